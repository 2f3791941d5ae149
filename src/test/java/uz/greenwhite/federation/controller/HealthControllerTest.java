package uz.greenwhite.federation.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.FilterType;
import org.springframework.test.web.servlet.MockMvc;
import uz.greenwhite.federation.model.ComponentHealth;
import uz.greenwhite.federation.proxy.ProxyService;
import uz.greenwhite.federation.ratelimit.RateLimitFilter;
import uz.greenwhite.federation.ratelimit.RateLimiter;
import uz.greenwhite.federation.translation.SchemaTranslationEngine;
import uz.greenwhite.federation.workflow.WorkflowEngine;

import java.util.Map;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = HealthController.class,
        excludeFilters = @ComponentScan.Filter(type = FilterType.ASSIGNABLE_TYPE, classes = RateLimitFilter.class))
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RateLimiter rateLimiter;

    @MockBean
    private ProxyService proxyService;

    @MockBean
    private SchemaTranslationEngine translationEngine;

    @MockBean
    private WorkflowEngine workflowEngine;

    private static ComponentHealth health(String component, String status) {
        return ComponentHealth.builder().component(component).status(status).successRate(100.0).build();
    }

    @Test
    void anyDegradedComponentDegradesOverallStatus() throws Exception {
        given(rateLimiter.health()).willReturn(health("rate_limiter", ComponentHealth.HEALTHY));
        given(proxyService.health()).willReturn(health("proxy", ComponentHealth.DEGRADED));
        given(translationEngine.health()).willReturn(health("schema_translator", ComponentHealth.HEALTHY));
        given(workflowEngine.health()).willReturn(health("workflow_engine", ComponentHealth.HEALTHY));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.components.proxy.status").value("degraded"))
                .andExpect(jsonPath("$.components.workflow_engine.status").value("healthy"));
    }

    @Test
    void metricsMergeAllComponents() throws Exception {
        given(rateLimiter.metrics()).willReturn(Map.of("ratelimit_checks_total", 4L));
        given(proxyService.metrics()).willReturn(Map.of("proxy_requests_total", 2L));
        given(translationEngine.metrics()).willReturn(Map.of("translation_total", 1L));
        given(workflowEngine.metrics()).willReturn(Map.of("workflow_executions_total", 0L));

        mockMvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ratelimit_checks_total").value(4))
                .andExpect(jsonPath("$.proxy_requests_total").value(2))
                .andExpect(jsonPath("$.translation_total").value(1))
                .andExpect(jsonPath("$.workflow_executions_total").value(0));
    }
}
