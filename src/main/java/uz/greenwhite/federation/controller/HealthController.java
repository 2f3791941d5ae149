package uz.greenwhite.federation.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import uz.greenwhite.federation.model.ComponentHealth;
import uz.greenwhite.federation.proxy.ProxyService;
import uz.greenwhite.federation.ratelimit.RateLimitStatus;
import uz.greenwhite.federation.ratelimit.RateLimiter;
import uz.greenwhite.federation.translation.SchemaTranslationEngine;
import uz.greenwhite.federation.workflow.WorkflowEngine;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only observability surface. Exempt from rate limiting.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final RateLimiter rateLimiter;
    private final ProxyService proxyService;
    private final SchemaTranslationEngine translationEngine;
    private final WorkflowEngine workflowEngine;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        List<ComponentHealth> components = List.of(
                rateLimiter.health(),
                proxyService.health(),
                translationEngine.health(),
                workflowEngine.health());

        boolean degraded = components.stream().anyMatch(c -> ComponentHealth.DEGRADED.equals(c.getStatus()));
        Map<String, Object> byName = new LinkedHashMap<>();
        components.forEach(c -> byName.put(c.getComponent(), c));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", degraded ? ComponentHealth.DEGRADED : ComponentHealth.HEALTHY);
        body.put("components", byName);
        body.put("timestamp", Instant.now());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Number>> metrics() {
        Map<String, Number> values = new LinkedHashMap<>();
        values.putAll(rateLimiter.metrics());
        values.putAll(proxyService.metrics());
        values.putAll(translationEngine.metrics());
        values.putAll(workflowEngine.metrics());
        return ResponseEntity.ok(values);
    }

    @GetMapping("/api/v1/rate-limit/global")
    public ResponseEntity<RateLimitStatus> globalRateLimitStatus() {
        return ResponseEntity.ok(rateLimiter.globalStatus());
    }

    @GetMapping("/api/v1/rate-limit/{clientId}")
    public ResponseEntity<RateLimitStatus> rateLimitStatus(@PathVariable String clientId) {
        return ResponseEntity.ok(rateLimiter.status(clientId));
    }
}
