package uz.greenwhite.federation.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "federation.workflow")
public class WorkflowProperties {

    private int stepPoolCoreSize = 4;
    private int stepPoolMaxSize = 16;
    private int stepQueueCapacity = 100;

    /**
     * Provider path used when a step declares no "path" parameter.
     */
    private String defaultStepPath = "/mcp/execute";

    private String defaultStepMethod = "POST";

    /**
     * Cost charged per provider call when the provider reports none.
     */
    private double defaultCostPerCall = 0.0;

    /**
     * Response header through which providers report the cost of a call.
     */
    private String costHeader = "X-Provider-Cost";

    @PostConstruct
    public void validate() {
        if (stepPoolCoreSize <= 0 || stepPoolMaxSize < stepPoolCoreSize) {
            throw new IllegalArgumentException(
                    "federation.workflow.step-pool-max-size must be >= step-pool-core-size > 0");
        }
        if (defaultCostPerCall < 0) {
            throw new IllegalArgumentException("federation.workflow.default-cost-per-call must be >= 0");
        }
        log.info("Workflow config: stepPool={}..{}, queue={}, defaultPath={}",
                stepPoolCoreSize, stepPoolMaxSize, stepQueueCapacity, defaultStepPath);
    }
}
