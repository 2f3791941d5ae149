package uz.greenwhite.federation.workflow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowConfig {

    public static final WorkflowConfig DEFAULT = WorkflowConfig.builder().build();

    @Builder.Default
    long timeoutSeconds = 3600;

    @Builder.Default
    int maxParallelExecutions = 4;

    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.DEFAULT;

    /**
     * Advisory: exceeding it is logged, never enforced.
     */
    Double costBudget;

    @Builder.Default
    WorkflowPriority priority = WorkflowPriority.NORMAL;

    @Builder.Default
    ExecutionEnvironment environment = ExecutionEnvironment.DEVELOPMENT;
}
