package uz.greenwhite.federation.workflow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowStep {

    String id;
    String name;
    StepType stepType;
    String providerId;

    @Builder.Default
    StepConfig config = StepConfig.EMPTY;

    /**
     * Target field -> JSON pointer into the execution context
     * ({@code /input/...}, {@code /steps/<id>/...}, {@code /vars/...}).
     */
    @Builder.Default
    Map<String, String> inputMapping = Map.of();

    /**
     * Context variable -> JSON pointer into this step's output.
     */
    @Builder.Default
    Map<String, String> outputMapping = Map.of();

    @Singular
    List<String> dependencies;

    /**
     * Overrides the workflow retry policy when set.
     */
    RetryPolicy retryConfig;
}
