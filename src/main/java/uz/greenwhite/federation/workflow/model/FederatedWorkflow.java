package uz.greenwhite.federation.workflow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A workflow definition. Never mutated: updates replace the stored instance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FederatedWorkflow {
    UUID id;
    String clientId;
    String name;
    String description;

    @Singular
    List<WorkflowStep> steps;

    WorkflowConfig config;
    WorkflowStatus status;
    UUID executionId;
    Instant createdAt;
    Instant updatedAt;
}
