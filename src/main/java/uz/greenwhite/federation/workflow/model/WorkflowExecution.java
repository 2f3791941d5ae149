package uz.greenwhite.federation.workflow.model;

import com.fasterxml.jackson.databind.JsonNode;
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
 * Immutable snapshot of an execution. Every change produces a new snapshot,
 * so status, ended_at and result/error always become visible together.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkflowExecution {
    UUID id;
    UUID workflowId;
    WorkflowStatus status;
    Instant createdAt;
    Instant startedAt;
    Instant endedAt;
    JsonNode result;
    ExecutionError error;

    @Singular
    List<StepExecution> stepExecutions;

    @Builder.Default
    ResourceUsage resourceUsage = ResourceUsage.ZERO;

    double totalCost;
}
