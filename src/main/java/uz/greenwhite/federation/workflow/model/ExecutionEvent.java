package uz.greenwhite.federation.workflow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of an execution's status history.
 */
@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionEvent {
    UUID executionId;
    WorkflowStatus from;
    WorkflowStatus to;
    String message;
    Instant timestamp;
}
