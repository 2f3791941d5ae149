package uz.greenwhite.federation.workflow.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StepExecution {
    String stepId;
    StepStatus status;
    String providerId;
    Instant startedAt;
    Instant endedAt;
    JsonNode result;
    ExecutionError error;
    double cost;
    int retryAttempts;
}
