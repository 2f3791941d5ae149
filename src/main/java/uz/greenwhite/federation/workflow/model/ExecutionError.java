package uz.greenwhite.federation.workflow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionError {

    public static final String EXECUTION_FAILED = "EXECUTION_FAILED";
    public static final String STEP_FAILED = "STEP_FAILED";
    public static final String WORKFLOW_TIMEOUT = "WORKFLOW_TIMEOUT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    String code;
    String message;

    @Singular
    Map<String, Object> details;

    String stackTrace;
    Instant occurredAt;
}
