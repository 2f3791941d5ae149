package uz.greenwhite.federation.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    VALIDATION("VALIDATION_ERROR", 400, "Invalid request or definition"),
    NOT_FOUND("NOT_FOUND", 404, "Resource not found"),
    RATE_LIMITED("RATE_LIMITED", 429, "Rate limit exceeded"),
    EXTERNAL_SERVICE("EXTERNAL_SERVICE_ERROR", 502, "Provider or transport failure"),
    SCHEMA_TRANSLATION_FAILED("SCHEMA_TRANSLATION_FAILED", 422, "No translator for version pair"),
    WORKFLOW_EXECUTION_FAILED("WORKFLOW_EXECUTION_FAILED", 500, "Workflow orchestration failure"),
    CONFLICT("CONFLICT", 409, "Operation not allowed in current state"),
    INTERNAL("INTERNAL_ERROR", 500, "Unexpected internal failure");

    private final String code;
    private final int httpStatus;
    private final String description;
}
