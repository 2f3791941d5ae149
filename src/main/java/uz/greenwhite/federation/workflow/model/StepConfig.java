package uz.greenwhite.federation.workflow.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Recognized parameters: {@code path}, {@code method}, {@code body} (used when no input mapping is set).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StepConfig {

    public static final StepConfig EMPTY = StepConfig.builder().build();

    @Singular
    Map<String, Object> parameters;

    Long timeoutSeconds;

    @Builder.Default
    boolean monitoringEnabled = true;

    Double costBudget;
}
