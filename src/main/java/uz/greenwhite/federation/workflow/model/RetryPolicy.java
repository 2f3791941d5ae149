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
public class RetryPolicy {

    public static final RetryPolicy DEFAULT = RetryPolicy.builder().build();

    /**
     * Total attempts including the first.
     */
    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    long initialDelayMs = 1000;

    @Builder.Default
    long maxDelayMs = 30_000;

    @Builder.Default
    double backoffMultiplier = 2.0;

    @Builder.Default
    boolean exponentialBackoff = true;
}
