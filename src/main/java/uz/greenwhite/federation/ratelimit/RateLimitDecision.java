package uz.greenwhite.federation.ratelimit;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an admission check. For rejections it names the first violated limit.
 */
@Value
@Builder
public class RateLimitDecision {

    private static final RateLimitDecision ADMITTED = RateLimitDecision.builder().admitted(true).build();

    boolean admitted;
    RateLimitScope scope;
    RateLimitViolation violation;
    int currentUsage;
    int limit;
    long retryAfterSeconds;

    public static RateLimitDecision admitted() {
        return ADMITTED;
    }

    public static RateLimitDecision rejected(RateLimitScope scope, RateLimitViolation violation,
                                             int currentUsage, int limit, long retryAfterSeconds) {
        return RateLimitDecision.builder()
                .admitted(false)
                .scope(scope)
                .violation(violation)
                .currentUsage(currentUsage)
                .limit(limit)
                .retryAfterSeconds(retryAfterSeconds)
                .build();
    }
}
