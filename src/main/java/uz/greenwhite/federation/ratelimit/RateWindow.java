package uz.greenwhite.federation.ratelimit;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import uz.greenwhite.federation.config.RateLimitProperties;

import java.time.Duration;

/**
 * Fixed counting windows, in the order they are checked.
 */
@Getter
@RequiredArgsConstructor
enum RateWindow {

    SECOND(Duration.ofSeconds(1), RateLimitViolation.REQUESTS_PER_SECOND),
    MINUTE(Duration.ofMinutes(1), RateLimitViolation.REQUESTS_PER_MINUTE),
    HOUR(Duration.ofHours(1), RateLimitViolation.REQUESTS_PER_HOUR);

    private final Duration duration;
    private final RateLimitViolation violation;

    int limit(RateLimitProperties.Limits limits) {
        return switch (this) {
            case SECOND -> limits.getRequestsPerSecond();
            case MINUTE -> limits.getRequestsPerMinute();
            case HOUR -> limits.getRequestsPerHour();
        };
    }

    static Duration longest() {
        return HOUR.duration;
    }
}
