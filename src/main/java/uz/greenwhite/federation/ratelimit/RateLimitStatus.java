package uz.greenwhite.federation.ratelimit;

import lombok.Builder;
import lombok.Value;
import uz.greenwhite.federation.config.RateLimitProperties;

import java.time.Instant;

@Value
@Builder
public class RateLimitStatus {

    /**
     * Null for the gateway-wide snapshot.
     */
    String clientId;

    int requestsPerSecond;
    int requestsPerMinute;
    int requestsPerHour;
    int concurrentRequests;
    int recentRequests;

    RateLimitProperties.Limits limits;

    Instant secondReset;
    Instant minuteReset;
    Instant hourReset;
}
