package uz.greenwhite.federation.ratelimit;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RateLimitViolation {

    REQUESTS_PER_SECOND("requests_per_second"),
    REQUESTS_PER_MINUTE("requests_per_minute"),
    REQUESTS_PER_HOUR("requests_per_hour"),
    CONCURRENT_REQUESTS("concurrent_requests");

    private final String code;
}
