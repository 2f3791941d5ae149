package uz.greenwhite.federation.config;

import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "federation.rate-limit")
public class RateLimitProperties {

    /**
     * Disable to admit everything (counters are still kept for status).
     */
    private boolean enabled = true;

    /**
     * Gateway-wide limits, checked before any per-client limit.
     */
    private Limits global = new Limits(1000, 60000, 3600000, 500);

    /**
     * Default per-client limits.
     */
    private Limits client = new Limits(10, 600, 36000, 10);

    /**
     * Per-client overrides.
     * Key: client id, value: limits used instead of {@link #client}.
     */
    private Map<String, Limits> clientOverrides = new HashMap<>();

    /**
     * Window size reported to clients; the counters themselves use fixed
     * 1s / 60s / 3600s windows.
     */
    private Duration windowSize = Duration.ofSeconds(60);

    /**
     * Max recent request timestamps kept per tracker (diagnostics only).
     */
    private int timestampHistorySize = 1000;

    /**
     * Path prefixes that bypass admission control.
     */
    private List<String> exemptPaths = new ArrayList<>(List.of("/health", "/metrics", "/actuator"));

    /**
     * Header carrying the client id on inbound requests.
     */
    private String clientIdHeader = "X-Client-Id";

    @PostConstruct
    public void validate() {
        global.validate("federation.rate-limit.global");
        client.validate("federation.rate-limit.client");
        clientOverrides.forEach((id, limits) -> limits.validate("federation.rate-limit.client-overrides." + id));
        if (timestampHistorySize <= 0) {
            throw new IllegalArgumentException("federation.rate-limit.timestamp-history-size must be > 0");
        }

        log.info("Rate limit config: enabled={}, global={}, client={}, overrides={}",
                enabled, global, client, clientOverrides.size());
    }

    public Limits limitsFor(String clientId) {
        return clientOverrides.getOrDefault(clientId, client);
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Limits {
        private int requestsPerSecond;
        private int requestsPerMinute;
        private int requestsPerHour;
        private int concurrentRequests;

        void validate(String prefix) {
            if (requestsPerSecond <= 0 || requestsPerMinute <= 0
                    || requestsPerHour <= 0 || concurrentRequests <= 0) {
                throw new IllegalArgumentException(prefix + " limits must all be > 0");
            }
        }

        @Override
        public String toString() {
            return requestsPerSecond + "/s, " + requestsPerMinute + "/m, "
                    + requestsPerHour + "/h, " + concurrentRequests + " concurrent";
        }
    }
}
