package uz.greenwhite.federation.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "federation.proxy")
public class ProxyProperties {

    private int connectTimeoutMs = 10_000;
    private int requestTimeoutMs = 30_000;
    private int writeTimeoutMs = 10_000;

    /**
     * Nominal pool capacity, used for utilization reporting.
     */
    private int connectionPoolSize = 10;

    /**
     * Active connections without traffic for this long are marked IDLE.
     */
    private long idleTimeoutSeconds = 90;

    /**
     * When false (default) an unknown server id is rejected.
     * When true a connection is created on first use from {@link #autoRegisterUrlTemplate}.
     */
    private boolean autoRegisterServers = false;

    /**
     * URL template for auto-registered servers; {serverId} is substituted.
     */
    private String autoRegisterUrlTemplate = "http://localhost:8080/{serverId}";

    /**
     * Protocol version assumed for clients and for servers that declare none.
     */
    private String defaultProtocolVersion = "v2.0";

    /**
     * Inbound header naming the protocol version of the request payload.
     */
    private String protocolVersionHeader = "X-MCP-Protocol-Version";

    /**
     * Statically registered providers.
     * Key: server id.
     */
    private Map<String, Server> servers = new LinkedHashMap<>();

    private List<Route> routingRules = new ArrayList<>();

    private Retry retry = new Retry();

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @PostConstruct
    public void validate() {
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("federation.proxy.connect-timeout-ms must be > 0");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("federation.proxy.request-timeout-ms must be > 0");
        }
        if (writeTimeoutMs <= 0) {
            throw new IllegalArgumentException("federation.proxy.write-timeout-ms must be > 0");
        }
        if (connectionPoolSize <= 0) {
            throw new IllegalArgumentException("federation.proxy.connection-pool-size must be > 0");
        }
        servers.forEach((id, server) -> {
            if (server.getUrl() == null || server.getUrl().isBlank()) {
                throw new IllegalArgumentException("federation.proxy.servers." + id + ".url must be configured");
            }
        });
        retry.init();
        if (circuitBreaker.getBrokenThreshold() < circuitBreaker.getFailureThreshold()) {
            throw new IllegalArgumentException(
                    "federation.proxy.circuit-breaker.broken-threshold must be >= failure-threshold");
        }

        log.info("Proxy config: connect={}ms, request={}ms, servers={}, autoRegister={}, retry={}x, cb={}",
                connectTimeoutMs, requestTimeoutMs, servers.keySet(), autoRegisterServers,
                retry.getMaxAttempts(), circuitBreaker.isEnabled());
    }

    @Getter
    @Setter
    public static class Server {
        private String url;
        private String protocolVersion;
    }

    @Getter
    @Setter
    public static class Route {
        private String name;
        private String pathPattern;
        private int priority;
        private String sourceVersion;
        private String targetVersion;
    }

    @Getter
    @Setter
    public static class Retry {

        /**
         * Total attempts including the first call.
         */
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30_000;
        private double backoffMultiplier = 2.0;
        private boolean enableJitter = true;

        /**
         * Comma-separated HTTP status codes that are retryable.
         */
        private String retryableStatuses = "408,429,500,502,503,504";

        private Set<Integer> retryableStatusSet = Set.of();

        void init() {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("federation.proxy.retry.max-attempts must be > 0");
            }
            this.retryableStatusSet = Collections.unmodifiableSet(
                    Arrays.stream(retryableStatuses.split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .map(Integer::parseInt)
                            .collect(Collectors.toSet())
            );
        }

        public boolean isRetryable(int httpStatus) {
            return retryableStatusSet.contains(httpStatus);
        }
    }

    @Getter
    @Setter
    public static class CircuitBreaker {
        private boolean enabled = true;

        /**
         * Consecutive failures before a connection is marked DEGRADED.
         */
        private int failureThreshold = 5;

        /**
         * Consecutive failures before a connection is marked BROKEN.
         */
        private int brokenThreshold = 10;

        private float failureRateThreshold = 50.0f;
        private int slidingWindowSize = 20;
        private long openStateSeconds = 60;
        private int halfOpenMaxCalls = 3;
    }
}
