package uz.greenwhite.federation.proxy;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uz.greenwhite.federation.config.ProxyProperties;
import uz.greenwhite.federation.error.ExternalServiceException;
import uz.greenwhite.federation.error.ResourceNotFoundException;
import uz.greenwhite.federation.error.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link ServerConnection} per provider, keyed by server id.
 *
 * Unknown server ids are rejected unless {@code federation.proxy.auto-register-servers}
 * is on, in which case the first caller creates the record and every concurrent
 * caller receives that same instance.
 */
@Slf4j
@Component
public class ConnectionPool {

    private static final String CB_PREFIX = "provider-";

    private final ProxyProperties properties;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Clock clock;

    private final Map<String, ServerConnection> connections = new ConcurrentHashMap<>();

    public ConnectionPool(ProxyProperties properties, CircuitBreakerRegistry circuitBreakerRegistry, Clock clock) {
        this.properties = properties;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void registerConfiguredServers() {
        properties.getServers().forEach((serverId, server) ->
                register(serverId, server.getUrl(), server.getProtocolVersion()));
    }

    /**
     * Register a provider. Re-registering with the same URL keeps the existing record.
     */
    public ServerConnection register(String serverId, String url, String protocolVersion) {
        if (serverId == null || serverId.isBlank()) {
            throw new ValidationException("server_id", "Server id is required");
        }
        if (url == null || url.isBlank()) {
            throw new ValidationException("url", "Server URL is required");
        }
        String version = protocolVersion != null ? protocolVersion : properties.getDefaultProtocolVersion();

        return connections.compute(serverId, (id, existing) -> {
            if (existing != null && existing.getUrl().equals(url) && existing.getProtocolVersion().equals(version)) {
                return existing;
            }
            if (existing != null) {
                existing.markClosing();
                log.info("Provider re-registered: {} {} -> {}", id, existing.getUrl(), url);
            }
            return create(id, url, version);
        });
    }

    /**
     * Resolve the connection for a call. Idle connections become active again.
     *
     * @throws ResourceNotFoundException for unknown ids when auto-registration is off
     * @throws ExternalServiceException  when the connection is closing, or broken with an open breaker
     */
    public ServerConnection getConnection(String serverId) {
        ServerConnection connection = connections.get(serverId);
        if (connection == null) {
            if (!properties.isAutoRegisterServers()) {
                throw new ResourceNotFoundException("Server", serverId);
            }
            connection = connections.computeIfAbsent(serverId, id -> create(id,
                    properties.getAutoRegisterUrlTemplate().replace("{serverId}", id),
                    properties.getDefaultProtocolVersion()));
        }

        ConnectionStatus status = connection.getStatus();
        if (status == ConnectionStatus.CLOSING) {
            throw new ExternalServiceException(serverId, "connection is closing", 503, false);
        }
        if (status == ConnectionStatus.BROKEN && properties.getCircuitBreaker().isEnabled()
                && circuitBreaker(serverId).getState() == CircuitBreaker.State.OPEN) {
            throw new ExternalServiceException(serverId, "connection is broken and its circuit breaker is open",
                    503, true);
        }

        connection.touch(clock.instant());
        return connection;
    }

    public Optional<ServerConnection> find(String serverId) {
        return Optional.ofNullable(connections.get(serverId));
    }

    public CircuitBreaker circuitBreaker(String serverId) {
        return circuitBreakerRegistry.circuitBreaker(CB_PREFIX + serverId);
    }

    void recordSuccess(ServerConnection connection, long latencyMs) {
        ConnectionStatus previous = connection.recordSuccess(latencyMs, clock.instant());
        if (previous == ConnectionStatus.DEGRADED || previous == ConnectionStatus.BROKEN) {
            log.info("Provider recovered: {} {} -> ACTIVE", connection.getServerId(), previous);
        }
    }

    void recordFailure(ServerConnection connection, long latencyMs) {
        ProxyProperties.CircuitBreaker cb = properties.getCircuitBreaker();
        ConnectionStatus previous = connection.recordFailure(latencyMs, clock.instant(),
                cb.getFailureThreshold(), cb.getBrokenThreshold());
        ConnectionStatus current = connection.getStatus();
        if (previous != current) {
            log.warn("Provider demoted: {} {} -> {}", connection.getServerId(), previous, current);
        }
    }

    void recordNeutral(ServerConnection connection, long latencyMs) {
        connection.recordNeutral(latencyMs, clock.instant());
    }

    /**
     * Mark active connections without traffic for {@code idle-timeout-seconds} as IDLE.
     */
    @Scheduled(fixedDelayString = "${federation.proxy.idle-sweep-interval-ms:30000}")
    public void sweepIdleConnections() {
        Instant threshold = clock.instant().minus(Duration.ofSeconds(properties.getIdleTimeoutSeconds()));
        int idled = 0;
        for (ServerConnection connection : connections.values()) {
            if (connection.markIdleIfInactiveSince(threshold)) {
                idled++;
            }
        }
        if (idled > 0) {
            log.debug("Marked {} provider connections idle", idled);
        }
    }

    /**
     * Move the connection through CLOSING and drop it from the pool.
     */
    public boolean close(String serverId) {
        ServerConnection connection = connections.get(serverId);
        if (connection == null) {
            return false;
        }
        connection.markClosing();
        boolean removed = connections.remove(serverId, connection);
        if (removed) {
            log.info("Provider connection closed: {}", serverId);
        }
        return removed;
    }

    @PreDestroy
    public void cleanup() {
        int count = connections.size();
        connections.keySet().forEach(this::close);
        log.info("Connection pool cleaned up: {} connections closed", count);
    }

    public List<ConnectionSnapshot> snapshots() {
        return connections.values().stream()
                .map(ServerConnection::snapshot)
                .sorted(Comparator.comparing(ConnectionSnapshot::getServerId))
                .toList();
    }

    public PoolStats stats() {
        int active = 0;
        int idle = 0;
        int degraded = 0;
        int broken = 0;
        for (ServerConnection connection : connections.values()) {
            switch (connection.getStatus()) {
                case ACTIVE -> active++;
                case IDLE -> idle++;
                case DEGRADED -> degraded++;
                case BROKEN -> broken++;
                default -> {
                }
            }
        }
        return PoolStats.builder()
                .totalConnections(connections.size())
                .activeConnections(active)
                .idleConnections(idle)
                .degradedConnections(degraded)
                .brokenConnections(broken)
                .poolSize(properties.getConnectionPoolSize())
                .utilization(active * 100.0 / properties.getConnectionPoolSize())
                .build();
    }

    private ServerConnection create(String serverId, String url, String protocolVersion) {
        ServerConnection connection = new ServerConnection(serverId, url, protocolVersion, clock.instant());

        String cbName = CB_PREFIX + serverId;
        circuitBreakerRegistry.circuitBreaker(cbName).getEventPublisher()
                .onStateTransition(event ->
                        log.warn("Circuit Breaker [{}] state change: {}", cbName, event.getStateTransition()))
                .onFailureRateExceeded(event ->
                        log.warn("Circuit Breaker [{}] failure rate exceeded: {}%", cbName, event.getFailureRate()));

        log.info("Provider connection registered: {} -> {} ({})", serverId, url, protocolVersion);
        return connection;
    }
}
