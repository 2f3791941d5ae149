package uz.greenwhite.federation.proxy;

import lombok.Getter;

import java.time.Instant;

/**
 * Logical connection to one provider. Owned by {@link ConnectionPool};
 * every mutation happens under this object's monitor so readers always
 * see status and counters from the same moment.
 */
public class ServerConnection {

    @Getter
    private final String serverId;
    @Getter
    private final String url;
    @Getter
    private final String protocolVersion;
    @Getter
    private final Instant createdAt;

    private ConnectionStatus status;
    private Instant lastActivity;
    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private int consecutiveFailures;
    private double averageLatencyMs;

    ServerConnection(String serverId, String url, String protocolVersion, Instant now) {
        this.serverId = serverId;
        this.url = url;
        this.protocolVersion = protocolVersion;
        this.createdAt = now;
        this.lastActivity = now;
        this.status = ConnectionStatus.ACTIVE;
    }

    public synchronized ConnectionStatus getStatus() {
        return status;
    }

    synchronized void touch(Instant now) {
        lastActivity = now;
        if (status == ConnectionStatus.IDLE) {
            status = ConnectionStatus.ACTIVE;
        }
    }

    /**
     * @return the status before this call
     */
    synchronized ConnectionStatus recordSuccess(long latencyMs, Instant now) {
        ConnectionStatus previous = status;
        record(latencyMs, now);
        successfulRequests++;
        consecutiveFailures = 0;
        if (status != ConnectionStatus.CLOSING) {
            status = ConnectionStatus.ACTIVE;
        }
        return previous;
    }

    /**
     * Counts the failure and demotes the connection once a threshold is reached.
     *
     * @return the status before this call
     */
    synchronized ConnectionStatus recordFailure(long latencyMs, Instant now,
                                                int degradedThreshold, int brokenThreshold) {
        ConnectionStatus previous = status;
        record(latencyMs, now);
        failedRequests++;
        consecutiveFailures++;
        if (status != ConnectionStatus.CLOSING) {
            if (consecutiveFailures >= brokenThreshold) {
                status = ConnectionStatus.BROKEN;
            } else if (consecutiveFailures >= degradedThreshold) {
                status = ConnectionStatus.DEGRADED;
            }
        }
        return previous;
    }

    /**
     * Counts a completed request that says nothing about provider health (e.g. a 4xx answer).
     */
    synchronized void recordNeutral(long latencyMs, Instant now) {
        record(latencyMs, now);
        failedRequests++;
    }

    synchronized boolean markIdleIfInactiveSince(Instant threshold) {
        if (status == ConnectionStatus.ACTIVE && lastActivity.isBefore(threshold)) {
            status = ConnectionStatus.IDLE;
            return true;
        }
        return false;
    }

    synchronized void markClosing() {
        status = ConnectionStatus.CLOSING;
    }

    public synchronized ConnectionSnapshot snapshot() {
        return ConnectionSnapshot.builder()
                .serverId(serverId)
                .url(url)
                .protocolVersion(protocolVersion)
                .status(status)
                .createdAt(createdAt)
                .lastActivity(lastActivity)
                .totalRequests(totalRequests)
                .successfulRequests(successfulRequests)
                .failedRequests(failedRequests)
                .consecutiveFailures(consecutiveFailures)
                .averageLatencyMs(averageLatencyMs)
                .build();
    }

    private void record(long latencyMs, Instant now) {
        totalRequests++;
        averageLatencyMs += (latencyMs - averageLatencyMs) / totalRequests;
        lastActivity = now;
    }
}
