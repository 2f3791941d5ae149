package uz.greenwhite.federation.proxy;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate request counters of the proxy. Updated as one unit.
 */
final class ProxyStats {

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private double averageLatencyMs;

    synchronized void record(boolean success, long latencyMs) {
        totalRequests++;
        if (success) {
            successfulRequests++;
        } else {
            failedRequests++;
        }
        averageLatencyMs += (latencyMs - averageLatencyMs) / totalRequests;
    }

    synchronized Snapshot snapshot() {
        return new Snapshot(totalRequests, successfulRequests, failedRequests, averageLatencyMs);
    }

    @Value
    @Builder
    static class Snapshot {
        long totalRequests;
        long successfulRequests;
        long failedRequests;
        double averageLatencyMs;
    }
}
