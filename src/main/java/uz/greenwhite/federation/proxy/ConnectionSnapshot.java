package uz.greenwhite.federation.proxy;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ConnectionSnapshot {

    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("url")
    String url;

    @JsonProperty("protocol_version")
    String protocolVersion;

    @JsonProperty("status")
    ConnectionStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("last_activity")
    Instant lastActivity;

    @JsonProperty("total_requests")
    long totalRequests;

    @JsonProperty("successful_requests")
    long successfulRequests;

    @JsonProperty("failed_requests")
    long failedRequests;

    @JsonProperty("consecutive_failures")
    int consecutiveFailures;

    @JsonProperty("average_latency_ms")
    double averageLatencyMs;
}
