package uz.greenwhite.federation.proxy;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PoolStats {
    int totalConnections;
    int activeConnections;
    int idleConnections;
    int degradedConnections;
    int brokenConnections;
    int poolSize;

    /**
     * Active connections as a percentage of the nominal pool size.
     */
    double utilization;
}
