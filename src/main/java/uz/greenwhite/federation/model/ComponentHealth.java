package uz.greenwhite.federation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only health summary exposed by each federation component.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentHealth {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private String component;
    private String status;

    /**
     * Percentage 0..100, 0 when nothing was processed yet.
     */
    private double successRate;

    private Map<String, Object> counters;
    private Instant checkedAt;

    public static double successRate(long successful, long total) {
        return total > 0 ? (successful * 100.0) / total : 0.0;
    }
}
