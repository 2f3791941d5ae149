package uz.greenwhite.federation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uz.greenwhite.federation.ratelimit.RateLimitViolation;

import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer meters for the four federation concerns.
 *
 * Naming convention:
 *   federation.{component}.{metric}
 *
 * Tags:
 *   result = success | error | ...
 *   limit  = violated rate limit (rate limiter only)
 */
@Slf4j
@Getter
@Component
public class FederationMetrics {

    private final MeterRegistry registry;

    // ==================== Rate limiter ====================
    private final Counter rateLimitAdmitted;
    private final Map<RateLimitViolation, Counter> rateLimitRejected = new EnumMap<>(RateLimitViolation.class);

    // ==================== Proxy ====================
    private final Timer proxyRequestTimer;
    private final Counter proxySuccess;
    private final Counter proxyFailure;
    private final Counter proxyRetry;
    private final Counter proxyTimeout;
    private final Counter proxyCircuitBreakerOpen;

    // ==================== Schema translation ====================
    private final Timer translationTimer;
    private final Counter translationCacheHit;
    private final Counter translationCacheMiss;
    private final Counter translationFailure;

    // ==================== Workflow ====================
    private final Timer workflowExecutionTimer;
    private final Counter workflowCompleted;
    private final Counter workflowFailed;
    private final Counter workflowCancelled;
    private final Counter workflowStepRetry;

    public FederationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.rateLimitAdmitted = Counter.builder("federation.ratelimit.decisions")
                .description("Admitted requests")
                .tag("result", "admitted")
                .register(registry);

        for (RateLimitViolation violation : RateLimitViolation.values()) {
            rateLimitRejected.put(violation, Counter.builder("federation.ratelimit.decisions")
                    .description("Rejected requests by violated limit")
                    .tag("result", "rejected")
                    .tag("limit", violation.getCode())
                    .register(registry));
        }

        this.proxyRequestTimer = Timer.builder("federation.proxy.request.duration")
                .description("Provider round-trip duration including retries")
                .register(registry);

        this.proxySuccess = Counter.builder("federation.proxy.request.total")
                .tag("result", "success")
                .register(registry);

        this.proxyFailure = Counter.builder("federation.proxy.request.total")
                .tag("result", "error")
                .register(registry);

        this.proxyTimeout = Counter.builder("federation.proxy.request.total")
                .tag("result", "timeout")
                .register(registry);

        this.proxyRetry = Counter.builder("federation.proxy.request.retry")
                .description("Retry attempts against providers")
                .register(registry);

        this.proxyCircuitBreakerOpen = Counter.builder("federation.proxy.circuitbreaker.rejected")
                .description("Calls rejected by an open provider circuit breaker")
                .register(registry);

        this.translationTimer = Timer.builder("federation.translation.duration")
                .description("Schema translation duration (cache misses only)")
                .register(registry);

        this.translationCacheHit = Counter.builder("federation.translation.cache")
                .tag("result", "hit")
                .register(registry);

        this.translationCacheMiss = Counter.builder("federation.translation.cache")
                .tag("result", "miss")
                .register(registry);

        this.translationFailure = Counter.builder("federation.translation.failed")
                .description("Translations with no translator or a failing translator")
                .register(registry);

        this.workflowExecutionTimer = Timer.builder("federation.workflow.execution.duration")
                .register(registry);

        this.workflowCompleted = Counter.builder("federation.workflow.execution.total")
                .tag("result", "completed")
                .register(registry);

        this.workflowFailed = Counter.builder("federation.workflow.execution.total")
                .tag("result", "failed")
                .register(registry);

        this.workflowCancelled = Counter.builder("federation.workflow.execution.total")
                .tag("result", "cancelled")
                .register(registry);

        this.workflowStepRetry = Counter.builder("federation.workflow.step.retry")
                .register(registry);

        log.info("Federation metrics registered (ratelimit, proxy, translation, workflow)");
    }

    public void recordRejection(RateLimitViolation violation) {
        rateLimitRejected.get(violation).increment();
    }
}
