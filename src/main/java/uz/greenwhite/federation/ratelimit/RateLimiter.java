package uz.greenwhite.federation.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import uz.greenwhite.federation.config.RateLimitProperties;
import uz.greenwhite.federation.metrics.FederationMetrics;
import uz.greenwhite.federation.model.ComponentHealth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Admission control with fixed-window counters.
 *
 * Global limits are checked first, then the client's, in the order
 * second, minute, hour, concurrent. Check and increment happen while holding
 * the global lock and then the client lock, always in that order, so two
 * callers can never both pass the same remaining slot.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final String GLOBAL_OWNER = "__global__";

    private final RateLimitProperties properties;
    private final FederationMetrics metrics;
    private final Clock clock;

    private final RateCounter global;
    private final Map<String, RateCounter> clients = new ConcurrentHashMap<>();

    private final AtomicLong totalChecks = new AtomicLong();
    private final AtomicLong admittedCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();

    public RateLimiter(RateLimitProperties properties, FederationMetrics metrics, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.global = new RateCounter(GLOBAL_OWNER, clock.instant());
    }

    /**
     * Check every limit and, only if all pass, count the request in all windows.
     * Never blocks waiting for capacity.
     */
    public RateLimitDecision checkAndAdmit(String clientId) {
        totalChecks.incrementAndGet();

        while (true) {
            RateCounter client = clients.computeIfAbsent(clientId, id -> new RateCounter(id, clock.instant()));

            global.lock();
            try {
                client.lock();
                try {
                    if (client.isRetired()) {
                        // evicted between lookup and lock, take the fresh one
                        continue;
                    }
                    return decide(clientId, client);
                } finally {
                    client.unlock();
                }
            } finally {
                global.unlock();
            }
        }
    }

    private RateLimitDecision decide(String clientId, RateCounter client) {
        Instant now = clock.instant();
        global.resetExpiredWindows(now);
        client.resetExpiredWindows(now);

        if (properties.isEnabled()) {
            RateLimitDecision rejection = global.firstViolation(RateLimitScope.GLOBAL, properties.getGlobal(), now);
            if (rejection == null) {
                rejection = client.firstViolation(RateLimitScope.CLIENT, properties.limitsFor(clientId), now);
            }
            if (rejection != null) {
                rejectedCount.incrementAndGet();
                metrics.recordRejection(rejection.getViolation());
                log.warn("Rate limit exceeded: client={}, scope={}, limit={}, usage={}/{}",
                        clientId, rejection.getScope(), rejection.getViolation().getCode(),
                        rejection.getCurrentUsage(), rejection.getLimit());
                return rejection;
            }
        }

        global.admit(now, properties.getTimestampHistorySize());
        client.admit(now, properties.getTimestampHistorySize());
        admittedCount.incrementAndGet();
        metrics.getRateLimitAdmitted().increment();
        return RateLimitDecision.admitted();
    }

    /**
     * Release one concurrent slot for the client and for the gateway.
     * A completion for a client with nothing in flight is ignored.
     */
    public void recordCompletion(String clientId) {
        RateCounter client = clients.get(clientId);
        if (client == null) {
            log.warn("Completion for unknown client ignored: {}", clientId);
            return;
        }

        boolean released;
        client.lock();
        try {
            released = client.complete();
        } finally {
            client.unlock();
        }

        if (!released) {
            log.warn("Completion without in-flight request ignored: {}", clientId);
            return;
        }

        global.lock();
        try {
            global.complete();
        } finally {
            global.unlock();
        }
    }

    public RateLimitStatus status(String clientId) {
        RateCounter client = clients.get(clientId);
        if (client == null) {
            return emptyStatus(clientId, properties.limitsFor(clientId));
        }
        client.lock();
        try {
            client.resetExpiredWindows(clock.instant());
            return snapshot(clientId, client, properties.limitsFor(clientId));
        } finally {
            client.unlock();
        }
    }

    public RateLimitStatus globalStatus() {
        global.lock();
        try {
            global.resetExpiredWindows(clock.instant());
            return snapshot(null, global, properties.getGlobal());
        } finally {
            global.unlock();
        }
    }

    /**
     * Drop trackers of clients with nothing in flight and no request for an hour.
     */
    @Scheduled(fixedDelayString = "${federation.rate-limit.eviction-interval-ms:300000}")
    public void evictIdleClients() {
        Instant threshold = clock.instant().minus(RateWindow.longest());
        int before = clients.size();

        for (String clientId : clients.keySet()) {
            clients.computeIfPresent(clientId, (id, counter) -> {
                counter.lock();
                try {
                    if (counter.isIdleSince(threshold)) {
                        counter.retire();
                        return null;
                    }
                    return counter;
                } finally {
                    counter.unlock();
                }
            });
        }

        int evicted = before - clients.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate limit trackers", evicted);
        }
    }

    public ComponentHealth health() {
        RateLimitStatus globalStatus = globalStatus();
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("tracked_clients", clients.size());
        counters.put("global_requests_per_second", globalStatus.getRequestsPerSecond());
        counters.put("global_concurrent_requests", globalStatus.getConcurrentRequests());
        counters.put("checks_total", totalChecks.get());
        counters.put("admitted_total", admittedCount.get());
        counters.put("rejected_total", rejectedCount.get());

        return ComponentHealth.builder()
                .component("rate_limiter")
                .status(ComponentHealth.HEALTHY)
                .successRate(ComponentHealth.successRate(admittedCount.get(), totalChecks.get()))
                .counters(counters)
                .checkedAt(clock.instant())
                .build();
    }

    public Map<String, Number> metrics() {
        Map<String, Number> values = new LinkedHashMap<>();
        values.put("ratelimit_checks_total", totalChecks.get());
        values.put("ratelimit_admitted_total", admittedCount.get());
        values.put("ratelimit_rejected_total", rejectedCount.get());
        values.put("ratelimit_tracked_clients", clients.size());
        return values;
    }

    private RateLimitStatus snapshot(String clientId, RateCounter counter, RateLimitProperties.Limits limits) {
        return RateLimitStatus.builder()
                .clientId(clientId)
                .requestsPerSecond(counter.count(RateWindow.SECOND))
                .requestsPerMinute(counter.count(RateWindow.MINUTE))
                .requestsPerHour(counter.count(RateWindow.HOUR))
                .concurrentRequests(counter.concurrent())
                .recentRequests(counter.recentRequestCount())
                .limits(limits)
                .secondReset(counter.nextReset(RateWindow.SECOND))
                .minuteReset(counter.nextReset(RateWindow.MINUTE))
                .hourReset(counter.nextReset(RateWindow.HOUR))
                .build();
    }

    private RateLimitStatus emptyStatus(String clientId, RateLimitProperties.Limits limits) {
        Instant now = clock.instant();
        return RateLimitStatus.builder()
                .clientId(clientId)
                .limits(limits)
                .secondReset(now.plus(Duration.ofSeconds(1)))
                .minuteReset(now.plus(Duration.ofMinutes(1)))
                .hourReset(now.plus(Duration.ofHours(1)))
                .build();
    }
}
