package uz.greenwhite.federation.ratelimit;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uz.greenwhite.federation.config.RateLimitProperties;
import uz.greenwhite.federation.metrics.FederationMetrics;
import uz.greenwhite.federation.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimitProperties properties;
    private FederationMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new RateLimitProperties();
        metrics = new FederationMetrics(new SimpleMeterRegistry());
    }

    private RateLimiter limiter() {
        return new RateLimiter(properties, metrics, clock);
    }

    @Test
    void concurrentCounterReturnsToZeroAfterMatchingCompletions() {
        properties.setClient(new RateLimitProperties.Limits(100, 1000, 10000, 100));
        RateLimiter limiter = limiter();

        for (int i = 0; i < 25; i++) {
            assertThat(limiter.checkAndAdmit("client-a").isAdmitted()).isTrue();
        }
        assertThat(limiter.status("client-a").getConcurrentRequests()).isEqualTo(25);

        for (int i = 0; i < 25; i++) {
            limiter.recordCompletion("client-a");
        }

        assertThat(limiter.status("client-a").getConcurrentRequests()).isZero();
        assertThat(limiter.globalStatus().getConcurrentRequests()).isZero();
    }

    @Test
    void thirdRequestWithinOneSecondIsRejected() {
        properties.setClient(new RateLimitProperties.Limits(2, 600, 36000, 10));
        RateLimiter limiter = limiter();

        List<Boolean> results = List.of(
                limiter.checkAndAdmit("client-a").isAdmitted(),
                limiter.checkAndAdmit("client-a").isAdmitted(),
                limiter.checkAndAdmit("client-a").isAdmitted());

        assertThat(results).containsExactly(true, true, false);
    }

    @Test
    void rejectionNamesViolatedLimitAndDoesNotCount() {
        properties.setClient(new RateLimitProperties.Limits(2, 600, 36000, 10));
        RateLimiter limiter = limiter();
        limiter.checkAndAdmit("client-a");
        limiter.checkAndAdmit("client-a");

        RateLimitDecision decision = limiter.checkAndAdmit("client-a");

        assertThat(decision.isAdmitted()).isFalse();
        assertThat(decision.getScope()).isEqualTo(RateLimitScope.CLIENT);
        assertThat(decision.getViolation()).isEqualTo(RateLimitViolation.REQUESTS_PER_SECOND);
        assertThat(decision.getCurrentUsage()).isEqualTo(2);
        assertThat(decision.getLimit()).isEqualTo(2);
        assertThat(decision.getRetryAfterSeconds()).isGreaterThanOrEqualTo(1);
        assertThat(limiter.status("client-a").getRequestsPerMinute()).isEqualTo(2);
        assertThat(limiter.globalStatus().getRequestsPerSecond()).isEqualTo(2);
    }

    @Test
    void secondWindowResetsAfterOneSecond() {
        properties.setClient(new RateLimitProperties.Limits(2, 600, 36000, 10));
        RateLimiter limiter = limiter();
        limiter.checkAndAdmit("client-a");
        limiter.checkAndAdmit("client-a");
        assertThat(limiter.checkAndAdmit("client-a").isAdmitted()).isFalse();

        clock.advance(Duration.ofSeconds(1));

        assertThat(limiter.checkAndAdmit("client-a").isAdmitted()).isTrue();
        assertThat(limiter.status("client-a").getRequestsPerMinute()).isEqualTo(3);
    }

    @Test
    void globalLimitIsCheckedBeforeClientLimit() {
        properties.setGlobal(new RateLimitProperties.Limits(1, 600, 36000, 10));
        properties.setClient(new RateLimitProperties.Limits(1, 600, 36000, 10));
        RateLimiter limiter = limiter();
        limiter.checkAndAdmit("client-a");

        RateLimitDecision decision = limiter.checkAndAdmit("client-a");

        assertThat(decision.getScope()).isEqualTo(RateLimitScope.GLOBAL);
        assertThat(decision.getViolation()).isEqualTo(RateLimitViolation.REQUESTS_PER_SECOND);
    }

    @Test
    void concurrentLimitRejectsUntilCompletion() {
        properties.setClient(new RateLimitProperties.Limits(100, 600, 36000, 1));
        RateLimiter limiter = limiter();
        assertThat(limiter.checkAndAdmit("client-a").isAdmitted()).isTrue();

        RateLimitDecision rejected = limiter.checkAndAdmit("client-a");
        assertThat(rejected.getViolation()).isEqualTo(RateLimitViolation.CONCURRENT_REQUESTS);

        limiter.recordCompletion("client-a");
        assertThat(limiter.checkAndAdmit("client-a").isAdmitted()).isTrue();
    }

    @Test
    void completionWithoutInFlightRequestNeverGoesNegative() {
        RateLimiter limiter = limiter();
        limiter.checkAndAdmit("client-a");
        limiter.recordCompletion("client-a");
        limiter.recordCompletion("client-a");
        limiter.recordCompletion("unknown");

        assertThat(limiter.status("client-a").getConcurrentRequests()).isZero();
        assertThat(limiter.globalStatus().getConcurrentRequests()).isZero();
    }

    @Test
    void clientOverrideReplacesDefaultLimits() {
        properties.getClientOverrides().put("premium", new RateLimitProperties.Limits(3, 600, 36000, 10));
        properties.setClient(new RateLimitProperties.Limits(1, 600, 36000, 10));
        RateLimiter limiter = limiter();

        assertThat(limiter.checkAndAdmit("premium").isAdmitted()).isTrue();
        assertThat(limiter.checkAndAdmit("premium").isAdmitted()).isTrue();
        assertThat(limiter.checkAndAdmit("premium").isAdmitted()).isTrue();
        assertThat(limiter.checkAndAdmit("basic").isAdmitted()).isTrue();
        assertThat(limiter.checkAndAdmit("basic").isAdmitted()).isFalse();
    }

    @Test
    void disabledLimiterAdmitsEverythingButStillCounts() {
        properties.setEnabled(false);
        properties.setClient(new RateLimitProperties.Limits(1, 1, 1, 1));
        RateLimiter limiter = limiter();

        assertThat(limiter.checkAndAdmit("client-a").isAdmitted()).isTrue();
        assertThat(limiter.checkAndAdmit("client-a").isAdmitted()).isTrue();
        assertThat(limiter.status("client-a").getConcurrentRequests()).isEqualTo(2);
    }

    @Test
    void parallelCallersNeverExceedLimit() throws Exception {
        properties.setClient(new RateLimitProperties.Limits(50, 600, 36000, 1000));
        RateLimiter limiter = limiter();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return limiter.checkAndAdmit("client-a").isAdmitted();
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(50);
            assertThat(limiter.status("client-a").getRequestsPerSecond()).isEqualTo(50);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void idleClientsAreEvictedAndStartFresh() {
        properties.setClient(new RateLimitProperties.Limits(10, 600, 36000, 10));
        RateLimiter limiter = limiter();
        limiter.checkAndAdmit("client-a");
        limiter.recordCompletion("client-a");

        clock.advance(Duration.ofHours(2));
        limiter.evictIdleClients();

        assertThat(limiter.metrics().get("ratelimit_tracked_clients")).isEqualTo(0);
        assertThat(limiter.checkAndAdmit("client-a").isAdmitted()).isTrue();
        assertThat(limiter.status("client-a").getRequestsPerHour()).isEqualTo(1);
    }

    @Test
    void busyClientsAreNotEvicted() {
        RateLimiter limiter = limiter();
        limiter.checkAndAdmit("client-a");

        clock.advance(Duration.ofHours(2));
        limiter.evictIdleClients();

        assertThat(limiter.status("client-a").getConcurrentRequests()).isEqualTo(1);
    }

    @Test
    void healthReportsAdmissionRate() {
        properties.setClient(new RateLimitProperties.Limits(1, 600, 36000, 10));
        RateLimiter limiter = limiter();
        limiter.checkAndAdmit("client-a");
        limiter.checkAndAdmit("client-a");

        assertThat(limiter.health().getSuccessRate()).isEqualTo(50.0);
        assertThat(limiter.health().getCounters()).containsEntry("rejected_total", 1L);
    }
}
