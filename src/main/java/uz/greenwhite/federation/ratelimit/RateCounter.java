package uz.greenwhite.federation.ratelimit;

import uz.greenwhite.federation.config.RateLimitProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-window counters for one scope (the gateway, or one client).
 * Every method except {@link #lock()} / {@link #unlock()} must be called with the lock held.
 */
final class RateCounter {

    private final String owner;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<RateWindow, Integer> counts = new EnumMap<>(RateWindow.class);
    private final Map<RateWindow, Instant> lastReset = new EnumMap<>(RateWindow.class);
    private final Deque<Instant> recentRequests = new ArrayDeque<>();
    private int concurrent;
    private Instant lastRequestAt;
    private boolean retired;

    RateCounter(String owner, Instant now) {
        this.owner = owner;
        for (RateWindow window : RateWindow.values()) {
            counts.put(window, 0);
            lastReset.put(window, now);
        }
        this.lastRequestAt = now;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    String owner() {
        return owner;
    }

    void resetExpiredWindows(Instant now) {
        for (RateWindow window : RateWindow.values()) {
            Duration elapsed = Duration.between(lastReset.get(window), now);
            if (elapsed.compareTo(window.getDuration()) >= 0) {
                counts.put(window, 0);
                lastReset.put(window, now);
            }
        }
    }

    /**
     * First exceeded limit in check order (second, minute, hour, concurrent), or null.
     */
    RateLimitDecision firstViolation(RateLimitScope scope, RateLimitProperties.Limits limits, Instant now) {
        for (RateWindow window : RateWindow.values()) {
            int count = counts.get(window);
            int limit = window.limit(limits);
            if (count >= limit) {
                long retryAfter = Math.max(1, Duration.between(now, nextReset(window)).toSeconds());
                return RateLimitDecision.rejected(scope, window.getViolation(), count, limit, retryAfter);
            }
        }
        if (concurrent >= limits.getConcurrentRequests()) {
            return RateLimitDecision.rejected(scope, RateLimitViolation.CONCURRENT_REQUESTS,
                    concurrent, limits.getConcurrentRequests(), 1);
        }
        return null;
    }

    void admit(Instant now, int historyCap) {
        for (RateWindow window : RateWindow.values()) {
            counts.merge(window, 1, Integer::sum);
        }
        concurrent++;
        lastRequestAt = now;

        recentRequests.addLast(now);
        Instant horizon = now.minus(RateWindow.longest());
        while (!recentRequests.isEmpty() && !recentRequests.peekFirst().isAfter(horizon)) {
            recentRequests.pollFirst();
        }
        while (recentRequests.size() > historyCap) {
            recentRequests.pollFirst();
        }
    }

    /**
     * @return false when the counter was already at zero
     */
    boolean complete() {
        if (concurrent > 0) {
            concurrent--;
            return true;
        }
        return false;
    }

    Instant nextReset(RateWindow window) {
        return lastReset.get(window).plus(window.getDuration());
    }

    int count(RateWindow window) {
        return counts.get(window);
    }

    int concurrent() {
        return concurrent;
    }

    int recentRequestCount() {
        return recentRequests.size();
    }

    boolean isIdleSince(Instant threshold) {
        return concurrent == 0 && lastRequestAt.isBefore(threshold);
    }

    void retire() {
        this.retired = true;
    }

    boolean isRetired() {
        return retired;
    }
}
