package uz.greenwhite.federation.proxy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay before retry number {@code retry} (1-based):
 * {@code base * multiplier^(retry-1)}, capped at {@code max}.
 * With jitter the delay is drawn uniformly from [delay/2, delay].
 */
public final class Backoff {

    private Backoff() {
    }

    public static Duration delay(int retry, long baseMs, long maxMs, double multiplier,
                                 boolean exponential, boolean jitter) {
        double raw = exponential ? baseMs * Math.pow(multiplier, Math.max(0, retry - 1)) : baseMs;
        long capped = (long) Math.min(raw, (double) maxMs);
        if (jitter && capped > 1) {
            long half = capped / 2;
            capped = half + ThreadLocalRandom.current().nextLong(capped - half + 1);
        }
        return Duration.ofMillis(Math.max(0, capped));
    }
}
