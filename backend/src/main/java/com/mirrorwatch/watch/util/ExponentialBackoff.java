package com.mirrorwatch.watch.util;

import java.time.Duration;

/**
 * Capped exponential backoff: {@code base * 2^(step-1)}, never above {@code max}.
 *
 * <p>Deterministic so that callers driven by an injected clock can assert exact retry times.
 */
public final class ExponentialBackoff {
    private final long baseMs;
    private final long maxMs;

    public ExponentialBackoff(Duration base, Duration max) {
        if (base == null || base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be > 0, got: " + base);
        }
        if (max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base, got: " + max);
        }
        this.baseMs = base.toMillis();
        this.maxMs = max.toMillis();
    }

    public Duration delayFor(int step) {
        if (step <= 0) {
            return Duration.ZERO;
        }
        if (step >= 63) {
            return Duration.ofMillis(maxMs);
        }
        long shift = 1L << (step - 1);
        // overflow guard: anything past max / base is capped anyway
        long delay = shift > maxMs / baseMs ? maxMs : baseMs * shift;
        return Duration.ofMillis(Math.min(maxMs, delay));
    }
}
