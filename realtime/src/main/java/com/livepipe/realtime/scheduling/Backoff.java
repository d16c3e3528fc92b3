package com.livepipe.realtime.scheduling;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(base × 2^(attempt−1), cap)}.
 *
 * Used for transport reconnects (base 3s, cap 30s) and for step retries
 * (base 2s, giving the 2s, 4s, 8s… sequence).
 */
public record Backoff(Duration base, Duration cap) {

    // 2^30 × base already overflows any sane cap.
    private static final int MAX_SHIFT = 30;

    public Backoff {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("Backoff base must be positive: " + base);
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff cap " + cap + " is below base " + base);
        }
    }

    public static Backoff exponential(Duration base, Duration cap) {
        return new Backoff(base, cap);
    }

    /**
     * Delay before the given attempt.
     *
     * @param attempt 1-based attempt number; values below 1 are treated as 1
     */
    public Duration delayFor(int attempt) {
        int shift = Math.min(Math.max(attempt, 1) - 1, MAX_SHIFT);
        long millis;
        try {
            millis = Math.multiplyExact(base.toMillis(), 1L << shift);
        } catch (ArithmeticException overflow) {
            return cap;
        }
        Duration delay = Duration.ofMillis(millis);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
