package io.devx.core.retry;

import java.time.Duration;

/**
 * Exponential backoff settings. Delays never decrease between attempts and are capped at {@code maxDelay}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
        maxDelay = maxDelay == null || maxDelay.compareTo(baseDelay) < 0 ? baseDelay : maxDelay;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(250), 2.0, Duration.ofMillis(2000));
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, 2.0, Duration.ofMillis(Long.MAX_VALUE / 4));
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration delayAfter(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        double millis = baseDelay.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }
}
