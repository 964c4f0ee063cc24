package com.nosota.tradeflow.api.socket;

import java.time.Duration;

/**
 * Capped exponential backoff for reconnecting after an unexpected close.
 *
 * @param initialDelay Delay before the first reconnect attempt
 * @param maxDelay     Upper bound for any single delay
 * @param multiplier   Growth factor between consecutive attempts
 * @param maxAttempts  Attempts before giving up; 0 retries forever
 */
public record ReconnectPolicy(
        Duration initialDelay,
        Duration maxDelay,
        double multiplier,
        int maxAttempts
) {

    public ReconnectPolicy {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
    }

    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0);
    }

    /**
     * @param attempt 1-based attempt number
     * @return Delay before that attempt
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based");
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean isExhausted(int attempt) {
        return maxAttempts > 0 && attempt > maxAttempts;
    }
}
