package com.meteoharvest.ingest.upstream;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff: the wait before attempt {@code n + 1} is
 * {@code baseDelay * multiplier^(n - 1)}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(5, Duration.ofMillis(200), 2.0);

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based");
        }
        double factor = Math.pow(multiplier, attempt - 1);
        return Duration.ofNanos(Math.round(baseDelay.toNanos() * factor));
    }

    public boolean isRetryableStatus(int statusCode) {
        return statusCode == 429 || statusCode >= 500;
    }
}
