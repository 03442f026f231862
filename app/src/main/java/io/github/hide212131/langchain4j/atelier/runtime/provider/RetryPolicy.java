package io.github.hide212131.langchain4j.atelier.runtime.provider;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff shared by every backend: {@code min(base * 2^(attempt-1), cap)} after a failed attempt.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, Sleeper sleeper) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(sleeper, "sleeper");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, Sleeper.system());
    }

    public RetryPolicy withSleeper(Sleeper replacement) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, replacement);
    }

    /**
     * Delay to wait after the given 1-based attempt failed.
     */
    public Duration delayAfter(int failedAttempt) {
        long factor = 1L << Math.min(30, Math.max(0, failedAttempt - 1));
        Duration delay = baseDelay.multipliedBy(factor);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
