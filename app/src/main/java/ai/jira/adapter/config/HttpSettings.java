package ai.jira.adapter.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeout and retry settings for calls to the issue tracker.
 *
 * @param maxRetryAttempts total attempts for a throttled request, including the first one
 */
public record HttpSettings(int maxRetryAttempts,
                           Duration initialBackoff,
                           Duration maxBackoff,
                           Duration timeout,
                           double jitterFactor) {

    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 4;
    public static final long DEFAULT_INITIAL_BACKOFF_SECONDS = 1;
    public static final long DEFAULT_MAX_BACKOFF_SECONDS = 30;
    public static final long DEFAULT_TIMEOUT_SECONDS = 30;
    public static final double DEFAULT_JITTER_FACTOR = 0.2;

    public HttpSettings {
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        requireNonNegative(initialBackoff, "initialBackoff");
        requireNonNegative(maxBackoff, "maxBackoff");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff;
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
        }
    }

    public static HttpSettings defaults() {
        return new HttpSettings(DEFAULT_MAX_RETRY_ATTEMPTS,
                Duration.ofSeconds(DEFAULT_INITIAL_BACKOFF_SECONDS),
                Duration.ofSeconds(DEFAULT_MAX_BACKOFF_SECONDS),
                Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS),
                DEFAULT_JITTER_FACTOR);
    }

    private static void requireNonNegative(Duration value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isNegative()) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
    }
}
