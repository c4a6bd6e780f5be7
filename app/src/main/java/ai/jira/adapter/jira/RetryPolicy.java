package ai.jira.adapter.jira;

import ai.jira.adapter.config.HttpSettings;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a throttled response is retried and how long to wait first.
 *
 * <p>The wait is {@code initialBackoff * 2^attempt} capped at {@code maxBackoff} and spread by the jitter factor,
 * unless the server sent a numeric {@code Retry-After} header.
 */
public class RetryPolicy {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 503);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitterFactor) {
        this(maxAttempts, initialBackoff, maxBackoff, jitterFactor, Math::random);
    }

    RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitterFactor,
                DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        this.jitterFactor = jitterFactor;
        this.random = Objects.requireNonNull(random, "random");
    }

    public static RetryPolicy from(HttpSettings settings) {
        return new RetryPolicy(settings.maxRetryAttempts(), settings.initialBackoff(), settings.maxBackoff(),
                settings.jitterFactor());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean isRetryable(int statusCode) {
        return RETRYABLE_STATUSES.contains(statusCode);
    }

    /**
     * @param attempt zero-based number of the attempt that just failed
     * @return the delay before the next attempt, or empty when the response must be returned as is
     */
    public Optional<Duration> delayBeforeRetry(int attempt, int statusCode, Optional<String> retryAfter) {
        if (!isRetryable(statusCode) || attempt >= maxAttempts - 1) {
            return Optional.empty();
        }
        Optional<Duration> serverDelay = retryAfter.flatMap(RetryPolicy::parseRetryAfter);
        if (serverDelay.isPresent()) {
            return Optional.of(min(serverDelay.get(), maxBackoff));
        }
        long baseMillis = initialBackoff.toMillis() * (1L << Math.min(attempt, 30));
        long cappedMillis = Math.min(baseMillis, maxBackoff.toMillis());
        double jitterMultiplier = 1.0 + (random.getAsDouble() * 2.0 - 1.0) * jitterFactor;
        return Optional.of(Duration.ofMillis(Math.max(0, (long) (cappedMillis * jitterMultiplier))));
    }

    private static Optional<Duration> parseRetryAfter(String raw) {
        try {
            long seconds = Long.parseLong(raw.trim());
            return seconds < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
        } catch (NumberFormatException ex) {
            // HTTP-date form is not honoured; fall back to computed backoff
            return Optional.empty();
        }
    }

    private static Duration min(Duration left, Duration right) {
        return left.compareTo(right) <= 0 ? left : right;
    }
}
