package uk.gegc.docgen.shared.http;

import java.time.Duration;

/**
 * Bounded retry budget with exponential backoff.
 *
 * @param maxRetries   additional attempts after the first one
 * @param baseBackoff  wait before the first retry; doubled for every subsequent retry
 * @param maxBackoff   cap applied before jitter
 * @param jitterFactor symmetric jitter band (0.25 = ±25% of the computed wait)
 */
public record RetryPolicy(
        int maxRetries,
        Duration baseBackoff,
        Duration maxBackoff,
        double jitterFactor
) {
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        if (baseBackoff == null || baseBackoff.isNegative()) {
            throw new IllegalArgumentException("baseBackoff must be zero or positive");
        }
        if (maxBackoff == null || maxBackoff.compareTo(baseBackoff) < 0) {
            maxBackoff = baseBackoff;
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 0.0);
    }
}
