package io.infrautomater.core.orchestration;

import java.time.Duration;
import java.util.Objects;

/// Bounded-attempts retry policy with fixed or exponential backoff.
///
/// The delay before attempt `n` (for `n >= 2`) is
/// `initialBackoff * multiplier^(n-2)`, capped at `maxBackoff`. A multiplier
/// of `1.0` gives fixed backoff.
///
/// @param maxAttempts total attempts including the first, at least 1
/// @param initialBackoff delay before the second attempt, not negative
/// @param multiplier growth factor per attempt, at least 1.0
/// @param maxBackoff cap on any single delay, at least `initialBackoff`
public record RetryPolicy(
        int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(60);

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    /// 3 attempts, 60 s apart.
    public static RetryPolicy defaults() {
        return fixed(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF);
    }

    public static RetryPolicy fixed(int maxAttempts, Duration backoff) {
        return new RetryPolicy(maxAttempts, backoff, 1.0, backoff);
    }

    public static RetryPolicy exponential(
            int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff);
    }

    /// A single attempt, never retried.
    public static RetryPolicy none() {
        return fixed(1, Duration.ZERO);
    }

    /// Returns whether another attempt may follow `attempt`.
    ///
    /// @param attempt 1-based number of the attempt that just ran
    /// @return true if `attempt < maxAttempts`
    public boolean hasAttemptsAfter(int attempt) {
        return attempt < maxAttempts;
    }

    /// Returns the delay to wait before running `attempt`.
    ///
    /// @param attempt 1-based number of the attempt about to run
    /// @return zero for the first attempt, otherwise the capped backoff
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double factor = Math.pow(multiplier, attempt - 2);
        double millis = initialBackoff.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(Math.round(millis));
    }

    public ProvisioningAttempt firstAttempt() {
        return ProvisioningAttempt.first(maxAttempts);
    }
}
