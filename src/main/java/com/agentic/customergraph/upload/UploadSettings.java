package com.agentic.customergraph.upload;

import java.time.Duration;

/**
 * Immutable settings of the Bulk Upload Coordinator.
 *
 * @param maxAttempts attempts per extraction within one run, including the first
 * @param initialBackoff delay before the second attempt
 * @param backoffMultiplier growth factor of the delay between attempts
 * @param maxBackoff upper bound of any single delay
 * @param callTimeout timeout of each call to the Extraction Store or Graph Database
 * @param parallelism number of customers processed concurrently by {@code uploadAll}
 */
public record UploadSettings(
    int maxAttempts,
    Duration initialBackoff,
    double backoffMultiplier,
    Duration maxBackoff,
    Duration callTimeout,
    int parallelism
) {

    public UploadSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be zero or positive");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0, got " + backoffMultiplier);
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must not be shorter than initialBackoff");
        }
        if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
    }

    public static UploadSettings defaults() {
        return new UploadSettings(5, Duration.ofMillis(200), 2.0, Duration.ofSeconds(5), Duration.ofSeconds(30), 4);
    }

    /**
     * Delay to wait after the given failed attempt (1-based):
     * {@code initialBackoff * multiplier^(attempt-1)}, capped at {@code maxBackoff}.
     */
    public Duration backoffAfter(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }

    public UploadSettings withMaxAttempts(int attempts) {
        return new UploadSettings(attempts, initialBackoff, backoffMultiplier, maxBackoff, callTimeout, parallelism);
    }

    public UploadSettings withCallTimeout(Duration timeout) {
        return new UploadSettings(maxAttempts, initialBackoff, backoffMultiplier, maxBackoff, timeout, parallelism);
    }
}
