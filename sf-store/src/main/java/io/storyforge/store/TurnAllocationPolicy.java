package io.storyforge.store;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry budget for turn-number allocation. The backoff grows linearly with the attempt number.
 */
public record TurnAllocationPolicy(int maxRetries, Duration backoff) {
    public static final TurnAllocationPolicy DEFAULT = new TurnAllocationPolicy(8, Duration.ofMillis(5));

    public TurnAllocationPolicy {
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
        Objects.requireNonNull(backoff);
        if (backoff.isNegative()) throw new IllegalArgumentException("backoff must not be negative");
    }

    public Duration backoffFor(int attempt) {
        return backoff.multipliedBy(attempt);
    }
}
