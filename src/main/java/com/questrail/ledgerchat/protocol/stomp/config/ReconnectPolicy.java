package com.questrail.ledgerchat.protocol.stomp.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * ReconnectPolicy
 * -----------------------------------------------------------------------------
 * Delay before each automatic reconnect attempt.
 *
 * <p>The delay for the n-th consecutive attempt (1-based) is
 * {@code min(maxDelay, initialDelay * multiplier^(n-1))}. A fixed policy has
 * multiplier 1. A zero {@code initialDelay} disables automatic reconnects.</p>
 */
public record ReconnectPolicy(
        Duration initialDelay,
        Duration maxDelay,
        double multiplier
) {
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(3);

    public ReconnectPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");

        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a finite value >= 1");
        }
    }

    /** Same delay before every attempt. */
    public static ReconnectPolicy fixed(Duration delay) {
        return new ReconnectPolicy(delay, delay, 1.0);
    }

    /** Doubling delay, capped at {@code maxDelay}. */
    public static ReconnectPolicy exponential(Duration initialDelay, Duration maxDelay) {
        return new ReconnectPolicy(initialDelay, maxDelay, 2.0);
    }

    public static ReconnectPolicy none() {
        return fixed(Duration.ZERO);
    }

    /** Fixed 3 second delay. */
    public static ReconnectPolicy defaults() {
        return fixed(DEFAULT_DELAY);
    }

    public boolean isEnabled() {
        return !initialDelay.isZero();
    }

    /**
     * @param attempt 1-based count of consecutive attempts since the last
     *                successful session
     * @return the delay, or empty when reconnects are disabled
     */
    public Optional<Duration> delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        if (!isEnabled()) {
            return Optional.empty();
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Optional.of(Duration.ofMillis(capped));
    }
}
