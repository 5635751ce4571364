package in.kiteticker.infrastructure.feed.common;

import java.time.Duration;

/**
 * Exponential backoff for one reconnect campaign.
 *
 * A campaign runs from the first failure after a good connection until the
 * next successful connect or until the attempt budget is spent:
 * <ul>
 *   <li>each attempt increments the attempt count</li>
 *   <li>attempts beyond {@code maxAttempts} exhaust the policy</li>
 *   <li>the delay starts at {@code initialDelay}, is multiplied after every
 *       attempt and never exceeds {@code maxDelay}</li>
 *   <li>a successful connection resets count and delay</li>
 * </ul>
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(2))
 *     .maxDelay(Duration.ofSeconds(60))
 *     .maxAttempts(30)
 *     .build();
 *
 * if (policy.beginAttempt()) {
 *     scheduler.schedule(this::connect, policy.nextDelay().toMillis(), TimeUnit.MILLISECONDS);
 * } else {
 *     // give up
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * Count a new attempt.
     *
     * @return true if the attempt is within budget, false once the attempt count
     *         exceeds {@code maxAttempts}
     */
    public synchronized boolean beginAttempt() {
        attemptCount++;
        return attemptCount <= maxAttempts;
    }

    /**
     * Delay to wait before the attempt just begun. Advances the backoff so the
     * following call returns the next, larger (or capped) delay.
     *
     * @return Duration to wait before connecting
     */
    public synchronized Duration nextDelay() {
        Duration delay = currentDelay;

        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));

        return delay;
    }

    /**
     * Record a successful connection.
     * Resets the attempt count and the delay.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
    }

    /**
     * Reset the policy to its initial state, e.g. before an explicit connect.
     */
    public synchronized void reset() {
        recordSuccess();
    }

    /**
     * @return Number of attempts since the last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults of the Kite ticker: 2s initial delay doubling up to 60s, 30 attempts.
     */
    public static ReconnectionPolicy forTickerFeed() {
        return builder().build();
    }

    /**
     * Builder for ReconnectionPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private int maxAttempts = 30;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
