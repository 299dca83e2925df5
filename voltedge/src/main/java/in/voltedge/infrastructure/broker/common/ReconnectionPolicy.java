package in.voltedge.infrastructure.broker.common;

import in.voltedge.config.ExecutionConfig;

import java.time.Duration;

/**
 * Exponential backoff with a bounded number of consecutive connection failures.
 *
 * Shared by every broker call site, so the attempt counter is process-wide: once
 * {@code maxAttempts} consecutive failures are recorded the policy is exhausted and stays
 * exhausted until {@link #reset()}. Any success clears the counter.
 *
 * Usage:
 * <pre>
 * Duration delay = policy.recordFailure();
 * if (policy.isExhausted()) {
 *     halt();
 * }
 * sleeper.sleep(delay);
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int consecutiveFailures = 0;
    private Duration nextDelay;
    private boolean exhausted = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.nextDelay = initialDelay;
    }

    /**
     * Record a connection failure.
     *
     * @return how long to wait before the next attempt
     */
    public synchronized Duration recordFailure() {
        consecutiveFailures++;
        Duration delay = nextDelay;
        long grown = (long) (nextDelay.toMillis() * multiplier);
        nextDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
        if (consecutiveFailures >= maxAttempts) {
            exhausted = true;
        }
        return delay;
    }

    public synchronized void recordSuccess() {
        if (exhausted) {
            return;
        }
        consecutiveFailures = 0;
        nextDelay = initialDelay;
    }

    /**
     * Manual reset after an operator restart.
     */
    public synchronized void reset() {
        consecutiveFailures = 0;
        nextDelay = initialDelay;
        exhausted = false;
    }

    public synchronized boolean isExhausted() {
        return exhausted;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy for broker calls: 1s doubling to 60s by default, capped attempts.
     */
    public static ReconnectionPolicy forBrokerCalls(ExecutionConfig config) {
        return builder()
            .initialDelay(Duration.ofMillis(config.reconnectInitialDelayMillis()))
            .maxDelay(Duration.ofMillis(config.reconnectMaxDelayMillis()))
            .multiplier(2.0)
            .maxAttempts(config.maxReconnectAttempts())
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private int maxAttempts = 5;

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
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
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
