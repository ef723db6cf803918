package express.mvp.blocksync.error;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether a failed save is retried and how long to wait first.
 *
 * <p>The policy is a pure function of its inputs: the zero-based retry number, the retry ceiling
 * and the classification of the failure. Only {@link ErrorClassification#TRANSIENT} failures are
 * retried, and only while {@code attempt < maxRetries}.
 *
 * <h2>Backoff</h2>
 *
 * <p>Delays grow exponentially from a base and are capped:
 *
 * <pre>
 * delay(attempt) = min(maxDelay, baseDelay * 2^attempt)
 * </pre>
 *
 * <p>With the defaults (1 s base, 10 s cap) the sequence is 1 s, 2 s, 4 s, 8 s, 10 s, 10 s, ...
 * The initial attempt is not counted: {@code attempt} is 0 when deciding the first retry.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.defaults();
 * RetryDecision decision = policy.decide(attempt, 3, ErrorClassifier.classification(failure));
 * if (decision.shouldRetry()) {
 *     scheduler.schedule(this::resend, decision.delay().toMillis(), TimeUnit.MILLISECONDS);
 * }
 * }</pre>
 *
 * @see ErrorClassifier
 * @see RetryDecision
 */
public final class RetryPolicy {

    /** Default delay before the first retry. */
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

    /** Default cap on any single delay. */
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    private static final RetryPolicy DEFAULTS = builder().build();

    /** Delay for attempt 0. */
    private final Duration baseDelay;

    /** Maximum delay cap. */
    private final Duration maxDelay;

    private RetryPolicy(Builder builder) {
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
    }

    /**
     * Returns the policy with a 1 s base delay capped at 10 s.
     *
     * @return the default policy
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a policy with exponential backoff.
     *
     * @param baseDelay delay before the first retry
     * @param maxDelay maximum delay cap
     * @return exponential backoff policy
     */
    public static RetryPolicy exponentialBackoff(Duration baseDelay, Duration maxDelay) {
        return builder().baseDelay(baseDelay).maxDelay(maxDelay).build();
    }

    /**
     * Returns a builder for custom policy configuration.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Decides whether to retry after a failure.
     *
     * @param attempt zero-based retry number (0 when deciding the first retry)
     * @param maxRetries the retry ceiling
     * @param classification the classification of the failure
     * @return the decision; {@link RetryDecision#stop()} when not retrying
     */
    public RetryDecision decide(int attempt, int maxRetries, ErrorClassification classification) {
        Objects.requireNonNull(classification, "classification");
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (classification != ErrorClassification.TRANSIENT || attempt >= maxRetries) {
            return RetryDecision.stop();
        }
        return RetryDecision.retryAfter(delayFor(attempt));
    }

    /**
     * Calculates the backoff delay for a retry.
     *
     * @param attempt zero-based retry number
     * @return {@code min(maxDelay, baseDelay * 2^attempt)}
     */
    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        // 2^62 overflows any realistic base; everything past the cap is the cap anyway
        if (attempt >= Long.SIZE - 2) {
            return maxDelay;
        }
        long base = baseDelay.toMillis();
        long factor = 1L << attempt;
        if (base != 0 && factor > Long.MAX_VALUE / base) {
            return maxDelay;
        }
        Duration delay = Duration.ofMillis(base * factor);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /**
     * Returns the delay before the first retry.
     *
     * @return the base delay
     */
    public Duration baseDelay() {
        return baseDelay;
    }

    /**
     * Returns the cap on any single delay.
     *
     * @return the maximum delay
     */
    public Duration maxDelay() {
        return maxDelay;
    }

    @Override
    public String toString() {
        return "RetryPolicy[base=" + baseDelay.toMillis() + "ms, max=" + maxDelay.toMillis() + "ms]";
    }

    /**
     * Builder for {@link RetryPolicy}.
     */
    public static final class Builder {
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;

        private Builder() {}

        /**
         * Sets the delay before the first retry.
         *
         * @param delay base delay (must not be negative)
         * @return this builder
         */
        public Builder baseDelay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("baseDelay must not be negative");
            }
            this.baseDelay = delay;
            return this;
        }

        /**
         * Sets the maximum delay cap.
         *
         * @param maxDelay maximum delay (must not be negative)
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Builds the retry policy.
         *
         * @return new policy
         * @throws IllegalArgumentException if the cap is below the base delay
         */
        public RetryPolicy build() {
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must be >= baseDelay");
            }
            return new RetryPolicy(this);
        }
    }
}
