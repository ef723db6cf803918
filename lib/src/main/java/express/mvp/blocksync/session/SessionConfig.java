package express.mvp.blocksync.session;

import express.mvp.blocksync.draft.DraftBuffer;
import express.mvp.blocksync.draft.TextDraftBuffer;
import express.mvp.blocksync.error.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration for an edit session.
 *
 * <p>Use the builder to create instances:
 *
 * <pre>{@code
 * SessionConfig config = SessionConfig.builder()
 *     .maxRetries(5)
 *     .retryPolicy(RetryPolicy.exponentialBackoff(Duration.ofMillis(500), Duration.ofSeconds(8)))
 *     .build();
 * }</pre>
 */
public final class SessionConfig {

    /** Default number of automatic retries per save request. */
    public static final int DEFAULT_MAX_RETRIES = 3;

    /** Default time a "Saved!" or "Refreshed" indicator stays up. */
    public static final Duration DEFAULT_INDICATOR_DELAY = Duration.ofMillis(1500);

    private final int maxRetries;
    private final RetryPolicy retryPolicy;
    private final Duration indicatorDelay;
    private final Function<String, DraftBuffer> draftFactory;
    private final String workerThreadPrefix;

    private SessionConfig(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.retryPolicy = builder.retryPolicy;
        this.indicatorDelay = builder.indicatorDelay;
        this.draftFactory = builder.draftFactory;
        this.workerThreadPrefix = builder.workerThreadPrefix;
    }

    /**
     * Returns a configuration with every default.
     *
     * @return the default configuration
     */
    public static SessionConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a new builder.
     *
     * @return a builder initialized with defaults
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the number of automatic retries after a transient save failure.
     *
     * @return the retry ceiling, 0 to never retry automatically
     */
    public int maxRetries() {
        return maxRetries;
    }

    /**
     * Returns the backoff policy for automatic retries.
     *
     * @return the retry policy
     */
    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    /**
     * Returns how long a "Saved!" or "Refreshed" indicator stays up.
     *
     * @return the indicator delay
     */
    public Duration indicatorDelay() {
        return indicatorDelay;
    }

    /**
     * Returns the factory that creates a draft seeded with the fetched text.
     *
     * @return the draft factory
     */
    public Function<String, DraftBuffer> draftFactory() {
        return draftFactory;
    }

    /**
     * Returns the prefix for the runtime's thread names.
     *
     * @return the thread name prefix
     */
    public String workerThreadPrefix() {
        return workerThreadPrefix;
    }

    @Override
    public String toString() {
        return "SessionConfig{maxRetries="
                + maxRetries
                + ", retryPolicy="
                + retryPolicy
                + ", indicatorDelay="
                + indicatorDelay.toMillis()
                + "ms}";
    }

    /** Builder for {@link SessionConfig}. */
    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration indicatorDelay = DEFAULT_INDICATOR_DELAY;
        private Function<String, DraftBuffer> draftFactory = TextDraftBuffer::new;
        private String workerThreadPrefix = "blocksync";

        private Builder() {}

        /**
         * Sets the number of automatic retries.
         *
         * @param maxRetries the retry ceiling (default: 3)
         * @return this builder
         * @throws IllegalArgumentException if negative
         */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the backoff policy.
         *
         * @param retryPolicy the policy (default: 1s doubling up to 10s)
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        /**
         * Sets how long save and refresh indicators stay up.
         *
         * @param indicatorDelay the delay (default: 1.5s)
         * @return this builder
         * @throws IllegalArgumentException if negative
         */
        public Builder indicatorDelay(Duration indicatorDelay) {
            Objects.requireNonNull(indicatorDelay, "indicatorDelay");
            if (indicatorDelay.isNegative()) {
                throw new IllegalArgumentException("indicatorDelay must not be negative");
            }
            this.indicatorDelay = indicatorDelay;
            return this;
        }

        /**
         * Sets the factory for drafts created after a load.
         *
         * @param draftFactory receives the fetched text (default: {@link TextDraftBuffer})
         * @return this builder
         */
        public Builder draftFactory(Function<String, DraftBuffer> draftFactory) {
            this.draftFactory = Objects.requireNonNull(draftFactory, "draftFactory");
            return this;
        }

        /**
         * Sets the prefix for the runtime's thread names.
         *
         * @param workerThreadPrefix the prefix (default: "blocksync")
         * @return this builder
         * @throws IllegalArgumentException if blank
         */
        public Builder workerThreadPrefix(String workerThreadPrefix) {
            Objects.requireNonNull(workerThreadPrefix, "workerThreadPrefix");
            if (workerThreadPrefix.isBlank()) {
                throw new IllegalArgumentException("workerThreadPrefix must not be blank");
            }
            this.workerThreadPrefix = workerThreadPrefix;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new configuration
         */
        public SessionConfig build() {
            return new SessionConfig(this);
        }
    }
}
