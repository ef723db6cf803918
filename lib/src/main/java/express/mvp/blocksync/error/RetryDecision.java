package express.mvp.blocksync.error;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a {@link RetryPolicy} decision.
 *
 * @param shouldRetry whether another attempt should be scheduled
 * @param delay how long to wait before that attempt ({@link Duration#ZERO} when not retrying)
 */
public record RetryDecision(boolean shouldRetry, Duration delay) {

    private static final RetryDecision STOP = new RetryDecision(false, Duration.ZERO);

    public RetryDecision {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }

    /**
     * Returns the decision to stop retrying.
     *
     * @return a non-retrying decision
     */
    public static RetryDecision stop() {
        return STOP;
    }

    /**
     * Returns a decision to retry after a delay.
     *
     * @param delay the delay before the next attempt
     * @return a retrying decision
     */
    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
