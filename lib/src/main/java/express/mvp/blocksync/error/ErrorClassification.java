package express.mvp.blocksync.error;

/**
 * Whether retrying a failed operation can be expected to help.
 *
 * @see ErrorCategory#classification()
 */
public enum ErrorClassification {

    /** Expected to succeed if retried: timeouts, refused connections, rate limits, server faults. */
    TRANSIENT,

    /** Retrying will not fix it: authentication, not-found, validation and unrecognized failures. */
    PERMANENT;

    /**
     * Checks if this classification allows automatic and manual retry.
     *
     * @return true only for {@link #TRANSIENT}
     */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
