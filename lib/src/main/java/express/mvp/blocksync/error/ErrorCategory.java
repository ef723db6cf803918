package express.mvp.blocksync.error;

/**
 * Categories of remote store failures.
 *
 * <p>Each category maps to exactly one {@link ErrorClassification}:
 *
 * <ul>
 *   <li><b>Transient:</b> NETWORK_TIMEOUT, CONNECTION_FAILURE, RATE_LIMITED, SERVER_FAULT
 *   <li><b>Permanent:</b> UNAUTHORIZED, NOT_FOUND, VALIDATION_FAILURE, UNKNOWN
 * </ul>
 *
 * <p>Transient failures are retried by the session controller with backoff and surface only as a
 * "retrying" status until the retry budget is spent. Permanent failures surface immediately.
 *
 * @see ErrorClassifier
 * @see RetryPolicy
 */
public enum ErrorCategory {

    /**
     * The request or connection timed out.
     *
     * <p>Examples: socket read timeout, deadline exceeded, HTTP 408.
     */
    NETWORK_TIMEOUT(ErrorClassification.TRANSIENT, "Request timed out"),

    /**
     * The store could not be reached.
     *
     * <p>Examples: connection refused, DNS resolution failure, host unreachable.
     */
    CONNECTION_FAILURE(ErrorClassification.TRANSIENT, "Could not reach the server"),

    /** The store asked the client to slow down (HTTP 429). */
    RATE_LIMITED(ErrorClassification.TRANSIENT, "Too many requests"),

    /** The store failed internally (HTTP 5xx). */
    SERVER_FAULT(ErrorClassification.TRANSIENT, "Server error"),

    /** Credentials are missing, invalid or lack access (HTTP 401/403). */
    UNAUTHORIZED(ErrorClassification.PERMANENT, "Not authorized"),

    /** The block does not exist or is not shared with the integration (HTTP 404). */
    NOT_FOUND(ErrorClassification.PERMANENT, "Block not found"),

    /** The store rejected the request as malformed (HTTP 400/409/422). */
    VALIDATION_FAILURE(ErrorClassification.PERMANENT, "Request rejected"),

    /**
     * Unrecognized failure.
     *
     * <p>Never retried automatically: unknown failures are treated as permanent.
     */
    UNKNOWN(ErrorClassification.PERMANENT, "Unexpected error");

    private final ErrorClassification classification;
    private final String description;

    ErrorCategory(ErrorClassification classification, String description) {
        this.classification = classification;
        this.description = description;
    }

    /**
     * Returns whether failures in this category are transient or permanent.
     *
     * @return the classification
     */
    public ErrorClassification classification() {
        return classification;
    }

    /**
     * Checks if failures in this category may be retried.
     *
     * @return true for transient categories
     */
    public boolean isRetryable() {
        return classification.isRetryable();
    }

    /**
     * Returns a short human-readable description for error displays.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
