package express.mvp.blocksync.store;

import express.mvp.blocksync.BlockSyncException;
import java.util.OptionalInt;

/**
 * Failure reported by a {@link RemoteContentStore}.
 *
 * <p>Carries the HTTP-equivalent status of the failed request, when the store received one, and
 * the store's own error code. Both feed {@link express.mvp.blocksync.error.ErrorClassifier}.
 * Transport-level failures (timeouts, refused connections) are reported with no status and the
 * underlying I/O exception as cause.
 */
public class RemoteStoreException extends BlockSyncException {

    /** Marker for "no status received". */
    private static final int NO_STATUS = -1;

    private final int status;
    private final String remoteCode;

    /**
     * Creates an exception for a response the store rejected.
     *
     * @param status the HTTP-equivalent status code
     * @param remoteCode the store's error code (may be null)
     * @param message the detail message
     */
    public RemoteStoreException(int status, String remoteCode, String message) {
        super(message);
        this.status = status;
        this.remoteCode = remoteCode;
    }

    /**
     * Creates an exception for a request that never produced a response.
     *
     * @param message the detail message
     * @param cause the transport failure
     */
    public RemoteStoreException(String message, Throwable cause) {
        super(message, cause);
        this.status = NO_STATUS;
        this.remoteCode = null;
    }

    /**
     * Returns the status code of the rejected request.
     *
     * @return the status, or empty for transport-level failures
     */
    public OptionalInt status() {
        return status == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(status);
    }

    /**
     * Returns the store's error code.
     *
     * @return the code, or null if none was reported
     */
    public String remoteCode() {
        return remoteCode;
    }
}
