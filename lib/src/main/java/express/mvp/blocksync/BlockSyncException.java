package express.mvp.blocksync;

/**
 * Unchecked exception thrown when a block editing operation fails.
 *
 * <p>This is the base of the failures raised by the block sync library. It extends
 * {@link RuntimeException} so that collaborator interfaces such as the remote content store do not
 * need checked exception clauses; the session controller classifies every failure it receives
 * instead of letting it propagate.
 *
 * @see express.mvp.blocksync.store.RemoteStoreException
 * @see express.mvp.blocksync.error.ErrorClassifier
 */
public class BlockSyncException extends RuntimeException {

    /**
     * Constructs a new exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public BlockSyncException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public BlockSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
