package express.mvp.blocksync.store;

import express.mvp.blocksync.block.BlockContent;
import express.mvp.blocksync.block.BlockUpdate;

/**
 * Remote storage for block content.
 *
 * <p>Both operations block the calling thread. The session runtime calls them from worker threads
 * and turns the outcome into a message for the session controller, so implementations never see
 * the controller or its state.
 *
 * <p>Failures are reported as unchecked exceptions, preferably {@link RemoteStoreException} with a
 * status code; any other exception is classified from its type and message.
 */
public interface RemoteContentStore {

    /**
     * Fetches one block.
     *
     * @param blockId the block to fetch
     * @return the block's current remote content
     * @throws RemoteStoreException if the store rejects the request or cannot be reached
     */
    BlockContent fetch(String blockId);

    /**
     * Replaces a block's text and asserts its structural type.
     *
     * @param blockId the block to update
     * @param update the text and type to save
     * @return the receipt carrying the new remote timestamp
     * @throws RemoteStoreException if the store rejects the request or cannot be reached
     */
    SaveReceipt save(String blockId, BlockUpdate update);
}
