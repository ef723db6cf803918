package express.mvp.blocksync.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Acknowledgement of a successful save.
 *
 * @param blockId the saved block
 * @param lastEditedTime the remote timestamp after the save
 */
public record SaveReceipt(String blockId, Instant lastEditedTime) {

    public SaveReceipt {
        Objects.requireNonNull(blockId, "blockId");
        Objects.requireNonNull(lastEditedTime, "lastEditedTime");
    }
}
