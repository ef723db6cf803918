package express.mvp.blocksync.block;

import java.time.Instant;
import java.util.Objects;

/**
 * A block as fetched from the remote store.
 *
 * @param blockId the block identifier
 * @param pageId the identifier of the page containing the block, or null if unknown
 * @param type the block's structural type
 * @param text the plain text of the block
 * @param lastEditedTime the remote last-edited timestamp
 */
public record BlockContent(
        String blockId, String pageId, BlockType type, String text, Instant lastEditedTime) {

    public BlockContent {
        Objects.requireNonNull(blockId, "blockId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(lastEditedTime, "lastEditedTime");
    }
}
