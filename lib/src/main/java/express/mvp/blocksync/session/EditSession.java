package express.mvp.blocksync.session;

import express.mvp.blocksync.block.BlockType;
import express.mvp.blocksync.block.BlockUpdate;
import express.mvp.blocksync.draft.DraftBuffer;
import java.time.Duration;
import java.time.Instant;

/**
 * Mutable record of one editing session, owned and written only by {@link SessionController}.
 *
 * <p>A session is reset in place when another block is loaded: counters, pending state and the
 * draft are discarded while the generation keeps increasing.
 */
final class EditSession {

    String blockId;
    String pageId;
    BlockType blockType;
    BlockType pendingBlockType;
    String baselineText;
    int retryAttempt;
    final int maxRetries;
    boolean quitAfterSave;

    long generation;
    DraftBuffer draft;
    BlockUpdate inFlight;
    Instant lastEditedTime;
    boolean refreshing;
    StatusIndicator indicator = StatusIndicator.NONE;
    long indicatorTicket;
    Duration retryDelay = Duration.ZERO;
    ErrorReport error;

    EditSession(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    /** Drops everything tied to the previous block and starts a new generation. */
    void reset(String newBlockId, String newPageId) {
        blockId = newBlockId;
        pageId = newPageId;
        blockType = null;
        pendingBlockType = null;
        baselineText = null;
        retryAttempt = 0;
        quitAfterSave = false;
        draft = null;
        inFlight = null;
        lastEditedTime = null;
        refreshing = false;
        indicator = StatusIndicator.NONE;
        retryDelay = Duration.ZERO;
        error = null;
        generation++;
    }

    boolean isDirty() {
        return draft != null && baselineText != null && !baselineText.equals(draft.getText());
    }

    BlockType effectiveBlockType() {
        return pendingBlockType != null ? pendingBlockType : blockType;
    }
}
