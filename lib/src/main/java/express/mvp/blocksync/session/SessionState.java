package express.mvp.blocksync.session;

import express.mvp.blocksync.block.BlockType;
import java.time.Duration;

/**
 * Immutable snapshot of a session as seen by displays and listeners.
 *
 * @param phase the current phase
 * @param blockId the block being edited, or null before the first load
 * @param blockType the confirmed structural type, or null until loaded
 * @param pendingBlockType a requested type not yet saved, or null
 * @param dirty whether the draft differs from the last saved text
 * @param retryAttempt consecutive failed attempts of the current save request
 * @param maxRetries the configured retry ceiling
 * @param retryDelay the backoff being waited out in {@link SessionPhase#RETRY_WAITING}, else zero
 * @param refreshing whether the current or last load was a refresh
 * @param quitAfterSave whether the in-flight save should end the session on success
 * @param indicator the short-lived confirmation to show
 * @param error the displayed error in {@link SessionPhase#SHOWING_ERROR}, else null
 * @param generation the load generation results must match
 */
public record SessionState(
        SessionPhase phase,
        String blockId,
        BlockType blockType,
        BlockType pendingBlockType,
        boolean dirty,
        int retryAttempt,
        int maxRetries,
        Duration retryDelay,
        boolean refreshing,
        boolean quitAfterSave,
        StatusIndicator indicator,
        ErrorReport error,
        long generation) {

    /**
     * Returns the state of a controller that has not loaded anything.
     *
     * @param maxRetries the configured retry ceiling
     * @return the idle state
     */
    public static SessionState idle(int maxRetries) {
        return new SessionState(
                SessionPhase.IDLE, null, null, null, false, 0, maxRetries, Duration.ZERO,
                false, false, StatusIndicator.NONE, null, 0L);
    }

    /**
     * Returns the type the next save will assert.
     *
     * @return the pending type if one is queued, otherwise the confirmed type
     */
    public BlockType effectiveBlockType() {
        return pendingBlockType != null ? pendingBlockType : blockType;
    }
}
