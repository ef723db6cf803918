package express.mvp.blocksync.session;

/**
 * Callback for session state changes.
 *
 * <p>Invoked on the controller's thread after every message that changed the snapshot, including
 * changes that keep the phase (the draft turning dirty, a retry counter moving).
 * Implementations should be quick and must not call back into the controller.
 *
 * @see SessionStateMachine
 */
@FunctionalInterface
public interface SessionStateListener {

    /**
     * Called when the session snapshot changes.
     *
     * @param previous the snapshot before the message
     * @param current the snapshot after the message
     */
    void onStateChanged(SessionState previous, SessionState current);
}
