package express.mvp.blocksync.runtime;

import express.mvp.blocksync.session.NavigationSignal;

/**
 * The component that opened the editor, typically a router.
 *
 * <p>Called on the session's mailbox thread.
 */
public interface SessionOwner {

    /**
     * The session for {@code blockId} has ended; close the editor.
     *
     * @param blockId the block that was being edited, or null if none was loaded
     */
    void onExited(String blockId);

    /**
     * The user pressed an explicit navigation key.
     *
     * @param signal where to go
     */
    void onNavigate(NavigationSignal signal);
}
