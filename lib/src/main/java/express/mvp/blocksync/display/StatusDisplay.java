package express.mvp.blocksync.display;

/**
 * Status line of the editor.
 *
 * <p>Called on the session's thread; implementations hand off to their own UI thread if needed.
 */
public interface StatusDisplay {

    /**
     * Shows the mode text, e.g. {@code Editing} or {@code Retrying in 2s... (1/3)}.
     *
     * @param mode the mode text
     */
    void setMode(String mode);

    void setSyncStatus(SyncStatus status);

    void setHelpText(String helpText);
}
