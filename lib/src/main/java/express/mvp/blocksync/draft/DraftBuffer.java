package express.mvp.blocksync.draft;

/**
 * Editable text held locally while a block is being edited.
 *
 * <p>The buffer remembers the text it was last marked clean with. It is dirty while its current
 * text differs from that baseline.
 */
public interface DraftBuffer {

    /**
     * Returns the current text.
     *
     * @return the text, never null
     */
    String getText();

    /**
     * Replaces the current text without touching the clean baseline.
     *
     * @param text the new text
     */
    void setText(String text);

    /**
     * Checks if the current text differs from the clean baseline.
     *
     * @return true if there are unsaved edits
     */
    boolean isDirty();

    /** Makes the current text the clean baseline. Calling it twice in a row is a no-op. */
    void markClean();
}
