package express.mvp.blocksync.draft;

import java.util.Objects;

/**
 * In-memory {@link DraftBuffer}.
 *
 * <p>Not thread-safe; owned by the session controller's thread.
 */
public final class TextDraftBuffer implements DraftBuffer {

    private String text;
    private String cleanText;

    /**
     * Creates a clean buffer holding the given text.
     *
     * @param initialText the loaded text
     */
    public TextDraftBuffer(String initialText) {
        this.text = Objects.requireNonNull(initialText, "initialText");
        this.cleanText = initialText;
    }

    /** Creates a clean, empty buffer. */
    public TextDraftBuffer() {
        this("");
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public void setText(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public boolean isDirty() {
        return !text.equals(cleanText);
    }

    @Override
    public void markClean() {
        cleanText = text;
    }

    @Override
    public String toString() {
        return "TextDraftBuffer[length=" + text.length() + ", dirty=" + isDirty() + "]";
    }
}
