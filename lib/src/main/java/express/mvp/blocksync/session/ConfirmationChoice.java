package express.mvp.blocksync.session;

/** Answers to the unsaved-changes prompt. */
public enum ConfirmationChoice {
    /** Save the draft, then exit once the save succeeds. */
    SAVE("Save", 's'),
    /** Exit without saving. */
    DISCARD("Discard", 'd'),
    /** Keep editing. */
    CANCEL("Cancel", 'c');

    private final String label;
    private final char key;

    ConfirmationChoice(String label, char key) {
        this.label = label;
        this.key = key;
    }

    /**
     * Returns the button label.
     *
     * @return the label
     */
    public String label() {
        return label;
    }

    /**
     * Returns the shortcut key shown next to the label.
     *
     * @return the key
     */
    public char key() {
        return key;
    }
}
