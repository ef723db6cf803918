package express.mvp.blocksync.session;

/**
 * Phases of an edit session.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 *  ┌──────┐ load  ┌─────────┐ loaded ┌─────────┐ save  ┌────────┐ transient ┌──────────────┐
 *  │ IDLE │──────▶│ LOADING │───────▶│ EDITING │──────▶│ SAVING │──────────▶│RETRY_WAITING │
 *  └──────┘       └─────────┘        └─────────┘◀──────└────────┘◀──────────└──────────────┘
 *                      │               │     ▲    saved    │         timer
 *                      │ failed        │exit │cancel       │ permanent / exhausted
 *                      ▼               ▼     │             ▼
 *               ┌───────────────┐  ┌─────────────────┐  ┌───────────────┐
 *               │ SHOWING_ERROR │  │ CONFIRMING_EXIT │  │ SHOWING_ERROR │
 *               └───────────────┘  └─────────────────┘  └───────────────┘
 *                                    │ discard / save-then-exit succeeded
 *                                    ▼
 *                               ┌────────┐
 *                               │ EXITED │
 *                               └────────┘
 * </pre>
 *
 * <p>Dirtiness is not a phase: {@link #EDITING} covers both the clean and the dirty draft, and
 * {@link SessionState#dirty()} tells them apart.
 *
 * @see SessionStateMachine
 */
public enum SessionPhase {

    /** No block requested yet. */
    IDLE("Idle", false),

    /** A fetch is in flight; no draft is editable. */
    LOADING("Loading", true),

    /** The draft is editable. */
    EDITING("Editing", false),

    /** A save is in flight. */
    SAVING("Saving", true),

    /** A transient save failure is waiting out its backoff delay. */
    RETRY_WAITING("Retrying", true),

    /** The user is being asked to save, discard or cancel before leaving. */
    CONFIRMING_EXIT("Confirming exit", false),

    /** A permanent or exhausted failure is displayed until acknowledged. */
    SHOWING_ERROR("Error", false),

    /** The session ended; the owner has been told. */
    EXITED("Exited", false);

    private final String displayName;
    private final boolean busy;

    SessionPhase(String displayName, boolean busy) {
        this.displayName = displayName;
        this.busy = busy;
    }

    /**
     * Returns a human-readable name for this phase.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if a fetch or save is outstanding (or about to be resent) in this phase.
     *
     * @return true for LOADING, SAVING and RETRY_WAITING
     */
    public boolean isBusy() {
        return busy;
    }

    /**
     * Checks if the save pipeline owns the session in this phase.
     *
     * @return true for SAVING and RETRY_WAITING
     */
    public boolean isSaving() {
        return this == SAVING || this == RETRY_WAITING;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
