package express.mvp.blocksync.session;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validated phase transitions and change notification for one edit session.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * IDLE            → LOADING, EXITED
 * LOADING         → LOADING, EDITING, SHOWING_ERROR, EXITED
 * EDITING         → LOADING, SAVING, CONFIRMING_EXIT, EXITED
 * SAVING          → EDITING, RETRY_WAITING, SHOWING_ERROR, EXITED
 * RETRY_WAITING   → SAVING, LOADING
 * CONFIRMING_EXIT → LOADING, SAVING, EDITING, EXITED
 * SHOWING_ERROR   → LOADING, SAVING, EDITING, EXITED
 * EXITED          → LOADING
 * </pre>
 *
 * <p>{@code LOADING → LOADING} is the one self-transition: loading another block while a fetch
 * is outstanding starts a new generation.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Transitions and publishing are confined to the controller's thread. Listener registration
 * and reads of the current phase or snapshot may happen from any thread.
 *
 * @see SessionPhase
 * @see SessionStateListener
 */
public final class SessionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(SessionStateMachine.class.getName());

    private static final Set<SessionPhase> FROM_IDLE =
            EnumSet.of(SessionPhase.LOADING, SessionPhase.EXITED);

    private static final Set<SessionPhase> FROM_LOADING =
            EnumSet.of(
                    SessionPhase.LOADING,
                    SessionPhase.EDITING,
                    SessionPhase.SHOWING_ERROR,
                    SessionPhase.EXITED);

    private static final Set<SessionPhase> FROM_EDITING =
            EnumSet.of(
                    SessionPhase.LOADING,
                    SessionPhase.SAVING,
                    SessionPhase.CONFIRMING_EXIT,
                    SessionPhase.EXITED);

    private static final Set<SessionPhase> FROM_SAVING =
            EnumSet.of(
                    SessionPhase.EDITING,
                    SessionPhase.RETRY_WAITING,
                    SessionPhase.SHOWING_ERROR,
                    SessionPhase.EXITED);

    private static final Set<SessionPhase> FROM_RETRY_WAITING =
            EnumSet.of(SessionPhase.SAVING, SessionPhase.LOADING);

    private static final Set<SessionPhase> FROM_CONFIRMING_EXIT =
            EnumSet.of(
                    SessionPhase.LOADING,
                    SessionPhase.SAVING,
                    SessionPhase.EDITING,
                    SessionPhase.EXITED);

    private static final Set<SessionPhase> FROM_SHOWING_ERROR =
            EnumSet.of(
                    SessionPhase.LOADING,
                    SessionPhase.SAVING,
                    SessionPhase.EDITING,
                    SessionPhase.EXITED);

    private static final Set<SessionPhase> FROM_EXITED = EnumSet.of(SessionPhase.LOADING);

    private final List<SessionStateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile SessionPhase phase = SessionPhase.IDLE;

    private volatile SessionState published;

    /**
     * Creates a machine in {@link SessionPhase#IDLE}.
     *
     * @param initial the idle snapshot to compare the first change against
     */
    public SessionStateMachine(SessionState initial) {
        this.published = Objects.requireNonNull(initial, "initial");
    }

    /**
     * Returns the current phase.
     *
     * @return the phase
     */
    public SessionPhase getPhase() {
        return phase;
    }

    /**
     * Returns the last published snapshot.
     *
     * @return the snapshot
     */
    public SessionState getPublished() {
        return published;
    }

    /**
     * Registers a listener for state changes.
     *
     * @param listener the listener to register
     */
    public void addListener(SessionStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(SessionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Moves to a new phase.
     *
     * @param newPhase the desired phase
     * @throws IllegalStateException if the transition is not allowed from the current phase
     */
    public void transitionTo(SessionPhase newPhase) {
        if (!isValidTransition(phase, newPhase)) {
            throw new IllegalStateException("Invalid session transition " + phase + " -> " + newPhase);
        }
        LOGGER.fine(() -> "Session phase " + phase + " -> " + newPhase);
        phase = newPhase;
    }

    /**
     * Publishes a snapshot, notifying listeners if it differs from the last one.
     *
     * @param current the snapshot after handling a message
     */
    public void publish(SessionState current) {
        SessionState previous = published;
        if (previous.equals(current)) {
            return;
        }
        published = current;
        for (SessionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Session state listener failed", e);
            }
        }
    }

    /**
     * Checks if a transition from one phase to another is valid.
     *
     * @param from the source phase
     * @param to the target phase
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(SessionPhase from, SessionPhase to) {
        return switch (from) {
            case IDLE -> FROM_IDLE.contains(to);
            case LOADING -> FROM_LOADING.contains(to);
            case EDITING -> FROM_EDITING.contains(to);
            case SAVING -> FROM_SAVING.contains(to);
            case RETRY_WAITING -> FROM_RETRY_WAITING.contains(to);
            case CONFIRMING_EXIT -> FROM_CONFIRMING_EXIT.contains(to);
            case SHOWING_ERROR -> FROM_SHOWING_ERROR.contains(to);
            case EXITED -> FROM_EXITED.contains(to);
        };
    }

    /**
     * Returns the set of valid target phases from a given phase.
     *
     * @param from the source phase
     * @return set of valid target phases
     */
    public static Set<SessionPhase> getValidTransitions(SessionPhase from) {
        EnumSet<SessionPhase> targets = EnumSet.noneOf(SessionPhase.class);
        for (SessionPhase to : SessionPhase.values()) {
            if (isValidTransition(from, to)) {
                targets.add(to);
            }
        }
        return targets;
    }

    @Override
    public String toString() {
        String id = published.blockId();
        return id != null
                ? "SessionStateMachine[" + id + ":" + phase + "]"
                : "SessionStateMachine[" + phase + "]";
    }
}
