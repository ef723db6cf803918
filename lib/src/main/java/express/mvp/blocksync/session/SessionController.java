package express.mvp.blocksync.session;

import express.mvp.blocksync.block.BlockContent;
import express.mvp.blocksync.block.BlockType;
import express.mvp.blocksync.block.BlockUpdate;
import express.mvp.blocksync.draft.DraftBuffer;
import express.mvp.blocksync.error.ErrorClassification;
import express.mvp.blocksync.error.ErrorClassifier;
import express.mvp.blocksync.error.RetryDecision;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one edit session for one remote block.
 *
 * <p>The controller is a pure message processor: {@link #handle(SessionMessage)} mutates the
 * session and returns the commands the caller must execute. It never blocks and never performs I/O,
 * so it can be driven synchronously in tests or from the mailbox thread of a runtime.
 *
 * <h2>Save Pipeline</h2>
 *
 * <pre>
 * EDITING ──save──▶ SAVING ──ok──▶ EDITING (clean)        or EXITED when quitAfterSave
 *                     │
 *                     ├─transient, attempt &lt; max──▶ RETRY_WAITING ──timer──▶ SAVING
 *                     │
 *                     └─permanent or exhausted──▶ SHOWING_ERROR
 * </pre>
 *
 * <p>A retry resends exactly the payload of the original request. A queued block type is applied
 * only by a save that succeeds.
 *
 * <h2>Stale Results</h2>
 *
 * <p>Every load and refresh starts a new generation. Fetch, save and timer results carry the
 * generation of the command that started them; results from another generation, or arriving in a
 * phase that is not waiting for them, are dropped.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. All calls must come from a single thread.
 */
public final class SessionController {

    private static final Logger LOGGER = Logger.getLogger(SessionController.class.getName());

    static final String CONFIRM_TITLE = "Unsaved Changes";

    static final String CONFIRM_MESSAGE = "You have unsaved changes. What do you want to do?";

    private static final List<ConfirmationChoice> CONFIRM_OPTIONS =
            List.of(ConfirmationChoice.SAVE, ConfirmationChoice.DISCARD, ConfirmationChoice.CANCEL);

    private final SessionConfig config;
    private final EditSession session;
    private final SessionStateMachine stateMachine;

    /**
     * Creates an idle controller.
     *
     * @param config session configuration
     */
    public SessionController(SessionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.session = new EditSession(config.maxRetries());
        this.stateMachine = new SessionStateMachine(SessionState.idle(config.maxRetries()));
    }

    /** Creates an idle controller with the default configuration. */
    public SessionController() {
        this(SessionConfig.defaults());
    }

    /**
     * Processes one message.
     *
     * @param message the message to process
     * @return the commands to execute, in order; empty when the message was ignored
     */
    public List<SessionCommand> handle(SessionMessage message) {
        Objects.requireNonNull(message, "message");
        List<SessionCommand> commands = new ArrayList<>(2);
        dispatch(message, commands);
        stateMachine.publish(snapshot());
        return commands;
    }

    private void dispatch(SessionMessage message, List<SessionCommand> out) {
        if (message instanceof SessionMessage.LoadBlock load) {
            onLoadBlock(load, out);
        } else if (message instanceof SessionMessage.UserEdit edit) {
            onUserEdit(edit);
        } else if (message instanceof SessionMessage.SaveRequested) {
            onSaveRequested(out);
        } else if (message instanceof SessionMessage.RefreshRequested) {
            onRefreshRequested(out);
        } else if (message instanceof SessionMessage.TransformRequested transform) {
            onTransformRequested(transform, out);
        } else if (message instanceof SessionMessage.ExitRequested) {
            onExitRequested(out);
        } else if (message instanceof SessionMessage.ConfirmationAnswered answer) {
            onConfirmationAnswered(answer, out);
        } else if (message instanceof SessionMessage.ErrorAcknowledged ack) {
            onErrorAcknowledged(ack, out);
        } else if (message instanceof SessionMessage.NavigationRequested nav) {
            out.add(new SessionCommand.Navigate(nav.signal()));
        } else if (message instanceof SessionMessage.FetchSucceeded fetched) {
            onFetchSucceeded(fetched, out);
        } else if (message instanceof SessionMessage.FetchFailed failed) {
            onFetchFailed(failed, out);
        } else if (message instanceof SessionMessage.SaveSucceeded saved) {
            onSaveSucceeded(saved, out);
        } else if (message instanceof SessionMessage.SaveFailed failed) {
            onSaveFailed(failed, out);
        } else if (message instanceof SessionMessage.RetryTimerFired timer) {
            onRetryTimerFired(timer, out);
        } else if (message instanceof SessionMessage.IndicatorTimerFired timer) {
            onIndicatorTimerFired(timer);
        } else {
            throw new IllegalArgumentException("Unknown session message: " + message);
        }
    }

    // ========== User intents ==========

    private void onLoadBlock(SessionMessage.LoadBlock load, List<SessionCommand> out) {
        if (phase() == SessionPhase.SAVING) {
            ignore(load);
            return;
        }
        boolean hadError = session.error != null;
        session.reset(load.blockId(), load.pageId());
        stateMachine.transitionTo(SessionPhase.LOADING);
        if (hadError) {
            out.add(new SessionCommand.ClearError());
        }
        out.add(new SessionCommand.Fetch(session.generation, session.blockId));
    }

    private void onUserEdit(SessionMessage.UserEdit edit) {
        if (phase() != SessionPhase.EDITING) {
            ignore(edit);
            return;
        }
        session.draft.setText(edit.text());
        if (session.isDirty()) {
            session.indicator = StatusIndicator.NONE;
        }
    }

    private void onSaveRequested(List<SessionCommand> out) {
        if (phase() != SessionPhase.EDITING) {
            LOGGER.fine(() -> "Save ignored in " + phase());
            return;
        }
        startSave(out);
    }

    private void onTransformRequested(
            SessionMessage.TransformRequested transform, List<SessionCommand> out) {
        if (phase() != SessionPhase.EDITING) {
            ignore(transform);
            return;
        }
        // one slot: a newer request replaces an unsaved older one
        session.pendingBlockType = transform.type();
        startSave(out);
    }

    private void onRefreshRequested(List<SessionCommand> out) {
        SessionPhase phase = phase();
        if (session.blockId == null
                || phase == SessionPhase.IDLE
                || phase.isSaving()
                || phase == SessionPhase.EXITED) {
            LOGGER.fine(() -> "Refresh ignored in " + phase);
            return;
        }
        boolean hadError = session.error != null;
        session.pendingBlockType = null;
        session.retryAttempt = 0;
        session.retryDelay = Duration.ZERO;
        session.quitAfterSave = false;
        session.inFlight = null;
        session.error = null;
        session.indicator = StatusIndicator.NONE;
        if (session.draft != null) {
            session.draft.setText(session.baselineText);
            session.draft.markClean();
        }
        session.refreshing = session.draft != null;
        session.generation++;
        stateMachine.transitionTo(SessionPhase.LOADING);
        if (hadError) {
            out.add(new SessionCommand.ClearError());
        }
        out.add(new SessionCommand.Fetch(session.generation, session.blockId));
    }

    private void onExitRequested(List<SessionCommand> out) {
        switch (phase()) {
            case EDITING -> {
                if (session.isDirty()) {
                    stateMachine.transitionTo(SessionPhase.CONFIRMING_EXIT);
                    out.add(
                            new SessionCommand.PresentConfirmation(
                                    CONFIRM_TITLE, CONFIRM_MESSAGE, CONFIRM_OPTIONS));
                } else {
                    exit(out);
                }
            }
            case IDLE, LOADING -> exit(out);
            default -> LOGGER.fine(() -> "Exit ignored in " + phase());
        }
    }

    private void onConfirmationAnswered(
            SessionMessage.ConfirmationAnswered answer, List<SessionCommand> out) {
        if (phase() != SessionPhase.CONFIRMING_EXIT) {
            ignore(answer);
            return;
        }
        switch (answer.choice()) {
            case SAVE -> {
                session.quitAfterSave = true;
                startSave(out);
            }
            case DISCARD -> exit(out);
            case CANCEL -> stateMachine.transitionTo(SessionPhase.EDITING);
        }
    }

    private void onErrorAcknowledged(
            SessionMessage.ErrorAcknowledged ack, List<SessionCommand> out) {
        ErrorReport error = session.error;
        if (phase() != SessionPhase.SHOWING_ERROR || error == null) {
            ignore(ack);
            return;
        }
        if (ack.action() == ErrorAction.RETRY) {
            if (!error.retryOffered()) {
                LOGGER.fine(() -> "Manual retry not offered for " + error.category());
                return;
            }
            session.error = null;
            out.add(new SessionCommand.ClearError());
            if (error.origin() == ErrorOrigin.SAVE) {
                session.retryAttempt = 0;
                sendSave(out);
            } else {
                session.generation++;
                stateMachine.transitionTo(SessionPhase.LOADING);
                out.add(new SessionCommand.Fetch(session.generation, session.blockId));
            }
            return;
        }
        session.error = null;
        session.quitAfterSave = false;
        out.add(new SessionCommand.ClearError());
        if (session.draft != null) {
            stateMachine.transitionTo(SessionPhase.EDITING);
        } else {
            exit(out);
        }
    }

    // ========== Asynchronous results ==========

    private void onFetchSucceeded(
            SessionMessage.FetchSucceeded fetched, List<SessionCommand> out) {
        if (isStale(fetched.generation(), SessionPhase.LOADING, fetched)) {
            return;
        }
        BlockContent content = fetched.content();
        session.baselineText = content.text();
        session.blockType = content.type();
        session.lastEditedTime = content.lastEditedTime();
        if (session.pageId == null) {
            session.pageId = content.pageId();
        }
        if (session.refreshing && session.draft != null) {
            session.draft.setText(content.text());
            session.draft.markClean();
            showIndicator(StatusIndicator.REFRESHED, out);
        } else {
            session.draft = config.draftFactory().apply(content.text());
        }
        stateMachine.transitionTo(SessionPhase.EDITING);
        LOGGER.info(() -> "Loaded block " + content.blockId() + " (" + content.type() + ")");
    }

    private void onFetchFailed(SessionMessage.FetchFailed failed, List<SessionCommand> out) {
        if (isStale(failed.generation(), SessionPhase.LOADING, failed)) {
            return;
        }
        showError(ErrorReport.of(ErrorOrigin.LOAD, failed.failure()), out);
    }

    private void onSaveSucceeded(SessionMessage.SaveSucceeded saved, List<SessionCommand> out) {
        if (isStale(saved.generation(), SessionPhase.SAVING, saved)) {
            return;
        }
        BlockUpdate update = session.inFlight;
        session.baselineText = update.text();
        session.draft.markClean();
        // the payload already carries the queued type, if any
        session.blockType = update.type();
        session.pendingBlockType = null;
        session.inFlight = null;
        session.retryAttempt = 0;
        session.retryDelay = Duration.ZERO;
        session.lastEditedTime = latest(session.lastEditedTime, saved.receipt().lastEditedTime());
        LOGGER.info(() -> "Saved block " + session.blockId + " (" + session.blockType + ")");
        if (session.quitAfterSave) {
            exit(out);
            return;
        }
        stateMachine.transitionTo(SessionPhase.EDITING);
        showIndicator(StatusIndicator.SAVED, out);
    }

    private void onSaveFailed(SessionMessage.SaveFailed failed, List<SessionCommand> out) {
        if (isStale(failed.generation(), SessionPhase.SAVING, failed)) {
            return;
        }
        ErrorClassification classification = ErrorClassifier.classification(failed.failure());
        RetryDecision decision =
                config.retryPolicy()
                        .decide(session.retryAttempt, session.maxRetries, classification);
        if (decision.shouldRetry()) {
            session.retryAttempt++;
            session.retryDelay = decision.delay();
            stateMachine.transitionTo(SessionPhase.RETRY_WAITING);
            LOGGER.log(
                    Level.WARNING,
                    "Save of block {0} failed, retry {1}/{2} in {3}ms: {4}",
                    new Object[] {
                        session.blockId,
                        session.retryAttempt,
                        session.maxRetries,
                        decision.delay().toMillis(),
                        ErrorClassifier.describeError(failed.failure())
                    });
            out.add(new SessionCommand.ScheduleRetry(session.generation, decision.delay()));
            return;
        }
        session.retryDelay = Duration.ZERO;
        showError(ErrorReport.of(ErrorOrigin.SAVE, failed.failure()), out);
    }

    private void onRetryTimerFired(
            SessionMessage.RetryTimerFired timer, List<SessionCommand> out) {
        if (isStale(timer.generation(), SessionPhase.RETRY_WAITING, timer)) {
            return;
        }
        session.retryDelay = Duration.ZERO;
        sendSave(out);
    }

    private void onIndicatorTimerFired(SessionMessage.IndicatorTimerFired timer) {
        if (timer.generation() != session.generation
                || timer.ticket() != session.indicatorTicket) {
            return;
        }
        if (phase() == SessionPhase.EDITING && !session.isDirty()) {
            session.indicator = StatusIndicator.NONE;
        }
    }

    // ========== Helpers ==========

    private void startSave(List<SessionCommand> out) {
        session.retryAttempt = 0;
        session.indicator = StatusIndicator.NONE;
        BlockType type = session.effectiveBlockType();
        session.inFlight = type.toUpdate(session.draft.getText());
        sendSave(out);
    }

    private void sendSave(List<SessionCommand> out) {
        stateMachine.transitionTo(SessionPhase.SAVING);
        out.add(new SessionCommand.Save(session.generation, session.blockId, session.inFlight));
    }

    private void showError(ErrorReport report, List<SessionCommand> out) {
        session.error = report;
        stateMachine.transitionTo(SessionPhase.SHOWING_ERROR);
        LOGGER.log(
                Level.WARNING,
                "{0} of block {1} failed ({2}): {3}",
                new Object[] {report.origin(), session.blockId, report.category(), report.message()});
        out.add(new SessionCommand.ShowError(report));
    }

    private void showIndicator(StatusIndicator indicator, List<SessionCommand> out) {
        session.indicator = indicator;
        session.indicatorTicket++;
        out.add(
                new SessionCommand.ScheduleIndicatorClear(
                        session.generation, session.indicatorTicket, config.indicatorDelay()));
    }

    private void exit(List<SessionCommand> out) {
        session.pendingBlockType = null;
        session.quitAfterSave = false;
        session.inFlight = null;
        stateMachine.transitionTo(SessionPhase.EXITED);
        out.add(new SessionCommand.Exit(session.blockId));
    }

    private boolean isStale(long generation, SessionPhase expected, SessionMessage message) {
        if (generation == session.generation && phase() == expected) {
            return false;
        }
        LOGGER.fine(
                () ->
                        "Discarding "
                                + message.getClass().getSimpleName()
                                + " for generation "
                                + generation
                                + " (current "
                                + session.generation
                                + ", "
                                + phase()
                                + ")");
        return true;
    }

    private void ignore(SessionMessage message) {
        LOGGER.fine(() -> message.getClass().getSimpleName() + " ignored in " + phase());
    }

    private static Instant latest(Instant current, Instant candidate) {
        if (current == null || candidate.isAfter(current)) {
            return candidate;
        }
        return current;
    }

    private SessionState snapshot() {
        return new SessionState(
                phase(),
                session.blockId,
                session.blockType,
                session.pendingBlockType,
                session.isDirty(),
                session.retryAttempt,
                session.maxRetries,
                session.retryDelay,
                session.refreshing,
                session.quitAfterSave,
                session.indicator,
                session.error,
                session.generation);
    }

    // ========== Accessors ==========

    /**
     * Returns the current phase.
     *
     * @return the phase
     */
    public SessionPhase phase() {
        return stateMachine.getPhase();
    }

    /**
     * Returns the snapshot published after the last message.
     *
     * @return the current state
     */
    public SessionState state() {
        return stateMachine.getPublished();
    }

    /**
     * Returns the text last known to match the remote store.
     *
     * @return the baseline, or null before a successful load
     */
    public String baselineText() {
        return session.baselineText;
    }

    /**
     * Returns the draft created by the last successful load.
     *
     * @return the draft, or null if no load has succeeded in this session
     */
    public DraftBuffer draft() {
        return session.draft;
    }

    /**
     * Returns the page containing the block.
     *
     * @return the page id given on load or reported by the store, or null if unknown
     */
    public String pageId() {
        return session.pageId;
    }

    /**
     * Returns the newest remote edit time seen through fetches and save receipts.
     *
     * @return the timestamp, or null before a successful load
     */
    public Instant lastEditedTime() {
        return session.lastEditedTime;
    }

    /**
     * Returns the configuration this controller was created with.
     *
     * @return the configuration
     */
    public SessionConfig config() {
        return config;
    }

    /**
     * Registers a listener for state snapshots.
     *
     * @param listener the listener
     */
    public void addStateListener(SessionStateListener listener) {
        stateMachine.addListener(listener);
    }

    /**
     * Removes a listener.
     *
     * @param listener the listener
     * @return true if it was registered
     */
    public boolean removeStateListener(SessionStateListener listener) {
        return stateMachine.removeListener(listener);
    }

    @Override
    public String toString() {
        return "SessionController[" + stateMachine + ", generation=" + session.generation + "]";
    }
}
