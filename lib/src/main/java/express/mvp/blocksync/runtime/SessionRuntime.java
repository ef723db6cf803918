package express.mvp.blocksync.runtime;

import express.mvp.blocksync.block.BlockContent;
import express.mvp.blocksync.block.BlockType;
import express.mvp.blocksync.display.ConfirmationPrompt;
import express.mvp.blocksync.display.ErrorDisplay;
import express.mvp.blocksync.display.StatusDisplay;
import express.mvp.blocksync.display.StatusReporter;
import express.mvp.blocksync.session.ConfirmationChoice;
import express.mvp.blocksync.session.ErrorAction;
import express.mvp.blocksync.session.NavigationSignal;
import express.mvp.blocksync.session.SessionCommand;
import express.mvp.blocksync.session.SessionConfig;
import express.mvp.blocksync.session.SessionController;
import express.mvp.blocksync.session.SessionMessage;
import express.mvp.blocksync.session.SessionPhase;
import express.mvp.blocksync.session.SessionState;
import express.mvp.blocksync.session.SessionStateListener;
import express.mvp.blocksync.store.RemoteContentStore;
import express.mvp.blocksync.store.SaveReceipt;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives a {@link SessionController} with real threads.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   UI thread(s)             mailbox thread                   worker / timer threads
 *  ─────────────      ───────────────────────────────      ───────────────────────────
 *   post(msg) ──▶ queue ──▶ controller.handle(msg)
 *                                  │ commands
 *                                  ├─ Fetch / Save ─────────────▶ store.fetch / store.save
 *                                  ├─ Schedule* ────────────────▶ scheduler
 *                                  └─ Show / Present / Exit ──▶ displays, owner
 *                 queue ◀──────────────────────────────────────── result messages
 * </pre>
 *
 * <p>The controller and every display, prompt and owner callback run on the mailbox thread, one
 * message at a time. Remote calls block a worker thread and never the mailbox. Nothing but the
 * mailbox thread touches the session.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (SessionRuntime runtime = SessionRuntime.builder(store)
 *         .statusDisplay(statusLine)
 *         .errorDisplay(banner)
 *         .confirmationPrompt(modal)
 *         .owner(router)
 *         .build()
 *         .start()) {
 *     runtime.load(blockId);
 *     runtime.edit("Hello World");
 *     runtime.save();
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>{@link #post(SessionMessage)} and the convenience methods may be called from any thread.
 */
public final class SessionRuntime implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SessionRuntime.class.getName());

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

    private final RemoteContentStore store;
    private final SessionController controller;
    private final ErrorDisplay errorDisplay;
    private final ConfirmationPrompt confirmationPrompt;
    private final SessionOwner owner;

    private final BlockingQueue<SessionMessage> mailbox = new LinkedBlockingQueue<>();
    private final WorkerPool workers;
    private final ScheduledExecutorService timers;
    private final Thread mailboxThread;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private SessionRuntime(Builder builder) {
        this.store = builder.store;
        this.controller = new SessionController(builder.config);
        this.errorDisplay = builder.errorDisplay;
        this.confirmationPrompt = builder.confirmationPrompt;
        this.owner = builder.owner;
        String prefix = builder.config.workerThreadPrefix();
        this.workers = WorkerPool.create(prefix + "-io");
        this.timers =
                Executors.newSingleThreadScheduledExecutor(
                        new NamedThreadFactory(prefix + "-timer"));
        this.mailboxThread = new NamedThreadFactory(prefix + "-session").newThread(this::runLoop);
        if (builder.statusDisplay != null) {
            controller.addStateListener(new StatusReporter(builder.statusDisplay));
        }
    }

    /**
     * Creates a builder for a runtime backed by the given store.
     *
     * @param store the remote store
     * @return a new builder
     */
    public static Builder builder(RemoteContentStore store) {
        return new Builder(store);
    }

    /**
     * Starts the mailbox thread.
     *
     * @return this runtime
     * @throws IllegalStateException if already started or closed
     */
    public SessionRuntime start() {
        if (closed.get() || !started.compareAndSet(false, true)) {
            throw new IllegalStateException("Session runtime already started or closed");
        }
        mailboxThread.start();
        return this;
    }

    /**
     * Queues a message for the controller.
     *
     * @param message the message
     * @return false if the runtime is closed and the message was dropped
     */
    public boolean post(SessionMessage message) {
        Objects.requireNonNull(message, "message");
        if (closed.get()) {
            LOGGER.fine(() -> "Runtime closed, dropping " + message.getClass().getSimpleName());
            return false;
        }
        return mailbox.offer(message);
    }

    /**
     * Loads a block whose page is not known.
     *
     * @param blockId the block to load
     * @return false if the runtime is closed
     */
    public boolean load(String blockId) {
        return post(new SessionMessage.LoadBlock(blockId));
    }

    /**
     * Loads a block, replacing whatever the session was editing.
     *
     * @param blockId the block to load
     * @param pageId the page containing the block, or null if unknown
     * @return false if the runtime is closed
     */
    public boolean load(String blockId, String pageId) {
        return post(new SessionMessage.LoadBlock(blockId, pageId));
    }

    /**
     * Replaces the draft text.
     *
     * @param text the full new text
     * @return false if the runtime is closed
     */
    public boolean edit(String text) {
        return post(new SessionMessage.UserEdit(text));
    }

    /**
     * Saves the draft if it has unsaved changes.
     *
     * @return false if the runtime is closed
     */
    public boolean save() {
        return post(new SessionMessage.SaveRequested());
    }

    /**
     * Discards the draft and reloads the block from the store.
     *
     * @return false if the runtime is closed
     */
    public boolean refresh() {
        return post(new SessionMessage.RefreshRequested());
    }

    /**
     * Converts the block to another type, saving the current draft text with it.
     *
     * @param type the target type
     * @return false if the runtime is closed
     */
    public boolean transform(BlockType type) {
        return post(new SessionMessage.TransformRequested(type));
    }

    /**
     * Leaves the session, asking for confirmation first if there are unsaved changes.
     *
     * @return false if the runtime is closed
     */
    public boolean requestExit() {
        return post(new SessionMessage.ExitRequested());
    }

    /**
     * Answers the error currently shown.
     *
     * @param action retry or dismiss
     * @return false if the runtime is closed
     */
    public boolean acknowledgeError(ErrorAction action) {
        return post(new SessionMessage.ErrorAcknowledged(action));
    }

    /**
     * Forwards a navigation key to the owner.
     *
     * @param signal the key
     * @return false if the runtime is closed
     */
    public boolean navigate(NavigationSignal signal) {
        return post(new SessionMessage.NavigationRequested(signal));
    }

    /**
     * Registers a listener; it is called on the mailbox thread.
     *
     * @param listener the listener
     */
    public void addStateListener(SessionStateListener listener) {
        controller.addStateListener(listener);
    }

    /**
     * Returns the snapshot published after the last processed message.
     *
     * @return the current state
     */
    public SessionState state() {
        return controller.state();
    }

    /**
     * Returns the phase after the last processed message.
     *
     * @return the current phase
     */
    public SessionPhase phase() {
        return controller.phase();
    }

    /**
     * Returns whether the runtime was started and not yet closed.
     *
     * @return true while messages are accepted
     */
    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    /**
     * Returns the remote call counters.
     *
     * @return a snapshot of the worker pool statistics
     */
    public WorkerPool.Stats workerStats() {
        return workers.getStats();
    }

    /**
     * Stops the mailbox and drops queued messages.
     *
     * <p>Remote calls already running get up to two seconds to finish so a save is not cut off
     * mid-request; their results are discarded. Calls still running after that are interrupted.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        mailboxThread.interrupt();
        timers.shutdownNow();
        try {
            if (!workers.shutdown(SHUTDOWN_TIMEOUT)) {
                LOGGER.warning(
                        "Remote calls still running after " + SHUTDOWN_TIMEOUT + ", interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (started.get() && Thread.currentThread() != mailboxThread) {
            try {
                mailboxThread.join(SHUTDOWN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int dropped = mailbox.size();
        mailbox.clear();
        LOGGER.fine(() -> "Session runtime closed, " + dropped + " queued messages dropped");
    }

    // ========== Mailbox ==========

    private void runLoop() {
        while (!closed.get()) {
            SessionMessage message;
            try {
                message = mailbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            List<SessionCommand> commands;
            try {
                commands = controller.handle(message);
            } catch (RuntimeException e) {
                LOGGER.log(
                        Level.SEVERE,
                        "Controller failed on " + message.getClass().getSimpleName(),
                        e);
                continue;
            }
            for (SessionCommand command : commands) {
                execute(command);
            }
        }
    }

    private void execute(SessionCommand command) {
        if (command instanceof SessionCommand.Fetch fetch) {
            submit(() -> runFetch(fetch));
        } else if (command instanceof SessionCommand.Save save) {
            submit(() -> runSave(save));
        } else if (command instanceof SessionCommand.ScheduleRetry retry) {
            schedule(new SessionMessage.RetryTimerFired(retry.generation()), retry.delay());
        } else if (command instanceof SessionCommand.ScheduleIndicatorClear clear) {
            schedule(
                    new SessionMessage.IndicatorTimerFired(clear.generation(), clear.ticket()),
                    clear.delay());
        } else if (command instanceof SessionCommand.PresentConfirmation prompt) {
            presentConfirmation(prompt);
        } else if (command instanceof SessionCommand.ShowError show) {
            if (errorDisplay != null) {
                callCollaborator("error display", () -> errorDisplay.show(show.report()));
            }
        } else if (command instanceof SessionCommand.ClearError) {
            if (errorDisplay != null) {
                callCollaborator("error display", errorDisplay::clear);
            }
        } else if (command instanceof SessionCommand.Exit exit) {
            if (owner != null) {
                callCollaborator("session owner", () -> owner.onExited(exit.blockId()));
            }
        } else if (command instanceof SessionCommand.Navigate navigate) {
            if (owner != null) {
                callCollaborator("session owner", () -> owner.onNavigate(navigate.signal()));
            }
        }
    }

    /** Without a working prompt the exit is cancelled so the session does not stay gated. */
    private void presentConfirmation(SessionCommand.PresentConfirmation prompt) {
        if (confirmationPrompt == null) {
            LOGGER.warning("No confirmation prompt configured, exit with unsaved changes cancelled");
            post(new SessionMessage.ConfirmationAnswered(ConfirmationChoice.CANCEL));
            return;
        }
        try {
            confirmationPrompt.present(
                    prompt.title(),
                    prompt.message(),
                    prompt.options(),
                    choice -> post(new SessionMessage.ConfirmationAnswered(choice)));
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Confirmation prompt failed, exit cancelled", e);
            post(new SessionMessage.ConfirmationAnswered(ConfirmationChoice.CANCEL));
        }
    }

    private void runFetch(SessionCommand.Fetch fetch) {
        SessionMessage result;
        try {
            BlockContent content = store.fetch(fetch.blockId());
            result = new SessionMessage.FetchSucceeded(fetch.generation(), content);
        } catch (RuntimeException e) {
            result = new SessionMessage.FetchFailed(fetch.generation(), e);
        }
        post(result);
    }

    private void runSave(SessionCommand.Save save) {
        SessionMessage result;
        try {
            SaveReceipt receipt = store.save(save.blockId(), save.update());
            result = new SessionMessage.SaveSucceeded(save.generation(), receipt);
        } catch (RuntimeException e) {
            result = new SessionMessage.SaveFailed(save.generation(), e);
        }
        post(result);
    }

    private void submit(Runnable task) {
        if (!workers.execute(task)) {
            LOGGER.fine("Worker pool shut down, remote call dropped");
        }
    }

    private void schedule(SessionMessage message, Duration delay) {
        if (closed.get()) {
            return;
        }
        try {
            timers.schedule(() -> post(message), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.fine("Scheduler shut down, timer dropped");
        }
    }

    private static void callCollaborator(String name, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Call to " + name + " failed", e);
        }
    }

    @Override
    public String toString() {
        return "SessionRuntime[" + controller + ", queued=" + mailbox.size() + "]";
    }

    // ========== Builder ==========

    /**
     * Builder for {@link SessionRuntime}. Collaborators other than the store are optional; without
     * a confirmation prompt an exit with unsaved changes is cancelled and the session keeps editing.
     */
    public static final class Builder {

        private final RemoteContentStore store;
        private SessionConfig config = SessionConfig.defaults();
        private StatusDisplay statusDisplay;
        private ErrorDisplay errorDisplay;
        private ConfirmationPrompt confirmationPrompt;
        private SessionOwner owner;

        private Builder(RemoteContentStore store) {
            this.store = Objects.requireNonNull(store, "store");
        }

        /**
         * Sets the session configuration.
         *
         * @param config the configuration, default {@link SessionConfig#defaults()}
         * @return this builder
         */
        public Builder config(SessionConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Sets the status line; a {@link StatusReporter} feeds it from state changes.
         *
         * @param statusDisplay the display, or null for none
         * @return this builder
         */
        public Builder statusDisplay(StatusDisplay statusDisplay) {
            this.statusDisplay = statusDisplay;
            return this;
        }

        /**
         * Sets the error display.
         *
         * @param errorDisplay the display, or null for none
         * @return this builder
         */
        public Builder errorDisplay(ErrorDisplay errorDisplay) {
            this.errorDisplay = errorDisplay;
            return this;
        }

        /**
         * Sets the prompt asked before discarding unsaved changes.
         *
         * @param confirmationPrompt the prompt, or null for none
         * @return this builder
         */
        public Builder confirmationPrompt(ConfirmationPrompt confirmationPrompt) {
            this.confirmationPrompt = confirmationPrompt;
            return this;
        }

        /**
         * Sets the receiver of exit and navigation signals.
         *
         * @param owner the owner, or null for none
         * @return this builder
         */
        public Builder owner(SessionOwner owner) {
            this.owner = owner;
            return this;
        }

        /**
         * Builds the runtime; call {@link SessionRuntime#start()} to begin processing.
         *
         * @return a new, unstarted runtime
         */
        public SessionRuntime build() {
            return new SessionRuntime(this);
        }
    }
}
