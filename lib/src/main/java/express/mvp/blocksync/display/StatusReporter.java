package express.mvp.blocksync.display;

import express.mvp.blocksync.session.ConfirmationChoice;
import express.mvp.blocksync.session.SessionState;
import express.mvp.blocksync.session.SessionStateListener;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders session snapshots onto a {@link StatusDisplay}.
 *
 * <p>Only values that changed since the previous snapshot are pushed to the display.
 */
public final class StatusReporter implements SessionStateListener {

    static final String EDITING_HELP = "Ctrl+S: Save | Ctrl+R: Refresh | Esc: Cancel";

    static final String ERROR_HELP_WITH_RETRY = "r: Retry | d: Dismiss";

    static final String ERROR_HELP = "d: Dismiss";

    static final String CONFIRM_HELP = confirmHelp();

    private final StatusDisplay display;

    private String mode;
    private SyncStatus syncStatus;
    private String helpText;

    public StatusReporter(StatusDisplay display) {
        this.display = Objects.requireNonNull(display, "display");
    }

    @Override
    public void onStateChanged(SessionState previous, SessionState current) {
        render(current);
    }

    /**
     * Pushes the texts for a snapshot.
     *
     * @param state the snapshot to render
     */
    public void render(SessionState state) {
        String newMode = modeText(state);
        if (!newMode.equals(mode)) {
            mode = newMode;
            display.setMode(newMode);
        }
        SyncStatus newStatus = syncStatus(state);
        if (newStatus != syncStatus) {
            syncStatus = newStatus;
            display.setSyncStatus(newStatus);
        }
        String newHelp = helpText(state);
        if (!newHelp.equals(helpText)) {
            helpText = newHelp;
            display.setHelpText(newHelp);
        }
    }

    /**
     * Returns the mode text for a snapshot.
     *
     * @param state the snapshot
     * @return the text shown in the status line
     */
    public static String modeText(SessionState state) {
        return switch (state.phase()) {
            case IDLE -> "Idle";
            case LOADING -> state.refreshing() ? "Refreshing..." : "Loading...";
            case EDITING -> switch (state.indicator()) {
                case SAVED -> "Saved!";
                case REFRESHED -> "Refreshed";
                case NONE -> state.dirty() ? "Modified *" : "Editing";
            };
            case SAVING -> state.pendingBlockType() != null
                    ? "Converting to " + state.pendingBlockType().displayName() + "..."
                    : "Saving...";
            case RETRY_WAITING -> "Retrying in "
                    + formatDelay(state.retryDelay())
                    + "... ("
                    + state.retryAttempt()
                    + "/"
                    + state.maxRetries()
                    + ")";
            case CONFIRMING_EXIT -> "Unsaved Changes";
            case SHOWING_ERROR -> "Error";
            case EXITED -> "Closed";
        };
    }

    static SyncStatus syncStatus(SessionState state) {
        return switch (state.phase()) {
            case LOADING, SAVING, RETRY_WAITING -> SyncStatus.SYNCING;
            case SHOWING_ERROR -> SyncStatus.ERROR;
            case EDITING, CONFIRMING_EXIT -> state.dirty() ? SyncStatus.MODIFIED : SyncStatus.SYNCED;
            case IDLE, EXITED -> SyncStatus.SYNCED;
        };
    }

    static String helpText(SessionState state) {
        return switch (state.phase()) {
            case EDITING -> EDITING_HELP;
            case CONFIRMING_EXIT -> CONFIRM_HELP;
            case SHOWING_ERROR -> state.error() != null && state.error().retryOffered()
                    ? ERROR_HELP_WITH_RETRY
                    : ERROR_HELP;
            default -> "";
        };
    }

    /**
     * Formats a backoff delay the way the status line shows it: {@code 2s}, {@code 1.5s} or
     * {@code 250ms}.
     */
    static String formatDelay(Duration delay) {
        long millis = delay.toMillis();
        if (millis < 1000) {
            return millis + "ms";
        }
        if (millis % 1000 == 0) {
            return (millis / 1000) + "s";
        }
        return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
    }

    private static String confirmHelp() {
        StringBuilder sb = new StringBuilder();
        for (ConfirmationChoice choice : ConfirmationChoice.values()) {
            if (sb.length() > 0) {
                sb.append(" | ");
            }
            sb.append(choice.key()).append(": ").append(choice.label());
        }
        return sb.toString();
    }
}
