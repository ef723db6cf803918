package express.mvp.blocksync.session;

import express.mvp.blocksync.block.BlockUpdate;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outbound work requested by {@link SessionController}.
 *
 * <p>The controller never performs I/O itself. Whoever drives it executes these commands and
 * feeds the outcome back as a {@link SessionMessage} tagged with the same generation.
 */
public sealed interface SessionCommand {

    /** Fetch the block; answer with {@code FetchSucceeded} or {@code FetchFailed}. */
    record Fetch(long generation, String blockId) implements SessionCommand {
        public Fetch {
            Objects.requireNonNull(blockId, "blockId");
        }
    }

    /** Save the payload; answer with {@code SaveSucceeded} or {@code SaveFailed}. */
    record Save(long generation, String blockId, BlockUpdate update) implements SessionCommand {
        public Save {
            Objects.requireNonNull(blockId, "blockId");
            Objects.requireNonNull(update, "update");
        }
    }

    /** Deliver {@code RetryTimerFired} after the delay. */
    record ScheduleRetry(long generation, Duration delay) implements SessionCommand {
        public ScheduleRetry {
            Objects.requireNonNull(delay, "delay");
        }
    }

    /** Deliver {@code IndicatorTimerFired} with the same ticket after the delay. */
    record ScheduleIndicatorClear(long generation, long ticket, Duration delay)
            implements SessionCommand {
        public ScheduleIndicatorClear {
            Objects.requireNonNull(delay, "delay");
        }
    }

    /** Ask the user to choose; answer with {@code ConfirmationAnswered}. */
    record PresentConfirmation(String title, String message, List<ConfirmationChoice> options)
            implements SessionCommand {
        public PresentConfirmation {
            Objects.requireNonNull(title, "title");
            Objects.requireNonNull(message, "message");
            options = List.copyOf(options);
        }
    }

    record ShowError(ErrorReport report) implements SessionCommand {
        public ShowError {
            Objects.requireNonNull(report, "report");
        }
    }

    record ClearError() implements SessionCommand {}

    /** The session has ended; the owner should close the editor. */
    record Exit(String blockId) implements SessionCommand {}

    record Navigate(NavigationSignal signal) implements SessionCommand {
        public Navigate {
            Objects.requireNonNull(signal, "signal");
        }
    }
}
