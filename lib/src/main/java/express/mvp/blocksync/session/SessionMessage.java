package express.mvp.blocksync.session;

import express.mvp.blocksync.block.BlockContent;
import express.mvp.blocksync.block.BlockType;
import express.mvp.blocksync.store.SaveReceipt;
import java.util.Objects;

/**
 * Inbound messages processed by {@link SessionController}, one at a time and in delivery order.
 *
 * <p>User intents carry no generation. Results of asynchronous work carry the generation of the
 * command that started it, so that results from a superseded load are recognised and dropped.
 */
public sealed interface SessionMessage {

    /** Start editing a block, replacing whatever session was active. */
    record LoadBlock(String blockId, String pageId) implements SessionMessage {
        public LoadBlock {
            Objects.requireNonNull(blockId, "blockId");
        }

        public LoadBlock(String blockId) {
            this(blockId, null);
        }
    }

    /** The draft text as the user left it after an edit. */
    record UserEdit(String text) implements SessionMessage {
        public UserEdit {
            Objects.requireNonNull(text, "text");
        }
    }

    record SaveRequested() implements SessionMessage {}

    record RefreshRequested() implements SessionMessage {}

    /** Change the block's structural type through the next save. */
    record TransformRequested(BlockType type) implements SessionMessage {
        public TransformRequested {
            Objects.requireNonNull(type, "type");
        }
    }

    record ExitRequested() implements SessionMessage {}

    record ConfirmationAnswered(ConfirmationChoice choice) implements SessionMessage {
        public ConfirmationAnswered {
            Objects.requireNonNull(choice, "choice");
        }
    }

    record ErrorAcknowledged(ErrorAction action) implements SessionMessage {
        public ErrorAcknowledged {
            Objects.requireNonNull(action, "action");
        }
    }

    /** Explicit navigation key; forwarded to the owner whatever the phase. */
    record NavigationRequested(NavigationSignal signal) implements SessionMessage {
        public NavigationRequested {
            Objects.requireNonNull(signal, "signal");
        }
    }

    record FetchSucceeded(long generation, BlockContent content) implements SessionMessage {
        public FetchSucceeded {
            Objects.requireNonNull(content, "content");
        }
    }

    record FetchFailed(long generation, Throwable failure) implements SessionMessage {
        public FetchFailed {
            Objects.requireNonNull(failure, "failure");
        }
    }

    record SaveSucceeded(long generation, SaveReceipt receipt) implements SessionMessage {
        public SaveSucceeded {
            Objects.requireNonNull(receipt, "receipt");
        }
    }

    record SaveFailed(long generation, Throwable failure) implements SessionMessage {
        public SaveFailed {
            Objects.requireNonNull(failure, "failure");
        }
    }

    record RetryTimerFired(long generation) implements SessionMessage {}

    /** Only the ticket of the most recently shown indicator clears it. */
    record IndicatorTimerFired(long generation, long ticket) implements SessionMessage {}
}
