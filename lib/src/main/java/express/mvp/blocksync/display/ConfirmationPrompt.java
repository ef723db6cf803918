package express.mvp.blocksync.display;

import express.mvp.blocksync.session.ConfirmationChoice;
import java.util.List;
import java.util.function.Consumer;

/**
 * Modal question with a fixed set of choices.
 *
 * <p>{@code present} must return without waiting for the user. The selection is reported later
 * through {@code answer}, from any thread, exactly once.
 */
public interface ConfirmationPrompt {

    /**
     * Presents the prompt.
     *
     * @param title the prompt title
     * @param message the question
     * @param options the choices, in display order
     * @param answer receives the user's selection
     */
    void present(
            String title,
            String message,
            List<ConfirmationChoice> options,
            Consumer<ConfirmationChoice> answer);
}
