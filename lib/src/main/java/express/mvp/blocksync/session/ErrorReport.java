package express.mvp.blocksync.session;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.blocksync.error.ErrorCategory;
import express.mvp.blocksync.error.ErrorClassification;
import express.mvp.blocksync.error.ErrorClassifier;
import java.util.Objects;

/**
 * A classified failure as displayed to the user.
 *
 * <p>Manual retry is offered only when the final failure was transient, i.e. automatic retries
 * were exhausted. Permanent failures offer dismissal only.
 *
 * @param origin the operation that failed
 * @param category the classified category
 * @param retryOffered whether the error display should offer manual retry
 * @param message the failure message for display
 * @param cause the failure itself
 */
@SuppressFBWarnings(
        value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
        justification = "Throwable is kept for diagnostics and cannot be safely copied.")
public record ErrorReport(
        ErrorOrigin origin,
        ErrorCategory category,
        boolean retryOffered,
        String message,
        Throwable cause) {

    public ErrorReport {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(message, "message");
    }

    /**
     * Classifies a failure into a report.
     *
     * @param origin the operation that failed
     * @param failure the failure
     * @return the report, offering retry iff the failure is transient
     */
    public static ErrorReport of(ErrorOrigin origin, Throwable failure) {
        ErrorCategory category = ErrorClassifier.classify(failure);
        String message = failure == null || failure.getMessage() == null
                ? category.description()
                : failure.getMessage();
        return new ErrorReport(origin, category, category.isRetryable(), message, failure);
    }

    /**
     * Returns the classification of the category.
     *
     * @return transient or permanent
     */
    public ErrorClassification classification() {
        return category.classification();
    }
}
