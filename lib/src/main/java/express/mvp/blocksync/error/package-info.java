/**
 * Failure classification and retry/backoff for remote store operations.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.blocksync.error.ErrorCategory} - failure taxonomy
 *   <li>{@link express.mvp.blocksync.error.ErrorClassification} - transient or permanent
 *   <li>{@link express.mvp.blocksync.error.ErrorClassifier} - maps failures to categories
 *   <li>{@link express.mvp.blocksync.error.RetryPolicy} - retry decisions and backoff delays
 * </ul>
 *
 * @see express.mvp.blocksync.session.SessionController
 */
package express.mvp.blocksync.error;
