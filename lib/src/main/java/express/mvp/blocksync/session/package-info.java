/**
 * The edit/save session core.
 *
 * <p>{@link express.mvp.blocksync.session.SessionController} consumes {@link
 * express.mvp.blocksync.session.SessionMessage}s and answers with {@link
 * express.mvp.blocksync.session.SessionCommand}s. Phases are validated by {@link
 * express.mvp.blocksync.session.SessionStateMachine}, which also publishes {@link
 * express.mvp.blocksync.session.SessionState} snapshots to listeners.
 *
 * @see express.mvp.blocksync.runtime.SessionRuntime
 */
package express.mvp.blocksync.session;
