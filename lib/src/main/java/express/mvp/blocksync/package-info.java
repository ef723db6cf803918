/**
 * Block sync: edit one remotely stored block locally and save it back over an unreliable network.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   UI events ──┐                       ┌──▶ RemoteContentStore (fetch / save)
 *               ▼                       │
 *        ┌──────────────┐   commands    │
 *        │SessionRuntime│───────────────┼──▶ scheduler (retry / indicator timers)
 *        │  (mailbox)   │               │
 *        └──────┬───────┘               └──▶ ConfirmationPrompt, ErrorDisplay, SessionOwner
 *               │ messages
 *               ▼
 *      ┌──────────────────┐
 *      │SessionController │──▶ SessionStateMachine ──▶ StatusReporter ──▶ StatusDisplay
 *      └──────────────────┘
 * </pre>
 *
 * <h2>Packages</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.blocksync.block} - block types, content and save payloads
 *   <li>{@link express.mvp.blocksync.error} - failure classification and retry/backoff policy
 *   <li>{@link express.mvp.blocksync.store} - remote content store contract
 *   <li>{@link express.mvp.blocksync.draft} - local draft buffer
 *   <li>{@link express.mvp.blocksync.session} - the edit/save session state machine
 *   <li>{@link express.mvp.blocksync.display} - status, error and confirmation surfaces
 *   <li>{@link express.mvp.blocksync.runtime} - single-threaded message loop
 * </ul>
 */
package express.mvp.blocksync;
