/**
 * Notion adapter: an HTTP {@link express.mvp.blocksync.store.RemoteContentStore} for the blocks
 * API and factory methods wiring it into a session runtime.
 */
package express.mvp.blocksync.notion;
