/**
 * Contract for the remote store that owns block content.
 *
 * @see express.mvp.blocksync.store.RemoteContentStore
 */
package express.mvp.blocksync.store;
