/**
 * Display collaborators and the listener that drives the status line from session snapshots.
 */
package express.mvp.blocksync.display;
