/**
 * Threads around the session controller: a mailbox thread, a worker pool for remote calls and a
 * scheduler for backoff and indicator timers.
 */
package express.mvp.blocksync.runtime;
