package express.mvp.blocksync.display;

/** Coarse synchronisation state shown next to the mode text. */
public enum SyncStatus {
    SYNCED,
    MODIFIED,
    SYNCING,
    ERROR
}
