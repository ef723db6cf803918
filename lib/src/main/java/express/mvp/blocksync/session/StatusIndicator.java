package express.mvp.blocksync.session;

/** Short-lived confirmation shown after a save or refresh completes. */
public enum StatusIndicator {
    NONE,
    SAVED,
    REFRESHED
}
