package express.mvp.blocksync.session;

/** Which operation produced a displayed error. */
public enum ErrorOrigin {
    /** A fetch issued by a load or refresh. */
    LOAD,
    /** A save, including transformations and save-then-exit. */
    SAVE
}
