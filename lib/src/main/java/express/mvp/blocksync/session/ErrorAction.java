package express.mvp.blocksync.session;

/** Ways to acknowledge a displayed error. */
public enum ErrorAction {
    /** Close the error and return to the draft. */
    DISMISS,
    /** Run the failed operation again; only honored when the error offers it. */
    RETRY
}
