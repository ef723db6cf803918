package express.mvp.blocksync.session;

/** Navigation keys the controller forwards to its owner without changing state. */
public enum NavigationSignal {
    NAVIGATE_BACK,
    ENTER_EDIT
}
