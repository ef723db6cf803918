package express.mvp.blocksync.display;

import express.mvp.blocksync.session.ErrorReport;

/** Renders a classified error, with a retry affordance when {@link ErrorReport#retryOffered()}. */
public interface ErrorDisplay {

    void show(ErrorReport report);

    void clear();
}
