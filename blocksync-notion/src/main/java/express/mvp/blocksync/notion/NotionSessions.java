package express.mvp.blocksync.notion;

import express.mvp.blocksync.runtime.SessionRuntime;
import express.mvp.blocksync.session.SessionConfig;

/**
 * Entry points for editing Notion blocks.
 *
 * <pre>{@code
 * SessionRuntime runtime = NotionSessions.builder(NotionStoreConfig.fromEnvironment())
 *     .statusDisplay(statusLine)
 *     .confirmationPrompt(modal)
 *     .owner(router)
 *     .build()
 *     .start();
 * runtime.load(blockId, pageId);
 * }</pre>
 */
public final class NotionSessions {

    private NotionSessions() {
        // Utility class
    }

    /**
     * Returns a runtime builder backed by a new {@link NotionBlockStore} and the default session
     * configuration.
     *
     * @param config connection settings
     * @return a runtime builder; displays and owner still need to be set
     */
    public static SessionRuntime.Builder builder(NotionStoreConfig config) {
        return builder(config, SessionConfig.defaults());
    }

    public static SessionRuntime.Builder builder(
            NotionStoreConfig config, SessionConfig sessionConfig) {
        return SessionRuntime.builder(new NotionBlockStore(config)).config(sessionConfig);
    }
}
