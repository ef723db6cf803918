package express.mvp.blocksync.notion;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.blocksync.block.BlockContent;
import express.mvp.blocksync.block.BlockUpdate;
import express.mvp.blocksync.store.RemoteContentStore;
import express.mvp.blocksync.store.RemoteStoreException;
import express.mvp.blocksync.store.SaveReceipt;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link RemoteContentStore} backed by the Notion blocks API.
 *
 * <ul>
 *   <li>{@code GET /v1/blocks/{id}} for fetches
 *   <li>{@code PATCH /v1/blocks/{id}} for saves
 * </ul>
 *
 * <p>Non-2xx responses become {@link RemoteStoreException}s carrying the HTTP status and the
 * API's error code; I/O failures are wrapped with their cause intact so that timeouts and refused
 * connections classify as transient.
 *
 * <p>Calls block the calling thread. The store is thread-safe and should be shared.
 */
public final class NotionBlockStore implements RemoteContentStore {

    private static final Logger LOGGER = Logger.getLogger(NotionBlockStore.class.getName());

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final NotionStoreConfig config;
    private final OkHttpClient client;
    private final NotionBlockCodec codec;
    private final HttpUrl blocksUrl;

    public NotionBlockStore(NotionStoreConfig config) {
        this(
                config,
                new OkHttpClient.Builder()
                        .connectTimeout(config.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .readTimeout(config.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .build(),
                new NotionBlockCodec());
    }

    /**
     * Creates a store with a caller-supplied client, e.g. one sharing a connection pool.
     *
     * @param config connection settings
     * @param client the HTTP client
     * @param codec the JSON codec
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "OkHttpClient is shared by design and immutable once built.")
    public NotionBlockStore(NotionStoreConfig config, OkHttpClient client, NotionBlockCodec codec) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = Objects.requireNonNull(client, "client");
        this.codec = Objects.requireNonNull(codec, "codec");
        HttpUrl base = HttpUrl.parse(config.getBaseUrl());
        if (base == null) {
            throw new IllegalArgumentException("Invalid base URL: " + config.getBaseUrl());
        }
        this.blocksUrl = base.newBuilder().addPathSegment("v1").addPathSegment("blocks").build();
    }

    @Override
    public BlockContent fetch(String blockId) {
        Request request = newRequest(blockId).get().build();
        BlockContent content = codec.decodeBlock(execute(request, "fetch", blockId));
        LOGGER.fine(() -> "Fetched block " + blockId + " (" + content.type() + ")");
        return content;
    }

    @Override
    public SaveReceipt save(String blockId, BlockUpdate update) {
        Objects.requireNonNull(update, "update");
        RequestBody body = RequestBody.create(codec.encodeUpdate(update), JSON);
        Request request = newRequest(blockId).patch(body).build();
        return codec.decodeReceipt(execute(request, "save", blockId));
    }

    private Request.Builder newRequest(String blockId) {
        Objects.requireNonNull(blockId, "blockId");
        HttpUrl url = blocksUrl.newBuilder().addPathSegment(blockId).build();
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + config.getToken())
                .header("Notion-Version", config.getApiVersion())
                .header("Accept", "application/json");
    }

    private String execute(Request request, String operation, String blockId) {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                RemoteStoreException error = codec.decodeError(response.code(), body);
                LOGGER.log(
                        Level.FINE,
                        "Notion {0} of {1} failed: {2}",
                        new Object[] {operation, blockId, error.getMessage()});
                throw error;
            }
            return body;
        } catch (IOException e) {
            throw new RemoteStoreException(
                    "Notion " + operation + " of " + blockId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "NotionBlockStore[" + blocksUrl + "]";
    }
}
