package express.mvp.blocksync.notion;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Connection settings for {@link NotionBlockStore}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * NotionStoreConfig config = NotionStoreConfig.builder()
 *     .token(System.getenv("NOTION_TOKEN"))
 *     .readTimeout(Duration.ofSeconds(20))
 *     .build();
 * }</pre>
 *
 * @see NotionBlockStore
 */
public final class NotionStoreConfig {

    /** Public Notion API endpoint. */
    public static final String DEFAULT_BASE_URL = "https://api.notion.com";

    /** API version sent in the {@code Notion-Version} header. */
    public static final String DEFAULT_API_VERSION = "2022-06-28";

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    /** Environment variable holding the integration token. */
    public static final String TOKEN_ENV = "NOTION_TOKEN";

    /** Token variable of the {@code NOTION_TUI_} settings, read when {@value #TOKEN_ENV} is unset. */
    public static final String FALLBACK_TOKEN_ENV = "NOTION_TUI_NOTION_TOKEN";

    /** Optional environment variable overriding the base URL. */
    public static final String BASE_URL_ENV = "NOTION_API_URL";

    private final String baseUrl;
    private final String apiVersion;
    private final String token;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    private NotionStoreConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.apiVersion = builder.apiVersion;
        this.token = builder.token;
        this.connectTimeout = builder.connectTimeout;
        this.readTimeout = builder.readTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the token and optional base URL from the process environment.
     *
     * @return a configuration with default timeouts
     * @throws IllegalStateException if neither token variable is set
     */
    public static NotionStoreConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the token and optional base URL from the given variables.
     *
     * <p>The token comes from {@value #TOKEN_ENV}, or from {@value #FALLBACK_TOKEN_ENV} when the
     * former is missing or blank.
     *
     * @param env environment variables
     * @return a configuration with default timeouts
     * @throws IllegalStateException if neither token variable is set
     */
    public static NotionStoreConfig fromEnvironment(Map<String, String> env) {
        String token = env.get(TOKEN_ENV);
        if (token == null || token.isBlank()) {
            token = env.get(FALLBACK_TOKEN_ENV);
        }
        if (token == null || token.isBlank()) {
            throw new IllegalStateException(
                    TOKEN_ENV + " is not set (" + FALLBACK_TOKEN_ENV + " is also accepted)");
        }
        Builder builder = builder().token(token.trim());
        String baseUrl = env.get(BASE_URL_ENV);
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl.trim());
        }
        return builder.build();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getToken() {
        return token;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    @Override
    public String toString() {
        // token omitted
        return "NotionStoreConfig{baseUrl="
                + baseUrl
                + ", apiVersion="
                + apiVersion
                + ", connectTimeout="
                + connectTimeout.toMillis()
                + "ms, readTimeout="
                + readTimeout.toMillis()
                + "ms}";
    }

    /** Builder for {@link NotionStoreConfig}. */
    public static final class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private String apiVersion = DEFAULT_API_VERSION;
        private String token;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;

        private Builder() {}

        /**
         * Sets the API root, without the {@code /v1} suffix.
         *
         * @param baseUrl e.g. {@code https://api.notion.com}
         * @return this builder
         */
        public Builder baseUrl(String baseUrl) {
            Objects.requireNonNull(baseUrl, "baseUrl");
            this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
            return this;
        }

        public Builder token(String token) {
            this.token = Objects.requireNonNull(token, "token");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = positive(readTimeout, "readTimeout");
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return a new configuration
         * @throws IllegalArgumentException if no token was set or the base URL is not HTTP(S)
         */
        public NotionStoreConfig build() {
            if (token == null || token.isBlank()) {
                throw new IllegalArgumentException("token is required");
            }
            if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
                throw new IllegalArgumentException("baseUrl must be an http(s) URL: " + baseUrl);
            }
            return new NotionStoreConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
