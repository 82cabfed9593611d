package cloud.recordstore.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link RecordClient} instances.
 */
public final class Config {

    public static final String DEFAULT_TOKEN_URL = "https://login.salesforce.com/services/oauth2/token";
    public static final String DEFAULT_API_VERSION = "v60.0";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    public static final String ENV_CLIENT_ID = "SALESFORCE_CLIENT_ID";
    public static final String ENV_CLIENT_SECRET = "SALESFORCE_CLIENT_SECRET";
    public static final String ENV_REFRESH_TOKEN = "SALESFORCE_REFRESH_TOKEN";
    public static final String ENV_INSTANCE_URL = "SALESFORCE_INSTANCE_URL";
    public static final String ENV_API_VERSION = "SALESFORCE_API_VERSION";
    public static final String ENV_TOKEN_URL = "SALESFORCE_TOKEN_URL";

    private final String instanceUrl;
    private final String apiVersion;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String refreshToken;
    private final HttpClient httpClient;
    private final Duration httpTimeout;

    private Config(Builder builder) {
        this.instanceUrl = builder.instanceUrl;
        this.apiVersion = builder.apiVersion;
        this.tokenUrl = builder.tokenUrl;
        this.clientId = builder.clientId;
        this.clientSecret = builder.clientSecret;
        this.refreshToken = builder.refreshToken;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from {@code SALESFORCE_*} variables.
     *
     * @param env variable source, typically {@link System#getenv()}.
     */
    public static Config fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
            .clientId(env.get(ENV_CLIENT_ID))
            .clientSecret(env.get(ENV_CLIENT_SECRET))
            .refreshToken(env.get(ENV_REFRESH_TOKEN))
            .instanceUrl(env.get(ENV_INSTANCE_URL))
            .apiVersion(env.get(ENV_API_VERSION))
            .tokenUrl(env.get(ENV_TOKEN_URL))
            .build();
    }

    public Config withDefaults() {
        requireValue(clientId, "ClientID");
        requireValue(clientSecret, "ClientSecret");
        requireValue(refreshToken, "RefreshToken");
        requireValue(instanceUrl, "InstanceURL");

        String resolvedInstanceUrl = sanitizeUrl(instanceUrl);
        String resolvedTokenUrl = sanitizeUrl(Optional.ofNullable(trimToNull(tokenUrl)).orElse(DEFAULT_TOKEN_URL));
        String resolvedApiVersion = Optional.ofNullable(trimToNull(apiVersion)).orElse(DEFAULT_API_VERSION);

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .instanceUrl(resolvedInstanceUrl)
            .apiVersion(resolvedApiVersion)
            .tokenUrl(resolvedTokenUrl)
            .clientId(clientId.trim())
            .clientSecret(clientSecret.trim())
            .refreshToken(refreshToken.trim())
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .buildInternal();
    }

    private static void requireValue(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * @return the credential set this configuration describes.
     */
    public Credentials credentials() {
        return new Credentials(clientId, clientSecret, refreshToken, instanceUrl, apiVersion);
    }

    public String getInstanceUrl() {
        return instanceUrl;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public static final class Builder {
        private String instanceUrl;
        private String apiVersion;
        private String tokenUrl;
        private String clientId;
        private String clientSecret;
        private String refreshToken;
        private HttpClient httpClient;
        private Duration httpTimeout;

        public Builder instanceUrl(String instanceUrl) {
            this.instanceUrl = instanceUrl;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder refreshToken(String refreshToken) {
            this.refreshToken = refreshToken;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
