package cloud.recordstore.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.recordstore.sdk.AuthException;
import cloud.recordstore.sdk.Credentials;
import cloud.recordstore.sdk.internal.ApiErrorDecoder;
import cloud.recordstore.sdk.internal.HttpUtil;
import cloud.recordstore.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * TokenProvider implementation performing the OAuth refresh-token grant.
 *
 * <p>
 * The cached token is read without locking; every exchange happens under a single lock so that concurrent callers
 * never issue redundant exchanges. Callers that queued on the lock while an exchange was running take that exchange's
 * outcome, the new token or its failure. A failure is not cached: callers arriving after it start a new exchange.
 * </p>
 */
public final class RefreshTokenManager implements TokenProvider {

    private static final Logger LOGGER = Logger.getLogger(RefreshTokenManager.class.getName());
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final String tokenUrl;
    private final Credentials credentials;
    private final Duration requestTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong exchanges = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private volatile AccessToken cached;
    // guarded by lock; outcome of the most recently completed exchange when it failed
    private AuthException lastFailure;

    public RefreshTokenManager(HttpClient httpClient, String tokenUrl, Credentials credentials, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
    }

    @Override
    public AccessToken currentToken() throws AuthException {
        AccessToken current = cached;
        if (current != null) {
            return current;
        }

        long seen = completed.get();
        lock.lock();
        try {
            current = cached;
            if (current != null) {
                return current;
            }
            rethrowFailureSince(seen);
            return exchangeAndCache();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AccessToken forceRefresh() throws AuthException {
        return refresh(cached);
    }

    @Override
    public AccessToken refresh(AccessToken rejected) throws AuthException {
        long seen = completed.get();
        lock.lock();
        try {
            AccessToken current = cached;
            if (current != null && current != rejected) {
                LOGGER.fine("[recordstore-sdk] token already refreshed by a concurrent caller; reusing it");
                return current;
            }
            rethrowFailureSince(seen);
            return exchangeAndCache();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of token exchanges performed so far.
     */
    public long exchangeCount() {
        return exchanges.get();
    }

    private void rethrowFailureSince(long seen) throws AuthException {
        AuthException failure = lastFailure;
        if (failure != null && completed.get() != seen) {
            LOGGER.fine("[recordstore-sdk] token exchange failed for a concurrent caller; sharing the failure");
            throw new AuthException(failure.getMessage(), failure.getStatusCode(), failure.getCode(), failure);
        }
    }

    private AccessToken exchangeAndCache() throws AuthException {
        try {
            AccessToken fresh = exchange();
            cached = fresh;
            lastFailure = null;
            return fresh;
        } catch (AuthException ex) {
            lastFailure = ex;
            throw ex;
        } finally {
            completed.incrementAndGet();
        }
    }

    private AccessToken exchange() throws AuthException {
        long attempt = exchanges.incrementAndGet();
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[recordstore-sdk] requesting access token (exchange #%d, client %s)", attempt, credentials.clientId()));

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("client_id", credentials.clientId());
        form.put("client_secret", credentials.clientSecret());
        form.put("refresh_token", credentials.refreshToken());

        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.postForm(httpClient, tokenUrl, form, requestTimeout);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AuthException("request token interrupted", ex);
        } catch (IOException ex) {
            throw new AuthException("request token: " + ex.getMessage(), ex);
        }

        try (InputStream bodyStream = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                AuthException failure = ApiErrorDecoder.decodeTokenError(response.statusCode(), bodyStream);
                LOGGER.warning(() -> "[recordstore-sdk] " + failure.getMessage());
                throw failure;
            }

            JsonNode node = Json.mapper().readTree(bodyStream);
            String accessToken = node == null ? null : node.path("access_token").asText(null);
            if (accessToken == null || accessToken.isBlank()) {
                throw new AuthException("token response missing access_token", response.statusCode(), null, null);
            }

            String instanceUrl = node.path("instance_url").asText(null);
            if (instanceUrl != null) {
                instanceUrl = instanceUrl.isBlank() ? null : stripTrailingSlash(instanceUrl.trim());
            }
            String tokenType = node.path("token_type").asText("Bearer");

            AccessToken token = new AccessToken(accessToken, Instant.now(), instanceUrl, tokenType);
            LOGGER.info(() -> "[recordstore-sdk] access token acquired at " + token.getAcquiredAt());
            return token;
        } catch (IOException ex) {
            throw new AuthException("decode token response: " + ex.getMessage(), ex);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
