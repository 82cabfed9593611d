package cloud.recordstore.sdk;

import java.util.Optional;

/**
 * The record API throttled the request. The SDK does not retry; the {@code Retry-After} hint, when the remote side sent
 * one, is passed through untouched.
 */
public final class RateLimitedException extends RecordApiException {

    private static final long serialVersionUID = 1L;

    private final String retryAfter;

    public RateLimitedException(int statusCode, String code, String message, String retryAfter) {
        super(statusCode, code, message);
        this.retryAfter = retryAfter;
    }

    /**
     * @return raw {@code Retry-After} header value (seconds or HTTP date), if present.
     */
    public Optional<String> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
