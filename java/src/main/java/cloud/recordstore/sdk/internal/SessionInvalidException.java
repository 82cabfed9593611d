package cloud.recordstore.sdk.internal;

import cloud.recordstore.sdk.RecordApiException;

/**
 * Signals that the record API rejected the presented access token. Only {@code RecordClient} handles this type: it
 * triggers one token refresh and one retry, and is escalated to an {@code AuthException} if the retry fails the same way.
 */
public final class SessionInvalidException extends RecordApiException {

    private static final long serialVersionUID = 1L;

    public SessionInvalidException(int statusCode, String code, String message) {
        super(statusCode, code, message);
    }
}
