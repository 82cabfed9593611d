package cloud.recordstore.sdk;

/**
 * Raised when an access token cannot be obtained, or when the record API keeps rejecting the session after a
 * freshly minted token was presented. Never retried by the SDK.
 */
public final class AuthException extends RecordStoreException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public AuthException(String message) {
        this(message, 0, null, null);
    }

    public AuthException(String message, Throwable cause) {
        this(message, 0, null, cause);
    }

    public AuthException(String message, int statusCode, String code, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status returned by the token endpoint, or {@code 0} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return OAuth error code (for example {@code invalid_grant}); nullable.
     */
    public String getCode() {
        return code;
    }
}
