package cloud.recordstore.sdk;

/**
 * The record API rejected the request payload or identifier as malformed.
 */
public final class ValidationException extends RecordApiException {

    private static final long serialVersionUID = 1L;

    public ValidationException(int statusCode, String code, String message) {
        super(statusCode, code, message);
    }
}
