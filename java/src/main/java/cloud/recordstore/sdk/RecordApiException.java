package cloud.recordstore.sdk;

/**
 * Exception representing an error returned by the record API. When the backend responds with a non-2xx status the
 * SDK hydrates this type (or one of its subclasses) so callers can inspect both the HTTP status and the remote error
 * code.
 */
public class RecordApiException extends RecordStoreException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public RecordApiException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the record API.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return remote error code such as {@code MALFORMED_ID} (nullable when the body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "record request failed with status " + status;
        }
        return "record request failed with status " + status + " (" + code + ")";
    }
}
