package cloud.recordstore.sdk;

/**
 * Root of the checked failures raised by {@link RecordClient}. Callers usually catch one of the subclasses:
 * {@link AuthException} when no usable session could be established, {@link TransportException} when the record
 * API could not be reached or answered unreadably, and {@link RecordApiException} for errors the API reported.
 */
public class RecordStoreException extends Exception {

    private static final long serialVersionUID = 1L;

    protected RecordStoreException(String message) {
        super(message);
    }

    protected RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
