package cloud.recordstore.sdk;

/**
 * Network or decoding failure unrelated to authentication: connection refused, timeout, interruption, or a success
 * response whose body could not be parsed. Not retried by the SDK.
 */
public final class TransportException extends RecordStoreException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
