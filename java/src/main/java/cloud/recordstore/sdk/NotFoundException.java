package cloud.recordstore.sdk;

/**
 * The identifier does not resolve to a record, including records that were already deleted.
 */
public final class NotFoundException extends RecordApiException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(int statusCode, String code, String message) {
        super(statusCode, code, message);
    }
}
