package cloud.recordstore.sdk;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Successful outcome of an operation. Failures are reported as {@link RecordStoreException} subclasses instead.
 *
 * <ul>
 *   <li>CREATE, GET, UPDATE: {@link #record()} holds the record.</li>
 *   <li>DELETE: {@link #deletedId()} acknowledges the removed identifier.</li>
 *   <li>LIST: {@link #records()} holds the records in remote order.</li>
 * </ul>
 */
public final class OperationResult {

    private final OperationKind kind;
    private final RemoteRecord record;
    private final List<RemoteRecord> records;
    private final String deletedId;

    private OperationResult(OperationKind kind, RemoteRecord record, List<RemoteRecord> records, String deletedId) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.record = record;
        this.records = records == null ? List.of() : List.copyOf(records);
        this.deletedId = deletedId;
    }

    static OperationResult ofRecord(OperationKind kind, RemoteRecord record) {
        return new OperationResult(kind, Objects.requireNonNull(record, "record"), null, null);
    }

    static OperationResult deleted(String id) {
        return new OperationResult(OperationKind.DELETE, null, null, id);
    }

    static OperationResult listed(List<RemoteRecord> records) {
        return new OperationResult(OperationKind.LIST, null, records, null);
    }

    public OperationKind kind() {
        return kind;
    }

    public Optional<RemoteRecord> record() {
        return Optional.ofNullable(record);
    }

    public List<RemoteRecord> records() {
        return records;
    }

    public Optional<String> deletedId() {
        return Optional.ofNullable(deletedId);
    }
}
