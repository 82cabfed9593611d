package cloud.recordstore.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single business operation to run through {@link RecordClient#execute(OperationRequest)}. The factories enforce which
 * parts each kind carries; field values are not inspected.
 */
public final class OperationRequest {

    private final RecordType type;
    private final OperationKind kind;
    private final String id;
    private final Map<String, Object> fields;
    private final ListConstraints constraints;

    private OperationRequest(
        RecordType type,
        OperationKind kind,
        String id,
        Map<String, ?> fields,
        ListConstraints constraints
    ) {
        this.type = Objects.requireNonNull(type, "type");
        this.kind = kind;
        this.id = id;
        this.fields = fields == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.constraints = constraints;
    }

    public static OperationRequest create(RecordType type, Map<String, ?> fields) {
        return new OperationRequest(type, OperationKind.CREATE, null, requireFields(fields), null);
    }

    public static OperationRequest get(RecordType type, String id) {
        return new OperationRequest(type, OperationKind.GET, requireId(id), null, null);
    }

    public static OperationRequest update(RecordType type, String id, Map<String, ?> fields) {
        return new OperationRequest(type, OperationKind.UPDATE, requireId(id), requireFields(fields), null);
    }

    public static OperationRequest delete(RecordType type, String id) {
        return new OperationRequest(type, OperationKind.DELETE, requireId(id), null, null);
    }

    public static OperationRequest list(RecordType type, ListConstraints constraints) {
        return new OperationRequest(type, OperationKind.LIST, null, null,
            constraints == null ? ListConstraints.defaults() : constraints);
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        return id.trim();
    }

    private static Map<String, ?> requireFields(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("fields are required");
        }
        return fields;
    }

    public RecordType type() {
        return type;
    }

    public OperationKind kind() {
        return kind;
    }

    public String id() {
        return id;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public ListConstraints constraints() {
        return constraints;
    }

    @Override
    public String toString() {
        return "OperationRequest[" + kind + " " + type.objectName() + (id == null ? "" : " " + id) + "]";
    }
}
