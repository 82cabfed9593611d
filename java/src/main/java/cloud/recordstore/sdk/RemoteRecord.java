package cloud.recordstore.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A record as seen through the API: its type, its remote identifier, and its fields passed through uninterpreted.
 * Field values may be {@code null}; the map keeps the order the remote side returned.
 */
public final class RemoteRecord {

    private final RecordType type;
    private final String id;
    private final Map<String, Object> fields;

    public RemoteRecord(RecordType type, String id, Map<String, ?> fields) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = id;
        this.fields = fields == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public RecordType type() {
        return type;
    }

    /**
     * @return remote identifier; {@code null} only for records whose identifier was not part of the response.
     */
    public String id() {
        return id;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public Optional<Object> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RemoteRecord)) {
            return false;
        }
        RemoteRecord that = (RemoteRecord) other;
        return type == that.type && Objects.equals(id, that.id) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id, fields);
    }

    @Override
    public String toString() {
        return "RemoteRecord[type=" + type + ", id=" + id + ", fields=" + fields.keySet() + "]";
    }
}
