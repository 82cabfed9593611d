package cloud.recordstore.sdk;

import java.util.List;
import java.util.Map;

/**
 * Raw query response. Records are the remote JSON objects converted to maps, in remote order.
 */
public record QueryResult(int totalSize, boolean done, List<Map<String, Object>> records) {

    public QueryResult {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
