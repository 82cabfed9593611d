package cloud.recordstore.sdk;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed contact payload rendered with the API field names. Null components are left out, so a partially filled
 * instance works as an update payload.
 */
public record ContactFields(String firstName, String lastName, String phone, String email) {

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, "FirstName", firstName);
        putIfPresent(fields, "LastName", lastName);
        putIfPresent(fields, "Phone", phone);
        putIfPresent(fields, "Email", email);
        return fields;
    }

    static void putIfPresent(Map<String, Object> fields, String name, Object value) {
        if (value != null) {
            fields.put(name, value);
        }
    }
}
