package cloud.recordstore.sdk;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed appointment payload. Date-times are ISO-8601 strings with offset; {@code whoId} links the contact.
 */
public record EventFields(String subject, String startDateTime, String endDateTime, String whoId) {

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        ContactFields.putIfPresent(fields, "Subject", subject);
        ContactFields.putIfPresent(fields, "StartDateTime", startDateTime);
        ContactFields.putIfPresent(fields, "EndDateTime", endDateTime);
        ContactFields.putIfPresent(fields, "WhoId", whoId);
        return fields;
    }
}
