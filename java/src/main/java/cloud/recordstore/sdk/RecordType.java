package cloud.recordstore.sdk;

import java.util.List;

/**
 * Record types exposed by the client, each mapped to the remote sObject it lives in.
 */
public enum RecordType {

    CONTACT("Contact", List.of("Id", "FirstName", "LastName", "Phone", "Email"), "CreatedDate"),
    /** Appointments are stored as {@code Event} sObjects. */
    EVENT("Event", List.of("Id", "Subject", "StartDateTime", "EndDateTime", "WhoId"), "StartDateTime");

    private final String objectName;
    private final List<String> listColumns;
    private final String listOrderColumn;

    RecordType(String objectName, List<String> listColumns, String listOrderColumn) {
        this.objectName = objectName;
        this.listColumns = listColumns;
        this.listOrderColumn = listOrderColumn;
    }

    public String objectName() {
        return objectName;
    }

    public List<String> listColumns() {
        return listColumns;
    }

    public String listOrderColumn() {
        return listOrderColumn;
    }
}
