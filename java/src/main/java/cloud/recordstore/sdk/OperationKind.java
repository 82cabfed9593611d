package cloud.recordstore.sdk;

public enum OperationKind {
    CREATE,
    GET,
    UPDATE,
    DELETE,
    LIST
}
