package cloud.recordstore.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import cloud.recordstore.sdk.auth.AccessToken;
import cloud.recordstore.sdk.auth.RefreshTokenManager;
import cloud.recordstore.sdk.auth.TokenProvider;
import cloud.recordstore.sdk.internal.ApiErrorDecoder;
import cloud.recordstore.sdk.internal.HttpUtil;
import cloud.recordstore.sdk.internal.Json;
import cloud.recordstore.sdk.internal.SessionInvalidException;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for reading and writing records (contacts and appointments) in the remote record store. The
 * client is thread-safe: create a single instance per process and reuse it for the lifetime of the JVM.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Acquires an access token lazily on first use and reuses it until the record API rejects it.</li>
 *   <li>When a call is rejected with {@code INVALID_SESSION_ID}, refreshes the token once and replays the call once.
 *       A second rejection is reported as {@link AuthException}; no third attempt is made.</li>
 *   <li>Any other failure (validation, not found, throttling, transport) is thrown immediately without a refresh.</li>
 *   <li>Concurrent callers that hit an expired session share a single token refresh.</li>
 * </ul>
 */
public final class RecordClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RecordClient.class.getName());

    static final int MAX_ATTEMPTS = 2;

    private final Config config;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final TokenProvider tokenProvider;

    /**
     * Constructs a client that exchanges the configured refresh token for access tokens.
     *
     * @param config caller-supplied configuration; defaults are applied to a copy.
     */
    public RecordClient(Config config) {
        this(config, null);
    }

    /**
     * Constructs a client using a caller-supplied token source.
     *
     * @param tokenProvider token source; when {@code null} a {@link RefreshTokenManager} is created from {@code config}.
     */
    public RecordClient(Config config, TokenProvider tokenProvider) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.httpClient = this.config.getHttpClient();
        this.requestTimeout = this.config.getHttpTimeout();
        this.tokenProvider = tokenProvider != null ? tokenProvider : new RefreshTokenManager(
            this.httpClient,
            this.config.getTokenUrl(),
            this.config.credentials(),
            this.requestTimeout
        );
    }

    /**
     * Eagerly obtains an access token so that credential problems surface at startup instead of on the first call.
     *
     * @throws AuthException when the token endpoint refuses the refresh token or cannot be reached.
     */
    public void init() throws AuthException {
        tokenProvider.currentToken();
    }

    // Contacts

    public RemoteRecord createContact(Map<String, ?> fields) throws RecordStoreException {
        return create(RecordType.CONTACT, fields);
    }

    public RemoteRecord createContact(ContactFields fields) throws RecordStoreException {
        return create(RecordType.CONTACT, Objects.requireNonNull(fields, "fields").toFields());
    }

    public RemoteRecord getContact(String id) throws RecordStoreException {
        return get(RecordType.CONTACT, id);
    }

    public RemoteRecord updateContact(String id, Map<String, ?> fields) throws RecordStoreException {
        return update(RecordType.CONTACT, id, fields);
    }

    public RemoteRecord updateContact(String id, ContactFields fields) throws RecordStoreException {
        return update(RecordType.CONTACT, id, Objects.requireNonNull(fields, "fields").toFields());
    }

    public void deleteContact(String id) throws RecordStoreException {
        delete(RecordType.CONTACT, id);
    }

    public List<RemoteRecord> listContacts(int limit) throws RecordStoreException {
        return list(RecordType.CONTACT, ListConstraints.limit(limit));
    }

    public List<RemoteRecord> listContacts(ListConstraints constraints) throws RecordStoreException {
        return list(RecordType.CONTACT, constraints);
    }

    // Appointments (Event sObject)

    public RemoteRecord createEvent(Map<String, ?> fields) throws RecordStoreException {
        return create(RecordType.EVENT, fields);
    }

    public RemoteRecord createEvent(EventFields fields) throws RecordStoreException {
        return create(RecordType.EVENT, Objects.requireNonNull(fields, "fields").toFields());
    }

    public RemoteRecord getEvent(String id) throws RecordStoreException {
        return get(RecordType.EVENT, id);
    }

    public RemoteRecord updateEvent(String id, Map<String, ?> fields) throws RecordStoreException {
        return update(RecordType.EVENT, id, fields);
    }

    public RemoteRecord updateEvent(String id, EventFields fields) throws RecordStoreException {
        return update(RecordType.EVENT, id, Objects.requireNonNull(fields, "fields").toFields());
    }

    public void deleteEvent(String id) throws RecordStoreException {
        delete(RecordType.EVENT, id);
    }

    public List<RemoteRecord> listEvents(int limit) throws RecordStoreException {
        return list(RecordType.EVENT, ListConstraints.limit(limit));
    }

    public List<RemoteRecord> listEvents(ListConstraints constraints) throws RecordStoreException {
        return list(RecordType.EVENT, constraints);
    }

    /**
     * Runs a pre-built operation. This is the single entry point used by dispatch layers that route named tools to the
     * client.
     *
     * @param request operation to run.
     * @return the success payload matching the request kind.
     * @throws RecordStoreException classified failure; see {@link RecordClient} for the retry rules.
     */
    public OperationResult execute(OperationRequest request) throws RecordStoreException {
        Objects.requireNonNull(request, "request");
        RecordType type = request.type();
        switch (request.kind()) {
            case CREATE:
                return OperationResult.ofRecord(OperationKind.CREATE, create(type, request.fields()));
            case GET:
                return OperationResult.ofRecord(OperationKind.GET, get(type, request.id()));
            case UPDATE:
                return OperationResult.ofRecord(OperationKind.UPDATE, update(type, request.id(), request.fields()));
            case DELETE:
                delete(type, request.id());
                return OperationResult.deleted(request.id());
            case LIST:
                return OperationResult.listed(list(type, request.constraints()));
            default:
                throw new IllegalArgumentException("unsupported operation " + request.kind());
        }
    }

    /**
     * Creates a record and returns it with its new identifier and the submitted fields.
     */
    public RemoteRecord create(RecordType type, Map<String, ?> fields) throws RecordStoreException {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(fields, "fields");
        String action = "create " + type.objectName();

        JsonNode node = invoke(action, "POST", objectPath(type), fields);
        String id = node.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new TransportException(action + " response missing id");
        }
        LOGGER.info(() -> String.format(Locale.ROOT, "[recordstore-sdk] created %s %s", type.objectName(), id));
        return new RemoteRecord(type, id, fields);
    }

    public RemoteRecord get(RecordType type, String id) throws RecordStoreException {
        Objects.requireNonNull(type, "type");
        String action = "get " + type.objectName();

        JsonNode node = invoke(action, "GET", recordPath(type, id), null);
        if (!node.isObject()) {
            throw new TransportException(action + " response is not a JSON object");
        }
        return toRecord(type, node, id);
    }

    /**
     * Applies a partial update. The returned record carries only the fields that were sent.
     */
    public RemoteRecord update(RecordType type, String id, Map<String, ?> fields) throws RecordStoreException {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(fields, "fields");
        invoke("update " + type.objectName(), "PATCH", recordPath(type, id), fields);
        return new RemoteRecord(type, id, fields);
    }

    /**
     * Deletes a record. Deleting an identifier that no longer resolves throws {@link NotFoundException}.
     */
    public void delete(RecordType type, String id) throws RecordStoreException {
        Objects.requireNonNull(type, "type");
        invoke("delete " + type.objectName(), "DELETE", recordPath(type, id), null);
        LOGGER.info(() -> String.format(Locale.ROOT, "[recordstore-sdk] deleted %s %s", type.objectName(), id));
    }

    /**
     * Lists the most recent records of a type, in the order the remote side returns them, never more than the limit.
     */
    public List<RemoteRecord> list(RecordType type, ListConstraints constraints) throws RecordStoreException {
        Objects.requireNonNull(type, "type");
        ListConstraints resolved = constraints == null ? ListConstraints.defaults() : constraints;

        QueryResult result = query(listQuery(type, resolved));
        List<RemoteRecord> records = new ArrayList<>(Math.min(result.records().size(), resolved.limit()));
        for (Map<String, Object> fields : result.records()) {
            if (records.size() >= resolved.limit()) {
                break;
            }
            Object id = fields.get("Id");
            records.add(new RemoteRecord(type, id == null ? null : id.toString(), fields));
        }
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[recordstore-sdk] listed %d %s records", records.size(), type.objectName()));
        return records;
    }

    /**
     * Runs a raw query and returns the response as-is. Only the first page is returned.
     */
    public QueryResult query(String soql) throws RecordStoreException {
        if (soql == null || soql.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }

        JsonNode node = invoke("query", "GET", "/query?q=" + HttpUtil.encode(soql), null);
        JsonNode recordsNode = node.path("records");
        List<Map<String, Object>> records = new ArrayList<>();
        if (recordsNode.isArray()) {
            for (JsonNode item : recordsNode) {
                if (item.isObject()) {
                    records.add(Json.toFieldMap(item));
                }
            }
        }
        int totalSize = node.path("totalSize").asInt(records.size());
        boolean done = node.path("done").asBoolean(true);
        return new QueryResult(totalSize, done, records);
    }

    /**
     * Closes the client. Currently a no-op because the underlying {@link HttpClient} does not require explicit shutdown.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    static String listQuery(RecordType type, ListConstraints constraints) {
        StringBuilder soql = new StringBuilder("SELECT ")
            .append(String.join(", ", type.listColumns()))
            .append(" FROM ")
            .append(type.objectName());
        constraints.filterCondition().ifPresent(filter -> soql.append(" WHERE ").append(filter));
        soql.append(" ORDER BY ").append(type.listOrderColumn()).append(" DESC")
            .append(" LIMIT ").append(constraints.limit());
        return soql.toString();
    }

    private static String objectPath(RecordType type) {
        return "/sobjects/" + type.objectName();
    }

    private static String recordPath(RecordType type, String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        return objectPath(type) + "/" + HttpUtil.encodePathSegment(id.trim());
    }

    private static RemoteRecord toRecord(RecordType type, JsonNode node, String requestedId) {
        Map<String, Object> fields = Json.toFieldMap(node);
        Object id = fields.get("Id");
        return new RemoteRecord(type, id == null ? requestedId : id.toString(), fields);
    }

    /**
     * Sends an authenticated call, refreshing the token and replaying the call once if the session was rejected.
     */
    private JsonNode invoke(String action, String method, String path, Object payload) throws RecordStoreException {
        AccessToken token = tokenProvider.currentToken();
        for (int attempt = 1; ; attempt++) {
            try {
                return send(action, token, method, path, payload);
            } catch (SessionInvalidException ex) {
                if (attempt >= MAX_ATTEMPTS) {
                    LOGGER.warning(() -> "[recordstore-sdk] " + action + ": session rejected again after token refresh");
                    throw new AuthException(action + ": session still invalid after token refresh",
                        ex.getStatusCode(), ex.getCode(), ex);
                }
                LOGGER.info(() -> "[recordstore-sdk] " + action + ": session rejected; refreshing token and retrying once");
                token = tokenProvider.refresh(token);
            }
        }
    }

    private JsonNode send(String action, AccessToken token, String method, String path, Object payload)
        throws RecordStoreException {

        String url = apiBaseUrl(token) + path;
        LOGGER.fine(() -> "[recordstore-sdk] " + method + " " + path);

        HttpResponse<InputStream> response;
        try {
            response = HttpUtil.sendJson(httpClient, method, url, payload, token.getValue(), requestTimeout);
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new TransportException(action + " interrupted", ex);
            }
            throw new TransportException(action + " request: " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            RecordApiException error;
            try {
                error = ApiErrorDecoder.decode(response);
            } catch (IOException ex) {
                throw new TransportException(action + " read error response: " + ex.getMessage(), ex);
            }
            throw logged(action, status, error);
        }

        JsonNode body;
        try (InputStream bodyStream = response.body()) {
            byte[] bytes = bodyStream.readAllBytes();
            if (bytes.length == 0) {
                return MissingNode.getInstance();
            }
            body = Json.mapper().readTree(bytes);
        } catch (IOException ex) {
            throw new TransportException("decode " + action + " response: " + ex.getMessage(), ex);
        }

        // an error list can arrive with a success status; the error code still decides
        RecordApiException embedded = ApiErrorDecoder.decodeEmbedded(
            status, body, response.headers().firstValue("Retry-After").orElse(null));
        if (embedded != null) {
            throw logged(action, status, embedded);
        }
        return body;
    }

    private static RecordApiException logged(String action, int status, RecordApiException error) {
        String code = error.getCode();
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[recordstore-sdk] %s failed with status %d (%s)", action, status, code));
        return error;
    }

    private String apiBaseUrl(AccessToken token) {
        String instance = token.getInstanceUrl().orElse(config.getInstanceUrl());
        return instance + "/services/data/" + config.getApiVersion();
    }
}
