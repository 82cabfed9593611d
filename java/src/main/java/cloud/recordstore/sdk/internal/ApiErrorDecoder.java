package cloud.recordstore.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cloud.recordstore.sdk.AuthException;
import cloud.recordstore.sdk.NotFoundException;
import cloud.recordstore.sdk.RateLimitedException;
import cloud.recordstore.sdk.RecordApiException;
import cloud.recordstore.sdk.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Decodes and classifies error payloads returned by the record API and the token endpoint.
 *
 * <p>
 * The record API reports errors as {@code [{"message": "...", "errorCode": "..."}]}. The error code wins over the HTTP
 * status: {@code INVALID_SESSION_ID} is a session failure whatever status accompanies it, and a different code at the
 * same status is classified by that code.
 * </p>
 */
public final class ApiErrorDecoder {

    public static final String INVALID_SESSION_ID = "INVALID_SESSION_ID";

    private static final Set<String> NOT_FOUND_CODES = Set.of("NOT_FOUND", "ENTITY_IS_DELETED");
    private static final Set<String> RATE_LIMIT_CODES = Set.of("REQUEST_LIMIT_EXCEEDED");

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static RecordApiException decode(HttpResponse<InputStream> response) throws IOException {
        String retryAfter = response.headers().firstValue("Retry-After").orElse(null);
        try (InputStream body = response.body()) {
            return decode(response.statusCode(), body, retryAfter);
        }
    }

    public static RecordApiException decode(int statusCode, InputStream bodyStream, String retryAfter) throws IOException {
        byte[] bytes = bodyStream == null ? new byte[0] : bodyStream.readAllBytes();
        String code = null;
        String message = null;
        if (bytes.length > 0) {
            try {
                JsonNode entry = errorEntry(MAPPER.readTree(bytes));
                if (entry != null) {
                    code = errorCode(entry);
                    message = text(entry, "message");
                }
            } catch (IOException ex) {
                message = new String(bytes, StandardCharsets.UTF_8);
            }
        }
        return classify(statusCode, code, message, retryAfter);
    }

    /**
     * Classifies an error list delivered with a success status. Returns {@code null} when the body is an ordinary
     * payload without an {@code errorCode}.
     */
    public static RecordApiException decodeEmbedded(int statusCode, JsonNode body, String retryAfter) {
        JsonNode entry = errorEntry(body);
        if (entry == null || !entry.hasNonNull("errorCode")) {
            return null;
        }
        return classify(statusCode, errorCode(entry), text(entry, "message"), retryAfter);
    }

    /**
     * Picks the entry that decides classification: an {@code INVALID_SESSION_ID} entry anywhere in the list,
     * otherwise the first one.
     */
    private static JsonNode errorEntry(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            return node;
        }
        if (!node.isArray()) {
            return null;
        }
        for (JsonNode element : node) {
            if (element.isObject() && INVALID_SESSION_ID.equals(errorCode(element))) {
                return element;
            }
        }
        JsonNode first = node.path(0);
        return first.isObject() ? first : null;
    }

    private static String errorCode(JsonNode entry) {
        String code = text(entry, "errorCode");
        return code != null ? code : text(entry, "code");
    }

    static RecordApiException classify(int statusCode, String code, String message, String retryAfter) {
        if (INVALID_SESSION_ID.equals(code)) {
            return new SessionInvalidException(statusCode, code, message);
        }
        if (code != null && RATE_LIMIT_CODES.contains(code)) {
            return new RateLimitedException(statusCode, code, message, retryAfter);
        }
        if (code != null && NOT_FOUND_CODES.contains(code)) {
            return new NotFoundException(statusCode, code, message);
        }
        if (statusCode == 429) {
            return new RateLimitedException(statusCode, code, message, retryAfter);
        }
        if (statusCode == 404) {
            return new NotFoundException(statusCode, code, message);
        }
        if (statusCode >= 400 && statusCode < 500) {
            return new ValidationException(statusCode, code, message);
        }
        return new RecordApiException(statusCode, code, message);
    }

    /**
     * Builds the failure for a non-success token endpoint response ({@code {"error": ..., "error_description": ...}}).
     */
    public static AuthException decodeTokenError(int statusCode, InputStream bodyStream) throws IOException {
        byte[] bytes = bodyStream == null ? new byte[0] : bodyStream.readAllBytes();
        String code = null;
        String description = null;
        if (bytes.length > 0) {
            try {
                JsonNode node = MAPPER.readTree(bytes);
                if (node != null && node.isObject()) {
                    code = text(node, "error");
                    description = text(node, "error_description");
                }
            } catch (IOException ex) {
                description = new String(bytes, StandardCharsets.UTF_8);
            }
        }
        StringBuilder message = new StringBuilder("token refresh failed with status ").append(statusCode);
        if (code != null) {
            message.append(" (").append(code).append(')');
        }
        if (description != null && !description.isBlank()) {
            message.append(": ").append(description);
        }
        return new AuthException(message.toString(), statusCode, code, null);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
