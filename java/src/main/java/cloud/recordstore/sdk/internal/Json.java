package cloud.recordstore.sdk.internal;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson configuration shared by the record and token calls.
 *
 * <p>
 * Record fields travel as untyped maps. Floating-point values are read as {@link java.math.BigDecimal} and
 * written in plain notation, {@code java.time} values placed in a payload are written as ISO-8601 strings, and
 * explicit {@code null} entries are sent so a caller can clear a field.
 * </p>
 */
public final class Json {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {
    };

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
        .build();

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Converts a record object into an insertion-ordered field map, keeping the server's field order.
     */
    public static Map<String, Object> toFieldMap(JsonNode node) {
        return MAPPER.convertValue(node, FIELD_MAP);
    }
}
