package com.panelbridge.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static utility for JSON handling of panel payloads.
 *
 * <p>The panel API is loosely typed: the same field can arrive as a number, a string or be
 * missing depending on the server build, and list endpoints wrap rows in {@code Results}. The
 * accessors here absorb those variations so callers read plain Java values.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.findAndRegisterModules();
    }

    private JsonHelper() {}

    public static ObjectMapper mapper() {
        return OBJECT_MAPPER;
    }

    public static ObjectNode newObject() {
        return OBJECT_MAPPER.createObjectNode();
    }

    /** Serialize an object to JSON string. Returns null if input is null. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** Parse a JSON document. Blank input yields a {@link MissingNode}. */
    public static JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse JSON ({} chars)", json.length(), e);
            throw new IllegalStateException("JSON parse failed", e);
        }
    }

    /** Parse a JSON document, returning null instead of throwing on malformed input. */
    public static JsonNode tryReadTree(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /** Rows of a paged list response ({@code {"Results": [...]}}), or the array itself. */
    public static List<JsonNode> results(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Collections.emptyList();
        }
        JsonNode rows = root.isArray() ? root : root.path("Results");
        if (!rows.isArray()) {
            return Collections.emptyList();
        }
        List<JsonNode> out = new ArrayList<>(rows.size());
        rows.forEach(out::add);
        return out;
    }

    /** First non-blank textual value among the given field names. */
    public static String text(JsonNode node, String... fieldNames) {
        if (node == null) {
            return null;
        }
        for (String field : fieldNames) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.isContainerNode()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    /** Integer field tolerant of numeric strings. Null if absent or not numeric. */
    public static Integer integer(JsonNode node, String... fieldNames) {
        if (node == null) {
            return null;
        }
        for (String field : fieldNames) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isIntegralNumber()) {
                return value.intValue();
            }
            if (value.isTextual()) {
                Integer parsed = parseIntSafe(value.asText());
                if (parsed != null) {
                    return parsed;
                }
            }
        }
        return null;
    }

    public static Long longValue(JsonNode node, String fieldName) {
        JsonNode value = node != null ? node.get(fieldName) : null;
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        try {
            return Long.parseLong(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Integer parseIntSafe(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
