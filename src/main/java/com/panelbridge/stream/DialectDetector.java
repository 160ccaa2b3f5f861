package com.panelbridge.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.domain.enums.PanelDialect;
import java.util.Iterator;

/**
 * Decides which backend dialect produced a status payload.
 *
 * <p>Odyssey encodes booleans as strings, uses PascalCase status keys and may report the reader
 * mode by name. ProtectorNET sends camelCase keys, JSON booleans and a numeric {@code timeZone}.
 */
public final class DialectDetector {

    private static final String[] FLAG_FIELDS = {"overridden", "strike", "opener"};

    private DialectDetector() {}

    /** Dialect of the payload, or null when it carries no status fields to judge from. */
    public static PanelDialect detect(JsonNode status) {
        if (status == null || !status.isObject() || status.isEmpty()) {
            return null;
        }
        for (String field : FLAG_FIELDS) {
            JsonNode value = status.get(field);
            if (value != null && value.isTextual()) {
                return PanelDialect.ODYSSEY;
            }
        }
        if (hasPascalCaseStatusKey(status)) {
            return PanelDialect.ODYSSEY;
        }
        JsonNode timeZone = status.get("timeZone");
        if (timeZone != null && timeZone.isTextual() && !isNumeric(timeZone.asText())) {
            return PanelDialect.ODYSSEY;
        }
        return PanelDialect.PROTECTOR_NET;
    }

    // ---- Private helpers ----

    private static boolean hasPascalCaseStatusKey(JsonNode status) {
        Iterator<String> names = status.fieldNames();
        while (names.hasNext()) {
            switch (names.next()) {
                case "StatusId", "Strike", "Opener", "Overridden", "TimeZone" -> {
                    return true;
                }
                default -> {
                    // keep looking
                }
            }
        }
        return false;
    }

    private static boolean isNumeric(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (!Character.isDigit(trimmed.charAt(i)) && !(i == 0 && trimmed.charAt(i) == '-')) {
                return false;
            }
        }
        return true;
    }
}
