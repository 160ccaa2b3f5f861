package com.panelbridge.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.mapper.JsonHelper;

/**
 * Extracts the human-readable error text from a rejected panel response.
 *
 * <p>Panels answer errors in several shapes: {@code {"Message": ...}}, {@code {"message": ...}},
 * {@code {"error": ...}}, {@code {"ResponseStatus": {"Message": ...}}} or plain text.
 */
public final class PanelErrorMessages {

    private static final int MAX_PLAIN_TEXT = 500;

    private PanelErrorMessages() {}

    public static String extract(int status, String body) {
        if (body == null || body.isBlank()) {
            return "HTTP " + status;
        }
        JsonNode root = JsonHelper.tryReadTree(body);
        if (root != null && root.isObject()) {
            String message = JsonHelper.text(root, "Message", "message", "error", "Error");
            if (message == null) {
                message = JsonHelper.text(root.path("ResponseStatus"), "Message", "ErrorCode");
            }
            if (message != null) {
                return message;
            }
        }
        return body.length() <= MAX_PLAIN_TEXT ? body : body.substring(0, MAX_PLAIN_TEXT);
    }
}
