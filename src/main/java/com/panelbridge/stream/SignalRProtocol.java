package com.panelbridge.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelbridge.mapper.JsonHelper;
import java.util.ArrayList;
import java.util.List;

/**
 * SignalR JSON hub protocol, version 1: the handful of frames the stream client writes and the
 * message types it reads. Every frame is a JSON document terminated by the record separator.
 */
final class SignalRProtocol {

    static final char RECORD_SEPARATOR = '\u001e';

    static final int TYPE_INVOCATION = 1;
    static final int TYPE_COMPLETION = 3;
    static final int TYPE_PING = 6;
    static final int TYPE_CLOSE = 7;

    static final String HUB_PATH = "/rt/notificationHub";
    static final String TARGET_STATUS = "status";
    static final String TARGET_NOTIFICATION = "notification";

    private SignalRProtocol() {}

    static String handshake() {
        ObjectNode frame = JsonHelper.newObject();
        frame.put("protocol", "json");
        frame.put("version", 1);
        return JsonHelper.toJson(frame) + RECORD_SEPARATOR;
    }

    static String ping() {
        ObjectNode frame = JsonHelper.newObject();
        frame.put("type", TYPE_PING);
        return JsonHelper.toJson(frame) + RECORD_SEPARATOR;
    }

    static String init() {
        ObjectNode frame = invocationFrame("Init", "1");
        ((ArrayNode) frame.get("arguments")).addNull().addNull();
        return JsonHelper.toJson(frame) + RECORD_SEPARATOR;
    }

    static String subscribeToStatus(List<String> panels) {
        ObjectNode frame = invocationFrame("subscribeToStatus", "2");
        ArrayNode panelArray = ((ArrayNode) frame.get("arguments")).addArray();
        panels.forEach(panelArray::add);
        return JsonHelper.toJson(frame) + RECORD_SEPARATOR;
    }

    /** Splits a text message into its frames, skipping empty ones. */
    static List<String> split(String text) {
        List<String> frames = new ArrayList<>();
        if (text == null) {
            return frames;
        }
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == RECORD_SEPARATOR) {
                addIfNotBlank(frames, text.substring(start, i));
                start = i + 1;
            }
        }
        addIfNotBlank(frames, text.substring(start));
        return frames;
    }

    static int type(JsonNode frame) {
        return frame.path("type").asInt(-1);
    }

    static boolean isInvocation(JsonNode frame, String target) {
        return type(frame) == TYPE_INVOCATION && target.equals(frame.path("target").asText());
    }

    // ---- Private helpers ----

    private static ObjectNode invocationFrame(String target, String invocationId) {
        ObjectNode frame = JsonHelper.newObject();
        frame.put("type", TYPE_INVOCATION);
        frame.put("target", target);
        frame.putArray("arguments");
        frame.put("invocationId", invocationId);
        frame.putArray("streamIds");
        return frame;
    }

    private static void addIfNotBlank(List<String> frames, String frame) {
        if (!frame.isBlank()) {
            frames.add(frame);
        }
    }
}
