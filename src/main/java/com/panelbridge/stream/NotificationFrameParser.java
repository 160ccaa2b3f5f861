package com.panelbridge.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.client.PanelTimeFormat;
import com.panelbridge.domain.model.PanelNotification;
import com.panelbridge.mapper.JsonHelper;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts notifications from a {@code notification} invocation. The first argument is either a
 * list of notifications or a single one; failing both, every object argument is a notification.
 */
final class NotificationFrameParser {

    private NotificationFrameParser() {}

    static List<PanelNotification> parse(JsonNode frame) {
        JsonNode args = frame.path("arguments");
        List<PanelNotification> notes = new ArrayList<>();
        if (!args.isArray() || args.isEmpty()) {
            return notes;
        }
        JsonNode first = args.get(0);
        if (first.isArray()) {
            first.forEach(node -> addIfObject(notes, node));
        } else if (first.isObject()) {
            addIfObject(notes, first);
        } else {
            args.forEach(node -> addIfObject(notes, node));
        }
        return notes;
    }

    static PanelNotification toNotification(JsonNode note) {
        return PanelNotification.builder()
                .notificationType(JsonHelper.text(note, "NotificationType"))
                .message(JsonHelper.text(note, "Message"))
                .sourceType(JsonHelper.text(note, "SourceType"))
                .sourceId(JsonHelper.integer(note, "SourceId"))
                .sourceName(JsonHelper.text(note, "SourceName"))
                .date(PanelTimeFormat.fromWire(JsonHelper.text(note, "Date")))
                .userId(JsonHelper.integer(note, "UserId"))
                .partitionId(JsonHelper.integer(note, "PartitionId"))
                .build();
    }

    private static void addIfObject(List<PanelNotification> notes, JsonNode node) {
        if (node != null && node.isObject()) {
            notes.add(toNotification(node));
        }
    }
}
