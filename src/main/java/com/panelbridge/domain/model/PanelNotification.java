package com.panelbridge.domain.model;

import java.time.Instant;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/** A {@code notification} frame entry (access log line, plan message, lock-state line). */
@Value
@Builder
public class PanelNotification {

    String notificationType;
    String message;
    String sourceType;
    Integer sourceId;
    String sourceName;
    Instant date;
    Integer userId;
    Integer partitionId;

    public String upperType() {
        return notificationType == null ? "" : notificationType.trim().toUpperCase(Locale.ROOT);
    }

    public boolean isReaderSourced() {
        return "reader".equalsIgnoreCase(sourceType == null ? "" : sourceType.trim());
    }
}
