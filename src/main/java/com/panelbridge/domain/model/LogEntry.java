package com.panelbridge.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Latest log line retained for a door.
 *
 * <p>{@code actor} says who acted ("Jane Doe granted access", "Home Assistant unlocked"); it is
 * only replaced by access, action-plan and one-time-run events. {@code doorMessage} holds the
 * last pure lock/unlock line and never touches {@code actor}.
 */
@Value
@Builder(toBuilder = true)
public class LogEntry {

    String actor;
    String readerMessage;
    Instant readerMessageTime;
    String doorMessage;
    Instant timestamp;

    public static LogEntry empty() {
        return LogEntry.builder().build();
    }
}
