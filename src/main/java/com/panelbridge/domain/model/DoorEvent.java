package com.panelbridge.domain.model;

import com.panelbridge.domain.enums.DoorEventType;
import com.panelbridge.domain.enums.EventSource;
import com.panelbridge.domain.enums.LockState;
import com.panelbridge.domain.enums.ReaderMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Canonical event applied to the state store.
 *
 * <p>{@code timestamp} drives reconciliation and is always taken from the local clock (receive
 * or request-issue time), so events from every source compare on one time line; {@code sequence}
 * is a monotonic arrival counter that breaks timestamp ties. {@code panelTime} is the panel's own
 * {@code Date} for notification lines and only feeds the displayed reader message time. Payload
 * fields are only set when the event type carries them.
 */
@Value
@Builder(toBuilder = true)
public class DoorEvent {

    DoorEventType type;
    int doorId;
    Instant timestamp;
    long sequence;
    EventSource source;
    Instant panelTime;

    LockState lockState;
    Boolean overridden;
    ReaderMode readerMode;
    OverrideState override;

    String actor;
    String readerMessage;
    String doorMessage;
}
