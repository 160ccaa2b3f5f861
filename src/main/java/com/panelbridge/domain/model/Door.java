package com.panelbridge.domain.model;

import com.panelbridge.domain.enums.LockState;
import com.panelbridge.domain.enums.ReaderMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of a door's live state, handed out by the state store and carried in
 * notifications. {@code overridden} is null until the panel has reported it.
 */
@Value
@Builder(toBuilder = true)
public class Door {

    int id;
    String name;
    int partitionId;
    String statusId;
    LockState lockState;
    Boolean overridden;
    ReaderMode readerMode;
    OverrideState override;
    LogEntry lastLog;
    Instant updatedAt;
}
