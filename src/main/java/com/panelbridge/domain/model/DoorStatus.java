package com.panelbridge.domain.model;

import com.panelbridge.domain.enums.ReaderMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Dialect-neutral door status. Every field except {@code statusId}/{@code doorId} is nullable:
 * frames often carry only the fields that changed.
 */
@Value
@Builder(toBuilder = true)
public class DoorStatus {

    String statusId;
    Integer doorId;
    Boolean strike;
    Boolean opener;
    Boolean overridden;
    ReaderMode readerMode;

    /** Panel-side time of the status, when the dialect reports one. */
    Instant timestamp;
}
