package com.panelbridge.domain.model;

import com.panelbridge.domain.enums.OverrideType;
import com.panelbridge.domain.enums.ReaderMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Active override of a door. {@code type} is null when the override was observed on the stream
 * without its duration policy (for example one set from the panel's own UI).
 */
@Value
@Builder
public class OverrideState {

    OverrideType type;
    ReaderMode mode;
    Integer minutes;
    Instant until;
}
