package com.panelbridge.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Time-bounded PIN credential for one door. On the panel it is a user named {@code HA-<code>}
 * holding a PIN-only credential and membership of the door's temp-access privilege group.
 */
@Value
@Builder(toBuilder = true)
public class TempCode {

    int doorId;
    String codeName;
    String code;
    long userId;
    Instant startTime;
    Instant endTime;
}
