package com.panelbridge.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** One-time-run override scheduled on the panel itself. Times are UTC. */
@Value
@Builder
public class OtrSchedule {

    long id;
    List<Integer> doorIds;
    String doorName;
    String name;
    String mode;
    Instant startUtc;
    Instant stopUtc;
    String description;
}
