package com.panelbridge.normalizer;

import com.panelbridge.domain.model.DoorEvent;
import java.util.List;
import lombok.Value;

/**
 * Result of normalizing one status or notification: the events to apply, and whether the routing
 * tables looked stale and should be rebuilt.
 */
@Value
public class NormalizedFrame {

    private static final NormalizedFrame NOTHING = new NormalizedFrame(List.of(), false);

    List<DoorEvent> events;
    boolean refreshRequested;

    public static NormalizedFrame of(List<DoorEvent> events) {
        return events.isEmpty() ? NOTHING : new NormalizedFrame(List.copyOf(events), false);
    }

    public static NormalizedFrame nothing() {
        return NOTHING;
    }

    public static NormalizedFrame refresh() {
        return new NormalizedFrame(List.of(), true);
    }
}
