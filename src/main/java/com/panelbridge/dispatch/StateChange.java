package com.panelbridge.dispatch;

import java.time.Instant;
import lombok.Value;

/**
 * Notification payload: the entity key and an immutable view of its new state (a
 * {@code Door}, a list of {@code TempCode}s or {@code OtrSchedule}s, or a
 * {@code ConnectionState}).
 */
@Value
public class StateChange {

    EntityKey key;
    Object state;
    Instant publishedAt;

    public <T> T stateAs(Class<T> type) {
        return type.isInstance(state) ? type.cast(state) : null;
    }
}
