package com.panelbridge.normalizer;

import com.panelbridge.domain.model.PanelNotification;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded FIFO of reader notifications whose reader was not in the routing tables yet.
 *
 * <p>When full, the oldest entry is dropped with a WARN. Thread-safe; the buffer is small and
 * touched at notification rate, so a plain monitor is enough.
 */
class UnresolvedNotificationBuffer {

    private static final Logger log = LoggerFactory.getLogger(UnresolvedNotificationBuffer.class);

    private final int capacity;
    private final Deque<Pending> entries = new ArrayDeque<>();

    UnresolvedNotificationBuffer(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    synchronized void add(PanelNotification notification, Instant receivedAt) {
        if (entries.size() >= capacity) {
            Pending dropped = entries.pollFirst();
            log.warn(
                    "Reconciliation: unresolved notification buffer full, dropping '{}' from {}",
                    dropped.notification.getMessage(),
                    dropped.notification.getSourceName());
        }
        entries.addLast(new Pending(notification, receivedAt));
    }

    synchronized List<Pending> drain() {
        List<Pending> drained = new ArrayList<>(entries);
        entries.clear();
        return drained;
    }

    synchronized int size() {
        return entries.size();
    }

    static final class Pending {

        final PanelNotification notification;
        final Instant receivedAt;

        Pending(PanelNotification notification, Instant receivedAt) {
            this.notification = notification;
            this.receivedAt = receivedAt;
        }
    }
}
