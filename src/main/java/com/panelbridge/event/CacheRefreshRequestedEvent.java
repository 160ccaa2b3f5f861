package com.panelbridge.event;

import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a temp code or OTR schedule was created or deleted, asking for an immediate
 * out-of-band refresh of the remote-owned caches.
 */
public class CacheRefreshRequestedEvent extends ApplicationEvent {

    private final String trigger;
    private final Instant occurredAt;

    public CacheRefreshRequestedEvent(Object source, String trigger) {
        super(source);
        this.trigger = trigger;
        this.occurredAt = Instant.now();
    }

    public String getTrigger() {
        return trigger;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
