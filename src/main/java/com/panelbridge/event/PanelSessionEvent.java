package com.panelbridge.event;

import com.panelbridge.session.SessionExpiryState;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the panel session changes state (created, expired, renewed, login failed).
 *
 * <p>The stream client listens for SESSION_RENEWED: the cookie it connected with is dead, so the
 * next reconnect must negotiate with the new one.
 */
public class PanelSessionEvent extends ApplicationEvent {

    private final SessionEventType eventType;
    private final SessionExpiryState previousState;
    private final SessionExpiryState newState;
    private final String message;
    private final Instant occurredAt;

    public PanelSessionEvent(
            Object source,
            SessionEventType eventType,
            SessionExpiryState previousState,
            SessionExpiryState newState,
            String message) {
        super(source);
        this.eventType = eventType;
        this.previousState = previousState;
        this.newState = newState;
        this.message = message;
        this.occurredAt = Instant.now();
    }

    public SessionEventType getEventType() {
        return eventType;
    }

    public SessionExpiryState getPreviousState() {
        return previousState;
    }

    public SessionExpiryState getNewState() {
        return newState;
    }

    public String getMessage() {
        return message;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
