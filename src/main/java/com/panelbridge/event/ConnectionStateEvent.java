package com.panelbridge.event;

import com.panelbridge.domain.enums.ConnectionState;
import com.panelbridge.domain.enums.PanelDialect;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every event stream state transition.
 *
 * <p>{@code dialect} is null until the first status payload of the connection has been
 * classified. {@code detail} carries the last error text on RECONNECTING/ERROR.
 */
public class ConnectionStateEvent extends ApplicationEvent {

    private final ConnectionState previousState;
    private final ConnectionState newState;
    private final PanelDialect dialect;
    private final String detail;
    private final Instant occurredAt;

    public ConnectionStateEvent(
            Object source,
            ConnectionState previousState,
            ConnectionState newState,
            PanelDialect dialect,
            String detail) {
        super(source);
        this.previousState = previousState;
        this.newState = newState;
        this.dialect = dialect;
        this.detail = detail;
        this.occurredAt = Instant.now();
    }

    public ConnectionState getPreviousState() {
        return previousState;
    }

    public ConnectionState getNewState() {
        return newState;
    }

    public PanelDialect getDialect() {
        return dialect;
    }

    public String getDetail() {
        return detail;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
