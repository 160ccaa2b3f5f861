package com.panelbridge.event;

import com.panelbridge.domain.enums.ConnectionState;
import com.panelbridge.domain.enums.PanelDialect;
import com.panelbridge.session.SessionExpiryState;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the runtime's lifecycle events.
 *
 * <p>Entity state changes do not go through here: they are keyed by entity identity and fan out
 * through {@link com.panelbridge.dispatch.StateChangeDispatcher}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Session ----

    public void publishSession(
            Object source,
            SessionEventType eventType,
            SessionExpiryState previousState,
            SessionExpiryState newState,
            String message) {
        applicationEventPublisher.publishEvent(
                new PanelSessionEvent(source, eventType, previousState, newState, message));
    }

    // ---- Event stream ----

    public void publishConnectionState(
            Object source,
            ConnectionState previousState,
            ConnectionState newState,
            PanelDialect dialect,
            String detail) {
        applicationEventPublisher.publishEvent(
                new ConnectionStateEvent(source, previousState, newState, dialect, detail));
    }

    // ---- Cache ----

    public void publishCacheRefresh(Object source, String trigger) {
        applicationEventPublisher.publishEvent(new CacheRefreshRequestedEvent(source, trigger));
    }
}
