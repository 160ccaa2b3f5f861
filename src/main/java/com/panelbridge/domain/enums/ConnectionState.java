package com.panelbridge.domain.enums;

/**
 * Health of the event stream client.
 *
 * <p>Valid transitions:
 * <pre>
 * IDLE -> CONNECTING -> RUNNING -> RECONNECTING -> CONNECTING ...
 *   any state -> ERROR   (unrecoverable failure, e.g. repeated auth failure at handshake)
 *   any state -> STOPPED (explicit shutdown only)
 * </pre>
 *
 * <p>Observability only: commands go through the session manager whatever the stream state is.
 */
public enum ConnectionState {

    /** Not started yet. */
    IDLE,

    /** Negotiating and performing the SignalR handshake. */
    CONNECTING,

    /** Handshake done, subscribed, frames flowing. */
    RUNNING,

    /** Connection dropped; waiting out the backoff delay before the next attempt. */
    RECONNECTING,

    /** Gave up after an unrecoverable failure. Commands keep working. */
    ERROR,

    /** Shut down on request. */
    STOPPED
}
