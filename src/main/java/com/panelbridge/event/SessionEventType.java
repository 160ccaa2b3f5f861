package com.panelbridge.event;

/**
 * Classifies the session lifecycle change behind a {@link PanelSessionEvent}.
 */
public enum SessionEventType {

    /** First login of the runtime succeeded. */
    SESSION_CREATED,

    /** The panel answered 401 for the current token. */
    SESSION_EXPIRED,

    /** A re-login after expiry produced a fresh token. */
    SESSION_RENEWED,

    /** Login failed; the event message names the cause (network or credentials). */
    LOGIN_FAILED
}
