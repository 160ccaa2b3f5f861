package com.panelbridge.session;

/**
 * Lifecycle of the panel session cookie.
 *
 * <pre>
 * NONE -> VALID -> EXPIRED -> VALID ...
 * </pre>
 */
public enum SessionExpiryState {

    /** No login has succeeded yet. */
    NONE,

    /** The current token was accepted by the last call or login. */
    VALID,

    /** The panel rejected the current token; the next call re-logs in. */
    EXPIRED
}
