package com.panelbridge.exception;

/** Why a login or re-login could not produce a usable session. */
public enum AuthFailureCause {
    /** Panel host unreachable, TLS failure or timeout while calling /auth. */
    NETWORK,
    /** Panel answered but refused the credentials, or answered without a session cookie. */
    CREDENTIALS,
    /** Request still unauthorized after one re-login and one retry. */
    REAUTH_EXHAUSTED
}
