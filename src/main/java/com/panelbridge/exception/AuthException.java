package com.panelbridge.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Raised when the panel session cannot be established or re-established.
 *
 * <p>Fatal for the call that triggered it, never for the process: the next call starts a fresh
 * login attempt.
 */
@Getter
public class AuthException extends BaseException {

    private final AuthFailureCause failureCause;

    public AuthException(AuthFailureCause failureCause, String message) {
        super(ErrorCode.AUTH_FAILED, message, Map.of("cause", failureCause.name()));
        this.failureCause = failureCause;
    }

    public AuthException(AuthFailureCause failureCause, String message, Throwable cause) {
        super(ErrorCode.AUTH_FAILED, message, Map.of("cause", failureCause.name()), cause);
        this.failureCause = failureCause;
    }
}
