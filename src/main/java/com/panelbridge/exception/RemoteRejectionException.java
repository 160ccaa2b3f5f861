package com.panelbridge.exception;

import java.util.Map;
import lombok.Getter;

/**
 * The panel answered a command with a structured error (duplicate PIN, unknown door, ...).
 *
 * <p>{@link #getPanelMessage()} carries the panel's own text verbatim so callers can show it.
 */
@Getter
public class RemoteRejectionException extends BaseException {

    private final int status;
    private final String panelMessage;

    public RemoteRejectionException(int status, String panelMessage) {
        super(
                ErrorCode.REMOTE_REJECTED,
                "Panel rejected request (HTTP " + status + "): " + panelMessage,
                Map.of("status", status, "panelMessage", panelMessage != null ? panelMessage : ""));
        this.status = status;
        this.panelMessage = panelMessage;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
