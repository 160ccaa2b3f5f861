package com.panelbridge.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.mapper.JsonHelper;
import lombok.Getter;

/** Status and raw body of a panel call. The body is parsed on demand. */
@Getter
public class PanelResponse {

    private final int status;
    private final String body;

    public PanelResponse(int status, String body) {
        this.status = status;
        this.body = body;
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public boolean isUnauthorized() {
        return status == 401;
    }

    public JsonNode json() {
        return JsonHelper.readTree(body);
    }
}
