package com.panelbridge.domain.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** Where and as whom to log in. The password never appears in toString output. */
@Value
@Builder
public class PanelCredentials {

    String baseUrl;

    String username;

    @ToString.Exclude
    String password;

    /** Base URL without a trailing slash, so paths can be appended directly. */
    public String normalizedBaseUrl() {
        if (baseUrl == null) {
            return null;
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
