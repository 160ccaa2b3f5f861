package com.panelbridge.session;

import java.time.Instant;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** Read-only view of the session owned by {@link PanelSessionManager}. */
@Value
@Builder
public class PanelSession {

    String baseUrl;
    String username;

    @ToString.Exclude
    String token;

    SessionExpiryState expiryState;
    Instant establishedAt;
}
