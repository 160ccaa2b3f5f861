package com.panelbridge.session;

import com.panelbridge.config.PanelConfig;
import com.panelbridge.domain.model.PanelCredentials;
import org.springframework.stereotype.Component;

/**
 * Holds where and as whom to log in, plus the current {@code ss-id} session token.
 *
 * <p>Plain holder: token rotation rules live in {@link PanelSessionManager}, which is the only
 * writer of the token.
 */
@Component
public class CredentialStore {

    private volatile PanelCredentials credentials;
    private volatile String sessionToken;

    public CredentialStore(PanelConfig panelConfig) {
        this.credentials = PanelCredentials.builder()
                .baseUrl(panelConfig.getBaseUrl())
                .username(panelConfig.getUsername())
                .password(panelConfig.getPassword())
                .build();
    }

    public PanelCredentials getCredentials() {
        return credentials;
    }

    /** Replaces the credentials and drops the token issued for the previous ones. */
    public void update(PanelCredentials credentials) {
        this.credentials = credentials;
        this.sessionToken = null;
    }

    public String getBaseUrl() {
        PanelCredentials current = credentials;
        return current != null ? current.normalizedBaseUrl() : null;
    }

    public String getSessionToken() {
        return sessionToken;
    }

    void setSessionToken(String sessionToken) {
        this.sessionToken = sessionToken;
    }

    /** Cookie header value for the current token, e.g. {@code ss-id=abc}. */
    public String cookieHeader() {
        String token = sessionToken;
        return token != null ? PanelHttpTransport.SESSION_COOKIE + "=" + token : null;
    }
}
