package com.panelbridge.session;

import com.panelbridge.domain.model.PanelCredentials;

/**
 * Raw HTTP exchange with the panel, with no authentication policy.
 *
 * <p>Implementations return every HTTP status as a {@link PanelResponse}; only I/O failures
 * raise {@link com.panelbridge.exception.TransportException}. Retry and re-login decisions are
 * made by {@link PanelSessionManager}.
 */
public interface PanelHttpTransport {

    /** Name of the panel's session cookie. */
    String SESSION_COOKIE = "ss-id";

    /**
     * Sends the request with {@code Cookie: ss-id=<sessionToken>}.
     *
     * @throws com.panelbridge.exception.TransportException on connect/read failure
     */
    PanelResponse send(String baseUrl, PanelRequest request, String sessionToken);

    /**
     * Calls {@code POST /auth} and returns the issued {@code ss-id} value.
     *
     * @throws com.panelbridge.exception.AuthException NETWORK when unreachable, CREDENTIALS when refused
     */
    String login(PanelCredentials credentials);
}
