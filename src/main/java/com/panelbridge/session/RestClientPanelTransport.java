package com.panelbridge.session;

import com.panelbridge.domain.model.PanelCredentials;
import com.panelbridge.exception.AuthException;
import com.panelbridge.exception.AuthFailureCause;
import com.panelbridge.exception.TransportException;
import java.net.HttpCookie;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link PanelHttpTransport} backed by Spring's {@link RestClient}.
 *
 * <p>Uses {@code exchange} so that every status code comes back as a {@link PanelResponse}
 * instead of an exception; only I/O failures are translated (to {@link TransportException}).
 */
@Component
public class RestClientPanelTransport implements PanelHttpTransport {

    private static final Logger log = LoggerFactory.getLogger(RestClientPanelTransport.class);

    private final RestClient panelRestClient;

    public RestClientPanelTransport(RestClient panelRestClient) {
        this.panelRestClient = panelRestClient;
    }

    @Override
    public PanelResponse send(String baseUrl, PanelRequest request, String sessionToken) {
        URI uri = buildUri(baseUrl, request.getPath(), request.getQueryParams());
        try {
            RestClient.RequestBodySpec spec = panelRestClient
                    .method(request.getMethod())
                    .uri(uri)
                    .headers(headers -> {
                        headers.setContentType(MediaType.APPLICATION_JSON);
                        if (sessionToken != null) {
                            headers.add(HttpHeaders.COOKIE, SESSION_COOKIE + "=" + sessionToken);
                        }
                    });
            if (request.getBody() != null) {
                spec = spec.body(request.getBody());
            }
            return spec.exchange((clientRequest, clientResponse) -> new PanelResponse(
                    clientResponse.getStatusCode().value(),
                    StreamUtils.copyToString(clientResponse.getBody(), StandardCharsets.UTF_8)));
        } catch (RestClientException e) {
            log.debug("Transport failure on {} {}: {}", request.getMethod(), uri, e.getMessage());
            throw new TransportException("Panel unreachable for " + request.describe() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String login(PanelCredentials credentials) {
        URI uri = buildUri(credentials.normalizedBaseUrl(), "/auth", Map.of());
        Map<String, String> body = Map.of(
                "Username", nullToEmpty(credentials.getUsername()),
                "Password", nullToEmpty(credentials.getPassword()));
        LoginOutcome outcome;
        try {
            outcome = panelRestClient
                    .post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .exchange((clientRequest, clientResponse) -> new LoginOutcome(
                            clientResponse.getStatusCode().value(),
                            findSessionCookie(clientResponse.getHeaders().get(HttpHeaders.SET_COOKIE))));
        } catch (RestClientException e) {
            throw new AuthException(AuthFailureCause.NETWORK, "Panel unreachable at " + uri + ": " + e.getMessage(), e);
        }

        if (outcome.status() == 401 || outcome.status() == 403) {
            throw new AuthException(
                    AuthFailureCause.CREDENTIALS, "Panel refused credentials for user " + credentials.getUsername());
        }
        if (outcome.status() < 200 || outcome.status() >= 300) {
            throw new AuthException(AuthFailureCause.NETWORK, "Panel login failed with HTTP " + outcome.status());
        }
        if (outcome.token() == null) {
            throw new AuthException(AuthFailureCause.CREDENTIALS, "Login succeeded but no ss-id cookie was issued");
        }
        return outcome.token();
    }

    // ---- Private helpers ----

    private URI buildUri(String baseUrl, String path, Map<String, Object> queryParams) {
        if (baseUrl == null) {
            throw new TransportException("Panel base URL is not configured");
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl).path(path);
        queryParams.forEach(builder::queryParam);
        return builder.encode().build().toUri();
    }

    private static String findSessionCookie(List<String> setCookieHeaders) {
        if (setCookieHeaders == null) {
            return null;
        }
        for (String header : setCookieHeaders) {
            try {
                for (HttpCookie cookie : HttpCookie.parse(header)) {
                    if (SESSION_COOKIE.equals(cookie.getName()) && !cookie.getValue().isBlank()) {
                        return cookie.getValue();
                    }
                }
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed Set-Cookie header: {}", header);
            }
        }
        return null;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private record LoginOutcome(int status, String token) {}
}
