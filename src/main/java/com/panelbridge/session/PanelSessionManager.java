package com.panelbridge.session;

import com.panelbridge.config.PanelConfig;
import com.panelbridge.domain.model.PanelCredentials;
import com.panelbridge.event.EventPublisherHelper;
import com.panelbridge.event.SessionEventType;
import com.panelbridge.exception.AuthException;
import com.panelbridge.exception.AuthFailureCause;
import com.panelbridge.exception.RemoteRejectionException;
import com.panelbridge.exception.TransportException;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes panel HTTP calls and owns the session cookie.
 *
 * <p>Callers never see authentication: a 401 triggers exactly one re-login and one retry of the
 * original request. A second 401 surfaces as {@link AuthException} with
 * {@link AuthFailureCause#REAUTH_EXHAUSTED}; that call fails, the next one starts over.
 *
 * <p>Single-flight re-login: every caller that received a 401 for token {@code T} joins the one
 * login future started for {@code T}. A caller arriving after the token has already moved past
 * {@code T} retries straight away with the new token. So N concurrent 401s cost one login and N
 * retries. The monitor only guards the in-memory hand-off; the login call itself runs outside
 * it.
 *
 * <p>Non-2xx answers other than 401 become {@link RemoteRejectionException} carrying the panel's
 * own message. Transport failures on idempotent GETs are retried a few times with doubling delay
 * before the {@link TransportException} reaches the caller.
 */
@Service
public class PanelSessionManager {

    private static final Logger log = LoggerFactory.getLogger(PanelSessionManager.class);

    private final CredentialStore credentialStore;
    private final PanelHttpTransport transport;
    private final PanelConfig panelConfig;
    private final EventPublisherHelper eventPublisherHelper;

    private final Object tokenMonitor = new Object();

    /** Login in progress, or null. Guarded by {@link #tokenMonitor}. */
    private CompletableFuture<String> inFlightLogin;

    private final AtomicInteger loginCount = new AtomicInteger();

    private volatile SessionExpiryState expiryState = SessionExpiryState.NONE;
    private volatile Instant establishedAt;

    public PanelSessionManager(
            CredentialStore credentialStore,
            PanelHttpTransport transport,
            PanelConfig panelConfig,
            EventPublisherHelper eventPublisherHelper) {
        this.credentialStore = credentialStore;
        this.transport = transport;
        this.panelConfig = panelConfig;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Switches to the given credentials and logs in eagerly.
     *
     * @throws AuthException NETWORK or CREDENTIALS when the login fails
     */
    public PanelSession connect(PanelCredentials credentials) {
        synchronized (tokenMonitor) {
            credentialStore.update(credentials);
            expiryState = SessionExpiryState.NONE;
        }
        String token = reauthenticate(null);
        log.info("Connected to panel {} as {}", credentials.normalizedBaseUrl(), credentials.getUsername());
        return buildSession(token);
    }

    /**
     * Executes a request against the panel, re-authenticating transparently.
     *
     * @return the successful (2xx) response
     * @throws AuthException when login fails or the request is still unauthorized after a re-login
     * @throws RemoteRejectionException when the panel answers with another non-2xx status
     * @throws TransportException when the panel cannot be reached
     */
    public PanelResponse execute(PanelRequest request) {
        String token = ensureToken();
        PanelResponse response = sendWithTransportRetry(request, token);

        if (response.isUnauthorized()) {
            log.debug("Session expired on {}, re-authenticating", request.describe());
            markExpired(token);
            String renewed = reauthenticate(token);
            response = sendWithTransportRetry(request, renewed);
            if (response.isUnauthorized()) {
                markExpired(renewed);
                throw new AuthException(
                        AuthFailureCause.REAUTH_EXHAUSTED,
                        "Still unauthorized after re-login for " + request.describe());
            }
        }

        if (!response.isSuccess()) {
            String panelMessage = PanelErrorMessages.extract(response.getStatus(), response.getBody());
            log.warn("Panel rejected {} with HTTP {}: {}", request.describe(), response.getStatus(), panelMessage);
            throw new RemoteRejectionException(response.getStatus(), panelMessage);
        }
        return response;
    }

    /** Current token, logging in first when there is none. Used by the stream handshake. */
    public String ensureToken() {
        String token = credentialStore.getSessionToken();
        return token != null ? token : reauthenticate(null);
    }

    /**
     * Returns a token newer than {@code staleToken}, logging in at most once for it.
     *
     * <p>Package-private for tests.
     */
    String reauthenticate(String staleToken) {
        CompletableFuture<String> pending;
        boolean leader = false;
        synchronized (tokenMonitor) {
            String current = credentialStore.getSessionToken();
            if (current != null && !current.equals(staleToken)) {
                return current;
            }
            if (inFlightLogin == null) {
                inFlightLogin = new CompletableFuture<>();
                leader = true;
            }
            pending = inFlightLogin;
        }

        if (leader) {
            performLogin(pending);
        }
        return awaitLogin(pending);
    }

    public PanelSession currentSession() {
        return buildSession(credentialStore.getSessionToken());
    }

    public SessionExpiryState getExpiryState() {
        return expiryState;
    }

    /** Number of login calls issued since start. */
    public int getLoginCount() {
        return loginCount.get();
    }

    public String getBaseUrl() {
        return credentialStore.getBaseUrl();
    }

    // ---- Private helpers ----

    private void performLogin(CompletableFuture<String> pending) {
        SessionExpiryState previous = expiryState;
        PanelCredentials credentials = credentialStore.getCredentials();
        loginCount.incrementAndGet();
        try {
            String token = transport.login(credentials);
            synchronized (tokenMonitor) {
                credentialStore.setSessionToken(token);
                inFlightLogin = null;
                expiryState = SessionExpiryState.VALID;
                establishedAt = Instant.now();
            }
            SessionEventType type = previous == SessionExpiryState.NONE
                    ? SessionEventType.SESSION_CREATED
                    : SessionEventType.SESSION_RENEWED;
            eventPublisherHelper.publishSession(this, type, previous, SessionExpiryState.VALID, "Login succeeded");
            log.info("Panel login succeeded ({})", type);
            pending.complete(token);
        } catch (RuntimeException e) {
            synchronized (tokenMonitor) {
                inFlightLogin = null;
            }
            String cause = e instanceof AuthException authException
                    ? authException.getFailureCause().name()
                    : AuthFailureCause.NETWORK.name();
            log.error("Panel login failed ({}): {}", cause, e.getMessage());
            eventPublisherHelper.publishSession(
                    this, SessionEventType.LOGIN_FAILED, previous, expiryState, cause + ": " + e.getMessage());
            pending.completeExceptionally(e);
        }
    }

    private String awaitLogin(CompletableFuture<String> pending) {
        try {
            return pending.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AuthException authException) {
                throw authException;
            }
            throw new AuthException(AuthFailureCause.NETWORK, "Login failed: " + cause.getMessage(), cause);
        }
    }

    private void markExpired(String token) {
        SessionExpiryState previous;
        synchronized (tokenMonitor) {
            if (token == null || !token.equals(credentialStore.getSessionToken())) {
                return;
            }
            previous = expiryState;
            if (previous == SessionExpiryState.EXPIRED) {
                return;
            }
            expiryState = SessionExpiryState.EXPIRED;
        }
        eventPublisherHelper.publishSession(
                this, SessionEventType.SESSION_EXPIRED, previous, SessionExpiryState.EXPIRED, "Panel answered 401");
    }

    private PanelResponse sendWithTransportRetry(PanelRequest request, String token) {
        int retries = request.isIdempotent() ? panelConfig.getHttp().getTransportRetries() : 0;
        long delay = panelConfig.getHttp().getRetryBackoffMs();
        String baseUrl = credentialStore.getBaseUrl();
        for (int attempt = 0; ; attempt++) {
            try {
                return transport.send(baseUrl, request, token);
            } catch (TransportException e) {
                if (attempt >= retries) {
                    throw e;
                }
                log.warn(
                        "Transport failure on {} (attempt {}/{}), retrying in {}ms: {}",
                        request.describe(),
                        attempt + 1,
                        retries + 1,
                        delay,
                        e.getMessage());
                sleep(delay, e);
                delay *= 2;
            }
        }
    }

    private static void sleep(long delayMs, TransportException original) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw original;
        }
    }

    private PanelSession buildSession(String token) {
        PanelCredentials credentials = credentialStore.getCredentials();
        return PanelSession.builder()
                .baseUrl(credentials != null ? credentials.normalizedBaseUrl() : null)
                .username(credentials != null ? credentials.getUsername() : null)
                .token(token)
                .expiryState(expiryState)
                .establishedAt(establishedAt)
                .build();
    }
}
