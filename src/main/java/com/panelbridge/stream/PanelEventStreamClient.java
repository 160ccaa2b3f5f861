package com.panelbridge.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.client.DiscoveryClient;
import com.panelbridge.client.PartitionContext;
import com.panelbridge.config.PanelConfig;
import com.panelbridge.dispatch.EntityKey;
import com.panelbridge.dispatch.StateChangeDispatcher;
import com.panelbridge.domain.enums.ConnectionState;
import com.panelbridge.domain.enums.EventSource;
import com.panelbridge.domain.enums.PanelDialect;
import com.panelbridge.domain.model.DoorEvent;
import com.panelbridge.domain.model.DoorStatus;
import com.panelbridge.domain.model.PanelNotification;
import com.panelbridge.event.EventPublisherHelper;
import com.panelbridge.event.PanelSessionEvent;
import com.panelbridge.event.SessionEventType;
import com.panelbridge.exception.AuthException;
import com.panelbridge.exception.BaseException;
import com.panelbridge.exception.TransportException;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.normalizer.NormalizedFrame;
import com.panelbridge.normalizer.PanelEventNormalizer;
import com.panelbridge.normalizer.ReaderDoorIndex;
import com.panelbridge.session.PanelHttpTransport;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelSessionManager;
import com.panelbridge.state.PanelStateStore;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Keeps the panel's SignalR notification hub connected and feeds what it pushes into the
 * {@link PanelStateStore}.
 *
 * <p>One dedicated daemon thread owns the connection. Transport callbacks only enqueue inbound
 * text; the loop thread parses frames, normalizes them, applies the resulting events, sends
 * heartbeats and takes periodic status snapshots. The connection lifecycle:
 * <ul>
 *   <li>rebuild the reader/door routing tables from the partition</li>
 *   <li>negotiate a connection token through the {@link PanelSessionManager} (re-authenticating
 *       when the session has expired)</li>
 *   <li>open the socket with the session cookie, send the handshake, {@code Init} and
 *       {@code subscribeToStatus} for every panel owning a partition door</li>
 *   <li>receive until the socket closes, goes silent for the idle timeout, or the session is
 *       renewed elsewhere; then back off and start over</li>
 * </ul>
 *
 * <p>Reconnect delay: initial backoff doubling per attempt up to the maximum, plus uniform random
 * jitter. Consecutive auth failures while negotiating end in ERROR; the HTTP command surface keeps
 * working regardless of the stream's state.
 *
 * <p>The backend dialect is detected on the first status payload of each connection and fixed
 * until the next reconnect.
 */
@Service
public class PanelEventStreamClient {

    private static final Logger log = LoggerFactory.getLogger(PanelEventStreamClient.class);

    private final PanelSessionManager sessionManager;
    private final DiscoveryClient discoveryClient;
    private final PartitionContext partitionContext;
    private final PanelEventNormalizer normalizer;
    private final PanelStateStore stateStore;
    private final StateChangeDispatcher stateChangeDispatcher;
    private final EventPublisherHelper eventPublisherHelper;
    private final StreamTransport streamTransport;
    private final Map<PanelDialect, DialectNormalizer> dialectNormalizers = new EnumMap<>(PanelDialect.class);
    private final PanelConfig.Stream settings;
    private final Clock clock;
    private Random jitterRandom = new Random();

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.IDLE);
    private final BlockingQueue<Signal> inbound = new LinkedBlockingQueue<>();
    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicInteger consecutiveAuthFailures = new AtomicInteger();

    private final Object lifecycleMonitor = new Object();
    private Thread loopThread;
    private CountDownLatch stopLatch = new CountDownLatch(1);
    private volatile boolean running;

    private volatile PanelDialect dialect;
    private volatile StreamChannel channel;
    private volatile Instant lastFrameAt;
    private List<String> subscribedPanels = List.of();
    private boolean snapshotUnsupported;

    public PanelEventStreamClient(
            PanelSessionManager sessionManager,
            DiscoveryClient discoveryClient,
            PartitionContext partitionContext,
            PanelEventNormalizer normalizer,
            PanelStateStore stateStore,
            StateChangeDispatcher stateChangeDispatcher,
            EventPublisherHelper eventPublisherHelper,
            StreamTransport streamTransport,
            List<DialectNormalizer> dialectNormalizers,
            PanelConfig panelConfig,
            Clock clock) {
        this.sessionManager = sessionManager;
        this.discoveryClient = discoveryClient;
        this.partitionContext = partitionContext;
        this.normalizer = normalizer;
        this.stateStore = stateStore;
        this.stateChangeDispatcher = stateChangeDispatcher;
        this.eventPublisherHelper = eventPublisherHelper;
        this.streamTransport = streamTransport;
        this.settings = panelConfig.getStream();
        this.clock = clock;
        dialectNormalizers.forEach(n -> this.dialectNormalizers.put(n.dialect(), n));
    }

    /** Starts the loop thread. No-op while a loop is already running. */
    public void start() {
        synchronized (lifecycleMonitor) {
            if (loopThread != null && loopThread.isAlive()) {
                log.debug("Event stream already running, start ignored");
                return;
            }
            running = true;
            stopLatch = new CountDownLatch(1);
            consecutiveAuthFailures.set(0);
            inbound.clear();
            loopThread = new Thread(this::runLoop, "panel-event-stream");
            loopThread.setDaemon(true);
            loopThread.start();
        }
        log.info("Event stream client started");
    }

    /**
     * Signals the loop to finish, closes the socket and waits at most the shutdown grace period for
     * the loop thread to exit. Ends in STOPPED.
     */
    @PreDestroy
    public void stop() {
        Thread thread;
        synchronized (lifecycleMonitor) {
            running = false;
            stopLatch.countDown();
            thread = loopThread;
        }
        inbound.offer(Signal.stop());
        closeChannel();
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(settings.getShutdownGraceMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Event stream loop did not exit within {}ms", settings.getShutdownGraceMs());
                thread.interrupt();
            }
        }
        transition(ConnectionState.STOPPED, null);
    }

    public ConnectionState getState() {
        return state.get();
    }

    /** Dialect of the current connection, or null before its first status payload. */
    public PanelDialect getDialect() {
        return dialect;
    }

    public Instant getLastFrameAt() {
        return lastFrameAt;
    }

    /**
     * A renewed session invalidates the cookie the socket was opened with; drop the connection so
     * the next one negotiates with the new session.
     */
    @EventListener
    public void onSessionEvent(PanelSessionEvent event) {
        if (event.getEventType() == SessionEventType.SESSION_RENEWED && state.get() == ConnectionState.RUNNING) {
            log.info("Panel session renewed, reconnecting event stream");
            inbound.offer(Signal.reconnect(generation.get()));
        }
    }

    /**
     * Delay before reconnect attempt {@code attempt} (1-based): initial backoff doubled per attempt,
     * capped at the maximum, plus uniform jitter.
     */
    long computeReconnectDelay(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long base = Math.min(settings.getInitialBackoffMs() * (1L << exponent), settings.getMaxBackoffMs());
        long jitter = settings.getJitterMs() > 0 ? (long) (jitterRandom.nextDouble() * settings.getJitterMs()) : 0;
        return base + jitter;
    }

    void setJitterRandom(Random jitterRandom) {
        this.jitterRandom = jitterRandom;
    }

    // ---- Loop ----

    private void runLoop() {
        int attempt = 0;
        while (running) {
            transition(ConnectionState.CONNECTING, null);
            String dropReason;
            try {
                StreamChannel opened = connect();
                attempt = 0;
                consecutiveAuthFailures.set(0);
                transition(ConnectionState.RUNNING, null);
                dropReason = receive(opened);
            } catch (AuthException e) {
                int failures = consecutiveAuthFailures.incrementAndGet();
                if (failures >= settings.getMaxAuthFailures()) {
                    log.error("Event stream giving up after {} consecutive auth failures: {}", failures, e.getMessage());
                    closeChannel();
                    transition(ConnectionState.ERROR, e.getMessage());
                    running = false;
                    return;
                }
                dropReason = "auth failure " + failures + ": " + e.getMessage();
            } catch (BaseException e) {
                dropReason = e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                log.error("Event stream loop failed", e);
                closeChannel();
                transition(ConnectionState.ERROR, e.getMessage());
                running = false;
                return;
            } finally {
                closeChannel();
            }

            if (!running) {
                break;
            }
            attempt++;
            long delay = computeReconnectDelay(attempt);
            log.warn("Event stream dropped ({}), reconnecting in {}ms (attempt {})", dropReason, delay, attempt);
            transition(ConnectionState.RECONNECTING, dropReason);
            if (awaitStop(delay)) {
                break;
            }
        }
        log.info("Event stream loop exited");
    }

    private StreamChannel connect() {
        int connectionGeneration = generation.incrementAndGet();
        dialect = null;
        snapshotUnsupported = false;
        normalizer.resetGuards();
        refreshIndex();

        String connectionToken = negotiate();
        URI uri = hubUri(sessionManager.getBaseUrl(), connectionToken);
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Cookie", PanelHttpTransport.SESSION_COOKIE + "=" + sessionManager.ensureToken());
        headers.put("X-Requested-With", "XMLHttpRequest");

        StreamChannel opened = streamTransport.open(uri, headers, new QueueingListener(connectionGeneration));
        channel = opened;
        lastFrameAt = clock.instant();

        send(opened, SignalRProtocol.handshake());
        send(opened, SignalRProtocol.init());
        subscribedPanels = normalizer.index().panels();
        if (subscribedPanels.isEmpty()) {
            log.warn("No panels own a partition door, nothing to subscribe to");
        } else {
            send(opened, SignalRProtocol.subscribeToStatus(subscribedPanels));
            log.info("Event stream connected, subscribed to panels {}", subscribedPanels);
        }
        return opened;
    }

    /**
     * Processes inbound signals until the connection should be dropped.
     *
     * @return why the connection ended
     */
    private String receive(StreamChannel opened) throws InterruptedException {
        long now = clock.millis();
        long lastInbound = now;
        long nextPing = now + settings.getHeartbeatIntervalMs();
        long nextSnapshot = now + settings.getSnapshotIntervalMs();
        int currentGeneration = generation.get();

        while (running) {
            long deadline = Math.min(Math.min(nextPing, nextSnapshot), lastInbound + settings.getIdleTimeoutMs());
            Signal signal = inbound.poll(Math.max(1, deadline - clock.millis()), TimeUnit.MILLISECONDS);
            now = clock.millis();

            if (signal != null) {
                if (signal.kind == SignalKind.STOP) {
                    return "stopped";
                }
                if (signal.generation != currentGeneration) {
                    continue;
                }
                switch (signal.kind) {
                    case TEXT -> {
                        lastInbound = now;
                        lastFrameAt = clock.instant();
                        String closeReason = handleText(signal.payload);
                        if (closeReason != null) {
                            return closeReason;
                        }
                    }
                    case CLOSED -> {
                        return "closed: " + signal.payload;
                    }
                    case ERROR -> {
                        return "transport error: " + signal.payload;
                    }
                    case RECONNECT -> {
                        return "session renewed";
                    }
                    default -> {
                        // STOP handled above
                    }
                }
            } else if (now - lastInbound >= settings.getIdleTimeoutMs()) {
                return "no frame for " + settings.getIdleTimeoutMs() + "ms";
            }

            if (!opened.isOpen()) {
                return "socket no longer open";
            }
            if (now >= nextPing) {
                send(opened, SignalRProtocol.ping());
                nextPing = now + settings.getHeartbeatIntervalMs();
            }
            if (now >= nextSnapshot) {
                snapshot(opened);
                nextSnapshot = clock.millis() + settings.getSnapshotIntervalMs();
            }
        }
        return "stopped";
    }

    /** @return a drop reason when the server closed the hub connection, else null */
    private String handleText(String text) {
        boolean refreshRequested = false;
        Instant receivedAt = clock.instant();
        for (String raw : SignalRProtocol.split(text)) {
            JsonNode frame = JsonHelper.tryReadTree(raw);
            if (frame == null) {
                log.debug("Bad JSON frame skipped ({} chars)", raw.length());
                continue;
            }
            int type = SignalRProtocol.type(frame);
            if (type == SignalRProtocol.TYPE_CLOSE) {
                return "hub close: " + frame.path("error").asText("no reason");
            }
            if (type == -1 && frame.hasNonNull("error")) {
                return "handshake rejected: " + frame.get("error").asText();
            }
            try {
                if (SignalRProtocol.isInvocation(frame, SignalRProtocol.TARGET_STATUS)) {
                    refreshRequested |= handleStatusFrame(frame, receivedAt);
                } else if (SignalRProtocol.isInvocation(frame, SignalRProtocol.TARGET_NOTIFICATION)) {
                    refreshRequested |= handleNotificationFrame(frame, receivedAt);
                } else if (type == SignalRProtocol.TYPE_COMPLETION && frame.hasNonNull("error")) {
                    log.warn("Hub invocation {} failed: {}", frame.path("invocationId").asText(), frame.get("error").asText());
                }
            } catch (BaseException e) {
                log.warn("Frame handling failed: {}", e.getMessage());
            }
        }
        if (refreshRequested) {
            rebuildAndRetry();
        }
        return null;
    }

    private boolean handleStatusFrame(JsonNode frame, Instant receivedAt) {
        JsonNode args = frame.path("arguments");
        if (!args.isArray() || args.isEmpty()) {
            return false;
        }
        JsonNode payload = args.get(0);
        if (!"Door".equals(JsonHelper.text(payload, "statusType", "StatusType"))) {
            return false;
        }
        DoorStatus status = dialectNormalizer(payload).toDoorStatus(payload, null);
        if (status == null) {
            return false;
        }
        return applyFrame(normalizer.normalizeStatus(status, receivedAt, EventSource.PUSH));
    }

    private boolean handleNotificationFrame(JsonNode frame, Instant receivedAt) {
        boolean refresh = false;
        for (PanelNotification note : NotificationFrameParser.parse(frame)) {
            refresh |= applyFrame(normalizer.normalizeNotification(note, receivedAt));
        }
        return refresh;
    }

    /**
     * Requests every partition door's status. Servers without the status endpoint get the panels
     * re-subscribed instead, which makes them push current status.
     */
    private void snapshot(StreamChannel opened) {
        if (snapshotUnsupported) {
            resubscribe(opened);
            return;
        }
        int applied = 0;
        for (Integer doorId : normalizer.index().allowedDoors()) {
            Instant issuedAt = clock.instant();
            Optional<JsonNode> payload;
            try {
                payload = discoveryClient.doorStatus(doorId);
            } catch (BaseException e) {
                log.warn("Status snapshot for door {} failed: {}", doorId, e.getMessage());
                continue;
            }
            if (payload.isEmpty()) {
                log.info("Door status endpoint not available, snapshots fall back to re-subscribing");
                snapshotUnsupported = true;
                resubscribe(opened);
                return;
            }
            DoorStatus status = dialectNormalizer(payload.get()).toDoorStatus(payload.get(), doorId);
            if (status != null) {
                applyFrame(normalizer.normalizeStatus(status, issuedAt, EventSource.SNAPSHOT));
                applied++;
            }
        }
        log.debug("Status snapshot applied for {} doors", applied);
    }

    // ---- Private helpers ----

    private String negotiate() {
        JsonNode response = sessionManager
                .execute(PanelRequest.post(SignalRProtocol.HUB_PATH + "/negotiate", null)
                        .queryParam("negotiateVersion", 1)
                        .build())
                .json();
        String token = JsonHelper.text(response, "connectionToken", "connectionId");
        if (token == null) {
            throw new TransportException("Negotiate returned no connection token");
        }
        return token;
    }

    static URI hubUri(String baseUrl, String connectionToken) {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String scheme = trimmed.startsWith("https") ? "wss" : "ws";
        String authority = trimmed.substring(trimmed.indexOf("://") + 3);
        return URI.create(scheme + "://" + authority + SignalRProtocol.HUB_PATH + "?id="
                + URLEncoder.encode(connectionToken, StandardCharsets.UTF_8));
    }

    private void refreshIndex() {
        ReaderDoorIndex index = discoveryClient.buildIndex(partitionContext.requirePartitionId());
        normalizer.updateIndex(index);
    }

    private void rebuildAndRetry() {
        try {
            refreshIndex();
        } catch (BaseException e) {
            log.warn("Routing table refresh failed: {}", e.getMessage());
            return;
        }
        List<DoorEvent> recovered = normalizer.retryPending();
        recovered.forEach(stateStore::apply);
        StreamChannel current = channel;
        if (current != null && !normalizer.index().panels().equals(subscribedPanels)) {
            resubscribe(current);
        }
    }

    private void resubscribe(StreamChannel opened) {
        subscribedPanels = normalizer.index().panels();
        if (!subscribedPanels.isEmpty()) {
            send(opened, SignalRProtocol.subscribeToStatus(subscribedPanels));
        }
    }

    private boolean applyFrame(NormalizedFrame normalized) {
        for (DoorEvent event : normalized.getEvents()) {
            stateStore.apply(event);
        }
        return normalized.isRefreshRequested();
    }

    private DialectNormalizer dialectNormalizer(JsonNode payload) {
        if (dialect == null) {
            PanelDialect detected = DialectDetector.detect(payload);
            if (detected != null) {
                dialect = detected;
                log.info("Panel dialect detected: {}", detected);
                eventPublisherHelper.publishConnectionState(this, state.get(), state.get(), detected, "dialect detected");
            }
        }
        DialectNormalizer selected = dialectNormalizers.get(dialect != null ? dialect : PanelDialect.PROTECTOR_NET);
        if (selected == null) {
            throw new IllegalStateException("No normalizer registered for dialect " + dialect);
        }
        return selected;
    }

    private void send(StreamChannel target, String frame) {
        try {
            target.send(frame);
        } catch (IOException e) {
            throw new TransportException("Failed to send frame: " + e.getMessage(), e);
        }
    }

    private void closeChannel() {
        StreamChannel current = channel;
        channel = null;
        if (current != null) {
            current.close();
        }
    }

    private boolean awaitStop(long delayMs) {
        CountDownLatch latch;
        synchronized (lifecycleMonitor) {
            latch = stopLatch;
        }
        try {
            return latch.await(delayMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void transition(ConnectionState next, String detail) {
        ConnectionState previous = state.getAndSet(next);
        if (previous == next) {
            return;
        }
        log.info("Event stream {} -> {}{}", previous, next, detail != null ? " (" + detail + ")" : "");
        eventPublisherHelper.publishConnectionState(this, previous, next, dialect, detail);
        stateChangeDispatcher.publish(EntityKey.connection(), next);
    }

    private enum SignalKind {
        TEXT,
        CLOSED,
        ERROR,
        RECONNECT,
        STOP
    }

    private static final class Signal {

        final SignalKind kind;
        final int generation;
        final String payload;

        private Signal(SignalKind kind, int generation, String payload) {
            this.kind = kind;
            this.generation = generation;
            this.payload = payload;
        }

        static Signal stop() {
            return new Signal(SignalKind.STOP, -1, null);
        }

        static Signal reconnect(int generation) {
            return new Signal(SignalKind.RECONNECT, generation, null);
        }
    }

    /** Enqueues transport callbacks for the loop thread, tagged with their connection. */
    private final class QueueingListener implements StreamChannelListener {

        private final int connectionGeneration;

        QueueingListener(int connectionGeneration) {
            this.connectionGeneration = connectionGeneration;
        }

        @Override
        public void onText(String text) {
            inbound.offer(new Signal(SignalKind.TEXT, connectionGeneration, text));
        }

        @Override
        public void onClosed(String reason) {
            inbound.offer(new Signal(SignalKind.CLOSED, connectionGeneration, reason));
        }

        @Override
        public void onError(Throwable error) {
            inbound.offer(new Signal(SignalKind.ERROR, connectionGeneration, String.valueOf(error.getMessage())));
        }
    }
}
