package com.panelbridge.stream;

import com.panelbridge.config.PanelConfig;
import com.panelbridge.config.TlsSupport;
import com.panelbridge.exception.TransportException;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * {@link StreamTransport} on Spring's {@link StandardWebSocketClient} (JSR-356, Tomcat
 * implementation). Certificate checks follow {@code panel.verify-ssl}.
 */
@Component
public class SpringWebSocketStreamTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(SpringWebSocketStreamTransport.class);

    /** Tomcat's user property for a custom client {@code SSLContext}. */
    static final String SSL_CONTEXT_PROPERTY = "org.apache.tomcat.websocket.SSL_CONTEXT";

    private static final int MAX_TEXT_MESSAGE_BYTES = 1024 * 1024;

    private final PanelConfig panelConfig;
    private final StandardWebSocketClient client;

    public SpringWebSocketStreamTransport(PanelConfig panelConfig) {
        this.panelConfig = panelConfig;
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        this.client = new StandardWebSocketClient(container);
        if (!panelConfig.isVerifySsl()) {
            this.client.setUserProperties(Map.of(SSL_CONTEXT_PROPERTY, TlsSupport.trustAllContext()));
        }
    }

    @Override
    public StreamChannel open(URI uri, Map<String, String> headers, StreamChannelListener listener) {
        WebSocketHttpHeaders handshakeHeaders = new WebSocketHttpHeaders();
        headers.forEach(handshakeHeaders::add);
        long timeoutMs = panelConfig.getHttp().getConnectTimeout();
        try {
            WebSocketSession session = client.execute(new ListenerAdapter(listener), handshakeHeaders, uri)
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("WebSocket open to {}", uri.getHost());
            return new SessionChannel(session);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while opening the event stream", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransportException("Event stream upgrade failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new TransportException("Event stream upgrade timed out after " + timeoutMs + "ms", e);
        }
    }

    private static final class ListenerAdapter extends TextWebSocketHandler {

        private final StreamChannelListener listener;

        ListenerAdapter(StreamChannelListener listener) {
            this.listener = listener;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onText(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClosed(status.toString());
        }
    }

    private static final class SessionChannel implements StreamChannel {

        private final WebSocketSession session;

        SessionChannel(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(String text) throws IOException {
            session.sendMessage(new TextMessage(text));
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public void close() {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error closing event stream: {}", e.getMessage());
            }
        }
    }
}
