package com.panelbridge.config;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Clock;
import java.time.ZoneId;
import javax.net.ssl.HttpsURLConnection;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and bean definitions for the panel connection.
 *
 * <p>Binds to the {@code panel.*} prefix in application.yml. Provides:
 * <ul>
 *   <li>A {@link RestClient} bean for all cookie-authenticated panel HTTP calls. Panels commonly
 *       run with self-signed certificates, so certificate checks follow {@code panel.verify-ssl}.</li>
 *   <li>The UTC {@link Clock} used for event timestamps and override minute computation.</li>
 *   <li>Nested settings for HTTP timeouts, the event stream and the schedule/temp-code cache.</li>
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "panel")
@Getter
@Setter
public class PanelConfig {

    private static final Logger log = LoggerFactory.getLogger(PanelConfig.class);

    /** Panel base URL, e.g. {@code https://panel.example.local:11001}. */
    private String baseUrl;

    private String username;

    private String password;

    /** Partition selected at setup. All discovery and commands are scoped to it. */
    private Integer partitionId;

    /** Verify the panel's TLS certificate. Off by default: most panels ship self-signed certs. */
    private boolean verifySsl = false;

    /** Duration used for timed overrides when the caller gives no usable minutes or until time. */
    private int defaultOverrideMinutes = 5;

    /** Zone applied to date-times supplied without an offset (until, temp code and OTR bounds). */
    private String inputZone = "UTC";

    /** Connect, discover and start the event stream once the application is ready. */
    private boolean autoStart = true;

    private Http http = new Http();

    private Stream stream = new Stream();

    private Cache cache = new Cache();

    @Bean
    public RestClient panelRestClient() {
        log.info("Creating panel RestClient for {} (verifySsl={})", baseUrl, verifySsl);
        SimpleClientHttpRequestFactory requestFactory = verifySsl
                ? new SimpleClientHttpRequestFactory()
                : new TrustAllRequestFactory();
        requestFactory.setConnectTimeout(http.getConnectTimeout());
        requestFactory.setReadTimeout(http.getReadTimeout());
        RestClient.Builder builder = RestClient.builder().requestFactory(requestFactory);
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    @Bean
    public Clock panelClock() {
        return Clock.systemUTC();
    }

    public ZoneId resolveInputZone() {
        return ZoneId.of(inputZone);
    }

    @Getter
    @Setter
    public static class Http {

        /** HTTP connect timeout in milliseconds. */
        private int connectTimeout = 10_000;

        /** HTTP read timeout in milliseconds. */
        private int readTimeout = 15_000;

        /** Extra attempts for idempotent GETs that fail at the transport level. */
        private int transportRetries = 2;

        /** Delay before the first transport retry; doubles per attempt. */
        private long retryBackoffMs = 500;
    }

    @Getter
    @Setter
    public static class Stream {

        private long initialBackoffMs = 5_000;

        private long maxBackoffMs = 30_000;

        /** Upper bound of the uniform random jitter added to each reconnect delay. */
        private long jitterMs = 1_500;

        /** Interval between SignalR pings sent by the receive loop. */
        private long heartbeatIntervalMs = 15_000;

        /** Silence after which the connection is considered dropped. */
        private long idleTimeoutMs = 30_000;

        /** Interval between door status snapshots while the stream is running. */
        private long snapshotIntervalMs = 60_000;

        private long shutdownGraceMs = 5_000;

        /** Consecutive auth failures during negotiate/handshake before the client gives up. */
        private int maxAuthFailures = 3;

        /** Capacity of the buffer holding notifications whose reader is not yet mapped. */
        private int pendingBufferSize = 64;

        /** A real status frame this recent suppresses status synthesized from notification text. */
        private long synthesisGuardMs = 1_000;
    }

    @Getter
    @Setter
    public static class Cache {

        /** Refresh interval for OTR schedules and temp codes. */
        private long refreshIntervalMs = 300_000;
    }

    /** Request factory that accepts any server certificate, for panels with self-signed certs. */
    static class TrustAllRequestFactory extends SimpleClientHttpRequestFactory {

        @Override
        protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
            if (connection instanceof HttpsURLConnection https) {
                https.setSSLSocketFactory(TlsSupport.trustAllContext().getSocketFactory());
                https.setHostnameVerifier((host, session) -> true);
            }
            super.prepareConnection(connection, httpMethod);
        }
    }
}
