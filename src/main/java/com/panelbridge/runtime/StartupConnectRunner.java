package com.panelbridge.runtime;

import com.panelbridge.config.PanelConfig;
import com.panelbridge.domain.model.PanelCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Runs the startup sequence once the application is ready: log in, discover the configured
 * partition, start the event stream.
 *
 * <p>Skipped when {@code panel.auto-start} is off or the connection settings are incomplete. A
 * failure here is logged and leaves the runtime idle; callers can still drive
 * {@link PanelRuntime} by hand.
 */
@Component
public class StartupConnectRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupConnectRunner.class);

    private final PanelRuntime panelRuntime;
    private final PanelConfig panelConfig;

    public StartupConnectRunner(PanelRuntime panelRuntime, PanelConfig panelConfig) {
        this.panelRuntime = panelRuntime;
        this.panelConfig = panelConfig;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!panelConfig.isAutoStart()) {
            log.info("Startup: panel.auto-start is off, waiting for explicit connect");
            return;
        }
        if (isBlank(panelConfig.getBaseUrl()) || isBlank(panelConfig.getUsername()) || panelConfig.getPartitionId() == null) {
            log.warn("Startup: panel.base-url, panel.username and panel.partition-id are required for auto-start");
            return;
        }
        try {
            panelRuntime.connect(PanelCredentials.builder()
                    .baseUrl(panelConfig.getBaseUrl())
                    .username(panelConfig.getUsername())
                    .password(panelConfig.getPassword())
                    .build());
            panelRuntime.discover(panelConfig.getPartitionId());
            panelRuntime.startStream();
        } catch (RuntimeException e) {
            log.error("Startup: panel connect failed, runtime left idle: {}", e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
