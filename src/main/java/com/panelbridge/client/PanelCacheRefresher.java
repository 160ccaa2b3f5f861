package com.panelbridge.client;

import com.panelbridge.event.CacheRefreshRequestedEvent;
import com.panelbridge.exception.BaseException;
import com.panelbridge.state.PanelStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps the remote-owned caches (OTR schedules, temp codes) close to the panel.
 *
 * <p>Runs every {@code panel.cache.refresh-interval-ms} (5 minutes) and, asynchronously, right
 * after a create or delete. Nothing is refreshed before discovery has loaded the doors. A failed
 * refresh keeps the previous cache and is retried on the next tick.
 */
@Service
public class PanelCacheRefresher {

    private static final Logger log = LoggerFactory.getLogger(PanelCacheRefresher.class);

    private final OtrScheduleClient otrScheduleClient;
    private final TempCodeClient tempCodeClient;
    private final PanelStateStore stateStore;

    public PanelCacheRefresher(
            OtrScheduleClient otrScheduleClient, TempCodeClient tempCodeClient, PanelStateStore stateStore) {
        this.otrScheduleClient = otrScheduleClient;
        this.tempCodeClient = tempCodeClient;
        this.stateStore = stateStore;
    }

    @Scheduled(
            fixedRateString = "${panel.cache.refresh-interval-ms:300000}",
            initialDelayString = "${panel.cache.refresh-interval-ms:300000}")
    public void scheduledRefresh() {
        refresh("scheduled");
    }

    @Async
    @EventListener
    public void onRefreshRequested(CacheRefreshRequestedEvent event) {
        refresh(event.getTrigger());
    }

    /** Refreshes both caches; each one fails independently. */
    public void refresh(String trigger) {
        if (!stateStore.hasDoors()) {
            log.debug("Cache refresh ({}) skipped: no doors discovered yet", trigger);
            return;
        }
        try {
            int count = otrScheduleClient.list().size();
            log.debug("OTR cache refreshed ({}): {} schedules", trigger, count);
        } catch (BaseException e) {
            log.warn("OTR cache refresh ({}) failed, keeping previous: {}", trigger, e.getMessage());
        }
        try {
            tempCodeClient.refresh();
        } catch (BaseException e) {
            log.warn("Temp code refresh ({}) failed, keeping previous: {}", trigger, e.getMessage());
        }
    }
}
