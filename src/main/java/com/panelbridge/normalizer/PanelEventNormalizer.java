package com.panelbridge.normalizer;

import com.panelbridge.config.PanelConfig;
import com.panelbridge.domain.enums.DoorEventType;
import com.panelbridge.domain.enums.EventSource;
import com.panelbridge.domain.enums.LockState;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DoorEvent;
import com.panelbridge.domain.model.DoorStatus;
import com.panelbridge.domain.model.PanelNotification;
import com.panelbridge.state.EventSequencer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps dialect-neutral door statuses and panel notifications onto canonical {@link DoorEvent}s.
 *
 * <p>Routing state lives here: the current {@link ReaderDoorIndex}, the last non-overridden reader
 * mode per door (restored when a notification says the schedule resumed), the time of the last
 * real status per door, and the buffer of reader notifications that could not be routed yet.
 *
 * <p>Status for a statusId on a subscribed panel but outside the partition is ignored; a statusId
 * on an unknown panel means the tables are stale and asks the caller for a rebuild. Buffered
 * notifications get one more attempt after that rebuild ({@link #retryPending()}).
 */
@Component
public class PanelEventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(PanelEventNormalizer.class);

    private final EventSequencer eventSequencer;
    private final Clock clock;
    private final Duration synthesisGuard;
    private final UnresolvedNotificationBuffer pending;

    private final AtomicReference<ReaderDoorIndex> index = new AtomicReference<>(ReaderDoorIndex.empty());
    private final Map<Integer, ReaderMode> baselineModes = new ConcurrentHashMap<>();
    private final Map<Integer, Instant> lastRealStatusAt = new ConcurrentHashMap<>();

    public PanelEventNormalizer(EventSequencer eventSequencer, PanelConfig panelConfig, Clock clock) {
        this.eventSequencer = eventSequencer;
        this.clock = clock;
        this.synthesisGuard = Duration.ofMillis(panelConfig.getStream().getSynthesisGuardMs());
        this.pending = new UnresolvedNotificationBuffer(panelConfig.getStream().getPendingBufferSize());
    }

    public void updateIndex(ReaderDoorIndex newIndex) {
        index.set(newIndex);
        log.debug("Routing index replaced: {} routable doors, panels {}", newIndex.mappedDoorCount(), newIndex.panels());
    }

    public ReaderDoorIndex index() {
        return index.get();
    }

    public ReaderMode baselineMode(int doorId) {
        return baselineModes.get(doorId);
    }

    /**
     * Normalizes a pushed or snapshot status.
     *
     * @param timestamp local time of the status: receive time for pushes, request-issue time for
     *     snapshots
     */
    public NormalizedFrame normalizeStatus(DoorStatus status, Instant timestamp, EventSource source) {
        ReaderDoorIndex current = index.get();
        Integer doorId = status.getDoorId() != null ? status.getDoorId() : current.doorForStatusId(status.getStatusId());
        if (doorId == null) {
            String panel = ReaderDoorIndex.panelOf(status.getStatusId());
            if (current.isSubscribedPanel(panel)) {
                log.trace("Status for door outside the partition ignored: {}", status.getStatusId());
                return NormalizedFrame.nothing();
            }
            log.debug("Status for unknown statusId {}, routing tables look stale", status.getStatusId());
            return NormalizedFrame.refresh();
        }
        if (!current.isAllowed(doorId)) {
            return NormalizedFrame.nothing();
        }

        lastRealStatusAt.put(doorId, clock.instant());
        if (Boolean.FALSE.equals(status.getOverridden()) && status.getReaderMode() != null) {
            baselineModes.put(doorId, status.getReaderMode());
        }
        return NormalizedFrame.of(statusEvents(doorId, status, timestamp, source));
    }

    /**
     * Normalizes a notification into its log event plus any status the text implies. Synthesized
     * status is skipped when a real status for the door arrived within the guard window.
     */
    public NormalizedFrame normalizeNotification(PanelNotification note, Instant receivedAt) {
        ReaderDoorIndex current = index.get();
        Integer doorId = resolveDoor(note, current);
        if (doorId == null) {
            if (note.upperType().startsWith("ACTIONPLAN_")) {
                return NormalizedFrame.nothing();
            }
            if (note.isReaderSourced()) {
                pending.add(note, receivedAt);
                log.debug("Reader notification from '{}' unresolved, buffered", note.getSourceName());
                return NormalizedFrame.refresh();
            }
            log.debug("Unmapped notification ignored: {} '{}'", note.upperType(), note.getMessage());
            return NormalizedFrame.nothing();
        }
        if (!current.isAllowed(doorId)) {
            return NormalizedFrame.nothing();
        }
        return NormalizedFrame.of(notificationEvents(doorId, note, receivedAt));
    }

    /**
     * Re-resolves buffered notifications against the current tables. Each gets this single retry;
     * still-unresolved ones are dropped with a WARN.
     */
    public List<DoorEvent> retryPending() {
        List<DoorEvent> events = new ArrayList<>();
        ReaderDoorIndex current = index.get();
        for (UnresolvedNotificationBuffer.Pending entry : pending.drain()) {
            Integer doorId = resolveDoor(entry.notification, current);
            if (doorId == null) {
                log.warn(
                        "Reconciliation: notification from reader '{}' (id {}) still unresolved after refresh, dropped",
                        entry.notification.getSourceName(),
                        entry.notification.getSourceId());
                continue;
            }
            if (current.isAllowed(doorId)) {
                events.addAll(notificationEvents(doorId, entry.notification, entry.receivedAt));
            }
        }
        return events;
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Clears per-connection caches. The routing index and baselines survive reconnects. */
    public void resetGuards() {
        lastRealStatusAt.clear();
    }

    // ---- Private helpers ----

    private Integer resolveDoor(PanelNotification note, ReaderDoorIndex current) {
        String sourceType = note.getSourceType() != null ? note.getSourceType().trim() : "";
        if ("door".equalsIgnoreCase(sourceType) && note.getSourceId() != null) {
            return note.getSourceId();
        }
        if (note.isReaderSourced()) {
            Integer byReader = current.doorForReader(note.getSourceId(), note.getSourceName());
            if (byReader != null) {
                return byReader;
            }
        }
        Integer byName = current.doorForText(note.getSourceName());
        if (byName != null) {
            return byName;
        }
        Integer byMessage = current.doorForText(note.getMessage());
        if (byMessage != null) {
            return byMessage;
        }
        return current.doorForTargetPhrase(note.getMessage());
    }

    private List<DoorEvent> notificationEvents(int doorId, PanelNotification note, Instant receivedAt) {
        // the panel clock may drift from ours; its Date is kept for display only
        Instant timestamp = receivedAt;
        List<DoorEvent> events = new ArrayList<>(3);

        NotificationInterpreter.LogLine line = NotificationInterpreter.logLine(note);
        if (line != null) {
            events.add(DoorEvent.builder()
                    .type(line.type)
                    .doorId(doorId)
                    .timestamp(timestamp)
                    .sequence(eventSequencer.next())
                    .source(EventSource.PUSH)
                    .panelTime(note.getDate())
                    .actor(line.actor)
                    .readerMessage(line.readerMessage)
                    .doorMessage(line.doorMessage)
                    .build());
        }

        List<DoorStatus> implied = NotificationInterpreter.impliedStatuses(note, baselineModes.get(doorId));
        if (!implied.isEmpty()) {
            if (recentRealStatus(doorId)) {
                log.debug("Synthesized status for door {} skipped, real status is fresher", doorId);
            } else {
                for (DoorStatus status : implied) {
                    events.addAll(statusEvents(doorId, status, timestamp, EventSource.SYNTHESIZED));
                }
            }
        }
        return events;
    }

    private boolean recentRealStatus(int doorId) {
        Instant last = lastRealStatusAt.get(doorId);
        return last != null && Duration.between(last, clock.instant()).compareTo(synthesisGuard) <= 0;
    }

    private List<DoorEvent> statusEvents(int doorId, DoorStatus status, Instant timestamp, EventSource source) {
        List<DoorEvent> events = new ArrayList<>(2);
        LockState lock = LockState.fromStrikeOpener(status.getStrike(), status.getOpener());
        if (lock != LockState.UNKNOWN) {
            events.add(base(DoorEventType.LOCK_STATE_CHANGED, doorId, timestamp, source)
                    .lockState(lock)
                    .build());
        }
        if (Boolean.TRUE.equals(status.getOverridden())) {
            events.add(base(DoorEventType.OVERRIDE_CHANGED, doorId, timestamp, source)
                    .overridden(Boolean.TRUE)
                    .readerMode(status.getReaderMode())
                    .build());
        } else if (Boolean.FALSE.equals(status.getOverridden())) {
            events.add(base(DoorEventType.SCHEDULE_FLIPPED, doorId, timestamp, source)
                    .overridden(Boolean.FALSE)
                    .readerMode(status.getReaderMode())
                    .build());
        } else if (status.getReaderMode() != null) {
            events.add(base(DoorEventType.OVERRIDE_CHANGED, doorId, timestamp, source)
                    .readerMode(status.getReaderMode())
                    .build());
        }
        return events;
    }

    private DoorEvent.DoorEventBuilder base(DoorEventType type, int doorId, Instant timestamp, EventSource source) {
        return DoorEvent.builder()
                .type(type)
                .doorId(doorId)
                .timestamp(timestamp)
                .sequence(eventSequencer.next())
                .source(source);
    }
}
