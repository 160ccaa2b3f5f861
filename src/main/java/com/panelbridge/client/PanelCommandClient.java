package com.panelbridge.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelbridge.domain.enums.DoorEventType;
import com.panelbridge.domain.enums.EventSource;
import com.panelbridge.domain.enums.OverrideType;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DoorEvent;
import com.panelbridge.domain.model.OverrideState;
import com.panelbridge.exception.BaseException;
import com.panelbridge.exception.ValidationException;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelSessionManager;
import com.panelbridge.state.EventSequencer;
import com.panelbridge.state.PanelStateStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Door commands: override, resume, pulse and the panel-wide configuration push.
 *
 * <p>Each door is commanded with its own HTTP call so one rejected door never fails the others.
 * Door ids the state store does not know are rejected locally without a call. A successful
 * override or resume is applied to the store right away as a COMMAND event stamped with the time
 * the request was issued; the panel's own status push, which is always later, then confirms or
 * corrects it.
 */
@Service
public class PanelCommandClient {

    private static final Logger log = LoggerFactory.getLogger(PanelCommandClient.class);

    private final PanelSessionManager sessionManager;
    private final PanelStateStore stateStore;
    private final OverrideMinutesCalculator minutesCalculator;
    private final ReaderModeLegend readerModeLegend;
    private final EventSequencer eventSequencer;
    private final Clock clock;

    public PanelCommandClient(
            PanelSessionManager sessionManager,
            PanelStateStore stateStore,
            OverrideMinutesCalculator minutesCalculator,
            ReaderModeLegend readerModeLegend,
            EventSequencer eventSequencer,
            Clock clock) {
        this.sessionManager = sessionManager;
        this.stateStore = stateStore;
        this.minutesCalculator = minutesCalculator;
        this.readerModeLegend = readerModeLegend;
        this.eventSequencer = eventSequencer;
        this.clock = clock;
    }

    /**
     * Overrides the given doors.
     *
     * @param type override duration policy
     * @param mode reader mode to hold; {@link ReaderMode#NONE} is rejected
     * @param minutes explicit minutes for {@link OverrideType#TIMED}
     * @param until end time for {@link OverrideType#TIMED} when {@code minutes} is null
     * @throws ValidationException before any call when the type or mode is unusable
     */
    public CommandResult override(
            Collection<Integer> doorIds, OverrideType type, ReaderMode mode, Integer minutes, Instant until) {
        if (type == null) {
            throw new ValidationException("Override type is required");
        }
        if (mode == null || mode == ReaderMode.NONE) {
            throw new ValidationException("Override mode must be a concrete reader mode, got " + mode);
        }
        Integer resolvedMinutes =
                type == OverrideType.TIMED ? minutesCalculator.resolve(minutes, until, null) : null;
        Instant effectiveUntil = resolvedMinutes != null ? clock.instant().plusSeconds(resolvedMinutes * 60L) : null;
        int modeIndex = readerModeLegend.indexOf(mode);

        OverrideState policy = OverrideState.builder()
                .type(type)
                .mode(mode)
                .minutes(resolvedMinutes)
                .until(effectiveUntil)
                .build();

        return forEachDoor("override", doorIds, doorId -> {
            ObjectNode body = doorIdsBody(doorId);
            body.put("OverrideType", type.getWireToken());
            body.put("TimeZoneMode", mode.getWireToken());
            if (resolvedMinutes != null) {
                body.put("Minutes", resolvedMinutes);
            }
            body.put("ModeIndex", modeIndex);
            body.put("TimeZoneModeIndex", modeIndex);
            body.put("TimeZone", modeIndex);
            body.put("TimeZoneState", modeIndex);

            Instant issuedAt = clock.instant();
            sessionManager.execute(PanelRequest.post("/api/PanelCommands/OverrideDoor", body).build());
            log.info(
                    "Override sent to door {}: type={} mode={} (index {}) minutes={}",
                    doorId,
                    type.getWireToken(),
                    mode.getWireToken(),
                    modeIndex,
                    resolvedMinutes);
            stateStore.apply(DoorEvent.builder()
                    .type(DoorEventType.OVERRIDE_CHANGED)
                    .doorId(doorId)
                    .timestamp(issuedAt)
                    .sequence(eventSequencer.next())
                    .source(EventSource.COMMAND)
                    .overridden(Boolean.TRUE)
                    .readerMode(mode)
                    .override(policy)
                    .build());
        });
    }

    /** Returns the doors to their schedule. Safe on doors that are not overridden. */
    public CommandResult resume(Collection<Integer> doorIds) {
        return forEachDoor("resume", doorIds, doorId -> {
            Instant issuedAt = clock.instant();
            sessionManager.execute(PanelRequest.post("/api/PanelCommands/ResumeDoor", doorIdsBody(doorId)).build());
            log.info("Resume sent to door {}", doorId);
            stateStore.apply(DoorEvent.builder()
                    .type(DoorEventType.SCHEDULE_FLIPPED)
                    .doorId(doorId)
                    .timestamp(issuedAt)
                    .sequence(eventSequencer.next())
                    .source(EventSource.COMMAND)
                    .overridden(Boolean.FALSE)
                    .build());
        });
    }

    /** Momentary unlock. The resulting lock changes arrive from the stream. */
    public CommandResult pulse(Collection<Integer> doorIds) {
        return forEachDoor("pulse", doorIds, doorId -> {
            sessionManager.execute(PanelRequest.post("/api/PanelCommands/PulseDoor", doorIdsBody(doorId)).build());
            log.info("Pulse sent to door {}", doorId);
        });
    }

    /** Pushes the server's configuration to every connected panel. */
    public void updatePanels() {
        sessionManager.execute(PanelRequest.post("/api/PanelCommands/UpdateAll", JsonHelper.newObject()).build());
        log.info("Update panels command sent");
    }

    // ---- Private helpers ----

    private CommandResult forEachDoor(String command, Collection<Integer> doorIds, IntConsumer action) {
        if (doorIds == null || doorIds.isEmpty()) {
            throw new ValidationException("At least one door id is required for " + command);
        }
        List<TargetResult> results = new ArrayList<>(doorIds.size());
        for (Integer doorId : doorIds) {
            if (doorId == null || !stateStore.hasDoor(doorId)) {
                log.warn("{} skipped for unknown door {}", command, doorId);
                results.add(TargetResult.failed(doorId == null ? -1 : doorId, "Unknown door " + doorId));
                continue;
            }
            try {
                action.accept(doorId);
                results.add(TargetResult.ok(doorId));
            } catch (BaseException e) {
                log.error("{} failed for door {}: {}", command, doorId, e.getMessage());
                results.add(TargetResult.failed(doorId, e.getMessage()));
            }
        }
        return new CommandResult(command, results);
    }

    private static ObjectNode doorIdsBody(int doorId) {
        ObjectNode body = JsonHelper.newObject();
        body.putArray("DoorIds").add(doorId);
        return body;
    }
}
