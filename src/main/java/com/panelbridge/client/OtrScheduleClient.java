package com.panelbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelbridge.config.PanelConfig;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DoorDescriptor;
import com.panelbridge.domain.model.OtrSchedule;
import com.panelbridge.event.EventPublisherHelper;
import com.panelbridge.exception.RemoteRejectionException;
import com.panelbridge.exception.ValidationException;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelSessionManager;
import com.panelbridge.state.PanelStateStore;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One-time-run (OTR) door overrides scheduled on the panel.
 *
 * <p>The panel owns these schedules; the state store keeps a cache that {@link #list()} replaces.
 * Create and delete request an immediate cache refresh on top of the periodic one.
 */
@Service
public class OtrScheduleClient {

    private static final Logger log = LoggerFactory.getLogger(OtrScheduleClient.class);

    static final String PATH = "/api/OneTimeRunTimeZones/Doors";
    static final long ID_LOOKUP_DELAY_MS = 500;

    private static final DateTimeFormatter DEFAULT_NAME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final PanelSessionManager sessionManager;
    private final PanelStateStore stateStore;
    private final PanelConfig panelConfig;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public OtrScheduleClient(
            PanelSessionManager sessionManager,
            PanelStateStore stateStore,
            PanelConfig panelConfig,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.sessionManager = sessionManager;
        this.stateStore = stateStore;
        this.panelConfig = panelConfig;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Schedules an override of the given doors between {@code start} and {@code stop}.
     *
     * @param mode reader mode while active; null means {@link ReaderMode#UNLOCK}
     * @param name schedule name, truncated to 60 characters; generated when blank
     */
    public OtrSchedule create(
            Collection<Integer> doorIds, String start, String stop, ReaderMode mode, String name, String description) {
        if (doorIds == null || doorIds.isEmpty()) {
            throw new ValidationException("At least one door id is required");
        }
        for (Integer doorId : doorIds) {
            if (doorId == null || !stateStore.hasDoor(doorId)) {
                throw new ValidationException("Unknown door " + doorId);
            }
        }
        ReaderMode effectiveMode = mode != null ? mode : ReaderMode.UNLOCK;
        if (effectiveMode == ReaderMode.NONE) {
            throw new ValidationException("Schedule mode must be a concrete reader mode");
        }
        Instant startUtc = requireTime(start, "start");
        Instant stopUtc = requireTime(stop, "stop");
        if (!stopUtc.isAfter(startUtc)) {
            throw new ValidationException("Stop time must be after start time");
        }
        String scheduleName = truncate(
                name == null || name.isBlank()
                        ? "HA Schedule " + DEFAULT_NAME.format(clock.instant().atZone(panelConfig.resolveInputZone()))
                        : name.trim(),
                60);

        String startWire = PanelTimeFormat.toWire(startUtc);
        String stopWire = PanelTimeFormat.toWire(stopUtc);
        ObjectNode payload = JsonHelper.newObject();
        payload.put("Name", scheduleName);
        payload.put("StartTime", startWire);
        payload.put("StopTime", stopWire);
        ArrayNode doors = payload.putArray("Doors");
        for (Integer doorId : doorIds) {
            doors.addObject().put("Id", doorId).put("Mode", effectiveMode.getWireToken());
        }
        payload.putArray("Dates").addObject().put("StartTime", startWire).put("StopTime", stopWire);
        if (description != null && !description.isBlank()) {
            payload.put("Description", truncate(description, 255));
        }

        JsonNode created = sessionManager.execute(PanelRequest.post(PATH, payload).build()).json();
        Long id = JsonHelper.longValue(created, "Id");
        if (id == null) {
            throw new RemoteRejectionException(200, "Schedule creation returned no Id");
        }
        if (id == 0) {
            id = lookupIdByName(scheduleName);
        }
        log.info("Created OTR schedule {} '{}' for doors {}: {} to {}", id, scheduleName, doorIds, startWire, stopWire);
        eventPublisherHelper.publishCacheRefresh(this, "otr-created");

        return OtrSchedule.builder()
                .id(id)
                .doorIds(List.copyOf(doorIds))
                .name(scheduleName)
                .mode(effectiveMode.getWireToken())
                .startUtc(startUtc)
                .stopUtc(stopUtc)
                .description(description)
                .build();
    }

    /** Fetches every schedule, replaces the cache and returns the list. */
    public List<OtrSchedule> list() {
        JsonNode root = sessionManager
                .execute(PanelRequest.get(PATH)
                        .queryParam("PageNumber", 1)
                        .queryParam("PerPage", 100)
                        .build())
                .json();
        Map<String, Integer> doorIdByName = doorIdsByName();
        List<OtrSchedule> schedules = new ArrayList<>();
        for (JsonNode row : JsonHelper.results(root)) {
            Long id = JsonHelper.longValue(row, "Id");
            if (id == null) {
                continue;
            }
            List<Integer> doorIds = resolveDoorIds(row, doorIdByName);
            if (doorIds.isEmpty()) {
                log.debug("OTR schedule {} has no resolvable door (DoorName={})", id, JsonHelper.text(row, "DoorName"));
            }
            schedules.add(OtrSchedule.builder()
                    .id(id)
                    .doorIds(doorIds)
                    .doorName(JsonHelper.text(row, "DoorName"))
                    .name(JsonHelper.text(row, "Name"))
                    .mode(JsonHelper.text(row, "Mode"))
                    .startUtc(PanelTimeFormat.fromWire(JsonHelper.text(row, "StartTime")))
                    .stopUtc(PanelTimeFormat.fromWire(JsonHelper.text(row, "StopTime")))
                    .description(JsonHelper.text(row, "Description"))
                    .build());
        }
        stateStore.replaceOtrSchedules(schedules);
        return schedules;
    }

    public void delete(long scheduleId) {
        sessionManager.execute(PanelRequest.delete(PATH + "/" + scheduleId).build());
        log.info("Deleted OTR schedule {}", scheduleId);
        eventPublisherHelper.publishCacheRefresh(this, "otr-deleted");
    }

    // ---- Private helpers ----

    /** The panel often answers a create with Id 0; the real id shows up in the list shortly after. */
    private long lookupIdByName(String scheduleName) {
        try {
            Thread.sleep(ID_LOOKUP_DELAY_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        }
        for (OtrSchedule schedule : list()) {
            if (scheduleName.equals(schedule.getName())) {
                return schedule.getId();
            }
        }
        log.warn("OTR schedule '{}' created but its id could not be found", scheduleName);
        return 0;
    }

    private static List<Integer> resolveDoorIds(JsonNode row, Map<String, Integer> doorIdByName) {
        List<Integer> doorIds = new ArrayList<>();
        Integer single = JsonHelper.integer(row, "DoorId");
        if (single != null && single != 0) {
            doorIds.add(single);
            return doorIds;
        }
        for (JsonNode door : row.path("Doors")) {
            Integer id = JsonHelper.integer(door, "Id");
            if (id != null) {
                doorIds.add(id);
            }
        }
        if (doorIds.isEmpty()) {
            String doorName = JsonHelper.text(row, "DoorName");
            Integer byName = doorName != null ? doorIdByName.get(doorName) : null;
            if (byName != null) {
                doorIds.add(byName);
            }
        }
        return doorIds;
    }

    private Map<String, Integer> doorIdsByName() {
        Map<String, Integer> byName = new HashMap<>();
        for (DoorDescriptor door : stateStore.doorDescriptors()) {
            if (door.getName() != null) {
                byName.put(door.getName(), door.getId());
            }
        }
        return byName;
    }

    private Instant requireTime(String value, String label) {
        Instant parsed = PanelTimeFormat.parse(value, panelConfig.resolveInputZone());
        if (parsed == null) {
            throw new ValidationException("Invalid " + label + " time '" + value + "'");
        }
        return parsed;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
