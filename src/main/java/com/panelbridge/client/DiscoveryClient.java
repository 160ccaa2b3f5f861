package com.panelbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.domain.model.ActionPlan;
import com.panelbridge.domain.model.DiscoveryResult;
import com.panelbridge.domain.model.DoorDescriptor;
import com.panelbridge.domain.model.Partition;
import com.panelbridge.domain.model.Reader;
import com.panelbridge.exception.RemoteRejectionException;
import com.panelbridge.exception.ResourceNotFoundException;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.normalizer.ReaderDoorIndex;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelSessionManager;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read-only panel queries: partitions, doors, readers, action plans, the system overview tree,
 * the reader-mode legend and per-door status.
 *
 * <p>{@link #discover(int)} combines them into the partition snapshot the state store is loaded
 * from. Door status ids come from the overview tree; a door missing there is still discovered but
 * cannot be routed from the stream until the next rebuild.
 */
@Service
public class DiscoveryClient {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryClient.class);

    static final int PAGE_SIZE = 500;

    private final PanelSessionManager sessionManager;
    private final ReaderModeLegend readerModeLegend;

    public DiscoveryClient(PanelSessionManager sessionManager, ReaderModeLegend readerModeLegend) {
        this.sessionManager = sessionManager;
        this.readerModeLegend = readerModeLegend;
    }

    /**
     * Discovers everything the runtime needs about one partition.
     *
     * @throws ResourceNotFoundException when the partition is not manageable by the account
     */
    public DiscoveryResult discover(int partitionId) {
        Partition partition = listPartitions().stream()
                .filter(p -> p.getId() == partitionId)
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Partition", partitionId));

        Map<Integer, String> doorNames = listDoors(partitionId);
        List<Reader> readers = listReaders(partitionId);
        ReaderDoorIndex index = buildIndex(doorNames, readers);
        loadLegend();

        DiscoveryResult.DiscoveryResultBuilder result = DiscoveryResult.builder().partition(partition);
        doorNames.forEach((id, name) -> result.door(DoorDescriptor.builder()
                .id(id)
                .name(name)
                .partitionId(partitionId)
                .statusId(index.statusIdOf(id))
                .build()));
        result.readers(readers);
        result.plans(listActionPlans(partitionId));

        DiscoveryResult discovery = result.build();
        log.info(
                "Discovered partition {} '{}': {} doors ({} routable), {} readers, {} plans",
                partition.getId(),
                partition.getName(),
                discovery.getDoors().size(),
                index.mappedDoorCount(),
                readers.size(),
                discovery.getPlans().size());
        return discovery;
    }

    public List<Partition> listPartitions() {
        JsonNode root = sessionManager
                .execute(PanelRequest.get("/api/Partitions/ByPrivilege/Manage_Doors")
                        .queryParam("PageNumber", 1)
                        .queryParam("PerPage", PAGE_SIZE)
                        .build())
                .json();
        List<Partition> partitions = new ArrayList<>();
        for (JsonNode row : JsonHelper.results(root)) {
            Integer id = JsonHelper.integer(row, "Id");
            if (id != null) {
                partitions.add(new Partition(id, JsonHelper.text(row, "Name")));
            }
        }
        return partitions;
    }

    /** Door id to name for the partition, in panel order. */
    public Map<Integer, String> listDoors(int partitionId) {
        JsonNode root = sessionManager
                .execute(PanelRequest.get("/api/doors")
                        .queryParam("PartitionId", partitionId)
                        .queryParam("PageNumber", 1)
                        .queryParam("PerPage", PAGE_SIZE)
                        .build())
                .json();
        Map<Integer, String> doors = new LinkedHashMap<>();
        for (JsonNode row : JsonHelper.results(root)) {
            Integer id = JsonHelper.integer(row, "Id");
            if (id != null) {
                String name = JsonHelper.text(row, "Name");
                doors.put(id, name != null ? name : "Door " + id);
            }
        }
        return doors;
    }

    public List<Reader> listReaders(int partitionId) {
        JsonNode root = sessionManager
                .execute(PanelRequest.get("/api/AccessPrivilegeGroups/AvailableReaders/" + partitionId)
                        .queryParam("PageNumber", 1)
                        .queryParam("PerPage", PAGE_SIZE)
                        .build())
                .json();
        List<Reader> readers = new ArrayList<>();
        for (JsonNode row : JsonHelper.results(root)) {
            Integer id = JsonHelper.integer(row, "Id");
            Integer doorId = JsonHelper.integer(row, "DoorId");
            if (id != null && doorId != null) {
                readers.add(new Reader(id, doorId, JsonHelper.text(row, "Name")));
            }
        }
        return readers;
    }

    public List<ActionPlan> listActionPlans(int partitionId) {
        JsonNode root = sessionManager
                .execute(PanelRequest.get("/api/ActionPlans")
                        .queryParam("PartitionId", partitionId)
                        .queryParam("PageNumber", 1)
                        .queryParam("PerPage", PAGE_SIZE)
                        .build())
                .json();
        List<ActionPlan> plans = new ArrayList<>();
        for (JsonNode row : JsonHelper.results(root)) {
            ActionPlan plan = toActionPlan(row);
            if (plan != null) {
                plans.add(plan);
            }
        }
        return plans;
    }

    /** Full plan including {@code Contents}. The panel wraps it in {@code Result}. */
    public ActionPlan getActionPlan(long planId) {
        JsonNode root = sessionManager.execute(PanelRequest.get("/api/ActionPlans/" + planId).build()).json();
        JsonNode plan = root.has("Result") ? root.get("Result") : root;
        ActionPlan parsed = toActionPlan(plan);
        if (parsed == null) {
            throw new ResourceNotFoundException("ActionPlan", planId);
        }
        return parsed;
    }

    public JsonNode systemOverview() {
        return sessionManager.execute(PanelRequest.get("/api/system/overview/System").build()).json();
    }

    /** Fetches the reader-mode legend into {@link ReaderModeLegend}. A failure keeps the static indices. */
    public void loadLegend() {
        try {
            JsonNode legend = sessionManager
                    .execute(PanelRequest.get("/api/TimeSpanStates/DoorTimeZoneMode").build())
                    .json();
            readerModeLegend.load(legend);
        } catch (RuntimeException e) {
            log.warn("Reader mode legend unavailable, using static indices: {}", e.getMessage());
        }
    }

    /**
     * Routing tables for the stream, from the overview tree and the partition's readers.
     */
    public ReaderDoorIndex buildIndex(int partitionId) {
        return buildIndex(listDoors(partitionId), listReaders(partitionId));
    }

    /**
     * Current status of one door.
     *
     * @return the status payload, or empty when neither status path exists on this server
     */
    public Optional<JsonNode> doorStatus(int doorId) {
        try {
            return Optional.of(sessionManager
                    .execute(PanelRequest.get("/api/Doors/" + doorId + "/Status").build())
                    .json());
        } catch (RemoteRejectionException e) {
            if (!e.isNotFound()) {
                throw e;
            }
        }
        try {
            return Optional.of(sessionManager
                    .execute(PanelRequest.get("/api/doors/" + doorId + "/status").build())
                    .json());
        } catch (RemoteRejectionException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    // ---- Private helpers ----

    private ReaderDoorIndex buildIndex(Map<Integer, String> doorNames, List<Reader> readers) {
        JsonNode overview;
        try {
            overview = systemOverview();
        } catch (RuntimeException e) {
            log.error("System overview unavailable, stream routing limited to readers: {}", e.getMessage());
            overview = null;
        }
        return ReaderDoorIndex.build(overview, doorNames, readers);
    }

    private static ActionPlan toActionPlan(JsonNode row) {
        Long id = JsonHelper.longValue(row, "Id");
        if (id == null) {
            return null;
        }
        return ActionPlan.builder()
                .id(id)
                .name(JsonHelper.text(row, "Name"))
                .planType(JsonHelper.text(row, "PlanType"))
                .partitionId(JsonHelper.integer(row, "PartitionId"))
                .description(JsonHelper.text(row, "Description"))
                .highSecurity(row.path("HighSecurity").asBoolean(false))
                .contents(JsonHelper.text(row, "Contents"))
                .build();
    }
}
