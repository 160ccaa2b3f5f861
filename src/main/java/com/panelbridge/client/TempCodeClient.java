package com.panelbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.panelbridge.config.PanelConfig;
import com.panelbridge.domain.model.Door;
import com.panelbridge.domain.model.Reader;
import com.panelbridge.domain.model.TempCode;
import com.panelbridge.event.EventPublisherHelper;
import com.panelbridge.exception.BaseException;
import com.panelbridge.exception.RemoteRejectionException;
import com.panelbridge.exception.ResourceNotFoundException;
import com.panelbridge.exception.ValidationException;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelSessionManager;
import com.panelbridge.state.PanelStateStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Temporary PIN codes, each one a panel user with a PIN-only credential.
 *
 * <p>Panel-side layout of a code for door D:
 * <ul>
 *   <li>a user {@code HA-<pin>} whose last name is the code name and whose
 *       {@code StartedOn}/{@code ExpiresOn} bound its validity;</li>
 *   <li>membership of the access privilege group {@code HA Temp Access - <door name>}, which
 *       grants D's readers on the always-access user time zone;</li>
 *   <li>a {@code PinOnly} credential carrying the PIN.</li>
 * </ul>
 *
 * <p>The state store mirrors the codes per door. An update never touches the PIN, only the
 * validity window, and only for the PIN already stored for that door.
 */
@Service
public class TempCodeClient {

    private static final Logger log = LoggerFactory.getLogger(TempCodeClient.class);

    static final String USER_PREFIX = "HA-";
    static final String GROUP_PREFIX = "HA Temp Access - ";
    static final int DEFAULT_ALWAYS_TIMEZONE_ID = 2;
    static final int DEFAULT_SECURITY_LEVEL_ID = 1;

    private static final Pattern PIN_PATTERN = Pattern.compile("^\\d{4,8}$");
    private static final List<String> ALWAYS_TIMEZONE_NAMES =
            List.of("always access", "always", "24/7", "all day", "anytime", "no restriction");

    private final PanelSessionManager sessionManager;
    private final DiscoveryClient discoveryClient;
    private final PanelStateStore stateStore;
    private final PartitionContext partitionContext;
    private final PanelConfig panelConfig;
    private final EventPublisherHelper eventPublisherHelper;

    public TempCodeClient(
            PanelSessionManager sessionManager,
            DiscoveryClient discoveryClient,
            PanelStateStore stateStore,
            PartitionContext partitionContext,
            PanelConfig panelConfig,
            EventPublisherHelper eventPublisherHelper) {
        this.sessionManager = sessionManager;
        this.discoveryClient = discoveryClient;
        this.stateStore = stateStore;
        this.partitionContext = partitionContext;
        this.panelConfig = panelConfig;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Creates a code for one door.
     *
     * @param start validity start, offset or naive in the input zone; null means now
     * @param end validity end; null means no expiry
     * @throws ValidationException for a malformed PIN, unknown door or inverted window
     * @throws RemoteRejectionException when the panel refuses the PIN (for example a duplicate)
     */
    public TempCode create(int doorId, String codeName, String pin, String start, String end) {
        validatePin(pin);
        Door door = requireDoor(doorId);
        String name = codeName == null || codeName.isBlank() ? "Temp " + pin : codeName.trim();
        Instant startTime = parseTime(start, "start");
        Instant endTime = parseTime(end, "end");
        requireOrdered(startTime, endTime);

        int partitionId = partitionContext.requirePartitionId();
        long groupId = findOrCreateAccessGroup(partitionId, door);
        int securityLevelId = resolveSecurityLevel();

        ObjectNode user = JsonHelper.newObject();
        user.put("FirstName", USER_PREFIX + pin);
        user.put("LastName", truncate(name, 60));
        user.put("SecurityLevelId", securityLevelId);
        user.putArray("Partitions").add(partitionId);
        user.putArray("AccessGroups");
        user.put("IsMaster", false);
        user.put("IsSupervisor", false);
        user.put("IsSecurity", false);
        user.put("FirstCardInEnabled", false);
        user.put("HandicapOpener", false);
        user.put("CanTripleSwipe", false);
        if (startTime != null) {
            user.put("StartedOn", PanelTimeFormat.toWire(startTime));
        }
        if (endTime != null) {
            user.put("ExpiresOn", PanelTimeFormat.toWire(endTime));
        }

        JsonNode created = sessionManager.execute(PanelRequest.post("/api/Users", user).build()).json();
        Long userId = JsonHelper.longValue(created, "Id");
        if (userId == null || userId == 0) {
            throw new RemoteRejectionException(200, "User creation returned no Id");
        }
        log.info("Created temp user {} for door {} valid {} to {}", userId, doorId, startTime, endTime);

        try {
            sessionManager.execute(PanelRequest.put(
                            "/api/AccessPrivilegeGroups/" + groupId + "/Users/" + userId, JsonHelper.newObject())
                    .build());
        } catch (BaseException e) {
            log.warn("Could not add user {} to access group {}: {}", userId, groupId, e.getMessage());
        }

        addPinCredential(userId, name, pin);

        TempCode code = TempCode.builder()
                .doorId(doorId)
                .codeName(name)
                .code(pin)
                .userId(userId)
                .startTime(startTime)
                .endTime(endTime)
                .build();
        stateStore.putTempCode(code);
        eventPublisherHelper.publishCacheRefresh(this, "temp-code-created");
        return code;
    }

    /**
     * Moves the validity window of an existing code. The PIN must match the one stored for the
     * door; it is never sent.
     */
    public TempCode update(int doorId, String pin, String start, String end) {
        validatePin(pin);
        TempCode existing = stateStore.findTempCode(doorId, pin)
                .orElseThrow(() -> new ValidationException("No temp code with that PIN for door " + doorId));
        Instant startTime = parseTime(start, "start");
        Instant endTime = parseTime(end, "end");
        if (startTime == null && endTime == null) {
            throw new ValidationException("Nothing to update: give a start or an end time");
        }
        requireOrdered(
                startTime != null ? startTime : existing.getStartTime(),
                endTime != null ? endTime : existing.getEndTime());

        ObjectNode body = JsonHelper.newObject();
        ArrayNode properties = body.putArray("Properties");
        if (endTime != null) {
            properties.addObject().put("Name", "ExpiresOn").put("Value", PanelTimeFormat.toWire(endTime));
        }
        if (startTime != null) {
            properties.addObject().put("Name", "StartedOn").put("Value", PanelTimeFormat.toWire(startTime));
        }
        sessionManager.execute(PanelRequest.put("/api/Users/" + existing.getUserId(), body).build());

        TempCode updated = existing.toBuilder()
                .startTime(startTime != null ? startTime : existing.getStartTime())
                .endTime(endTime != null ? endTime : existing.getEndTime())
                .build();
        stateStore.putTempCode(updated);
        log.info("Updated temp code window for door {}: {} to {}", doorId, updated.getStartTime(), updated.getEndTime());
        return updated;
    }

    /** Deletes the panel user holding the PIN. */
    public void delete(int doorId, String pin) {
        validatePin(pin);
        long userId = stateStore.findTempCode(doorId, pin)
                .map(TempCode::getUserId)
                .filter(id -> id > 0)
                .orElseGet(() -> findUserIdByPin(pin));
        deleteUser(userId);
        stateStore.removeTempCode(doorId, pin);
        log.info("Deleted temp user {} for door {}", userId, doorId);
        eventPublisherHelper.publishCacheRefresh(this, "temp-code-deleted");
    }

    /**
     * Deletes the door's code carrying the given name.
     *
     * @return the PIN that was removed
     * @throws ResourceNotFoundException when no mirrored code of the door has that name
     */
    public String deleteByName(int doorId, String codeName) {
        TempCode code = stateStore.tempCodes(doorId).stream()
                .filter(c -> c.getCodeName() != null && c.getCodeName().equals(codeName))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No temp code named '" + codeName + "' for door " + doorId));
        delete(doorId, code.getCode());
        return code.getCode();
    }

    /**
     * Removes every mirrored code of one door, or of all doors when {@code doorId} is null. A
     * code leaves the mirror even when the panel refuses to delete its user.
     *
     * @return number of codes removed from the mirror
     */
    public int clearAll(Integer doorId) {
        Map<Integer, List<TempCode>> targets = doorId != null
                ? Map.of(doorId, stateStore.tempCodes(doorId))
                : stateStore.allTempCodes();
        int cleared = 0;
        for (Map.Entry<Integer, List<TempCode>> door : targets.entrySet()) {
            for (TempCode code : door.getValue()) {
                try {
                    long userId = code.getUserId() > 0 ? code.getUserId() : findUserIdByPin(code.getCode());
                    deleteUser(userId);
                } catch (BaseException e) {
                    log.warn("Panel delete failed for temp code '{}' on door {}, removing it locally: {}",
                            code.getCodeName(), door.getKey(), e.getMessage());
                }
                stateStore.removeTempCode(door.getKey(), code.getCode());
                cleared++;
            }
        }
        log.info("Cleared {} temp codes ({})", cleared, doorId != null ? "door " + doorId : "all doors");
        if (cleared > 0) {
            eventPublisherHelper.publishCacheRefresh(this, "temp-codes-cleared");
        }
        return cleared;
    }

    public List<TempCode> list(int doorId) {
        return stateStore.tempCodes(doorId);
    }

    /**
     * Reconciles the mirror with the panel. Codes whose user disappeared are dropped, the
     * remaining ones take the panel's validity window, and {@code HA-} users the mirror does not
     * know yet are adopted under the door of their temp-access group.
     */
    public Map<Integer, List<TempCode>> refresh() {
        Map<Long, JsonNode> remoteUsers = new HashMap<>();
        for (JsonNode user : listPartitionUsers()) {
            String firstName = JsonHelper.text(user, "FirstName");
            Long id = JsonHelper.longValue(user, "Id");
            if (id != null && firstName != null && firstName.startsWith(USER_PREFIX)) {
                remoteUsers.put(id, user);
            }
        }

        Map<Integer, List<TempCode>> reconciled = new HashMap<>();
        Set<Long> mirroredUsers = new HashSet<>();
        stateStore.allTempCodes().forEach((doorId, codes) -> {
            List<TempCode> kept = new ArrayList<>();
            for (TempCode code : codes) {
                JsonNode remote = remoteUsers.get(code.getUserId());
                if (remote == null) {
                    log.info("Temp code user {} for door {} no longer exists on the panel", code.getUserId(), doorId);
                    continue;
                }
                mirroredUsers.add(code.getUserId());
                kept.add(code.toBuilder()
                        .startTime(PanelTimeFormat.fromWire(JsonHelper.text(remote, "StartedOn")))
                        .endTime(PanelTimeFormat.fromWire(JsonHelper.text(remote, "ExpiresOn")))
                        .build());
            }
            reconciled.put(doorId, kept);
        });

        Map<Long, JsonNode> unknown = new HashMap<>(remoteUsers);
        unknown.keySet().removeAll(mirroredUsers);
        int adopted = 0;
        if (!unknown.isEmpty()) {
            Map<Long, Integer> doorByUser = tempAccessMembership();
            for (Map.Entry<Long, JsonNode> user : unknown.entrySet()) {
                Integer doorId = doorByUser.get(user.getKey());
                TempCode code = toTempCode(user.getKey(), user.getValue(), doorId);
                if (code == null) {
                    log.debug("Panel user {} has no resolvable temp-access door, not mirrored", user.getKey());
                    continue;
                }
                reconciled.computeIfAbsent(doorId, id -> new ArrayList<>()).add(code);
                adopted++;
            }
        }

        reconciled.forEach(stateStore::replaceTempCodes);
        log.debug("Temp codes reconciled: {} panel users, {} doors mirrored, {} adopted",
                remoteUsers.size(), reconciled.size(), adopted);
        return reconciled;
    }

    // ---- Private helpers ----

    private TempCode toTempCode(long userId, JsonNode user, Integer doorId) {
        String pin = JsonHelper.text(user, "FirstName").substring(USER_PREFIX.length());
        if (doorId == null || !PIN_PATTERN.matcher(pin).matches()) {
            return null;
        }
        return TempCode.builder()
                .doorId(doorId)
                .codeName(JsonHelper.text(user, "LastName"))
                .code(pin)
                .userId(userId)
                .startTime(PanelTimeFormat.fromWire(JsonHelper.text(user, "StartedOn")))
                .endTime(PanelTimeFormat.fromWire(JsonHelper.text(user, "ExpiresOn")))
                .build();
    }

    /** User id to door id, read from the members of each {@code HA Temp Access - <door>} group. */
    private Map<Long, Integer> tempAccessMembership() {
        Map<String, Integer> doorsByName = new HashMap<>();
        for (Door door : stateStore.doors()) {
            if (door.getName() != null) {
                doorsByName.put(door.getName(), door.getId());
            }
        }
        Map<Long, Integer> doorByUser = new HashMap<>();
        try {
            for (JsonNode group : accessGroups(partitionContext.requirePartitionId())) {
                String name = JsonHelper.text(group, "Name");
                Long groupId = JsonHelper.longValue(group, "Id");
                if (groupId == null || name == null || !name.startsWith(GROUP_PREFIX)) {
                    continue;
                }
                Integer doorId = doorsByName.get(name.substring(GROUP_PREFIX.length()));
                if (doorId == null) {
                    continue;
                }
                for (JsonNode member : pagedResults("/api/AccessPrivilegeGroups/" + groupId + "/Users")) {
                    Long userId = JsonHelper.longValue(member, "Id");
                    if (userId != null) {
                        doorByUser.put(userId, doorId);
                    }
                }
            }
        } catch (BaseException e) {
            log.warn("Temp-access group membership unavailable, unknown panel codes not adopted: {}", e.getMessage());
        }
        return doorByUser;
    }

    private List<JsonNode> accessGroups(int partitionId) {
        return JsonHelper.results(sessionManager
                .execute(PanelRequest.get("/api/AccessPrivilegeGroups")
                        .queryParam("PartitionId", partitionId)
                        .queryParam("PageNumber", 1)
                        .queryParam("PerPage", DiscoveryClient.PAGE_SIZE)
                        .build())
                .json());
    }

    private void deleteUser(long userId) {
        sessionManager.execute(PanelRequest.delete("/api/Users/" + userId)
                .queryParam("forceDelete", true)
                .build());
    }

    private Door requireDoor(int doorId) {
        return stateStore.door(doorId).orElseThrow(() -> new ValidationException("Unknown door " + doorId));
    }

    static void validatePin(String pin) {
        if (pin == null || !PIN_PATTERN.matcher(pin).matches()) {
            throw new ValidationException("PIN must be 4 to 8 digits");
        }
    }

    private Instant parseTime(String value, String label) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Instant parsed = PanelTimeFormat.parse(value, panelConfig.resolveInputZone());
        if (parsed == null) {
            throw new ValidationException("Unparseable " + label + " time '" + value + "'");
        }
        return parsed;
    }

    private static void requireOrdered(Instant start, Instant end) {
        if (start != null && end != null && !end.isAfter(start)) {
            throw new ValidationException("End time must be after start time");
        }
    }

    private long findOrCreateAccessGroup(int partitionId, Door door) {
        String groupName = GROUP_PREFIX + door.getName();
        List<Reader> doorReaders = discoveryClient.listReaders(partitionId).stream()
                .filter(r -> r.getDoorId() == door.getId())
                .collect(Collectors.toList());

        for (JsonNode group : accessGroups(partitionId)) {
            Long groupId = JsonHelper.longValue(group, "Id");
            if (groupId != null && groupName.equals(JsonHelper.text(group, "Name"))) {
                JsonNode assigned = sessionManager
                        .execute(PanelRequest.get("/api/AccessPrivilegeGroups/" + groupId + "/Readers").build())
                        .json();
                if (JsonHelper.results(assigned).isEmpty()) {
                    log.info("Access group '{}' has no readers, assigning", groupName);
                    assignReaders(groupId, doorReaders);
                }
                return groupId;
            }
        }

        List<JsonNode> holidayGroups = pagedResults("/api/UserHolidayGroups");
        if (holidayGroups.isEmpty()) {
            throw new ResourceNotFoundException("No user holiday group found, cannot create access group " + groupName);
        }
        if (doorReaders.isEmpty()) {
            throw new ResourceNotFoundException("No readers found for door " + door.getId());
        }

        ObjectNode payload = JsonHelper.newObject();
        payload.put("GroupType", "Local");
        payload.put("Name", groupName);
        payload.put("Description", "Home Assistant temporary access for " + door.getName());
        payload.set("HolidayTimeZoneGroupId", holidayGroups.get(0).path("Id"));
        payload.put("PartitionId", partitionId);
        JsonNode created = sessionManager.execute(PanelRequest.post("/api/AccessPrivilegeGroups", payload).build()).json();
        Long groupId = JsonHelper.longValue(created, "Id");
        if (groupId == null || groupId == 0) {
            throw new RemoteRejectionException(200, "Access group creation returned no Id");
        }
        log.info("Created access group '{}' ({})", groupName, groupId);
        assignReaders(groupId, doorReaders);
        return groupId;
    }

    private void assignReaders(long groupId, List<Reader> readers) {
        int timeZoneId = resolveAlwaysTimeZone();
        for (Reader reader : readers) {
            try {
                sessionManager.execute(PanelRequest.put(
                                "/api/AccessPrivilegeGroups/" + groupId + "/Readers/" + reader.getId() + "/" + timeZoneId,
                                JsonHelper.newObject())
                        .build());
                log.debug("Assigned reader {} to access group {} on time zone {}", reader.getId(), groupId, timeZoneId);
            } catch (BaseException e) {
                log.warn("Could not assign reader {} to access group {}: {}", reader.getId(), groupId, e.getMessage());
            }
        }
    }

    int resolveAlwaysTimeZone() {
        List<JsonNode> timeZones;
        try {
            timeZones = pagedResults("/api/UserTimeZones");
        } catch (BaseException e) {
            log.debug("User time zones unavailable, using {}: {}", DEFAULT_ALWAYS_TIMEZONE_ID, e.getMessage());
            return DEFAULT_ALWAYS_TIMEZONE_ID;
        }
        for (JsonNode tz : timeZones) {
            String name = String.valueOf(JsonHelper.text(tz, "Name")).toLowerCase(Locale.ROOT);
            Integer id = JsonHelper.integer(tz, "Id");
            if (id != null && ALWAYS_TIMEZONE_NAMES.stream().anyMatch(name::contains)) {
                return id;
            }
        }
        return DEFAULT_ALWAYS_TIMEZONE_ID;
    }

    private int resolveSecurityLevel() {
        try {
            List<JsonNode> levels = pagedResults("/api/SecurityLevels");
            Integer id = levels.isEmpty() ? null : JsonHelper.integer(levels.get(0), "Id");
            return id != null ? id : DEFAULT_SECURITY_LEVEL_ID;
        } catch (BaseException e) {
            log.debug("Security levels unavailable, using {}: {}", DEFAULT_SECURITY_LEVEL_ID, e.getMessage());
            return DEFAULT_SECURITY_LEVEL_ID;
        }
    }

    private void addPinCredential(long userId, String codeName, String pin) {
        ObjectNode credential = JsonHelper.newObject();
        credential.put("Name", "PIN-" + codeName);
        credential.put("CredentialType", "PinOnly");
        credential.put("SiteCode", 0);
        credential.put("CardNumber", 0);
        credential.put("PinNumber", Long.parseLong(pin));
        try {
            sessionManager.execute(PanelRequest.post("/api/Users/" + userId + "/Credentials", credential).build());
        } catch (RemoteRejectionException e) {
            log.error("PIN credential rejected for user {}: {}", userId, e.getPanelMessage());
            deleteUserQuietly(userId);
            throw new RemoteRejectionException(e.getStatus(), "PIN rejected: " + e.getPanelMessage());
        } catch (BaseException e) {
            deleteUserQuietly(userId);
            throw e;
        }
    }

    private void deleteUserQuietly(long userId) {
        try {
            sessionManager.execute(PanelRequest.delete("/api/Users/" + userId).build());
        } catch (BaseException cleanup) {
            log.warn("Could not remove temp user {} after credential failure: {}", userId, cleanup.getMessage());
        }
    }

    private long findUserIdByPin(String pin) {
        String expected = USER_PREFIX + pin;
        for (JsonNode user : listPartitionUsers()) {
            String firstName = JsonHelper.text(user, "FirstName");
            Long userId = JsonHelper.longValue(user, "Id");
            if (userId == null || firstName == null) {
                continue;
            }
            if (firstName.equals(expected)) {
                return userId;
            }
            if (firstName.startsWith(USER_PREFIX) && hasPinCredential(userId, pin)) {
                return userId;
            }
        }
        throw new ResourceNotFoundException("No temporary user found with that PIN");
    }

    private boolean hasPinCredential(long userId, String pin) {
        JsonNode credentials = sessionManager
                .execute(PanelRequest.get("/api/Users/" + userId + "/Credentials")
                        .queryParam("PageNumber", 1)
                        .queryParam("PerPage", 100)
                        .build())
                .json();
        for (JsonNode credential : JsonHelper.results(credentials)) {
            if (pin.equals(JsonHelper.text(credential, "PinNumber"))) {
                return true;
            }
        }
        return false;
    }

    private List<JsonNode> listPartitionUsers() {
        JsonNode users = sessionManager
                .execute(PanelRequest.get("/api/Partitions/" + partitionContext.requirePartitionId() + "/Users")
                        .queryParam("PageNumber", 1)
                        .queryParam("PerPage", DiscoveryClient.PAGE_SIZE)
                        .build())
                .json();
        return JsonHelper.results(users);
    }

    private List<JsonNode> pagedResults(String path) {
        return JsonHelper.results(sessionManager
                .execute(PanelRequest.get(path)
                        .queryParam("PageNumber", 1)
                        .queryParam("PerPage", 100)
                        .build())
                .json());
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
