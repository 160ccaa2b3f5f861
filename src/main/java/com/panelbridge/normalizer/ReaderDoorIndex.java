package com.panelbridge.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.domain.model.Reader;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable routing tables from stream identifiers to partition doors.
 *
 * <p>Built from the system overview tree ({@code Status.Nodes}, nested Site/Panel/Door/Reader
 * nodes) merged with the partition's available readers. Only doors of the configured partition
 * are indexed; everything else on a shared panel resolves to nothing. Rebuilt as a whole and
 * swapped atomically by the holder, so readers never observe a half-built map.
 */
public final class ReaderDoorIndex {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern READER_SUFFIX = Pattern.compile("\\s+reader(\\s+\\d+)?$");
    private static final Pattern DOOR_SUFFIX = Pattern.compile("\\s+(door|gate)$");
    private static final Pattern TARGET_PHRASE =
            Pattern.compile("\\b(?:to|on|for)\\s+(.+)$", Pattern.CASE_INSENSITIVE);

    private static final ReaderDoorIndex EMPTY =
            new ReaderDoorIndex(Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Set.of());

    private final Map<String, Integer> doorByStatusId;
    private final Map<Integer, String> statusIdByDoor;
    private final Map<String, Integer> doorByName;
    private final Map<Integer, Integer> doorByReaderId;
    private final Map<String, Integer> doorByReaderName;
    private final Set<Integer> allowedDoors;
    private final Set<String> panels;

    private ReaderDoorIndex(
            Map<String, Integer> doorByStatusId,
            Map<Integer, String> statusIdByDoor,
            Map<String, Integer> doorByName,
            Map<Integer, Integer> doorByReaderId,
            Map<String, Integer> doorByReaderName,
            Set<Integer> allowedDoors) {
        this.doorByStatusId = doorByStatusId;
        this.statusIdByDoor = statusIdByDoor;
        this.doorByName = doorByName;
        this.doorByReaderId = doorByReaderId;
        this.doorByReaderName = doorByReaderName;
        this.allowedDoors = allowedDoors;
        Set<String> roots = new TreeSet<>();
        for (String statusId : doorByStatusId.keySet()) {
            String root = panelOf(statusId);
            if (root != null) {
                roots.add(root);
            }
        }
        this.panels = Collections.unmodifiableSet(roots);
    }

    public static ReaderDoorIndex empty() {
        return EMPTY;
    }

    /**
     * Builds the index.
     *
     * @param overview {@code /api/system/overview/System} payload, may be null
     * @param partitionDoors door id to name for the configured partition
     * @param readers the partition's available readers
     */
    public static ReaderDoorIndex build(JsonNode overview, Map<Integer, String> partitionDoors, Collection<Reader> readers) {
        Map<String, Integer> byStatusId = new HashMap<>();
        Map<Integer, String> statusIds = new HashMap<>();
        Map<String, Integer> byName = new HashMap<>();
        Map<Integer, Integer> byReaderId = new HashMap<>();
        Map<String, Integer> byReaderName = new HashMap<>();
        Set<Integer> allowed = new LinkedHashSet<>(partitionDoors.keySet());

        partitionDoors.forEach((id, name) -> {
            if (name != null && !name.isBlank()) {
                byName.putIfAbsent(normalizeName(name), id);
            }
        });

        if (overview != null) {
            for (JsonNode site : overview.path("Status").path("Nodes")) {
                walk(site, null, allowed, byStatusId, statusIds, byName, byReaderId, byReaderName);
            }
        }

        for (Reader reader : readers) {
            if (!allowed.isEmpty() && !allowed.contains(reader.getDoorId())) {
                continue;
            }
            byReaderId.put(reader.getId(), reader.getDoorId());
            indexReaderName(reader.getName(), reader.getDoorId(), byReaderName);
        }

        return new ReaderDoorIndex(
                Map.copyOf(byStatusId),
                Map.copyOf(statusIds),
                Map.copyOf(byName),
                Map.copyOf(byReaderId),
                Map.copyOf(byReaderName),
                Collections.unmodifiableSet(allowed));
    }

    // ---- Lookups ----

    public Integer doorForStatusId(String statusId) {
        return statusId == null ? null : doorByStatusId.get(statusId);
    }

    public String statusIdOf(int doorId) {
        return statusIdByDoor.get(doorId);
    }

    public boolean isAllowed(int doorId) {
        return allowedDoors.isEmpty() || allowedDoors.contains(doorId);
    }

    public Set<Integer> allowedDoors() {
        return allowedDoors;
    }

    /** Panels hosting at least one partition door, sorted; the {@code subscribeToStatus} argument. */
    public List<String> panels() {
        return List.copyOf(panels);
    }

    public boolean isSubscribedPanel(String panel) {
        return panel != null && panels.contains(panel);
    }

    public int mappedDoorCount() {
        return doorByStatusId.size();
    }

    /**
     * Resolves a reader source: id first, then the exact name, then the name without its
     * {@code reader N}/{@code door}/{@code gate} suffix, then the door-name index.
     */
    public Integer doorForReader(Integer readerId, String readerName) {
        if (readerId != null) {
            Integer byId = doorByReaderId.get(readerId);
            if (byId != null) {
                return byId;
            }
        }
        if (readerName == null || readerName.isBlank()) {
            return null;
        }
        Integer exact = doorByReaderName.get(readerName.trim().toLowerCase(Locale.ROOT));
        if (exact != null) {
            return exact;
        }
        String base = stripReaderSuffix(readerName);
        if (base.isEmpty()) {
            return null;
        }
        Integer byBase = doorByReaderName.get(base);
        return byBase != null ? byBase : doorForText(base);
    }

    /**
     * Finds a door named in free text: exact normalized match (with and without suffix), then
     * containment either way.
     */
    public Integer doorForText(String text) {
        String norm = normalizeName(text);
        if (norm.isEmpty()) {
            return null;
        }
        Set<String> variants = new LinkedHashSet<>();
        variants.add(norm);
        String stripped = stripReaderSuffix(norm);
        if (!stripped.isEmpty()) {
            variants.add(stripped);
        }
        for (String variant : variants) {
            Integer id = doorByName.get(variant);
            if (id != null) {
                return id;
            }
        }
        for (String variant : variants) {
            for (Map.Entry<String, Integer> entry : doorByName.entrySet()) {
                if (variant.contains(entry.getKey()) || entry.getKey().contains(variant)) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }

    /** Door named after "to", "on" or "for" at the end of a message. */
    public Integer doorForTargetPhrase(String message) {
        if (message == null) {
            return null;
        }
        Matcher m = TARGET_PHRASE.matcher(message.trim());
        return m.find() ? doorForText(m.group(1)) : null;
    }

    /** Door id for a door name, exact normalized match only. */
    public Integer doorForName(String name) {
        return name == null ? null : doorByName.get(normalizeName(name));
    }

    // ---- Name normalization ----

    public static String normalizeName(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /** Removes a trailing {@code reader}, {@code reader <n>}, {@code door} or {@code gate}. */
    public static String stripReaderSuffix(String value) {
        String s = normalizeName(value);
        s = READER_SUFFIX.matcher(s).replaceAll("");
        s = DOOR_SUFFIX.matcher(s).replaceAll("");
        return s.trim();
    }

    public static String panelOf(String statusId) {
        if (statusId == null) {
            return null;
        }
        int sep = statusId.indexOf("::");
        String root = sep >= 0 ? statusId.substring(0, sep) : statusId;
        return root.isBlank() ? null : root;
    }

    // ---- Private helpers ----

    private static void walk(
            JsonNode node,
            Integer currentDoor,
            Set<Integer> allowed,
            Map<String, Integer> byStatusId,
            Map<Integer, String> statusIds,
            Map<String, Integer> byName,
            Map<Integer, Integer> byReaderId,
            Map<String, Integer> byReaderName) {
        for (JsonNode child : node.path("Nodes")) {
            String type = child.path("Type").asText("");
            if ("Door".equals(type)) {
                JsonNode idNode = child.get("Id");
                Integer doorId = idNode != null && idNode.isIntegralNumber() ? idNode.intValue() : null;
                if (doorId != null && allowed.contains(doorId)) {
                    String statusId = child.path("StatusId").asText("");
                    if (!statusId.isEmpty()) {
                        byStatusId.put(statusId, doorId);
                        statusIds.put(doorId, statusId);
                    }
                    String name = child.path("Name").asText("");
                    if (!name.isEmpty()) {
                        byName.put(normalizeName(name), doorId);
                    }
                    walk(child, doorId, allowed, byStatusId, statusIds, byName, byReaderId, byReaderName);
                } else {
                    walk(child, null, allowed, byStatusId, statusIds, byName, byReaderId, byReaderName);
                }
            } else if ("Reader".equals(type) && currentDoor != null) {
                JsonNode idNode = child.get("Id");
                if (idNode != null && idNode.isIntegralNumber()) {
                    byReaderId.put(idNode.intValue(), currentDoor);
                }
                indexReaderName(child.path("Name").asText(""), currentDoor, byReaderName);
                walk(child, currentDoor, allowed, byStatusId, statusIds, byName, byReaderId, byReaderName);
            } else {
                walk(child, currentDoor, allowed, byStatusId, statusIds, byName, byReaderId, byReaderName);
            }
        }
    }

    private static void indexReaderName(String rawName, int doorId, Map<String, Integer> byReaderName) {
        String name = rawName == null ? "" : rawName.trim();
        if (name.isEmpty()) {
            return;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        byReaderName.put(lower, doorId);
        String base = stripReaderSuffix(name);
        if (!base.isEmpty() && !base.equals(lower)) {
            byReaderName.put(base, doorId);
        }
    }
}
