package com.panelbridge.state;

import com.panelbridge.dispatch.EntityKey;
import com.panelbridge.dispatch.StateChangeDispatcher;
import com.panelbridge.domain.model.DiscoveryResult;
import com.panelbridge.domain.model.Door;
import com.panelbridge.domain.model.DoorDescriptor;
import com.panelbridge.domain.model.DoorEvent;
import com.panelbridge.domain.model.OtrSchedule;
import com.panelbridge.domain.model.Partition;
import com.panelbridge.domain.model.TempCode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Authoritative in-memory model of the partition: doors, temp codes and OTR schedules.
 *
 * <p>Mutated only by normalized events ({@link #apply}) and by the command client's optimistic
 * updates, which arrive as COMMAND-sourced events through the same path. Everything handed out
 * is an immutable view.
 *
 * <p>Concurrency:
 * <ul>
 *   <li>Each door entry is its own monitor, so writes to one door are serialized while different
 *       doors proceed independently.</li>
 *   <li>The lock covers the in-memory mutation, the view copy and the hand-off to the dispatch
 *       executor, which never blocks on listeners.</li>
 *   <li>Temp-code and schedule caches are replaced per door through {@code ConcurrentHashMap}
 *       compute calls.</li>
 * </ul>
 */
@Service
public class PanelStateStore {

    private static final Logger log = LoggerFactory.getLogger(PanelStateStore.class);

    private final StateChangeDispatcher stateChangeDispatcher;

    private final Map<Integer, DoorEntry> doors = new ConcurrentHashMap<>();
    private final Map<Integer, List<TempCode>> tempCodes = new ConcurrentHashMap<>();
    private final Map<Integer, List<OtrSchedule>> otrSchedulesByDoor = new ConcurrentHashMap<>();
    private volatile List<OtrSchedule> otrSchedules = List.of();
    private volatile Partition partition;

    public PanelStateStore(StateChangeDispatcher stateChangeDispatcher) {
        this.stateChangeDispatcher = stateChangeDispatcher;
    }

    // ---- Doors ----

    /**
     * Installs the discovered doors. Doors already known keep their live state; doors no longer
     * in the partition are removed (reconfiguration).
     */
    public void loadDiscovery(DiscoveryResult discovery) {
        this.partition = discovery.getPartition();
        Set<Integer> discovered = new HashSet<>();
        for (DoorDescriptor descriptor : discovery.getDoors()) {
            discovered.add(descriptor.getId());
            doors.compute(descriptor.getId(), (id, existing) -> {
                if (existing == null) {
                    return new DoorEntry(descriptor);
                }
                synchronized (existing) {
                    existing.redescribe(descriptor);
                }
                return existing;
            });
        }
        doors.keySet().removeIf(id -> !discovered.contains(id));
        log.info(
                "State store loaded {} doors for partition {}",
                doors.size(),
                partition != null ? partition.getId() : null);
    }

    /**
     * Applies a normalized event to its door and notifies subscribers when anything changed.
     *
     * @return true if the door's state changed
     */
    public boolean apply(DoorEvent event) {
        DoorEntry entry = doors.get(event.getDoorId());
        if (entry == null) {
            log.debug("Event {} for unknown door {} ignored", event.getType(), event.getDoorId());
            return false;
        }

        DoorEntry.ApplyOutcome outcome;
        synchronized (entry) {
            outcome = entry.apply(event);
            if (outcome.changed) {
                // queued under the entry monitor so a door's views reach the executor in write order
                stateChangeDispatcher.publish(EntityKey.door(event.getDoorId()), entry.toView());
            }
        }

        if (outcome.stale) {
            log.debug(
                    "Reconciliation: stale {} {} for door {} at {} ignored",
                    event.getSource(),
                    event.getType(),
                    event.getDoorId(),
                    event.getTimestamp());
        }
        return outcome.changed;
    }

    public Optional<Door> door(int doorId) {
        DoorEntry entry = doors.get(doorId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return Optional.of(entry.toView());
        }
    }

    public List<Door> doors() {
        List<Door> views = new ArrayList<>(doors.size());
        for (DoorEntry entry : doors.values()) {
            synchronized (entry) {
                views.add(entry.toView());
            }
        }
        views.sort(Comparator.comparingInt(Door::getId));
        return views;
    }

    public List<DoorDescriptor> doorDescriptors() {
        return doors.values().stream()
                .map(DoorEntry::getDescriptor)
                .sorted(Comparator.comparingInt(DoorDescriptor::getId))
                .collect(Collectors.toList());
    }

    public boolean hasDoor(int doorId) {
        return doors.containsKey(doorId);
    }

    public boolean hasDoors() {
        return !doors.isEmpty();
    }

    public Partition partition() {
        return partition;
    }

    // ---- Temp codes ----

    public void putTempCode(TempCode code) {
        List<TempCode> updated = tempCodes.compute(code.getDoorId(), (doorId, current) -> {
            List<TempCode> next = new ArrayList<>();
            if (current != null) {
                current.stream().filter(c -> !c.getCode().equals(code.getCode())).forEach(next::add);
            }
            next.add(code);
            return List.copyOf(next);
        });
        stateChangeDispatcher.publish(EntityKey.tempCodes(code.getDoorId()), updated);
    }

    public void removeTempCode(int doorId, String code) {
        List<TempCode> updated = tempCodes.computeIfPresent(doorId, (id, current) -> {
            List<TempCode> next =
                    current.stream().filter(c -> !c.getCode().equals(code)).collect(Collectors.toList());
            return next.isEmpty() ? null : List.copyOf(next);
        });
        stateChangeDispatcher.publish(EntityKey.tempCodes(doorId), updated != null ? updated : List.of());
    }

    /** Replaces a door's mirrored temp codes, notifying only when the list actually changed. */
    public void replaceTempCodes(int doorId, List<TempCode> codes) {
        List<TempCode> next = List.copyOf(codes);
        List<TempCode> previous = next.isEmpty() ? tempCodes.remove(doorId) : tempCodes.put(doorId, next);
        if (!next.equals(previous == null ? List.of() : previous)) {
            stateChangeDispatcher.publish(EntityKey.tempCodes(doorId), next);
        }
    }

    public List<TempCode> tempCodes(int doorId) {
        return tempCodes.getOrDefault(doorId, List.of());
    }

    public Map<Integer, List<TempCode>> allTempCodes() {
        return Map.copyOf(tempCodes);
    }

    public Optional<TempCode> findTempCode(int doorId, String code) {
        return tempCodes(doorId).stream().filter(c -> c.getCode().equals(code)).findFirst();
    }

    // ---- OTR schedules ----

    /** Replaces the schedule cache and notifies each door whose schedule list changed. */
    public void replaceOtrSchedules(List<OtrSchedule> schedules) {
        Map<Integer, List<OtrSchedule>> grouped = new ConcurrentHashMap<>();
        for (OtrSchedule schedule : schedules) {
            if (schedule.getDoorIds() == null) {
                continue;
            }
            for (Integer doorId : schedule.getDoorIds()) {
                if (doorId != null) {
                    grouped.computeIfAbsent(doorId, id -> new ArrayList<>()).add(schedule);
                }
            }
        }
        this.otrSchedules = List.copyOf(schedules);

        Set<Integer> affected = new HashSet<>(otrSchedulesByDoor.keySet());
        affected.addAll(grouped.keySet());
        for (Integer doorId : affected) {
            List<OtrSchedule> next = List.copyOf(grouped.getOrDefault(doorId, List.of()));
            List<OtrSchedule> previous = next.isEmpty()
                    ? otrSchedulesByDoor.remove(doorId)
                    : otrSchedulesByDoor.put(doorId, next);
            if (!next.equals(previous == null ? List.of() : previous)) {
                stateChangeDispatcher.publish(EntityKey.otrSchedules(doorId), next);
            }
        }
    }

    public List<OtrSchedule> otrSchedules() {
        return otrSchedules;
    }

    public List<OtrSchedule> otrSchedules(int doorId) {
        return otrSchedulesByDoor.getOrDefault(doorId, List.of());
    }
}
