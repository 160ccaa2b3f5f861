package com.panelbridge.state;

import com.panelbridge.domain.enums.DoorEventType;
import com.panelbridge.domain.enums.LockState;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.Door;
import com.panelbridge.domain.model.DoorDescriptor;
import com.panelbridge.domain.model.DoorEvent;
import com.panelbridge.domain.model.LogEntry;
import com.panelbridge.domain.model.OverrideState;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutable state of one door. Not thread-safe: {@link PanelStateStore} serializes access per door.
 *
 * <p>Each independently reported field has its own {@link FieldClock}. An event only changes a
 * field when it is at least as new as the last value applied to that field (timestamp, then
 * arrival sequence). Applying events in any arrival order therefore ends in the same state as
 * applying them in timestamp order.
 *
 * <p>The override policy (type, minutes, until) is tracked apart from the overridden flag and
 * the reader mode, since the stream reports the latter two but only commands know the policy.
 */
class DoorEntry {

    private DoorDescriptor descriptor;

    private LockState lockState = LockState.UNKNOWN;
    private Boolean overridden;
    private OverrideState policy;
    private ReaderMode readerMode;
    private String actor;
    private String readerMessage;
    private Instant readerMessageTime;
    private String doorMessage;
    private Instant updatedAt;

    private final FieldClock lockClock = new FieldClock();
    private final FieldClock overriddenClock = new FieldClock();
    private final FieldClock policyClock = new FieldClock();
    private final FieldClock modeClock = new FieldClock();
    private final FieldClock actorClock = new FieldClock();
    private final FieldClock doorMessageClock = new FieldClock();

    DoorEntry(DoorDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    void redescribe(DoorDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    DoorDescriptor getDescriptor() {
        return descriptor;
    }

    ReaderMode getReaderMode() {
        return readerMode;
    }

    /**
     * Applies the event to every field it carries that it is not stale for.
     *
     * @return the outcome, telling whether any field changed and whether any was stale
     */
    ApplyOutcome apply(DoorEvent event) {
        Instant ts = event.getTimestamp();
        long seq = event.getSequence();
        ApplyOutcome outcome = new ApplyOutcome();
        DoorEventType type = event.getType();

        if (type == DoorEventType.LOCK_STATE_CHANGED) {
            applyLock(event, ts, seq, outcome);
        } else if (type == DoorEventType.OVERRIDE_CHANGED || type == DoorEventType.SCHEDULE_FLIPPED) {
            applyOverride(event, ts, seq, outcome);
        } else if (type.carriesActor()) {
            applyActor(event, ts, seq, outcome);
        } else if (type == DoorEventType.DOOR_MESSAGE) {
            applyDoorMessage(event, ts, seq, outcome);
        }

        if (outcome.changed && (updatedAt == null || ts.isAfter(updatedAt))) {
            updatedAt = ts;
        }
        return outcome;
    }

    Door toView() {
        Instant logTime = latest(actorClock.asOf, doorMessageClock.asOf);
        LogEntry lastLog = LogEntry.builder()
                .actor(actor)
                .readerMessage(readerMessage)
                .readerMessageTime(readerMessageTime)
                .doorMessage(doorMessage)
                .timestamp(logTime)
                .build();
        return Door.builder()
                .id(descriptor.getId())
                .name(descriptor.getName())
                .partitionId(descriptor.getPartitionId())
                .statusId(descriptor.getStatusId())
                .lockState(lockState)
                .overridden(overridden)
                .readerMode(readerMode)
                .override(currentOverride())
                .lastLog(lastLog)
                .updatedAt(updatedAt)
                .build();
    }

    // ---- Private helpers ----

    private void applyLock(DoorEvent event, Instant ts, long seq, ApplyOutcome outcome) {
        LockState next = event.getLockState();
        if (next == null || next == LockState.UNKNOWN) {
            return;
        }
        if (!lockClock.admits(ts, seq)) {
            outcome.stale = true;
            return;
        }
        lockClock.advance(ts, seq);
        if (next != lockState) {
            lockState = next;
            outcome.changed = true;
        }
    }

    private void applyOverride(DoorEvent event, Instant ts, long seq, ApplyOutcome outcome) {
        Boolean nextOverridden = event.getType() == DoorEventType.SCHEDULE_FLIPPED ? Boolean.FALSE : event.getOverridden();
        ReaderMode nextMode = event.getReaderMode();

        if (nextOverridden != null) {
            if (overriddenClock.admits(ts, seq)) {
                overriddenClock.advance(ts, seq);
                if (!nextOverridden.equals(overridden)) {
                    overridden = nextOverridden;
                    outcome.changed = true;
                }
            } else {
                outcome.stale = true;
            }
        }

        // Policy is set by events that know it (commands) and cleared by a resume.
        OverrideState nextPolicy = Boolean.FALSE.equals(nextOverridden) ? null : event.getOverride();
        if (nextPolicy != null || Boolean.FALSE.equals(nextOverridden)) {
            if (policyClock.admits(ts, seq)) {
                policyClock.advance(ts, seq);
                if (!Objects.equals(nextPolicy, policy)) {
                    policy = nextPolicy;
                    outcome.changed = true;
                }
            } else {
                outcome.stale = true;
            }
        }

        if (nextMode != null) {
            if (modeClock.admits(ts, seq)) {
                modeClock.advance(ts, seq);
                if (nextMode != readerMode) {
                    readerMode = nextMode;
                    outcome.changed = true;
                }
            } else {
                outcome.stale = true;
            }
        }
    }

    /** The active override as seen now: policy from the last command, mode from the last report. */
    private OverrideState currentOverride() {
        if (!Boolean.TRUE.equals(overridden)) {
            return null;
        }
        if (policy == null) {
            return OverrideState.builder().mode(readerMode).build();
        }
        return OverrideState.builder()
                .type(policy.getType())
                .mode(readerMode != null ? readerMode : policy.getMode())
                .minutes(policy.getMinutes())
                .until(policy.getUntil())
                .build();
    }

    private void applyActor(DoorEvent event, Instant ts, long seq, ApplyOutcome outcome) {
        if (!actorClock.admits(ts, seq)) {
            outcome.stale = true;
            return;
        }
        actorClock.advance(ts, seq);
        actor = event.getActor();
        readerMessage = event.getReaderMessage();
        readerMessageTime = event.getPanelTime() != null ? event.getPanelTime() : ts;
        outcome.changed = true;
    }

    private void applyDoorMessage(DoorEvent event, Instant ts, long seq, ApplyOutcome outcome) {
        if (event.getDoorMessage() == null) {
            return;
        }
        if (!doorMessageClock.admits(ts, seq)) {
            outcome.stale = true;
            return;
        }
        doorMessageClock.advance(ts, seq);
        doorMessage = event.getDoorMessage();
        outcome.changed = true;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    /** Time and arrival sequence of the last value applied to one field. */
    static final class FieldClock {

        private Instant asOf;
        private long sequence;

        boolean admits(Instant ts, long seq) {
            if (asOf == null) {
                return true;
            }
            if (ts.isAfter(asOf)) {
                return true;
            }
            return ts.equals(asOf) && seq >= sequence;
        }

        void advance(Instant ts, long seq) {
            asOf = ts;
            sequence = seq;
        }
    }

    static final class ApplyOutcome {

        boolean changed;
        boolean stale;
    }
}
