package com.panelbridge.domain.enums;

/**
 * Canonical door events produced by the normalizer, whatever dialect or frame type they came from.
 */
public enum DoorEventType {

    /** Strike/opener state changed. Never touches the last-log actor. */
    LOCK_STATE_CHANGED,

    /** Door is overridden (or its override mode changed). */
    OVERRIDE_CHANGED,

    /** Door follows its schedule again; carries the scheduled reader mode when known. */
    SCHEDULE_FLIPPED,

    ACCESS_GRANTED,

    ACCESS_DENIED,

    /** An action plan acted on the door. */
    ACTION_PLAN_EXECUTED,

    /** A one-time-run schedule became active on the door. */
    OTR_ACTIVATED,

    /** Door lock/unlock text line. Updates the door message only. */
    DOOR_MESSAGE;

    /** Whether this event names who acted, and therefore replaces the last-log actor. */
    public boolean carriesActor() {
        return switch (this) {
            case ACCESS_GRANTED, ACCESS_DENIED, ACTION_PLAN_EXECUTED, OTR_ACTIVATED -> true;
            default -> false;
        };
    }
}
