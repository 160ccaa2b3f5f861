package com.panelbridge.domain.enums;

/** Where a door event originated. */
public enum EventSource {
    /** Status or notification frame pushed over the event stream. */
    PUSH,
    /** Periodic status snapshot. */
    SNAPSHOT,
    /** Derived from notification text (override/resume/lock phrasing). */
    SYNTHESIZED,
    /** Optimistic update after a successful command. */
    COMMAND
}
