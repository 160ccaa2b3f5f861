package com.panelbridge.domain.enums;

/**
 * Duration policy of a door override, with the {@code OverrideType} token the panel expects.
 */
public enum OverrideType {
    /** Lasts a number of minutes. */
    TIMED("Time"),
    /** Lasts until an explicit resume. */
    UNTIL_RESUMED("Resume"),
    /** Lasts until the door's next scheduled transition. */
    UNTIL_NEXT_SCHEDULE("Schedule");

    private final String wireToken;

    OverrideType(String wireToken) {
        this.wireToken = wireToken;
    }

    public String getWireToken() {
        return wireToken;
    }
}
