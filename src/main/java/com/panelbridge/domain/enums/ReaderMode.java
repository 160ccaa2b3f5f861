package com.panelbridge.domain.enums;

import java.util.Locale;

/**
 * Reader access mode of a door, keyed by the panel's DoorTimeZoneMode legend index.
 *
 * <p>The wire token is what PanelCommands/OverrideDoor and one-time-run schedules accept. Two
 * modes are known to the server under a different token than their display name:
 * FIRST_CREDENTIAL_IN is {@code UnlockWithFirstCardIn} and DUAL_CREDENTIAL is {@code DualCard}.
 * NONE marks a door that follows its schedule and is never sent to the panel.
 */
public enum ReaderMode {
    NONE(-1, null, "None"),
    LOCKDOWN(0, "Lockdown", "Lockdown"),
    CARD(1, "Card", "Card"),
    PIN(2, "Pin", "Pin"),
    CARD_OR_PIN(3, "CardOrPin", "Card or Pin"),
    CARD_AND_PIN(4, "CardAndPin", "Card and Pin"),
    UNLOCK(5, "Unlock", "Unlock"),
    FIRST_CREDENTIAL_IN(6, "UnlockWithFirstCardIn", "First Credential In"),
    DUAL_CREDENTIAL(7, "DualCard", "Dual Credential");

    /** Some panels report lockdown as index 8. */
    private static final int ALTERNATE_LOCKDOWN_INDEX = 8;

    private final int index;
    private final String wireToken;
    private final String label;

    ReaderMode(int index, String wireToken, String label) {
        this.index = index;
        this.wireToken = wireToken;
        this.label = label;
    }

    public int getIndex() {
        return index;
    }

    public String getWireToken() {
        return wireToken;
    }

    public String getLabel() {
        return label;
    }

    public static ReaderMode fromIndex(Integer index) {
        if (index == null) {
            return null;
        }
        if (index == ALTERNATE_LOCKDOWN_INDEX) {
            return LOCKDOWN;
        }
        for (ReaderMode mode : values()) {
            if (mode.index == index && mode != NONE) {
                return mode;
            }
        }
        return null;
    }

    /**
     * Resolves a mode from any of its spellings: enum name, wire token, display label, or the
     * un-aliased names {@code FirstCredentialIn} / {@code DualCredential}. Case and whitespace
     * are ignored. Returns null when nothing matches.
     */
    public static ReaderMode fromText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String key = squash(text);
        for (ReaderMode mode : values()) {
            if (key.equals(squash(mode.name()))
                    || key.equals(squash(mode.label))
                    || (mode.wireToken != null && key.equals(squash(mode.wireToken)))) {
                return mode;
            }
        }
        return null;
    }

    private static String squash(String value) {
        return value.replaceAll("[\\s_]", "").toLowerCase(Locale.ROOT);
    }
}
