package com.panelbridge.domain.enums;

/**
 * Physical lock state of a door as reported by the panel.
 * Strike or opener energized means UNLOCKED; both released means LOCKED.
 */
public enum LockState {
    LOCKED,
    UNLOCKED,
    UNKNOWN;

    /** Derives the lock state from strike/opener flags; UNKNOWN when neither settles it. */
    public static LockState fromStrikeOpener(Boolean strike, Boolean opener) {
        if (Boolean.TRUE.equals(strike) || Boolean.TRUE.equals(opener)) {
            return UNLOCKED;
        }
        if (Boolean.FALSE.equals(strike) && Boolean.FALSE.equals(opener)) {
            return LOCKED;
        }
        return UNKNOWN;
    }
}
