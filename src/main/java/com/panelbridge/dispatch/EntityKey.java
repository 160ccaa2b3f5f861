package com.panelbridge.dispatch;

import lombok.Value;

/**
 * Identity of an observable entity. Door-scoped keys carry the door id; {@code CONNECTION} is a
 * singleton.
 */
@Value
public class EntityKey {

    private static final EntityKey CONNECTION_KEY = new EntityKey(EntityType.CONNECTION, 0);

    EntityType type;
    int id;

    public static EntityKey door(int doorId) {
        return new EntityKey(EntityType.DOOR, doorId);
    }

    public static EntityKey tempCodes(int doorId) {
        return new EntityKey(EntityType.TEMP_CODES, doorId);
    }

    public static EntityKey otrSchedules(int doorId) {
        return new EntityKey(EntityType.OTR_SCHEDULES, doorId);
    }

    public static EntityKey connection() {
        return CONNECTION_KEY;
    }

    @Override
    public String toString() {
        return type == EntityType.CONNECTION ? "CONNECTION" : type + "/" + id;
    }
}
