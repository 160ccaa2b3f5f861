package com.panelbridge.dispatch;

public enum EntityType {
    DOOR,
    TEMP_CODES,
    OTR_SCHEDULES,
    CONNECTION
}
