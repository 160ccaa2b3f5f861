package com.panelbridge.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.domain.enums.PanelDialect;
import com.panelbridge.domain.model.DoorStatus;

/**
 * Turns one backend dialect's door status payload (a {@code status} frame argument or a
 * {@code Doors/{id}/Status} snapshot body) into a dialect-neutral {@link DoorStatus}.
 */
public interface DialectNormalizer {

    PanelDialect dialect();

    /**
     * @param payload the status object
     * @param knownDoorId door the payload was requested for (snapshots), or null for pushed frames
     * @return the status, or null when the payload carries neither a statusId nor a door id
     */
    DoorStatus toDoorStatus(JsonNode payload, Integer knownDoorId);
}
