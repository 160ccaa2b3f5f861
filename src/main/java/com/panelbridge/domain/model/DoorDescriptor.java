package com.panelbridge.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Static identity of a door found during discovery.
 *
 * <p>{@code statusId} is the stream routing key ({@code <panel>::<address>}); the part before
 * {@code ::} names the panel to subscribe to. It is null when the system overview did not list
 * the door.
 */
@Value
@Builder
public class DoorDescriptor {

    int id;
    String name;
    int partitionId;
    String statusId;

    public String panelKey() {
        if (statusId == null) {
            return null;
        }
        int sep = statusId.indexOf("::");
        String root = sep >= 0 ? statusId.substring(0, sep) : statusId;
        return root.isBlank() ? null : root;
    }
}
