package com.panelbridge.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class DiscoveryResult {

    Partition partition;

    @Singular
    List<DoorDescriptor> doors;

    @Singular
    List<Reader> readers;

    @Singular
    List<ActionPlan> plans;
}
