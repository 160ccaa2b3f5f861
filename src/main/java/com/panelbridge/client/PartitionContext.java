package com.panelbridge.client;

import com.panelbridge.config.PanelConfig;
import com.panelbridge.domain.model.Partition;
import com.panelbridge.exception.ValidationException;
import com.panelbridge.state.PanelStateStore;
import org.springframework.stereotype.Component;

/** The partition commands are scoped to: the discovered one, else the configured one. */
@Component
public class PartitionContext {

    private final PanelStateStore stateStore;
    private final PanelConfig panelConfig;

    public PartitionContext(PanelStateStore stateStore, PanelConfig panelConfig) {
        this.stateStore = stateStore;
        this.panelConfig = panelConfig;
    }

    public int requirePartitionId() {
        Partition partition = stateStore.partition();
        if (partition != null) {
            return partition.getId();
        }
        if (panelConfig.getPartitionId() != null) {
            return panelConfig.getPartitionId();
        }
        throw new ValidationException("No partition selected: set panel.partition-id or run discovery first");
    }
}
