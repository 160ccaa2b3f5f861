package com.panelbridge.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.client.ReaderModeLegend;
import com.panelbridge.domain.enums.PanelDialect;
import com.panelbridge.domain.model.DoorStatus;
import com.panelbridge.mapper.JsonHelper;
import org.springframework.stereotype.Component;

/** ProtectorNET status: camelCase keys, JSON booleans, {@code timeZone} as a legend index. */
@Component
public class ProtectorNetDialectNormalizer implements DialectNormalizer {

    private final ReaderModeLegend readerModeLegend;

    public ProtectorNetDialectNormalizer(ReaderModeLegend readerModeLegend) {
        this.readerModeLegend = readerModeLegend;
    }

    @Override
    public PanelDialect dialect() {
        return PanelDialect.PROTECTOR_NET;
    }

    @Override
    public DoorStatus toDoorStatus(JsonNode payload, Integer knownDoorId) {
        String statusId = JsonHelper.text(payload, "statusId");
        if (statusId == null && knownDoorId == null) {
            return null;
        }
        return DoorStatus.builder()
                .statusId(statusId)
                .doorId(knownDoorId)
                .strike(flag(payload, "strike"))
                .opener(flag(payload, "opener"))
                .overridden(flag(payload, "overridden"))
                .readerMode(readerModeLegend.modeOf(JsonHelper.integer(payload, "timeZone")))
                .build();
    }

    private static Boolean flag(JsonNode payload, String field) {
        JsonNode value = payload.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.isNumber() ? value.intValue() != 0 : null;
    }
}
