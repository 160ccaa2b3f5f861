package com.panelbridge.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.client.PanelTimeFormat;
import com.panelbridge.client.ReaderModeLegend;
import com.panelbridge.domain.enums.PanelDialect;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DoorStatus;
import com.panelbridge.mapper.JsonHelper;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Odyssey status. Keys may be PascalCase or camelCase, flags arrive as {@code "True"}/{@code
 * "False"} strings, and the reader mode is either a legend index or the mode's name. Odyssey also
 * stamps the status with the panel's time.
 */
@Component
public class OdysseyDialectNormalizer implements DialectNormalizer {

    private final ReaderModeLegend readerModeLegend;

    public OdysseyDialectNormalizer(ReaderModeLegend readerModeLegend) {
        this.readerModeLegend = readerModeLegend;
    }

    @Override
    public PanelDialect dialect() {
        return PanelDialect.ODYSSEY;
    }

    @Override
    public DoorStatus toDoorStatus(JsonNode payload, Integer knownDoorId) {
        String statusId = JsonHelper.text(payload, "statusId", "StatusId");
        if (statusId == null && knownDoorId == null) {
            return null;
        }
        return DoorStatus.builder()
                .statusId(statusId)
                .doorId(knownDoorId)
                .strike(flag(payload, "strike", "Strike"))
                .opener(flag(payload, "opener", "Opener"))
                .overridden(flag(payload, "overridden", "Overridden"))
                .readerMode(readerMode(payload))
                .timestamp(PanelTimeFormat.fromWire(JsonHelper.text(payload, "date", "Date", "timestamp", "Timestamp")))
                .build();
    }

    // ---- Private helpers ----

    private ReaderMode readerMode(JsonNode payload) {
        Integer index = JsonHelper.integer(payload, "timeZone", "TimeZone");
        if (index != null) {
            return readerModeLegend.modeOf(index);
        }
        ReaderMode named = ReaderMode.fromText(JsonHelper.text(payload, "timeZone", "TimeZone"));
        return named == ReaderMode.NONE ? null : named;
    }

    private static Boolean flag(JsonNode payload, String... fields) {
        for (String field : fields) {
            JsonNode value = payload.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isBoolean()) {
                return value.booleanValue();
            }
            if (value.isNumber()) {
                return value.intValue() != 0;
            }
            switch (value.asText().trim().toLowerCase(Locale.ROOT)) {
                case "true", "1", "yes", "on" -> {
                    return true;
                }
                case "false", "0", "no", "off" -> {
                    return false;
                }
                default -> {
                    return null;
                }
            }
        }
        return null;
    }
}
