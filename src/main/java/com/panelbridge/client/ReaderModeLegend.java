package com.panelbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.mapper.JsonHelper;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The panel's DoorTimeZoneMode legend ({@code [{index, name}]}).
 *
 * <p>Panels may number reader modes differently from the usual 0..7 layout. When the legend was
 * loaded its indices win; otherwise {@link ReaderMode}'s static indices apply.
 */
@Component
public class ReaderModeLegend {

    private static final Logger log = LoggerFactory.getLogger(ReaderModeLegend.class);

    private volatile Map<Integer, ReaderMode> modeByIndex = Map.of();
    private volatile Map<ReaderMode, Integer> indexByMode = Map.of();

    /** Replaces the legend with the rows of a {@code TimeSpanStates/DoorTimeZoneMode} payload. */
    public void load(JsonNode legend) {
        Map<Integer, ReaderMode> byIndex = new HashMap<>();
        Map<ReaderMode, Integer> byMode = new EnumMap<>(ReaderMode.class);
        for (JsonNode row : JsonHelper.results(legend)) {
            Integer index = JsonHelper.integer(row, "index", "Index");
            ReaderMode mode = ReaderMode.fromText(JsonHelper.text(row, "name", "Name"));
            if (index == null || mode == null || mode == ReaderMode.NONE) {
                continue;
            }
            byIndex.put(index, mode);
            byMode.putIfAbsent(mode, index);
        }
        this.modeByIndex = Map.copyOf(byIndex);
        this.indexByMode = byMode.isEmpty() ? Map.of() : Map.copyOf(byMode);
        log.debug("Reader mode legend loaded with {} entries", byIndex.size());
    }

    /** Reader mode for a stream {@code timeZone} index, or null when the index is unknown. */
    public ReaderMode modeOf(Integer index) {
        if (index == null) {
            return null;
        }
        ReaderMode mode = modeByIndex.get(index);
        return mode != null ? mode : ReaderMode.fromIndex(index);
    }

    /** Index sent alongside the mode token in override commands. */
    public int indexOf(ReaderMode mode) {
        Integer index = indexByMode.get(mode);
        return index != null ? index : mode.getIndex();
    }

    public boolean isLoaded() {
        return !modeByIndex.isEmpty();
    }
}
