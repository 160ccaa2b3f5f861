package com.panelbridge.unit.stream;

import static org.assertj.core.api.Assertions.assertThat;

import com.panelbridge.client.ReaderModeLegend;
import com.panelbridge.domain.enums.PanelDialect;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DoorStatus;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.stream.DialectDetector;
import com.panelbridge.stream.OdysseyDialectNormalizer;
import com.panelbridge.stream.ProtectorNetDialectNormalizer;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for backend dialect detection and the two status readers.
 */
class DialectNormalizerTest {

    private ReaderModeLegend legend;

    @BeforeEach
    void setUp() {
        legend = new ReaderModeLegend();
    }

    @Nested
    @DisplayName("Detection")
    class Detection {

        @Test
        @DisplayName("JSON booleans with a numeric time zone are ProtectorNET")
        void protectorNet() {
            assertThat(DialectDetector.detect(JsonHelper.readTree(
                            "{\"statusId\":\"P1::3\",\"strike\":true,\"overridden\":false,\"timeZone\":5}")))
                    .isEqualTo(PanelDialect.PROTECTOR_NET);
            assertThat(DialectDetector.detect(JsonHelper.readTree("{\"statusId\":\"P1::3\",\"timeZone\":\"5\"}")))
                    .isEqualTo(PanelDialect.PROTECTOR_NET);
        }

        @Test
        @DisplayName("String flags, PascalCase keys or a named mode mean Odyssey")
        void odyssey() {
            assertThat(DialectDetector.detect(JsonHelper.readTree("{\"statusId\":\"P1::3\",\"strike\":\"True\"}")))
                    .isEqualTo(PanelDialect.ODYSSEY);
            assertThat(DialectDetector.detect(JsonHelper.readTree("{\"StatusId\":\"P1::3\",\"Strike\":true}")))
                    .isEqualTo(PanelDialect.ODYSSEY);
            assertThat(DialectDetector.detect(
                            JsonHelper.readTree("{\"statusId\":\"P1::3\",\"timeZone\":\"Card or Pin\"}")))
                    .isEqualTo(PanelDialect.ODYSSEY);
        }

        @Test
        @DisplayName("Nothing to judge from yields no dialect")
        void undecided() {
            assertThat(DialectDetector.detect(null)).isNull();
            assertThat(DialectDetector.detect(JsonHelper.readTree("{}"))).isNull();
            assertThat(DialectDetector.detect(JsonHelper.readTree("[1]"))).isNull();
        }
    }

    @Nested
    @DisplayName("ProtectorNET")
    class ProtectorNet {

        @Test
        @DisplayName("Reads flags and resolves the time zone through the legend")
        void readsStatus() {
            legend.load(JsonHelper.readTree("[{\"index\":12,\"name\":\"Card or Pin\"}]"));
            ProtectorNetDialectNormalizer normalizer = new ProtectorNetDialectNormalizer(legend);

            DoorStatus status = normalizer.toDoorStatus(JsonHelper.readTree(
                    "{\"statusId\":\"P1::3\",\"strike\":false,\"opener\":1,\"timeZone\":12}"), null);

            assertThat(status.getStatusId()).isEqualTo("P1::3");
            assertThat(status.getStrike()).isFalse();
            assertThat(status.getOpener()).isTrue();
            assertThat(status.getOverridden()).isNull();
            assertThat(status.getReaderMode()).isEqualTo(ReaderMode.CARD_OR_PIN);
        }

        @Test
        @DisplayName("A payload with neither statusId nor known door is unusable")
        void unroutable() {
            ProtectorNetDialectNormalizer normalizer = new ProtectorNetDialectNormalizer(legend);

            assertThat(normalizer.toDoorStatus(JsonHelper.readTree("{\"strike\":true}"), null)).isNull();
            assertThat(normalizer.toDoorStatus(JsonHelper.readTree("{\"strike\":true}"), 7).getDoorId()).isEqualTo(7);
        }
    }

    @Nested
    @DisplayName("Odyssey")
    class Odyssey {

        @Test
        @DisplayName("Reads string flags, a named mode and the panel timestamp")
        void readsStatus() {
            OdysseyDialectNormalizer normalizer = new OdysseyDialectNormalizer(legend);

            DoorStatus status = normalizer.toDoorStatus(JsonHelper.readTree("{\"StatusId\":\"P1::3\","
                    + "\"Strike\":\"True\",\"Opener\":\"off\",\"Overridden\":\"yes\",\"TimeZone\":\"Unlock\","
                    + "\"Date\":\"2026-05-04T12:00:05\"}"), null);

            assertThat(status.getStatusId()).isEqualTo("P1::3");
            assertThat(status.getStrike()).isTrue();
            assertThat(status.getOpener()).isFalse();
            assertThat(status.getOverridden()).isTrue();
            assertThat(status.getReaderMode()).isEqualTo(ReaderMode.UNLOCK);
            assertThat(status.getTimestamp()).isEqualTo(Instant.parse("2026-05-04T12:00:05Z"));
        }

        @Test
        @DisplayName("Numeric time zones go through the static indices when no legend is loaded")
        void numericMode() {
            OdysseyDialectNormalizer normalizer = new OdysseyDialectNormalizer(legend);

            DoorStatus status = normalizer.toDoorStatus(
                    JsonHelper.readTree("{\"statusId\":\"P1::3\",\"timeZone\":\"8\",\"strike\":\"maybe\"}"), null);

            assertThat(status.getReaderMode()).isEqualTo(ReaderMode.LOCKDOWN);
            assertThat(status.getStrike()).isNull();
            assertThat(status.getTimestamp()).isNull();
        }
    }
}
