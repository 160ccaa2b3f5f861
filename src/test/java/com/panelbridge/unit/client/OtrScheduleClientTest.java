package com.panelbridge.unit.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.client.OtrScheduleClient;
import com.panelbridge.config.PanelConfig;
import com.panelbridge.dispatch.StateChangeDispatcher;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DiscoveryResult;
import com.panelbridge.domain.model.DoorDescriptor;
import com.panelbridge.domain.model.OtrSchedule;
import com.panelbridge.domain.model.Partition;
import com.panelbridge.event.EventPublisherHelper;
import com.panelbridge.exception.ValidationException;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.session.PanelSessionManager;
import com.panelbridge.state.PanelStateStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OtrScheduleClientTest {

    private static final String PATH = "/api/OneTimeRunTimeZones/Doors";

    private FakePanel panel;
    private PanelStateStore stateStore;
    private EventPublisherHelper eventPublisherHelper;
    private OtrScheduleClient otrScheduleClient;

    @BeforeEach
    void setUp() {
        PanelSessionManager sessionManager = mock(PanelSessionManager.class);
        panel = FakePanel.attachTo(sessionManager);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        stateStore = new PanelStateStore(new StateChangeDispatcher(Runnable::run));
        stateStore.loadDiscovery(DiscoveryResult.builder()
                .partition(new Partition(1, "Main"))
                .door(DoorDescriptor.builder().id(7).name("Lobby").partitionId(1).build())
                .door(DoorDescriptor.builder().id(8).name("Dock").partitionId(1).build())
                .build());
        PanelConfig panelConfig = new PanelConfig();
        otrScheduleClient = new OtrScheduleClient(
                sessionManager,
                stateStore,
                panelConfig,
                eventPublisherHelper,
                Clock.fixed(Instant.parse("2026-05-04T12:00:00Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Create")
    class Create {

        @Test
        @DisplayName("Posts every door with the mode token and one date window")
        void payload() {
            panel.on("POST " + PATH, "{\"Id\":55}");

            OtrSchedule schedule = otrScheduleClient.create(
                    List.of(7, 8), "2026-05-05T08:00:00Z", "2026-05-05T10:00:00Z", null, "Delivery", null);

            assertThat(schedule.getId()).isEqualTo(55L);
            assertThat(schedule.getMode()).isEqualTo("Unlock");
            JsonNode body = JsonHelper.mapper().valueToTree(panel.requests("POST " + PATH).get(0).getBody());
            assertThat(body.path("Name").asText()).isEqualTo("Delivery");
            assertThat(body.path("StartTime").asText()).isEqualTo("2026-05-05T08:00:00");
            assertThat(body.path("Doors")).hasSize(2);
            assertThat(body.path("Doors").get(1).path("Id").asInt()).isEqualTo(8);
            assertThat(body.path("Dates").get(0).path("StopTime").asText()).isEqualTo("2026-05-05T10:00:00");
            assertThat(body.has("Description")).isFalse();
            verify(eventPublisherHelper).publishCacheRefresh(any(), eq("otr-created"));
        }

        @Test
        @DisplayName("An Id of 0 is resolved by re-listing and matching the name")
        void zeroIdLookedUpByName() {
            panel.on("POST " + PATH, "{\"Id\":0}")
                    .on("GET " + PATH, "{\"Results\":[{\"Id\":12,\"Name\":\"Other\",\"DoorId\":8},"
                            + "{\"Id\":77,\"Name\":\"Delivery\",\"DoorId\":7}]}");

            OtrSchedule schedule = otrScheduleClient.create(
                    List.of(7), "2026-05-05T08:00:00Z", "2026-05-05T10:00:00Z", ReaderMode.CARD, "Delivery", "");

            assertThat(schedule.getId()).isEqualTo(77L);
            assertThat(stateStore.otrSchedules(7)).extracting(OtrSchedule::getId).containsExactly(77L);
        }

        @Test
        @DisplayName("Generates a timestamped name when none is given")
        void defaultName() {
            panel.on("POST " + PATH, "{\"Id\":3}");

            OtrSchedule schedule =
                    otrScheduleClient.create(List.of(7), "2026-05-05T08:00:00Z", "2026-05-05T09:00:00Z", null, " ", null);

            assertThat(schedule.getName()).isEqualTo("HA Schedule 20260504_120000");
        }

        @Test
        @DisplayName("Rejects bad input before calling the panel")
        void validation() {
            assertThatThrownBy(() -> otrScheduleClient.create(
                            List.of(7), "2026-05-05T10:00:00Z", "2026-05-05T10:00:00Z", null, null, null))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("after");
            assertThatThrownBy(() -> otrScheduleClient.create(
                            List.of(42), "2026-05-05T08:00:00Z", "2026-05-05T10:00:00Z", null, null, null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> otrScheduleClient.create(
                            List.of(7), "soon", "2026-05-05T10:00:00Z", null, null, null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> otrScheduleClient.create(
                            List.of(7), "2026-05-05T08:00:00Z", "2026-05-05T10:00:00Z", ReaderMode.NONE, null, null))
                    .isInstanceOf(ValidationException.class);
            assertThat(panel.requests()).isEmpty();
        }
    }

    @Test
    @DisplayName("List resolves doors by DoorId, then the Doors array, then DoorName")
    void listResolvesDoors() {
        panel.on("GET " + PATH, "{\"Results\":["
                + "{\"Id\":1,\"Name\":\"a\",\"DoorId\":7,\"StartTime\":\"2026-05-05T08:00:00\"},"
                + "{\"Id\":2,\"Name\":\"b\",\"DoorId\":0,\"Doors\":[{\"Id\":7},{\"Id\":8}]},"
                + "{\"Id\":3,\"Name\":\"c\",\"DoorName\":\"Dock\"},"
                + "{\"Id\":4,\"Name\":\"d\",\"DoorName\":\"Nowhere\"},"
                + "{\"Name\":\"no id\"}]}");

        List<OtrSchedule> schedules = otrScheduleClient.list();

        assertThat(schedules).extracting(OtrSchedule::getDoorIds)
                .containsExactly(List.of(7), List.of(7, 8), List.of(8), List.of());
        assertThat(schedules.get(0).getStartUtc()).isEqualTo(Instant.parse("2026-05-05T08:00:00Z"));
        assertThat(stateStore.otrSchedules(7)).extracting(OtrSchedule::getId).containsExactly(1L, 2L);
        assertThat(stateStore.otrSchedules(8)).extracting(OtrSchedule::getId).containsExactly(2L, 3L);
    }

    @Test
    @DisplayName("Delete removes the schedule by id and asks for a cache refresh")
    void delete() {
        otrScheduleClient.delete(55);

        assertThat(panel.requests("DELETE " + PATH + "/55")).hasSize(1);
        verify(eventPublisherHelper).publishCacheRefresh(any(), eq("otr-deleted"));
    }
}
