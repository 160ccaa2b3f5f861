package com.panelbridge.unit.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.panelbridge.client.DiscoveryClient;
import com.panelbridge.client.ReaderModeLegend;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DiscoveryResult;
import com.panelbridge.domain.model.DoorDescriptor;
import com.panelbridge.exception.RemoteRejectionException;
import com.panelbridge.exception.ResourceNotFoundException;
import com.panelbridge.normalizer.ReaderDoorIndex;
import com.panelbridge.session.PanelSessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DiscoveryClientTest {

    private static final String OVERVIEW = "{\"Status\":{\"Nodes\":[{\"Type\":\"Site\",\"Nodes\":["
            + "{\"Type\":\"Panel\",\"Name\":\"P1\",\"Nodes\":["
            + "{\"Type\":\"Door\",\"Id\":7,\"Name\":\"Lobby\",\"StatusId\":\"P1::3\","
            + "\"Nodes\":[{\"Type\":\"Reader\",\"Id\":71,\"Name\":\"Lobby Reader 1\"}]},"
            + "{\"Type\":\"Door\",\"Id\":99,\"Name\":\"Other tenant\",\"StatusId\":\"P1::9\"}]},"
            + "{\"Type\":\"Panel\",\"Name\":\"P2\",\"Nodes\":["
            + "{\"Type\":\"Door\",\"Id\":8,\"Name\":\"Dock\",\"StatusId\":\"P2::1\"}]}]}]}}";

    private FakePanel panel;
    private ReaderModeLegend legend;
    private DiscoveryClient discoveryClient;

    @BeforeEach
    void setUp() {
        PanelSessionManager sessionManager = mock(PanelSessionManager.class);
        panel = FakePanel.attachTo(sessionManager);
        legend = new ReaderModeLegend();
        discoveryClient = new DiscoveryClient(sessionManager, legend);
    }

    @Nested
    @DisplayName("Discover")
    class Discover {

        @BeforeEach
        void panelLayout() {
            panel.on("GET /api/Partitions/ByPrivilege/Manage_Doors",
                            "{\"Results\":[{\"Id\":1,\"Name\":\"Main\"},{\"Id\":2,\"Name\":\"Annex\"}]}")
                    .on("GET /api/doors", "{\"Results\":[{\"Id\":7,\"Name\":\"Lobby\"},{\"Id\":8,\"Name\":\"Dock\"},"
                            + "{\"Id\":9}]}")
                    .on("GET /api/AccessPrivilegeGroups/AvailableReaders/1",
                            "{\"Results\":[{\"Id\":81,\"DoorId\":8,\"Name\":\"Dock Reader\"},{\"Id\":5}]}")
                    .on("GET /api/system/overview/System", OVERVIEW)
                    .on("GET /api/TimeSpanStates/DoorTimeZoneMode",
                            "[{\"index\":0,\"name\":\"Lockdown\"},{\"index\":9,\"name\":\"Unlock\"}]")
                    .on("GET /api/ActionPlans", "{\"Results\":[{\"Id\":300,\"Name\":\"Log\",\"PlanType\":\"Local\"}]}");
        }

        @Test
        @DisplayName("Collects doors with their stream routing keys, readers, plans and the mode legend")
        void discoversPartition() {
            DiscoveryResult result = discoveryClient.discover(1);

            assertThat(result.getPartition().getName()).isEqualTo("Main");
            assertThat(result.getDoors()).extracting(DoorDescriptor::getId).containsExactly(7, 8, 9);
            assertThat(result.getDoors()).extracting(DoorDescriptor::getStatusId)
                    .containsExactly("P1::3", "P2::1", null);
            assertThat(result.getDoors().get(2).getName()).isEqualTo("Door 9");
            assertThat(result.getReaders()).hasSize(1);
            assertThat(result.getPlans()).singleElement().satisfies(plan -> assertThat(plan.getId()).isEqualTo(300L));
            assertThat(legend.isLoaded()).isTrue();
            assertThat(legend.indexOf(ReaderMode.UNLOCK)).isEqualTo(9);
        }

        @Test
        @DisplayName("A partition the account cannot manage is reported as not found")
        void unknownPartition() {
            assertThatThrownBy(() -> discoveryClient.discover(5)).isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Without the overview the index still routes by reader")
        void overviewUnavailable() {
            panel.on("GET /api/system/overview/System", request -> {
                throw new RemoteRejectionException(500, "boom");
            });

            ReaderDoorIndex index = discoveryClient.buildIndex(1);

            assertThat(index.panels()).isEmpty();
            assertThat(index.doorForReader(81, null)).isEqualTo(8);
        }

        @Test
        @DisplayName("The index only subscribes panels hosting partition doors")
        void indexPanels() {
            ReaderDoorIndex index = discoveryClient.buildIndex(1);

            assertThat(index.panels()).containsExactly("P1", "P2");
            assertThat(index.doorForStatusId("P1::9")).isNull();
            assertThat(index.doorForReader(71, null)).isEqualTo(7);
        }
    }

    @Nested
    @DisplayName("Door status")
    class DoorStatus {

        @Test
        @DisplayName("Falls back to the lower-case path on 404")
        void fallsBack() {
            panel.on("GET /api/Doors/7/Status", request -> {
                throw new RemoteRejectionException(404, "Not found");
            }).on("GET /api/doors/7/status", "{\"statusId\":\"P1::3\"}");

            assertThat(discoveryClient.doorStatus(7))
                    .hasValueSatisfying(json -> assertThat(json.path("statusId").asText()).isEqualTo("P1::3"));
        }

        @Test
        @DisplayName("Empty when neither path exists")
        void unsupported() {
            panel.on("GET /api/Doors/7/Status", request -> {
                        throw new RemoteRejectionException(404, "Not found");
                    })
                    .on("GET /api/doors/7/status", request -> {
                        throw new RemoteRejectionException(404, "Not found");
                    });

            assertThat(discoveryClient.doorStatus(7)).isEmpty();
            assertThat(panel.requests()).hasSize(2);
        }

        @Test
        @DisplayName("Other rejections propagate")
        void otherRejection() {
            panel.on("GET /api/Doors/7/Status", request -> {
                throw new RemoteRejectionException(503, "Busy");
            });

            assertThatThrownBy(() -> discoveryClient.doorStatus(7)).isInstanceOf(RemoteRejectionException.class);
        }
    }
}
