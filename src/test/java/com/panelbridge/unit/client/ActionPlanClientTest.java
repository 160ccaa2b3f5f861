package com.panelbridge.unit.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.client.ActionPlanClient;
import com.panelbridge.client.CommandResult;
import com.panelbridge.client.DiscoveryClient;
import com.panelbridge.client.PartitionContext;
import com.panelbridge.client.TargetResult;
import com.panelbridge.config.PanelConfig;
import com.panelbridge.dispatch.StateChangeDispatcher;
import com.panelbridge.domain.model.ActionPlan;
import com.panelbridge.exception.RemoteRejectionException;
import com.panelbridge.exception.ValidationException;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelSessionManager;
import com.panelbridge.state.PanelStateStore;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ActionPlanClientTest {

    private FakePanel panel;
    private DiscoveryClient discoveryClient;
    private ActionPlanClient actionPlanClient;

    @BeforeEach
    void setUp() {
        PanelSessionManager sessionManager = mock(PanelSessionManager.class);
        panel = FakePanel.attachTo(sessionManager);
        discoveryClient = mock(DiscoveryClient.class);
        PanelConfig panelConfig = new PanelConfig();
        panelConfig.setPartitionId(2);
        PartitionContext partitionContext =
                new PartitionContext(new PanelStateStore(new StateChangeDispatcher(Runnable::run)), panelConfig);
        actionPlanClient = new ActionPlanClient(sessionManager, discoveryClient, partitionContext);
    }

    @Nested
    @DisplayName("Execute")
    class Execute {

        @Test
        @DisplayName("Posts session variables to the plan's Exec endpoint in the current partition")
        void executesPlan() {
            actionPlanClient.executePlan(300, Map.of("Door", "Lobby"), " Debug ");

            PanelRequest sent = panel.requests().get(0);
            assertThat(sent.getPath()).isEqualTo("/api/ActionPlans/300/Exec/Debug");
            assertThat(sent.getQueryParams()).containsEntry("PartitionId", 2);
            JsonNode body = JsonHelper.mapper().valueToTree(sent.getBody());
            assertThat(body.path("SessionVars").path("Door").asText()).isEqualTo("Lobby");
        }

        @Test
        @DisplayName("Reports each plan separately")
        void perPlanResults() {
            panel.on("POST /api/ActionPlans/2/Exec", request -> {
                throw new RemoteRejectionException(400, "Plan is disabled");
            });

            CommandResult result = actionPlanClient.executePlans(List.of(1L, 2L), null, null);

            assertThat(result.getSucceededIds()).containsExactly(1L);
            assertThat(result.getFailures()).extracting(TargetResult::getTargetId).containsExactly(2L);
            assertThat(result.getFailures().get(0).getError()).contains("Plan is disabled");
        }

        @Test
        @DisplayName("An empty plan list is rejected")
        void emptyPlans() {
            assertThatThrownBy(() -> actionPlanClient.executePlans(List.of(), null, null))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("System plans")
    class SystemPlans {

        @Test
        @DisplayName("A trigger plan is cloned once: skeleton first, then its contents")
        void clonesTriggerPlan() {
            when(discoveryClient.getActionPlan(40)).thenReturn(ActionPlan.builder()
                    .id(40)
                    .name("Open Lobby")
                    .planType("Trigger")
                    .partitionId(2)
                    .contents("{\"Action\":{}}")
                    .build());
            when(discoveryClient.listActionPlans(2)).thenReturn(List.of());
            panel.on("POST /api/ActionPlans", "{\"Id\":41}");

            long cloneId = actionPlanClient.findOrCloneSystemPlan(40);

            assertThat(cloneId).isEqualTo(41L);
            JsonNode skeleton = JsonHelper.mapper().valueToTree(panel.requests("POST /api/ActionPlans").get(0).getBody());
            assertThat(skeleton.path("Name").asText()).isEqualTo("Open Lobby (Home Assistant)");
            assertThat(skeleton.path("PlanType").asText()).isEqualTo("System");
            JsonNode update = JsonHelper.mapper().valueToTree(panel.requests("PUT /api/ActionPlans/41").get(0).getBody());
            assertThat(update.path("Properties").get(0).path("Value").asText()).isEqualTo("{\"Action\":{}}");
        }

        @Test
        @DisplayName("An existing clone in the same partition is reused")
        void reusesClone() {
            when(discoveryClient.getActionPlan(40)).thenReturn(
                    ActionPlan.builder().id(40).name("Open Lobby").planType("Trigger").partitionId(2).build());
            when(discoveryClient.listActionPlans(2)).thenReturn(List.of(
                    ActionPlan.builder().id(55).name("Open Lobby (Home Assistant)").planType("System").partitionId(2).build()));

            assertThat(actionPlanClient.findOrCloneSystemPlan(40)).isEqualTo(55L);
            assertThat(panel.requests()).isEmpty();
        }

        @Test
        @DisplayName("The door-log plan is created with a Log action when missing")
        void createsLogPlan() {
            when(discoveryClient.listActionPlans(2)).thenReturn(List.of(
                    ActionPlan.builder().id(9).name("HA Door Log").planType("Trigger").partitionId(2).build()));
            panel.on("POST /api/ActionPlans", "{\"Id\":77}");

            assertThat(actionPlanClient.findOrCreateLogPlan()).isEqualTo(77L);
            JsonNode update = JsonHelper.mapper().valueToTree(panel.requests("PUT /api/ActionPlans/77").get(0).getBody());
            JsonNode contents = JsonHelper.readTree(update.path("Properties").get(0).path("Value").asText());
            assertThat(contents.path("Action").path("_Type").asText()).isEqualTo("Log");
            assertThat(contents.path("Action").path("Parameters").path("Message").asText())
                    .isEqualTo("@{Session.App} unlocked @{Session.Door}");
        }
    }
}
