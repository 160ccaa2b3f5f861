package com.panelbridge.unit.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.JsonNode;
import com.panelbridge.client.CommandResult;
import com.panelbridge.client.OverrideMinutesCalculator;
import com.panelbridge.client.PanelCommandClient;
import com.panelbridge.client.ReaderModeLegend;
import com.panelbridge.client.TargetResult;
import com.panelbridge.config.PanelConfig;
import com.panelbridge.dispatch.StateChangeDispatcher;
import com.panelbridge.domain.enums.OverrideType;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DiscoveryResult;
import com.panelbridge.domain.model.Door;
import com.panelbridge.domain.model.DoorDescriptor;
import com.panelbridge.domain.model.Partition;
import com.panelbridge.exception.RemoteRejectionException;
import com.panelbridge.exception.ValidationException;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelResponse;
import com.panelbridge.session.PanelSessionManager;
import com.panelbridge.state.EventSequencer;
import com.panelbridge.state.PanelStateStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link PanelCommandClient}: per-door fan-out, wire payloads and the optimistic
 * state update after a successful command.
 */
class PanelCommandClientTest {

    private static final Instant NOW = Instant.parse("2026-05-04T12:00:00Z");

    private FakePanel panel;
    private PanelStateStore stateStore;
    private PanelCommandClient commandClient;

    @BeforeEach
    void setUp() {
        PanelSessionManager sessionManager = mock(PanelSessionManager.class);
        panel = FakePanel.attachTo(sessionManager);
        stateStore = new PanelStateStore(new StateChangeDispatcher(Runnable::run));
        stateStore.loadDiscovery(DiscoveryResult.builder()
                .partition(new Partition(1, "Main"))
                .door(DoorDescriptor.builder().id(10).name("Front").partitionId(1).build())
                .door(DoorDescriptor.builder().id(11).name("Back").partitionId(1).build())
                .build());
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        commandClient = new PanelCommandClient(
                sessionManager,
                stateStore,
                new OverrideMinutesCalculator(new PanelConfig(), clock),
                new ReaderModeLegend(),
                new EventSequencer(),
                clock);
    }

    @Test
    @DisplayName("Multi-door override reports each door; unknown and rejected doors fail alone")
    void multiDoorOverridePerTarget() {
        panel.on("POST /api/PanelCommands/OverrideDoor", request -> {
            JsonNode body = JsonHelper.mapper().valueToTree(request.getBody());
            if (body.path("DoorIds").get(0).asInt() == 11) {
                throw new RemoteRejectionException(400, "Door offline");
            }
            return new PanelResponse(200, "{}");
        });

        CommandResult result = commandClient.override(
                List.of(10, 99, 11), OverrideType.TIMED, ReaderMode.UNLOCK, null, NOW.plusSeconds(30 * 60));

        assertThat(result.isAllSucceeded()).isFalse();
        assertThat(result.getSucceededIds()).containsExactly(10L);
        assertThat(result.getFailures()).extracting(TargetResult::getTargetId).containsExactly(99L, 11L);
        assertThat(result.getFailures().get(1).getError()).contains("Door offline");
        assertThat(panel.requests("POST /api/PanelCommands/OverrideDoor")).hasSize(2);
    }

    @Test
    @DisplayName("Timed override sends the mode token, index and whole minutes")
    void overridePayload() {
        commandClient.override(List.of(10), OverrideType.TIMED, ReaderMode.FIRST_CREDENTIAL_IN, null, NOW.plusSeconds(30 * 60));

        PanelRequest sent = panel.requests("POST /api/PanelCommands/OverrideDoor").get(0);
        JsonNode body = JsonHelper.mapper().valueToTree(sent.getBody());
        assertThat(body.path("DoorIds").get(0).asInt()).isEqualTo(10);
        assertThat(body.path("OverrideType").asText()).isEqualTo("Time");
        assertThat(body.path("TimeZoneMode").asText()).isEqualTo("UnlockWithFirstCardIn");
        assertThat(body.path("Minutes").asInt()).isEqualTo(30);
        assertThat(body.path("ModeIndex").asInt()).isEqualTo(6);
    }

    @Test
    @DisplayName("Untimed overrides carry no minutes")
    void untilResumedHasNoMinutes() {
        commandClient.override(List.of(10), OverrideType.UNTIL_RESUMED, ReaderMode.LOCKDOWN, 20, null);

        JsonNode body = JsonHelper.mapper().valueToTree(
                panel.requests("POST /api/PanelCommands/OverrideDoor").get(0).getBody());
        assertThat(body.path("OverrideType").asText()).isEqualTo("Resume");
        assertThat(body.has("Minutes")).isFalse();
    }

    @Test
    @DisplayName("Successful override is reflected in the store with its policy")
    void overrideUpdatesStore() {
        commandClient.override(List.of(10), OverrideType.TIMED, ReaderMode.UNLOCK, 15, null);

        Door door = stateStore.door(10).orElseThrow();
        assertThat(door.getOverridden()).isTrue();
        assertThat(door.getReaderMode()).isEqualTo(ReaderMode.UNLOCK);
        assertThat(door.getOverride().getType()).isEqualTo(OverrideType.TIMED);
        assertThat(door.getOverride().getMinutes()).isEqualTo(15);
        assertThat(door.getOverride().getUntil()).isEqualTo(NOW.plusSeconds(15 * 60));
    }

    @Test
    @DisplayName("Resume clears the override")
    void resumeClearsOverride() {
        commandClient.override(List.of(10), OverrideType.UNTIL_RESUMED, ReaderMode.UNLOCK, null, null);

        CommandResult result = commandClient.resume(List.of(10));

        assertThat(result.isAllSucceeded()).isTrue();
        Door door = stateStore.door(10).orElseThrow();
        assertThat(door.getOverridden()).isFalse();
        assertThat(door.getOverride()).isNull();
    }

    @Test
    @DisplayName("Mode NONE and a missing type are rejected before any call")
    void invalidOverrideRejected() {
        assertThatThrownBy(() -> commandClient.override(List.of(10), OverrideType.TIMED, ReaderMode.NONE, 5, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> commandClient.override(List.of(10), null, ReaderMode.CARD, 5, null))
                .isInstanceOf(ValidationException.class);
        assertThat(panel.requests()).isEmpty();
    }

    @Test
    @DisplayName("Pulse posts one command per door")
    void pulsePerDoor() {
        CommandResult result = commandClient.pulse(List.of(10, 11));

        assertThat(result.getSucceededIds()).containsExactly(10L, 11L);
        assertThat(panel.requests("POST /api/PanelCommands/PulseDoor")).hasSize(2);
    }
}
