package com.panelbridge.unit.normalizer;

import static org.assertj.core.api.Assertions.assertThat;

import com.panelbridge.config.PanelConfig;
import com.panelbridge.dispatch.StateChangeDispatcher;
import com.panelbridge.domain.enums.DoorEventType;
import com.panelbridge.domain.enums.EventSource;
import com.panelbridge.domain.enums.LockState;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DiscoveryResult;
import com.panelbridge.domain.model.Door;
import com.panelbridge.domain.model.DoorDescriptor;
import com.panelbridge.domain.model.DoorEvent;
import com.panelbridge.domain.model.DoorStatus;
import com.panelbridge.domain.model.PanelNotification;
import com.panelbridge.domain.model.Partition;
import com.panelbridge.domain.model.Reader;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.normalizer.NormalizedFrame;
import com.panelbridge.normalizer.PanelEventNormalizer;
import com.panelbridge.normalizer.ReaderDoorIndex;
import com.panelbridge.state.EventSequencer;
import com.panelbridge.state.PanelStateStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PanelEventNormalizerTest {

    private static final Instant T0 = Instant.parse("2026-05-04T12:00:00Z");

    private static final String OVERVIEW = "{\"Status\":{\"Nodes\":[{\"Type\":\"Site\",\"Nodes\":["
            + "{\"Type\":\"Panel\",\"Nodes\":["
            + "{\"Type\":\"Door\",\"Id\":7,\"Name\":\"Lobby\",\"StatusId\":\"P1::3\"},"
            + "{\"Type\":\"Door\",\"Id\":99,\"Name\":\"Neighbour\",\"StatusId\":\"P1::9\"}]},"
            + "{\"Type\":\"Panel\",\"Nodes\":["
            + "{\"Type\":\"Door\",\"Id\":8,\"Name\":\"Dock\",\"StatusId\":\"P2::1\"}]}]}]}}";

    private MutableClock clock;
    private PanelEventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        normalizer = new PanelEventNormalizer(new EventSequencer(), new PanelConfig(), clock);
        normalizer.updateIndex(index(List.of(new Reader(71, 7, "Lobby Reader 1"))));
    }

    @Nested
    @DisplayName("Status")
    class Status {

        @Test
        @DisplayName("Routes by statusId and splits lock and override facts")
        void routesByStatusId() {
            DoorStatus status = DoorStatus.builder()
                    .statusId("P1::3")
                    .strike(true)
                    .overridden(true)
                    .readerMode(ReaderMode.UNLOCK)
                    .build();

            NormalizedFrame frame = normalizer.normalizeStatus(status, T0, EventSource.PUSH);

            assertThat(frame.getEvents()).extracting(DoorEvent::getType)
                    .containsExactly(DoorEventType.LOCK_STATE_CHANGED, DoorEventType.OVERRIDE_CHANGED);
            assertThat(frame.getEvents()).allSatisfy(event -> {
                assertThat(event.getDoorId()).isEqualTo(7);
                assertThat(event.getTimestamp()).isEqualTo(T0);
                assertThat(event.getSource()).isEqualTo(EventSource.PUSH);
            });
            assertThat(frame.getEvents().get(0).getLockState()).isEqualTo(LockState.UNLOCKED);
            assertThat(frame.getEvents().get(1).getSequence()).isGreaterThan(frame.getEvents().get(0).getSequence());
        }

        @Test
        @DisplayName("A neighbour's door on a subscribed panel is ignored quietly")
        void otherPartitionIgnored() {
            NormalizedFrame frame = normalizer.normalizeStatus(
                    DoorStatus.builder().statusId("P1::9").strike(true).build(), T0, EventSource.PUSH);

            assertThat(frame.getEvents()).isEmpty();
            assertThat(frame.isRefreshRequested()).isFalse();
        }

        @Test
        @DisplayName("An unknown panel means the routing tables are stale")
        void unknownPanelRequestsRefresh() {
            NormalizedFrame frame = normalizer.normalizeStatus(
                    DoorStatus.builder().statusId("P7::2").strike(true).build(), T0, EventSource.PUSH);

            assertThat(frame.getEvents()).isEmpty();
            assertThat(frame.isRefreshRequested()).isTrue();
        }

        @Test
        @DisplayName("Non-overridden reports become the door's baseline mode")
        void recordsBaseline() {
            normalizer.normalizeStatus(
                    DoorStatus.builder().doorId(8).overridden(false).readerMode(ReaderMode.CARD_AND_PIN).build(),
                    T0,
                    EventSource.SNAPSHOT);
            normalizer.normalizeStatus(
                    DoorStatus.builder().doorId(8).overridden(true).readerMode(ReaderMode.UNLOCK).build(),
                    T0,
                    EventSource.PUSH);

            assertThat(normalizer.baselineMode(8)).isEqualTo(ReaderMode.CARD_AND_PIN);
        }
    }

    @Nested
    @DisplayName("Notifications")
    class Notifications {

        @Test
        @DisplayName("Access lines route by reader id and name the actor")
        void accessGranted() {
            PanelNotification note = PanelNotification.builder()
                    .notificationType("Reader_Access_Granted")
                    .message("Jane Doe Granted Access at Lobby Reader 1")
                    .sourceType("Reader")
                    .sourceId(71)
                    .sourceName("Lobby Reader 1")
                    .build();

            NormalizedFrame frame = normalizer.normalizeNotification(note, T0);

            assertThat(frame.getEvents()).singleElement().satisfies(event -> {
                assertThat(event.getType()).isEqualTo(DoorEventType.ACCESS_GRANTED);
                assertThat(event.getDoorId()).isEqualTo(7);
                assertThat(event.getActor()).isEqualTo("Jane Doe granted access");
                assertThat(event.getTimestamp()).isEqualTo(T0);
            });
        }

        @Test
        @DisplayName("Override text synthesizes status with the named mode")
        void overrideTextSynthesizesStatus() {
            NormalizedFrame frame = normalizer.normalizeNotification(
                    doorNote(8, "Door_Override", "Dock has been overridden, current state is Card or Pin"), T0);

            assertThat(frame.getEvents()).singleElement().satisfies(event -> {
                assertThat(event.getType()).isEqualTo(DoorEventType.OVERRIDE_CHANGED);
                assertThat(event.getSource()).isEqualTo(EventSource.SYNTHESIZED);
                assertThat(event.getReaderMode()).isEqualTo(ReaderMode.CARD_OR_PIN);
                assertThat(event.getOverridden()).isTrue();
            });
        }

        @Test
        @DisplayName("Synthesis is suppressed while a real status is fresh")
        void synthesisGuard() {
            normalizer.normalizeStatus(DoorStatus.builder().doorId(8).strike(false).opener(false).build(), T0,
                    EventSource.PUSH);
            PanelNotification note = doorNote(8, "Door_Override", "Unlock until resume requested");

            clock.advance(Duration.ofMillis(500));
            assertThat(normalizer.normalizeNotification(note, clock.instant()).getEvents()).isEmpty();

            clock.advance(Duration.ofSeconds(2));
            assertThat(normalizer.normalizeNotification(note, clock.instant()).getEvents())
                    .extracting(DoorEvent::getType)
                    .containsExactly(DoorEventType.LOCK_STATE_CHANGED, DoorEventType.OVERRIDE_CHANGED);
        }

        @Test
        @DisplayName("Resume text restores the baseline mode, else card")
        void resumeRestoresBaseline() {
            normalizer.normalizeStatus(
                    DoorStatus.builder().doorId(8).overridden(false).readerMode(ReaderMode.PIN).build(),
                    T0,
                    EventSource.SNAPSHOT);
            clock.advance(Duration.ofSeconds(10));

            List<DoorEvent> dock = normalizer
                    .normalizeNotification(doorNote(8, "Door_Schedule", "Dock schedule resumed"), clock.instant())
                    .getEvents();
            List<DoorEvent> lobby = normalizer
                    .normalizeNotification(doorNote(7, "Door_Schedule", "Lobby schedule resumed"), clock.instant())
                    .getEvents();

            assertThat(dock).singleElement().satisfies(event -> {
                assertThat(event.getType()).isEqualTo(DoorEventType.SCHEDULE_FLIPPED);
                assertThat(event.getReaderMode()).isEqualTo(ReaderMode.PIN);
            });
            assertThat(lobby).singleElement()
                    .satisfies(event -> assertThat(event.getReaderMode()).isEqualTo(ReaderMode.CARD));
        }

        @Test
        @DisplayName("Lock-state lines update the door message and the lock, never the actor")
        void lockLine() {
            List<DoorEvent> events = normalizer
                    .normalizeNotification(doorNote(7, "Door_Lock_State", "Front door unlocked"), T0)
                    .getEvents();

            assertThat(events).extracting(DoorEvent::getType)
                    .containsExactly(DoorEventType.DOOR_MESSAGE, DoorEventType.LOCK_STATE_CHANGED);
            assertThat(events).allSatisfy(event -> assertThat(event.getActor()).isNull());
            assertThat(events.get(0).getDoorMessage()).isEqualTo("Front door unlocked");
            assertThat(events.get(1).getLockState()).isEqualTo(LockState.UNLOCKED);
        }

        @Test
        @DisplayName("Receive time drives reconciliation, panel time is kept for display")
        void panelTimeKeptSeparately() {
            Instant panelTime = T0.minusSeconds(3);
            PanelNotification note = PanelNotification.builder()
                    .notificationType("ACTIONPLAN_MESSAGE")
                    .message("Night lock locked Lobby")
                    .sourceType("Door")
                    .sourceId(7)
                    .date(panelTime)
                    .build();

            assertThat(normalizer.normalizeNotification(note, T0).getEvents()).singleElement().satisfies(event -> {
                assertThat(event.getType()).isEqualTo(DoorEventType.ACTION_PLAN_EXECUTED);
                assertThat(event.getTimestamp()).isEqualTo(T0);
                assertThat(event.getPanelTime()).isEqualTo(panelTime);
                assertThat(event.getActor()).isEqualTo("Night lock locked");
            });
        }

        @Test
        @DisplayName("A panel clock running behind does not make a later override look stale")
        void laggingPanelClock() {
            PanelStateStore store = new PanelStateStore(new StateChangeDispatcher(Runnable::run));
            store.loadDiscovery(DiscoveryResult.builder()
                    .partition(new Partition(2, "Main"))
                    .door(DoorDescriptor.builder().id(7).name("Lobby").partitionId(2).statusId("P1::3").build())
                    .build());

            DoorStatus locked = DoorStatus.builder()
                    .statusId("P1::3")
                    .strike(false)
                    .opener(false)
                    .overridden(false)
                    .readerMode(ReaderMode.CARD)
                    .build();
            normalizer.normalizeStatus(locked, clock.instant(), EventSource.PUSH).getEvents().forEach(store::apply);

            clock.advance(Duration.ofSeconds(10));
            PanelNotification note = PanelNotification.builder()
                    .notificationType("Door_Override")
                    .message("Lobby has been overridden. Current state is Unlock")
                    .sourceType("Door")
                    .sourceId(7)
                    .date(clock.instant().minusSeconds(30))
                    .build();
            normalizer.normalizeNotification(note, clock.instant()).getEvents().forEach(store::apply);

            Door door = store.door(7).orElseThrow();
            assertThat(door.getOverridden()).isTrue();
            assertThat(door.getReaderMode()).isEqualTo(ReaderMode.UNLOCK);
            assertThat(door.getLockState()).isEqualTo(LockState.UNLOCKED);
        }

        @Test
        @DisplayName("Unroutable action-plan lines are dropped without asking for a refresh")
        void unroutableActionPlan() {
            PanelNotification note = PanelNotification.builder()
                    .notificationType("ACTIONPLAN_STATE")
                    .message("Plan finished")
                    .build();

            NormalizedFrame frame = normalizer.normalizeNotification(note, T0);

            assertThat(frame.getEvents()).isEmpty();
            assertThat(frame.isRefreshRequested()).isFalse();
        }
    }

    @Nested
    @DisplayName("Unresolved readers")
    class UnresolvedReaders {

        @Test
        @DisplayName("Are buffered, then resolved once after the tables are rebuilt")
        void retriedAfterRebuild() {
            NormalizedFrame frame = normalizer.normalizeNotification(readerNote(72, "Annex Reader"), T0);
            normalizer.normalizeNotification(readerNote(73, "Ghost Reader"), T0);

            assertThat(frame.isRefreshRequested()).isTrue();
            assertThat(normalizer.pendingCount()).isEqualTo(2);

            normalizer.updateIndex(index(List.of(new Reader(71, 7, "Lobby Reader 1"), new Reader(72, 8, "Annex Reader"))));
            List<DoorEvent> retried = normalizer.retryPending();

            assertThat(retried).singleElement().satisfies(event -> {
                assertThat(event.getDoorId()).isEqualTo(8);
                assertThat(event.getType()).isEqualTo(DoorEventType.ACCESS_DENIED);
            });
            assertThat(normalizer.pendingCount()).isZero();
            assertThat(normalizer.retryPending()).isEmpty();
        }
    }

    // ---- Helpers ----

    private static ReaderDoorIndex index(List<Reader> readers) {
        return ReaderDoorIndex.build(JsonHelper.readTree(OVERVIEW), Map.of(7, "Lobby", 8, "Dock"), readers);
    }

    private static PanelNotification doorNote(int doorId, String type, String message) {
        return PanelNotification.builder()
                .notificationType(type)
                .message(message)
                .sourceType("Door")
                .sourceId(doorId)
                .build();
    }

    private static PanelNotification readerNote(int readerId, String readerName) {
        return PanelNotification.builder()
                .notificationType("Reader_Access_Denied")
                .message("Unknown card Denied Access")
                .sourceType("Reader")
                .sourceId(readerId)
                .sourceName(readerName)
                .build();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
