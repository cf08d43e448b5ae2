package com.example.draft.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.draft.DraftFixtures;
import com.example.draft.api.DraftRoomNotFoundException;
import com.example.draft.api.InvalidDraftRequestException;
import com.example.draft.api.ParticipantAccessDeniedException;
import com.example.draft.api.PickRejectedException;
import com.example.draft.api.request.CreateDraftRequest;
import com.example.draft.api.response.BoardResponse;
import com.example.draft.api.response.BoardRoundPayload;
import com.example.draft.api.response.DraftRoomResponse;
import com.example.draft.api.response.DraftStateResponse;
import com.example.draft.api.response.PickResponse;
import com.example.draft.api.response.RosterResponse;
import com.example.draft.engine.DraftErrorCode;
import com.example.draft.engine.ManualEngineScheduler;
import com.example.draft.model.DraftSnapshot;
import com.example.draft.model.DraftStatus;
import com.example.draft.repository.DraftAdapter;
import com.example.draft.repository.InMemoryAutodraftConfigRepository;
import com.example.draft.repository.InMemoryDraftAdapter;
import com.example.draft.repository.InMemoryQueueStore;
import com.example.draft.repository.PlayerCatalog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class DraftRoomServiceTest {

  private static final String YOU = DraftRoomFactory.OFFLINE_USER_ID;

  private final ManualEngineScheduler scheduler = ManualEngineScheduler.trampolining();
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final DraftMetrics metrics = new DraftMetrics(registry);
  private final DraftRoomFactory roomFactory = new DraftRoomFactory(DraftFixtures.properties());
  private final PlayerCatalog catalog = new PlayerCatalog(DraftFixtures.catalog(240));
  private final InMemoryDraftAdapter adapter =
      new InMemoryDraftAdapter(roomFactory, catalog, DraftFixtures.CLOCK);
  private final InMemoryQueueStore queues = new InMemoryQueueStore();
  private final DraftEngineFactory engineFactory =
      new DraftEngineFactory(
          adapter,
          new InMemoryAutodraftConfigRepository(),
          queues,
          scheduler,
          Mockito.mock(DraftEventPublisher.class),
          metrics,
          DraftFixtures.CLOCK);
  private final DraftRoomService service =
      new DraftRoomService(adapter, engineFactory, roomFactory, catalog, metrics);

  @Test
  void createRoomPlacesCreatorFirstAndFillsBots() {
    final DraftRoomResponse room =
        service.createRoom("alice", new CreateDraftRequest("League", List.of("bob", "alice")));

    assertThat(room.roomId()).isNotBlank();
    assertThat(room.status()).isEqualTo("pending");
    assertThat(room.participants()).hasSize(12);
    assertThat(room.participants().get(0).id()).isEqualTo("alice");
    assertThat(room.participants().get(1).id()).isEqualTo("bob");
    assertThat(room.participants().get(2).bot()).isTrue();
    assertThat(service.getRoom(room.roomId(), "bob").name()).isEqualTo("League");
  }

  @Test
  void createRoomValidatesRequest() {
    assertThatThrownBy(() -> service.createRoom("alice", new CreateDraftRequest(" ", null)))
        .isInstanceOf(InvalidDraftRequestException.class);
    assertThatThrownBy(
            () ->
                service.createRoom(
                    "alice", new CreateDraftRequest("League", Arrays.asList("bob", null))))
        .isInstanceOf(InvalidDraftRequestException.class);
    final List<String> tooMany =
        IntStream.range(0, 12).mapToObj(i -> "user-" + i).toList();
    assertThatThrownBy(
            () -> service.createRoom("alice", new CreateDraftRequest("League", tooMany)))
        .isInstanceOf(InvalidDraftRequestException.class)
        .hasMessageContaining("too many participants");
  }

  @Test
  void startAndPickThroughService() {
    final DraftStateResponse started = service.start("room-1", YOU);

    assertThat(started.status()).isEqualTo("active");
    assertThat(started.currentPickLabel()).isEqualTo("1.01");
    assertThat(started.yourParticipantIndex()).isZero();
    assertThat(started.yourTurn()).isTrue();
    assertThat(started.picksUntilYourTurn()).isZero();
    assertThat(started.timer().display()).isEqualTo("0:30");
    assertThat(started.timer().urgency()).isEqualTo("NORMAL");

    final PickResponse pick = service.makePick("room-1", YOU, "p-002");

    assertThat(pick.label()).isEqualTo("1.01");
    assertThat(pick.playerId()).isEqualTo("p-002");
    assertThat(pick.autopick()).isFalse();
    final DraftStateResponse state = service.getState("room-1", YOU);
    assertThat(state.currentPickNumber()).isEqualTo(24);
    assertThat(state.currentPickLabel()).isEqualTo("2.12");
    assertThat(service.getPicks("room-1", YOU)).hasSize(23);
    assertThat(service.getAvailablePlayers("room-1", YOU)).hasSize(240 - 23);
    assertThat(service.openRoomIds()).containsExactly("room-1");
    assertThat(registry.get("draft.rooms.open").gauge().value()).isEqualTo(1.0);
  }

  @Test
  void draftFromQueueThroughService() {
    service.start("room-1", YOU);

    assertThatThrownBy(() -> service.draftFromQueue("room-1", YOU))
        .isInstanceOf(PickRejectedException.class)
        .satisfies(
            ex ->
                assertThat(((PickRejectedException) ex).errorCode())
                    .isEqualTo(DraftErrorCode.QUEUE_EMPTY));

    queues.save(YOU, List.of("p-040"));
    final PickResponse pick = service.draftFromQueue("room-1", YOU);

    assertThat(pick.label()).isEqualTo("1.01");
    assertThat(pick.playerId()).isEqualTo("p-040");
    assertThat(pick.autopick()).isFalse();
    assertThatThrownBy(() -> service.draftFromQueue("room-1", "intruder"))
        .isInstanceOf(ParticipantAccessDeniedException.class);
  }

  @Test
  void rosterAndBoardAreDerivedFromPicks() {
    service.start("room-1", YOU);
    service.makePick("room-1", YOU, "p-005");

    final RosterResponse roster = service.getRoster("room-1", YOU, 0);

    assertThat(roster.participantId()).isEqualTo(YOU);
    assertThat(roster.picks()).extracting(PickResponse::playerId).containsExactly("p-005");
    assertThat(roster.positionCounts()).containsEntry("QB", 1);
    assertThat(service.getRoster("room-1", YOU, 11).picks()).hasSize(2);

    final BoardResponse board = service.getBoard("room-1", YOU);

    assertThat(board.rounds()).hasSize(18);
    final BoardRoundPayload second = board.rounds().get(1);
    assertThat(second.round()).isEqualTo(2);
    assertThat(second.slots().get(0).label()).isEqualTo("2.01");
    assertThat(second.slots().get(0).participantIndex()).isEqualTo(11);
    assertThat(second.slots().get(0).pick()).isNotNull();
    assertThat(second.slots().get(11).pickNumber()).isEqualTo(24);
    assertThat(second.slots().get(11).participantIndex()).isZero();
    assertThat(second.slots().get(11).pick()).isNull();
    assertThat(board.rounds().get(0).slots().get(0).pick().playerId()).isEqualTo("p-005");
  }

  @Test
  void rosterRejectsOutOfRangeIndex() {
    assertThatThrownBy(() -> service.getRoster("room-1", YOU, 12))
        .isInstanceOf(InvalidDraftRequestException.class)
        .hasMessageContaining("out of range");
  }

  @Test
  void spectatorStateHasNoTurn() {
    service.start("room-1", YOU);

    final DraftStateResponse state = service.getState("room-1", "someone-else");

    assertThat(state.yourParticipantIndex()).isEqualTo(-1);
    assertThat(state.yourTurn()).isFalse();
    assertThat(state.picksUntilYourTurn()).isEqualTo(-1);
  }

  @Test
  void rejectedPickCarriesErrorCode() {
    service.start("room-1", YOU);
    service.makePick("room-1", YOU, "p-002");

    assertThatThrownBy(() -> service.makePick("room-1", YOU, "p-002"))
        .isInstanceOf(PickRejectedException.class)
        .satisfies(
            ex ->
                assertThat(((PickRejectedException) ex).errorCode())
                    .isEqualTo(DraftErrorCode.PLAYER_UNAVAILABLE));
  }

  @Test
  void nonParticipantCannotPickOrControlDraft() {
    assertThatThrownBy(() -> service.start("room-1", "intruder"))
        .isInstanceOf(ParticipantAccessDeniedException.class);
    assertThatThrownBy(() -> service.makePick("room-1", "intruder", "p-001"))
        .isInstanceOf(ParticipantAccessDeniedException.class);
  }

  @Test
  void invalidTransitionSurfacesAsIllegalState() {
    service.start("room-1", YOU);

    assertThatThrownBy(() -> service.start("room-1", YOU))
        .isInstanceOf(IllegalStateException.class);
    assertThat(service.pause("room-1", YOU).status()).isEqualTo("paused");
    assertThat(service.resume("room-1", YOU).status()).isEqualTo("active");
  }

  @Test
  void missingRoomIsNotFoundWhenCreatedRoomsAreRequired() {
    final DraftAdapter emptyAdapter = Mockito.mock(DraftAdapter.class);
    Mockito.when(emptyAdapter.getRoom("missing")).thenReturn(Optional.empty());
    final DraftRoomService strict =
        new DraftRoomService(emptyAdapter, engineFactory, roomFactory, catalog, metrics);

    assertThatThrownBy(() -> strict.getRoom("missing", YOU))
        .isInstanceOf(DraftRoomNotFoundException.class);
    assertThatThrownBy(() -> strict.getState("missing", YOU))
        .isInstanceOf(DraftRoomNotFoundException.class);
  }

  @Test
  void unknownRoomIdsDoNotOpenEngines() {
    for (int i = 0; i < 500; i++) {
      final String roomId = UUID.randomUUID().toString();
      assertThatThrownBy(() -> service.getState(roomId, YOU))
          .isInstanceOf(DraftRoomNotFoundException.class);
    }

    assertThat(service.openRoomIds()).isEmpty();
    assertThat(adapter.getRoom(UUID.randomUUID().toString())).isEmpty();
  }

  @Test
  void creatorCannotInviteBotIds() {
    assertThatThrownBy(
            () -> service.createRoom("alice", new CreateDraftRequest("League", List.of("cpu-3"))))
        .isInstanceOf(InvalidDraftRequestException.class)
        .hasMessageContaining("cpu-");
  }

  @Test
  void blankUserIdIsBadRequest() {
    assertThatThrownBy(() -> service.getState("room-1", " "))
        .isInstanceOf(InvalidDraftRequestException.class);
    assertThatThrownBy(() -> service.makePick("room-1", YOU, ""))
        .isInstanceOf(InvalidDraftRequestException.class);
  }

  @Test
  void resyncEvictsCompletedRooms() {
    final DraftRoomResponse room =
        service.createRoom("alice", new CreateDraftRequest("Solo", List.of()));
    service.getState(room.roomId(), "alice");
    adapter.updateRoomStatus(room.roomId(), DraftStatus.COMPLETED);

    assertThat(service.resync(room.roomId()))
        .map(DraftSnapshot::status)
        .contains(DraftStatus.COMPLETED);
    assertThat(service.openRoomIds()).doesNotContain(room.roomId());
    assertThat(service.resync(room.roomId())).isEmpty();
  }

  @Test
  void shutdownClosesAllEngines() {
    service.getState("room-1", YOU);
    service.getState("room-2", YOU);

    service.shutdown();

    assertThat(service.openRoomIds()).isEmpty();
    assertThat(registry.get("draft.rooms.open").gauge().value()).isZero();
  }
}
