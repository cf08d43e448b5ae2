/*
 * どこで: Draft サービス層
 * 何を: ルーム作成/エンジンの起動と保持/指名 API の入口を提供する
 * なぜ: HTTP スレッドと制御スレッドの境界で待ち合わせとエラー変換を一箇所に集めるため
 */
package com.example.draft.service;

import com.example.draft.api.DraftRoomNotFoundException;
import com.example.draft.api.InvalidDraftRequestException;
import com.example.draft.api.ParticipantAccessDeniedException;
import com.example.draft.api.PickRejectedException;
import com.example.draft.api.request.CreateDraftRequest;
import com.example.draft.api.response.BoardResponse;
import com.example.draft.api.response.DraftRoomResponse;
import com.example.draft.api.response.DraftStateResponse;
import com.example.draft.api.response.PickResponse;
import com.example.draft.api.response.PlayerResponse;
import com.example.draft.api.response.RosterResponse;
import com.example.draft.engine.DraftEngine;
import com.example.draft.engine.PickResult;
import com.example.draft.model.DraftRoom;
import com.example.draft.model.DraftSnapshot;
import com.example.draft.model.DraftStatus;
import com.example.draft.model.Participant;
import com.example.draft.model.Roster;
import com.example.draft.repository.DraftAdapter;
import com.example.draft.repository.PlayerCatalog;
import com.google.common.util.concurrent.UncheckedTimeoutException;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DraftRoomService {

  private static final Logger logger = LoggerFactory.getLogger(DraftRoomService.class);

  static final Duration ENGINE_TIMEOUT = Duration.ofSeconds(5);

  private final DraftAdapter adapter;
  private final DraftEngineFactory engineFactory;
  private final DraftRoomFactory roomFactory;
  private final PlayerCatalog catalog;
  private final DraftMetrics metrics;
  private final Map<String, DraftEngine> engines = new ConcurrentHashMap<>();

  public DraftRoomService(
      DraftAdapter adapter,
      DraftEngineFactory engineFactory,
      DraftRoomFactory roomFactory,
      PlayerCatalog catalog,
      DraftMetrics metrics) {
    this.adapter = adapter;
    this.engineFactory = engineFactory;
    this.roomFactory = roomFactory;
    this.catalog = catalog;
    this.metrics = metrics;
  }

  /** 作成者を index 0 とし、続けて participant_user_ids の順に並べる。空き枠は CPU。 */
  public DraftRoomResponse createRoom(String userId, CreateDraftRequest request) {
    requireUserId(userId);
    if (request == null || request.name() == null || request.name().isBlank()) {
      throw new InvalidDraftRequestException("name is required");
    }
    final Set<String> humans = new LinkedHashSet<>();
    humans.add(userId);
    if (request.participantUserIds() != null) {
      for (String id : request.participantUserIds()) {
        if (id == null || id.isBlank()) {
          throw new InvalidDraftRequestException("participant_user_ids must not contain blanks");
        }
        humans.add(id);
      }
    }
    final DraftRoom room;
    try {
      room =
          roomFactory.newRoom(
              UUID.randomUUID().toString(), request.name(), new ArrayList<>(humans));
    } catch (IllegalArgumentException ex) {
      throw new InvalidDraftRequestException(ex.getMessage());
    }
    final DraftRoom created = adapter.createRoom(room, catalog.players());
    logger.info(
        "draft room created roomId={} humans={} by={}", created.roomId(), humans.size(), userId);
    return DraftResponses.room(created);
  }

  public DraftRoomResponse getRoom(String roomId, String userId) {
    requireUserId(userId);
    return DraftResponses.room(requireRoom(roomId));
  }

  public DraftStateResponse getState(String roomId, String userId) {
    requireUserId(userId);
    final DraftEngine engine = openEngine(roomId);
    return stateFor(engine, userId);
  }

  public DraftStateResponse start(String roomId, String userId) {
    final DraftEngine engine = openEngineForParticipant(roomId, userId);
    await(engine.start());
    return stateFor(engine, userId);
  }

  public DraftStateResponse pause(String roomId, String userId) {
    final DraftEngine engine = openEngineForParticipant(roomId, userId);
    await(engine.pause());
    return stateFor(engine, userId);
  }

  public DraftStateResponse resume(String roomId, String userId) {
    final DraftEngine engine = openEngineForParticipant(roomId, userId);
    await(engine.resume());
    return stateFor(engine, userId);
  }

  /**
   * 役割: 呼び出しユーザーの手動指名をエンジンへ渡す。
   * 動作: 拒否された場合は PickRejectedException (エラーコード付き) を送出する。
   * 前提: userId がルームの参加者であること。
   */
  public PickResponse makePick(String roomId, String userId, String playerId) {
    if (playerId == null || playerId.isBlank()) {
      throw new InvalidDraftRequestException("player_id is required");
    }
    final DraftEngine engine = openEngineForParticipant(roomId, userId);
    final Participant participant = requireParticipant(engine, userId);
    final PickResult result = await(engine.makePick(participant.index(), playerId));
    if (!result.accepted()) {
      throw new PickRejectedException(result.errorCode(), result.errorMessage());
    }
    return DraftResponses.pick(result.pick(), engine.room().orElseThrow().teamCount());
  }

  /** queue 先頭の選手を指名する。拒否理由は makePick と同じく PickRejectedException で返す。 */
  public PickResponse draftFromQueue(String roomId, String userId) {
    final DraftEngine engine = openEngineForParticipant(roomId, userId);
    final Participant participant = requireParticipant(engine, userId);
    final PickResult result = await(engine.draftFromQueue(participant.index()));
    if (!result.accepted()) {
      throw new PickRejectedException(result.errorCode(), result.errorMessage());
    }
    return DraftResponses.pick(result.pick(), engine.room().orElseThrow().teamCount());
  }

  public RosterResponse getRoster(String roomId, String userId, int participantIndex) {
    requireUserId(userId);
    final DraftRoom room = requireRoom(roomId);
    final Participant participant =
        room.participant(participantIndex)
            .orElseThrow(
                () ->
                    new InvalidDraftRequestException(
                        "participant index out of range: " + participantIndex));
    final Roster roster = Roster.of(adapter.getPicks(roomId), participantIndex);
    return DraftResponses.roster(participant, roster, room.teamCount());
  }

  public BoardResponse getBoard(String roomId, String userId) {
    requireUserId(userId);
    final DraftRoom room = requireRoom(roomId);
    return DraftResponses.board(room, adapter.getPicks(roomId));
  }

  public List<PickResponse> getPicks(String roomId, String userId) {
    requireUserId(userId);
    final DraftRoom room = requireRoom(roomId);
    return adapter.getPicks(roomId).stream()
        .map(pick -> DraftResponses.pick(pick, room.teamCount()))
        .toList();
  }

  public List<PlayerResponse> getAvailablePlayers(String roomId, String userId) {
    requireUserId(userId);
    requireRoom(roomId);
    return adapter.getAvailablePlayers(roomId).stream().map(DraftResponses::player).toList();
  }

  public List<String> openRoomIds() {
    return List.copyOf(engines.keySet());
  }

  /**
   * 役割: 開いているエンジンを保存層から読み直す (再同期ワーカー用)。
   * 動作: 完了済みになったルームはエンジンを閉じて解放する。未オープンなら empty。
   */
  public Optional<DraftSnapshot> resync(String roomId) {
    final DraftEngine engine = engines.get(roomId);
    if (engine == null) {
      return Optional.empty();
    }
    final DraftSnapshot snapshot = await(engine.resync());
    if (snapshot.status() == DraftStatus.COMPLETED) {
      evict(roomId);
    }
    return Optional.of(snapshot);
  }

  /** 完了済みルームのエンジンを閉じて解放する。 */
  public void evict(String roomId) {
    final DraftEngine engine = engines.remove(roomId);
    if (engine != null) {
      await(engine.close());
      metrics.updateOpenRooms(engines.size());
      logger.info("draft engine evicted roomId={}", roomId);
    }
  }

  @PreDestroy
  public void shutdown() {
    for (String roomId : List.copyOf(engines.keySet())) {
      try {
        evict(roomId);
      } catch (RuntimeException ex) {
        logger.warn("failed to close draft engine roomId={}", roomId, ex);
      }
    }
  }

  DraftEngine openEngine(String roomId) {
    requireRoom(roomId);
    final DraftEngine engine = engines.computeIfAbsent(roomId, engineFactory::create);
    await(engine.open());
    metrics.updateOpenRooms(engines.size());
    return engine;
  }

  private DraftEngine openEngineForParticipant(String roomId, String userId) {
    requireUserId(userId);
    final DraftEngine engine = openEngine(roomId);
    requireParticipant(engine, userId);
    return engine;
  }

  private DraftStateResponse stateFor(DraftEngine engine, String userId) {
    final DraftRoom room = engine.room().orElseThrow();
    final int yourIndex =
        room.participantForUser(userId)
            .map(Participant::index)
            .orElse(DraftEngine.NO_LOCAL_PARTICIPANT);
    final DraftSnapshot snapshot = engine.snapshot(yourIndex);
    return DraftResponses.state(room, snapshot, yourIndex);
  }

  private Participant requireParticipant(DraftEngine engine, String userId) {
    final DraftRoom room = engine.room().orElseThrow();
    return room.participantForUser(userId)
        .orElseThrow(() -> new ParticipantAccessDeniedException(room.roomId()));
  }

  private DraftRoom requireRoom(String roomId) {
    if (roomId == null || roomId.isBlank()) {
      throw new InvalidDraftRequestException("roomId is required");
    }
    return adapter.getRoom(roomId).orElseThrow(() -> new DraftRoomNotFoundException(roomId));
  }

  private void requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new InvalidDraftRequestException("userId is required");
    }
  }

  private <T> T await(CompletableFuture<T> future) {
    try {
      return future.orTimeout(ENGINE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS).join();
    } catch (CompletionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof TimeoutException) {
        throw new UncheckedTimeoutException("draft engine did not respond in time", cause);
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw ex;
    }
  }
}
