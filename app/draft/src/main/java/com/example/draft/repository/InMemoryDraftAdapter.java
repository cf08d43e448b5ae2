/*
 * どこで: Draft 永続化境界 (オフライン/テスト用)
 * 何を: ルームと指名履歴をプロセス内に保持し、変更を同期的に通知する
 * なぜ: 外部ストアなしでドラフトを最初から最後まで進められるようにするため
 */
package com.example.draft.repository;

import com.example.draft.model.DraftPick;
import com.example.draft.model.DraftPlayer;
import com.example.draft.model.DraftRoom;
import com.example.draft.model.DraftStatus;
import com.example.draft.service.DraftRoomFactory;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * draft.offline-room-ids に含まれる roomId は初回参照時に既定のオフラインルームとして作成する。
 * それ以外の未知の roomId は存在しないものとして扱う。
 */
@Repository
@ConditionalOnProperty(name = "draft.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryDraftAdapter implements DraftAdapter {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryDraftAdapter.class);

  private final DraftRoomFactory roomFactory;
  private final PlayerCatalog catalog;
  private final Clock clock;
  private final Map<String, RoomState> rooms = new ConcurrentHashMap<>();

  public InMemoryDraftAdapter(DraftRoomFactory roomFactory, PlayerCatalog catalog, Clock clock) {
    this.roomFactory = roomFactory;
    this.catalog = catalog;
    this.clock = clock;
  }

  @Override
  public Optional<DraftRoom> getRoom(String roomId) {
    return find(roomId)
        .map(
            state -> {
              synchronized (state) {
                return state.room;
              }
            });
  }

  @Override
  public Subscription subscribeToRoom(String roomId, Consumer<DraftRoom> onChange) {
    final RoomState state = state(roomId);
    state.roomListeners.add(onChange);
    return () -> state.roomListeners.remove(onChange);
  }

  @Override
  public Subscription subscribeToPicks(String roomId, Consumer<List<DraftPick>> onChange) {
    final RoomState state = state(roomId);
    state.pickListeners.add(onChange);
    return () -> state.pickListeners.remove(onChange);
  }

  @Override
  public List<DraftPick> getPicks(String roomId) {
    final Optional<RoomState> found = find(roomId);
    if (found.isEmpty()) {
      return List.of();
    }
    final RoomState state = found.get();
    synchronized (state) {
      return List.copyOf(state.picks);
    }
  }

  @Override
  public DraftPick addPick(String roomId, DraftPick pick) {
    final RoomState state = state(roomId);
    final List<DraftPick> snapshot;
    synchronized (state) {
      final int expected = state.picks.size() + 1;
      if (pick.pickNumber() != expected) {
        throw new PickConflictException(
            roomId,
            pick.pickNumber(),
            "pick number " + pick.pickNumber() + " is not next (expected " + expected + ")");
      }
      if (state.picked.contains(pick.playerId())) {
        throw new PickConflictException(
            roomId, pick.pickNumber(), "player already drafted: " + pick.playerId());
      }
      state.picks.add(pick);
      state.picked.add(pick.playerId());
      snapshot = List.copyOf(state.picks);
    }
    for (Consumer<List<DraftPick>> listener : state.pickListeners) {
      listener.accept(snapshot);
    }
    return pick;
  }

  @Override
  public List<DraftPlayer> getAvailablePlayers(String roomId) {
    final Optional<RoomState> found = find(roomId);
    if (found.isEmpty()) {
      return List.of();
    }
    final RoomState state = found.get();
    synchronized (state) {
      return state.catalog.stream().filter(p -> !state.picked.contains(p.id())).toList();
    }
  }

  @Override
  public DraftRoom updateRoomStatus(String roomId, DraftStatus status) {
    final RoomState state = state(roomId);
    final DraftRoom updated;
    synchronized (state) {
      state.room = state.room.withStatus(status, clock.instant());
      updated = state.room;
    }
    for (Consumer<DraftRoom> listener : state.roomListeners) {
      listener.accept(updated);
    }
    return updated;
  }

  @Override
  public DraftRoom createRoom(DraftRoom room, List<DraftPlayer> catalog) {
    final RoomState created = new RoomState(room, catalog);
    if (rooms.putIfAbsent(room.roomId(), created) != null) {
      throw new IllegalStateException("draft room already exists: " + room.roomId());
    }
    return room;
  }

  private RoomState state(String roomId) {
    return find(roomId)
        .orElseThrow(() -> new IllegalArgumentException("draft room not found: " + roomId));
  }

  private Optional<RoomState> find(String roomId) {
    final RoomState existing = rooms.get(roomId);
    if (existing != null || !roomFactory.isOfflineRoomId(roomId)) {
      return Optional.ofNullable(existing);
    }
    return Optional.of(
        rooms.computeIfAbsent(
            roomId,
            id -> {
              logger.info("seeding offline draft room roomId={}", id);
              return new RoomState(roomFactory.offlineRoom(id), catalog.players());
            }));
  }

  private static final class RoomState {
    private DraftRoom room;
    private final List<DraftPlayer> catalog;
    private final List<DraftPick> picks = new ArrayList<>();
    private final Set<String> picked = new HashSet<>();
    private final List<Consumer<DraftRoom>> roomListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<List<DraftPick>>> pickListeners = new CopyOnWriteArrayList<>();

    private RoomState(DraftRoom room, List<DraftPlayer> catalog) {
      this.room = room;
      this.catalog = List.copyOf(catalog);
    }
  }
}
