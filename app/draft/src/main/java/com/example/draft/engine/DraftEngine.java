/*
 * どこで: Draft エンジン
 * 何を: 1 ルーム分の手番進行/タイマー/自動指名/指名書き込みを制御スレッド上で調停する
 * なぜ: 指名履歴を唯一の情報源とし、同一指名番号への二重書き込みを防ぐため
 */
package com.example.draft.engine;

import com.example.draft.model.AutodraftConfig;
import com.example.draft.model.DraftPick;
import com.example.draft.model.DraftPlayer;
import com.example.draft.model.DraftRoom;
import com.example.draft.model.DraftSnapshot;
import com.example.draft.model.DraftStatus;
import com.example.draft.model.Participant;
import com.example.draft.model.Position;
import com.example.draft.model.Roster;
import com.example.draft.repository.AutodraftConfigRepository;
import com.example.draft.repository.DraftAdapter;
import com.example.draft.repository.PickConflictException;
import com.example.draft.repository.QueueStore;
import com.example.draft.repository.Subscription;
import com.example.draft.service.DraftEventPublisher;
import com.example.draft.service.DraftMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 1 ルームのドラフト進行を司るオーケストレータ。
 *
 * <p>状態を変更する処理はすべて {@link EngineScheduler} の制御スレッドで直列実行され、公開メソッドは
 * {@link CompletableFuture} を返す。Adapter からの変更通知も制御スレッドへ積み直してから反映するため、
 * エンジン内部はロックを持たない。
 *
 * <p>書き込みは {@link DraftAdapter#addPick} が確定させたものだけを正とし、反映は常に
 * {@link DraftAdapter#getPicks} の再取得で行う。保存層が競合で拒否した場合、手動指名には
 * {@link DraftErrorCode#PICK_CONFLICT} を返し、自動指名は黙って破棄する。
 */
public class DraftEngine {

  private static final Logger logger = LoggerFactory.getLogger(DraftEngine.class);

  public static final int NO_LOCAL_PARTICIPANT = -1;

  private final String roomId;
  private final DraftAdapter adapter;
  private final AutodraftConfigRepository configRepository;
  private final QueueStore queueStore;
  private final EngineScheduler scheduler;
  private final DraftEventPublisher eventPublisher;
  private final DraftMetrics metrics;
  private final Clock clock;
  private final List<Consumer<DraftSnapshot>> listeners = new CopyOnWriteArrayList<>();

  // 書き込みは制御スレッドのみ。
  private volatile DraftRoom room;
  private volatile List<DraftPick> picks = List.of();
  private volatile CountdownTimer timer;
  private volatile boolean open;

  private Subscription roomSubscription;
  private Subscription picksSubscription;
  private int timedPickNumber;
  private Instant turnStartedAt;
  private boolean completionHandled;

  public DraftEngine(
      String roomId,
      DraftAdapter adapter,
      AutodraftConfigRepository configRepository,
      QueueStore queueStore,
      EngineScheduler scheduler,
      DraftEventPublisher eventPublisher,
      DraftMetrics metrics,
      Clock clock) {
    this.roomId = roomId;
    this.adapter = adapter;
    this.configRepository = configRepository;
    this.queueStore = queueStore;
    this.scheduler = scheduler;
    this.eventPublisher = eventPublisher;
    this.metrics = metrics;
    this.clock = clock;
  }

  public String roomId() {
    return roomId;
  }

  public boolean isOpen() {
    return open;
  }

  /**
   * 役割: ルームと指名履歴を読み込み、変更通知を購読する。
   * 動作: ルームが ACTIVE なら現在の指名番号の手番を開始する。既に開いていれば何もしない。
   * 前提: ルームが存在しない場合 future は IllegalArgumentException で失敗する。
   */
  public CompletableFuture<DraftSnapshot> open() {
    return submit(
        () -> {
          if (open) {
            return snapshot(NO_LOCAL_PARTICIPANT);
          }
          final DraftRoom loaded =
              adapter
                  .getRoom(roomId)
                  .orElseThrow(
                      () -> new IllegalArgumentException("draft room not found: " + roomId));
          room = loaded;
          timer =
              new CountdownTimer(
                  scheduler,
                  loaded.pickTimeSeconds(),
                  loaded.gracePeriodSeconds(),
                  new EngineTimerListener());
          picks = List.copyOf(adapter.getPicks(roomId));
          roomSubscription =
              adapter.subscribeToRoom(
                  roomId, updated -> scheduler.execute(() -> applyRoom(updated)));
          picksSubscription =
              adapter.subscribeToPicks(
                  roomId, updated -> scheduler.execute(() -> applyPicks(updated)));
          open = true;
          logger.info(
              "draft engine opened roomId={} status={} picks={}",
              roomId,
              loaded.status().value(),
              picks.size());
          onStateChanged();
          return snapshot(NO_LOCAL_PARTICIPANT);
        });
  }

  /** 購読解除とタイマー停止。以後の通知やタイマーは無視される。 */
  public CompletableFuture<Void> close() {
    return submit(
        () -> {
          if (!open) {
            return null;
          }
          open = false;
          unsubscribe(roomSubscription);
          unsubscribe(picksSubscription);
          timer.cancel();
          listeners.clear();
          logger.info("draft engine closed roomId={}", roomId);
          return null;
        });
  }

  public CompletableFuture<DraftSnapshot> start() {
    return transition(DraftStatus.PENDING, DraftStatus.ACTIVE);
  }

  public CompletableFuture<DraftSnapshot> pause() {
    return transition(DraftStatus.ACTIVE, DraftStatus.PAUSED);
  }

  public CompletableFuture<DraftSnapshot> resume() {
    return transition(DraftStatus.PAUSED, DraftStatus.ACTIVE);
  }

  /**
   * 役割: 人間の手動指名を検証し、通れば Adapter へ書き込む。
   * 動作: ルール違反は rejected を返し状態を変更しない。保存層の競合は PICK_CONFLICT。
   * 前提: participantIndex は呼び出し元のユーザーを解決済みの値 (未参加なら負値)。
   */
  public CompletableFuture<PickResult> makePick(int participantIndex, String playerId) {
    return submit(
        () -> {
          requireOpen();
          return manualPick(participantIndex, playerId);
        });
  }

  /**
   * 役割: 参加者の queue 先頭の選手を手動指名と同じ検証で指名する。
   * 動作: queue が空なら QUEUE_EMPTY。先頭が指名済みなら queue から外して PLAYER_UNAVAILABLE。
   * 成功しても queue は変更しない (指名済みの選手は autodraft 側で読み飛ばされる)。
   */
  public CompletableFuture<PickResult> draftFromQueue(int participantIndex) {
    return submit(
        () -> {
          requireOpen();
          final int pickNumber = picks.size() + 1;
          final Optional<Participant> participant = room.participant(participantIndex);
          if (participant.isEmpty()) {
            return reject(pickNumber, ValidationResult.fail(DraftErrorCode.NOT_YOUR_TURN));
          }
          final QueueManager queue = QueueManager.load(participant.get().id(), queueStore);
          final List<String> queued = queue.playerIds();
          if (queued.isEmpty()) {
            return reject(pickNumber, ValidationResult.fail(DraftErrorCode.QUEUE_EMPTY));
          }
          final String next = queued.get(0);
          if (pickedPlayerIds().contains(next)) {
            queue.remove(next);
            logger.info(
                "drafted player dropped from queue roomId={} participantId={} playerId={}",
                roomId,
                participant.get().id(),
                next);
            return reject(pickNumber, ValidationResult.fail(DraftErrorCode.PLAYER_UNAVAILABLE));
          }
          return manualPick(participantIndex, next);
        });
  }

  /**
   * 役割: 保存層から room と指名履歴を読み直し、取りこぼした通知を補う。
   * 動作: 時間切れ後に自動指名が書き込めていなければ再試行する。
   */
  public CompletableFuture<DraftSnapshot> resync() {
    return submit(
        () -> {
          if (!open) {
            return snapshot(NO_LOCAL_PARTICIPANT);
          }
          adapter.getRoom(roomId).ifPresent(updated -> room = updated);
          applyPicks(adapter.getPicks(roomId));
          final int pickNumber = picks.size() + 1;
          if (room.status() == DraftStatus.ACTIVE
              && pickNumber == timedPickNumber
              && timer.state().expired()) {
            logger.info("retry expired autopick roomId={} pickNumber={}", roomId, pickNumber);
            autopick(pickNumber);
          }
          return snapshot(NO_LOCAL_PARTICIPANT);
        });
  }

  /** 任意スレッドから呼べる。指名履歴とタイマーの最新値から毎回組み立てる。 */
  public DraftSnapshot snapshot(int localParticipantIndex) {
    final DraftRoom current = room;
    if (current == null) {
      throw new IllegalStateException("draft engine is not open roomId=" + roomId);
    }
    return DraftSnapshot.of(current, picks, timer.state(), localParticipantIndex);
  }

  public List<DraftPick> picks() {
    return picks;
  }

  public Optional<DraftRoom> room() {
    return Optional.ofNullable(room);
  }

  /** 状態変化のたびに snapshot を通知する。通知は制御スレッドで行われる。 */
  public Subscription subscribe(Consumer<DraftSnapshot> listener) {
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  private CompletableFuture<DraftSnapshot> transition(DraftStatus from, DraftStatus to) {
    return submit(
        () -> {
          requireOpen();
          if (room.status() != from || !from.canTransitionTo(to)) {
            throw new IllegalStateException(
                "cannot move draft from " + room.status().value() + " to " + to.value());
          }
          final DraftRoom updated = adapter.updateRoomStatus(roomId, to);
          logger.info(
              "draft status changed roomId={} from={} to={}", roomId, from.value(), to.value());
          applyRoom(updated);
          return snapshot(NO_LOCAL_PARTICIPANT);
        });
  }

  private void applyRoom(DraftRoom updated) {
    if (!open || updated == null) {
      return;
    }
    room = updated;
    onStateChanged();
  }

  private void applyPicks(List<DraftPick> updated) {
    if (!open || updated == null) {
      return;
    }
    if (updated.size() < picks.size()) {
      logger.debug(
          "stale pick list ignored roomId={} received={} known={}",
          roomId,
          updated.size(),
          picks.size());
      return;
    }
    picks = List.copyOf(updated);
    onStateChanged();
  }

  private void onStateChanged() {
    final int currentPick = picks.size() + 1;
    if (currentPick > room.totalPicks()) {
      timer.cancel();
      completeDraft();
    } else if (room.status() == DraftStatus.ACTIVE) {
      if (currentPick != timedPickNumber) {
        beginTurn(currentPick);
      } else if (timer.state().paused()) {
        timer.resume();
        // 停止中に捨てられた即時指名を積み直す。重複しても手番が進めば古い方は捨てられる
        scheduleTurnStartAutopick(currentPick);
      }
    } else if (room.status() == DraftStatus.PAUSED) {
      timer.pause();
    }
    notifyListeners();
  }

  private void beginTurn(int pickNumber) {
    timedPickNumber = pickNumber;
    turnStartedAt = clock.instant();
    timer.start();
    logger.debug(
        "turn started roomId={} pick={} participantIndex={}",
        roomId,
        SnakeOrder.formatPickNumber(pickNumber, room.teamCount()),
        SnakeOrder.getParticipantForPick(pickNumber, room.teamCount()));
    scheduleTurnStartAutopick(pickNumber);
  }

  /** CPU と自動指名 ON の参加者は持ち時間を待たずに指名する。 */
  private void scheduleTurnStartAutopick(int pickNumber) {
    final int participantIndex = SnakeOrder.getParticipantForPick(pickNumber, room.teamCount());
    final Optional<Participant> participant = room.participant(participantIndex);
    if (participant.isPresent() && picksOnTurnStart(participant.get())) {
      scheduler.execute(() -> autopick(pickNumber));
    }
  }

  private boolean picksOnTurnStart(Participant participant) {
    if (participant.bot()) {
      return true;
    }
    try {
      return configRepository.find(participant.id()).map(AutodraftConfig::enabled).orElse(false);
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("autodraft_config");
      logger.warn(
          "autodraft config lookup failed roomId={} participantId={}",
          roomId,
          participant.id(),
          ex);
      return false;
    }
  }

  private void autopick(int pickNumber) {
    if (!open || room.status() != DraftStatus.ACTIVE || picks.size() + 1 != pickNumber) {
      logger.debug("stale autopick dropped roomId={} pickNumber={}", roomId, pickNumber);
      return;
    }
    final DraftRoom current = room;
    final int participantIndex = SnakeOrder.getParticipantForPick(pickNumber, current.teamCount());
    final Optional<Participant> participant = current.participant(participantIndex);
    if (participant.isEmpty()) {
      logger.warn(
          "autopick skipped, participant missing roomId={} participantIndex={}",
          roomId,
          participantIndex);
      return;
    }
    try {
      final String participantId = participant.get().id();
      final AutodraftConfig config =
          configRepository.find(participantId).orElseGet(AutodraftConfig::defaults);
      final List<String> queue = queueStore.load(participantId);
      final List<DraftPlayer> available = adapter.getAvailablePlayers(roomId);
      final Map<Position, Integer> rosterCounts =
          Roster.of(picks, participantIndex).positionCounts();
      final Optional<AutodraftSelection> selection =
          AutodraftSelector.select(available, rosterCounts, queue, config)
              .or(() -> AutodraftSelector.bestAvailable(available));
      if (selection.isEmpty()) {
        logger.warn(
            "autopick found no available players roomId={} pickNumber={}", roomId, pickNumber);
        return;
      }
      final DraftPlayer player = selection.get().player();
      final ValidationResult validation =
          PickValidator.validateAutopick(player, current.status(), pickedPlayerIds());
      if (!validation.valid()) {
        reject(pickNumber, validation);
        return;
      }
      commit(
          DraftPick.autopick(
              pickNumber,
              current.teamCount(),
              participant.get(),
              player,
              clock.instant(),
              selection.get().source()),
          selection.get().source().value());
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("autopick");
      logger.warn("autopick failed roomId={} pickNumber={}", roomId, pickNumber, ex);
    }
  }

  private PickResult manualPick(int participantIndex, String playerId) {
    final DraftRoom current = room;
    final int pickNumber = picks.size() + 1;
    if (pickNumber > current.totalPicks()) {
      return reject(pickNumber, ValidationResult.fail(DraftErrorCode.DRAFT_NOT_ACTIVE));
    }
    final DraftPlayer player = findPlayer(playerId);
    final ValidationResult validation =
        PickValidator.validateManualPick(
            player,
            current.status(),
            pickNumber,
            participantIndex,
            current.teamCount(),
            pickNumber == timedPickNumber ? timer.state() : null,
            pickedPlayerIds());
    if (!validation.valid()) {
      return reject(pickNumber, validation);
    }
    final Participant participant =
        current
            .participant(participantIndex)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "participant missing from room index=" + participantIndex));
    return commit(
        DraftPick.manual(pickNumber, current.teamCount(), participant, player, clock.instant()),
        "manual");
  }

  private PickResult commit(DraftPick pick, String kind) {
    MDC.put("room_id", roomId);
    MDC.put("pick_number", String.valueOf(pick.pickNumber()));
    try {
      final DraftPick committed;
      try {
        committed = adapter.addPick(roomId, pick);
      } catch (PickConflictException ex) {
        metrics.recordConflict();
        logger.info(
            "pick rejected by store roomId={} pickNumber={} autopick={} reason={}",
            roomId,
            pick.pickNumber(),
            pick.autopick(),
            ex.getMessage());
        refreshPicks();
        return PickResult.rejected(DraftErrorCode.PICK_CONFLICT);
      }
      timer.cancel();
      metrics.recordPick(kind);
      if (turnStartedAt != null) {
        metrics.recordPickLatency(Duration.between(turnStartedAt, clock.instant()));
      }
      logger.info(
          "pick committed roomId={} pickNumber={} participantIndex={} playerId={} kind={}",
          roomId,
          committed.pickNumber(),
          committed.participantIndex(),
          committed.playerId(),
          kind);
      publishPickMade(committed);
      refreshPicks();
      return PickResult.accepted(committed);
    } finally {
      MDC.remove("room_id");
      MDC.remove("pick_number");
    }
  }

  private void completeDraft() {
    if (completionHandled) {
      return;
    }
    completionHandled = true;
    if (room.status() == DraftStatus.COMPLETED) {
      return;
    }
    try {
      room = adapter.updateRoomStatus(roomId, DraftStatus.COMPLETED);
    } catch (RuntimeException ex) {
      completionHandled = false;
      metrics.recordDependencyError("update_room_status");
      logger.warn("failed to mark draft completed roomId={}", roomId, ex);
      return;
    }
    logger.info("draft completed roomId={} totalPicks={}", roomId, room.totalPicks());
    try {
      eventPublisher.publishDraftCompleted(roomId, room.totalPicks());
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("publish");
      logger.warn("failed to publish draft completion roomId={}", roomId, ex);
    }
  }

  private void publishPickMade(DraftPick pick) {
    try {
      eventPublisher.publishPickMade(roomId, pick);
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("publish");
      logger.warn(
          "failed to publish pick event roomId={} pickNumber={}", roomId, pick.pickNumber(), ex);
    }
  }

  private void refreshPicks() {
    try {
      applyPicks(adapter.getPicks(roomId));
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("get_picks");
      logger.warn("failed to refresh picks roomId={}", roomId, ex);
    }
  }

  private PickResult reject(int pickNumber, ValidationResult validation) {
    metrics.recordRejected(validation.errorCode());
    logger.debug(
        "pick rejected roomId={} pickNumber={} code={}",
        roomId,
        pickNumber,
        validation.errorCode());
    return PickResult.rejected(validation);
  }

  private DraftPlayer findPlayer(String playerId) {
    if (playerId == null || playerId.isBlank()) {
      return null;
    }
    for (DraftPlayer player : adapter.getAvailablePlayers(roomId)) {
      if (playerId.equals(player.id())) {
        return player;
      }
    }
    // 取得済みの選手は PLAYER_UNAVAILABLE で返すため指名履歴から復元する
    for (DraftPick pick : picks) {
      if (playerId.equals(pick.playerId())) {
        return new DraftPlayer(
            pick.playerId(), pick.playerName(), pick.position(), null, 0, 0, 0);
      }
    }
    return null;
  }

  private Set<String> pickedPlayerIds() {
    return picks.stream().map(DraftPick::playerId).collect(Collectors.toSet());
  }

  private void notifyListeners() {
    if (listeners.isEmpty()) {
      return;
    }
    final DraftSnapshot snapshot = snapshot(NO_LOCAL_PARTICIPANT);
    for (Consumer<DraftSnapshot> listener : listeners) {
      try {
        listener.accept(snapshot);
      } catch (RuntimeException ex) {
        logger.warn("draft snapshot listener failed roomId={}", roomId, ex);
      }
    }
  }

  private void requireOpen() {
    if (!open) {
      throw new IllegalStateException("draft engine is not open roomId=" + roomId);
    }
  }

  private void unsubscribe(Subscription subscription) {
    if (subscription != null) {
      subscription.unsubscribe();
    }
  }

  private <T> CompletableFuture<T> submit(Supplier<T> action) {
    final CompletableFuture<T> future = new CompletableFuture<>();
    scheduler.execute(
        () -> {
          try {
            future.complete(action.get());
          } catch (RuntimeException ex) {
            future.completeExceptionally(ex);
          }
        });
    return future;
  }

  private final class EngineTimerListener implements TimerListener {

    @Override
    public void onTick(int secondsRemaining) {
      notifyListeners();
    }

    @Override
    public void onGracePeriodStart() {
      logger.debug("grace period started roomId={} pickNumber={}", roomId, timedPickNumber);
      notifyListeners();
    }

    @Override
    public void onExpire() {
      logger.info("pick timer expired roomId={} pickNumber={}", roomId, timedPickNumber);
      autopick(timedPickNumber);
    }
  }
}
