/*
 * どこで: Draft サービス層
 * 何を: ユーザー単位の queue 編集 (追加/削除/並べ替え/消去) を提供する
 * なぜ: 同一ユーザーへの並行編集を直列化し、カタログ外の選手 id を弾くため
 */
package com.example.draft.service;

import com.example.draft.api.InvalidDraftRequestException;
import com.example.draft.api.response.QueueResponse;
import com.example.draft.engine.QueueManager;
import com.example.draft.model.DraftPlayer;
import com.example.draft.repository.PlayerCatalog;
import com.example.draft.repository.QueueStore;
import com.google.common.util.concurrent.Striped;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class QueueService {

  private static final Logger logger = LoggerFactory.getLogger(QueueService.class);

  private final QueueStore queueStore;
  private final Set<String> catalogIds;
  private final Striped<Lock> userLocks = Striped.lock(64);

  public QueueService(QueueStore queueStore, PlayerCatalog catalog) {
    this.queueStore = queueStore;
    this.catalogIds = catalog.players().stream().map(DraftPlayer::id).collect(Collectors.toSet());
  }

  public QueueResponse getQueue(String userId) {
    requireUserId(userId);
    return new QueueResponse(userId, QueueManager.load(userId, queueStore).playerIds());
  }

  public QueueResponse append(String userId, String playerId) {
    requirePlayerId(playerId);
    if (!catalogIds.contains(playerId)) {
      throw new InvalidDraftRequestException("unknown player: " + playerId);
    }
    return mutate(userId, queue -> queue.append(playerId));
  }

  public QueueResponse remove(String userId, String playerId) {
    requirePlayerId(playerId);
    return mutate(userId, queue -> queue.remove(playerId));
  }

  public QueueResponse moveTo(String userId, String playerId, int index) {
    requirePlayerId(playerId);
    if (index < 0) {
      throw new InvalidDraftRequestException("index must be >= 0");
    }
    return mutate(userId, queue -> requireQueued(queue.moveTo(playerId, index), playerId));
  }

  public QueueResponse moveToTop(String userId, String playerId) {
    requirePlayerId(playerId);
    return mutate(userId, queue -> requireQueued(queue.moveToTop(playerId), playerId));
  }

  public QueueResponse clear(String userId) {
    return mutate(userId, QueueManager::clear);
  }

  private QueueResponse mutate(String userId, Consumer<QueueManager> change) {
    requireUserId(userId);
    final Lock lock = userLocks.get(userId);
    lock.lock();
    try {
      final QueueManager queue = QueueManager.load(userId, queueStore);
      change.accept(queue);
      logger.debug("queue updated userId={} size={}", userId, queue.playerIds().size());
      return new QueueResponse(userId, queue.playerIds());
    } finally {
      lock.unlock();
    }
  }

  private void requireQueued(boolean found, String playerId) {
    if (!found) {
      throw new InvalidDraftRequestException("player is not in queue: " + playerId);
    }
  }

  private void requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new InvalidDraftRequestException("userId is required");
    }
  }

  private void requirePlayerId(String playerId) {
    if (playerId == null || playerId.isBlank()) {
      throw new InvalidDraftRequestException("player_id is required");
    }
  }
}
