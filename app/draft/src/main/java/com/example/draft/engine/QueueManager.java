/*
 * どこで: Draft エンジン
 * 何を: 1 ユーザー分の優先選手リストを保持し、変更のたびに保存先へ書き戻す
 * なぜ: ドラフト開始前に用意した queue を複数ドラフトで再利用できるようにするため
 */
package com.example.draft.engine;

import com.example.draft.repository.QueueStore;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

public class QueueManager {

  private final String userId;
  private final QueueStore store;
  private final List<String> playerIds;

  private QueueManager(String userId, QueueStore store, List<String> playerIds) {
    this.userId = userId;
    this.store = store;
    this.playerIds = playerIds;
  }

  /** 保存済みの queue を読み込む。重複 id は先頭側だけを残す。 */
  public static QueueManager load(String userId, QueueStore store) {
    final List<String> stored = store.load(userId);
    final List<String> ids =
        stored == null ? new ArrayList<>() : new ArrayList<>(new LinkedHashSet<>(stored));
    ids.removeIf(id -> id == null || id.isBlank());
    return new QueueManager(userId, store, ids);
  }

  public synchronized List<String> playerIds() {
    return List.copyOf(playerIds);
  }

  /** 既に含まれていれば何もせず false を返す。 */
  public synchronized boolean append(String playerId) {
    if (playerId == null || playerId.isBlank() || playerIds.contains(playerId)) {
      return false;
    }
    playerIds.add(playerId);
    save();
    return true;
  }

  public synchronized boolean remove(String playerId) {
    if (!playerIds.remove(playerId)) {
      return false;
    }
    save();
    return true;
  }

  /**
   * 役割: 指定 id を新しい位置へ移動する (ドラッグ並べ替え)。
   * 動作: index は [0, size-1] に丸める。id が無ければ false。
   * 前提: 移動後の位置は移動対象を取り除いたリスト上の index として解釈する。
   */
  public synchronized boolean moveTo(String playerId, int index) {
    final int current = playerIds.indexOf(playerId);
    if (current < 0) {
      return false;
    }
    final int target = Math.max(0, Math.min(index, playerIds.size() - 1));
    if (target == current) {
      return true;
    }
    playerIds.remove(current);
    playerIds.add(target, playerId);
    save();
    return true;
  }

  public synchronized boolean moveToTop(String playerId) {
    return moveTo(playerId, 0);
  }

  public synchronized void clear() {
    if (playerIds.isEmpty()) {
      return;
    }
    playerIds.clear();
    save();
  }

  private void save() {
    store.save(userId, List.copyOf(playerIds));
  }
}
