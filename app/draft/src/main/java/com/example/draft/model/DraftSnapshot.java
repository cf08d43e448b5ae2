/*
 * どこで: Draft ドメインモデル
 * 何を: Engine が公開する読み取り専用の派生状態を表現する
 * なぜ: 指名履歴から毎回再計算し、独立した可変状態を持たないため
 */
package com.example.draft.model;

import com.example.draft.engine.SnakeOrder;
import java.util.ArrayList;
import java.util.List;

public record DraftSnapshot(
    String roomId,
    DraftStatus status,
    int currentPickNumber,
    int currentRound,
    int currentParticipantIndex,
    boolean localUsersTurn,
    List<Integer> pickCounts,
    int totalPicks,
    boolean complete,
    TimerState timer) {

  public DraftSnapshot {
    pickCounts = List.copyOf(pickCounts);
  }

  /**
   * 役割: room と確定済み指名一覧から派生状態を組み立てる。
   * 動作: 現在の指名番号は picks.size() + 1、完了判定は指名番号が総指名数を超えたかで行う。
   * 前提: picks は 1 から欠番なく並んでいること。localParticipantIndex が負ならローカル参加者なし。
   * 手番は ACTIVE の間だけ立つ (PENDING/PAUSED では常に false)。
   */
  public static DraftSnapshot of(
      DraftRoom room, List<DraftPick> picks, TimerState timer, int localParticipantIndex) {
    final int teamCount = room.teamCount();
    final int currentPick = picks.size() + 1;
    final boolean complete = currentPick > room.totalPicks();
    final List<Integer> counts = new ArrayList<>(teamCount);
    for (int i = 0; i < teamCount; i++) {
      counts.add(0);
    }
    for (DraftPick pick : picks) {
      final int index = pick.participantIndex();
      if (index >= 0 && index < teamCount) {
        counts.set(index, counts.get(index) + 1);
      }
    }
    final int currentParticipant =
        complete ? -1 : SnakeOrder.getParticipantForPick(currentPick, teamCount);
    final int currentRound =
        complete ? room.rosterSize() : SnakeOrder.getRoundForPick(currentPick, teamCount);
    return new DraftSnapshot(
        room.roomId(),
        room.status(),
        currentPick,
        currentRound,
        currentParticipant,
        room.status() == DraftStatus.ACTIVE
            && !complete
            && localParticipantIndex >= 0
            && currentParticipant == localParticipantIndex,
        counts,
        room.totalPicks(),
        complete,
        timer);
  }
}
