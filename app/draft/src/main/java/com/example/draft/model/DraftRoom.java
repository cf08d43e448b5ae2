/*
 * どこで: Draft ドメインモデル
 * 何を: 1 つのドラフトインスタンスの設定と状態を表現する
 * なぜ: 参加者数/ロースター枠/持ち時間を Engine と Adapter で共有するため
 */
package com.example.draft.model;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "participants はコンストラクタで不変リストへコピー済みのため")
public record DraftRoom(
    String roomId,
    String name,
    int teamCount,
    int rosterSize,
    int pickTimeSeconds,
    int gracePeriodSeconds,
    DraftStatus status,
    List<Participant> participants,
    Instant startedAt,
    Instant completedAt) {

  public DraftRoom {
    participants = participants == null ? List.of() : List.copyOf(participants);
  }

  public int totalPicks() {
    return teamCount * rosterSize;
  }

  public Optional<Participant> participant(int index) {
    return participants.stream().filter(p -> p.index() == index).findFirst();
  }

  public Optional<Participant> participantForUser(String userId) {
    if (userId == null) {
      return Optional.empty();
    }
    return participants.stream().filter(p -> userId.equals(p.id())).findFirst();
  }

  /** 状態遷移後の room を返す。開始時刻/完了時刻は初回遷移時のみ記録する。 */
  public DraftRoom withStatus(DraftStatus newStatus, Instant now) {
    final Instant started = newStatus == DraftStatus.ACTIVE && startedAt == null ? now : startedAt;
    final Instant completed =
        newStatus == DraftStatus.COMPLETED && completedAt == null ? now : completedAt;
    return new DraftRoom(
        roomId,
        name,
        teamCount,
        rosterSize,
        pickTimeSeconds,
        gracePeriodSeconds,
        newStatus,
        participants,
        started,
        completed);
  }
}
