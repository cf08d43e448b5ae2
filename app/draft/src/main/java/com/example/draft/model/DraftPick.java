/*
 * どこで: Draft ドメインモデル
 * 何を: 確定済みの 1 指名を不変レコードとして表現する
 * なぜ: 指名履歴を「誰が何を持っているか」の唯一の情報源にするため
 */
package com.example.draft.model;

import java.time.Instant;

public record DraftPick(
    int pickNumber,
    int round,
    int pickInRound,
    int participantIndex,
    String participantId,
    String playerId,
    String playerName,
    Position position,
    Instant pickedAt,
    boolean autopick,
    PickSource source) {

  public static DraftPick manual(
      int pickNumber,
      int teamCount,
      Participant participant,
      DraftPlayer player,
      Instant pickedAt) {
    return create(pickNumber, teamCount, participant, player, pickedAt, false, null);
  }

  public static DraftPick autopick(
      int pickNumber,
      int teamCount,
      Participant participant,
      DraftPlayer player,
      Instant pickedAt,
      PickSource source) {
    return create(pickNumber, teamCount, participant, player, pickedAt, true, source);
  }

  private static DraftPick create(
      int pickNumber,
      int teamCount,
      Participant participant,
      DraftPlayer player,
      Instant pickedAt,
      boolean autopick,
      PickSource source) {
    return new DraftPick(
        pickNumber,
        (pickNumber + teamCount - 1) / teamCount,
        ((pickNumber - 1) % teamCount) + 1,
        participant.index(),
        participant.id(),
        player.id(),
        player.name(),
        player.position(),
        pickedAt,
        autopick,
        source);
  }
}
