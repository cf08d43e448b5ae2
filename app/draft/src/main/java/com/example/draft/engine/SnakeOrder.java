/*
 * どこで: Draft エンジン
 * 何を: スネーク順の指名番号 → 参加者/ラウンド変換を純関数で提供する
 * なぜ: 指名番号と teamCount だけから決定的に手番を求め、履歴に依存させないため
 */
package com.example.draft.engine;

import java.util.ArrayList;
import java.util.List;

public final class SnakeOrder {

  public static final int NO_REMAINING_PICK = -1;

  private SnakeOrder() {}

  public static int getRoundForPick(int pickNumber, int teamCount) {
    requirePositive(pickNumber, teamCount);
    return (pickNumber + teamCount - 1) / teamCount;
  }

  /** 奇数ラウンドは 0 → teamCount-1、偶数ラウンドは逆順。 */
  public static int getParticipantForPick(int pickNumber, int teamCount) {
    final int round = getRoundForPick(pickNumber, teamCount);
    final int positionInRound = (pickNumber - 1) % teamCount;
    return round % 2 == 1 ? positionInRound : teamCount - 1 - positionInRound;
  }

  public static int getPickInRound(int pickNumber, int teamCount) {
    requirePositive(pickNumber, teamCount);
    return ((pickNumber - 1) % teamCount) + 1;
  }

  /** 例: 12 チームの 13 番目 → "2.01"。 */
  public static String formatPickNumber(int pickNumber, int teamCount) {
    return String.format(
        "%d.%02d",
        getRoundForPick(pickNumber, teamCount), getPickInRound(pickNumber, teamCount));
  }

  /**
   * 役割: formatPickNumber の表記を指名番号へ戻す。
   * 動作: "{round}.{pickInRound}" を分解し (round-1)*teamCount + pickInRound を返す。
   * 前提: pickInRound は [1, teamCount] であること。外れる場合は IllegalArgumentException。
   */
  public static int parsePickNumber(String label, int teamCount) {
    if (label == null) {
      throw new IllegalArgumentException("pick label is required");
    }
    final int dot = label.indexOf('.');
    if (dot <= 0 || dot == label.length() - 1) {
      throw new IllegalArgumentException("malformed pick label: " + label);
    }
    final int round;
    final int pickInRound;
    try {
      round = Integer.parseInt(label.substring(0, dot));
      pickInRound = Integer.parseInt(label.substring(dot + 1));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("malformed pick label: " + label, ex);
    }
    if (round < 1 || pickInRound < 1 || pickInRound > teamCount) {
      throw new IllegalArgumentException("pick label out of range: " + label);
    }
    return (round - 1) * teamCount + pickInRound;
  }

  public static List<Integer> getPickNumbersForParticipant(
      int participantIndex, int teamCount, int totalRounds) {
    requireParticipant(participantIndex, teamCount);
    final List<Integer> pickNumbers = new ArrayList<>(totalRounds);
    for (int round = 1; round <= totalRounds; round++) {
      final int offset = round % 2 == 1 ? participantIndex : teamCount - 1 - participantIndex;
      pickNumbers.add((round - 1) * teamCount + offset + 1);
    }
    return pickNumbers;
  }

  /**
   * 役割: 現在の指名番号から指定参加者の次の手番までの差分を返す。
   * 動作: 現在の指名がその参加者なら 0。残りの手番が無ければ NO_REMAINING_PICK。
   * 前提: currentPick は 1 以上。
   */
  public static int getPicksUntilTurn(
      int currentPick, int participantIndex, int teamCount, int totalRounds) {
    for (int pickNumber :
        getPickNumbersForParticipant(participantIndex, teamCount, totalRounds)) {
      if (pickNumber >= currentPick) {
        return pickNumber - currentPick;
      }
    }
    return NO_REMAINING_PICK;
  }

  private static void requirePositive(int pickNumber, int teamCount) {
    if (teamCount < 1) {
      throw new IllegalArgumentException("teamCount must be positive: " + teamCount);
    }
    if (pickNumber < 1) {
      throw new IllegalArgumentException("pickNumber must be positive: " + pickNumber);
    }
  }

  private static void requireParticipant(int participantIndex, int teamCount) {
    if (teamCount < 1) {
      throw new IllegalArgumentException("teamCount must be positive: " + teamCount);
    }
    if (participantIndex < 0 || participantIndex >= teamCount) {
      throw new IllegalArgumentException("participantIndex out of range: " + participantIndex);
    }
  }
}
