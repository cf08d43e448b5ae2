/*
 * どこで: Draft エンジン
 * 何を: 指名提案の合法性を判定し、型付き結果で返す
 * なぜ: 「手番ではない」等の頻出かつ回復可能な違反を例外にせず呼び出し側へ返すため
 */
package com.example.draft.engine;

import com.example.draft.model.DraftPlayer;
import com.example.draft.model.DraftStatus;
import com.example.draft.model.Position;
import com.example.draft.model.TimerState;
import java.util.Map;
import java.util.Set;

public final class PickValidator {

  private PickValidator() {}

  public static ValidationResult validateTurn(
      int pickNumber, int callerParticipantIndex, int teamCount) {
    if (SnakeOrder.getParticipantForPick(pickNumber, teamCount) != callerParticipantIndex) {
      return ValidationResult.fail(DraftErrorCode.NOT_YOUR_TURN);
    }
    return ValidationResult.ok();
  }

  public static ValidationResult validatePlayerAvailable(
      DraftPlayer player, Set<String> alreadyPickedIds) {
    if (alreadyPickedIds.contains(player.id())) {
      return ValidationResult.fail(DraftErrorCode.PLAYER_UNAVAILABLE);
    }
    return ValidationResult.ok();
  }

  /** Engine が書き込み前に呼ぶ手番 + 在庫チェック。最初の失敗で打ち切る。 */
  public static ValidationResult validatePick(
      int pickNumber,
      int callerParticipantIndex,
      int teamCount,
      DraftPlayer player,
      Set<String> alreadyPickedIds) {
    final ValidationResult turn = validateTurn(pickNumber, callerParticipantIndex, teamCount);
    if (!turn.valid()) {
      return turn;
    }
    return validatePlayerAvailable(player, alreadyPickedIds);
  }

  public static ValidationResult validateDraftActive(DraftStatus status) {
    if (status != DraftStatus.ACTIVE) {
      return ValidationResult.fail(DraftErrorCode.DRAFT_NOT_ACTIVE);
    }
    return ValidationResult.ok();
  }

  public static ValidationResult validatePlayer(DraftPlayer player) {
    if (player == null
        || isBlank(player.id())
        || isBlank(player.name())
        || player.position() == null) {
      return ValidationResult.fail(DraftErrorCode.INVALID_PLAYER);
    }
    return ValidationResult.ok();
  }

  /** 残り 0 秒以下でも猶予期間中なら指名を受け付ける。 */
  public static ValidationResult validateTimer(int secondsRemaining, boolean inGracePeriod) {
    if (inGracePeriod || secondsRemaining > 0) {
      return ValidationResult.ok();
    }
    return ValidationResult.fail(DraftErrorCode.TIMER_EXPIRED);
  }

  /** 自動指名専用。手動指名には適用しない。 */
  public static ValidationResult validatePositionLimit(
      DraftPlayer player, Map<Position, Integer> rosterCounts, Map<Position, Integer> limits) {
    final int current = rosterCounts.getOrDefault(player.position(), 0);
    final int limit = limits.getOrDefault(player.position(), Integer.MAX_VALUE);
    if (current >= limit) {
      return ValidationResult.fail(DraftErrorCode.POSITION_LIMIT_REACHED);
    }
    return ValidationResult.ok();
  }

  /**
   * 役割: 人間の手動指名を検証する。
   * 動作: 選手 → ドラフト状態 → 手番 → タイマー → 在庫の順に判定し、最初の失敗を返す。
   * 前提: timer は現在の指名番号に対応する状態 (未計測なら null)。ポジション上限は判定しない。
   */
  public static ValidationResult validateManualPick(
      DraftPlayer player,
      DraftStatus status,
      int pickNumber,
      int callerParticipantIndex,
      int teamCount,
      TimerState timer,
      Set<String> alreadyPickedIds) {
    ValidationResult result = validatePlayer(player);
    if (!result.valid()) {
      return result;
    }
    result = validateDraftActive(status);
    if (!result.valid()) {
      return result;
    }
    result = validateTurn(pickNumber, callerParticipantIndex, teamCount);
    if (!result.valid()) {
      return result;
    }
    if (timer != null) {
      result = validateTimer(timer.secondsRemaining(), timer.inGracePeriod());
      if (!result.valid()) {
        return result;
      }
    }
    return validatePlayerAvailable(player, alreadyPickedIds);
  }

  /** 自動指名の検証。手番はエンジン自身が決めるため判定しない。 */
  public static ValidationResult validateAutopick(
      DraftPlayer player, DraftStatus status, Set<String> alreadyPickedIds) {
    ValidationResult result = validatePlayer(player);
    if (!result.valid()) {
      return result;
    }
    result = validateDraftActive(status);
    if (!result.valid()) {
      return result;
    }
    return validatePlayerAvailable(player, alreadyPickedIds);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
