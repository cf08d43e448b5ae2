/*
 * どこで: Draft ドメインモデル
 * 何を: ドラフトルームのライフサイクル状態と許可される遷移を定義する
 * なぜ: API 応答と永続値の表記、遷移規則を一箇所で一貫させるため
 */
package com.example.draft.model;

public enum DraftStatus {
  PENDING("pending"),
  ACTIVE("active"),
  PAUSED("paused"),
  COMPLETED("completed");

  private final String value;

  DraftStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** pending → active ⇄ paused → completed。completed からはどこへも遷移しない。 */
  public boolean canTransitionTo(DraftStatus next) {
    return switch (this) {
      case PENDING -> next == ACTIVE;
      case ACTIVE -> next == PAUSED || next == COMPLETED;
      case PAUSED -> next == ACTIVE || next == COMPLETED;
      case COMPLETED -> false;
    };
  }

  /**
   * 役割: 永続値/API 入力の status 文字列を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: status は null でないことを呼び出し側で保証する。
   */
  public static DraftStatus fromValue(String status) {
    for (DraftStatus draftStatus : values()) {
      if (draftStatus.value.equalsIgnoreCase(status)) {
        return draftStatus;
      }
    }
    throw new IllegalArgumentException("unsupported draft status: " + status);
  }
}
