package com.example.draft.engine;

public enum DraftErrorCode {
  NOT_YOUR_TURN("it is not your turn to pick"),
  PLAYER_UNAVAILABLE("player has already been drafted"),
  POSITION_LIMIT_REACHED("position limit reached for this roster"),
  TIMER_EXPIRED("pick timer has expired"),
  DRAFT_NOT_ACTIVE("draft is not active"),
  INVALID_PLAYER("player is not in the draft catalog"),
  PICK_CONFLICT("pick number was already taken"),
  QUEUE_EMPTY("draft queue is empty");

  private final String defaultMessage;

  DraftErrorCode(String defaultMessage) {
    this.defaultMessage = defaultMessage;
  }

  public String defaultMessage() {
    return defaultMessage;
  }
}
