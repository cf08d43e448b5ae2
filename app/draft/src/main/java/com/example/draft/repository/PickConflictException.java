package com.example.draft.repository;

/** addPick が指名番号または選手の取得済みを検出したときに送出する。 */
public class PickConflictException extends RuntimeException {

  private final String roomId;
  private final int pickNumber;

  public PickConflictException(String roomId, int pickNumber, String message) {
    super(message);
    this.roomId = roomId;
    this.pickNumber = pickNumber;
  }

  public String roomId() {
    return roomId;
  }

  public int pickNumber() {
    return pickNumber;
  }
}
