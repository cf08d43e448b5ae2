package com.example.draft.engine;

import com.example.draft.model.DraftPick;

/** makePick の結果。ルール違反は例外ではなくこの値で返す。 */
public record PickResult(
    boolean accepted, DraftPick pick, DraftErrorCode errorCode, String errorMessage) {

  public static PickResult accepted(DraftPick pick) {
    return new PickResult(true, pick, null, null);
  }

  public static PickResult rejected(ValidationResult validation) {
    return new PickResult(false, null, validation.errorCode(), validation.errorMessage());
  }

  public static PickResult rejected(DraftErrorCode errorCode) {
    return new PickResult(false, null, errorCode, errorCode.defaultMessage());
  }
}
