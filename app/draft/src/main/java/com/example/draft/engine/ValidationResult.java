package com.example.draft.engine;

public record ValidationResult(boolean valid, DraftErrorCode errorCode, String errorMessage) {

  private static final ValidationResult OK = new ValidationResult(true, null, null);

  public static ValidationResult ok() {
    return OK;
  }

  public static ValidationResult fail(DraftErrorCode errorCode) {
    return new ValidationResult(false, errorCode, errorCode.defaultMessage());
  }
}
