package com.example.draft.api;

import com.example.draft.engine.DraftErrorCode;

/** エンジンが拒否した指名。409 とエラーコードへ変換する。 */
public class PickRejectedException extends RuntimeException {

  private final DraftErrorCode errorCode;

  public PickRejectedException(DraftErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public DraftErrorCode errorCode() {
    return errorCode;
  }
}
