package com.example.draft.api;

public class InvalidDraftRequestException extends RuntimeException {
  public InvalidDraftRequestException(String message) {
    super(message);
  }
}
