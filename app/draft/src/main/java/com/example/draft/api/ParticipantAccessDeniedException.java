package com.example.draft.api;

/** 呼び出しユーザーがルームの参加者ではない。 */
public class ParticipantAccessDeniedException extends RuntimeException {
  public ParticipantAccessDeniedException(String roomId) {
    super("user is not a participant of draft room: " + roomId);
  }
}
