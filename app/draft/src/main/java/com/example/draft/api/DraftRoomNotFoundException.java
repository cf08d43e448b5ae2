/*
 * どこで: Draft API
 * 何を: ルーム未検出を表現する
 * なぜ: 404 応答へ変換するため
 */
package com.example.draft.api;

public class DraftRoomNotFoundException extends RuntimeException {
  public DraftRoomNotFoundException(String roomId) {
    super("draft room not found: " + roomId);
  }
}
