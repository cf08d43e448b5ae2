/*
 * どこで: Draft API
 * 何を: ルーム作成/状態取得/開始・一時停止・再開/指名/ボード・ロスター参照のエンドポイントを公開する
 * なぜ: クライアントからのドラフト操作を受け付ける入口を提供するため
 */
package com.example.draft.api;

import com.example.draft.api.request.CreateDraftRequest;
import com.example.draft.api.request.MakePickRequest;
import com.example.draft.api.response.BoardResponse;
import com.example.draft.api.response.DraftRoomResponse;
import com.example.draft.api.response.DraftStateResponse;
import com.example.draft.api.response.PickResponse;
import com.example.draft.api.response.PlayerResponse;
import com.example.draft.api.response.RosterResponse;
import com.example.draft.service.DraftRoomService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/drafts")
@RequiredArgsConstructor
public class DraftController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final DraftRoomService draftRoomService;

  @PostMapping
  public ResponseEntity<DraftRoomResponse> createRoom(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody CreateDraftRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(draftRoomService.createRoom(userId, request));
  }

  @GetMapping("/{roomId}")
  public ResponseEntity<DraftRoomResponse> getRoom(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.getRoom(roomId, userId));
  }

  @GetMapping("/{roomId}/state")
  public ResponseEntity<DraftStateResponse> getState(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.getState(roomId, userId));
  }

  @PostMapping("/{roomId}/start")
  public ResponseEntity<DraftStateResponse> start(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.start(roomId, userId));
  }

  @PostMapping("/{roomId}/pause")
  public ResponseEntity<DraftStateResponse> pause(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.pause(roomId, userId));
  }

  @PostMapping("/{roomId}/resume")
  public ResponseEntity<DraftStateResponse> resume(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.resume(roomId, userId));
  }

  @PostMapping("/{roomId}/picks")
  public ResponseEntity<PickResponse> makePick(
      @PathVariable("roomId") String roomId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody MakePickRequest request) {
    return ResponseEntity.ok(draftRoomService.makePick(roomId, userId, request.playerId()));
  }

  @PostMapping("/{roomId}/picks/from-queue")
  public ResponseEntity<PickResponse> draftFromQueue(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.draftFromQueue(roomId, userId));
  }

  @GetMapping("/{roomId}/picks")
  public ResponseEntity<List<PickResponse>> getPicks(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.getPicks(roomId, userId));
  }

  @GetMapping("/{roomId}/players")
  public ResponseEntity<List<PlayerResponse>> getAvailablePlayers(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.getAvailablePlayers(roomId, userId));
  }

  @GetMapping("/{roomId}/rosters/{participantIndex}")
  public ResponseEntity<RosterResponse> getRoster(
      @PathVariable("roomId") String roomId,
      @PathVariable("participantIndex") int participantIndex,
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.getRoster(roomId, userId, participantIndex));
  }

  @GetMapping("/{roomId}/board")
  public ResponseEntity<BoardResponse> getBoard(
      @PathVariable("roomId") String roomId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(draftRoomService.getBoard(roomId, userId));
  }
}
