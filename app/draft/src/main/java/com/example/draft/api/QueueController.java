package com.example.draft.api;

import com.example.draft.api.request.QueueAppendRequest;
import com.example.draft.api.request.QueueMoveRequest;
import com.example.draft.api.response.QueueResponse;
import com.example.draft.service.QueueService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/queue")
@RequiredArgsConstructor
public class QueueController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final QueueService queueService;

  @GetMapping
  public ResponseEntity<QueueResponse> getQueue(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(queueService.getQueue(userId));
  }

  @PostMapping
  public ResponseEntity<QueueResponse> append(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody QueueAppendRequest request) {
    return ResponseEntity.ok(queueService.append(userId, request.playerId()));
  }

  @DeleteMapping("/{playerId}")
  public ResponseEntity<QueueResponse> remove(
      @PathVariable("playerId") String playerId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(queueService.remove(userId, playerId));
  }

  @PutMapping("/{playerId}/position")
  public ResponseEntity<QueueResponse> moveTo(
      @PathVariable("playerId") String playerId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody QueueMoveRequest request) {
    return ResponseEntity.ok(queueService.moveTo(userId, playerId, request.index()));
  }

  @PostMapping("/{playerId}/top")
  public ResponseEntity<QueueResponse> moveToTop(
      @PathVariable("playerId") String playerId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(queueService.moveToTop(userId, playerId));
  }

  @DeleteMapping
  public ResponseEntity<QueueResponse> clear(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(queueService.clear(userId));
  }
}
