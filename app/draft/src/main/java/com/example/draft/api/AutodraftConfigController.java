package com.example.draft.api;

import com.example.draft.api.request.UpdateAutodraftConfigRequest;
import com.example.draft.api.response.AutodraftConfigResponse;
import com.example.draft.service.AutodraftConfigService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/autodraft-config")
@RequiredArgsConstructor
public class AutodraftConfigController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final AutodraftConfigService autodraftConfigService;

  @GetMapping
  public ResponseEntity<AutodraftConfigResponse> get(
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(autodraftConfigService.get(userId));
  }

  @PutMapping
  public ResponseEntity<AutodraftConfigResponse> update(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody UpdateAutodraftConfigRequest request) {
    return ResponseEntity.ok(autodraftConfigService.update(userId, request));
  }
}
