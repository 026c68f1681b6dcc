/*
 * どこで: Matchmaking API
 * 何を: ゲートウェイのソケット接続/切断報告を受け付ける
 */
package io.linkup.matchmaking.api;

import io.linkup.matchmaking.api.response.PresenceSessionResponse;
import io.linkup.matchmaking.service.PresenceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/presence")
@RequiredArgsConstructor
public class PresenceController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final PresenceService presenceService;

  @PutMapping("/sessions/{sessionId}")
  public ResponseEntity<PresenceSessionResponse> connect(
      @PathVariable("sessionId") String sessionId, @RequestHeader(HEADER_USER_ID) String userId) {
    presenceService.connect(userId, sessionId);
    return ResponseEntity.ok(new PresenceSessionResponse(userId, sessionId, "ONLINE"));
  }

  @DeleteMapping("/sessions/{sessionId}")
  public ResponseEntity<PresenceSessionResponse> disconnect(
      @PathVariable("sessionId") String sessionId, @RequestHeader(HEADER_USER_ID) String userId) {
    final boolean removed = presenceService.disconnect(userId, sessionId);
    return ResponseEntity.ok(
        new PresenceSessionResponse(userId, sessionId, removed ? "OFFLINE" : "STALE"));
  }
}
