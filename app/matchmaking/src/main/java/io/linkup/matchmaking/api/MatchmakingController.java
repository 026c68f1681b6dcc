/*
 * どこで: Matchmaking API
 * 何を: 検索開始/取消、accept/reject、proposal 参照、統計のエンドポイントを公開する
 * なぜ: ゲートウェイからのマッチメイク要求を受け付ける入口を提供するため
 */
package io.linkup.matchmaking.api;

import io.linkup.matchmaking.api.request.DecisionRequest;
import io.linkup.matchmaking.api.request.StartSearchRequest;
import io.linkup.matchmaking.api.response.CancelSearchResponse;
import io.linkup.matchmaking.api.response.MatchmakingStatsResponse;
import io.linkup.matchmaking.api.response.ProposalResponse;
import io.linkup.matchmaking.api.response.SearchResponse;
import io.linkup.matchmaking.service.MatchmakingService;
import io.linkup.matchmaking.service.MatchmakingStatsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/matchmaking")
@RequiredArgsConstructor
public class MatchmakingController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final MatchmakingService matchmakingService;
  private final MatchmakingStatsService statsService;

  @PostMapping("/searches")
  public ResponseEntity<SearchResponse> startSearch(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody StartSearchRequest request) {
    return ResponseEntity.ok(
        SearchResponse.queued(
            matchmakingService.startSearch(userId, request.interests(), request.preference())));
  }

  @DeleteMapping("/searches")
  public ResponseEntity<CancelSearchResponse> cancelSearch(
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(
        new CancelSearchResponse(userId, matchmakingService.cancelSearch(userId)));
  }

  @PostMapping("/proposals/{proposalId}/decisions")
  public ResponseEntity<ProposalResponse> submitDecision(
      @PathVariable("proposalId") String proposalId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody DecisionRequest request) {
    return ResponseEntity.ok(
        ProposalResponse.from(
            matchmakingService.submitDecision(proposalId, userId, request.accept()), userId));
  }

  @GetMapping("/proposals/current")
  public ResponseEntity<ProposalResponse> currentProposal(
      @RequestHeader(HEADER_USER_ID) String userId) {
    return matchmakingService
        .currentProposal(userId)
        .map(snapshot -> ResponseEntity.ok(ProposalResponse.from(snapshot, userId)))
        .orElseThrow(() -> MatchmakingException.proposalNotFound("current"));
  }

  @GetMapping("/proposals/{proposalId}")
  public ResponseEntity<ProposalResponse> getProposal(
      @PathVariable("proposalId") String proposalId,
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(
        ProposalResponse.from(matchmakingService.findProposal(proposalId, userId), userId));
  }

  @GetMapping("/stats")
  public ResponseEntity<MatchmakingStatsResponse> stats() {
    return ResponseEntity.ok(statsService.stats());
  }
}
