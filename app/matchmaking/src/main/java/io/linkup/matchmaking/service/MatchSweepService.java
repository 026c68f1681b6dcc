/*
 * どこで: Matchmaking サービス層
 * 何を: 1 回分のマッチング sweep (snapshot → 計画 → ペアごとの確定) を実行する
 * なぜ: 投入ごとではなく一定間隔でまとめて照合し、pool 全体ロックを避けるため
 */
package io.linkup.matchmaking.service;

import io.linkup.matchmaking.config.MatchmakingProperties;
import io.linkup.matchmaking.model.MatchPair;
import io.linkup.matchmaking.model.SearchingUser;
import io.linkup.matchmaking.repository.CandidatePool;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchSweepService {

  private static final Logger logger = LoggerFactory.getLogger(MatchSweepService.class);

  private final CandidatePool candidatePool;
  private final MatchPlanner matchPlanner;
  private final MatchmakingService matchmakingService;
  private final MatchmakingMetrics metrics;
  private final MatchmakingProperties properties;
  private final Clock clock;

  /**
   * 役割: 古い順のバッチから proposal を作成する。
   * 動作: ペア単位で失敗を隔離し、1 組の失敗で sweep 全体を止めない。バッチ全体でロックは保持しない。
   */
  public SweepResult sweep() {
    final long startedAt = System.nanoTime();
    final List<SearchingUser> batch = candidatePool.snapshot(properties.batchSize());
    if (batch.size() < 2) {
      metrics.recordSweepDuration(Duration.ofNanos(System.nanoTime() - startedAt));
      return new SweepResult(batch.size(), 0, 0, 0);
    }
    final List<MatchPair> pairs =
        matchPlanner.plan(batch, properties.matchLimitPerSweep(), Instant.now(clock));
    int created = 0;
    int aborted = 0;
    for (MatchPair pair : pairs) {
      try {
        if (matchmakingService.claim(pair).isPresent()) {
          created++;
        } else {
          aborted++;
        }
      } catch (RuntimeException ex) {
        aborted++;
        logger.warn(
            "matchmaking pair claim failed first={} second={}",
            pair.first().userId(),
            pair.second().userId(),
            ex);
        metrics.recordSweepError("pair_claim");
      }
    }
    metrics.recordSweepDuration(Duration.ofNanos(System.nanoTime() - startedAt));
    if (!pairs.isEmpty()) {
      logger.info(
          "matchmaking sweep finished scanned={} planned={} created={} aborted={}",
          batch.size(),
          pairs.size(),
          created,
          aborted);
    }
    return new SweepResult(batch.size(), pairs.size(), created, aborted);
  }
}
