/*
 * どこで: Matchmaking サービス層
 * 何を: pool と proposal の統計 (待ち時間分布、人気の興味) を集計する
 */
package io.linkup.matchmaking.service;

import io.linkup.matchmaking.api.response.MatchmakingStatsResponse;
import io.linkup.matchmaking.api.response.MatchmakingStatsResponse.InterestCount;
import io.linkup.matchmaking.api.response.MatchmakingStatsResponse.Limits;
import io.linkup.matchmaking.api.response.MatchmakingStatsResponse.WaitTimeDistribution;
import io.linkup.matchmaking.config.MatchmakingProperties;
import io.linkup.matchmaking.model.SearchingUser;
import io.linkup.matchmaking.presence.PresenceRegistry;
import io.linkup.matchmaking.repository.CandidatePool;
import io.linkup.matchmaking.repository.ProposalRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchmakingStatsService {

  static final int TOP_INTERESTS = 10;

  private final CandidatePool candidatePool;
  private final ProposalRepository proposalRepository;
  private final PresenceRegistry presenceRegistry;
  private final MatchmakingProperties properties;
  private final Clock clock;

  /**
   * 役割: 現時点の統計を返す。
   * 動作: 待ち時間は 1 分未満 / 1-5 分 / 5-15 分 / 15 分超 に分類する。興味は件数降順、同数は名前順で上位 10 件。
   */
  public MatchmakingStatsResponse stats() {
    final Instant now = Instant.now(clock);
    long underOne = 0;
    long oneToFive = 0;
    long fiveToFifteen = 0;
    long overFifteen = 0;
    final Map<String, Long> interestCounts = new HashMap<>();
    int poolSize = 0;
    for (SearchingUser entry : candidatePool.entries()) {
      poolSize++;
      final long minutes = Duration.between(entry.enqueuedAt(), now).toMinutes();
      if (minutes < 1) {
        underOne++;
      } else if (minutes < 5) {
        oneToFive++;
      } else if (minutes < 15) {
        fiveToFifteen++;
      } else {
        overFifteen++;
      }
      for (String interest : entry.interests()) {
        interestCounts.merge(interest, 1L, Long::sum);
      }
    }
    final List<InterestCount> topInterests =
        interestCounts.entrySet().stream()
            .sorted(
                Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                    .thenComparing(Map.Entry.comparingByKey()))
            .limit(TOP_INTERESTS)
            .map(entry -> new InterestCount(entry.getKey(), entry.getValue()))
            .toList();
    return new MatchmakingStatsResponse(
        poolSize,
        proposalRepository.liveCount(),
        presenceRegistry.onlineCount(),
        new WaitTimeDistribution(underOne, oneToFive, fiveToFifteen, overFifteen),
        topInterests,
        new Limits(
            properties.batchSize(),
            properties.matchLimitPerSweep(),
            properties.proposalTtl().toSeconds(),
            properties.sweepInterval().toMillis()),
        now.toString());
  }
}
