/*
 * どこで: Matchmaking API レスポンス DTO
 * 何を: キュー統計の応答を定義する
 */
package io.linkup.matchmaking.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchmakingStatsResponse(
    int poolSize,
    int liveProposals,
    int onlineUsers,
    WaitTimeDistribution waitTimeDistribution,
    List<InterestCount> topInterests,
    Limits limits,
    String generatedAt) {

  public MatchmakingStatsResponse {
    topInterests = List.copyOf(topInterests);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record WaitTimeDistribution(
      long underOneMinute, long oneToFiveMinutes, long fiveToFifteenMinutes, long overFifteenMinutes) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record InterestCount(String interest, long count) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Limits(
      int batchSize, int matchLimitPerSweep, long proposalTtlSeconds, long sweepIntervalMillis) {}
}
