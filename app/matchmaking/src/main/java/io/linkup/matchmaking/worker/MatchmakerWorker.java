package io.linkup.matchmaking.worker;

import io.linkup.matchmaking.presence.PresenceRegistry;
import io.linkup.matchmaking.repository.CandidatePool;
import io.linkup.matchmaking.repository.ProposalRepository;
import io.linkup.matchmaking.service.MatchSweepService;
import io.linkup.matchmaking.service.MatchmakingMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "matchmaking.sweep-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class MatchmakerWorker {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakerWorker.class);

  private final MatchSweepService sweepService;
  private final CandidatePool candidatePool;
  private final ProposalRepository proposalRepository;
  private final PresenceRegistry presenceRegistry;
  private final MatchmakingMetrics metrics;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${matchmaking.sweep-interval}")
  public void run() {
    try {
      sweepService.sweep();
    } catch (RuntimeException ex) {
      logger.warn("matchmaker sweep failed", ex);
      metrics.recordSweepError("sweep_loop");
    }
    updateGauges();
  }

  private void updateGauges() {
    try {
      metrics.updatePoolSize(candidatePool.size());
      metrics.updateOldestPoolAge(
          candidatePool
              .oldestEnqueuedAt()
              .map(oldest -> Duration.between(oldest, Instant.now(clock)).toSeconds())
              .orElse(0L));
      metrics.updateOnlineUsers(presenceRegistry.onlineCount());
      metrics.updateLiveProposals(proposalRepository.liveCount());
    } catch (RuntimeException ex) {
      logger.warn("matchmaker gauge update failed", ex);
      metrics.recordSweepError("gauge_update");
    }
  }
}
