/*
 * どこで: Matchmaking 保守ワーカー
 * 何を: 保持期間を過ぎた終端 proposal を定期的に削除する
 * なぜ: 終端 proposal を一定時間参照可能にしつつメモリを解放するため
 */
package io.linkup.matchmaking.worker;

import io.linkup.matchmaking.config.MatchmakingProperties;
import io.linkup.matchmaking.repository.ProposalRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProposalRetentionWorker {

  private static final Logger logger = LoggerFactory.getLogger(ProposalRetentionWorker.class);

  private final ProposalRepository proposalRepository;
  private final MatchmakingProperties properties;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${matchmaking.retention-interval}")
  public void run() {
    final Instant cutoff = Instant.now(clock).minus(properties.terminalRetention());
    final int purged = proposalRepository.purgeTerminalBefore(cutoff);
    if (purged > 0) {
      logger.info("terminal proposals purged count={} cutoff={}", purged, cutoff);
    }
  }
}
