/*
 * どこで: Matchmaking サービス層
 * 何を: proposal の期限到達時に実行するタスクを登録する
 */
package io.linkup.matchmaking.service;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProposalExpiryScheduler {

  private static final Logger logger = LoggerFactory.getLogger(ProposalExpiryScheduler.class);

  private final TaskScheduler taskScheduler;

  public void schedule(String proposalId, Instant expiresAt, Runnable expiry) {
    taskScheduler.schedule(
        () -> {
          try {
            expiry.run();
          } catch (RuntimeException ex) {
            logger.warn("proposal expiry task failed proposalId={}", proposalId, ex);
          }
        },
        expiresAt);
  }
}
