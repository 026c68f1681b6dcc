/*
 * どこで: Matchmaking 配信
 * 何を: Presence Registry 経由でセッションへイベントを送る
 * なぜ: 配信の遅延/失敗を状態遷移から切り離すため
 */
package io.linkup.matchmaking.delivery;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.linkup.matchmaking.config.DeliveryConfig;
import io.linkup.matchmaking.config.MatchmakingProperties;
import io.linkup.matchmaking.presence.PresenceRegistry;
import io.linkup.matchmaking.presence.SessionHandle;
import io.linkup.matchmaking.service.MatchmakingMetrics;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Registry/Executor/Metrics は Spring 管理の共有 Bean")
public class PresenceMatchEventDelivery implements MatchEventDelivery {

  private static final Logger logger = LoggerFactory.getLogger(PresenceMatchEventDelivery.class);

  private final PresenceRegistry presenceRegistry;
  private final Executor deliveryExecutor;
  private final MatchmakingMetrics metrics;
  private final Duration deliveryTimeout;

  public PresenceMatchEventDelivery(
      PresenceRegistry presenceRegistry,
      @Qualifier(DeliveryConfig.DELIVERY_EXECUTOR) Executor deliveryExecutor,
      MatchmakingMetrics metrics,
      MatchmakingProperties properties) {
    this.presenceRegistry = presenceRegistry;
    this.deliveryExecutor = deliveryExecutor;
    this.metrics = metrics;
    this.deliveryTimeout = properties.deliveryTimeout();
  }

  @Override
  public void deliver(String userId, String eventName, Object payload) {
    final Optional<SessionHandle> handle = presenceRegistry.find(userId);
    if (handle.isEmpty()) {
      logger.debug("match event skipped offline userId={} event={}", userId, eventName);
      metrics.recordDelivery("skipped_offline");
      return;
    }
    final SessionHandle session = handle.get();
    try {
      CompletableFuture.runAsync(() -> session.channel().send(eventName, payload), deliveryExecutor)
          .orTimeout(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS)
          .whenComplete((ignored, ex) -> onComplete(session, eventName, ex));
    } catch (RejectedExecutionException ex) {
      logger.warn(
          "match event rejected by executor userId={} event={}", userId, eventName, ex);
      metrics.recordDelivery("rejected");
    }
  }

  private void onComplete(SessionHandle session, String eventName, Throwable ex) {
    if (ex == null) {
      metrics.recordDelivery("delivered");
      return;
    }
    final Throwable cause = ex instanceof CompletionException && ex.getCause() != null
        ? ex.getCause()
        : ex;
    if (cause instanceof TimeoutException) {
      logger.warn(
          "match event delivery timed out userId={} sessionId={} event={} timeout={}",
          session.userId(),
          session.sessionId(),
          eventName,
          deliveryTimeout);
      metrics.recordDelivery("timeout");
      return;
    }
    logger.warn(
        "match event delivery failed userId={} sessionId={} event={}",
        session.userId(),
        session.sessionId(),
        eventName,
        cause);
    metrics.recordDelivery("failed");
  }
}
