/*
 * どこで: Matchmaking NATS 連携
 * 何を: セッション宛てイベントを JetStream へ publish するチャネルを作る
 * なぜ: ソケットを保持するゲートウェイへ subject 経由で中継するため
 */
package io.linkup.matchmaking.nats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.linkup.common.TraceIds;
import io.linkup.matchmaking.config.MatchmakingNatsProperties;
import io.linkup.matchmaking.delivery.SessionChannelFactory;
import io.linkup.matchmaking.presence.SessionChannel;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JetStream/ObjectMapper は Spring 管理の共有 Bean")
public class NatsSessionChannelFactory implements SessionChannelFactory {

  private final JetStream jetStream;
  private final MatchmakingNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public NatsSessionChannelFactory(
      JetStream jetStream,
      MatchmakingNatsProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.jetStream = jetStream;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public SessionChannel open(String userId, String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("sessionId is required");
    }
    final String subject = properties.subjectFor(sessionId);
    return (eventName, payload) -> publish(subject, userId, sessionId, eventName, payload);
  }

  private void publish(
      String subject, String userId, String sessionId, String eventName, Object payload) {
    final String eventId = UUID.randomUUID().toString();
    final SessionEventEnvelope envelope =
        new SessionEventEnvelope(
            eventId,
            eventName,
            Instant.now(clock).toString(),
            userId,
            sessionId,
            TraceIds.currentOrNew(),
            payload);
    final Headers headers = new Headers();
    headers.add("Nats-Msg-Id", eventId);
    try {
      jetStream.publish(subject, headers, objectMapper.writeValueAsBytes(envelope));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize match event " + eventName, ex);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish match event " + eventName, ex);
    }
  }
}
