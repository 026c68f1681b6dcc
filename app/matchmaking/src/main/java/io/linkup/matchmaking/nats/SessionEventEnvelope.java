/*
 * どこで: Matchmaking NATS 連携
 * 何を: ゲートウェイへ中継するイベントの封筒を定義する
 */
package io.linkup.matchmaking.nats;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionEventEnvelope(
    String eventId,
    String eventName,
    String occurredAt,
    String userId,
    String sessionId,
    String traceId,
    Object payload) {}
