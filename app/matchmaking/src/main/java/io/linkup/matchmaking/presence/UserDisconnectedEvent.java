/*
 * どこで: Presence
 * 何を: 実効的な切断 (登録解除) を通知する Spring イベント
 */
package io.linkup.matchmaking.presence;

public record UserDisconnectedEvent(String userId, String sessionId) {}
