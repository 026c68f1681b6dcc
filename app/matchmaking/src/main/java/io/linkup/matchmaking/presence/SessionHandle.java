package io.linkup.matchmaking.presence;

import java.time.Instant;

public record SessionHandle(
    String userId, String sessionId, SessionChannel channel, Instant connectedAt) {}
