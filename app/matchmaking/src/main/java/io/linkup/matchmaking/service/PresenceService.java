/*
 * どこで: Matchmaking サービス層
 * 何を: ゲートウェイからの接続/切断報告を Presence Registry へ反映する
 */
package io.linkup.matchmaking.service;

import io.linkup.matchmaking.delivery.SessionChannelFactory;
import io.linkup.matchmaking.presence.PresenceRegistry;
import io.linkup.matchmaking.presence.SessionHandle;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PresenceService {

  private static final Logger logger = LoggerFactory.getLogger(PresenceService.class);

  private final PresenceRegistry presenceRegistry;
  private final SessionChannelFactory channelFactory;
  private final Clock clock;

  public SessionHandle connect(String userId, String sessionId) {
    final SessionHandle handle =
        new SessionHandle(
            userId, sessionId, channelFactory.open(userId, sessionId), Instant.now(clock));
    presenceRegistry.register(userId, handle);
    logger.info("presence connected userId={} sessionId={}", userId, sessionId);
    return handle;
  }

  /** 現在のセッションと一致しない切断報告は無視する。 */
  public boolean disconnect(String userId, String sessionId) {
    final boolean removed = presenceRegistry.unregister(userId, sessionId);
    if (removed) {
      logger.info("presence disconnected userId={} sessionId={}", userId, sessionId);
    }
    return removed;
  }
}
