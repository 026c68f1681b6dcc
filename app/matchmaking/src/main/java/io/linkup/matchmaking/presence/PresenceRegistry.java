/*
 * どこで: Presence
 * 何を: userId から現在のセッションハンドルを引く登録簿
 * なぜ: 配信時の O(1) 参照と、切断の一元的な通知のため
 */
package io.linkup.matchmaking.presence;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 役割: オンラインユーザーのセッションを保持する。
 *
 * <p>動作: register は last-writer-wins。登録解除が実際に起きた時だけ {@link UserDisconnectedEvent}
 * を publish する。
 */
@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ApplicationEventPublisher は Spring 管理の共有 Bean")
public class PresenceRegistry {

  private static final Logger logger = LoggerFactory.getLogger(PresenceRegistry.class);

  private final ConcurrentMap<String, SessionHandle> sessions = new ConcurrentHashMap<>();
  private final ApplicationEventPublisher eventPublisher;

  public PresenceRegistry(ApplicationEventPublisher eventPublisher) {
    this.eventPublisher = eventPublisher;
  }

  public void register(String userId, SessionHandle handle) {
    final SessionHandle previous = sessions.put(userId, handle);
    if (previous != null && !previous.sessionId().equals(handle.sessionId())) {
      logger.info(
          "presence session replaced userId={} previousSessionId={} sessionId={}",
          userId,
          previous.sessionId(),
          handle.sessionId());
    }
  }

  /** 冪等。登録が無ければ何もしない。 */
  public boolean unregister(String userId) {
    final SessionHandle removed = sessions.remove(userId);
    if (removed == null) {
      return false;
    }
    eventPublisher.publishEvent(new UserDisconnectedEvent(userId, removed.sessionId()));
    return true;
  }

  /** 現在のハンドルが sessionId と一致する場合のみ解除する。古いソケットの切断は無視される。 */
  public boolean unregister(String userId, String sessionId) {
    final SessionHandle current = sessions.get(userId);
    if (current == null || !current.sessionId().equals(sessionId)) {
      logger.debug("presence stale disconnect ignored userId={} sessionId={}", userId, sessionId);
      return false;
    }
    if (!sessions.remove(userId, current)) {
      return false;
    }
    eventPublisher.publishEvent(new UserDisconnectedEvent(userId, sessionId));
    return true;
  }

  public boolean isOnline(String userId) {
    return sessions.containsKey(userId);
  }

  public Optional<SessionHandle> find(String userId) {
    return Optional.ofNullable(sessions.get(userId));
  }

  public int onlineCount() {
    return sessions.size();
  }
}
