/*
 * どこで: Matchmaking 配信
 * 何を: NATS 無効時にイベント送信を模擬するチャネルを作る
 * なぜ: ローカル起動やテストで外部依存なしに配信経路を動かすため
 */
package io.linkup.matchmaking.delivery;

import io.linkup.matchmaking.presence.SessionChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LocalSessionChannelFactory implements SessionChannelFactory {

  private static final Logger logger = LoggerFactory.getLogger(LocalSessionChannelFactory.class);

  @Override
  public SessionChannel open(String userId, String sessionId) {
    return (eventName, payload) ->
        // 実送信は行わず、ログに残すだけとする
        logger.info(
            "match event simulated send userId={} sessionId={} event={}",
            userId,
            sessionId,
            eventName);
  }
}
