/*
 * どこで: Matchmaking NATS 初期化
 * 何を: セッション宛てイベントの JetStream stream を起動時に作成/更新する
 * なぜ: publish 前に stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package io.linkup.matchmaking.nats;

import io.linkup.matchmaking.config.MatchmakingNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class MatchmakingJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakingJetStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final MatchmakingNatsProperties properties;

  @PostConstruct
  public void start() {
    ensureSettings();
    try {
      final StreamConfiguration streamConfiguration =
          StreamConfiguration.builder()
              .name(properties.stream())
              .subjects(properties.streamSubjects())
              .duplicateWindow(properties.duplicateWindow())
              .build();
      upsertStream(connection.jetStreamManagement(), streamConfiguration);
      logger.info(
          "matchmaking session stream ensured stream={} subjects={} duplicateWindow={}",
          properties.stream(),
          properties.streamSubjects(),
          properties.duplicateWindow());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream stream", ex);
    }
  }

  private void upsertStream(JetStreamManagement management, StreamConfiguration configuration)
      throws IOException, JetStreamApiException {
    try {
      management.updateStream(configuration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      management.addStream(configuration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private void ensureSettings() {
    if (properties.subjectPrefix() == null || properties.subjectPrefix().isBlank()) {
      throw new IllegalStateException("matchmaking.nats.subject-prefix must be set");
    }
    if (properties.stream() == null || properties.stream().isBlank()) {
      throw new IllegalStateException("matchmaking.nats.stream must be set");
    }
    if (properties.duplicateWindow() == null
        || properties.duplicateWindow().isZero()
        || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("matchmaking.nats.duplicate-window must be positive");
    }
  }
}
