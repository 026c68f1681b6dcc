/*
 * どこで: Matchmaking 設定
 * 何を: セッション宛てイベントの subject/stream 設定を保持する
 */
package io.linkup.matchmaking.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "matchmaking.nats")
public record MatchmakingNatsProperties(
    @NotBlank String subjectPrefix, @NotBlank String stream, @NotNull Duration duplicateWindow) {

  /** セッション単位の publish 先。 */
  public String subjectFor(String sessionId) {
    return subjectPrefix + "." + sessionId;
  }

  /** stream が捕捉する subject (全セッション)。 */
  public String streamSubjects() {
    return subjectPrefix + ".>";
  }
}
