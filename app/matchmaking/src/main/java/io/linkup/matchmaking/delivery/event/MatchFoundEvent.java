package io.linkup.matchmaking.delivery.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchFoundEvent(
    String proposalId, String counterpart, List<String> sharedInterests, Instant expiresAt) {

  public MatchFoundEvent {
    sharedInterests = List.copyOf(sharedInterests);
  }
}
