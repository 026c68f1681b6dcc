package io.linkup.matchmaking.delivery.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchConfirmedEvent(String proposalId, String chatChannelId, String counterpart) {}
