package io.linkup.matchmaking.delivery.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchRejectedEvent(String proposalId, String reason, String rejectedBy) {}
