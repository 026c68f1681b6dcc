package io.linkup.matchmaking.delivery.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 自動再投入を知らせる。reason は直前 proposal の終了理由 (小文字)。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchSearchingEvent(String reason) {}
