/*
 * どこで: Matchmaking API レスポンス DTO
 * 何を: 検索開始 API の成功応答を定義する
 */
package io.linkup.matchmaking.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.linkup.matchmaking.model.SearchingUser;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchResponse(String userId, String status, String enqueuedAt) {

  public static SearchResponse queued(SearchingUser entry) {
    return new SearchResponse(entry.userId(), "QUEUED", entry.enqueuedAt().toString());
  }
}
