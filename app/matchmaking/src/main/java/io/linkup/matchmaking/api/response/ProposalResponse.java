/*
 * どこで: Matchmaking API レスポンス DTO
 * 何を: 参加者から見た proposal の状態を定義する
 */
package io.linkup.matchmaking.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.linkup.matchmaking.model.ProposalSnapshot;
import java.util.List;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProposalResponse(
    String proposalId,
    String state,
    String counterpart,
    List<String> sharedInterests,
    String myDecision,
    String counterpartDecision,
    String createdAt,
    String expiresAt,
    String resolution,
    String resolvedBy,
    String chatChannelId) {

  public ProposalResponse {
    sharedInterests = List.copyOf(sharedInterests);
  }

  /** viewer 視点へ変換する。viewer は参加者であること。 */
  public static ProposalResponse from(ProposalSnapshot snapshot, String viewer) {
    final String counterpart = snapshot.counterpartOf(viewer);
    return new ProposalResponse(
        snapshot.proposalId(),
        snapshot.state().name(),
        counterpart,
        List.copyOf(snapshot.sharedInterests()),
        snapshot.decisionOf(viewer).name(),
        snapshot.decisionOf(counterpart).name(),
        snapshot.createdAt().toString(),
        snapshot.expiresAt().toString(),
        snapshot.resolution() == null
            ? null
            : snapshot.resolution().name().toLowerCase(Locale.ROOT),
        snapshot.resolvedBy(),
        snapshot.chatChannelId());
  }
}
