/*
 * どこで: Matchmaking ドメインモデル
 * 何を: Proposal のある時点の不変ビューを表現する
 */
package io.linkup.matchmaking.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record ProposalSnapshot(
    String proposalId,
    List<String> participants,
    ProposalState state,
    Instant createdAt,
    Instant expiresAt,
    Map<String, Decision> decisions,
    Set<String> sharedInterests,
    ProposalResolution resolution,
    String resolvedBy,
    Instant resolvedAt,
    String chatChannelId) {

  public ProposalSnapshot {
    participants = List.copyOf(participants);
    decisions = Map.copyOf(decisions);
    sharedInterests = Collections.unmodifiableSet(new LinkedHashSet<>(sharedInterests));
  }

  public boolean isParticipant(String userId) {
    return participants.contains(userId);
  }

  public String counterpartOf(String userId) {
    if (participants.get(0).equals(userId)) {
      return participants.get(1);
    }
    if (participants.get(1).equals(userId)) {
      return participants.get(0);
    }
    throw new IllegalArgumentException("not a participant: " + userId);
  }

  public Decision decisionOf(String userId) {
    return decisions.getOrDefault(userId, Decision.UNDECIDED);
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }
}
