/*
 * どこで: Matchmaking API
 * 何を: 呼び出し側で是正可能なドメインエラーを表現する
 */
package io.linkup.matchmaking.api;

public class MatchmakingException extends RuntimeException {

  private final MatchmakingErrorCode code;

  public MatchmakingException(MatchmakingErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public MatchmakingErrorCode code() {
    return code;
  }

  public static MatchmakingException invalidCriteria(String message) {
    return new MatchmakingException(MatchmakingErrorCode.INVALID_CRITERIA, message);
  }

  public static MatchmakingException alreadyQueued(String userId) {
    return new MatchmakingException(
        MatchmakingErrorCode.ALREADY_QUEUED, "user already queued: " + userId);
  }

  public static MatchmakingException alreadyInProposal(String userId) {
    return new MatchmakingException(
        MatchmakingErrorCode.ALREADY_IN_PROPOSAL, "user has a live proposal: " + userId);
  }

  public static MatchmakingException proposalNotFound(String proposalId) {
    return new MatchmakingException(
        MatchmakingErrorCode.PROPOSAL_NOT_FOUND, "proposal not found: " + proposalId);
  }

  public static MatchmakingException notAParticipant(String proposalId, String userId) {
    return new MatchmakingException(
        MatchmakingErrorCode.NOT_A_PARTICIPANT,
        "user " + userId + " is not a participant of proposal " + proposalId);
  }

  public static MatchmakingException alreadyTerminal(String proposalId) {
    return new MatchmakingException(
        MatchmakingErrorCode.ALREADY_TERMINAL, "proposal already resolved: " + proposalId);
  }

  public static MatchmakingException alreadyDecided(String proposalId, String userId) {
    return new MatchmakingException(
        MatchmakingErrorCode.ALREADY_DECIDED,
        "user " + userId + " already decided on proposal " + proposalId);
  }
}
