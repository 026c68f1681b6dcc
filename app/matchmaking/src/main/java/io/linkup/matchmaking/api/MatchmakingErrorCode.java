/*
 * どこで: Matchmaking API
 * 何を: ドメインエラーの種類を定義する
 */
package io.linkup.matchmaking.api;

public enum MatchmakingErrorCode {
  INVALID_CRITERIA,
  ALREADY_QUEUED,
  ALREADY_IN_PROPOSAL,
  NOT_A_PARTICIPANT,
  ALREADY_TERMINAL,
  ALREADY_DECIDED,
  PROPOSAL_NOT_FOUND
}
