/*
 * どこで: Matchmaking ドメインモデル
 * 何を: Proposal が終端に至った理由を定義する
 */
package io.linkup.matchmaking.model;

public enum ProposalResolution {
  MUTUAL_ACCEPT,
  DECLINED,
  DISCONNECTED,
  TIMED_OUT
}
