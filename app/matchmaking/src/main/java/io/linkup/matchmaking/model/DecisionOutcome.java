/*
 * どこで: Matchmaking ドメインモデル
 * 何を: 1 回の状態遷移の前後を表現する
 */
package io.linkup.matchmaking.model;

public record DecisionOutcome(ProposalState previousState, ProposalSnapshot proposal) {

  public ProposalState state() {
    return proposal.state();
  }

  public boolean becameTerminal() {
    return !previousState.isTerminal() && proposal.isTerminal();
  }
}
