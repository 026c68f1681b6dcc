/*
 * どこで: Matchmaking ドメインモデル
 * 何を: Proposal の状態を定義する
 */
package io.linkup.matchmaking.model;

public enum ProposalState {
  PENDING(false),
  ACCEPTED_BY_ONE(false),
  CONFIRMED(true),
  REJECTED(true),
  EXPIRED(true);

  private final boolean terminal;

  ProposalState(boolean terminal) {
    this.terminal = terminal;
  }

  public boolean isTerminal() {
    return terminal;
  }
}
