/*
 * どこで: Matchmaking Repository 層
 * 何を: Proposal テーブルの保存と参照を抽象化する
 */
package io.linkup.matchmaking.repository;

import io.linkup.matchmaking.model.Proposal;
import java.time.Instant;
import java.util.Optional;

public interface ProposalRepository {

  /** 参加者の live 索引も同時に張る。参加者のロック保持が前提。 */
  void save(Proposal proposal);

  Optional<Proposal> findById(String proposalId);

  Optional<Proposal> findLiveByUser(String userId);

  boolean hasLiveProposal(String userId);

  /** 終端へ遷移した proposal の live 索引を外す。 */
  void markTerminal(Proposal proposal);

  int liveCount();

  /** cutoff より前に終端した proposal を削除し、件数を返す。 */
  int purgeTerminalBefore(Instant cutoff);
}
