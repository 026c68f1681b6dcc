/*
 * どこで: Matchmaking Repository 層
 * 何を: 検索中ユーザー (Candidate Pool) の保存と参照を抽象化する
 */
package io.linkup.matchmaking.repository;

import io.linkup.matchmaking.model.SearchCriteria;
import io.linkup.matchmaking.model.SearchingUser;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface CandidatePool {

  /**
   * 役割: ユーザーを pool へ追加する。
   * 動作: 興味が空なら INVALID_CRITERIA、既に存在すれば ALREADY_QUEUED。
   * 前提: 呼び出し側が userId のロックを保持している。
   */
  default SearchingUser enqueue(String userId, SearchCriteria criteria) {
    return enqueue(userId, criteria, Set.of(), Duration.ZERO);
  }

  /** excludedPeers とは投入時刻から exclusionWindow の間だけペアにしない。 */
  SearchingUser enqueue(
      String userId, SearchCriteria criteria, Set<String> excludedPeers, Duration exclusionWindow);

  boolean dequeue(String userId);

  /** 計画時と同一のエントリが残っている場合のみ取り除く。 */
  boolean remove(SearchingUser entry);

  /**
   * remove したエントリを投入時刻・順序を保ったまま戻す。同じユーザーが既に居れば何もしない。
   * 前提: 呼び出し側が userId のロックを保持している。
   */
  boolean restore(SearchingUser entry);

  Optional<SearchingUser> find(String userId);

  /** enqueuedAt 昇順 (同時刻は投入順) で最大 limit 件。取り除かない。 */
  List<SearchingUser> snapshot(int limit);

  int size();

  Optional<Instant> oldestEnqueuedAt();

  Collection<SearchingUser> entries();
}
