/*
 * どこで: Matchmaking Repository 層
 * 何を: Candidate Pool のインメモリ実装
 * なぜ: userId 索引と古い順の走査を pool 全体ロックなしで両立するため
 */
package io.linkup.matchmaking.repository;

import io.linkup.matchmaking.api.MatchmakingException;
import io.linkup.matchmaking.model.SearchCriteria;
import io.linkup.matchmaking.model.SearchingUser;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCandidatePool implements CandidatePool {

  private static final Comparator<SearchingUser> OLDEST_FIRST =
      Comparator.comparing(SearchingUser::enqueuedAt)
          .thenComparingLong(SearchingUser::sequence);

  private final ConcurrentMap<String, SearchingUser> byUser = new ConcurrentHashMap<>();
  private final ConcurrentSkipListSet<SearchingUser> byAge =
      new ConcurrentSkipListSet<>(OLDEST_FIRST);
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  public InMemoryCandidatePool(Clock clock) {
    this.clock = clock;
  }

  @Override
  public SearchingUser enqueue(
      String userId, SearchCriteria criteria, Set<String> excludedPeers, Duration exclusionWindow) {
    if (userId == null || userId.isBlank()) {
      throw MatchmakingException.invalidCriteria("userId is required");
    }
    if (criteria == null || !criteria.hasInterests()) {
      throw MatchmakingException.invalidCriteria("at least one interest is required");
    }
    final Instant now = Instant.now(clock);
    final Instant excludedUntil =
        exclusionWindow == null || exclusionWindow.isZero() || exclusionWindow.isNegative()
            ? null
            : now.plus(exclusionWindow);
    final SearchingUser entry =
        new SearchingUser(
            userId, criteria, now, sequence.incrementAndGet(), excludedPeers, excludedUntil);
    if (byUser.putIfAbsent(userId, entry) != null) {
      throw MatchmakingException.alreadyQueued(userId);
    }
    byAge.add(entry);
    return entry;
  }

  @Override
  public boolean dequeue(String userId) {
    final SearchingUser removed = byUser.remove(userId);
    if (removed == null) {
      return false;
    }
    byAge.remove(removed);
    return true;
  }

  @Override
  public boolean remove(SearchingUser entry) {
    if (!byUser.remove(entry.userId(), entry)) {
      return false;
    }
    byAge.remove(entry);
    return true;
  }

  @Override
  public boolean restore(SearchingUser entry) {
    if (byUser.putIfAbsent(entry.userId(), entry) != null) {
      return false;
    }
    byAge.add(entry);
    return true;
  }

  @Override
  public Optional<SearchingUser> find(String userId) {
    return Optional.ofNullable(byUser.get(userId));
  }

  @Override
  public List<SearchingUser> snapshot(int limit) {
    final List<SearchingUser> batch = new ArrayList<>(Math.max(0, Math.min(limit, 1024)));
    final Iterator<SearchingUser> iterator = byAge.iterator();
    while (batch.size() < limit && iterator.hasNext()) {
      final SearchingUser entry = iterator.next();
      // 索引側から既に消えたエントリ (削除処理の途中) は読み飛ばす
      if (byUser.get(entry.userId()) == entry) {
        batch.add(entry);
      }
    }
    return batch;
  }

  @Override
  public int size() {
    return byUser.size();
  }

  @Override
  public Optional<Instant> oldestEnqueuedAt() {
    for (SearchingUser entry : byAge) {
      if (byUser.get(entry.userId()) == entry) {
        return Optional.of(entry.enqueuedAt());
      }
    }
    return Optional.empty();
  }

  @Override
  public Collection<SearchingUser> entries() {
    return Collections.unmodifiableCollection(byUser.values());
  }
}
