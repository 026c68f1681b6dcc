/*
 * どこで: Matchmaking ドメインモデル
 * 何を: Candidate Pool に滞在する 1 ユーザー分のエントリを表現する
 */
package io.linkup.matchmaking.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Candidate pool entry. {@code sequence} is unique per enqueue, so two entries for the same user
 * created at different times are never equal. {@code excludedPeers} only apply before {@code
 * excludedUntil}; an entry without exclusions has a null {@code excludedUntil}.
 */
public record SearchingUser(
    String userId,
    SearchCriteria criteria,
    Instant enqueuedAt,
    long sequence,
    Set<String> excludedPeers,
    Instant excludedUntil) {

  public SearchingUser {
    excludedPeers =
        excludedPeers == null || excludedUntil == null ? Set.of() : Set.copyOf(excludedPeers);
    if (excludedPeers.isEmpty()) {
      excludedUntil = null;
    }
  }

  public SearchingUser(String userId, SearchCriteria criteria, Instant enqueuedAt, long sequence) {
    this(userId, criteria, enqueuedAt, sequence, Set.of(), null);
  }

  public Set<String> interests() {
    return criteria.interests();
  }

  public MatchPreference preference() {
    return criteria.preference();
  }

  /** {@code now} 時点で両者をペアにできるか。除外は期限内のみ効く。 */
  public boolean isCompatibleWith(SearchingUser other, Instant now) {
    if (userId.equals(other.userId)) {
      return false;
    }
    if (excludes(other.userId, now) || other.excludes(userId, now)) {
      return false;
    }
    if (!MatchPreference.compatible(preference(), other.preference())) {
      return false;
    }
    for (String interest : interests()) {
      if (other.interests().contains(interest)) {
        return true;
      }
    }
    return false;
  }

  public boolean excludes(String peer, Instant now) {
    return excludedUntil != null && now.isBefore(excludedUntil) && excludedPeers.contains(peer);
  }

  /** 自分の興味の並び順で共通項を返す。 */
  public Set<String> sharedInterests(SearchingUser other) {
    final Set<String> shared = new LinkedHashSet<>(interests());
    shared.retainAll(other.interests());
    return Collections.unmodifiableSet(shared);
  }
}
