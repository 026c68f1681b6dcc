/*
 * どこで: Matchmaking ドメインモデル
 * 何を: sweep の計画段階で組まれた 1 組の候補を表現する
 */
package io.linkup.matchmaking.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record MatchPair(SearchingUser first, SearchingUser second, Set<String> sharedInterests) {

  public MatchPair {
    sharedInterests = Collections.unmodifiableSet(new LinkedHashSet<>(sharedInterests));
  }
}
