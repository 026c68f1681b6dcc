/*
 * どこで: Matchmaking ドメインモデル
 * 何を: 検索条件 (興味セットと任意の preference) を正規化して保持する
 */
package io.linkup.matchmaking.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record SearchCriteria(Set<String> interests, MatchPreference preference) {

  public SearchCriteria {
    interests =
        interests == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(interests));
  }

  /**
   * 役割: 生の興味リストから検索条件を組み立てる。
   * 動作: 前後空白を除去し、null/空白要素と重複を落とす。順序は入力順を保つ。
   */
  public static SearchCriteria of(Collection<String> rawInterests, MatchPreference preference) {
    final Set<String> normalized = new LinkedHashSet<>();
    if (rawInterests != null) {
      for (String interest : rawInterests) {
        if (interest == null || interest.isBlank()) {
          continue;
        }
        normalized.add(interest.trim());
      }
    }
    return new SearchCriteria(normalized, preference);
  }

  public boolean hasInterests() {
    return !interests.isEmpty();
  }
}
