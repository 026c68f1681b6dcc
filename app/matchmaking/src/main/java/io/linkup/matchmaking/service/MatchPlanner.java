/*
 * どこで: Matchmaking サービス層
 * 何を: sweep のバッチから貪欲法でペア候補を組む
 */
package io.linkup.matchmaking.service;

import io.linkup.matchmaking.model.MatchPair;
import io.linkup.matchmaking.model.SearchingUser;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * 役割: 古い順に並んだバッチから互換なペアを選ぶ。
 *
 * <p>動作: 未ペアの A ごとに、A より後ろで最初に互換な未ペア B を採用する (スコアリングなし)。
 * maxPairs 件に達した時点で打ち切る。除外の期限は now で判定する。状態は持たず、pool にも触れない。
 */
@Component
public class MatchPlanner {

  public List<MatchPair> plan(List<SearchingUser> batch, int maxPairs, Instant now) {
    final List<MatchPair> pairs = new ArrayList<>();
    if (maxPairs <= 0) {
      return pairs;
    }
    final boolean[] paired = new boolean[batch.size()];
    for (int i = 0; i < batch.size() && pairs.size() < maxPairs; i++) {
      if (paired[i]) {
        continue;
      }
      final SearchingUser candidate = batch.get(i);
      for (int j = i + 1; j < batch.size(); j++) {
        if (paired[j]) {
          continue;
        }
        final SearchingUser other = batch.get(j);
        if (candidate.isCompatibleWith(other, now)) {
          paired[i] = true;
          paired[j] = true;
          pairs.add(new MatchPair(candidate, other, candidate.sharedInterests(other)));
          break;
        }
      }
    }
    return pairs;
  }
}
