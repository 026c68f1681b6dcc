/*
 * どこで: Matchmaking サービス層
 * 何を: userId 単位の排他をストライプ化したロックで提供する
 * なぜ: pool 全体ロックを避けつつ、ペア操作をデッドロックなしで直列化するため
 */
package io.linkup.matchmaking.service;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import io.linkup.matchmaking.config.MatchmakingProperties;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 役割: 1 ユーザー / 複数ユーザーのロック区間を提供する。
 *
 * <p>動作: 複数ユーザーは {@link Striped#bulkGet} の固定順で取得するため、並行するペア操作同士でも
 * デッドロックしない。
 *
 * <p>前提: ロック区間の中で別のロック区間を開かないこと。
 */
@Component
public class UserLocks {

  private final Striped<Lock> stripes;

  @Autowired
  public UserLocks(MatchmakingProperties properties) {
    this(properties.lockStripes());
  }

  @VisibleForTesting
  UserLocks(int stripeCount) {
    this.stripes = Striped.lock(stripeCount);
  }

  public <T> T withUser(String userId, Supplier<T> action) {
    final Lock lock = stripes.get(userId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public <T> T withUsers(Collection<String> userIds, Supplier<T> action) {
    final List<Lock> acquired = new ArrayList<>();
    try {
      for (Lock lock : stripes.bulkGet(userIds)) {
        lock.lock();
        acquired.add(lock);
      }
      return action.get();
    } finally {
      for (int i = acquired.size() - 1; i >= 0; i--) {
        acquired.get(i).unlock();
      }
    }
  }
}
