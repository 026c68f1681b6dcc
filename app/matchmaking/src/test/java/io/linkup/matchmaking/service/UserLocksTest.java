package io.linkup.matchmaking.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class UserLocksTest {

  @Test
  void withUsersToleratesSameStripe() {
    // stripe 1 本なら全ユーザーが同じロックになる
    final UserLocks locks = new UserLocks(1);

    final String result = locks.withUsers(List.of("a", "b"), () -> "ok");

    assertThat(result).isEqualTo("ok");
    assertThat(locks.withUser("a", () -> "again")).isEqualTo("again");
  }

  @Test
  void releasesLocksWhenActionThrows() {
    final UserLocks locks = new UserLocks(4);

    assertThatThrownBy(
            () ->
                locks.withUsers(
                    List.of("a", "b"),
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(locks.withUsers(List.of("b", "a"), () -> true)).isTrue();
  }

  @Test
  void opposingLockOrderDoesNotDeadlock() throws Exception {
    final UserLocks locks = new UserLocks(64);
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      final Future<?> forward =
          executor.submit(
              () -> {
                for (int i = 0; i < 10_000; i++) {
                  locks.withUsers(List.of("a", "b"), () -> null);
                }
              });
      final Future<?> backward =
          executor.submit(
              () -> {
                for (int i = 0; i < 10_000; i++) {
                  locks.withUsers(List.of("b", "a"), () -> null);
                }
              });
      forward.get(10, TimeUnit.SECONDS);
      backward.get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
  }
}
