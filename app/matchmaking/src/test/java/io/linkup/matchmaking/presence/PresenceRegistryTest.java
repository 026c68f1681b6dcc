package io.linkup.matchmaking.presence;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PresenceRegistryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  private final List<Object> events = new ArrayList<>();
  private final PresenceRegistry registry = new PresenceRegistry(events::add);

  @Test
  void registerIsLastWriterWins() {
    registry.register("a", handle("a", "s-1"));
    registry.register("a", handle("a", "s-2"));

    assertThat(registry.find("a")).hasValueSatisfying(h -> assertThat(h.sessionId()).isEqualTo("s-2"));
    assertThat(registry.onlineCount()).isEqualTo(1);
    assertThat(events).isEmpty();
  }

  @Test
  void unregisterIsIdempotentAndPublishesOnce() {
    registry.register("a", handle("a", "s-1"));

    assertThat(registry.unregister("a")).isTrue();
    assertThat(registry.unregister("a")).isFalse();

    assertThat(registry.isOnline("a")).isFalse();
    assertThat(events).containsExactly(new UserDisconnectedEvent("a", "s-1"));
  }

  @Test
  void staleSessionDisconnectIsIgnored() {
    registry.register("a", handle("a", "s-1"));
    registry.register("a", handle("a", "s-2"));

    assertThat(registry.unregister("a", "s-1")).isFalse();
    assertThat(registry.isOnline("a")).isTrue();
    assertThat(events).isEmpty();

    assertThat(registry.unregister("a", "s-2")).isTrue();
    assertThat(registry.isOnline("a")).isFalse();
    assertThat(events).containsExactly(new UserDisconnectedEvent("a", "s-2"));
  }

  @Test
  void unknownUserIsOffline() {
    assertThat(registry.isOnline("nobody")).isFalse();
    assertThat(registry.find("nobody")).isEmpty();
    assertThat(registry.unregister("nobody", "s-1")).isFalse();
  }

  private static SessionHandle handle(String userId, String sessionId) {
    return new SessionHandle(userId, sessionId, (name, payload) -> {}, NOW);
  }
}
