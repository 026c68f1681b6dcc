package io.linkup.matchmaking.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class MatchmakingMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer timeToMatchTimer;
  private final Timer sweepTimer;
  private final AtomicLong poolSize = new AtomicLong();
  private final AtomicLong oldestAge = new AtomicLong();
  private final AtomicLong onlineUsers = new AtomicLong();
  private final AtomicLong liveProposals = new AtomicLong();
  private final ConcurrentMap<String, Counter> proposalCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> sweepErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> dependencyErrorCounters = new ConcurrentHashMap<>();

  public MatchmakingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.timeToMatchTimer =
        Timer.builder("mm.time_to_match")
            .description("Time from enqueue to proposal creation")
            .register(meterRegistry);
    this.sweepTimer =
        Timer.builder("mm.sweep.duration")
            .description("Wall time of one matching sweep")
            .register(meterRegistry);
    Gauge.builder("mm.pool.size", poolSize, AtomicLong::get).register(meterRegistry);
    Gauge.builder("mm.pool.oldest_age", oldestAge, AtomicLong::get)
        .baseUnit("seconds")
        .register(meterRegistry);
    Gauge.builder("mm.presence.online", onlineUsers, AtomicLong::get).register(meterRegistry);
    Gauge.builder("mm.proposal.live", liveProposals, AtomicLong::get).register(meterRegistry);
  }

  public void updatePoolSize(long size) {
    poolSize.set(Math.max(0, size));
  }

  public void updateOldestPoolAge(long ageSeconds) {
    oldestAge.set(Math.max(0, ageSeconds));
  }

  public void updateOnlineUsers(long count) {
    onlineUsers.set(Math.max(0, count));
  }

  public void updateLiveProposals(long count) {
    liveProposals.set(Math.max(0, count));
  }

  /** result: created / confirmed / declined / disconnected / expired。 */
  public void recordProposalResult(String result) {
    proposalCounters
        .computeIfAbsent(result, key -> counter("mm.proposal.total", "result", key))
        .increment();
  }

  public void recordSweepError(String errorType) {
    sweepErrorCounters
        .computeIfAbsent(errorType, key -> counter("mm.sweep.error.total", "type", key))
        .increment();
  }

  /** result: delivered / skipped_offline / failed / timeout / rejected。 */
  public void recordDelivery(String result) {
    deliveryCounters
        .computeIfAbsent(result, key -> counter("mm.delivery.total", "result", key))
        .increment();
  }

  public void recordDependencyError(String errorType) {
    dependencyErrorCounters
        .computeIfAbsent(errorType, key -> counter("mm.dependency.error.total", "type", key))
        .increment();
  }

  public void recordTimeToMatch(Duration waited) {
    if (waited.isNegative()) {
      return;
    }
    timeToMatchTimer.record(waited);
  }

  public void recordSweepDuration(Duration elapsed) {
    sweepTimer.record(elapsed);
  }

  private Counter counter(String name, String tagKey, String tagValue) {
    return Counter.builder(name).tags(Tags.of(tagKey, tagValue)).register(meterRegistry);
  }
}
