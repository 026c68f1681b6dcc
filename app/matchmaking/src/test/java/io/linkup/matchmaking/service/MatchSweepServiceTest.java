package io.linkup.matchmaking.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.linkup.matchmaking.config.MatchmakingProperties;
import io.linkup.matchmaking.model.MatchPair;
import io.linkup.matchmaking.model.ProposalSnapshot;
import io.linkup.matchmaking.model.SearchCriteria;
import io.linkup.matchmaking.model.SearchingUser;
import io.linkup.matchmaking.repository.CandidatePool;
import io.linkup.matchmaking.support.MatchmakingFixture;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MatchSweepServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void sweepCreatesProposalsAndLeavesUnpairedQueued() {
    final MatchmakingFixture fixture = new MatchmakingFixture(false);
    fixture.service.startSearch("a", List.of("music"), null);
    fixture.service.startSearch("b", List.of("music"), null);
    fixture.service.startSearch("c", List.of("music"), null);

    final SweepResult result = fixture.sweepService.sweep();

    assertThat(result.scanned()).isEqualTo(3);
    assertThat(result.created()).isEqualTo(1);
    assertThat(fixture.pool.find("c")).isPresent();
    assertThat(fixture.service.currentProposal("a")).isPresent();
    assertThat(fixture.liveProposalOf("a").counterpartOf("a")).isEqualTo("b");
    assertThat(fixture.scheduledExpiries).hasSize(1);
    assertThat(
            fixture.meterRegistry.get("mm.proposal.total").tag("result", "created").counter().count())
        .isEqualTo(1.0);
    assertThat(fixture.meterRegistry.get("mm.time_to_match").timer().count()).isEqualTo(2L);
  }

  @Test
  void sweepWithFewerThanTwoCandidatesDoesNothing() {
    final MatchmakingFixture fixture = new MatchmakingFixture(false);
    fixture.service.startSearch("a", List.of("music"), null);

    final SweepResult result = fixture.sweepService.sweep();

    assertThat(result).isEqualTo(new SweepResult(1, 0, 0, 0));
    assertThat(fixture.pool.size()).isEqualTo(1);
  }

  @Test
  void sweepHonorsMatchLimit() {
    final CandidatePool pool = mock(CandidatePool.class);
    final MatchmakingService service = mock(MatchmakingService.class);
    final MatchmakingMetrics metrics = mock(MatchmakingMetrics.class);
    final List<SearchingUser> batch =
        List.of(user("a", 1), user("b", 2), user("c", 3), user("d", 4), user("e", 5), user("f", 6));
    when(pool.snapshot(100)).thenReturn(batch);
    when(service.claim(any(MatchPair.class))).thenReturn(Optional.of(mock(ProposalSnapshot.class)));
    final MatchSweepService sweepService =
        new MatchSweepService(
            pool,
            new MatchPlanner(),
            service,
            metrics,
            withMatchLimit(MatchmakingFixture.properties(false), 2),
            CLOCK);

    final SweepResult result = sweepService.sweep();

    assertThat(result.planned()).isEqualTo(2);
    assertThat(result.created()).isEqualTo(2);
    verify(service, times(2)).claim(any(MatchPair.class));
  }

  @Test
  void pairFailureIsIsolated() {
    final CandidatePool pool = mock(CandidatePool.class);
    final MatchmakingService service = mock(MatchmakingService.class);
    final MatchmakingMetrics metrics = mock(MatchmakingMetrics.class);
    when(pool.snapshot(100)).thenReturn(List.of(user("a", 1), user("b", 2), user("c", 3), user("d", 4)));
    when(service.claim(any(MatchPair.class)))
        .thenThrow(new IllegalStateException("boom"))
        .thenReturn(Optional.of(mock(ProposalSnapshot.class)));
    final MatchSweepService sweepService =
        new MatchSweepService(
            pool,
            new MatchPlanner(),
            service,
            metrics,
            MatchmakingFixture.properties(false),
            CLOCK);

    final SweepResult result = sweepService.sweep();

    assertThat(result.created()).isEqualTo(1);
    assertThat(result.aborted()).isEqualTo(1);
    verify(metrics).recordSweepError("pair_claim");
    verify(service, times(2)).claim(any(MatchPair.class));
  }

  @Test
  void claimAbortsWhenPlannedEntryWasReplaced() {
    final MatchmakingFixture fixture = new MatchmakingFixture(false);
    final SearchingUser a = fixture.service.startSearch("a", List.of("music"), null);
    final SearchingUser b = fixture.service.startSearch("b", List.of("music"), null);
    fixture.service.cancelSearch("b");
    fixture.service.startSearch("b", List.of("art"), null);

    final Optional<ProposalSnapshot> claimed =
        fixture.service.claim(new MatchPair(a, b, Set.of("music")));

    assertThat(claimed).isEmpty();
    assertThat(fixture.pool.find("a")).contains(a);
    assertThat(fixture.pool.find("b")).isPresent();
    assertThat(fixture.delivery.all()).isEmpty();
  }

  @Test
  void emptyPlanSkipsClaims() {
    final CandidatePool pool = mock(CandidatePool.class);
    final MatchmakingService service = mock(MatchmakingService.class);
    when(pool.snapshot(100)).thenReturn(List.of());
    final MatchSweepService sweepService =
        new MatchSweepService(
            pool,
            new MatchPlanner(),
            service,
            mock(MatchmakingMetrics.class),
            MatchmakingFixture.properties(false),
            CLOCK);

    sweepService.sweep();

    verify(service, never()).claim(any());
  }

  private static SearchingUser user(String userId, long sequence) {
    return new SearchingUser(userId, SearchCriteria.of(List.of("music"), null), NOW, sequence);
  }

  private static MatchmakingProperties withMatchLimit(
      MatchmakingProperties base, int limit) {
    return new MatchmakingProperties(
        base.batchSize(),
        base.sweepInterval(),
        base.proposalTtl(),
        base.autoRequeueOnRejection(),
        limit,
        base.sweepEnabled(),
        base.deliveryTimeout(),
        base.terminalRetention(),
        base.retentionInterval(),
        base.lockStripes(),
        base.requeueExclusion());
  }
}
