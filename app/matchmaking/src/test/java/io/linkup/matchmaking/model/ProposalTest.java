package io.linkup.matchmaking.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.linkup.matchmaking.api.MatchmakingErrorCode;
import io.linkup.matchmaking.api.MatchmakingException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ProposalTest {

  private static final Instant CREATED = Instant.parse("2026-03-01T09:00:00Z");
  private static final Instant EXPIRES = CREATED.plus(Duration.ofSeconds(120));

  @Test
  void firstAcceptMovesToAcceptedByOne() {
    final Proposal proposal = proposal();

    final DecisionOutcome outcome = proposal.decide("a", true, CREATED.plusSeconds(5));

    assertThat(outcome.previousState()).isEqualTo(ProposalState.PENDING);
    assertThat(outcome.state()).isEqualTo(ProposalState.ACCEPTED_BY_ONE);
    assertThat(outcome.becameTerminal()).isFalse();
    assertThat(outcome.proposal().decisionOf("a")).isEqualTo(Decision.ACCEPT);
    assertThat(outcome.proposal().decisionOf("b")).isEqualTo(Decision.UNDECIDED);
  }

  @Test
  void secondAcceptConfirms() {
    final Proposal proposal = proposal();
    proposal.decide("a", true, CREATED.plusSeconds(5));

    final DecisionOutcome outcome = proposal.decide("b", true, CREATED.plusSeconds(6));

    assertThat(outcome.state()).isEqualTo(ProposalState.CONFIRMED);
    assertThat(outcome.becameTerminal()).isTrue();
    assertThat(outcome.proposal().resolution()).isEqualTo(ProposalResolution.MUTUAL_ACCEPT);
    assertThat(outcome.proposal().resolvedAt()).isEqualTo(CREATED.plusSeconds(6));
  }

  @Test
  void rejectEndsImmediately() {
    final Proposal proposal = proposal();
    proposal.decide("a", true, CREATED.plusSeconds(5));

    final DecisionOutcome outcome = proposal.decide("b", false, CREATED.plusSeconds(6));

    assertThat(outcome.previousState()).isEqualTo(ProposalState.ACCEPTED_BY_ONE);
    assertThat(outcome.state()).isEqualTo(ProposalState.REJECTED);
    assertThat(outcome.proposal().resolution()).isEqualTo(ProposalResolution.DECLINED);
    assertThat(outcome.proposal().resolvedBy()).isEqualTo("b");
  }

  @Test
  void decisionErrorsAreCheckedInOrder() {
    final Proposal proposal = proposal();
    proposal.decide("a", true, CREATED);

    assertErrorCode(
        () -> proposal.decide("stranger", true, CREATED), MatchmakingErrorCode.NOT_A_PARTICIPANT);
    assertErrorCode(() -> proposal.decide("a", false, CREATED), MatchmakingErrorCode.ALREADY_DECIDED);

    proposal.decide("b", true, CREATED);

    assertErrorCode(
        () -> proposal.decide("stranger", true, CREATED), MatchmakingErrorCode.NOT_A_PARTICIPANT);
    assertErrorCode(() -> proposal.decide("a", true, CREATED), MatchmakingErrorCode.ALREADY_TERMINAL);
    assertThat(proposal.state()).isEqualTo(ProposalState.CONFIRMED);
  }

  @Test
  void decisionAtOrAfterDeadlineExpiresWithoutRecording() {
    final Proposal proposal = proposal();
    proposal.decide("a", true, CREATED);

    final DecisionOutcome outcome = proposal.decide("b", true, EXPIRES);

    assertThat(outcome.previousState()).isEqualTo(ProposalState.ACCEPTED_BY_ONE);
    assertThat(outcome.state()).isEqualTo(ProposalState.EXPIRED);
    assertThat(outcome.becameTerminal()).isTrue();
    assertThat(outcome.proposal().resolution()).isEqualTo(ProposalResolution.TIMED_OUT);
    assertThat(outcome.proposal().decisionOf("b")).isEqualTo(Decision.UNDECIDED);
    assertThat(proposal.expire(EXPIRES.plusSeconds(300))).isEmpty();
    assertErrorCode(
        () -> proposal.decide("b", true, EXPIRES.plusSeconds(300)),
        MatchmakingErrorCode.ALREADY_TERMINAL);
  }

  @Test
  void expireIsNoOpBeforeDeadline() {
    final Proposal proposal = proposal();

    assertThat(proposal.expire(EXPIRES.minusMillis(1))).isEmpty();
    assertThat(proposal.state()).isEqualTo(ProposalState.PENDING);
  }

  @Test
  void expireTransitionsOnceAndIsIdempotent() {
    final Proposal proposal = proposal();
    proposal.decide("a", true, CREATED);

    assertThat(proposal.expire(EXPIRES))
        .hasValueSatisfying(
            outcome -> {
              assertThat(outcome.previousState()).isEqualTo(ProposalState.ACCEPTED_BY_ONE);
              assertThat(outcome.state()).isEqualTo(ProposalState.EXPIRED);
            });
    assertThat(proposal.expire(EXPIRES.plusSeconds(10))).isEmpty();
    assertThat(proposal.snapshot().resolution()).isEqualTo(ProposalResolution.TIMED_OUT);
    assertThat(proposal.snapshot().resolvedAt()).isEqualTo(EXPIRES);
  }

  @Test
  void terminalStateIsImmutable() {
    final Proposal proposal = proposal();
    proposal.decide("a", false, CREATED);

    assertThat(proposal.expire(EXPIRES)).isEmpty();
    assertThat(proposal.rejectByDisconnect("b", EXPIRES)).isEmpty();
    assertThat(proposal.snapshot().resolution()).isEqualTo(ProposalResolution.DECLINED);
  }

  @Test
  void disconnectRejectsWithDisconnectedResolution() {
    final Proposal proposal = proposal();

    assertThat(proposal.rejectByDisconnect("b", CREATED.plusSeconds(3)))
        .hasValueSatisfying(
            outcome -> {
              assertThat(outcome.state()).isEqualTo(ProposalState.REJECTED);
              assertThat(outcome.proposal().resolution())
                  .isEqualTo(ProposalResolution.DISCONNECTED);
              assertThat(outcome.proposal().resolvedBy()).isEqualTo("b");
            });
  }

  @Test
  void chatChannelRequiresConfirmation() {
    final Proposal proposal = proposal();

    assertThatThrownBy(() -> proposal.attachChatChannel("match_p-1"))
        .isInstanceOf(IllegalStateException.class);

    proposal.decide("a", true, CREATED);
    proposal.decide("b", true, CREATED);
    proposal.attachChatChannel("match_p-1");

    assertThat(proposal.snapshot().chatChannelId()).isEqualTo("match_p-1");
  }

  @Test
  void rejectsSameUserOnBothSides() {
    final SearchingUser a = entry("a");

    assertThatThrownBy(() -> new Proposal("p-1", a, a, Set.of("music"), CREATED, EXPIRES))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void snapshotExposesCounterpart() {
    final ProposalSnapshot snapshot = proposal().snapshot();

    assertThat(snapshot.participants()).containsExactly("a", "b");
    assertThat(snapshot.counterpartOf("a")).isEqualTo("b");
    assertThat(snapshot.counterpartOf("b")).isEqualTo("a");
    assertThatThrownBy(() -> snapshot.counterpartOf("c"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static Proposal proposal() {
    return new Proposal("p-1", entry("a"), entry("b"), Set.of("music"), CREATED, EXPIRES);
  }

  private static SearchingUser entry(String userId) {
    return new SearchingUser(userId, SearchCriteria.of(List.of("music"), null), CREATED, 1L);
  }

  private static void assertErrorCode(Runnable action, MatchmakingErrorCode expected) {
    assertThatThrownBy(action::run)
        .isInstanceOf(MatchmakingException.class)
        .extracting(ex -> ((MatchmakingException) ex).code())
        .isEqualTo(expected);
  }
}
