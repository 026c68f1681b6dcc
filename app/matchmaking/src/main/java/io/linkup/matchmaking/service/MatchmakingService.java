/*
 * どこで: Matchmaking サービス層
 * 何を: 検索開始/取消、ペア確定、accept/reject、期限切れ、切断を処理する
 * なぜ: pool と proposal テーブルの変更をユーザーロック下の 1 箇所に集約するため
 */
package io.linkup.matchmaking.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.linkup.matchmaking.api.MatchmakingException;
import io.linkup.matchmaking.config.MatchmakingProperties;
import io.linkup.matchmaking.delivery.MatchEventDelivery;
import io.linkup.matchmaking.delivery.event.MatchConfirmedEvent;
import io.linkup.matchmaking.delivery.event.MatchEventNames;
import io.linkup.matchmaking.delivery.event.MatchExpiredEvent;
import io.linkup.matchmaking.delivery.event.MatchFoundEvent;
import io.linkup.matchmaking.delivery.event.MatchPeerAcceptedEvent;
import io.linkup.matchmaking.delivery.event.MatchRejectedEvent;
import io.linkup.matchmaking.delivery.event.MatchSearchingEvent;
import io.linkup.matchmaking.model.DecisionOutcome;
import io.linkup.matchmaking.model.MatchPair;
import io.linkup.matchmaking.model.MatchPreference;
import io.linkup.matchmaking.model.Proposal;
import io.linkup.matchmaking.model.ProposalResolution;
import io.linkup.matchmaking.model.ProposalSnapshot;
import io.linkup.matchmaking.model.ProposalState;
import io.linkup.matchmaking.model.SearchCriteria;
import io.linkup.matchmaking.model.SearchingUser;
import io.linkup.matchmaking.presence.PresenceRegistry;
import io.linkup.matchmaking.presence.UserDisconnectedEvent;
import io.linkup.matchmaking.repository.CandidatePool;
import io.linkup.matchmaking.repository.ProposalRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * 役割: マッチメイクの全状態遷移を担う。
 *
 * <p>動作: 変更はすべて参加ユーザーのロック下で行い、配信・チャット作成・再投入はロック解放後に行う。
 *
 * <p>前提: 同一ユーザーは pool と live proposal のどちらか一方にしか存在しない。
 */
@Service
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Repository/Registry/Delivery は Spring 管理の共有 Bean")
public class MatchmakingService {

  private static final Logger logger = LoggerFactory.getLogger(MatchmakingService.class);

  private final CandidatePool candidatePool;
  private final ProposalRepository proposalRepository;
  private final PresenceRegistry presenceRegistry;
  private final MatchEventDelivery eventDelivery;
  private final ChatChannelProvisioner chatChannelProvisioner;
  private final ProposalExpiryScheduler expiryScheduler;
  private final UserLocks userLocks;
  private final MatchmakingMetrics metrics;
  private final MatchmakingProperties properties;
  private final Clock clock;

  /**
   * 役割: 検索を開始し pool へ投入する。
   * 動作: live proposal の参加中なら ALREADY_IN_PROPOSAL、投入済みなら ALREADY_QUEUED。
   * 前提: presence の登録有無は問わない。
   */
  public SearchingUser startSearch(String userId, List<String> interests, String preference) {
    final SearchCriteria criteria = SearchCriteria.of(interests, parsePreference(preference));
    if (!criteria.hasInterests()) {
      throw MatchmakingException.invalidCriteria("at least one interest is required");
    }
    final SearchingUser entry =
        userLocks.withUser(
            userId,
            () -> {
              if (proposalRepository.hasLiveProposal(userId)) {
                throw MatchmakingException.alreadyInProposal(userId);
              }
              return candidatePool.enqueue(userId, criteria);
            });
    logger.info(
        "matchmaking search started userId={} interests={} preference={}",
        userId,
        criteria.interests().size(),
        criteria.preference());
    return entry;
  }

  /** proposal 作成後の取消は proposal に影響しない。 */
  public boolean cancelSearch(String userId) {
    final boolean removed = userLocks.withUser(userId, () -> candidatePool.dequeue(userId));
    if (removed) {
      logger.info("matchmaking search cancelled userId={}", userId);
    }
    return removed;
  }

  /**
   * 役割: sweep が計画したペアを確定し proposal を作成する。
   * 動作: 両者のロック下で、計画時と同じエントリが残り live proposal が無い場合のみ確定する。
   * 条件を満たさなければ empty を返し、残っている側は pool に留まる。
   */
  public Optional<ProposalSnapshot> claim(MatchPair pair) {
    final SearchingUser first = pair.first();
    final SearchingUser second = pair.second();
    final Proposal proposal =
        userLocks.withUsers(
            List.of(first.userId(), second.userId()),
            () -> {
              if (!isStillQueued(first) || !isStillQueued(second)) {
                return null;
              }
              if (proposalRepository.hasLiveProposal(first.userId())
                  || proposalRepository.hasLiveProposal(second.userId())) {
                return null;
              }
              final Instant now = Instant.now(clock);
              final Proposal created =
                  new Proposal(
                      UUID.randomUUID().toString(),
                      first,
                      second,
                      pair.sharedInterests(),
                      now,
                      now.plus(properties.proposalTtl()));
              // pool と live proposal の両方に同時に現れないよう、先に pool から外す
              candidatePool.remove(first);
              candidatePool.remove(second);
              try {
                proposalRepository.save(created);
              } catch (RuntimeException ex) {
                candidatePool.restore(first);
                candidatePool.restore(second);
                throw ex;
              }
              return created;
            });
    if (proposal == null) {
      logger.debug(
          "matchmaking pair claim aborted first={} second={}", first.userId(), second.userId());
      return Optional.empty();
    }
    final ProposalSnapshot snapshot = proposal.snapshot();
    expiryScheduler.schedule(
        snapshot.proposalId(), snapshot.expiresAt(), () -> expire(snapshot.proposalId()));
    metrics.recordProposalResult("created");
    metrics.recordTimeToMatch(Duration.between(first.enqueuedAt(), snapshot.createdAt()));
    metrics.recordTimeToMatch(Duration.between(second.enqueuedAt(), snapshot.createdAt()));
    logger.info(
        "matchmaking proposal created proposalId={} first={} second={} sharedInterests={}",
        snapshot.proposalId(),
        first.userId(),
        second.userId(),
        snapshot.sharedInterests());
    for (String userId : snapshot.participants()) {
      eventDelivery.deliver(
          userId,
          MatchEventNames.FOUND,
          new MatchFoundEvent(
              snapshot.proposalId(),
              snapshot.counterpartOf(userId),
              new ArrayList<>(snapshot.sharedInterests()),
              snapshot.expiresAt()));
    }
    return Optional.of(snapshot);
  }

  /**
   * 役割: 参加者の accept / reject を反映する。
   * 動作: エラー判定順は PROPOSAL_NOT_FOUND → NOT_A_PARTICIPANT → ALREADY_TERMINAL → ALREADY_DECIDED。
   * 期限を過ぎていればタイマーを待たずに EXPIRED を確定させ、ALREADY_TERMINAL で拒否する。
   */
  public ProposalSnapshot submitDecision(String proposalId, String userId, boolean accept) {
    final Proposal proposal =
        proposalRepository
            .findById(proposalId)
            .orElseThrow(() -> MatchmakingException.proposalNotFound(proposalId));
    if (!proposal.isParticipant(userId)) {
      throw MatchmakingException.notAParticipant(proposalId, userId);
    }
    final DecisionOutcome outcome =
        userLocks.withUsers(
            proposal.participants(),
            () -> {
              final DecisionOutcome result =
                  proposal.decide(userId, accept, Instant.now(clock));
              if (result.becameTerminal()) {
                proposalRepository.markTerminal(proposal);
              }
              return result;
            });
    if (outcome.state() == ProposalState.EXPIRED) {
      logger.info(
          "matchmaking decision after deadline proposalId={} userId={} expiresAt={}",
          proposalId,
          userId,
          proposal.expiresAt());
      afterTransition(proposal, outcome, null);
      throw MatchmakingException.alreadyTerminal(proposalId);
    }
    logger.info(
        "matchmaking decision proposalId={} userId={} accept={} state={}",
        proposalId,
        userId,
        accept,
        outcome.state());
    afterTransition(proposal, outcome, userId);
    return proposal.snapshot();
  }

  /** 期限到達時の EXPIRED 遷移。終端済み・削除済みなら何もしない。 */
  public Optional<ProposalSnapshot> expire(String proposalId) {
    final Optional<Proposal> found = proposalRepository.findById(proposalId);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    final Proposal proposal = found.get();
    final Optional<DecisionOutcome> outcome =
        userLocks.withUsers(
            proposal.participants(),
            () -> {
              final Optional<DecisionOutcome> result = proposal.expire(Instant.now(clock));
              result.ifPresent(ignored -> proposalRepository.markTerminal(proposal));
              return result;
            });
    if (outcome.isEmpty()) {
      return Optional.empty();
    }
    logger.info("matchmaking proposal expired proposalId={}", proposalId);
    afterTransition(proposal, outcome.get(), null);
    return Optional.of(proposal.snapshot());
  }

  /**
   * 役割: ユーザー切断に追従する。
   * 動作: pool から取り除き、live proposal があれば DISCONNECTED で REJECTED にする。冪等。
   */
  public void onDisconnect(String userId) {
    final boolean dequeued = userLocks.withUser(userId, () -> candidatePool.dequeue(userId));
    if (dequeued) {
      logger.info("matchmaking search dropped on disconnect userId={}", userId);
    }
    final Optional<Proposal> live = proposalRepository.findLiveByUser(userId);
    if (live.isEmpty()) {
      return;
    }
    final Proposal proposal = live.get();
    final Optional<DecisionOutcome> outcome =
        userLocks.withUsers(
            proposal.participants(),
            () -> {
              final Optional<DecisionOutcome> result =
                  proposal.rejectByDisconnect(userId, Instant.now(clock));
              result.ifPresent(ignored -> proposalRepository.markTerminal(proposal));
              return result;
            });
    outcome.ifPresent(
        result -> {
          logger.info(
              "matchmaking proposal rejected by disconnect proposalId={} userId={}",
              proposal.proposalId(),
              userId);
          afterTransition(proposal, result, userId);
        });
  }

  @EventListener
  public void onUserDisconnected(UserDisconnectedEvent event) {
    onDisconnect(event.userId());
  }

  public Optional<ProposalSnapshot> currentProposal(String userId) {
    return proposalRepository.findLiveByUser(userId).map(Proposal::snapshot);
  }

  /** 参加者のみ参照可能。終端済みも保持期間内は返す。 */
  public ProposalSnapshot findProposal(String proposalId, String userId) {
    final Proposal proposal =
        proposalRepository
            .findById(proposalId)
            .orElseThrow(() -> MatchmakingException.proposalNotFound(proposalId));
    if (!proposal.isParticipant(userId)) {
      throw MatchmakingException.notAParticipant(proposalId, userId);
    }
    return proposal.snapshot();
  }

  private boolean isStillQueued(SearchingUser planned) {
    return candidatePool
        .find(planned.userId())
        .map(current -> current.equals(planned))
        .orElse(false);
  }

  private MatchPreference parsePreference(String preference) {
    try {
      return MatchPreference.fromValue(preference);
    } catch (IllegalArgumentException ex) {
      throw MatchmakingException.invalidCriteria(ex.getMessage());
    }
  }

  private void afterTransition(Proposal proposal, DecisionOutcome outcome, String actor) {
    final ProposalSnapshot snapshot = outcome.proposal();
    switch (snapshot.state()) {
      case ACCEPTED_BY_ONE ->
          eventDelivery.deliver(
              snapshot.counterpartOf(actor),
              MatchEventNames.PEER_ACCEPTED,
              new MatchPeerAcceptedEvent(snapshot.proposalId()));
      case CONFIRMED -> onConfirmed(proposal, snapshot);
      case REJECTED -> onRejected(proposal, snapshot);
      case EXPIRED -> onExpired(proposal, snapshot);
      default -> {
        // PENDING へ戻る遷移は無い
      }
    }
  }

  private void onConfirmed(Proposal proposal, ProposalSnapshot snapshot) {
    metrics.recordProposalResult("confirmed");
    String channelId = null;
    try {
      channelId = chatChannelProvisioner.provision(snapshot);
      proposal.attachChatChannel(channelId);
    } catch (RuntimeException ex) {
      // 成立自体は取り消さない
      logger.warn("chat channel provisioning failed proposalId={}", snapshot.proposalId(), ex);
      metrics.recordDependencyError("chat_provision");
    }
    for (String userId : snapshot.participants()) {
      eventDelivery.deliver(
          userId,
          MatchEventNames.CONFIRMED,
          new MatchConfirmedEvent(
              snapshot.proposalId(), channelId, snapshot.counterpartOf(userId)));
    }
  }

  private void onRejected(Proposal proposal, ProposalSnapshot snapshot) {
    final String rejectedBy = snapshot.resolvedBy();
    final String reason = reasonOf(snapshot.resolution());
    metrics.recordProposalResult(reason);
    final MatchRejectedEvent event =
        new MatchRejectedEvent(snapshot.proposalId(), reason, rejectedBy);
    final String remaining = snapshot.counterpartOf(rejectedBy);
    if (snapshot.resolution() != ProposalResolution.DISCONNECTED) {
      eventDelivery.deliver(rejectedBy, MatchEventNames.REJECTED, event);
    }
    eventDelivery.deliver(remaining, MatchEventNames.REJECTED, event);
    requeue(proposal, remaining, reason);
  }

  private void onExpired(Proposal proposal, ProposalSnapshot snapshot) {
    metrics.recordProposalResult("expired");
    final MatchExpiredEvent event = new MatchExpiredEvent(snapshot.proposalId());
    for (String userId : snapshot.participants()) {
      eventDelivery.deliver(userId, MatchEventNames.EXPIRED, event);
    }
    final String reason = reasonOf(snapshot.resolution());
    for (String userId : snapshot.participants()) {
      requeue(proposal, userId, reason);
    }
  }

  /**
   * 役割: 失敗した proposal の参加者を元の条件で pool へ戻す。
   * 動作: 設定が有効、オンライン、live proposal 無し、未投入の場合のみ。直前の相手は
   * requeue-exclusion の間だけ除外する。
   */
  private void requeue(Proposal proposal, String userId, String reason) {
    if (!properties.autoRequeueOnRejection()) {
      return;
    }
    if (!presenceRegistry.isOnline(userId)) {
      logger.debug(
          "matchmaking requeue skipped offline proposalId={} userId={}",
          proposal.proposalId(),
          userId);
      return;
    }
    final SearchCriteria criteria = proposal.criteriaOf(userId);
    final Set<String> excluded = Set.of(proposal.snapshot().counterpartOf(userId));
    final boolean requeued =
        userLocks.withUser(
            userId,
            () -> {
              if (proposalRepository.hasLiveProposal(userId)
                  || candidatePool.find(userId).isPresent()) {
                return false;
              }
              candidatePool.enqueue(userId, criteria, excluded, properties.requeueExclusion());
              return true;
            });
    if (!requeued) {
      return;
    }
    logger.info(
        "matchmaking user requeued proposalId={} userId={} reason={}",
        proposal.proposalId(),
        userId,
        reason);
    eventDelivery.deliver(userId, MatchEventNames.SEARCHING, new MatchSearchingEvent(reason));
  }

  private static String reasonOf(ProposalResolution resolution) {
    return resolution.name().toLowerCase(Locale.ROOT);
  }
}
