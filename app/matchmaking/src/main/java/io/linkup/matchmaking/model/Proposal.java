/*
 * どこで: Matchmaking ドメインモデル
 * 何を: 2 人のペアリング提案を作成から終端まで管理する状態機械
 * なぜ: 状態遷移の検証を 1 箇所に閉じ込め、終端状態を不変に保つため
 */
package io.linkup.matchmaking.model;

import io.linkup.matchmaking.api.MatchmakingException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 役割: 1 件の Proposal の可変状態を保持する。
 *
 * <p>動作: すべての遷移は synchronized で直列化される。終端状態 (CONFIRMED / REJECTED / EXPIRED)
 * に入った後は一切変化しない。
 *
 * <p>前提: 参加者のユーザーロックは呼び出し側 (サービス層) が保持している。
 */
public final class Proposal {

  private final String proposalId;
  private final List<String> participants;
  private final Map<String, SearchCriteria> criteriaByUser;
  private final Set<String> sharedInterests;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final Map<String, Decision> decisions = new LinkedHashMap<>();

  private ProposalState state = ProposalState.PENDING;
  private ProposalResolution resolution;
  private String resolvedBy;
  private Instant resolvedAt;
  private String chatChannelId;

  public Proposal(
      String proposalId,
      SearchingUser first,
      SearchingUser second,
      Set<String> sharedInterests,
      Instant createdAt,
      Instant expiresAt) {
    Objects.requireNonNull(proposalId, "proposalId");
    if (first.userId().equals(second.userId())) {
      throw new IllegalArgumentException("participants must be distinct: " + first.userId());
    }
    if (!expiresAt.isAfter(createdAt)) {
      throw new IllegalArgumentException("expiresAt must be after createdAt");
    }
    this.proposalId = proposalId;
    this.participants = List.of(first.userId(), second.userId());
    this.criteriaByUser =
        Map.of(first.userId(), first.criteria(), second.userId(), second.criteria());
    this.sharedInterests = Collections.unmodifiableSet(new LinkedHashSet<>(sharedInterests));
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
    decisions.put(first.userId(), Decision.UNDECIDED);
    decisions.put(second.userId(), Decision.UNDECIDED);
  }

  public String proposalId() {
    return proposalId;
  }

  public List<String> participants() {
    return participants;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  public boolean isParticipant(String userId) {
    return participants.contains(userId);
  }

  public SearchCriteria criteriaOf(String userId) {
    return criteriaByUser.get(userId);
  }

  public synchronized ProposalState state() {
    return state;
  }

  public synchronized boolean isTerminal() {
    return state.isTerminal();
  }

  /**
   * 役割: 参加者の accept / reject を反映する。
   *
   * <p>動作: 検証順は NOT_A_PARTICIPANT → ALREADY_TERMINAL → ALREADY_DECIDED。reject で即 REJECTED、
   * 最初の accept で ACCEPTED_BY_ONE、双方 accept で CONFIRMED。期限 (expiresAt) 以降に届いた判断は
   * 反映せず EXPIRED へ遷移させ、その outcome を返す。
   */
  public synchronized DecisionOutcome decide(String userId, boolean accept, Instant now) {
    if (!isParticipant(userId)) {
      throw MatchmakingException.notAParticipant(proposalId, userId);
    }
    if (state.isTerminal()) {
      throw MatchmakingException.alreadyTerminal(proposalId);
    }
    if (!now.isBefore(expiresAt)) {
      final ProposalState previous = state;
      resolve(ProposalState.EXPIRED, ProposalResolution.TIMED_OUT, null, now);
      return new DecisionOutcome(previous, snapshotLocked());
    }
    if (decisions.get(userId) != Decision.UNDECIDED) {
      throw MatchmakingException.alreadyDecided(proposalId, userId);
    }
    final ProposalState previous = state;
    if (!accept) {
      decisions.put(userId, Decision.REJECT);
      resolve(ProposalState.REJECTED, ProposalResolution.DECLINED, userId, now);
      return new DecisionOutcome(previous, snapshotLocked());
    }
    decisions.put(userId, Decision.ACCEPT);
    final boolean allAccepted =
        decisions.values().stream().allMatch(decision -> decision == Decision.ACCEPT);
    if (allAccepted) {
      resolve(ProposalState.CONFIRMED, ProposalResolution.MUTUAL_ACCEPT, null, now);
    } else {
      state = ProposalState.ACCEPTED_BY_ONE;
    }
    return new DecisionOutcome(previous, snapshotLocked());
  }

  /** 期限到達時のみ EXPIRED に遷移する。終端済み・期限前なら empty。 */
  public synchronized Optional<DecisionOutcome> expire(Instant now) {
    if (state.isTerminal() || now.isBefore(expiresAt)) {
      return Optional.empty();
    }
    final ProposalState previous = state;
    resolve(ProposalState.EXPIRED, ProposalResolution.TIMED_OUT, null, now);
    return Optional.of(new DecisionOutcome(previous, snapshotLocked()));
  }

  /** 参加者の切断による REJECTED 遷移。終端済みなら empty。 */
  public synchronized Optional<DecisionOutcome> rejectByDisconnect(String userId, Instant now) {
    if (!isParticipant(userId) || state.isTerminal()) {
      return Optional.empty();
    }
    final ProposalState previous = state;
    resolve(ProposalState.REJECTED, ProposalResolution.DISCONNECTED, userId, now);
    return Optional.of(new DecisionOutcome(previous, snapshotLocked()));
  }

  public synchronized void attachChatChannel(String channelId) {
    if (state != ProposalState.CONFIRMED) {
      throw new IllegalStateException("chat channel requires CONFIRMED: " + proposalId);
    }
    if (chatChannelId != null) {
      throw new IllegalStateException("chat channel already attached: " + proposalId);
    }
    this.chatChannelId = channelId;
  }

  public synchronized Instant resolvedAt() {
    return resolvedAt;
  }

  public synchronized ProposalSnapshot snapshot() {
    return snapshotLocked();
  }

  private void resolve(
      ProposalState terminal, ProposalResolution reason, String by, Instant now) {
    this.state = terminal;
    this.resolution = reason;
    this.resolvedBy = by;
    this.resolvedAt = now;
  }

  private ProposalSnapshot snapshotLocked() {
    return new ProposalSnapshot(
        proposalId,
        participants,
        state,
        createdAt,
        expiresAt,
        decisions,
        sharedInterests,
        resolution,
        resolvedBy,
        resolvedAt,
        chatChannelId);
  }
}
