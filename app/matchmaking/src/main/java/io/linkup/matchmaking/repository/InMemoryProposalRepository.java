package io.linkup.matchmaking.repository;

import io.linkup.matchmaking.model.Proposal;
import java.time.Instant;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryProposalRepository implements ProposalRepository {

  private final ConcurrentMap<String, Proposal> byId = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Proposal> liveByUser = new ConcurrentHashMap<>();

  @Override
  public void save(Proposal proposal) {
    for (String userId : proposal.participants()) {
      final Proposal existing = liveByUser.get(userId);
      if (existing != null && existing != proposal && !existing.isTerminal()) {
        throw new IllegalStateException(
            "user " + userId + " already in live proposal " + existing.proposalId());
      }
    }
    byId.put(proposal.proposalId(), proposal);
    for (String userId : proposal.participants()) {
      liveByUser.put(userId, proposal);
    }
  }

  @Override
  public Optional<Proposal> findById(String proposalId) {
    return Optional.ofNullable(byId.get(proposalId));
  }

  @Override
  public Optional<Proposal> findLiveByUser(String userId) {
    final Proposal proposal = liveByUser.get(userId);
    if (proposal == null || proposal.isTerminal()) {
      return Optional.empty();
    }
    return Optional.of(proposal);
  }

  @Override
  public boolean hasLiveProposal(String userId) {
    return findLiveByUser(userId).isPresent();
  }

  @Override
  public void markTerminal(Proposal proposal) {
    for (String userId : proposal.participants()) {
      liveByUser.remove(userId, proposal);
    }
  }

  @Override
  public int liveCount() {
    int count = 0;
    for (Proposal proposal : byId.values()) {
      if (!proposal.isTerminal()) {
        count++;
      }
    }
    return count;
  }

  @Override
  public int purgeTerminalBefore(Instant cutoff) {
    int purged = 0;
    final Iterator<Proposal> iterator = byId.values().iterator();
    while (iterator.hasNext()) {
      final Proposal proposal = iterator.next();
      final Instant resolvedAt = proposal.resolvedAt();
      if (proposal.isTerminal() && resolvedAt != null && resolvedAt.isBefore(cutoff)) {
        iterator.remove();
        markTerminal(proposal);
        purged++;
      }
    }
    return purged;
  }
}
