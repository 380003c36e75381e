// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import com.github.batch_auction.matching.MatchingEngine;
import com.github.batch_auction.matching.OrderFillState;
import com.github.batch_auction.matching.PoolSnapshotSource;
import com.github.batch_auction.matching.PoolSolution;
import com.github.batch_auction.msg.AuctionMessage;
import com.github.batch_auction.msg.Commit;
import com.github.batch_auction.msg.PrePropose;
import com.github.batch_auction.msg.PreProposeAggregation;
import com.github.batch_auction.msg.Propose;
import com.github.batch_auction.msg.SignedMessage;
import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.OrderId;
import com.github.batch_auction.orders.OrderKind;
import com.github.batch_auction.orders.OrderSet;
import com.github.batch_auction.orders.OrderStorage;
import com.github.batch_auction.orders.SearcherOrder;
import com.github.batch_auction.types.CommitVote;
import com.github.batch_auction.types.Digest;
import com.github.batch_auction.types.PeerId;
import com.github.batch_auction.types.PreProposal;
import com.github.batch_auction.types.PreProposalAggregation;
import com.github.batch_auction.types.Proposal;
import com.github.batch_auction.types.Roster;
import com.github.batch_auction.types.Signer;
import org.jetbrains.annotations.TestOnly;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static com.github.batch_auction.AuctionLogger.LOGGER;

/// The state of one round. It is owned by the [RoundStateMachine] and only mutated by the active phase. A new
/// context is created for every block height, nothing carries over from the previous round other than the
/// collaborators.
///
/// It requires the following collaborating classes:
///
/// * One [OrderStorage] that is shared with the host and is internally synchronized.
/// * One [MatchingEngine] that solves the pools asynchronously.
/// * One [PoolSnapshotSource] that gives every validator the same AMM reserves for the height.
/// * One [QuorumStrategy] applied to the roster size.
public class RoundContext {
  private final long height;
  private final PeerId leader;
  private final Roster roster;
  private final Signer signer;
  private final QuorumStrategy quorumStrategy;
  private final OrderStorage orderStorage;
  private final MatchingEngine matchingEngine;
  private final PoolSnapshotSource snapshots;
  private final RoundConfig config;
  private final Clock clock;

  private final ArrayDeque<AuctionMessage> outbound = new ArrayDeque<>();
  private final Set<Digest> seen = new HashSet<>();
  private final PreProposalPool preProposals = new PreProposalPool();
  private final CommitTally commitTally = new CommitTally();
  private final List<CompletableFuture<?>> inflight = new ArrayList<>();
  private Optional<Proposal> proposal = Optional.empty();

  public RoundContext(long height,
                      PeerId leader,
                      Roster roster,
                      Signer signer,
                      QuorumStrategy quorumStrategy,
                      OrderStorage orderStorage,
                      MatchingEngine matchingEngine,
                      PoolSnapshotSource snapshots,
                      RoundConfig config,
                      Clock clock) {
    this.height = height;
    this.leader = Objects.requireNonNull(leader);
    this.roster = Objects.requireNonNull(roster);
    this.signer = Objects.requireNonNull(signer);
    this.quorumStrategy = Objects.requireNonNull(quorumStrategy);
    this.orderStorage = Objects.requireNonNull(orderStorage);
    this.matchingEngine = Objects.requireNonNull(matchingEngine);
    this.snapshots = Objects.requireNonNull(snapshots);
    this.config = Objects.requireNonNull(config);
    this.clock = Objects.requireNonNull(clock);
    if (!roster.contains(leader)) {
      throw new IllegalArgumentException("leader " + leader + " is not on the roster " + roster.members());
    }
  }

  /// @return a fresh context for the next block that shares this context's collaborators.
  public RoundContext nextRound(long newHeight, PeerId newLeader, Roster newRoster) {
    return new RoundContext(newHeight, newLeader, newRoster, signer, quorumStrategy, orderStorage, matchingEngine,
        snapshots, config, clock);
  }

  public long height() {
    return height;
  }

  public PeerId leader() {
    return leader;
  }

  public PeerId self() {
    return signer.id();
  }

  public boolean isLeader() {
    return leader.equals(signer.id());
  }

  public Roster roster() {
    return roster;
  }

  public int quorum() {
    return quorumStrategy.quorum(roster.size());
  }

  QuorumStrategy quorumStrategy() {
    return quorumStrategy;
  }

  Signer signer() {
    return signer;
  }

  OrderStorage orderStorage() {
    return orderStorage;
  }

  public RoundConfig config() {
    return config;
  }

  Instant now() {
    return clock.instant();
  }

  boolean hasElapsed(Instant since, Duration duration) {
    return !now().isBefore(since.plus(duration));
  }

  void broadcast(AuctionMessage message) {
    outbound.add(message);
  }

  List<AuctionMessage> drainOutbound() {
    final var drained = new ArrayList<AuctionMessage>(outbound);
    outbound.clear();
    return drained;
  }

  /// Applies the rules every signed message goes through. Messages relayed from outside the roster are dropped,
  /// content that is for another height or does not verify is dropped, content already seen is dropped. Anything else
  /// is recorded as seen and relayed to the peers exactly once.
  ///
  /// @return true if the content is new and valid.
  boolean handleVerification(SignedMessage message) {
    if (!roster.contains(message.from())) {
      LOGGER.warning(() -> "dropping " + message.getClass().getSimpleName() + " from " + message.from()
          + " who is not a validator at height " + height);
      return false;
    }
    final var content = message.content();
    if (!content.isValid(height, roster)) {
      LOGGER.info(() -> "dropping invalid " + content + " relayed by " + message.from() + " at height " + height);
      return false;
    }
    if (!seen.add(content.digest())) {
      LOGGER.info(() -> "already seen " + content + " relayed by " + message.from());
      return false;
    }
    broadcast(relay(message));
    return true;
  }

  private SignedMessage relay(SignedMessage message) {
    final var self = self();
    if (message instanceof PrePropose p) {
      return new PrePropose(self, p.preProposal());
    } else if (message instanceof PreProposeAggregation a) {
      return new PreProposeAggregation(self, a.aggregation());
    } else if (message instanceof Propose p) {
      return new Propose(self, p.proposal());
    } else if (message instanceof Commit c) {
      return new Commit(self, c.vote());
    }
    throw new IllegalArgumentException("unknown message type " + message.getClass());
  }

  boolean handlePreProposal(PrePropose message) {
    return handleVerification(message) && preProposals.add(message.preProposal());
  }

  boolean handleAggregation(PreProposeAggregation message) {
    return handleVerification(message) && preProposals.add(message.aggregation());
  }

  /// A proposal is only accepted from the leader of the round. The accepted proposal is kept for the rest of the
  /// round.
  Optional<Proposal> verifyProposal(Propose message) {
    final var candidate = message.proposal();
    if (!candidate.source().equals(leader)) {
      LOGGER.info(() -> "dropping " + candidate + " as leader at height " + height + " is " + leader);
      return Optional.empty();
    }
    if (proposal.isPresent()) {
      final var accepted = proposal.get();
      if (accepted.equals(candidate)) {
        LOGGER.info(() -> "already seen " + candidate + " relayed by " + message.from());
      } else if (candidate.isValid(height, roster)) {
        LOGGER.warning(() -> "leader " + leader + " signed a second proposal " + candidate + " after " + accepted);
      }
      return Optional.empty();
    }
    if (!handleVerification(message)) {
      return Optional.empty();
    }
    proposal = Optional.of(candidate);
    return proposal;
  }

  boolean handleCommit(Commit message) {
    return handleVerification(message) && commitTally.record(message.vote());
  }

  /// Signs and records this validator's pre-proposal from the eligible orders in storage.
  PreProposal ownPreProposal() {
    final var own = PreProposal.generate(height, signer, orderStorage.eligibleOrders());
    seen.add(own.digest());
    preProposals.add(own);
    broadcast(new PrePropose(self(), own));
    LOGGER.fine(() -> self() + " signed " + own);
    return own;
  }

  void ownAggregation() {
    final var own = PreProposalAggregation.generate(height, signer, preProposals.all());
    seen.add(own.digest());
    preProposals.add(own);
    broadcast(new PreProposeAggregation(self(), own));
  }

  void ownProposal(Proposal own) {
    seen.add(own.digest());
    proposal = Optional.of(own);
    broadcast(new Propose(self(), own));
    LOGGER.fine(() -> self() + " proposed " + own);
  }

  void ownVote(CommitVote vote) {
    seen.add(vote.digest());
    commitTally.record(vote);
    broadcast(new Commit(self(), vote));
  }

  List<PreProposal> preProposals() {
    return preProposals.all();
  }

  long preProposalSources() {
    return preProposals.distinctSources();
  }

  Optional<Proposal> proposal() {
    return proposal;
  }

  CommitTally commitTally() {
    return commitTally;
  }

  /// Keeps the orders that at least `quorum` distinct validators included in their pre-proposals. An order only
  /// seen by a minority never reaches the book.
  public static OrderSet filterQuorumOrders(Collection<PreProposal> preProposals, int quorum) {
    final var limit = countSources(preProposals, p -> p.orders().allLimit(), quorum);
    final var searcher = countSources(preProposals, p -> p.orders().allSearcher(), quorum);
    return OrderSet.of(
        limit.stream().sorted(Comparator.comparing(LimitOrder::id)).toList(),
        searcher.stream().sorted(Comparator.comparing(SearcherOrder::id)).toList());
  }

  private static <T> List<T> countSources(Collection<PreProposal> preProposals,
                                          Function<PreProposal, List<T>> orders,
                                          int quorum) {
    final Map<T, Set<PeerId>> sightings = new HashMap<>();
    for (var preProposal : preProposals) {
      for (var order : orders.apply(preProposal)) {
        sightings.computeIfAbsent(order, o -> new HashSet<>()).add(preProposal.source());
      }
    }
    return sightings.entrySet().stream()
        .filter(e -> e.getValue().size() >= quorum)
        .map(Map.Entry::getKey)
        .toList();
  }

  /// Starts a solve over the quorum filtered union of the given pre-proposals. The future is cancelled if the round
  /// is reset before it completes.
  CompletableFuture<List<PoolSolution>> matchingEngineOutput(Collection<PreProposal> inputs) {
    final var filtered = filterQuorumOrders(inputs, quorum());
    LOGGER.fine(() -> self() + " solving height " + height + " over " + inputs.size() + " pre-proposals with "
        + filtered.allLimit().size() + " limit and " + filtered.allSearcher().size() + " searcher orders");
    final var future = matchingEngine.solvePools(filtered.allLimit(), filtered.allSearcher(), snapshots.snapshots(height));
    inflight.add(future);
    return future;
  }

  /// Moves the orders the proposal filled completely into pending finalization at this height. A partially filled
  /// STANDING order stays eligible with only its unfilled remainder. A partially filled FLASH order cannot rest so it
  /// is treated as filled.
  void markFilled(Proposal committed) {
    final var filled = new ArrayList<OrderId>();
    for (var solution : committed.solutions()) {
      for (var outcome : solution.outcomes()) {
        if (outcome.outcome() instanceof OrderFillState.CompleteFill) {
          filled.add(outcome.id());
        } else if (outcome.outcome() instanceof OrderFillState.PartialFill partial) {
          orderStorage.removeLimitOrder(outcome.id()).ifPresent(order -> {
            final long remaining = order.quantity() - partial.filledQuantity();
            if (order.kind() == OrderKind.STANDING && remaining > 0) {
              orderStorage.addLimitOrder(order.withQuantity(remaining));
            } else {
              orderStorage.addLimitOrder(order);
              filled.add(order.id());
            }
          });
        }
      }
      solution.searcher().ifPresent(s -> filled.add(s.id()));
    }
    orderStorage.addFilledOrders(height, filled);
  }

  void cancelInflight() {
    inflight.forEach(f -> f.cancel(false));
    inflight.clear();
  }

  @TestOnly
  int outboundSize() {
    return outbound.size();
  }

  @Override
  public String toString() {
    return "RoundContext(height=" + height + ", self=" + self() + ", leader=" + leader + ", roster=" + roster.size()
        + ", " + preProposals + ", votes=" + commitTally.size() + ")";
  }
}
