// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import com.github.batch_auction.matching.BookSolver;
import com.github.batch_auction.matching.OrderFillState;
import com.github.batch_auction.matching.OrderOutcome;
import com.github.batch_auction.matching.PoolSnapshotSource;
import com.github.batch_auction.matching.PoolSolution;
import com.github.batch_auction.msg.Commit;
import com.github.batch_auction.msg.PrePropose;
import com.github.batch_auction.msg.Propose;
import com.github.batch_auction.orders.InMemoryOrderStorage;
import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.OrderId;
import com.github.batch_auction.orders.OrderKind;
import com.github.batch_auction.orders.OrderSet;
import com.github.batch_auction.orders.PoolId;
import com.github.batch_auction.orders.Price;
import com.github.batch_auction.orders.SearcherOrder;
import com.github.batch_auction.types.CommitVote;
import com.github.batch_auction.types.PreProposal;
import com.github.batch_auction.types.Proposal;
import com.github.batch_auction.types.Roster;
import com.github.batch_auction.types.Signer;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;

import static com.github.batch_auction.AuctionLogger.LOGGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RoundContextTest {
  static final long HEIGHT = 5;
  static final Validators VALIDATORS = Validators.of(7);
  static final Signer OUTSIDER = Signer.generate();

  final LimitOrder bid = LimitOrder.bid("b1", "ETH-USDC", 100, 10);
  final LimitOrder ask = LimitOrder.ask("a1", "ETH-USDC", 100, 10);
  final LimitOrder minority = LimitOrder.bid("b2", "ETH-USDC", 101, 3);

  InMemoryOrderStorage storage;
  RoundContext context;

  @BeforeAll
  static void setupLogging() {
    final var logLevel = System.getProperty("java.util.logging.ConsoleHandler.level", "WARNING");
    final Level level = Level.parse(logLevel);
    LOGGER.setLevel(level);
    ConsoleHandler consoleHandler = new ConsoleHandler();
    consoleHandler.setLevel(level);
    LOGGER.addHandler(consoleHandler);
    LOGGER.setUseParentHandlers(false);
  }

  @BeforeEach
  void setup() {
    storage = new InMemoryOrderStorage();
    // index 1 is a follower of leader 0 on a roster of four
    final var four = new Validators(VALIDATORS.signers().subList(0, 4),
        new Roster(VALIDATORS.roster().validators().subList(0, 4)));
    context = four.context(HEIGHT, 1, 0, storage, new BookSolver(Runnable::run), new MutableClock());
  }

  PreProposal preProposal(int signer, LimitOrder... orders) {
    return PreProposal.generate(HEIGHT, VALIDATORS.get(signer), OrderSet.of(List.of(orders), List.of()));
  }

  @Test
  void quorumOfFourIsThree() {
    assertThat(context.quorum()).isEqualTo(3);
    assertThat(context.isLeader()).isFalse();
  }

  @Test
  void validMessageIsRelayedOnceAsOurOwn() {
    final var pre = preProposal(2, bid);

    assertThat(context.handlePreProposal(new PrePropose(VALIDATORS.get(2).id(), pre))).isTrue();
    assertThat(context.handlePreProposal(new PrePropose(VALIDATORS.get(3).id(), pre))).isFalse();

    final var relayed = context.drainOutbound();
    assertThat(relayed).hasSize(1);
    assertThat(relayed.get(0).from()).isEqualTo(context.self());
    assertThat(context.preProposals()).containsExactly(pre);
  }

  @Test
  void messageFromOutsideTheRosterIsDropped() {
    final var pre = preProposal(2, bid);

    assertThat(context.handlePreProposal(new PrePropose(OUTSIDER.id(), pre))).isFalse();
    assertThat(context.outboundSize()).isZero();
    assertThat(context.preProposals()).isEmpty();
  }

  @Test
  void contentForAnotherHeightIsDropped() {
    final var stale = PreProposal.generate(HEIGHT - 1, VALIDATORS.get(2), OrderSet.empty());

    assertThat(context.handlePreProposal(new PrePropose(VALIDATORS.get(2).id(), stale))).isFalse();
    assertThat(context.outboundSize()).isZero();
  }

  @Test
  void contentSignedOffTheRosterIsDropped() {
    final var foreign = PreProposal.generate(HEIGHT, OUTSIDER, OrderSet.empty());

    assertThat(context.handlePreProposal(new PrePropose(VALIDATORS.get(2).id(), foreign))).isFalse();
  }

  @Test
  void proposalIsOnlyAcceptedFromTheLeader() {
    final var fromFollower = Proposal.generate(HEIGHT, VALIDATORS.get(2), List.of(), List.of());
    final var fromLeader = Proposal.generate(HEIGHT, VALIDATORS.get(0), List.of(), List.of());

    assertThat(context.verifyProposal(new Propose(VALIDATORS.get(2).id(), fromFollower))).isEmpty();
    assertThat(context.verifyProposal(new Propose(VALIDATORS.get(2).id(), fromLeader))).contains(fromLeader);
    assertThat(context.proposal()).contains(fromLeader);
  }

  @Test
  void secondProposalFromTheLeaderIsIgnored() {
    final var first = Proposal.generate(HEIGHT, VALIDATORS.get(0), List.of(), List.of());
    final var second = Proposal.generate(HEIGHT, VALIDATORS.get(0), List.of(preProposal(0, bid)), List.of());

    context.verifyProposal(new Propose(VALIDATORS.get(0).id(), first));

    assertThat(context.verifyProposal(new Propose(VALIDATORS.get(0).id(), second))).isEmpty();
    assertThat(context.verifyProposal(new Propose(VALIDATORS.get(2).id(), first))).isEmpty();
    assertThat(context.proposal()).contains(first);
  }

  @Test
  void eachValidatorVotesOnce() {
    final var proposal = Proposal.generate(HEIGHT, VALIDATORS.get(0), List.of(), List.of());
    final var carol = VALIDATORS.get(2);

    assertThat(context.handleCommit(new Commit(carol.id(), CommitVote.commit(HEIGHT, carol, proposal.digest()))))
        .isTrue();
    assertThat(context.handleCommit(new Commit(carol.id(), CommitVote.nil(HEIGHT, carol, Optional.empty()))))
        .isFalse();

    assertThat(context.commitTally().size()).isEqualTo(1);
    assertThat(context.commitTally().commitsFor(proposal.digest())).hasSize(1);
  }

  @Test
  void ordersSeenByAMinorityAreFiltered() {
    final var inputs = List.of(
        preProposal(0, bid, ask, minority),
        preProposal(1, bid, ask),
        preProposal(2, bid, ask, minority),
        preProposal(3, bid));

    final var filtered = RoundContext.filterQuorumOrders(inputs, 3);

    assertThat(filtered.allLimit()).containsExactly(ask, bid);
  }

  @Test
  void repeatSightingsFromOneSourceCountOnce() {
    final var inputs = List.of(
        preProposal(0, minority),
        preProposal(0, minority, bid),
        preProposal(0, minority, ask),
        preProposal(1, minority));

    assertThat(RoundContext.filterQuorumOrders(inputs, 3).allLimit()).isEmpty();
  }

  @Property(tries = 40)
  void orderNeedsQuorumSightings(@ForAll @IntRange(min = 1, max = 7) int validators,
                                 @ForAll @IntRange(min = 0, max = 7) int sightings) {
    final int seenBy = Math.min(sightings, validators);
    final int quorum = TwoThirdsQuorum.INSTANCE.quorum(validators);
    final var inputs = new ArrayList<PreProposal>();
    for (int i = 0; i < validators; i++) {
      inputs.add(i < seenBy ? preProposal(i, bid, minority) : preProposal(i, bid));
    }

    final var filtered = RoundContext.filterQuorumOrders(inputs, quorum).allLimit();

    assertThat(filtered).contains(bid);
    assertThat(filtered.contains(minority)).isEqualTo(seenBy >= quorum);
  }

  @Test
  void searcherOrdersAreFilteredToo() {
    final var searcher = new SearcherOrder(new OrderId("s1"), new PoolId("ETH-USDC"), 3);
    final var withSearcher = OrderSet.of(List.of(), List.of(searcher));
    final var inputs = List.of(
        PreProposal.generate(HEIGHT, VALIDATORS.get(0), withSearcher),
        PreProposal.generate(HEIGHT, VALIDATORS.get(1), withSearcher),
        PreProposal.generate(HEIGHT, VALIDATORS.get(2), OrderSet.empty()));

    assertThat(RoundContext.filterQuorumOrders(inputs, 2).allSearcher()).containsExactly(searcher);
    assertThat(RoundContext.filterQuorumOrders(inputs, 3).allSearcher()).isEmpty();
  }

  @Test
  void markFilledMovesCompleteFillsAndTheSearcher() {
    final var searcher = new SearcherOrder(new OrderId("s1"), new PoolId("ETH-USDC"), 3);
    storage.addLimitOrder(bid);
    storage.addLimitOrder(ask);
    storage.addSearcherOrder(searcher);
    final var solution = new PoolSolution(new PoolId("ETH-USDC"), Price.of(100), Optional.empty(),
        Optional.of(searcher), List.of(
        new OrderOutcome(bid.id(), new OrderFillState.CompleteFill()),
        new OrderOutcome(ask.id(), new OrderFillState.PartialFill(2))));
    final var proposal = Proposal.generate(HEIGHT, VALIDATORS.get(0), List.of(), List.of(solution));

    context.markFilled(proposal);

    // the partially filled standing ask rests with its remainder
    assertThat(storage.eligibleOrders().allLimit()).containsExactly(ask.withQuantity(8));
    assertThat(storage.eligibleOrders().allSearcher()).isEmpty();
    assertThat(storage.finalizedBlock(HEIGHT)).containsExactlyInAnyOrder(bid.id(), searcher.id());
  }

  @Test
  void partiallyFilledFlashOrderLeavesThePool() {
    final var flash = ask.withKind(OrderKind.FLASH);
    storage.addLimitOrder(bid);
    storage.addLimitOrder(flash);
    final var solution = new PoolSolution(new PoolId("ETH-USDC"), Price.of(100), Optional.empty(),
        Optional.empty(), List.of(
        new OrderOutcome(bid.id(), new OrderFillState.CompleteFill()),
        new OrderOutcome(flash.id(), new OrderFillState.PartialFill(2))));

    context.markFilled(Proposal.generate(HEIGHT, VALIDATORS.get(0), List.of(), List.of(solution)));

    assertThat(storage.eligibleOrders().isEmpty()).isTrue();
    assertThat(storage.reorg(List.of(flash.id()))).containsExactly(flash.id());
    assertThat(storage.eligibleOrders().allLimit()).containsExactly(flash);
  }

  @Test
  void partialFillOfAnOrderWeDoNotHoldIsIgnored() {
    final var solution = new PoolSolution(new PoolId("ETH-USDC"), Price.of(100), Optional.empty(),
        Optional.empty(), List.of(new OrderOutcome(ask.id(), new OrderFillState.PartialFill(2))));

    context.markFilled(Proposal.generate(HEIGHT, VALIDATORS.get(0), List.of(), List.of(solution)));

    assertThat(storage.eligibleOrders().isEmpty()).isTrue();
    assertThat(storage.finalizedBlock(HEIGHT)).isEmpty();
  }

  @Test
  void leaderMustBeOnTheRoster() {
    assertThatThrownBy(() -> new RoundContext(HEIGHT, OUTSIDER.id(),
            VALIDATORS.roster(), VALIDATORS.get(0), TwoThirdsQuorum.INSTANCE, storage, new BookSolver(Runnable::run),
            PoolSnapshotSource.none(), RoundConfig.DEFAULT, new MutableClock()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
