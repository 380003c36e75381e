// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.OrderId;
import com.github.batch_auction.orders.OrderKind;
import com.github.batch_auction.orders.Price;
import com.github.batch_auction.orders.SearcherOrder;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;

import static com.github.batch_auction.AuctionLogger.LOGGER;

/// Walks the bids down and the asks up of a single [OrderBook], matching the best remaining bid against the best
/// remaining ask until the prices no longer cross. When the book has an AMM it is offered as a synthetic order on
/// whichever side it is priced better than the next resting order. A step that fills exactly ends at the midpoint
/// of the two prices, otherwise the price of the order that was only partly consumed becomes the clearing price.
///
/// Whenever the state is one that could be published, i.e. there is no outstanding fragment or the fragment belongs
/// to a standing order that may rest partially filled, the matcher records a checkpoint. [#fromCheckpoint()] and
/// [#restoreCheckpoint()] go back to that state.
///
/// Each step either completes at least one resting order, or moves the AMM to the next resting price, so the loop
/// always terminates.
public class VolumeFillMatcher {
  private final OrderBook book;
  private final Set<OrderId> dead;
  private int bidIdx;
  private final OrderFillState[] bidOutcomes;
  private int askIdx;
  private final OrderFillState[] askOutcomes;
  private @Nullable MarketPrice ammPrice;
  private @Nullable NetAmmOrder ammOutcome;
  private @Nullable LimitOrder currentPartial;
  private Solution results;
  private long iterations;
  private @Nullable Checkpoint checkpoint;

  /// A flat copy of the mutable solve state. A checkpoint never holds a checkpoint.
  record Checkpoint(
      int bidIdx,
      List<OrderFillState> bidOutcomes,
      int askIdx,
      List<OrderFillState> askOutcomes,
      @Nullable MarketPrice ammPrice,
      @Nullable NetAmmOrder ammOutcome,
      @Nullable LimitOrder currentPartial,
      Solution results,
      long iterations
  ) {
  }

  public VolumeFillMatcher(OrderBook book) {
    this(book, Set.of());
  }

  /// @param dead orders that must be skipped because they were excluded on another pool or by validation
  public VolumeFillMatcher(OrderBook book, Set<OrderId> dead) {
    this.book = Objects.requireNonNull(book);
    this.dead = Set.copyOf(dead);
    this.bidOutcomes = new OrderFillState[book.bids().size()];
    this.askOutcomes = new OrderFillState[book.asks().size()];
    Arrays.fill(bidOutcomes, OrderFillState.UNFILLED);
    Arrays.fill(askOutcomes, OrderFillState.UNFILLED);
    this.ammPrice = book.amm().map(AmmSnapshot::currentPosition).orElse(null);
    this.results = Solution.EMPTY;
    saveCheckpoint();
  }

  private VolumeFillMatcher(VolumeFillMatcher other, Checkpoint from) {
    this.book = other.book;
    this.dead = other.dead;
    this.bidOutcomes = from.bidOutcomes().toArray(new OrderFillState[0]);
    this.askOutcomes = from.askOutcomes().toArray(new OrderFillState[0]);
    apply(from);
    this.checkpoint = from;
  }

  private void apply(Checkpoint from) {
    this.bidIdx = from.bidIdx();
    this.askIdx = from.askIdx();
    this.ammPrice = from.ammPrice();
    this.ammOutcome = from.ammOutcome();
    this.currentPartial = from.currentPartial();
    this.results = from.results();
    this.iterations = from.iterations();
  }

  private void saveCheckpoint() {
    checkpoint = new Checkpoint(
        bidIdx, List.of(bidOutcomes),
        askIdx, List.of(askOutcomes),
        ammPrice, ammOutcome, currentPartial, results, iterations);
  }

  /// @return a new matcher in the last good state, leaving this matcher untouched.
  public Optional<VolumeFillMatcher> fromCheckpoint() {
    return Optional.ofNullable(checkpoint).map(cp -> new VolumeFillMatcher(this, cp));
  }

  /// Rewinds this matcher to the last good state. The checkpoint is consumed.
  ///
  /// @return false if there was no checkpoint to restore.
  public boolean restoreCheckpoint() {
    final var cp = checkpoint;
    if (cp == null) {
      return false;
    }
    checkpoint = null;
    for (int i = 0; i < bidOutcomes.length; i++) {
      bidOutcomes[i] = cp.bidOutcomes().get(i);
    }
    for (int i = 0; i < askOutcomes.length; i++) {
      askOutcomes[i] = cp.askOutcomes().get(i);
    }
    apply(cp);
    return true;
  }

  /// The most loop iterations [#fill()] can take, counting the final check that ends it. Without an AMM every step
  /// except the last completes at least one resting order. With an AMM there can also be one AMM step per resting
  /// price boundary it trades up to, and one open ended step to the opposing order's price.
  public static long iterationBound(int bids, int asks, boolean withAmm) {
    final long orders = (long) bids + asks;
    return withAmm ? 2 * (orders + 1) : orders + 1;
  }

  public EndReason fill() {
    while (true) {
      iterations++;
      final OrderContainer bid;
      if (currentPartial != null && currentPartial.bid()) {
        bid = new OrderContainer.BookOrderFragment(currentPartial);
      } else {
        final var next = tryNextOrder(Direction.BID);
        if (next.isEmpty()) {
          return finish(EndReason.NO_MORE_BIDS);
        }
        bid = next.get();
      }
      final OrderContainer ask;
      if (currentPartial != null && !currentPartial.bid()) {
        ask = new OrderContainer.BookOrderFragment(currentPartial);
      } else {
        final var next = tryNextOrder(Direction.ASK);
        if (next.isEmpty()) {
          return finish(EndReason.NO_MORE_ASKS);
        }
        ask = next.get();
      }

      if (bid.isAmm() && ask.isAmm()) {
        return finish(EndReason.BOTH_SIDES_AMM);
      }
      if (ask.price().greaterThan(bid.price())) {
        return finish(EndReason.NO_LONGER_CROSS);
      }

      // the AMM only offers what it can trade before crossing the other side's price
      final long askQ = ask.quantity(bid.price());
      final long bidQ = bid.quantity(ask.price());
      if (askQ == 0 || bidQ == 0) {
        return finish(EndReason.ZERO_QUANTITY);
      }

      final long matched = Math.min(askQ, bidQ);
      results = results.matched(matched, bid.isFragment(), ask.isFragment());

      final var amm = bid instanceof OrderContainer.Amm b ? b.order()
          : ask instanceof OrderContainer.Amm a ? a.order() : null;
      if (amm != null) {
        final var ammFill = amm.fill(matched);
        ammPrice = ammFill.end();
        results = results.withAmm(matched, ammFill.end().price());
        if (ammOutcome == null) {
          ammOutcome = NetAmmOrder.empty(amm.side());
        }
        ammOutcome = ammOutcome.add(ammFill.baseDelta(), ammFill.quoteDelta());
      }

      final int cmp = Long.compare(bidQ, askQ);
      if (cmp == 0) {
        results = results.withPrice(ask.price().midpoint(bid.price()));
        if (!ask.isAmm()) {
          askOutcomes[askIdx] = OrderFillState.COMPLETE_FILL;
        }
        if (!bid.isAmm()) {
          bidOutcomes[bidIdx] = OrderFillState.COMPLETE_FILL;
        }
        currentPartial = null;
      } else if (cmp > 0) {
        results = results.withPrice(bid.price());
        if (!ask.isAmm()) {
          askOutcomes[askIdx] = OrderFillState.COMPLETE_FILL;
        }
        if (!bid.isAmm()) {
          bidOutcomes[bidIdx] = bidOutcomes[bidIdx].partialFill(matched);
          currentPartial = OrderContainer.remainder(bid, askQ);
        } else {
          currentPartial = null;
        }
      } else {
        results = results.withPrice(ask.price());
        if (!bid.isAmm()) {
          bidOutcomes[bidIdx] = OrderFillState.COMPLETE_FILL;
        }
        if (!ask.isAmm()) {
          askOutcomes[askIdx] = askOutcomes[askIdx].partialFill(matched);
          currentPartial = OrderContainer.remainder(ask, bidQ);
        } else {
          currentPartial = null;
        }
      }

      if (currentPartial == null || currentPartial.kind() == OrderKind.STANDING) {
        saveCheckpoint();
      }
    }
  }

  private EndReason finish(EndReason reason) {
    LOGGER.finer(() -> "solved " + book.id() + " after " + iterations + " steps with " + reason
        + " volume=" + results.totalVolume() + " price=" + results.price().map(Price::toString).orElse("none"));
    return reason;
  }

  /// Finds the next unfilled live order on one side and decides whether the AMM beats it. The cursor only moves when
  /// the AMM does not take precedence.
  private Optional<OrderContainer> tryNextOrder(Direction direction) {
    final var orders = direction == Direction.BID ? book.bids() : book.asks();
    final var outcomes = direction == Direction.BID ? bidOutcomes : askOutcomes;
    int index = direction == Direction.BID ? bidIdx : askIdx;
    while (index < outcomes.length) {
      if (dead.contains(orders.get(index).id()) || !outcomes[index].isUnfilled()) {
        index++;
      } else {
        break;
      }
    }
    final Optional<Price> target = index < orders.size() ? Optional.of(orders.get(index).price()) : Optional.empty();
    final Optional<OrderContainer> amm = ammPrice == null ? Optional.empty()
        : ammPrice.orderToTarget(target, direction).map(OrderContainer.Amm::new);
    if (amm.isPresent()) {
      return amm;
    }
    if (direction == Direction.BID) {
      bidIdx = index;
    } else {
      askIdx = index;
    }
    return index < orders.size() ? Optional.of(new OrderContainer.BookOrder(orders.get(index))) : Optional.empty();
  }

  /// Reports every resting order of the book, bids first, with its fill state. A book that never crossed clears at
  /// zero.
  public PoolSolution solution(Optional<SearcherOrder> searcher) {
    final var outcomes = new ArrayList<OrderOutcome>(bidOutcomes.length + askOutcomes.length);
    for (int i = 0; i < bidOutcomes.length; i++) {
      outcomes.add(new OrderOutcome(book.bids().get(i).id(), bidOutcomes[i]));
    }
    for (int i = 0; i < askOutcomes.length; i++) {
      outcomes.add(new OrderOutcome(book.asks().get(i).id(), askOutcomes[i]));
    }
    if (LOGGER.isLoggable(Level.FINEST)) {
      LOGGER.finest("solution " + book.id() + " outcomes=" + outcomes);
    }
    return new PoolSolution(book.id(), results.price().orElse(Price.ZERO), Optional.ofNullable(ammOutcome), searcher, outcomes);
  }

  public Solution results() {
    return results;
  }

  public long iterations() {
    return iterations;
  }

  @TestOnly
  @Nullable
  LimitOrder currentPartial() {
    return currentPartial;
  }

  @TestOnly
  List<OrderFillState> bidOutcomes() {
    return List.of(bidOutcomes);
  }

  @TestOnly
  List<OrderFillState> askOutcomes() {
    return List.of(askOutcomes);
  }
}
