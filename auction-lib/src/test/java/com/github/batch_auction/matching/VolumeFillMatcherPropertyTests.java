// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.OrderId;
import com.github.batch_auction.orders.OrderKind;
import com.github.batch_auction.orders.PoolId;
import com.github.batch_auction.orders.Price;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/// Property tests over random books. Prices are drawn from a narrow band so that most books cross.
public class VolumeFillMatcherPropertyTests {
  static final PoolId POOL = new PoolId("ETH-USDC");

  record Generated(boolean bid, int price, long quantity, OrderKind kind) {
  }

  record Market(List<LimitOrder> orders, Optional<AmmSnapshot> amm) {
  }

  @Property
  void solvingIsDeterministic(@ForAll("markets") Market market) {
    final var reversed = new ArrayList<>(market.orders());
    Collections.reverse(reversed);
    final var first = new VolumeFillMatcher(OrderBook.build(POOL, market.amm(), market.orders()));
    final var second = new VolumeFillMatcher(OrderBook.build(POOL, market.amm(), reversed));

    assertThat(first.fill()).isEqualTo(second.fill());
    assertThat(first.solution(Optional.empty())).isEqualTo(second.solution(Optional.empty()));
    assertThat(first.results()).isEqualTo(second.results());
  }

  @Property
  void booksWithoutAnAmmTerminateWithinBound(@ForAll("books") List<LimitOrder> orders) {
    final var book = OrderBook.build(POOL, Optional.empty(), orders);
    final var matcher = new VolumeFillMatcher(book);

    assertThat(matcher.fill()).isNotNull();
    assertThat(matcher.iterations())
        .isLessThanOrEqualTo(VolumeFillMatcher.iterationBound(book.bids().size(), book.asks().size(), false))
        .isLessThanOrEqualTo(book.bids().size() + book.asks().size() + 1);
  }

  @Property
  void booksWithAnAmmTerminateWithinBound(@ForAll("markets") Market market) {
    final var book = OrderBook.build(POOL, market.amm(), market.orders());
    final var matcher = new VolumeFillMatcher(book);

    assertThat(matcher.fill()).isNotNull();
    assertThat(matcher.iterations()).isLessThanOrEqualTo(
        VolumeFillMatcher.iterationBound(book.bids().size(), book.asks().size(), book.amm().isPresent()));
  }

  @Property
  void bothSidesFillTheMatchedVolume(@ForAll("books") List<LimitOrder> orders) {
    final var matcher = new VolumeFillMatcher(OrderBook.build(POOL, Optional.empty(), orders));
    matcher.fill();
    final var solution = matcher.solution(Optional.empty());
    final Map<OrderId, LimitOrder> byId = orders.stream()
        .collect(Collectors.toMap(LimitOrder::id, Function.identity()));

    long bidFilled = 0;
    long askFilled = 0;
    for (var outcome : solution.outcomes()) {
      final var order = byId.get(outcome.id());
      final long filled = filled(order, outcome.outcome());
      assertThat(filled).isBetween(0L, order.quantity());
      if (order.bid()) {
        bidFilled += filled;
      } else {
        askFilled += filled;
      }
    }
    assertThat(bidFilled).isEqualTo(matcher.results().totalVolume());
    assertThat(askFilled).isEqualTo(matcher.results().totalVolume());
  }

  @Property
  void clearingPriceIsWithinTheCrossedOrders(@ForAll("books") List<LimitOrder> orders) {
    final var matcher = new VolumeFillMatcher(OrderBook.build(POOL, Optional.empty(), orders));
    matcher.fill();
    final var solution = matcher.solution(Optional.empty());
    final Map<OrderId, LimitOrder> byId = orders.stream()
        .collect(Collectors.toMap(LimitOrder::id, Function.identity()));

    for (var outcome : solution.outcomes()) {
      if (outcome.outcome().isUnfilled()) {
        continue;
      }
      final var order = byId.get(outcome.id());
      // no filled bid pays more than its limit and no filled ask receives less than its limit
      if (order.bid()) {
        assertThat(solution.clearingPrice().greaterThan(order.price())).isFalse();
      } else {
        assertThat(solution.clearingPrice().lessThan(order.price())).isFalse();
      }
    }
  }

  static long filled(LimitOrder order, OrderFillState state) {
    if (state instanceof OrderFillState.PartialFill p) {
      return p.filledQuantity();
    } else if (state.isComplete()) {
      return order.quantity();
    }
    return 0;
  }

  @Provide
  @SuppressWarnings("unused")
  Arbitrary<List<LimitOrder>> books() {
    final Arbitrary<Generated> generated = Combinators.combine(
        Arbitraries.of(true, false),
        Arbitraries.integers().between(95, 105),
        Arbitraries.longs().between(1, 20),
        Arbitraries.of(OrderKind.values())
    ).as(Generated::new);
    return generated.list().ofMaxSize(12).map(list -> IntStream.range(0, list.size())
        .mapToObj(i -> {
          final var g = list.get(i);
          return new LimitOrder(new OrderId("o" + i), POOL, g.bid(), Price.of(g.price()), g.quantity(), g.kind());
        })
        .toList());
  }

  @Provide
  @SuppressWarnings("unused")
  Arbitrary<Market> markets() {
    final Arbitrary<Optional<AmmSnapshot>> amm = Combinators.combine(
        Arbitraries.longs().between(50, 500),
        Arbitraries.integers().between(95, 105)
    ).as((base, price) -> AmmSnapshot.of(base, base * price)).optional();
    return Combinators.combine(books(), amm).as(Market::new);
  }
}
