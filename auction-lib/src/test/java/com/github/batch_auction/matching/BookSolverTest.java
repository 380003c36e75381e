// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.OrderId;
import com.github.batch_auction.orders.PoolId;
import com.github.batch_auction.orders.Price;
import com.github.batch_auction.orders.SearcherOrder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

public class BookSolverTest {
  static final PoolId ETH = new PoolId("ETH-USDC");
  static final PoolId BTC = new PoolId("BTC-USDC");
  static final PoolId SOL = new PoolId("SOL-USDC");

  final List<LimitOrder> limit = List.of(
      LimitOrder.bid("e-b1", ETH.name(), 100, 10),
      LimitOrder.ask("e-a1", ETH.name(), 100, 10),
      LimitOrder.bid("b-b1", BTC.name(), 200, 1),
      LimitOrder.ask("b-a1", BTC.name(), 210, 1));

  @Test
  void solvesEveryPoolWithOrdersInPoolOrder() {
    final var solutions = BookSolver.solve(limit, List.of(), Map.of(SOL, AmmSnapshot.of(100, 1_000)));

    // SOL has an AMM but no orders so it is not solved
    assertThat(solutions).extracting(PoolSolution::pool).containsExactly(BTC, ETH);
    assertThat(solutions.get(0).clearingPrice()).isEqualTo(Price.ZERO);
    assertThat(solutions.get(1).clearingPrice()).isEqualTo(Price.of(100));
  }

  @Test
  void highestTipWinsTheSearcherSlot() {
    final var searchers = List.of(
        new SearcherOrder(new OrderId("s-low"), ETH, 5),
        new SearcherOrder(new OrderId("s-b"), ETH, 9),
        new SearcherOrder(new OrderId("s-a"), ETH, 9),
        new SearcherOrder(new OrderId("s-btc"), BTC, 1));

    final var solutions = BookSolver.solve(limit, searchers, Map.of());

    assertThat(solutions.get(1).searcher()).map(SearcherOrder::id).contains(new OrderId("s-a"));
    assertThat(solutions.get(0).searcher()).map(SearcherOrder::id).contains(new OrderId("s-btc"));
  }

  @Test
  void poolWithOnlyASearcherOrderIsSolved() {
    final var searcher = new SearcherOrder(new OrderId("s1"), SOL, 3);

    final var solutions = BookSolver.solve(List.of(), List.of(searcher), Map.of());

    assertThat(solutions).hasSize(1);
    assertThat(solutions.get(0).pool()).isEqualTo(SOL);
    assertThat(solutions.get(0).outcomes()).isEmpty();
    assertThat(solutions.get(0).searcher()).contains(searcher);
  }

  @Test
  void solvesOnTheExecutor() throws Exception {
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final var future = new BookSolver(executor).solvePools(limit, List.of(), Map.of());
      final var solutions = future.get(10, TimeUnit.SECONDS);
      assertThat(solutions).isEqualTo(BookSolver.solve(limit, List.of(), Map.of()));
    } finally {
      executor.shutdownNow();
    }
  }
}
