// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.PoolId;
import com.github.batch_auction.orders.SearcherOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import static com.github.batch_auction.AuctionLogger.LOGGER;

/// Runs one [VolumeFillMatcher] per pool on the supplied executor. The pools are solved in pool order on a single
/// task so the work is the same no matter which validator runs it.
public class BookSolver implements MatchingEngine {
  private final Executor executor;

  public BookSolver(Executor executor) {
    this.executor = Objects.requireNonNull(executor);
  }

  @Override
  public CompletableFuture<List<PoolSolution>> solvePools(List<LimitOrder> limit,
                                                         List<SearcherOrder> searcher,
                                                         Map<PoolId, AmmSnapshot> pools) {
    final var limitCopy = List.copyOf(limit);
    final var searcherCopy = List.copyOf(searcher);
    final var poolsCopy = Map.copyOf(pools);
    return CompletableFuture.supplyAsync(() -> solve(limitCopy, searcherCopy, poolsCopy), executor);
  }

  /// Solves synchronously. A pool with neither limit nor searcher orders has no solution even if it has an AMM.
  public static List<PoolSolution> solve(List<LimitOrder> limit,
                                         List<SearcherOrder> searcher,
                                         Map<PoolId, AmmSnapshot> pools) {
    final var limitByPool = limit.stream()
        .collect(Collectors.groupingBy(LimitOrder::pool, TreeMap::new, Collectors.toList()));
    final var searcherByPool = searcher.stream()
        .collect(Collectors.groupingBy(SearcherOrder::pool, TreeMap::new, Collectors.toList()));
    final Set<PoolId> poolIds = new TreeSet<>(limitByPool.keySet());
    poolIds.addAll(searcherByPool.keySet());

    final var solutions = new ArrayList<PoolSolution>(poolIds.size());
    for (var pool : poolIds) {
      final var book = OrderBook.build(pool, Optional.ofNullable(pools.get(pool)),
          limitByPool.getOrDefault(pool, List.of()));
      final var matcher = new VolumeFillMatcher(book);
      final var reason = matcher.fill();
      final var winner = searcherByPool.getOrDefault(pool, List.of()).stream()
          .min(SearcherOrder.PRIORITY);
      LOGGER.fine(() -> "pool " + pool + " " + book + " ended " + reason + " " + matcher.results());
      solutions.add(matcher.solution(winner));
    }
    return List.copyOf(solutions);
  }
}
