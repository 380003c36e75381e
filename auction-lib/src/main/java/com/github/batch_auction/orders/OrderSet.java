// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.orders;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/// A snapshot of the eligible orders of a validator keyed by pool.
public record OrderSet(Map<PoolId, List<LimitOrder>> limit, Map<PoolId, List<SearcherOrder>> searcher) {
  public OrderSet {
    limit = copy(limit);
    searcher = copy(searcher);
  }

  public static OrderSet empty() {
    return new OrderSet(Map.of(), Map.of());
  }

  public static OrderSet of(Collection<LimitOrder> limitOrders, Collection<SearcherOrder> searcherOrders) {
    return new OrderSet(
        limitOrders.stream().collect(Collectors.groupingBy(LimitOrder::pool)),
        searcherOrders.stream().collect(Collectors.groupingBy(SearcherOrder::pool))
    );
  }

  public boolean isEmpty() {
    return limit.isEmpty() && searcher.isEmpty();
  }

  public List<LimitOrder> allLimit() {
    return limit.values().stream().flatMap(List::stream).toList();
  }

  public List<SearcherOrder> allSearcher() {
    return searcher.values().stream().flatMap(List::stream).toList();
  }

  private static <T> Map<PoolId, List<T>> copy(Map<PoolId, List<T>> byPool) {
    final var sorted = new TreeMap<PoolId, List<T>>();
    byPool.forEach((pool, orders) -> {
      if (!orders.isEmpty()) {
        sorted.put(pool, List.copyOf(orders));
      }
    });
    return Collections.unmodifiableSortedMap(sorted);
  }
}
