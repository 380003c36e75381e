// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.PoolId;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// The book of one pool for one solve. Bids are non-increasing by price and asks are non-decreasing by price. The
/// constructor refuses anything else.
public final class OrderBook {
  private final PoolId id;
  private final Optional<AmmSnapshot> amm;
  private final List<LimitOrder> bids;
  private final List<LimitOrder> asks;

  public OrderBook(PoolId id, Optional<AmmSnapshot> amm, List<LimitOrder> bids, List<LimitOrder> asks) {
    this.id = Objects.requireNonNull(id);
    this.amm = Objects.requireNonNull(amm);
    this.bids = List.copyOf(bids);
    this.asks = List.copyOf(asks);
    for (int i = 1; i < this.bids.size(); i++) {
      if (this.bids.get(i).price().greaterThan(this.bids.get(i - 1).price())) {
        throw new IllegalArgumentException("bids aren't decreasing by price in pool " + id + " at index " + i);
      }
    }
    for (int i = 1; i < this.asks.size(); i++) {
      if (this.asks.get(i).price().lessThan(this.asks.get(i - 1).price())) {
        throw new IllegalArgumentException("asks aren't increasing by price in pool " + id + " at index " + i);
      }
    }
    if (!this.bids.stream().allMatch(LimitOrder::bid) || this.asks.stream().anyMatch(LimitOrder::bid)) {
      throw new IllegalArgumentException("order on the wrong side of the book in pool " + id);
    }
  }

  /// Splits the orders into bids and asks and sorts them with the given strategy.
  public static OrderBook build(PoolId id, Optional<AmmSnapshot> amm, Collection<LimitOrder> orders, SortStrategy strategy) {
    final var sides = orders.stream().collect(Collectors.partitioningBy(LimitOrder::bid));
    final var bids = sides.get(true).stream().sorted(strategy.bids()).toList();
    final var asks = sides.get(false).stream().sorted(strategy.asks()).toList();
    return new OrderBook(id, amm, bids, asks);
  }

  public static OrderBook build(PoolId id, Optional<AmmSnapshot> amm, Collection<LimitOrder> orders) {
    return build(id, amm, orders, SortStrategy.BY_PRICE_BY_VOLUME);
  }

  public PoolId id() {
    return id;
  }

  public Optional<AmmSnapshot> amm() {
    return amm;
  }

  public List<LimitOrder> bids() {
    return bids;
  }

  public List<LimitOrder> asks() {
    return asks;
  }

  @Override
  public String toString() {
    return "OrderBook(" + id + ", bids=" + bids.size() + ", asks=" + asks.size() + ", amm=" + amm.isPresent() + ")";
  }
}
