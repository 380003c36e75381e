// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.LimitOrder;

import java.util.Comparator;

/// How the two sides of a book are put into priority order. The final tie break on the order hash makes the order
/// total so two validators holding the same orders always build the same book.
public enum SortStrategy {
  BY_PRICE_BY_VOLUME(
      Comparator.comparing(LimitOrder::price).reversed()
          .thenComparing(Comparator.comparingLong(LimitOrder::quantity).reversed())
          .thenComparing(LimitOrder::id),
      Comparator.comparing(LimitOrder::price)
          .thenComparing(Comparator.comparingLong(LimitOrder::quantity).reversed())
          .thenComparing(LimitOrder::id)
  );

  private final Comparator<LimitOrder> bids;
  private final Comparator<LimitOrder> asks;

  SortStrategy(Comparator<LimitOrder> bids, Comparator<LimitOrder> asks) {
    this.bids = bids;
    this.asks = asks;
  }

  public Comparator<LimitOrder> bids() {
    return bids;
  }

  public Comparator<LimitOrder> asks() {
    return asks;
  }
}
