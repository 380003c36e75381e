// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.orders;

import java.util.Comparator;
import java.util.Objects;

/// A top of block priority order. A searcher pays a tip for the right to trade first in a pool; each pool has at most
/// one winning searcher order per block.
public record SearcherOrder(OrderId id, PoolId pool, long tip) {
  /// Highest tip first then the lowest order hash so that every validator picks the same winner.
  public static final Comparator<SearcherOrder> PRIORITY = Comparator
      .comparingLong(SearcherOrder::tip).reversed()
      .thenComparing(SearcherOrder::id);

  public SearcherOrder {
    Objects.requireNonNull(id);
    Objects.requireNonNull(pool);
    if (tip < 0) {
      throw new IllegalArgumentException("tip must not be negative: " + tip);
    }
  }
}
