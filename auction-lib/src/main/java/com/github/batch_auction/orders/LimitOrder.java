// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.orders;

import java.util.Objects;

/// A resting limit order on one side of a pool's book.
///
/// @param id       the order hash
/// @param pool     the pool the order trades in
/// @param bid      true when the order buys the base asset
/// @param price    the limit price in quote per base
/// @param quantity the base quantity still to be filled
/// @param kind     whether a partial fill may rest
public record LimitOrder(OrderId id, PoolId pool, boolean bid, Price price, long quantity, OrderKind kind) {
  public LimitOrder {
    Objects.requireNonNull(id);
    Objects.requireNonNull(pool);
    Objects.requireNonNull(price);
    Objects.requireNonNull(kind);
    if (quantity <= 0) {
      throw new IllegalArgumentException("quantity must be positive: " + quantity);
    }
  }

  public static LimitOrder bid(String id, String pool, long price, long quantity) {
    return new LimitOrder(new OrderId(id), new PoolId(pool), true, Price.of(price), quantity, OrderKind.STANDING);
  }

  public static LimitOrder ask(String id, String pool, long price, long quantity) {
    return new LimitOrder(new OrderId(id), new PoolId(pool), false, Price.of(price), quantity, OrderKind.STANDING);
  }

  /// @return the same order carrying only the unfilled remainder.
  public LimitOrder withQuantity(long remaining) {
    return new LimitOrder(id, pool, bid, price, remaining, kind);
  }

  public LimitOrder withKind(OrderKind newKind) {
    return new LimitOrder(id, pool, bid, price, quantity, newKind);
  }
}
