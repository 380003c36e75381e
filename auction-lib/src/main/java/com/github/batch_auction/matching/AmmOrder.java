// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.Price;

import java.math.BigDecimal;
import java.util.Optional;

/// A synthetic order against the AMM curve. It never has a resting order identity so it never appears in the outcome
/// list of a solution.
///
/// @param side  the side of the book the AMM is on
/// @param start the curve position when the order was offered
/// @param bound the price of the next resting order on the same side, the AMM stops there to let that order trade
public record AmmOrder(Direction side, MarketPrice start, Optional<Price> bound) {

  public Price price() {
    return start.price();
  }

  /// @return how much base the AMM can trade before its price passes the opposing price or its own bound.
  public long quantity(Price opposing) {
    final Price limit;
    if (bound.isPresent()) {
      final var b = bound.get();
      limit = side == Direction.BID ? max(b, opposing) : min(b, opposing);
    } else {
      limit = opposing;
    }
    final var current = start.price();
    if (side == Direction.BID ? !current.greaterThan(limit) : !current.lessThan(limit)) {
      return 0;
    }
    return start.baseToReach(limit);
  }

  public AmmFill fill(long quantity) {
    final var end = start.afterTrade(side, quantity);
    return new AmmFill(end, quantity, start.quote().subtract(end.quote()).abs());
  }

  /// @param end        the curve position after the fill
  /// @param baseDelta  base traded
  /// @param quoteDelta quote traded
  public record AmmFill(MarketPrice end, long baseDelta, BigDecimal quoteDelta) {
  }

  private static Price max(Price a, Price b) {
    return a.greaterThan(b) ? a : b;
  }

  private static Price min(Price a, Price b) {
    return a.lessThan(b) ? a : b;
  }
}
