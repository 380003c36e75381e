// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.Price;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;

/// A position on the constant product curve `base * quote = k`. The price is `quote / base`. Moving the curve to a
/// price `p` leaves `sqrt(k / p)` base in the pool. All arithmetic uses [MathContext#DECIMAL128] so that every
/// validator computes the same quantities.
public record MarketPrice(BigDecimal base, BigDecimal quote) {
  static final MathContext MC = MathContext.DECIMAL128;

  public Price price() {
    return new Price(quote.divide(base, MC));
  }

  BigDecimal k() {
    return base.multiply(quote, MC);
  }

  BigDecimal baseAt(Price price) {
    return k().divide(price.value(), MC).sqrt(MC);
  }

  /// @return the whole base quantity that moves the curve from here towards the given price without passing it.
  public long baseToReach(Price target) {
    if (target.value().signum() == 0) {
      return Long.MAX_VALUE;
    }
    final var delta = base.subtract(baseAt(target)).abs().setScale(0, RoundingMode.DOWN);
    return delta.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) >= 0 ? Long.MAX_VALUE : delta.longValueExact();
  }

  /// @return the position after the AMM traded `quantity` base on the given side of the book.
  public MarketPrice afterTrade(Direction ammSide, long quantity) {
    final var q = BigDecimal.valueOf(quantity);
    final var newBase = ammSide == Direction.BID ? base.add(q) : base.subtract(q);
    if (newBase.signum() <= 0) {
      throw new IllegalArgumentException("trade of " + quantity + " would drain the pool base reserve " + base);
    }
    return new MarketPrice(newBase, k().divide(newBase, MC));
  }

  /// Offers the AMM as a synthetic order on one side of the book when the curve is priced better than the next
  /// resting order on that side. The AMM bids while its price is above the best book bid and asks while its price is
  /// below the best book ask.
  ///
  /// @param target the price of the next eligible resting order on the same side if there is one
  /// @param side   the side of the book the AMM would be on
  public Optional<AmmOrder> orderToTarget(Optional<Price> target, Direction side) {
    final var current = price();
    if (target.isPresent()) {
      final var t = target.get();
      final var better = side == Direction.BID ? current.greaterThan(t) : current.lessThan(t);
      if (!better || baseToReach(t) == 0) {
        return Optional.empty();
      }
    }
    return Optional.of(new AmmOrder(side, this, target));
  }
}
