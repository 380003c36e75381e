// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.Price;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/// The net trade of a solve against the AMM curve. When the direction is [Direction#BID] the AMM bought base and paid
/// quote; when it is [Direction#ASK] the AMM sold base and received quote.
///
/// @param direction     which side of the book the AMM was on
/// @param baseQuantity  total base moved through the AMM
/// @param quoteQuantity total quote moved through the AMM held at [Price#SCALE]
public record NetAmmOrder(Direction direction, long baseQuantity, BigDecimal quoteQuantity) {
  public NetAmmOrder {
    Objects.requireNonNull(direction);
    quoteQuantity = quoteQuantity.setScale(Price.SCALE, RoundingMode.HALF_EVEN);
  }

  public static NetAmmOrder empty(Direction direction) {
    return new NetAmmOrder(direction, 0, BigDecimal.ZERO);
  }

  public NetAmmOrder add(long base, BigDecimal quote) {
    return new NetAmmOrder(direction, Math.addExact(baseQuantity, base), quoteQuantity.add(quote));
  }
}
