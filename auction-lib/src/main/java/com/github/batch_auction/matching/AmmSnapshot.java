// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import java.math.BigDecimal;
import java.util.Objects;

/// The reserves of a pool's constant product curve at the start of a block. All validators must read the same
/// snapshot for a height else a replay of the leader's solve will not agree.
public record AmmSnapshot(BigDecimal baseReserve, BigDecimal quoteReserve) {
  public AmmSnapshot {
    Objects.requireNonNull(baseReserve);
    Objects.requireNonNull(quoteReserve);
    if (baseReserve.signum() <= 0 || quoteReserve.signum() <= 0) {
      throw new IllegalArgumentException("reserves must be positive: base=" + baseReserve + " quote=" + quoteReserve);
    }
  }

  public static AmmSnapshot of(long baseReserve, long quoteReserve) {
    return new AmmSnapshot(BigDecimal.valueOf(baseReserve), BigDecimal.valueOf(quoteReserve));
  }

  public MarketPrice currentPosition() {
    return new MarketPrice(baseReserve, quoteReserve);
  }
}
