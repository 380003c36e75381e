// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

/// Why the volume fill matcher stopped. Exactly one of these is reported by every solve.
public enum EndReason {
  /// No eligible bid remains.
  NO_MORE_BIDS,
  /// No eligible ask remains.
  NO_MORE_ASKS,
  /// The best bid and the best ask are both the AMM so there is no genuine counterparty.
  BOTH_SIDES_AMM,
  /// The best bid price is below the best ask price.
  NO_LONGER_CROSS,
  /// One side can offer nothing at the other side's price.
  ZERO_QUANTITY
}
