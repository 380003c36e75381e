// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.Price;

import java.util.Optional;

/// Running totals of a solve. This is immutable so that a checkpoint can share it with the live matcher.
///
/// @param price             the settlement price of the last matching step
/// @param totalVolume       all base quantity matched
/// @param partialBidVolume  base quantity matched by the remainders of partially filled bids
/// @param partialAskVolume  base quantity matched by the remainders of partially filled asks
/// @param ammVolume         base quantity matched against the AMM
/// @param ammFinalPrice     the AMM price after the last AMM step
public record Solution(
    Optional<Price> price,
    long totalVolume,
    long partialBidVolume,
    long partialAskVolume,
    long ammVolume,
    Optional<Price> ammFinalPrice
) {
  public static final Solution EMPTY = new Solution(Optional.empty(), 0, 0, 0, 0, Optional.empty());

  Solution matched(long quantity, boolean bidFragment, boolean askFragment) {
    return new Solution(price, Math.addExact(totalVolume, quantity),
        Math.addExact(partialBidVolume, bidFragment ? quantity : 0),
        Math.addExact(partialAskVolume, askFragment ? quantity : 0),
        ammVolume, ammFinalPrice);
  }

  Solution withAmm(long quantity, Price finalPrice) {
    return new Solution(price, totalVolume, partialBidVolume, partialAskVolume, Math.addExact(ammVolume, quantity),
        Optional.of(finalPrice));
  }

  Solution withPrice(Price settlement) {
    return new Solution(Optional.of(settlement), totalVolume, partialBidVolume, partialAskVolume, ammVolume, ammFinalPrice);
  }
}
