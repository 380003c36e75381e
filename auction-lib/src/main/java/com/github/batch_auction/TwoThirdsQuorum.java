// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

/// A byzantine supermajority of `ceil(2n/3)` validators. With seven validators five must agree.
public class TwoThirdsQuorum implements QuorumStrategy {
  public static final TwoThirdsQuorum INSTANCE = new TwoThirdsQuorum();

  @Override
  public int quorum(int validators) {
    if (validators <= 0) {
      throw new IllegalArgumentException("validators must be positive: " + validators);
    }
    return (2 * validators + 2) / 3;
  }
}
