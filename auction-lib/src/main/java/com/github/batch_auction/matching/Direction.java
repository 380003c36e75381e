// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

public enum Direction {
  BID,
  ASK;

  public boolean isAsk() {
    return this == ASK;
  }
}
