// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.orders;

/// Standing orders live across blocks and may rest with a partial fill. Flash orders are only valid for the block
/// they were submitted in.
public enum OrderKind {
  STANDING,
  FLASH;

  public boolean allowsRestingPartial() {
    return this == STANDING;
  }
}
