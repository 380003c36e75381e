// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.orders;

import java.util.Objects;

/// Identifies a trading pool. Pool keyed maps are sorted by this key before they are signed.
public record PoolId(String name) implements Comparable<PoolId> {
  public PoolId {
    Objects.requireNonNull(name);
    if (name.isBlank()) {
      throw new IllegalArgumentException("pool name must not be blank");
    }
  }

  @Override
  public int compareTo(PoolId other) {
    return name.compareTo(other.name);
  }

  @Override
  public String toString() {
    return name;
  }
}
