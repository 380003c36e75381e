// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.orders;

import java.util.Objects;

/// The hash that identifies a user order across all validators.
public record OrderId(String hash) implements Comparable<OrderId> {
  public OrderId {
    Objects.requireNonNull(hash);
    if (hash.isBlank()) {
      throw new IllegalArgumentException("order hash must not be blank");
    }
  }

  @Override
  public int compareTo(OrderId other) {
    return hash.compareTo(other.hash);
  }

  @Override
  public String toString() {
    return hash;
  }
}
