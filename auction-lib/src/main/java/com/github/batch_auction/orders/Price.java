// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.orders;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/// A price in quote units per base unit. Prices are held at a fixed scale so that record equality and the canonical
/// serialization are the same on every validator.
public record Price(BigDecimal value) implements Comparable<Price> {
  public static final int SCALE = 18;

  public static final Price ZERO = new Price(BigDecimal.ZERO);

  public Price {
    Objects.requireNonNull(value);
    if (value.signum() < 0) {
      throw new IllegalArgumentException("price must not be negative: " + value);
    }
    value = value.setScale(SCALE, RoundingMode.HALF_EVEN);
  }

  public static Price of(long value) {
    return new Price(BigDecimal.valueOf(value));
  }

  public static Price of(String value) {
    return new Price(new BigDecimal(value));
  }

  /// The arithmetic midpoint used as the settlement price when a bid and an ask annihilate each other.
  public Price midpoint(Price other) {
    return new Price(value.add(other.value).divide(BigDecimal.valueOf(2), SCALE, RoundingMode.HALF_EVEN));
  }

  public boolean greaterThan(Price other) {
    return compareTo(other) > 0;
  }

  public boolean lessThan(Price other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(Price other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value.stripTrailingZeros().toPlainString();
  }
}
