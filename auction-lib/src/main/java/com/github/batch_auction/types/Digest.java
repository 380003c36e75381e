// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import java.util.Objects;

/// The hex SHA-256 of a canonical serialization. Two signed items with equal digests carry the same content even
/// when their signatures differ.
public record Digest(String hex) implements Comparable<Digest> {
  public Digest {
    Objects.requireNonNull(hex);
  }

  @Override
  public int compareTo(Digest other) {
    return hex.compareTo(other.hex);
  }

  @Override
  public String toString() {
    return hex.length() > 10 ? hex.substring(0, 10) : hex;
  }
}
