// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/// A DER encoded ECDSA signature. ECDSA signing is randomized so two signatures over the same payload differ. This is
/// why the signed content types never include the signature in their equality.
public record Signature(byte[] bytes) {
  public Signature {
    Objects.requireNonNull(bytes);
    bytes = bytes.clone();
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Signature other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    final var hex = HexFormat.of().formatHex(bytes);
    return "Signature(" + (hex.length() > 12 ? hex.substring(0, 12) : hex) + ")";
  }
}
