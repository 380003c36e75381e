// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/// The network identity of a validator. It is derived from the validator's public key so that a signature can be
/// checked against the roster entry of the claimed source.
public record PeerId(String id) implements Comparable<PeerId> {
  public PeerId {
    Objects.requireNonNull(id);
    if (id.isBlank()) {
      throw new IllegalArgumentException("peer id must not be blank");
    }
  }

  public static PeerId of(PublicKey publicKey) {
    try {
      final var hash = MessageDigest.getInstance("SHA-256").digest(publicKey.getEncoded());
      return new PeerId(HexFormat.of().formatHex(Arrays.copyOf(hash, 20)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

  @Override
  public int compareTo(PeerId other) {
    return id.compareTo(other.id);
  }

  @Override
  public String toString() {
    return id.length() > 8 ? id.substring(0, 8) : id;
  }
}
