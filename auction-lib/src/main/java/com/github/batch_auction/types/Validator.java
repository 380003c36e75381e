// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import java.security.PublicKey;
import java.util.Objects;

/// A member of the validator roster. Every validator is eligible to be a round leader.
public record Validator(PeerId id, PublicKey publicKey) {
  public Validator {
    Objects.requireNonNull(id);
    Objects.requireNonNull(publicKey);
    if (!id.equals(PeerId.of(publicKey))) {
      throw new IllegalArgumentException("peer id " + id + " does not match public key");
    }
  }
}
