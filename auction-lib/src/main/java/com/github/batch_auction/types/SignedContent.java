// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

/// Content a validator signs over its canonical bytes. Equality of signed content is equality of [#digest()] as the
/// signature scheme is randomised and signing the same content twice gives two different signatures.
public interface SignedContent {
  long height();

  PeerId source();

  Signature signature();

  /// @return the canonical bytes that were signed, never including the signature.
  byte[] payload();

  Digest digest();

  /// @return true if the content is for the expected height and is signed by the roster member it claims as source.
  default boolean isValid(long expectedHeight, Roster roster) {
    return height() == expectedHeight && roster.publicKeyOf(source())
        .map(key -> Signer.verify(key, payload(), signature()))
        .orElse(false);
  }
}
