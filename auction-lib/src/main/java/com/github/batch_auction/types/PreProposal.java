// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import com.github.batch_auction.orders.OrderSet;

import java.util.Objects;

/// One validator's view of the eligible orders for a block. The source is part of the signed content so the same
/// order set from two validators counts as two sightings when filtering by quorum.
public final class PreProposal implements SignedContent {
  private final long height;
  private final PeerId source;
  private final OrderSet orders;
  private final Signature signature;
  private final byte[] payload;
  private final Digest digest;

  public PreProposal(long height, PeerId source, OrderSet orders, Signature signature) {
    this.height = height;
    this.source = Objects.requireNonNull(source);
    this.orders = Objects.requireNonNull(orders);
    this.signature = Objects.requireNonNull(signature);
    this.payload = payload(height, source, orders);
    this.digest = Canonical.digest(payload);
  }

  public static PreProposal generate(long height, Signer signer, OrderSet orders) {
    return new PreProposal(height, signer.id(), orders, signer.sign(payload(height, signer.id(), orders)));
  }

  static byte[] payload(long height, PeerId source, OrderSet orders) {
    return Canonical.bytes(dos -> {
      dos.writeLong(height);
      dos.writeUTF(source.id());
      Canonical.write(orders, dos);
    });
  }

  @Override
  public long height() {
    return height;
  }

  @Override
  public PeerId source() {
    return source;
  }

  public OrderSet orders() {
    return orders;
  }

  @Override
  public Signature signature() {
    return signature;
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public Digest digest() {
    return digest;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PreProposal other && digest.equals(other.digest);
  }

  @Override
  public int hashCode() {
    return digest.hashCode();
  }

  @Override
  public String toString() {
    return "PreProposal(height=" + height + ", source=" + source + ", pools=" + orders.limit().keySet()
        + ", digest=" + digest + ")";
  }
}
