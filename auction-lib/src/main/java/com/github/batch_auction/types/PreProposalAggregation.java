// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// The pre-proposals a validator collected, forwarded as one unit. Only the member digests are signed as every
/// member carries its own signature.
public final class PreProposalAggregation implements SignedContent {
  private final long height;
  private final PeerId source;
  private final List<PreProposal> preProposals;
  private final Signature signature;
  private final byte[] payload;
  private final Digest digest;

  public PreProposalAggregation(long height, PeerId source, Collection<PreProposal> preProposals, Signature signature) {
    this.height = height;
    this.source = Objects.requireNonNull(source);
    this.preProposals = sorted(preProposals);
    this.signature = Objects.requireNonNull(signature);
    this.payload = payload(height, source, this.preProposals);
    this.digest = Canonical.digest(payload);
  }

  public static PreProposalAggregation generate(long height, Signer signer, Collection<PreProposal> preProposals) {
    final var members = sorted(preProposals);
    return new PreProposalAggregation(height, signer.id(), members, signer.sign(payload(height, signer.id(), members)));
  }

  static List<PreProposal> sorted(Collection<PreProposal> preProposals) {
    return preProposals.stream().distinct().sorted(Comparator.comparing(PreProposal::digest)).toList();
  }

  static byte[] payload(long height, PeerId source, List<PreProposal> members) {
    return Canonical.bytes(dos -> {
      dos.writeLong(height);
      dos.writeUTF(source.id());
      Canonical.write(members.stream().map(PreProposal::digest).toList(), dos);
    });
  }

  /// An aggregation is only as good as its worst member.
  @Override
  public boolean isValid(long expectedHeight, Roster roster) {
    return SignedContent.super.isValid(expectedHeight, roster)
        && preProposals.stream().allMatch(p -> p.isValid(expectedHeight, roster));
  }

  @Override
  public long height() {
    return height;
  }

  @Override
  public PeerId source() {
    return source;
  }

  public List<PreProposal> preProposals() {
    return preProposals;
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
    return o instanceof PreProposalAggregation other && digest.equals(other.digest);
  }

  @Override
  public int hashCode() {
    return digest.hashCode();
  }

  @Override
  public String toString() {
    return "PreProposalAggregation(height=" + height + ", source=" + source + ", members=" + preProposals.size()
        + ", digest=" + digest + ")";
  }
}
