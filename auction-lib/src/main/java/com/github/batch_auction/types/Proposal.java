// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import com.github.batch_auction.matching.PoolSolution;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/// The leader's signed claim for a block: the pre-proposals it aggregated and the solution it computed for every pool.
/// Anyone holding the proposal can rerun the solve from the embedded pre-proposals and check the claim.
public final class Proposal implements SignedContent {
  private final long height;
  private final PeerId source;
  private final List<PreProposal> preProposals;
  private final List<PoolSolution> solutions;
  private final Signature signature;
  private final byte[] payload;
  private final Digest digest;

  public Proposal(long height,
                  PeerId source,
                  Collection<PreProposal> preProposals,
                  Collection<PoolSolution> solutions,
                  Signature signature) {
    this.height = height;
    this.source = Objects.requireNonNull(source);
    this.preProposals = PreProposalAggregation.sorted(preProposals);
    this.solutions = solutions.stream().sorted().toList();
    this.signature = Objects.requireNonNull(signature);
    this.payload = payload(height, source, this.preProposals, this.solutions);
    this.digest = Canonical.digest(payload);
  }

  public static Proposal generate(long height,
                                  Signer signer,
                                  Collection<PreProposal> preProposals,
                                  Collection<PoolSolution> solutions) {
    final var members = PreProposalAggregation.sorted(preProposals);
    final var sortedSolutions = solutions.stream().sorted().toList();
    final var signature = signer.sign(payload(height, signer.id(), members, sortedSolutions));
    return new Proposal(height, signer.id(), members, sortedSolutions, signature);
  }

  static byte[] payload(long height, PeerId source, List<PreProposal> members, List<PoolSolution> solutions) {
    return Canonical.bytes(dos -> {
      dos.writeLong(height);
      dos.writeUTF(source.id());
      Canonical.write(members.stream().map(PreProposal::digest).toList(), dos);
      dos.writeInt(solutions.size());
      for (var solution : solutions) {
        Canonical.write(solution, dos);
      }
    });
  }

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

  /// @return the solutions sorted by pool.
  public List<PoolSolution> solutions() {
    return solutions;
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
    return o instanceof Proposal other && digest.equals(other.digest);
  }

  @Override
  public int hashCode() {
    return digest.hashCode();
  }

  @Override
  public String toString() {
    return "Proposal(height=" + height + ", source=" + source + ", preProposals=" + preProposals.size()
        + ", solutions=" + solutions.size() + ", digest=" + digest + ")";
  }
}
