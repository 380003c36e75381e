// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import java.util.Objects;
import java.util.Optional;

/// A validator's signed vote on the leader's proposal. A `NIL` vote may carry no proposal when none arrived in time.
public final class CommitVote implements SignedContent {
  public enum Kind {
    COMMIT, NIL
  }

  private final long height;
  private final PeerId source;
  private final Kind kind;
  private final Optional<Digest> proposal;
  private final Signature signature;
  private final byte[] payload;
  private final Digest digest;

  public CommitVote(long height, PeerId source, Kind kind, Optional<Digest> proposal, Signature signature) {
    if (kind == Kind.COMMIT && proposal.isEmpty()) {
      throw new IllegalArgumentException("a commit vote must name the proposal it commits to");
    }
    this.height = height;
    this.source = Objects.requireNonNull(source);
    this.kind = Objects.requireNonNull(kind);
    this.proposal = Objects.requireNonNull(proposal);
    this.signature = Objects.requireNonNull(signature);
    this.payload = payload(height, source, kind, proposal);
    this.digest = Canonical.digest(payload);
  }

  public static CommitVote commit(long height, Signer signer, Digest proposal) {
    return generate(height, signer, Kind.COMMIT, Optional.of(proposal));
  }

  public static CommitVote nil(long height, Signer signer, Optional<Digest> proposal) {
    return generate(height, signer, Kind.NIL, proposal);
  }

  static CommitVote generate(long height, Signer signer, Kind kind, Optional<Digest> proposal) {
    return new CommitVote(height, signer.id(), kind, proposal, signer.sign(payload(height, signer.id(), kind, proposal)));
  }

  static byte[] payload(long height, PeerId source, Kind kind, Optional<Digest> proposal) {
    return Canonical.bytes(dos -> {
      dos.writeLong(height);
      dos.writeUTF(source.id());
      dos.writeUTF(kind.name());
      dos.writeBoolean(proposal.isPresent());
      if (proposal.isPresent()) {
        dos.writeUTF(proposal.get().hex());
      }
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

  public Kind kind() {
    return kind;
  }

  public Optional<Digest> proposal() {
    return proposal;
  }

  public boolean isCommit() {
    return kind == Kind.COMMIT;
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
    return o instanceof CommitVote other && digest.equals(other.digest);
  }

  @Override
  public int hashCode() {
    return digest.hashCode();
  }

  @Override
  public String toString() {
    return "CommitVote(height=" + height + ", source=" + source + ", " + kind
        + proposal.map(d -> ", proposal=" + d).orElse("") + ")";
  }
}
