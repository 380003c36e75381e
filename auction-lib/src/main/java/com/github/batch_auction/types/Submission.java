// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import java.util.List;
import java.util.Objects;

/// What the leader relays to the chain: the proposal and the commit votes that prove a quorum accepted it.
public record Submission(long height, Proposal proposal, List<CommitVote> commits) {
  public Submission {
    Objects.requireNonNull(proposal);
    commits = List.copyOf(commits);
    if (proposal.height() != height) {
      throw new IllegalArgumentException("proposal height " + proposal.height() + " is not submission height " + height);
    }
  }
}
