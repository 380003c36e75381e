// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import com.github.batch_auction.types.CommitVote;
import com.github.batch_auction.types.Digest;
import com.github.batch_auction.types.PeerId;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.batch_auction.AuctionLogger.LOGGER;

/// The commit votes seen this round. A validator votes once, a later vote from the same validator is ignored.
class CommitTally {
  private final Map<PeerId, CommitVote> votes = new LinkedHashMap<>();

  boolean record(CommitVote vote) {
    final var prior = votes.putIfAbsent(vote.source(), vote);
    if (prior != null) {
      LOGGER.info(() -> "ignoring second vote " + vote + " as already counted " + prior);
      return false;
    }
    return true;
  }

  /// @return true for each vote that commits to the given proposal and false for every other vote.
  List<Boolean> votesFor(Optional<Digest> proposal) {
    return votes.values().stream()
        .map(v -> v.isCommit() && proposal.isPresent() && v.proposal().equals(proposal))
        .toList();
  }

  List<CommitVote> commitsFor(Digest proposal) {
    return votes.values().stream()
        .filter(v -> v.isCommit() && v.proposal().equals(Optional.of(proposal)))
        .toList();
  }

  int size() {
    return votes.size();
  }
}
