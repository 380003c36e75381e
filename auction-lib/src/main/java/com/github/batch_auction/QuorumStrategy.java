// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// The interface to provide a strategy for how many validators must agree. The same threshold is used for the number
/// of pre-proposals an order must appear in before it is matched and for the number of commit votes that accept a
/// proposal.
public interface QuorumStrategy {
  /// @param validators the size of the roster for the round
  /// @return the number of validators that must agree
  int quorum(int validators);

  enum QuorumOutcome {
    WIN, LOSE, WAIT
  }

  default QuorumOutcome countVotes(int quorum, List<Boolean> votes) {
    Map<Boolean, List<Boolean>> voteMap = votes.stream().collect(Collectors.partitioningBy(v -> v));
    if (voteMap.get(true).size() >= quorum)
      return QuorumOutcome.WIN;
    else if (voteMap.get(false).size() >= quorum)
      return QuorumOutcome.LOSE;
    else
      return QuorumOutcome.WAIT;
  }
}
