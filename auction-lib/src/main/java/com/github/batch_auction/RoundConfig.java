// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import java.time.Duration;
import java.util.Objects;

/// The timers of a round. Each duration is measured from the moment the round entered the phase that uses it.
///
/// @param bidAggregationWait  how long to collect local orders before signing a pre-proposal
/// @param preProposalDeadline how long to wait for a quorum of pre-proposals
/// @param proposalDeadline    how long a follower waits for the leader's proposal
/// @param commitDeadline      how long to wait for a quorum of commit votes
/// @param submitDelay         how long the leader keeps collecting commit votes before it submits
/// @param maxTransitions      the most phase changes a single call to advance may make
public record RoundConfig(
    Duration bidAggregationWait,
    Duration preProposalDeadline,
    Duration proposalDeadline,
    Duration commitDeadline,
    Duration submitDelay,
    int maxTransitions
) {
  public static final RoundConfig DEFAULT = new RoundConfig(
      Duration.ofSeconds(1),
      Duration.ofSeconds(2),
      Duration.ofSeconds(4),
      Duration.ofSeconds(2),
      Duration.ofMillis(500),
      16);

  public RoundConfig {
    Objects.requireNonNull(bidAggregationWait);
    Objects.requireNonNull(preProposalDeadline);
    Objects.requireNonNull(proposalDeadline);
    Objects.requireNonNull(commitDeadline);
    Objects.requireNonNull(submitDelay);
    if (maxTransitions < 1) {
      throw new IllegalArgumentException("maxTransitions must be positive: " + maxTransitions);
    }
  }

  public RoundConfig withBidAggregationWait(Duration d) {
    return new RoundConfig(d, preProposalDeadline, proposalDeadline, commitDeadline, submitDelay, maxTransitions);
  }

  public RoundConfig withPreProposalDeadline(Duration d) {
    return new RoundConfig(bidAggregationWait, d, proposalDeadline, commitDeadline, submitDelay, maxTransitions);
  }

  public RoundConfig withProposalDeadline(Duration d) {
    return new RoundConfig(bidAggregationWait, preProposalDeadline, d, commitDeadline, submitDelay, maxTransitions);
  }

  public RoundConfig withCommitDeadline(Duration d) {
    return new RoundConfig(bidAggregationWait, preProposalDeadline, proposalDeadline, d, submitDelay, maxTransitions);
  }

  public RoundConfig withSubmitDelay(Duration d) {
    return new RoundConfig(bidAggregationWait, preProposalDeadline, proposalDeadline, commitDeadline, d, maxTransitions);
  }
}
