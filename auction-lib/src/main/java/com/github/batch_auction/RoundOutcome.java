// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

/// How a round ended. The host uses this to decide what to do with the orders of the block.
public enum RoundOutcome {
  /// The leader relayed a proposal with a quorum of commits.
  SUBMITTED,
  /// A quorum committed to the proposal and the local replay agreed with it.
  COMMITTED,
  /// A quorum committed to a proposal that the local replay disagrees with.
  VERIFIED_MISMATCH,
  /// A quorum voted against the proposal.
  NIL_COMMIT,
  /// No proposal from the leader arrived before the deadline.
  LEADER_TIMEOUT,
  /// The solve or replay failed with an exception.
  SOLVE_FAILED,
  /// A proposal arrived but neither a commit nor a nil quorum formed before the deadline.
  COMMIT_TIMEOUT
}
