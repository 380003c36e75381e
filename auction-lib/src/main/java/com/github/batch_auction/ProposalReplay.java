// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import com.github.batch_auction.matching.PoolSolution;
import com.github.batch_auction.types.Proposal;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;

import static com.github.batch_auction.AuctionLogger.LOGGER;

/// Reruns the leader's solve from the pre-proposals embedded in its proposal and compares the result pool by pool
/// with what the leader claimed. This is the only check on the leader's computation so a difference is logged as a
/// violation.
final class ProposalReplay {
  enum Verdict {
    AGREE, DISAGREE, FAILED
  }

  private final Proposal proposal;
  private final CompletableFuture<Verdict> verdict;

  private ProposalReplay(Proposal proposal, CompletableFuture<Verdict> verdict) {
    this.proposal = proposal;
    this.verdict = verdict;
  }

  static ProposalReplay start(RoundContext context, Proposal proposal) {
    final var self = context.self();
    final var verdict = context.matchingEngineOutput(proposal.preProposals())
        .handle((solutions, error) -> {
          if (error instanceof CancellationException || (error != null && error.getCause() instanceof CancellationException)) {
            LOGGER.fine(() -> self + " replay of " + proposal + " cancelled");
            return Verdict.FAILED;
          } else if (error != null) {
            LOGGER.log(Level.SEVERE, self + " replay of " + proposal + " failed: " + error.getMessage(), error);
            return Verdict.FAILED;
          }
          return compare(proposal, solutions);
        });
    return new ProposalReplay(proposal, verdict);
  }

  /// Both lists are put into pool order before comparing so the order the solver returned them in does not matter.
  static Verdict compare(Proposal proposal, List<PoolSolution> replayed) {
    final var claimed = proposal.solutions().stream().sorted().toList();
    final var local = replayed.stream().sorted().toList();
    if (claimed.size() != local.size()) {
      LOGGER.severe(() -> "violation detected: " + proposal + " claims " + claimed.size() + " pools but replay solved "
          + local.size());
      return Verdict.DISAGREE;
    }
    for (int i = 0; i < claimed.size(); i++) {
      final var c = claimed.get(i);
      final var l = local.get(i);
      if (!Objects.equals(c, l)) {
        LOGGER.severe(() -> "violation detected: " + proposal + " claimed " + c + " but replay got " + l);
        return Verdict.DISAGREE;
      }
    }
    return Verdict.AGREE;
  }

  /// @return the verdict once the replay has finished.
  Optional<Verdict> poll() {
    if (!verdict.isDone()) {
      return Optional.empty();
    }
    return Optional.of(verdict.join());
  }

  Proposal proposal() {
    return proposal;
  }

  @Override
  public String toString() {
    return "ProposalReplay(" + proposal + ", done=" + verdict.isDone() + ")";
  }
}
