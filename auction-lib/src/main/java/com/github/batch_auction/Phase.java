// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import com.github.batch_auction.matching.PoolSolution;
import com.github.batch_auction.types.PreProposal;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/// The closed set of phases of a round. Each phase records when it was entered, its timers run from that instant. The
/// only logic here is the data each phase carries, the transitions are in [RoundTransitions].
///
/// ```
/// BidAggregation
/// └── PreProposalAggregation
///     ├── ProposalWait (followers)
///     │   └── Commit
///     │       └── Finalization
///     └── Commit (leader)
///         └── Submit
///```
/// Every phase may go to `Completed` on a timeout or failure.
sealed interface Phase permits
    Phase.BidAggregation,
    Phase.PreProposalAggregation,
    Phase.ProposalWait,
    Phase.Commit,
    Phase.Submit,
    Phase.Finalization,
    Phase.Completed {

  enum Kind {
    BID_AGGREGATION,
    PRE_PROPOSAL_AGGREGATION,
    PROPOSAL_WAIT,
    COMMIT,
    SUBMIT,
    FINALIZATION,
    COMPLETED
  }

  Kind kind();

  Instant enteredAt();

  /// Collecting local orders until the wait expires.
  record BidAggregation(Instant enteredAt) implements Phase {
    @Override
    public Kind kind() {
      return Kind.BID_AGGREGATION;
    }
  }

  /// Collecting pre-proposals from peers. The leader carries its solve once it has started one.
  record PreProposalAggregation(Instant enteredAt, Optional<LeaderSolve> solve) implements Phase {
    @Override
    public Kind kind() {
      return Kind.PRE_PROPOSAL_AGGREGATION;
    }
  }

  /// The pre-proposals the leader solved over and the pending result. The same pre-proposals go into the proposal so
  /// that followers replay exactly the same input.
  record LeaderSolve(List<PreProposal> inputs, CompletableFuture<List<PoolSolution>> solutions) {
    public LeaderSolve {
      inputs = List.copyOf(inputs);
      Objects.requireNonNull(solutions);
    }
  }

  /// A follower waiting for the leader's proposal and then for the replay of it.
  record ProposalWait(Instant enteredAt, Optional<ProposalReplay> replay) implements Phase {
    @Override
    public Kind kind() {
      return Kind.PROPOSAL_WAIT;
    }
  }

  /// This validator has voted and is counting votes. A follower carries the replay it voted on.
  record Commit(Instant enteredAt, Optional<ProposalReplay> replay) implements Phase {
    @Override
    public Kind kind() {
      return Kind.COMMIT;
    }
  }

  /// The leader keeps collecting commit votes until the submit delay passes.
  record Submit(Instant enteredAt) implements Phase {
    @Override
    public Kind kind() {
      return Kind.SUBMIT;
    }
  }

  /// A follower saw a commit quorum and reports whether its own replay agreed.
  record Finalization(Instant enteredAt, ProposalReplay replay) implements Phase {
    @Override
    public Kind kind() {
      return Kind.FINALIZATION;
    }
  }

  record Completed(Instant enteredAt, RoundOutcome outcome) implements Phase {
    @Override
    public Kind kind() {
      return Kind.COMPLETED;
    }
  }
}
