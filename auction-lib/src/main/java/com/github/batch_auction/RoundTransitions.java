// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import com.github.batch_auction.matching.PoolSolution;
import com.github.batch_auction.msg.AuctionMessage;
import com.github.batch_auction.msg.Commit;
import com.github.batch_auction.msg.PrePropose;
import com.github.batch_auction.msg.PreProposeAggregation;
import com.github.batch_auction.msg.Propose;
import com.github.batch_auction.msg.RelaySubmission;
import com.github.batch_auction.types.CommitVote;
import com.github.batch_auction.types.Proposal;
import com.github.batch_auction.types.Submission;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;

import static com.github.batch_auction.AuctionLogger.LOGGER;

/// The transition function of a round. [#onMessage] lets the current phase consume an inbound message and
/// [#poll] asks it whether it is ready to move on. Both switch over [Phase.Kind] so adding a phase fails to compile
/// until every transition handles it. Neither method ever blocks, a phase that is waiting on a timer or a future
/// returns no successor and is asked again on the next poll.
final class RoundTransitions {
  private RoundTransitions() {
  }

  static Phase start(RoundContext context) {
    return new Phase.BidAggregation(context.now());
  }

  /// Commit votes are counted in every phase until the round completes as peers may be ahead of us. Pre-proposals are
  /// only of interest until this validator has stopped aggregating. A proposal that arrives before a follower is
  /// waiting for it is verified and kept until it is.
  static Phase onMessage(Phase phase, RoundContext context, AuctionMessage message) {
    if (phase.kind() != Phase.Kind.COMPLETED && message instanceof Commit commit) {
      context.handleCommit(commit);
      return phase;
    }
    if (message instanceof RelaySubmission) {
      LOGGER.finest(() -> context.self() + " ignoring " + message + " as relaying is the host's job");
      return phase;
    }
    return switch (phase.kind()) {
      case BID_AGGREGATION, PRE_PROPOSAL_AGGREGATION -> {
        if (message instanceof PrePropose p) {
          context.handlePreProposal(p);
        } else if (message instanceof PreProposeAggregation a) {
          context.handleAggregation(a);
        } else if (message instanceof Propose p) {
          context.verifyProposal(p);
        }
        yield phase;
      }
      case PROPOSAL_WAIT -> {
        final var wait = (Phase.ProposalWait) phase;
        if (message instanceof Propose p) {
          final var accepted = context.verifyProposal(p);
          if (accepted.isPresent() && wait.replay().isEmpty()) {
            yield new Phase.ProposalWait(wait.enteredAt(), Optional.of(ProposalReplay.start(context, accepted.get())));
          }
        }
        yield phase;
      }
      case COMMIT, SUBMIT, FINALIZATION -> {
        if (message instanceof Propose p) {
          context.verifyProposal(p);
        }
        yield phase;
      }
      case COMPLETED -> {
        LOGGER.finest(() -> context.self() + " round " + context.height() + " is completed, ignoring " + message);
        yield phase;
      }
    };
  }

  static Optional<Phase> poll(Phase phase, RoundContext context) {
    return switch (phase.kind()) {
      case BID_AGGREGATION -> bidAggregation((Phase.BidAggregation) phase, context);
      case PRE_PROPOSAL_AGGREGATION -> preProposalAggregation((Phase.PreProposalAggregation) phase, context);
      case PROPOSAL_WAIT -> proposalWait((Phase.ProposalWait) phase, context);
      case COMMIT -> commit((Phase.Commit) phase, context);
      case SUBMIT -> submit((Phase.Submit) phase, context);
      case FINALIZATION -> finalization((Phase.Finalization) phase, context);
      case COMPLETED -> Optional.empty();
    };
  }

  private static Optional<Phase> bidAggregation(Phase.BidAggregation phase, RoundContext context) {
    if (!context.hasElapsed(phase.enteredAt(), context.config().bidAggregationWait())) {
      return Optional.empty();
    }
    context.ownPreProposal();
    return Optional.of(new Phase.PreProposalAggregation(context.now(), Optional.empty()));
  }

  private static Optional<Phase> preProposalAggregation(Phase.PreProposalAggregation phase, RoundContext context) {
    if (phase.solve().isPresent()) {
      return leaderSolved(phase.solve().get(), context);
    }
    final long sources = context.preProposalSources();
    final boolean quorum = sources >= context.quorum();
    final boolean deadline = context.hasElapsed(phase.enteredAt(), context.config().preProposalDeadline());
    final boolean proposalArrived = !context.isLeader() && context.proposal().isPresent();
    if (!quorum && !deadline && !proposalArrived) {
      return Optional.empty();
    }
    if (!quorum) {
      LOGGER.info(() -> context.self() + " stopped aggregating at height " + context.height() + " with " + sources
          + " of " + context.quorum() + " pre-proposal sources");
    }
    context.ownAggregation();
    if (context.isLeader()) {
      final var inputs = context.preProposals();
      final var solve = new Phase.LeaderSolve(inputs, context.matchingEngineOutput(inputs));
      return Optional.of(new Phase.PreProposalAggregation(phase.enteredAt(), Optional.of(solve)));
    }
    final var replay = context.proposal().map(p -> ProposalReplay.start(context, p));
    return Optional.of(new Phase.ProposalWait(context.now(), replay));
  }

  private static Optional<Phase> leaderSolved(Phase.LeaderSolve solve, RoundContext context) {
    final var future = solve.solutions();
    if (!future.isDone()) {
      return Optional.empty();
    }
    final List<PoolSolution> solutions;
    try {
      solutions = future.join();
    } catch (CompletionException | CancellationException e) {
      LOGGER.log(Level.SEVERE, context.self() + " leader solve at height " + context.height() + " failed", e);
      return completed(context, RoundOutcome.SOLVE_FAILED);
    }
    final var proposal = Proposal.generate(context.height(), context.signer(), solve.inputs(), solutions);
    context.ownProposal(proposal);
    context.ownVote(CommitVote.commit(context.height(), context.signer(), proposal.digest()));
    return Optional.of(new Phase.Commit(context.now(), Optional.empty()));
  }

  private static Optional<Phase> proposalWait(Phase.ProposalWait phase, RoundContext context) {
    if (phase.replay().isPresent()) {
      final var replay = phase.replay().get();
      final var verdict = replay.poll();
      if (verdict.isEmpty()) {
        return Optional.empty();
      }
      final var digest = replay.proposal().digest();
      final var vote = verdict.get() == ProposalReplay.Verdict.AGREE
          ? CommitVote.commit(context.height(), context.signer(), digest)
          : CommitVote.nil(context.height(), context.signer(), Optional.of(digest));
      LOGGER.fine(() -> context.self() + " replay " + verdict.get() + " votes " + vote.kind());
      context.ownVote(vote);
      return Optional.of(new Phase.Commit(context.now(), phase.replay()));
    }
    if (!context.hasElapsed(phase.enteredAt(), context.config().proposalDeadline())) {
      return Optional.empty();
    }
    LOGGER.warning(() -> context.self() + " no proposal from leader " + context.leader() + " at height "
        + context.height() + " voting nil");
    context.ownVote(CommitVote.nil(context.height(), context.signer(), Optional.empty()));
    return Optional.of(new Phase.Commit(context.now(), Optional.empty()));
  }

  private static Optional<Phase> commit(Phase.Commit phase, RoundContext context) {
    final var proposal = context.proposal();
    final var outcome = context.quorumStrategy().countVotes(context.quorum(),
        context.commitTally().votesFor(proposal.map(Proposal::digest)));
    switch (outcome) {
      case WIN -> {
        if (context.isLeader()) {
          return Optional.of(new Phase.Submit(context.now()));
        }
        // a proposal that arrived after we voted nil is still replayed so we can report on it
        final var replay = phase.replay().orElseGet(() -> ProposalReplay.start(context, proposal.orElseThrow()));
        return Optional.of(new Phase.Finalization(context.now(), replay));
      }
      case LOSE -> {
        return completed(context, proposal.isPresent() ? RoundOutcome.NIL_COMMIT : RoundOutcome.LEADER_TIMEOUT);
      }
      default -> {
        if (!context.hasElapsed(phase.enteredAt(), context.config().commitDeadline())) {
          return Optional.empty();
        }
        return completed(context, proposal.isPresent() ? RoundOutcome.COMMIT_TIMEOUT : RoundOutcome.LEADER_TIMEOUT);
      }
    }
  }

  private static Optional<Phase> submit(Phase.Submit phase, RoundContext context) {
    if (!context.hasElapsed(phase.enteredAt(), context.config().submitDelay())) {
      return Optional.empty();
    }
    final var proposal = context.proposal().orElseThrow(
        () -> new IllegalStateException("leader reached submit without a proposal at height " + context.height()));
    final var commits = context.commitTally().commitsFor(proposal.digest());
    if (commits.size() < context.quorum()) {
      return completed(context, RoundOutcome.COMMIT_TIMEOUT);
    }
    context.broadcast(new RelaySubmission(context.self(), new Submission(context.height(), proposal, commits)));
    context.markFilled(proposal);
    return completed(context, RoundOutcome.SUBMITTED);
  }

  private static Optional<Phase> finalization(Phase.Finalization phase, RoundContext context) {
    final var verdict = phase.replay().poll();
    if (verdict.isEmpty()) {
      return Optional.empty();
    }
    return switch (verdict.get()) {
      case AGREE -> {
        context.markFilled(phase.replay().proposal());
        yield completed(context, RoundOutcome.COMMITTED);
      }
      case DISAGREE -> {
        // slashing the leader is not implemented so the violation is only reported
        LOGGER.severe(() -> "violation detected: a quorum committed " + phase.replay().proposal()
            + " which does not match the replay at " + context.self());
        yield completed(context, RoundOutcome.VERIFIED_MISMATCH);
      }
      case FAILED -> completed(context, RoundOutcome.SOLVE_FAILED);
    };
  }

  private static Optional<Phase> completed(RoundContext context, RoundOutcome outcome) {
    LOGGER.info(() -> context.self() + " completed round " + context.height() + " with " + outcome);
    return Optional.of(new Phase.Completed(context.now(), outcome));
  }
}
