// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import com.github.batch_auction.msg.AuctionMessage;
import com.github.batch_auction.types.PeerId;
import com.github.batch_auction.types.Roster;
import org.jetbrains.annotations.TestOnly;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.github.batch_auction.AuctionLogger.LOGGER;

/// Drives the rounds of one validator. The host's event loop calls [#deliver(AuctionMessage)] for every inbound
/// message, calls [#advance()] repeatedly to let timers and solves make progress and broadcasts what it returns, and
/// calls [#reset(long, PeerId)] when a new block arrives.
///
/// This class is not thread safe and performs no threading of its own. All calls must come from the host's event
/// loop. Solving happens on the executor given to the [com.github.batch_auction.matching.MatchingEngine] and is only
/// ever observed by polling, so no method here blocks.
public class RoundStateMachine {
  private RoundContext context;
  private Phase phase;

  public RoundStateMachine(RoundContext context) {
    this.context = Objects.requireNonNull(context);
    this.phase = RoundTransitions.start(context);
    LOGGER.fine(() -> context.self() + " starting " + context);
  }

  /// Hands an inbound message to the current phase. Messages the phase has no use for are ignored.
  public void deliver(AuctionMessage message) {
    if (message.from().equals(context.self())) {
      LOGGER.finest(() -> context.self() + " ignoring own message " + message);
      return;
    }
    phase = RoundTransitions.onMessage(phase, context, message);
  }

  /// Moves through as many phases as are ready now.
  ///
  /// @return the messages to broadcast to every validator in the order they were queued.
  public List<AuctionMessage> advance() {
    final var maxTransitions = context.config().maxTransitions();
    int transitions = 0;
    Optional<Phase> next;
    while ((next = RoundTransitions.poll(phase, context)).isPresent()) {
      final var from = phase.kind();
      phase = next.get();
      LOGGER.fine(() -> context.self() + " height " + context.height() + " " + from + " -> " + phase.kind());
      if (++transitions >= maxTransitions && phase.kind() != Phase.Kind.COMPLETED) {
        throw new IllegalStateException("round " + context.height() + " made " + transitions
            + " transitions in one advance and is now in " + phase.kind());
      }
    }
    return context.drainOutbound();
  }

  /// Abandons the current round, including any solve that is still running, and starts the round for a new block
  /// with the same roster.
  public void reset(long height, PeerId leader) {
    reset(height, leader, context.roster());
  }

  public void reset(long height, PeerId leader, Roster roster) {
    final var old = context;
    old.cancelInflight();
    LOGGER.fine(() -> old.self() + " reset from height " + old.height() + " in " + phase.kind() + " to height " + height);
    context = old.nextRound(height, leader, roster);
    phase = RoundTransitions.start(context);
  }

  /// @return how the round ended once it has completed.
  public Optional<RoundOutcome> outcome() {
    return phase instanceof Phase.Completed c ? Optional.of(c.outcome()) : Optional.empty();
  }

  public boolean isCompleted() {
    return phase.kind() == Phase.Kind.COMPLETED;
  }

  public long height() {
    return context.height();
  }

  public PeerId self() {
    return context.self();
  }

  @TestOnly
  Phase.Kind phase() {
    return phase.kind();
  }

  @TestOnly
  RoundContext context() {
    return context;
  }
}
