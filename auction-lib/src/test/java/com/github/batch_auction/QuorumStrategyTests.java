// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class QuorumStrategyTests {

  final QuorumStrategy strategy = TwoThirdsQuorum.INSTANCE;

  @Property
  void quorumIsCeilingOfTwoThirds(@ForAll @IntRange(min = 1, max = 10_000) int validators) {
    final var expected = (int) Math.ceil(2.0 * validators / 3.0);
    assertThat(strategy.quorum(validators)).isEqualTo(expected);
  }

  @Property
  void quorumIsASupermajority(@ForAll @IntRange(min = 1, max = 10_000) int validators) {
    final var q = strategy.quorum(validators);
    // any two quorums share at least a third of the validators
    assertThat(3 * (2 * q - validators)).isGreaterThanOrEqualTo(validators);
    assertThat(q).isLessThanOrEqualTo(validators);
  }

  @Test
  void knownRosterSizes() {
    assertThat(strategy.quorum(1)).isEqualTo(1);
    assertThat(strategy.quorum(3)).isEqualTo(2);
    assertThat(strategy.quorum(4)).isEqualTo(3);
    assertThat(strategy.quorum(5)).isEqualTo(4);
    assertThat(strategy.quorum(7)).isEqualTo(5);
  }

  @Test
  void emptyRosterHasNoQuorum() {
    assertThatThrownBy(() -> strategy.quorum(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void countVotes() {
    assertThat(strategy.countVotes(3, List.of(true, true, true, false))).isEqualTo(QuorumStrategy.QuorumOutcome.WIN);
    assertThat(strategy.countVotes(3, List.of(false, false, true, false))).isEqualTo(QuorumStrategy.QuorumOutcome.LOSE);
    assertThat(strategy.countVotes(3, List.of(true, true, false, false))).isEqualTo(QuorumStrategy.QuorumOutcome.WAIT);
    assertThat(strategy.countVotes(3, List.of())).isEqualTo(QuorumStrategy.QuorumOutcome.WAIT);
  }
}
