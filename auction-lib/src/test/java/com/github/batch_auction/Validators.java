// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import com.github.batch_auction.matching.MatchingEngine;
import com.github.batch_auction.matching.PoolSnapshotSource;
import com.github.batch_auction.orders.OrderStorage;
import com.github.batch_auction.types.Roster;
import com.github.batch_auction.types.Signer;

import java.time.Clock;
import java.util.List;
import java.util.stream.IntStream;

/// Key pairs and a roster for tests. Key generation is slow so tests share instances.
record Validators(List<Signer> signers, Roster roster) {
  static Validators of(int count) {
    final var signers = IntStream.range(0, count).mapToObj(i -> Signer.generate()).toList();
    return new Validators(signers, new Roster(signers.stream().map(Signer::validator).toList()));
  }

  Signer get(int index) {
    return signers.get(index);
  }

  RoundContext context(long height, int self, int leader, OrderStorage storage, MatchingEngine engine, Clock clock) {
    return new RoundContext(height, get(leader).id(), roster, get(self), TwoThirdsQuorum.INSTANCE, storage, engine,
        PoolSnapshotSource.none(), RoundConfig.DEFAULT, clock);
  }
}
