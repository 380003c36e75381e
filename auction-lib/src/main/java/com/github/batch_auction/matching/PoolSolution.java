// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.PoolId;
import com.github.batch_auction.orders.Price;
import com.github.batch_auction.orders.SearcherOrder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// The deterministic clearing result for one pool.
///
/// @param pool          the pool that was solved
/// @param clearingPrice the uniform price the matched volume settles at, zero when nothing matched
/// @param amm           the net trade against the AMM curve if the AMM took part
/// @param searcher      the winning top of block order if any
/// @param outcomes      every resting order with its final fill state, bids first then asks in book order
public record PoolSolution(
    PoolId pool,
    Price clearingPrice,
    Optional<NetAmmOrder> amm,
    Optional<SearcherOrder> searcher,
    List<OrderOutcome> outcomes
) implements Comparable<PoolSolution> {
  public PoolSolution {
    Objects.requireNonNull(pool);
    Objects.requireNonNull(clearingPrice);
    Objects.requireNonNull(amm);
    Objects.requireNonNull(searcher);
    outcomes = List.copyOf(outcomes);
  }

  /// Solutions are compared by pool which is the canonical key used to line up a leader's claim with a replay.
  @Override
  public int compareTo(PoolSolution other) {
    return pool.compareTo(other.pool);
  }
}
