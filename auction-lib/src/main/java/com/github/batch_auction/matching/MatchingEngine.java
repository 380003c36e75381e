// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.PoolId;
import com.github.batch_auction.orders.SearcherOrder;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/// Solves every pool that has orders. The result is sorted by pool. Solving may take real time so it is handed back
/// as a future that the round polls rather than waits on.
public interface MatchingEngine {
  CompletableFuture<List<PoolSolution>> solvePools(
      List<LimitOrder> limit,
      List<SearcherOrder> searcher,
      Map<PoolId, AmmSnapshot> pools);
}
