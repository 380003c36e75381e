// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.orders;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/// The order pool that the round protocol reads from. Admission validation (nonce, balance and signature checks) has
/// already happened before an order is added here. Implementations must be internally synchronized as the pool is
/// shared between the network layer that adds orders and the round state machine that reads them. No lock is
/// exposed to callers.
///
/// Orders move through three places:
///
/// 1. Eligible orders are returned by [#eligibleOrders()] and go into this validator's pre-proposal.
/// 2. Once a round commits a solution the filled orders are moved into a pending finalization area keyed by the block
///    height with [#addFilledOrders(long, Collection)].
/// 3. When the block is final they are dropped with [#finalizedBlock(long)]. If the chain reorganizes they are put back
///    into the eligible set with [#reorg(Collection)].
public interface OrderStorage {

  /// @return every order that is currently eligible for matching keyed by pool.
  OrderSet eligibleOrders();

  void addLimitOrder(LimitOrder order);

  void addSearcherOrder(SearcherOrder order);

  Optional<LimitOrder> removeLimitOrder(OrderId id);

  Optional<SearcherOrder> removeSearcherOrder(OrderId id);

  /// Moves the given orders out of the eligible set into pending finalization at the given height. Ids that are not
  /// eligible are ignored.
  void addFilledOrders(long height, Collection<OrderId> filled);

  /// Drops all orders pending finalization at or below the given height.
  ///
  /// @return the ids of the orders that were finalized.
  List<OrderId> finalizedBlock(long height);

  /// Requeues orders pending finalization as eligible orders after a chain reorganization.
  ///
  /// @return the ids of the orders that were requeued.
  List<OrderId> reorg(Collection<OrderId> ids);
}
