// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.PoolId;

import java.util.Map;

/// Supplies the AMM reserves that all validators agree on for a block height. Pools without an entry have no AMM.
@FunctionalInterface
public interface PoolSnapshotSource {
  Map<PoolId, AmmSnapshot> snapshots(long height);

  static PoolSnapshotSource none() {
    return height -> Map.of();
  }
}
