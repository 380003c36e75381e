// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// This package contains the round protocol that lets a fixed set of validators agree once per block on a single
/// matching result for the orders of every pool.
///
/// The host application drives a [com.github.batch_auction.RoundStateMachine] from its event loop. It needs to
/// provide:
/// 1. An [com.github.batch_auction.orders.OrderStorage] holding the orders that passed admission validation.
/// 2. A [com.github.batch_auction.matching.MatchingEngine], normally a
///    [com.github.batch_auction.matching.BookSolver] on an executor of its choosing.
/// 3. A [com.github.batch_auction.matching.PoolSnapshotSource] for the AMM reserves at the block height.
/// 4. A network that delivers [com.github.batch_auction.msg.AuctionMessage]s to every validator.
///
/// Supporting classes and interfaces:
/// - [com.github.batch_auction.RoundContext]: the state of one round and the rules for verifying messages.
/// - [com.github.batch_auction.QuorumStrategy]: how many validators must agree, see
///   [com.github.batch_auction.TwoThirdsQuorum].
/// - [com.github.batch_auction.RoundConfig]: the phase timers.
/// - [com.github.batch_auction.RoundOutcome]: how a round ended.
package com.github.batch_auction;
