// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The deterministic solver. An [com.github.batch_auction.matching.OrderBook] per pool is crossed by a
/// [com.github.batch_auction.matching.VolumeFillMatcher] against itself and a constant product AMM. Validators
/// replay the leader's solve and compare results so every computation here must give the same answer on every
/// machine: prices are fixed scale decimals and curve arithmetic uses a fixed math context.
package com.github.batch_auction.matching;
