// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The order model and the order pool the round reads from.
package com.github.batch_auction.orders;
