// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.OrderId;

public record OrderOutcome(OrderId id, OrderFillState outcome) {
}
