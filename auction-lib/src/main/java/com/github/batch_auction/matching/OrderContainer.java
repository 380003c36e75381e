// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.Price;

/// What the matcher is holding on one side of a step: a resting order, the remainder of a resting order that was
/// partially filled on an earlier step, or a synthetic AMM order.
sealed interface OrderContainer permits OrderContainer.BookOrder, OrderContainer.BookOrderFragment, OrderContainer.Amm {

  Price price();

  /// Resting orders ignore the opposing price. The AMM only offers what it can profitably trade at that price.
  long quantity(Price opposing);

  default boolean isAmm() {
    return this instanceof Amm;
  }

  default boolean isFragment() {
    return this instanceof BookOrderFragment;
  }

  record BookOrder(LimitOrder order) implements OrderContainer {
    @Override
    public Price price() {
      return order.price();
    }

    @Override
    public long quantity(Price opposing) {
      return order.quantity();
    }
  }

  record BookOrderFragment(LimitOrder order) implements OrderContainer {
    @Override
    public Price price() {
      return order.price();
    }

    @Override
    public long quantity(Price opposing) {
      return order.quantity();
    }
  }

  record Amm(AmmOrder order) implements OrderContainer {
    @Override
    public Price price() {
      return order.price();
    }

    @Override
    public long quantity(Price opposing) {
      return order.quantity(opposing);
    }
  }

  /// @return the unfilled part of a resting order after `consumed` was matched.
  static LimitOrder remainder(OrderContainer container, long consumed) {
    final LimitOrder order;
    if (container instanceof BookOrder b) {
      order = b.order();
    } else if (container instanceof BookOrderFragment f) {
      order = f.order();
    } else {
      throw new IllegalArgumentException("an AMM order has no remainder");
    }
    return order.withQuantity(order.quantity() - consumed);
  }
}
