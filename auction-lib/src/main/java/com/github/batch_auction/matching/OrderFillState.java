// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

/// The outcome of a solve for a single resting order. A complete fill is terminal. A partial fill may be refined to a
/// larger partial fill or to a complete fill within the same solve but never goes back to unfilled.
public sealed interface OrderFillState permits OrderFillState.Unfilled, OrderFillState.PartialFill, OrderFillState.CompleteFill {

  Unfilled UNFILLED = new Unfilled();

  CompleteFill COMPLETE_FILL = new CompleteFill();

  record Unfilled() implements OrderFillState {
  }

  record PartialFill(long filledQuantity) implements OrderFillState {
    public PartialFill {
      if (filledQuantity <= 0) {
        throw new IllegalArgumentException("filled quantity must be positive: " + filledQuantity);
      }
    }
  }

  record CompleteFill() implements OrderFillState {
  }

  /// @return the state after a further `quantity` of the order was matched without completing it.
  default OrderFillState partialFill(long quantity) {
    if (this instanceof PartialFill p) {
      return new PartialFill(p.filledQuantity() + quantity);
    } else if (this instanceof CompleteFill) {
      return this;
    }
    return new PartialFill(quantity);
  }

  default boolean isUnfilled() {
    return this instanceof Unfilled;
  }

  default boolean isComplete() {
    return this instanceof CompleteFill;
  }
}
