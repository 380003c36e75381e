// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.msg;

import com.github.batch_auction.types.SignedContent;

/// Messages that carry signed content which is verified, deduplicated and relayed by every validator.
public sealed interface SignedMessage extends AuctionMessage permits
    PrePropose,
    PreProposeAggregation,
    Propose,
    Commit {
  SignedContent content();

  @Override
  default long height() {
    return content().height();
  }
}
