// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.msg;

import com.github.batch_auction.types.PeerId;
import com.github.batch_auction.types.PreProposal;

/// @param from        see [AuctionMessage]
/// @param preProposal a single validator's signed view of the eligible orders
public record PrePropose(PeerId from, PreProposal preProposal) implements SignedMessage {
  @Override
  public PreProposal content() {
    return preProposal;
  }
}
