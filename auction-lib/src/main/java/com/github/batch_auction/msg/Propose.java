// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.msg;

import com.github.batch_auction.types.PeerId;
import com.github.batch_auction.types.Proposal;

/// The leader's proposal. It is only accepted when the signer of the proposal is the leader of the round, the
/// relaying validator may be anyone on the roster.
public record Propose(PeerId from, Proposal proposal) implements SignedMessage {
  @Override
  public Proposal content() {
    return proposal;
  }
}
