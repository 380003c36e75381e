// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.msg;

import com.github.batch_auction.types.PeerId;
import com.github.batch_auction.types.Submission;

/// Emitted by the leader once a quorum committed. The host relays it to the chain.
public record RelaySubmission(PeerId from, Submission submission) implements AuctionMessage {
  @Override
  public long height() {
    return submission.height();
  }
}
