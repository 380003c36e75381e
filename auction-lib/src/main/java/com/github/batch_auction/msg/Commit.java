// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.msg;

import com.github.batch_auction.types.CommitVote;
import com.github.batch_auction.types.PeerId;

public record Commit(PeerId from, CommitVote vote) implements SignedMessage {
  @Override
  public CommitVote content() {
    return vote;
  }
}
