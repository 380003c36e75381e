// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.msg;

import com.github.batch_auction.types.PeerId;

/// AuctionMessage is the base interface for all messages exchanged between validators during a round.
public sealed interface AuctionMessage permits
    SignedMessage,
    RelaySubmission {
  /// @return the validator that sent this message which may not be the validator that signed its content.
  PeerId from();

  /// @return the block height the message is about.
  long height();
}
