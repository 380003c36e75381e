// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.msg;

import com.github.batch_auction.types.PeerId;
import com.github.batch_auction.types.PreProposalAggregation;

public record PreProposeAggregation(PeerId from, PreProposalAggregation aggregation) implements SignedMessage {
  @Override
  public PreProposalAggregation content() {
    return aggregation;
  }
}
