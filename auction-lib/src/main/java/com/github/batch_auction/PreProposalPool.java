// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction;

import com.github.batch_auction.types.PreProposal;
import com.github.batch_auction.types.PreProposalAggregation;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/// The pre-proposals a validator has accepted this round, whether they arrived alone or inside an aggregation.
class PreProposalPool {
  private final Set<PreProposal> preProposals = new LinkedHashSet<>();
  private final Set<PreProposalAggregation> aggregations = new LinkedHashSet<>();

  boolean add(PreProposal preProposal) {
    return preProposals.add(preProposal);
  }

  boolean add(PreProposalAggregation aggregation) {
    return aggregations.add(aggregation);
  }

  /// @return every distinct pre-proposal including the members of aggregations.
  List<PreProposal> all() {
    return Stream.concat(preProposals.stream(), aggregations.stream().flatMap(a -> a.preProposals().stream()))
        .distinct()
        .toList();
  }

  long distinctSources() {
    return all().stream().map(PreProposal::source).distinct().count();
  }

  @Override
  public String toString() {
    return "PreProposalPool(preProposals=" + preProposals.size() + ", aggregations=" + aggregations.size() + ")";
  }
}
