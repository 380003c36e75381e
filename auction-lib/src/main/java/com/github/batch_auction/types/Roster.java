// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import java.security.PublicKey;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/// The ordered, fixed size set of validators for a round. It is never mutated; a new roster replaces the old one
/// wholesale when a round is reset.
public record Roster(List<Validator> validators) {
  public Roster {
    validators = List.copyOf(validators);
    if (validators.isEmpty()) {
      throw new IllegalArgumentException("roster must not be empty");
    }
    final var seen = new HashSet<PeerId>();
    for (var v : validators) {
      if (!seen.add(v.id())) {
        throw new IllegalArgumentException("duplicate validator " + v.id());
      }
    }
  }

  public static Roster of(Validator... validators) {
    return new Roster(List.of(validators));
  }

  public int size() {
    return validators.size();
  }

  public boolean contains(PeerId id) {
    return validators.stream().anyMatch(v -> v.id().equals(id));
  }

  public Optional<PublicKey> publicKeyOf(PeerId id) {
    return validators.stream()
        .filter(v -> v.id().equals(id))
        .map(Validator::publicKey)
        .findFirst();
  }

  public List<PeerId> members() {
    return validators.stream().map(Validator::id).toList();
  }

  /// The deterministic leader schedule. Every validator computes the same leader for a height so a leader that fails
  /// to produce a proposal is replaced at the next height.
  public PeerId roundRobinLeader(long height) {
    return validators.get((int) Math.floorMod(height, (long) validators.size())).id();
  }
}
