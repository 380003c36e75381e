// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.orders;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import static com.github.batch_auction.AuctionLogger.LOGGER;

/// An order pool held in memory. Every method takes the instance monitor so the pool can be shared between threads.
public class InMemoryOrderStorage implements OrderStorage {
  private final Map<OrderId, LimitOrder> limitOrders = new LinkedHashMap<>();
  private final Map<OrderId, SearcherOrder> searcherOrders = new LinkedHashMap<>();
  private final NavigableMap<Long, Pending> pendingFinalization = new TreeMap<>();

  /// Orders that were filled at a height and wait for that block to become final.
  private record Pending(Map<OrderId, LimitOrder> limit, Map<OrderId, SearcherOrder> searcher) {
    Pending() {
      this(new LinkedHashMap<>(), new LinkedHashMap<>());
    }
  }

  @Override
  public synchronized OrderSet eligibleOrders() {
    return OrderSet.of(limitOrders.values(), searcherOrders.values());
  }

  @Override
  public synchronized void addLimitOrder(LimitOrder order) {
    limitOrders.put(order.id(), order);
  }

  @Override
  public synchronized void addSearcherOrder(SearcherOrder order) {
    searcherOrders.put(order.id(), order);
  }

  @Override
  public synchronized Optional<LimitOrder> removeLimitOrder(OrderId id) {
    return Optional.ofNullable(limitOrders.remove(id));
  }

  @Override
  public synchronized Optional<SearcherOrder> removeSearcherOrder(OrderId id) {
    return Optional.ofNullable(searcherOrders.remove(id));
  }

  @Override
  public synchronized void addFilledOrders(long height, Collection<OrderId> filled) {
    final var pending = pendingFinalization.computeIfAbsent(height, h -> new Pending());
    for (var id : filled) {
      final var limit = limitOrders.remove(id);
      if (limit != null) {
        pending.limit().put(id, limit);
        continue;
      }
      final var searcher = searcherOrders.remove(id);
      if (searcher != null) {
        pending.searcher().put(id, searcher);
      }
    }
    LOGGER.fine(() -> "pending finalization at height " + height + " limit=" + pending.limit().size()
        + " searcher=" + pending.searcher().size());
  }

  @Override
  public synchronized List<OrderId> finalizedBlock(long height) {
    final var finalized = new ArrayList<OrderId>();
    final var finalizedHeights = pendingFinalization.headMap(height, true);
    finalizedHeights.values().forEach(p -> {
      finalized.addAll(p.limit().keySet());
      finalized.addAll(p.searcher().keySet());
    });
    finalizedHeights.clear();
    return finalized;
  }

  @Override
  public synchronized List<OrderId> reorg(Collection<OrderId> ids) {
    final var wanted = new HashSet<>(ids);
    final var requeued = new ArrayList<OrderId>();
    final Iterator<Pending> blocks = pendingFinalization.values().iterator();
    while (blocks.hasNext()) {
      final var pending = blocks.next();
      pending.limit().entrySet().removeIf(e -> {
        if (wanted.contains(e.getKey())) {
          limitOrders.put(e.getKey(), e.getValue());
          requeued.add(e.getKey());
          return true;
        }
        return false;
      });
      pending.searcher().entrySet().removeIf(e -> {
        if (wanted.contains(e.getKey())) {
          searcherOrders.put(e.getKey(), e.getValue());
          requeued.add(e.getKey());
          return true;
        }
        return false;
      });
      if (pending.limit().isEmpty() && pending.searcher().isEmpty()) {
        blocks.remove();
      }
    }
    LOGGER.info(() -> "reorg requeued " + requeued.size() + " of " + wanted.size() + " orders");
    return requeued;
  }
}
