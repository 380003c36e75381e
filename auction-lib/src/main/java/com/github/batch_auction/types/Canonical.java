// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.types;

import com.github.batch_auction.matching.NetAmmOrder;
import com.github.batch_auction.matching.OrderFillState;
import com.github.batch_auction.matching.OrderOutcome;
import com.github.batch_auction.matching.PoolSolution;
import com.github.batch_auction.orders.LimitOrder;
import com.github.batch_auction.orders.OrderSet;
import com.github.batch_auction.orders.PoolId;
import com.github.batch_auction.orders.Price;
import com.github.batch_auction.orders.SearcherOrder;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/// Writes the byte form that is signed and hashed. Maps are written in key order and the orders of a pool in id order
/// so that two validators holding the same content always produce the same bytes. Nothing here is ever read back, the
/// bytes only exist to be signed, verified and digested.
public final class Canonical {
  private Canonical() {
  }

  @FunctionalInterface
  public interface Writer {
    void write(DataOutputStream dos) throws IOException;
  }

  public static byte[] bytes(Writer writer) {
    try (ByteArrayOutputStream byteArrayOutputStream = new ByteArrayOutputStream();
         DataOutputStream dos = new DataOutputStream(byteArrayOutputStream)) {
      writer.write(dos);
      dos.flush();
      return byteArrayOutputStream.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static Digest digest(byte[] payload) {
    try {
      return new Digest(HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(payload)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }

  public static void write(Price price, DataOutputStream dos) throws IOException {
    dos.writeUTF(price.value().toPlainString());
  }

  public static void write(LimitOrder order, DataOutputStream dos) throws IOException {
    dos.writeUTF(order.id().hash());
    dos.writeUTF(order.pool().name());
    dos.writeBoolean(order.bid());
    write(order.price(), dos);
    dos.writeLong(order.quantity());
    dos.writeUTF(order.kind().name());
  }

  public static void write(SearcherOrder order, DataOutputStream dos) throws IOException {
    dos.writeUTF(order.id().hash());
    dos.writeUTF(order.pool().name());
    dos.writeLong(order.tip());
  }

  public static void write(OrderSet orders, DataOutputStream dos) throws IOException {
    // OrderSet maps are sorted by pool
    dos.writeInt(orders.limit().size());
    for (Map.Entry<PoolId, List<LimitOrder>> entry : orders.limit().entrySet()) {
      dos.writeUTF(entry.getKey().name());
      final var sorted = entry.getValue().stream().sorted(Comparator.comparing(LimitOrder::id)).toList();
      dos.writeInt(sorted.size());
      for (var order : sorted) {
        write(order, dos);
      }
    }
    dos.writeInt(orders.searcher().size());
    for (Map.Entry<PoolId, List<SearcherOrder>> entry : orders.searcher().entrySet()) {
      dos.writeUTF(entry.getKey().name());
      final var sorted = entry.getValue().stream().sorted(Comparator.comparing(SearcherOrder::id)).toList();
      dos.writeInt(sorted.size());
      for (var order : sorted) {
        write(order, dos);
      }
    }
  }

  public static void write(PoolSolution solution, DataOutputStream dos) throws IOException {
    dos.writeUTF(solution.pool().name());
    write(solution.clearingPrice(), dos);
    dos.writeBoolean(solution.amm().isPresent());
    if (solution.amm().isPresent()) {
      final NetAmmOrder amm = solution.amm().get();
      dos.writeUTF(amm.direction().name());
      dos.writeLong(amm.baseQuantity());
      dos.writeUTF(amm.quoteQuantity().toPlainString());
    }
    dos.writeBoolean(solution.searcher().isPresent());
    if (solution.searcher().isPresent()) {
      write(solution.searcher().get(), dos);
    }
    dos.writeInt(solution.outcomes().size());
    for (OrderOutcome outcome : solution.outcomes()) {
      dos.writeUTF(outcome.id().hash());
      write(outcome.outcome(), dos);
    }
  }

  static void write(OrderFillState state, DataOutputStream dos) throws IOException {
    if (state instanceof OrderFillState.PartialFill p) {
      dos.writeByte(1);
      dos.writeLong(p.filledQuantity());
    } else if (state instanceof OrderFillState.CompleteFill) {
      dos.writeByte(2);
    } else {
      dos.writeByte(0);
    }
  }

  public static void write(List<Digest> digests, DataOutputStream dos) throws IOException {
    dos.writeInt(digests.size());
    for (var d : digests) {
      dos.writeUTF(d.hex());
    }
  }
}
