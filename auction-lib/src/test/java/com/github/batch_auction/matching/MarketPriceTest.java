// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.batch_auction.matching;

import com.github.batch_auction.orders.Price;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MarketPriceTest {
  // k = 1,000,000 at a price of 100
  final MarketPrice start = AmmSnapshot.of(100, 10_000).currentPosition();

  @Test
  void priceIsQuotePerBase() {
    assertThat(start.price()).isEqualTo(Price.of(100));
  }

  @Test
  void baseToReachIsRoundedDown() {
    // sqrt(1e6 / 90) is 105.409 and sqrt(1e6 / 110) is 95.346
    assertThat(start.baseToReach(Price.of(90))).isEqualTo(5);
    assertThat(start.baseToReach(Price.of(110))).isEqualTo(4);
    assertThat(start.baseToReach(Price.of(100))).isZero();
  }

  @Test
  void tradingKeepsTheProductConstant() {
    final var after = start.afterTrade(Direction.ASK, 3);

    assertThat(after.base()).isEqualByComparingTo(BigDecimal.valueOf(97));
    assertThat(after.base().multiply(after.quote()).subtract(BigDecimal.valueOf(1_000_000)).abs())
        .isLessThan(new BigDecimal("0.000000000001"));
    assertThat(after.price().greaterThan(start.price())).isTrue();
  }

  @Test
  void tradingCannotDrainThePool() {
    assertThatThrownBy(() -> start.afterTrade(Direction.ASK, 100)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void offersToBidOnlyAboveTheRestingBid() {
    assertThat(start.orderToTarget(Optional.of(Price.of(95)), Direction.BID)).isPresent();
    assertThat(start.orderToTarget(Optional.of(Price.of(100)), Direction.BID)).isEmpty();
    assertThat(start.orderToTarget(Optional.of(Price.of(105)), Direction.BID)).isEmpty();
    assertThat(start.orderToTarget(Optional.empty(), Direction.BID)).isPresent();
  }

  @Test
  void offersToAskOnlyBelowTheRestingAsk() {
    assertThat(start.orderToTarget(Optional.of(Price.of(105)), Direction.ASK)).isPresent();
    assertThat(start.orderToTarget(Optional.of(Price.of(95)), Direction.ASK)).isEmpty();
    assertThat(start.orderToTarget(Optional.empty(), Direction.ASK)).isPresent();
  }

  @Test
  void doesNotOfferWhenLessThanOneUnitSeparatesThePrices() {
    assertThat(start.orderToTarget(Optional.of(Price.of("99.9")), Direction.BID)).isEmpty();
  }

  @Test
  void ammOrderQuantityStopsAtTheTighterLimit() {
    final var bid = start.orderToTarget(Optional.of(Price.of(95)), Direction.BID).orElseThrow();

    // an ask at 80 is further away than the resting bid at 95
    assertThat(bid.quantity(Price.of(80))).isEqualTo(start.baseToReach(Price.of(95)));
    assertThat(bid.quantity(Price.of(90))).isEqualTo(start.baseToReach(Price.of(95)));
    // an ask at 98 is the tighter limit
    assertThat(bid.quantity(Price.of(98))).isEqualTo(start.baseToReach(Price.of(98)));
    // an ask above the curve price gets nothing
    assertThat(bid.quantity(Price.of(101))).isZero();
  }

  @Test
  void fillReportsBothDeltas() {
    final var ask = start.orderToTarget(Optional.empty(), Direction.ASK).orElseThrow();
    final var fill = ask.fill(3);

    assertThat(fill.baseDelta()).isEqualTo(3);
    assertThat(fill.end().base()).isEqualByComparingTo(BigDecimal.valueOf(97));
    assertThat(fill.quoteDelta()).isEqualByComparingTo(fill.end().quote().subtract(BigDecimal.valueOf(10_000)));
  }
}
