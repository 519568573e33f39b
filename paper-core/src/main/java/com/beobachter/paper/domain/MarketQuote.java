package com.beobachter.paper.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest mark for a market, used by the evaluation sweep.
 */
public record MarketQuote(
    String marketId,
    BigDecimal yesPrice,
    BigDecimal liquidityUsd,
    boolean resolved,
    Side resolvedOutcome,
    Instant asOf
) {

  public BigDecimal priceFor(Side side) {
    return side == Side.YES ? yesPrice : BigDecimal.ONE.subtract(yesPrice);
  }
}
