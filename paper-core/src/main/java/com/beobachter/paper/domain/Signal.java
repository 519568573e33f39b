package com.beobachter.paper.domain;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Trade signal produced by an external forecasting model.
 *
 * <p>{@code probability} is the model probability that {@code side} wins and
 * {@code marketPrice} is the price of one {@code side} contract, i.e. the market
 * implied probability. A contract pays 1 on a win, so the net decimal odds are
 * {@code (1 - marketPrice) / marketPrice}.
 */
public record Signal(
    String signalId,
    String marketId,
    Side side,
    double probability,
    double marketPrice,
    double edge,
    ConfidenceTier confidence,
    Instant issuedAt,
    Duration horizon,
    BigDecimal liquidityUsd     // optional depth proxy
) {

  /**
   * Net payout per unit staked.
   */
  public double odds() {
    return (1.0 - marketPrice) / marketPrice;
  }

  public Instant expiresAt() {
    return issuedAt.plus(horizon);
  }

  /**
   * Edge expressed for the given side. A signal for the opposite side counts as a negative edge.
   */
  public double edgeFor(Side positionSide) {
    return positionSide == side ? edge : -edge;
  }

  /**
   * Returns the first problem found, or empty when the signal is well formed.
   */
  public Optional<String> validate() {
    if (marketId == null || marketId.isBlank()) {
      return Optional.of("marketId is blank");
    }
    if (side == null) {
      return Optional.of("side is missing");
    }
    if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
      return Optional.of("probability outside [0,1]: " + probability);
    }
    if (Double.isNaN(marketPrice) || marketPrice <= 0.0 || marketPrice >= 1.0) {
      return Optional.of("market price must be in (0,1): " + marketPrice);
    }
    if (Double.isNaN(edge) || Double.isInfinite(edge)) {
      return Optional.of("edge is not finite");
    }
    if (issuedAt == null) {
      return Optional.of("issuedAt is missing");
    }
    if (horizon == null || horizon.isNegative() || horizon.isZero()) {
      return Optional.of("horizon must be positive");
    }
    if (liquidityUsd != null && liquidityUsd.signum() < 0) {
      return Optional.of("liquidity is negative");
    }
    return Optional.empty();
  }
}
