package com.beobachter.paper.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * A paper position in a single market.
 *
 * <p>Instances are immutable; {@link com.beobachter.paper.position.PositionStore} swaps in a
 * new instance on every lifecycle transition. The stake is the USD paid, so it is also the
 * cost basis. {@code entryPrice} is stake weighted across fills.
 */
public record Position(
    String positionId,
    String marketId,
    Side side,
    BigDecimal entryPrice,
    BigDecimal stake,
    BigDecimal contracts,
    PositionStatus status,
    Instant openedAt,
    Instant closedAt,
    BigDecimal realizedPnl,
    int additions,
    double entryEdge,
    double lastEdge,
    Instant expiresAt,
    String reservationId,
    BigDecimal exitPrice,
    String signalId,
    PositionStatus exitStatus    // closing state the position left through, null while active
) {

  public static final int PRICE_SCALE = 8;

  public static Position opening(String positionId, Signal signal, Instant now) {
    return opening(positionId, signal.marketId(), signal.side(), signal.edge(), signal.expiresAt(),
        signal.signalId(), now);
  }

  public static Position opening(String positionId, String marketId, Side side, double edge, Instant expiresAt,
                                 String signalId, Instant now) {
    return new Position(
        positionId,
        marketId,
        side,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        PositionStatus.OPENING,
        now,
        null,
        BigDecimal.ZERO,
        0,
        edge,
        edge,
        expiresAt,
        null,
        null,
        signalId,
        null
    );
  }

  public Position opened(String reservationId, BigDecimal stake, BigDecimal fillPrice, Instant now) {
    return new Position(positionId, marketId, side,
        fillPrice.setScale(PRICE_SCALE, RoundingMode.HALF_UP),
        stake,
        contractsFor(stake, fillPrice),
        PositionStatus.OPEN,
        now, null, BigDecimal.ZERO, 0, entryEdge, lastEdge, expiresAt, reservationId, null, signalId, null);
  }

  /**
   * Averaging-down addition: stake grows and the entry price becomes the stake weighted mean.
   */
  public Position withAddition(BigDecimal addStake, BigDecimal fillPrice, double edge) {
    BigDecimal newStake = stake.add(addStake);
    BigDecimal newEntry = stake.multiply(entryPrice)
        .add(addStake.multiply(fillPrice))
        .divide(newStake, PRICE_SCALE, RoundingMode.HALF_UP);
    return new Position(positionId, marketId, side, newEntry, newStake,
        contracts.add(contractsFor(addStake, fillPrice)),
        status, openedAt, closedAt, realizedPnl, additions + 1, entryEdge, edge, expiresAt,
        reservationId, exitPrice, signalId, exitStatus);
  }

  public Position withStatus(PositionStatus next) {
    return new Position(positionId, marketId, side, entryPrice, stake, contracts, next, openedAt, closedAt,
        realizedPnl, additions, entryEdge, lastEdge, expiresAt, reservationId, exitPrice, signalId, exitStatus);
  }

  public Position closed(BigDecimal exit, BigDecimal pnl, Instant now) {
    return new Position(positionId, marketId, side, entryPrice, stake, contracts, PositionStatus.CLOSED,
        openedAt, now, pnl, additions, entryEdge, lastEdge, expiresAt, reservationId, exit, signalId, status);
  }

  public BigDecimal costBasis() {
    return stake;
  }

  /**
   * Cash result of selling every contract at {@code exit}.
   */
  public BigDecimal pnlAt(BigDecimal exit) {
    return contracts.multiply(exit).subtract(stake).setScale(PRICE_SCALE, RoundingMode.HALF_UP);
  }

  /**
   * Fractional move of {@code mark} relative to the entry price.
   */
  public double returnAt(BigDecimal mark) {
    if (entryPrice.signum() <= 0) {
      return 0.0;
    }
    return mark.subtract(entryPrice).divide(entryPrice, PRICE_SCALE, RoundingMode.HALF_UP).doubleValue();
  }

  public boolean isOpen() {
    return status == PositionStatus.OPEN;
  }

  private static BigDecimal contractsFor(BigDecimal stake, BigDecimal price) {
    return stake.divide(price, PRICE_SCALE, RoundingMode.HALF_UP);
  }
}
