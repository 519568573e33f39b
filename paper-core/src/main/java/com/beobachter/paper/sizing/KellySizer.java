package com.beobachter.paper.sizing;

import com.beobachter.paper.config.PaperTradingProperties;
import com.beobachter.paper.domain.RejectionReason;
import com.beobachter.paper.domain.Signal;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fractional Kelly sizing for binary contracts.
 *
 * <p>With win probability {@code p}, {@code q = 1 - p} and net odds {@code b}, full Kelly is
 * {@code f* = (b*p - q) / b}. The stake is {@code k * f* * C}, capped at {@code m * C}, where
 * {@code C} is available capital. Stateless; safe to share.
 */
public class KellySizer {

  private static final int USD_SCALE = 2;

  public SizingDecision size(Signal signal, BigDecimal availableCapital, PaperTradingProperties.Sizing sizing) {
    double p = signal.probability();
    double q = 1.0 - p;
    double b = signal.odds();
    double fullKelly = (b * p - q) / b;

    if (!(fullKelly > 0.0)) {
      return SizingDecision.reject(RejectionReason.NO_EDGE, fullKelly,
          String.format("kelly fraction %.4f <= 0", fullKelly));
    }
    if (signal.edge() <= sizing.minEdge()) {
      return SizingDecision.reject(RejectionReason.NO_EDGE, fullKelly,
          String.format("edge %.4f <= min %.4f", signal.edge(), sizing.minEdge()));
    }
    if (availableCapital == null || availableCapital.signum() <= 0) {
      return SizingDecision.reject(RejectionReason.INSUFFICIENT_CAPITAL, fullKelly, "no available capital");
    }

    double applied = sizing.kellyFraction() * fullKelly;
    boolean capped = applied > sizing.maxExposureFraction();
    if (capped) {
      applied = sizing.maxExposureFraction();
    }
    BigDecimal stake = availableCapital.multiply(BigDecimal.valueOf(applied)).setScale(USD_SCALE, RoundingMode.DOWN);

    if (stake.signum() <= 0 || stake.compareTo(sizing.minStakeUsd()) < 0) {
      return SizingDecision.reject(RejectionReason.NO_EDGE, fullKelly,
          "stake " + stake + " below minimum " + sizing.minStakeUsd());
    }
    return SizingDecision.accept(stake, fullKelly, applied, capped);
  }
}
