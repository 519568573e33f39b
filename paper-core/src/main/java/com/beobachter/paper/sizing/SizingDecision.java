package com.beobachter.paper.sizing;

import com.beobachter.paper.domain.RejectionReason;

import java.math.BigDecimal;

/**
 * Outcome of sizing a signal. {@code stake} is zero whenever {@code rejection} is set.
 */
public record SizingDecision(
    BigDecimal stake,
    double fullKellyFraction,
    double appliedFraction,
    boolean capped,
    RejectionReason rejection,
    String detail
) {

  public static SizingDecision accept(BigDecimal stake, double fullKelly, double applied, boolean capped) {
    return new SizingDecision(stake, fullKelly, applied, capped, null, null);
  }

  public static SizingDecision reject(RejectionReason reason, double fullKelly, String detail) {
    return new SizingDecision(BigDecimal.ZERO, fullKelly, 0.0, false, reason, detail);
  }

  public boolean accepted() {
    return rejection == null;
  }
}
