package com.beobachter.paper.risk;

import java.math.BigDecimal;

/**
 * Whether a repeat signal may add to an open position, and the most it may add.
 */
public record AveragingDecision(boolean accepted, BigDecimal maxAddStake, String reason) {

  public static AveragingDecision accept(BigDecimal room) {
    return new AveragingDecision(true, room, "ok");
  }

  public static AveragingDecision decline(String reason) {
    return new AveragingDecision(false, BigDecimal.ZERO, reason);
  }
}
