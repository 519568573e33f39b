package com.beobachter.paper.engine;

import java.math.BigDecimal;
import java.util.List;

public record EvaluationSummary(int evaluated, List<ClosedPosition> closed, boolean entriesHalted) {

  public record ClosedPosition(String marketId, String exitStatus, BigDecimal realizedPnl) {
  }
}
