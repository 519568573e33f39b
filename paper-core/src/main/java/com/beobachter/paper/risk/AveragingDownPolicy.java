package com.beobachter.paper.risk;

import com.beobachter.paper.config.PaperTradingProperties;
import com.beobachter.paper.domain.Position;
import com.beobachter.paper.domain.Signal;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decides whether a repeat signal for an open market should add to the position.
 *
 * <p>All of these must hold: same side, price moved against the entry by at least the
 * configured fraction, edge improved on the entry edge, additions below the cap and room left
 * under the per-market exposure cap.
 */
public class AveragingDownPolicy {

  public AveragingDecision evaluate(Position position, Signal signal, BigDecimal totalCapital,
                                    PaperTradingProperties.AveragingDown rules) {
    if (!Boolean.TRUE.equals(rules.enabled())) {
      return AveragingDecision.decline("averaging down disabled");
    }
    if (!position.isOpen()) {
      return AveragingDecision.decline("position is " + position.status());
    }
    if (signal.side() != position.side()) {
      return AveragingDecision.decline("opposite side");
    }
    if (position.additions() >= rules.maxAdditions()) {
      return AveragingDecision.decline("max additions reached (" + position.additions() + ")");
    }

    BigDecimal price = BigDecimal.valueOf(signal.marketPrice());
    double move = position.entryPrice().subtract(price)
        .divide(position.entryPrice(), 8, RoundingMode.HALF_UP)
        .doubleValue();
    if (move < rules.minPriceMovePct()) {
      return AveragingDecision.decline(String.format("price move %.4f below %.4f", move, rules.minPriceMovePct()));
    }

    double improvement = signal.edge() - position.entryEdge();
    if (improvement < rules.minEdgeImprovement()) {
      return AveragingDecision.decline(
          String.format("edge improvement %.4f below %.4f", improvement, rules.minEdgeImprovement()));
    }

    BigDecimal cap = totalCapital.multiply(BigDecimal.valueOf(rules.maxMarketExposureFraction()))
        .setScale(2, RoundingMode.DOWN);
    BigDecimal room = cap.subtract(position.stake());
    if (room.signum() <= 0) {
      return AveragingDecision.decline("market exposure cap " + cap + " reached");
    }
    return AveragingDecision.accept(room);
  }
}
