package com.beobachter.paper.service.report;

import com.beobachter.paper.domain.Position;
import com.beobachter.paper.engine.PaperTradingEngine;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Win rate, profit factor and realized drawdown over the engine's closed positions.
 */
@Service
@RequiredArgsConstructor
public class PerformanceReportService {

  /**
   * Profit factor reported when there are winning trades but no losing ones.
   */
  static final double PROFIT_FACTOR_CAP = 5.0;

  private final @NonNull PaperTradingEngine engine;

  public PerformanceReport report() {
    return summarize(engine.closedPositions());
  }

  public List<Position> closedPositions() {
    return engine.closedPositions();
  }

  static PerformanceReport summarize(List<Position> closed) {
    int wins = 0;
    int losses = 0;
    BigDecimal grossProfit = BigDecimal.ZERO;
    BigDecimal grossLoss = BigDecimal.ZERO;
    BigDecimal cumulative = BigDecimal.ZERO;
    BigDecimal peak = BigDecimal.ZERO;
    BigDecimal maxDrawdown = BigDecimal.ZERO;
    Map<String, Long> byStatus = new TreeMap<>();

    for (Position p : closed) {
      BigDecimal pnl = p.realizedPnl() == null ? BigDecimal.ZERO : p.realizedPnl();
      if (pnl.signum() > 0) {
        wins++;
        grossProfit = grossProfit.add(pnl);
      } else if (pnl.signum() < 0) {
        losses++;
        grossLoss = grossLoss.add(pnl.abs());
      }

      // closes are kept in order, so this walks the realized equity curve
      cumulative = cumulative.add(pnl);
      peak = peak.max(cumulative);
      maxDrawdown = maxDrawdown.max(peak.subtract(cumulative));

      String status = p.exitStatus() == null ? "UNKNOWN" : p.exitStatus().name();
      byStatus.merge(status, 1L, Long::sum);
    }

    int total = closed.size();
    double winRate = total == 0 ? 0.0 : (double) wins / total;
    double profitFactor;
    if (grossLoss.signum() > 0) {
      profitFactor = grossProfit.divide(grossLoss, 4, RoundingMode.HALF_UP).doubleValue();
    } else if (grossProfit.signum() > 0) {
      profitFactor = PROFIT_FACTOR_CAP;
    } else {
      profitFactor = 0.0;
    }
    BigDecimal net = grossProfit.subtract(grossLoss);
    BigDecimal average = total == 0 ? BigDecimal.ZERO : net.divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);

    return new PerformanceReport(total, wins, losses, winRate,
        grossProfit.setScale(2, RoundingMode.HALF_UP),
        grossLoss.setScale(2, RoundingMode.HALF_UP),
        profitFactor,
        net.setScale(2, RoundingMode.HALF_UP),
        average,
        maxDrawdown.setScale(2, RoundingMode.HALF_UP),
        byStatus);
  }
}
