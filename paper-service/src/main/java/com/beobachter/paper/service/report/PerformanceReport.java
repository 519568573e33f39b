package com.beobachter.paper.service.report;

import java.math.BigDecimal;
import java.util.Map;

public record PerformanceReport(
    int totalTrades,
    int wins,
    int losses,
    double winRate,
    BigDecimal grossProfit,
    BigDecimal grossLoss,
    double profitFactor,
    BigDecimal netPnl,
    BigDecimal averagePnl,
    BigDecimal maxRealizedDrawdown,
    Map<String, Long> closesByStatus
) {
}
