package com.beobachter.paper.governance;

import com.beobachter.paper.config.PaperTradingProperties;
import com.beobachter.paper.config.PaperTradingProperties.AveragingDown;
import com.beobachter.paper.config.PaperTradingProperties.Drawdown;
import com.beobachter.paper.config.PaperTradingProperties.EdgeReversal;
import com.beobachter.paper.config.PaperTradingProperties.Exits;
import com.beobachter.paper.config.PaperTradingProperties.Sizing;
import com.beobachter.paper.config.PaperTradingProperties.Slippage;

import static com.beobachter.paper.governance.GovernedParameter.*;

/**
 * Snapshot of every tunable the engine reads during one operation. Built once per
 * (re)load with all governed values already clamped, then swapped in atomically.
 */
public record RiskParameters(
    Sizing sizing,
    Slippage slippage,
    Exits exits,
    Drawdown drawdown,
    EdgeReversal edgeReversal,
    AveragingDown averagingDown,
    int maxOpenPositions
) {

  public static RiskParameters defaults() {
    return resolve(PaperTradingProperties.defaults(), GovernanceBounds.unbounded(), null);
  }

  public static RiskParameters resolve(PaperTradingProperties properties,
                                       GovernanceBounds bounds,
                                       GovernanceBounds.ClampListener listener) {
    Sizing s = properties.sizing();
    Sizing sizing = new Sizing(
        bounds.clamp(KELLY_FRACTION, s.kellyFraction(), listener),
        bounds.clamp(MAX_EXPOSURE_FRACTION, s.maxExposureFraction(), listener),
        bounds.clamp(MIN_EDGE, s.minEdge(), listener),
        s.minStakeUsd()
    );

    Exits e = properties.exits();
    Exits exits = new Exits(
        bounds.clamp(STOP_LOSS_PCT, e.stopLossPct(), listener),
        bounds.clamp(TAKE_PROFIT_PCT, e.takeProfitPct(), listener)
    );

    Drawdown d = properties.drawdown();
    double halt = bounds.clamp(DRAWDOWN_HALT_PCT, d.haltPct(), listener);
    double resume = bounds.clamp(DRAWDOWN_RESUME_PCT, d.resumePct(), listener);
    Drawdown drawdown = new Drawdown(halt, Math.min(resume, halt), d.recoveryMode(), d.cooldown(), d.minDataPoints());

    EdgeReversal edgeReversal = new EdgeReversal(
        Math.max(1, bounds.clampInt(EDGE_REVERSAL_CONSECUTIVE_EVALUATIONS,
            properties.edgeReversal().consecutiveEvaluations(), listener)));

    AveragingDown a = properties.averagingDown();
    AveragingDown averagingDown = new AveragingDown(
        a.enabled(),
        bounds.clamp(AVERAGING_MIN_PRICE_MOVE_PCT, a.minPriceMovePct(), listener),
        a.minEdgeImprovement(),
        Math.max(0, bounds.clampInt(AVERAGING_MAX_ADDITIONS, a.maxAdditions(), listener)),
        bounds.clamp(AVERAGING_MAX_MARKET_EXPOSURE_FRACTION, a.maxMarketExposureFraction(), listener)
    );

    return new RiskParameters(sizing, properties.slippage(), exits, drawdown, edgeReversal, averagingDown,
        properties.capital().maxOpenPositions());
  }
}
