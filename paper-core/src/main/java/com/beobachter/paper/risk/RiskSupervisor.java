package com.beobachter.paper.risk;

import com.beobachter.paper.domain.ConfidenceTier;
import com.beobachter.paper.domain.MarketQuote;
import com.beobachter.paper.domain.Position;
import com.beobachter.paper.domain.PositionStatus;
import com.beobachter.paper.domain.Signal;
import com.beobachter.paper.governance.RiskParameters;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Combines the drawdown breaker, edge reversal monitor, averaging-down policy and the
 * stop-loss, take-profit and expiry exits.
 *
 * <p>Exit checks run in priority order: resolution, expiry, stop-loss, take-profit, edge
 * reversal. The first one that fires wins.
 */
@Slf4j
@RequiredArgsConstructor
public class RiskSupervisor {

  @Getter
  private final @NonNull DrawdownProtector drawdownProtector;
  @Getter
  private final @NonNull EdgeReversalMonitor edgeReversalMonitor;
  private final @NonNull AveragingDownPolicy averagingDownPolicy;

  public RiskSupervisor() {
    this(new DrawdownProtector(), new EdgeReversalMonitor(), new AveragingDownPolicy());
  }

  /**
   * Feeds total capital to the breaker. Returns a halt command only on the observation that
   * trips it.
   */
  public Optional<LifecycleCommand.HaltNewEntries> observeCapital(BigDecimal total, Instant now,
                                                                  RiskParameters params) {
    boolean wasHalted = drawdownProtector.isHalted();
    DrawdownState state = drawdownProtector.observe(total, now, params.drawdown());
    if (state.halted() && !wasHalted) {
      return Optional.of(new LifecycleCommand.HaltNewEntries(state,
          String.format("drawdown %.4f above %.4f", state.drawdown(), params.drawdown().haltPct())));
    }
    return Optional.empty();
  }

  public boolean entriesHalted() {
    return drawdownProtector.isHalted();
  }

  public Optional<LifecycleCommand.TopUp> reviewRepeatSignal(Position position, Signal signal, BigDecimal total,
                                                             RiskParameters params) {
    AveragingDecision decision = averagingDownPolicy.evaluate(position, signal, total, params.averagingDown());
    if (!decision.accepted()) {
      log.debug("averaging down declined for {}: {}", position.marketId(), decision.reason());
      return Optional.empty();
    }
    return Optional.of(new LifecycleCommand.TopUp(position.marketId(), decision.maxAddStake(), decision.reason()));
  }

  /**
   * Re-evaluates an open position against its latest quote and the latest signal edge for its
   * side. Either may be null when nothing has arrived for the market yet. A high-confidence
   * signal whose edge sits below the minimum entry edge counts toward the reversal streak.
   */
  public Optional<LifecycleCommand.Close> evaluate(Position position, MarketQuote quote, Double latestEdge,
                                                   ConfidenceTier latestConfidence, RiskParameters params,
                                                   Instant now) {
    if (!position.isOpen()) {
      return Optional.empty();
    }
    String marketId = position.marketId();

    if (quote != null && quote.resolved() && quote.resolvedOutcome() != null) {
      return close(position, PositionStatus.CLOSING_RESOLVED, null, "market resolved " + quote.resolvedOutcome());
    }
    BigDecimal mark = quote != null && quote.yesPrice() != null ? quote.priceFor(position.side()) : null;

    if (position.expiresAt() != null && !now.isBefore(position.expiresAt())) {
      return close(position, PositionStatus.CLOSING_EXPIRED, mark, "horizon elapsed at " + position.expiresAt());
    }
    if (mark != null) {
      double ret = position.returnAt(mark);
      if (ret <= -params.exits().stopLossPct()) {
        return close(position, PositionStatus.CLOSING_STOP_LOSS, mark,
            String.format("return %.4f <= -%.4f", ret, params.exits().stopLossPct()));
      }
      if (ret >= params.exits().takeProfitPct()) {
        return close(position, PositionStatus.CLOSING_TAKE_PROFIT, mark,
            String.format("return %.4f >= %.4f", ret, params.exits().takeProfitPct()));
      }
    }
    if (latestEdge != null && edgeReversalMonitor.observe(position, latestEdge, latestConfidence,
        params.sizing().minEdge(), params.edgeReversal().consecutiveEvaluations())) {
      int streak = edgeReversalMonitor.streak(position.positionId());
      if (EdgeReversalMonitor.isReversed(position.entryEdge(), latestEdge)) {
        return close(position, PositionStatus.CLOSING_MANUAL, mark,
            "edge reversed for " + streak + " evaluations in " + marketId);
      }
      return close(position, PositionStatus.CLOSING_MANUAL, mark, String.format(
          "edge %.4f decayed below min edge %.4f on high-confidence signal for %d evaluations in %s",
          latestEdge, params.sizing().minEdge(), streak, marketId));
    }
    return Optional.empty();
  }

  public void onClosed(Position position) {
    edgeReversalMonitor.forget(position.positionId());
  }

  private static Optional<LifecycleCommand.Close> close(Position position, PositionStatus status, BigDecimal mark,
                                                        String reason) {
    return Optional.of(new LifecycleCommand.Close(position.marketId(), status, mark, reason));
  }
}
