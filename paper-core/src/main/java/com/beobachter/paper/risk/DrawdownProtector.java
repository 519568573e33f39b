package com.beobachter.paper.risk;

import com.beobachter.paper.config.PaperTradingProperties;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker on drawdown from the rolling capital peak.
 *
 * <p>Once drawdown exceeds the halt threshold new entries are blocked. Recovery either waits
 * for drawdown to fall below the resume threshold (hysteresis) or for the cool-down to elapse,
 * after which the baseline re-anchors to current capital.
 */
@Slf4j
public class DrawdownProtector {

  private BigDecimal baseline;
  private BigDecimal lastTotal = BigDecimal.ZERO;
  private boolean halted;
  private Instant haltedAt;
  private long observations;

  public synchronized DrawdownState observe(BigDecimal total, Instant now, PaperTradingProperties.Drawdown rules) {
    observations++;
    lastTotal = total;
    if (baseline == null || (!halted && total.compareTo(baseline) > 0)) {
      baseline = total;
    }
    double drawdown = drawdown(total);

    if (halted) {
      if (canResume(drawdown, now, rules)) {
        halted = false;
        haltedAt = null;
        if (rules.recoveryMode() == PaperTradingProperties.RecoveryMode.COOLDOWN) {
          baseline = total;
          drawdown = 0.0;
        }
        log.info("drawdown breaker reset: total={} baseline={} drawdown={}", total, baseline, fmt(drawdown));
      }
    } else if (observations >= rules.minDataPoints() && drawdown > rules.haltPct()) {
      halted = true;
      haltedAt = now;
      log.warn("drawdown breaker tripped: total={} baseline={} drawdown={} threshold={}",
          total, baseline, fmt(drawdown), fmt(rules.haltPct()));
    }
    return new DrawdownState(baseline, total, drawdown, halted, haltedAt);
  }

  public synchronized boolean isHalted() {
    return halted;
  }

  public synchronized DrawdownState state() {
    BigDecimal base = baseline == null ? BigDecimal.ZERO : baseline;
    return new DrawdownState(base, lastTotal, baseline == null ? 0.0 : drawdown(lastTotal), halted, haltedAt);
  }

  /**
   * Re-anchors the baseline, e.g. after recovery from the journal.
   */
  public synchronized void reset(BigDecimal newBaseline) {
    baseline = newBaseline;
    lastTotal = newBaseline;
    halted = false;
    haltedAt = null;
    observations = 0;
  }

  private boolean canResume(double drawdown, Instant now, PaperTradingProperties.Drawdown rules) {
    if (rules.recoveryMode() == PaperTradingProperties.RecoveryMode.COOLDOWN) {
      return haltedAt != null && !Duration.between(haltedAt, now).minus(rules.cooldown()).isNegative();
    }
    return drawdown < rules.resumePct();
  }

  private double drawdown(BigDecimal total) {
    if (baseline.signum() <= 0) {
      return 0.0;
    }
    return baseline.subtract(total).divide(baseline, 8, RoundingMode.HALF_UP).doubleValue();
  }

  private static String fmt(double v) {
    return String.format("%.2f%%", v * 100);
  }
}
