package com.beobachter.paper.governance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Parameters whose value range is owned by the governance process.
 */
public enum GovernedParameter {
  KELLY_FRACTION("kelly-fraction"),
  MAX_EXPOSURE_FRACTION("max-exposure-fraction"),
  MIN_EDGE("min-edge"),
  STOP_LOSS_PCT("stop-loss-pct"),
  TAKE_PROFIT_PCT("take-profit-pct"),
  DRAWDOWN_HALT_PCT("drawdown-halt-pct"),
  DRAWDOWN_RESUME_PCT("drawdown-resume-pct"),
  AVERAGING_MIN_PRICE_MOVE_PCT("averaging-min-price-move-pct"),
  AVERAGING_MAX_ADDITIONS("averaging-max-additions"),
  AVERAGING_MAX_MARKET_EXPOSURE_FRACTION("averaging-max-market-exposure-fraction"),
  EDGE_REVERSAL_CONSECUTIVE_EVALUATIONS("edge-reversal-consecutive-evaluations");

  private final String key;

  GovernedParameter(String key) {
    this.key = key;
  }

  @JsonValue
  public String key() {
    return key;
  }

  @JsonCreator
  public static GovernedParameter fromKey(String key) {
    return Arrays.stream(values())
        .filter(p -> p.key.equalsIgnoreCase(key) || p.name().equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown governed parameter: " + key));
  }
}
