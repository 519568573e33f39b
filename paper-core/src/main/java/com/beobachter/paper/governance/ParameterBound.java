package com.beobachter.paper.governance;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Inclusive range with an optional step. A zero or missing step means continuous.
 */
public record ParameterBound(BigDecimal min, BigDecimal max, BigDecimal step) {

  public ParameterBound {
    if (min == null || max == null) {
      throw new IllegalArgumentException("bound requires min and max");
    }
    if (min.compareTo(max) > 0) {
      throw new IllegalArgumentException("bound min " + min + " exceeds max " + max);
    }
    if (step == null || step.signum() < 0) {
      step = BigDecimal.ZERO;
    }
  }

  public static ParameterBound of(double min, double max, double step) {
    return new ParameterBound(BigDecimal.valueOf(min), BigDecimal.valueOf(max), BigDecimal.valueOf(step));
  }

  /**
   * Snaps {@code value} to the nearest step above {@code min}, then clamps it into range.
   */
  public double clamp(double value) {
    BigDecimal v = BigDecimal.valueOf(value);
    if (step.signum() > 0) {
      BigDecimal steps = v.subtract(min).divide(step, 0, RoundingMode.HALF_UP);
      v = min.add(steps.multiply(step));
    }
    if (v.compareTo(min) < 0) {
      v = min;
    } else if (v.compareTo(max) > 0) {
      v = max;
    }
    return v.doubleValue();
  }

  public boolean contains(double value) {
    return clamp(value) == value;
  }
}
