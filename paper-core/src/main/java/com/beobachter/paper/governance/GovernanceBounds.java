package com.beobachter.paper.governance;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable set of governance bounds. Parameters without a bound are passed through unchanged.
 */
public final class GovernanceBounds {

  private static final GovernanceBounds UNBOUNDED = new GovernanceBounds(Map.of());

  private final Map<GovernedParameter, ParameterBound> bounds;

  public GovernanceBounds(Map<GovernedParameter, ParameterBound> bounds) {
    EnumMap<GovernedParameter, ParameterBound> copy = new EnumMap<>(GovernedParameter.class);
    if (bounds != null) {
      copy.putAll(bounds);
    }
    this.bounds = Collections.unmodifiableMap(copy);
  }

  public static GovernanceBounds unbounded() {
    return UNBOUNDED;
  }

  public Map<GovernedParameter, ParameterBound> asMap() {
    return bounds;
  }

  public double clamp(GovernedParameter parameter, double value, ClampListener listener) {
    ParameterBound bound = bounds.get(parameter);
    if (bound == null) {
      return value;
    }
    double applied = bound.clamp(value);
    if (Double.compare(applied, value) != 0 && listener != null) {
      listener.onClamp(parameter, value, applied);
    }
    return applied;
  }

  public int clampInt(GovernedParameter parameter, int value, ClampListener listener) {
    return (int) Math.round(clamp(parameter, value, listener));
  }

  @FunctionalInterface
  public interface ClampListener {
    void onClamp(GovernedParameter parameter, double requested, double applied);
  }
}
