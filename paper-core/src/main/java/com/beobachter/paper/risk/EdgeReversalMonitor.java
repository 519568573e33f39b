package com.beobachter.paper.risk;

import com.beobachter.paper.domain.ConfidenceTier;
import com.beobachter.paper.domain.Position;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts consecutive evaluations in which the latest signal edge for a position's side has lost
 * the sign the position was opened with, or has decayed below the minimum entry edge while the
 * latest signal is {@link ConfidenceTier#HIGH}. A single healthy evaluation resets the count.
 */
public class EdgeReversalMonitor {

  private final Map<String, Integer> consecutive = new ConcurrentHashMap<>();

  /**
   * Returns true once the reversal has persisted for {@code required} evaluations.
   */
  public boolean observe(Position position, double latestEdge, int required) {
    return observe(position, latestEdge, null, 0.0, required);
  }

  public boolean observe(Position position, double latestEdge, ConfidenceTier confidence, double minEdge,
                         int required) {
    if (!isReversed(position.entryEdge(), latestEdge)
        && !isDecayed(position.entryEdge(), latestEdge, confidence, minEdge)) {
      consecutive.remove(position.positionId());
      return false;
    }
    int count = consecutive.merge(position.positionId(), 1, Integer::sum);
    return count >= required;
  }

  public int streak(String positionId) {
    return consecutive.getOrDefault(positionId, 0);
  }

  public void forget(String positionId) {
    consecutive.remove(positionId);
  }

  static boolean isReversed(double entryEdge, double latestEdge) {
    // an edge that shrank to zero counts as gone
    return entryEdge >= 0 ? latestEdge <= 0 : latestEdge >= 0;
  }

  static boolean isDecayed(double entryEdge, double latestEdge, ConfidenceTier confidence, double minEdge) {
    if (confidence != ConfidenceTier.HIGH) {
      return false;
    }
    return entryEdge >= 0 ? latestEdge < minEdge : latestEdge > -minEdge;
  }
}
