package com.beobachter.paper.position;

import com.beobachter.paper.domain.PositionStatus;

public class IllegalTransitionException extends IllegalStateException {

  public IllegalTransitionException(String marketId, PositionStatus from, String attempted) {
    super("cannot " + attempted + " position in market " + marketId + " from " + from);
  }
}
