package com.beobachter.paper.risk;

import com.beobachter.paper.domain.PositionStatus;

import java.math.BigDecimal;

/**
 * Instructions the supervisor hands back to the engine.
 */
public sealed interface LifecycleCommand {

  String reason();

  record Close(String marketId, PositionStatus closingStatus, BigDecimal markPrice, String reason)
      implements LifecycleCommand {
  }

  record TopUp(String marketId, BigDecimal maxAddStake, String reason) implements LifecycleCommand {
  }

  record HaltNewEntries(DrawdownState state, String reason) implements LifecycleCommand {
  }
}
