package com.beobachter.paper.engine;

import com.beobachter.paper.ledger.LedgerSnapshot;
import com.beobachter.paper.risk.DrawdownState;

public record EngineStatus(
    LedgerSnapshot capital,
    int activePositions,
    int closedPositions,
    DrawdownState drawdown,
    FatalHalt fatalHalt,
    long journalSequence
) {

  public boolean intakeFrozen() {
    return fatalHalt != null;
  }
}
