package com.beobachter.paper.engine;

public enum FatalCondition {
  LEDGER_INVARIANT_VIOLATION,
  JOURNAL_WRITE_FAILURE,
  LEDGER_DIVERGENCE
}
