package com.beobachter.paper.journal;

import com.beobachter.paper.ledger.LedgerSnapshot;

import java.math.BigDecimal;
import java.time.Instant;

public record CapitalSnapshot(
    BigDecimal total,
    BigDecimal available,
    BigDecimal allocated,
    long lastSequence,
    Instant writtenAt
) {

  public static CapitalSnapshot of(LedgerSnapshot ledger, long lastSequence, Instant now) {
    return new CapitalSnapshot(ledger.total(), ledger.available(), ledger.allocated(), lastSequence, now);
  }

  public boolean matches(LedgerSnapshot ledger) {
    return total.compareTo(ledger.total()) == 0
        && available.compareTo(ledger.available()) == 0
        && allocated.compareTo(ledger.allocated()) == 0;
  }
}
