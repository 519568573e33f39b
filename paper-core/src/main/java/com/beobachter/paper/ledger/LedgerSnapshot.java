package com.beobachter.paper.ledger;

import java.math.BigDecimal;

public record LedgerSnapshot(BigDecimal total, BigDecimal available, BigDecimal allocated) {

  public boolean isBalanced() {
    return available.add(allocated).compareTo(total) == 0
        && available.signum() >= 0
        && allocated.signum() >= 0;
  }
}
