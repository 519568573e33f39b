package com.beobachter.paper.ledger;

/**
 * Accounting mismatch inside the ledger. Always a programming error.
 */
public class LedgerInvariantViolationException extends IllegalStateException {

  public LedgerInvariantViolationException(String message) {
    super(message);
  }
}
