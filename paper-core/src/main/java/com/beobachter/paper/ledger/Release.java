package com.beobachter.paper.ledger;

import java.math.BigDecimal;

/**
 * Result of releasing a reservation: the reserved amount, the realized PnL and the cash
 * that went back to available capital.
 */
public record Release(ReservationToken token, BigDecimal reserved, BigDecimal realizedPnl, BigDecimal returned) {
}
