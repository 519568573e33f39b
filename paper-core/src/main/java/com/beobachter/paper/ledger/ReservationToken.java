package com.beobachter.paper.ledger;

/**
 * Handle for capital moved from available to allocated. Exactly one release is allowed per token.
 */
public record ReservationToken(String reservationId, String positionId) {
}
