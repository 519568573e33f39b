package com.beobachter.paper.journal;

import com.beobachter.paper.domain.Position;
import com.beobachter.paper.domain.PositionStatus;
import com.beobachter.paper.journal.JournalEntry.DepositRecord;
import com.beobachter.paper.journal.JournalEntry.ReleaseRecord;
import com.beobachter.paper.journal.JournalEntry.ReservationRecord;
import com.beobachter.paper.journal.JournalEntry.TransitionRecord;
import com.beobachter.paper.ledger.CapitalLedger;
import com.beobachter.paper.ledger.LedgerInvariantViolationException;
import com.beobachter.paper.ledger.ReservationToken;
import com.beobachter.paper.position.PositionStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Deterministic fold of journal entries into a ledger and a position store.
 *
 * <p>Positions left in a CLOSING state (close started, release never committed) are put back
 * to OPEN so the next evaluation sweep closes them again.
 */
@Slf4j
public class JournalReplayer {

  public record ReplayResult(CapitalLedger ledger, PositionStore store, long lastSequence, int applied,
                             int reopened) {
  }

  public ReplayResult replay(List<JournalEntry> entries) {
    return replayInto(new CapitalLedger(), new PositionStore(), entries);
  }

  public ReplayResult replayInto(CapitalLedger ledger, PositionStore store, List<JournalEntry> entries) {
    long lastSequence = 0;
    int applied = 0;
    for (JournalEntry entry : entries) {
      if (entry.sequence() <= lastSequence) {
        throw new LedgerInvariantViolationException(
            "journal out of order: seq " + entry.sequence() + " after " + lastSequence);
      }
      apply(ledger, store, entry);
      lastSequence = entry.sequence();
      applied++;
    }

    int reopened = 0;
    for (Position position : store.activePositions()) {
      if (position.status().isClosing()) {
        store.revertClosing(position.marketId());
        reopened++;
        log.warn("replay: position {} in {} was mid-close, reopened", position.positionId(), position.marketId());
      }
    }
    return new ReplayResult(ledger, store, lastSequence, applied, reopened);
  }

  private void apply(CapitalLedger ledger, PositionStore store, JournalEntry entry) {
    if (entry instanceof DepositRecord deposit) {
      ledger.deposit(deposit.amount());
    } else if (entry instanceof ReservationRecord reservation) {
      applyReservation(ledger, store, reservation);
    } else if (entry instanceof ReleaseRecord release) {
      ReservationToken token = new ReservationToken(release.reservationId(), release.positionId());
      if (store.active(release.marketId()).map(Position::isOpen).orElse(false)) {
        store.beginClosing(release.marketId(), release.closingStatus());
      }
      store.completeClosing(release.marketId(), release.exitPrice(), release.realizedPnl(), release.timestamp());
      ledger.release(token, release.realizedPnl());
    } else if (entry instanceof TransitionRecord transition) {
      if (transition.from() == PositionStatus.OPEN && transition.to().isClosing()) {
        store.beginClosing(transition.marketId(), transition.to());
      }
    }
  }

  private void applyReservation(CapitalLedger ledger, PositionStore store, ReservationRecord r) {
    switch (r.reason()) {
      case OPEN -> {
        ledger.tryReserve(r.positionId(), r.reservationId(), r.amount())
            .orElseThrow(() -> new LedgerInvariantViolationException(
                "replay could not reserve " + r.amount() + " for " + r.positionId()));
        store.beginOpening(Position.opening(r.positionId(), r.marketId(), r.side(), r.edge(), r.expiresAt(),
                r.signalId(), r.timestamp()))
            .orElseThrow(() -> new LedgerInvariantViolationException(
                "replay found a second active position in " + r.marketId()));
        store.completeOpening(r.marketId(), r.reservationId(), r.amount(), r.fillPrice(), r.timestamp());
      }
      case AVERAGE_DOWN -> {
        ReservationToken token = new ReservationToken(r.reservationId(), r.positionId());
        if (!ledger.tryIncrease(token, r.amount())) {
          throw new LedgerInvariantViolationException(
              "replay could not increase " + r.reservationId() + " by " + r.amount());
        }
        store.averageDown(r.marketId(), r.amount(), r.fillPrice(), r.edge());
      }
    }
  }
}
