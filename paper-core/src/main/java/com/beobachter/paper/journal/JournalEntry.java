package com.beobachter.paper.journal;

import com.beobachter.paper.domain.PositionStatus;
import com.beobachter.paper.domain.Side;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One line of the append-only journal. Sequence numbers are assigned by the {@link Journal}
 * on append and are strictly increasing.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = JournalEntry.DepositRecord.class, name = "DEPOSIT"),
    @JsonSubTypes.Type(value = JournalEntry.ReservationRecord.class, name = "RESERVATION"),
    @JsonSubTypes.Type(value = JournalEntry.ReleaseRecord.class, name = "RELEASE"),
    @JsonSubTypes.Type(value = JournalEntry.TransitionRecord.class, name = "TRANSITION")
})
public sealed interface JournalEntry {

  long sequence();

  Instant timestamp();

  JournalEntry withSequence(long sequence);

  enum ReservationReason {
    OPEN,
    AVERAGE_DOWN
  }

  record DepositRecord(long sequence, Instant timestamp, BigDecimal amount, String note) implements JournalEntry {
    @Override
    public DepositRecord withSequence(long seq) {
      return new DepositRecord(seq, timestamp, amount, note);
    }
  }

  /**
   * Capital moved into a position. Carries the fill so replay can rebuild the position.
   */
  record ReservationRecord(
      long sequence,
      Instant timestamp,
      String positionId,
      String marketId,
      String reservationId,
      BigDecimal amount,
      ReservationReason reason,
      Side side,
      BigDecimal fillPrice,
      double edge,
      Instant expiresAt,
      String signalId
  ) implements JournalEntry {
    @Override
    public ReservationRecord withSequence(long seq) {
      return new ReservationRecord(seq, timestamp, positionId, marketId, reservationId, amount, reason, side,
          fillPrice, edge, expiresAt, signalId);
    }
  }

  record ReleaseRecord(
      long sequence,
      Instant timestamp,
      String positionId,
      String marketId,
      String reservationId,
      BigDecimal amountReleased,
      BigDecimal realizedPnl,
      PositionStatus closingStatus,
      BigDecimal exitPrice
  ) implements JournalEntry {
    @Override
    public ReleaseRecord withSequence(long seq) {
      return new ReleaseRecord(seq, timestamp, positionId, marketId, reservationId, amountReleased, realizedPnl,
          closingStatus, exitPrice);
    }
  }

  /**
   * Lifecycle change with no capital movement, such as OPEN to CLOSING_STOP_LOSS.
   */
  record TransitionRecord(
      long sequence,
      Instant timestamp,
      String positionId,
      String marketId,
      PositionStatus from,
      PositionStatus to,
      String detail
  ) implements JournalEntry {
    @Override
    public TransitionRecord withSequence(long seq) {
      return new TransitionRecord(seq, timestamp, positionId, marketId, from, to, detail);
    }
  }
}
