package com.beobachter.paper.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single source of truth for total, available and allocated capital.
 *
 * <p>Every mutation runs in one short critical section on {@link #lock}, so
 * {@code available + allocated == total} holds at every point another thread can observe.
 * Nothing inside a critical section does I/O. Callers holding a per-market lock may take the
 * ledger lock, never the other way round.
 */
@Slf4j
public class CapitalLedger {

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Reservation> reservations = new HashMap<>();

  private BigDecimal total = BigDecimal.ZERO;
  private BigDecimal available = BigDecimal.ZERO;
  private BigDecimal allocated = BigDecimal.ZERO;

  public CapitalLedger() {
  }

  public CapitalLedger(BigDecimal initialCapital) {
    deposit(initialCapital);
  }

  /**
   * Moves {@code amount} from available to allocated, or returns empty when there is not enough
   * available capital.
   */
  public Optional<ReservationToken> tryReserve(String positionId, BigDecimal amount) {
    return tryReserve(positionId, UUID.randomUUID().toString(), amount);
  }

  public Optional<ReservationToken> tryReserve(String positionId, String reservationId, BigDecimal amount) {
    requirePositive(amount, "reserve");
    lock.lock();
    try {
      if (reservations.containsKey(reservationId)) {
        throw new LedgerInvariantViolationException("reservation id already in use: " + reservationId);
      }
      if (amount.compareTo(available) > 0) {
        return Optional.empty();
      }
      available = available.subtract(amount);
      allocated = allocated.add(amount);
      ReservationToken token = new ReservationToken(reservationId, positionId);
      reservations.put(reservationId, new Reservation(token, amount));
      return Optional.of(token);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Grows an existing reservation, used when averaging down into an open position.
   */
  public boolean tryIncrease(ReservationToken token, BigDecimal amount) {
    requirePositive(amount, "increase");
    lock.lock();
    try {
      Reservation existing = requireLive(token);
      if (amount.compareTo(available) > 0) {
        return false;
      }
      available = available.subtract(amount);
      allocated = allocated.add(amount);
      reservations.put(token.reservationId(), new Reservation(token, existing.amount().add(amount)));
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the reserved amount to the pool and books {@code realizedPnl}. The PnL cannot lose
   * more than was reserved.
   */
  public Release release(ReservationToken token, BigDecimal realizedPnl) {
    lock.lock();
    try {
      Reservation reservation = requireLive(token);
      BigDecimal reserved = reservation.amount();
      if (realizedPnl.add(reserved).signum() < 0) {
        throw new LedgerInvariantViolationException(
            "loss " + realizedPnl + " exceeds reserved " + reserved + " for " + token.reservationId());
      }
      reservations.remove(token.reservationId());
      BigDecimal returned = reserved.add(realizedPnl);
      allocated = allocated.subtract(reserved);
      available = available.add(returned);
      total = total.add(realizedPnl);
      return new Release(token, reserved, realizedPnl, returned);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Undoes a reservation that was never committed. Books no PnL.
   */
  public BigDecimal cancel(ReservationToken token) {
    lock.lock();
    try {
      Reservation reservation = requireLive(token);
      reservations.remove(token.reservationId());
      allocated = allocated.subtract(reservation.amount());
      available = available.add(reservation.amount());
      return reservation.amount();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reverts part of a reservation after an uncommitted increase.
   */
  public void shrink(ReservationToken token, BigDecimal amount) {
    lock.lock();
    try {
      Reservation reservation = requireLive(token);
      if (amount.compareTo(reservation.amount()) >= 0) {
        throw new LedgerInvariantViolationException("cannot shrink " + token.reservationId() + " by " + amount);
      }
      reservations.put(token.reservationId(), new Reservation(token, reservation.amount().subtract(amount)));
      allocated = allocated.subtract(amount);
      available = available.add(amount);
    } finally {
      lock.unlock();
    }
  }

  public void deposit(BigDecimal amount) {
    requirePositive(amount, "deposit");
    lock.lock();
    try {
      total = total.add(amount);
      available = available.add(amount);
    } finally {
      lock.unlock();
    }
  }

  public LedgerSnapshot snapshot() {
    lock.lock();
    try {
      return new LedgerSnapshot(total, available, allocated);
    } finally {
      lock.unlock();
    }
  }

  public BigDecimal reservedAmount(ReservationToken token) {
    lock.lock();
    try {
      return requireLive(token).amount();
    } finally {
      lock.unlock();
    }
  }

  public int liveReservationCount() {
    lock.lock();
    try {
      return reservations.size();
    } finally {
      lock.unlock();
    }
  }

  private Reservation requireLive(ReservationToken token) {
    if (token == null) {
      throw new LedgerInvariantViolationException("null reservation token");
    }
    Reservation reservation = reservations.get(token.reservationId());
    if (reservation == null) {
      log.error("ledger invariant violation: unknown or released reservation {} (position {})",
          token.reservationId(), token.positionId());
      throw new LedgerInvariantViolationException("unknown or already released reservation " + token.reservationId());
    }
    return reservation;
  }

  private static void requirePositive(BigDecimal amount, String op) {
    if (amount == null || amount.signum() <= 0) {
      throw new IllegalArgumentException(op + " amount must be positive: " + amount);
    }
  }

  private record Reservation(ReservationToken token, BigDecimal amount) {
  }
}
