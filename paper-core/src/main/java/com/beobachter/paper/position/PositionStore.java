package com.beobachter.paper.position;

import com.beobachter.paper.domain.Position;
import com.beobachter.paper.domain.PositionStatus;
import com.beobachter.paper.domain.Signal;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Owns live and closed positions and enforces the lifecycle
 * {@code OPENING -> OPEN -> CLOSING_* -> CLOSED}.
 *
 * <p>The active index is keyed by market id, so at most one non-terminal position exists per
 * market. Transitions are applied with {@link ConcurrentHashMap#compute} and are therefore
 * atomic per market even without the engine's market lock.
 */
public class PositionStore {

  private final Map<String, Position> active = new ConcurrentHashMap<>();
  private final List<Position> history = new CopyOnWriteArrayList<>();

  /**
   * Places a transient OPENING placeholder. Empty when the market already has an active position.
   */
  public Optional<Position> beginOpening(String positionId, Signal signal, Instant now) {
    return beginOpening(Position.opening(positionId, signal, now));
  }

  public Optional<Position> beginOpening(Position placeholder) {
    return beginOpening(placeholder, Integer.MAX_VALUE);
  }

  /**
   * Places a transient OPENING placeholder unless the market is already active or
   * {@code maxActive} positions are already held. The count check and the insert happen under
   * one monitor, so concurrent openers for different markets cannot overshoot the cap.
   */
  public Optional<Position> beginOpening(String positionId, Signal signal, Instant now, int maxActive) {
    return beginOpening(Position.opening(positionId, signal, now), maxActive);
  }

  public synchronized Optional<Position> beginOpening(Position placeholder, int maxActive) {
    if (placeholder.status() != PositionStatus.OPENING) {
      throw new IllegalTransitionException(placeholder.marketId(), placeholder.status(), "begin opening");
    }
    if (active.size() >= maxActive && !active.containsKey(placeholder.marketId())) {
      return Optional.empty();
    }
    Position existing = active.putIfAbsent(placeholder.marketId(), placeholder);
    return existing == null ? Optional.of(placeholder) : Optional.empty();
  }

  public Position completeOpening(String marketId, String reservationId, BigDecimal stake, BigDecimal fillPrice,
                                  Instant now) {
    return transition(marketId, PositionStatus.OPENING, "open",
        p -> p.opened(reservationId, stake, fillPrice, now));
  }

  /**
   * Drops an OPENING placeholder. Nothing about it is persisted.
   */
  public void abandonOpening(String marketId) {
    active.computeIfPresent(marketId, (id, p) -> {
      if (p.status() != PositionStatus.OPENING) {
        throw new IllegalTransitionException(id, p.status(), "abandon");
      }
      return null;
    });
  }

  public Position averageDown(String marketId, BigDecimal addStake, BigDecimal fillPrice, double edge) {
    return transition(marketId, PositionStatus.OPEN, "average down",
        p -> p.withAddition(addStake, fillPrice, edge));
  }

  /**
   * Moves an OPEN position into the given closing state. Empty when the position is missing or
   * is not OPEN, which is how a second close attempt gets rejected.
   */
  public Optional<Position> beginClosing(String marketId, PositionStatus closingStatus) {
    if (!closingStatus.isClosing()) {
      throw new IllegalArgumentException("not a closing status: " + closingStatus);
    }
    Position[] result = new Position[1];
    active.computeIfPresent(marketId, (id, p) -> {
      if (p.status() != PositionStatus.OPEN) {
        return p;
      }
      result[0] = p.withStatus(closingStatus);
      return result[0];
    });
    return Optional.ofNullable(result[0]);
  }

  /**
   * Finishes a close: the immutable CLOSED position leaves the active index for history.
   */
  public Position completeClosing(String marketId, BigDecimal exitPrice, BigDecimal realizedPnl, Instant now) {
    Position[] result = new Position[1];
    active.compute(marketId, (id, p) -> {
      if (p == null || !p.status().isClosing()) {
        throw new IllegalTransitionException(id, p == null ? null : p.status(), "complete closing");
      }
      result[0] = p.closed(exitPrice, realizedPnl, now);
      return null;
    });
    history.add(result[0]);
    return result[0];
  }

  /**
   * Puts a CLOSING position back to OPEN when its release could not be committed.
   */
  public void revertClosing(String marketId) {
    active.computeIfPresent(marketId, (id, p) -> p.status().isClosing() ? p.withStatus(PositionStatus.OPEN) : p);
  }

  public Optional<Position> active(String marketId) {
    return Optional.ofNullable(active.get(marketId));
  }

  public boolean isActive(String marketId) {
    return active.containsKey(marketId);
  }

  public Collection<Position> activePositions() {
    return List.copyOf(active.values());
  }

  public List<Position> closedPositions() {
    return new ArrayList<>(history);
  }

  public int openCount() {
    return active.size();
  }

  private Position transition(String marketId, PositionStatus required, String action,
                              UnaryOperator<Position> change) {
    Position[] result = new Position[1];
    active.compute(marketId, (id, p) -> {
      if (p == null || p.status() != required) {
        throw new IllegalTransitionException(id, p == null ? null : p.status(), action);
      }
      result[0] = change.apply(p);
      return result[0];
    });
    return result[0];
  }
}
