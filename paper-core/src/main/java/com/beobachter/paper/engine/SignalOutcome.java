package com.beobachter.paper.engine;

import com.beobachter.paper.domain.Position;
import com.beobachter.paper.domain.RejectionReason;
import com.beobachter.paper.domain.Signal;

import java.math.BigDecimal;

public record SignalOutcome(
    String signalId,
    String marketId,
    Status status,
    RejectionReason rejection,
    String detail,
    BigDecimal stake,
    Position position
) {

  public enum Status {
    OPENED,
    AVERAGED_DOWN,
    REJECTED
  }

  static SignalOutcome opened(Signal signal, BigDecimal stake, Position position) {
    return new SignalOutcome(signal.signalId(), signal.marketId(), Status.OPENED, null, null, stake, position);
  }

  static SignalOutcome averaged(Signal signal, BigDecimal stake, Position position) {
    return new SignalOutcome(signal.signalId(), signal.marketId(), Status.AVERAGED_DOWN, null, null, stake, position);
  }

  static SignalOutcome rejected(Signal signal, RejectionReason reason, String detail) {
    return new SignalOutcome(
        signal == null ? null : signal.signalId(),
        signal == null ? null : signal.marketId(),
        Status.REJECTED, reason, detail, BigDecimal.ZERO, null);
  }

  public boolean isRejected() {
    return status == Status.REJECTED;
  }
}
