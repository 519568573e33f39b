package com.beobachter.paper.domain;

public enum PositionStatus {
  OPENING,
  OPEN,
  CLOSING_STOP_LOSS,
  CLOSING_TAKE_PROFIT,
  CLOSING_EXPIRED,
  CLOSING_MANUAL,
  CLOSING_RESOLVED,
  CLOSED;

  public boolean isClosing() {
    return name().startsWith("CLOSING_");
  }

  public boolean isActive() {
    return this != CLOSED;
  }
}
