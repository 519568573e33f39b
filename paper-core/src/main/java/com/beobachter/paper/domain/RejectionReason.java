package com.beobachter.paper.domain;

public enum RejectionReason {
  INVALID_SIGNAL,
  INSUFFICIENT_CAPITAL,
  NO_EDGE,
  DUPLICATE_ACTIVE_POSITION,
  TRADING_HALTED,
  INTAKE_FROZEN,
  MAX_OPEN_POSITIONS
}
