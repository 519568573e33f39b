package com.beobachter.paper.risk;

import java.math.BigDecimal;
import java.time.Instant;

public record DrawdownState(
    BigDecimal baseline,
    BigDecimal total,
    double drawdown,
    boolean halted,
    Instant haltedAt
) {
}
