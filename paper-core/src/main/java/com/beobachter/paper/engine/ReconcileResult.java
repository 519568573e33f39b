package com.beobachter.paper.engine;

import java.math.BigDecimal;

public record ReconcileResult(BigDecimal liveTotal, BigDecimal replayedTotal, long journalSequence, boolean matches) {
}
