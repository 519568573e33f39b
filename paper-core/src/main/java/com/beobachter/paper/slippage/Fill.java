package com.beobachter.paper.slippage;

import java.math.BigDecimal;

public record Fill(BigDecimal price, BigDecimal referencePrice, double slippageRate) {
}
