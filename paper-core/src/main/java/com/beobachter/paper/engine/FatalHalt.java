package com.beobachter.paper.engine;

import java.time.Instant;

/**
 * Why new intake is frozen. Cleared only by an operator.
 */
public record FatalHalt(FatalCondition condition, String detail, Instant at) {
}
