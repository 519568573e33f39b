package com.beobachter.paper.service.web;

import com.beobachter.paper.domain.ConfidenceTier;
import com.beobachter.paper.domain.Side;
import com.beobachter.paper.domain.Signal;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Inbound signal. Missing id and issue time are filled in on receipt; everything else is
 * checked by the engine.
 */
public record SignalRequest(
    String signalId,
    String marketId,
    Side side,
    Double probability,
    Double marketPrice,
    Double edge,
    ConfidenceTier confidence,
    Instant issuedAt,
    Duration horizon,
    BigDecimal liquidityUsd
) {

  public Signal toSignal(Clock clock) {
    return new Signal(
        signalId == null || signalId.isBlank() ? UUID.randomUUID().toString() : signalId,
        marketId,
        side,
        probability == null ? Double.NaN : probability,
        marketPrice == null ? Double.NaN : marketPrice,
        edge == null ? Double.NaN : edge,
        confidence == null ? ConfidenceTier.MEDIUM : confidence,
        issuedAt == null ? clock.instant() : issuedAt,
        horizon,
        liquidityUsd
    );
  }
}
