package com.beobachter.paper.service.web;

import com.beobachter.paper.domain.MarketQuote;
import com.beobachter.paper.domain.Position;
import com.beobachter.paper.domain.RejectionReason;
import com.beobachter.paper.engine.EngineStatus;
import com.beobachter.paper.engine.FatalHalt;
import com.beobachter.paper.engine.PaperTradingEngine;
import com.beobachter.paper.engine.SignalOutcome;
import com.beobachter.paper.governance.RiskParameters;
import com.beobachter.paper.journal.JournalWriteException;
import com.beobachter.paper.ledger.LedgerSnapshot;
import com.beobachter.paper.service.governance.GovernanceBoundsLoader;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/paper")
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaperTradingController {

  private final @NonNull PaperTradingEngine engine;
  private final @NonNull GovernanceBoundsLoader governanceBoundsLoader;
  private final @NonNull Clock clock;

  @PostMapping("/signals")
  public CompletableFuture<ResponseEntity<SignalOutcome>> submitSignal(@RequestBody SignalRequest request) {
    return engine.submit(request.toSignal(clock)).thenApply(outcome ->
        outcome.rejection() == RejectionReason.INVALID_SIGNAL
            ? ResponseEntity.badRequest().body(outcome)
            : ResponseEntity.ok(outcome));
  }

  @PostMapping("/quotes")
  public ResponseEntity<Object> submitQuote(@RequestBody MarketQuote quote) {
    MarketQuote stamped = quote.asOf() != null ? quote : new MarketQuote(quote.marketId(), quote.yesPrice(),
        quote.liquidityUsd(), quote.resolved(), quote.resolvedOutcome(), clock.instant());
    try {
      engine.onQuote(stamped);
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }
    return ResponseEntity.accepted().build();
  }

  @GetMapping("/status")
  public ResponseEntity<StatusResponse> status() {
    EngineStatus status = engine.status();
    return ResponseEntity.ok(new StatusResponse(status, status.intakeFrozen(), engine.parameters()));
  }

  @GetMapping("/positions")
  public ResponseEntity<Object> activePositions() {
    return ResponseEntity.ok(engine.activePositions());
  }

  @PostMapping("/positions/{marketId}/close")
  public ResponseEntity<Object> closePosition(
      @PathVariable String marketId,
      @RequestParam(name = "reason", required = false) String reason
  ) {
    return engine.closePosition(marketId, reason)
        .<ResponseEntity<Object>>map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("no open position for " + marketId)));
  }

  @PostMapping("/intake/resume")
  public ResponseEntity<ResumeResponse> resumeIntake() {
    FatalHalt previous = engine.resumeIntake().orElse(null);
    return ResponseEntity.ok(new ResumeResponse(previous != null, previous));
  }

  @PostMapping("/capital/deposits")
  public ResponseEntity<Object> deposit(@Valid @RequestBody DepositRequest request) {
    try {
      engine.deposit(request.amount(), request.note() == null ? "operator deposit" : request.note());
    } catch (JournalWriteException e) {
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(e.getMessage()));
    }
    LedgerSnapshot capital = engine.status().capital();
    return ResponseEntity.ok(capital);
  }

  @PostMapping("/governance/reload")
  public ResponseEntity<Object> reloadGovernance() {
    RiskParameters next;
    try {
      next = governanceBoundsLoader.resolve();
    } catch (UncheckedIOException | IllegalArgumentException e) {
      log.warn("governance reload rejected, keeping current parameters: {}", e.getMessage());
      return ResponseEntity.unprocessableEntity().body(new ErrorResponse(e.getMessage()));
    }
    engine.updateParameters(next);
    return ResponseEntity.ok(next);
  }

  public record DepositRequest(@NotNull @Positive BigDecimal amount, String note) {
  }

  public record StatusResponse(EngineStatus engine, boolean intakeFrozen, RiskParameters parameters) {
  }

  public record ResumeResponse(boolean wasFrozen, FatalHalt cleared) {
  }

  public record ErrorResponse(String error) {
  }
}
