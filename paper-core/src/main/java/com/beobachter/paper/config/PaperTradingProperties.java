package com.beobachter.paper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix="paper")
public record PaperTradingProperties(
    @Valid Capital capital,
    @Valid Sizing sizing,
    @Valid Slippage slippage,
    @Valid Exits exits,
    @Valid Drawdown drawdown,
    @Valid EdgeReversal edgeReversal,
    @Valid AveragingDown averagingDown,
    @Valid Journal journal,
    @Valid Engine engine,
    @Valid Governance governance
) {

  public PaperTradingProperties {
    if (capital == null) {
      capital = new Capital(null, null);
    }
    if (sizing == null) {
      sizing = new Sizing(null, null, null, null);
    }
    if (slippage == null) {
      slippage = new Slippage(null, null, null, null);
    }
    if (exits == null) {
      exits = new Exits(null, null);
    }
    if (drawdown == null) {
      drawdown = new Drawdown(null, null, null, null, null);
    }
    if (edgeReversal == null) {
      edgeReversal = new EdgeReversal(null);
    }
    if (averagingDown == null) {
      averagingDown = new AveragingDown(null, null, null, null, null);
    }
    if (journal == null) {
      journal = new Journal(null, null, null, null, null);
    }
    if (engine == null) {
      engine = new Engine(null, null, null);
    }
    if (governance == null) {
      governance = new Governance(null);
    }
  }

  public static PaperTradingProperties defaults() {
    return new PaperTradingProperties(null, null, null, null, null, null, null, null, null, null);
  }

  public enum RecoveryMode {
    HYSTERESIS,
    COOLDOWN
  }

  public record Capital(
      @NotNull @PositiveOrZero BigDecimal initialUsd,
      @Min(1) Integer maxOpenPositions
  ) {
    public Capital {
      if (initialUsd == null) {
        initialUsd = BigDecimal.valueOf(1000);
      }
      if (maxOpenPositions == null) {
        maxOpenPositions = 10;
      }
    }
  }

  /**
   * Kelly sizing knobs. All of them are clamped by governance bounds before use.
   */
  public record Sizing(
      @DecimalMin("0.0") @DecimalMax("1.0") Double kellyFraction,
      @DecimalMin("0.0") @DecimalMax("1.0") Double maxExposureFraction,
      @DecimalMin("0.0") @DecimalMax("1.0") Double minEdge,
      @PositiveOrZero BigDecimal minStakeUsd
  ) {
    public Sizing {
      if (kellyFraction == null) {
        kellyFraction = 0.25;
      }
      if (maxExposureFraction == null) {
        maxExposureFraction = 0.10;
      }
      if (minEdge == null) {
        minEdge = 0.05;
      }
      if (minStakeUsd == null) {
        minStakeUsd = BigDecimal.ONE;
      }
    }
  }

  public record Slippage(
      @DecimalMin("0.0") Double baseRate,
      @DecimalMin("0.0") Double impactCoefficient,
      @DecimalMin("0.0") Double maxRate,
      @PositiveOrZero BigDecimal minLiquidityUsd
  ) {
    public Slippage {
      if (baseRate == null) {
        baseRate = 0.002;
      }
      if (impactCoefficient == null) {
        impactCoefficient = 0.5;
      }
      if (maxRate == null) {
        maxRate = 0.10;
      }
      if (minLiquidityUsd == null || minLiquidityUsd.signum() <= 0) {
        minLiquidityUsd = BigDecimal.valueOf(1000);
      }
    }
  }

  public record Exits(
      @DecimalMin("0.0") @DecimalMax("1.0") Double stopLossPct,
      @DecimalMin("0.0") Double takeProfitPct
  ) {
    public Exits {
      if (stopLossPct == null) {
        stopLossPct = 0.25;
      }
      if (takeProfitPct == null) {
        takeProfitPct = 0.50;
      }
    }
  }

  public record Drawdown(
      @DecimalMin("0.0") @DecimalMax("1.0") Double haltPct,
      @DecimalMin("0.0") @DecimalMax("1.0") Double resumePct,
      RecoveryMode recoveryMode,
      Duration cooldown,
      @Min(1) Integer minDataPoints
  ) {
    public Drawdown {
      if (haltPct == null) {
        haltPct = 0.15;
      }
      if (resumePct == null) {
        resumePct = 0.05;
      }
      if (recoveryMode == null) {
        recoveryMode = RecoveryMode.HYSTERESIS;
      }
      if (cooldown == null) {
        cooldown = Duration.ofHours(6);
      }
      if (minDataPoints == null) {
        minDataPoints = 1;
      }
    }
  }

  public record EdgeReversal(@Min(1) Integer consecutiveEvaluations) {
    public EdgeReversal {
      if (consecutiveEvaluations == null) {
        consecutiveEvaluations = 2;
      }
    }
  }

  public record AveragingDown(
      Boolean enabled,
      @DecimalMin("0.0") @DecimalMax("1.0") Double minPriceMovePct,
      @DecimalMin("0.0") Double minEdgeImprovement,
      @Min(0) Integer maxAdditions,
      @DecimalMin("0.0") @DecimalMax("1.0") Double maxMarketExposureFraction
  ) {
    public AveragingDown {
      if (enabled == null) {
        enabled = true;
      }
      if (minPriceMovePct == null) {
        minPriceMovePct = 0.10;
      }
      if (minEdgeImprovement == null) {
        minEdgeImprovement = 0.05;
      }
      if (maxAdditions == null) {
        maxAdditions = 1;
      }
      if (maxMarketExposureFraction == null) {
        maxMarketExposureFraction = 0.15;
      }
    }
  }

  public record Journal(
      String path,
      String snapshotPath,
      @Min(1) Integer maxAttempts,
      @Min(0) Long initialBackoffMillis,
      @Min(0) Long maxBackoffMillis
  ) {
    public Journal {
      if (path == null || path.isBlank()) {
        path = "data/paper-journal.jsonl";
      }
      if (snapshotPath == null || snapshotPath.isBlank()) {
        snapshotPath = "data/capital-snapshot.json";
      }
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 50L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 1_000L;
      }
    }
  }

  public record Engine(
      @Min(1) Integer workerThreads,
      @Min(100) Long evaluationIntervalMillis,
      @Min(1_000) Long reconcileIntervalMillis
  ) {
    public Engine {
      if (workerThreads == null) {
        workerThreads = 4;
      }
      if (evaluationIntervalMillis == null) {
        evaluationIntervalMillis = 30_000L;
      }
      if (reconcileIntervalMillis == null) {
        reconcileIntervalMillis = 300_000L;
      }
    }
  }

  public record Governance(String boundsPath) {
    public Governance {
      if (boundsPath == null || boundsPath.isBlank()) {
        boundsPath = "classpath:governance-bounds.json";
      }
    }
  }
}
