package com.beobachter.paper.service.config;

import com.beobachter.paper.config.PaperTradingProperties;
import com.beobachter.paper.engine.PaperTradingEngine;
import com.beobachter.paper.governance.RiskParameters;
import com.beobachter.paper.journal.CapitalSnapshotStore;
import com.beobachter.paper.journal.FileJournal;
import com.beobachter.paper.journal.JournalCodec;
import com.beobachter.paper.journal.RetryPolicy;
import com.beobachter.paper.ledger.CapitalLedger;
import com.beobachter.paper.position.PositionStore;
import com.beobachter.paper.risk.RiskSupervisor;
import com.beobachter.paper.service.governance.GovernanceBoundsLoader;
import com.beobachter.paper.sizing.KellySizer;
import com.beobachter.paper.slippage.SlippageModel;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the paper trading engine around a file journal and a capital snapshot.
 */
@Slf4j
@Configuration
public class PaperEngineConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "close")
  public FileJournal paperJournal(PaperTradingProperties properties) {
    PaperTradingProperties.Journal cfg = properties.journal();
    return new FileJournal(Path.of(cfg.path()), JournalCodec.objectMapper(), RetryPolicy.from(cfg));
  }

  @Bean
  public CapitalSnapshotStore capitalSnapshotStore(PaperTradingProperties properties) {
    return new CapitalSnapshotStore(Path.of(properties.journal().snapshotPath()), JournalCodec.objectMapper());
  }

  @Bean(destroyMethod = "shutdown")
  public PaperTradingEngine paperTradingEngine(
      PaperTradingProperties properties,
      FileJournal paperJournal,
      CapitalSnapshotStore capitalSnapshotStore,
      GovernanceBoundsLoader governanceBoundsLoader,
      Clock clock,
      MeterRegistry meterRegistry
  ) {
    RiskParameters parameters = governanceBoundsLoader.resolve();
    PaperTradingEngine engine = new PaperTradingEngine(
        new CapitalLedger(),
        new PositionStore(),
        new KellySizer(),
        new SlippageModel(),
        new RiskSupervisor(),
        paperJournal,
        capitalSnapshotStore,
        parameters,
        clock,
        meterRegistry,
        properties.engine().workerThreads()
    );

    log.info("============================================================");
    log.info("  Paper Trader - Starting");
    log.info("============================================================");
    log.info("  Journal: {}", properties.journal().path());
    log.info("  Initial capital: ${}", properties.capital().initialUsd());
    log.info("  Kelly fraction: {} (max exposure {})",
        parameters.sizing().kellyFraction(), parameters.sizing().maxExposureFraction());
    log.info("  Drawdown halt/resume: {}/{} ({})", parameters.drawdown().haltPct(),
        parameters.drawdown().resumePct(), parameters.drawdown().recoveryMode());
    log.info("  Workers: {}", properties.engine().workerThreads());
    log.info("============================================================");

    engine.start(properties.capital().initialUsd());
    return engine;
  }
}
