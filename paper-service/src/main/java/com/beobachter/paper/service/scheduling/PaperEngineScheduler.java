package com.beobachter.paper.service.scheduling;

import com.beobachter.paper.engine.EvaluationSummary;
import com.beobachter.paper.engine.PaperTradingEngine;
import com.beobachter.paper.engine.ReconcileResult;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class PaperEngineScheduler {

  private final @NonNull PaperTradingEngine engine;

  @Scheduled(
      fixedDelayString = "${paper.engine.evaluation-interval-millis:30000}",
      initialDelayString = "${paper.engine.evaluation-interval-millis:30000}"
  )
  public void evaluate() {
    try {
      EvaluationSummary summary = engine.evaluateOpenPositions();
      log.debug("evaluation tick: evaluated={} closed={} halted={}",
          summary.evaluated(), summary.closed().size(), summary.entriesHalted());
    } catch (Exception e) {
      log.warn("evaluation tick failed: {}", e.toString());
    }
  }

  @Scheduled(
      fixedDelayString = "${paper.engine.reconcile-interval-millis:300000}",
      initialDelayString = "${paper.engine.reconcile-interval-millis:300000}"
  )
  public void reconcile() {
    try {
      ReconcileResult result = engine.reconcile();
      if (!result.matches()) {
        log.warn("reconcile mismatch: live={} journal={} seq={}",
            result.liveTotal(), result.replayedTotal(), result.journalSequence());
      }
    } catch (Exception e) {
      log.warn("reconcile tick failed: {}", e.toString());
    }
  }
}
