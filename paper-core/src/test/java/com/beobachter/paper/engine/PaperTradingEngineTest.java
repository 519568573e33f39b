package com.beobachter.paper.engine;

import com.beobachter.paper.config.PaperTradingProperties;
import com.beobachter.paper.domain.MarketQuote;
import com.beobachter.paper.domain.Position;
import com.beobachter.paper.domain.PositionStatus;
import com.beobachter.paper.domain.RejectionReason;
import com.beobachter.paper.domain.Side;
import com.beobachter.paper.domain.Signal;
import com.beobachter.paper.governance.GovernanceBounds;
import com.beobachter.paper.governance.RiskParameters;
import com.beobachter.paper.journal.CapitalSnapshotStore;
import com.beobachter.paper.journal.FileJournal;
import com.beobachter.paper.journal.Journal;
import com.beobachter.paper.journal.JournalCodec;
import com.beobachter.paper.journal.JournalEntry;
import com.beobachter.paper.journal.JournalReplayer;
import com.beobachter.paper.journal.JournalWriteException;
import com.beobachter.paper.journal.RetryPolicy;
import com.beobachter.paper.ledger.CapitalLedger;
import com.beobachter.paper.ledger.LedgerSnapshot;
import com.beobachter.paper.position.PositionStore;
import com.beobachter.paper.risk.RiskSupervisor;
import com.beobachter.paper.sizing.KellySizer;
import com.beobachter.paper.sizing.SizingDecision;
import com.beobachter.paper.slippage.SlippageModel;
import com.beobachter.paper.support.InMemoryJournal;
import com.beobachter.paper.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.beobachter.paper.support.TestSignals.NOW;
import static com.beobachter.paper.support.TestSignals.signal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Engine scenarios: intake, dedup, exits, breaker, fatal freeze, recovery and concurrency.
 */
@ExtendWith(MockitoExtension.class)
class PaperTradingEngineTest {

  private static final BigDecimal DEEP_BOOK = new BigDecimal("1000000");

  @Mock
  private Journal failingJournal;

  private MutableClock clock;
  private SimpleMeterRegistry meterRegistry;
  private final List<PaperTradingEngine> engines = new ArrayList<>();

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    meterRegistry = new SimpleMeterRegistry();
  }

  @AfterEach
  void tearDown() {
    engines.forEach(PaperTradingEngine::shutdown);
  }

  @Test
  void opensOnePositionAndRejectsSecondSignalForSameMarket() {
    InMemoryJournal journal = new InMemoryJournal();
    PaperTradingEngine engine = engine(properties(0.20, 0.10, 0.05), journal);

    SignalOutcome first = engine.process(signal("M1", Side.YES, 0.55, 0.30, 0.12));
    SignalOutcome second = engine.process(signal("M1", Side.YES, 0.56, 0.30, 0.13));

    assertThat(first.status()).isEqualTo(SignalOutcome.Status.OPENED);
    assertThat(first.stake()).isLessThanOrEqualTo(new BigDecimal("100"));
    assertThat(first.stake()).isEqualByComparingTo("71.42");
    assertThat(second.status()).isEqualTo(SignalOutcome.Status.REJECTED);
    assertThat(second.rejection()).isEqualTo(RejectionReason.DUPLICATE_ACTIVE_POSITION);

    assertThat(engine.activePositions()).hasSize(1);
    assertThat(engine.activePositions().get(0).status()).isEqualTo(PositionStatus.OPEN);
    assertThat(journal.entriesOf(JournalEntry.ReservationRecord.class)).hasSize(1);
    assertBalanced(engine.status().capital());
    assertThat(engine.status().capital().allocated()).isEqualByComparingTo("71.42");
    assertThat(meterRegistry.get("paper.signals.rejected").tag("reason", "DUPLICATE_ACTIVE_POSITION")
        .counter().count()).isEqualTo(1.0);
  }

  @Test
  void stopLossReleasesReservedStakeAndFreesTheMarket() {
    InMemoryJournal journal = new InMemoryJournal();
    PaperTradingEngine engine = engine(withExits(properties(0.20, 0.10, 0.05), 0.20, 0.50), journal);
    SignalOutcome opened = engine.process(signal("M1", Side.YES, 0.55, 0.30, 0.12, DEEP_BOOK));
    Position position = opened.position();
    BigDecimal stake = opened.stake();

    BigDecimal mark = position.entryPrice().multiply(new BigDecimal("0.79"));
    engine.onQuote(new MarketQuote("M1", mark, DEEP_BOOK, false, null, NOW));
    EvaluationSummary summary = engine.evaluateOpenPositions();

    assertThat(summary.closed()).hasSize(1);
    assertThat(summary.closed().get(0).exitStatus()).isEqualTo("CLOSING_STOP_LOSS");
    JournalEntry.ReleaseRecord release = journal.entriesOf(JournalEntry.ReleaseRecord.class).get(0);
    assertThat(release.amountReleased()).isEqualByComparingTo(stake);
    assertThat(release.closingStatus()).isEqualTo(PositionStatus.CLOSING_STOP_LOSS);
    double expectedLoss = -0.21 * stake.doubleValue();
    assertThat(release.realizedPnl().doubleValue()).isCloseTo(expectedLoss, within(0.01 * stake.doubleValue()));

    LedgerSnapshot capital = engine.status().capital();
    assertThat(capital.allocated()).isEqualByComparingTo("0");
    assertThat(capital.total()).isEqualByComparingTo(new BigDecimal("1000").add(release.realizedPnl()));
    assertBalanced(capital);

    assertThat(engine.process(signal("M1", Side.YES, 0.55, 0.30, 0.12)).status())
        .isEqualTo(SignalOutcome.Status.OPENED);
  }

  @Test
  void drawdownBreakerBlocksEntriesButNotCloses() {
    PaperTradingProperties props = new PaperTradingProperties(null,
        new PaperTradingProperties.Sizing(1.0, 0.20, 0.01, BigDecimal.ONE), null, null, null, null,
        new PaperTradingProperties.AveragingDown(false, null, null, null, null), null, null, null);
    PaperTradingEngine engine = engine(props, new InMemoryJournal());

    assertThat(engine.process(signal("M1", Side.YES, 0.9, 0.5, 0.4)).stake()).isEqualByComparingTo("200.00");
    assertThat(engine.process(signal("M2", Side.YES, 0.9, 0.5, 0.4)).status()).isEqualTo(SignalOutcome.Status.OPENED);

    engine.onQuote(new MarketQuote("M1", BigDecimal.ZERO, null, true, Side.NO, NOW));
    EvaluationSummary summary = engine.evaluateOpenPositions();

    assertThat(summary.closed()).extracting(EvaluationSummary.ClosedPosition::exitStatus)
        .containsExactly("CLOSING_RESOLVED");
    assertThat(engine.status().capital().total()).isEqualByComparingTo("800");
    assertThat(engine.status().drawdown().halted()).isTrue();
    assertThat(summary.entriesHalted()).isTrue();

    SignalOutcome blocked = engine.process(signal("M3", Side.YES, 0.9, 0.5, 0.4));
    assertThat(blocked.rejection()).isEqualTo(RejectionReason.TRADING_HALTED);

    assertThat(engine.closePosition("M2", "operator")).hasValueSatisfying(closed -> {
      assertThat(closed.status()).isEqualTo(PositionStatus.CLOSED);
      assertThat(closed.exitStatus()).isEqualTo(PositionStatus.CLOSING_MANUAL);
    });
    assertThat(engine.activePositions()).isEmpty();
    assertBalanced(engine.status().capital());
  }

  @Test
  void drawdownOfSixteenPercentHaltsEntriesAtTheDefaultThreshold() {
    PaperTradingProperties props = new PaperTradingProperties(null,
        new PaperTradingProperties.Sizing(1.0, 0.16, 0.01, BigDecimal.ONE), null, null, null, null,
        new PaperTradingProperties.AveragingDown(false, null, null, null, null), null, null, null);
    PaperTradingEngine engine = engine(props, new InMemoryJournal());

    assertThat(engine.process(signal("M1", Side.YES, 0.9, 0.5, 0.4)).stake()).isEqualByComparingTo("160.00");
    assertThat(engine.process(signal("M2", Side.YES, 0.9, 0.5, 0.4)).stake()).isEqualByComparingTo("134.40");

    engine.onQuote(new MarketQuote("M1", BigDecimal.ZERO, null, true, Side.NO, NOW));
    EvaluationSummary summary = engine.evaluateOpenPositions();

    assertThat(engine.status().capital().total()).isEqualByComparingTo("840");
    assertThat(engine.status().drawdown().drawdown()).isCloseTo(0.16, within(1e-9));
    assertThat(engine.status().drawdown().halted()).isTrue();
    assertThat(summary.entriesHalted()).isTrue();

    SignalOutcome blocked = engine.process(signal("M3", Side.YES, 0.9, 0.5, 0.4));
    assertThat(blocked.status()).isEqualTo(SignalOutcome.Status.REJECTED);
    assertThat(blocked.rejection()).isEqualTo(RejectionReason.TRADING_HALTED);
    assertThat(engine.activePositions()).extracting(Position::marketId).containsExactly("M2");

    assertThat(engine.closePosition("M2", "operator")).hasValueSatisfying(closed -> {
      assertThat(closed.status()).isEqualTo(PositionStatus.CLOSED);
      assertThat(closed.exitStatus()).isEqualTo(PositionStatus.CLOSING_MANUAL);
    });
    assertThat(engine.activePositions()).isEmpty();
    assertThat(engine.status().capital().allocated()).isEqualByComparingTo("0");
    assertBalanced(engine.status().capital());
  }

  @Test
  void openPositionCapRejectsNewMarketsUntilASlotFrees() {
    PaperTradingProperties props = new PaperTradingProperties(
        new PaperTradingProperties.Capital(new BigDecimal("1000"), 2), null, null, null, null, null, null,
        null, null, null);
    PaperTradingEngine engine = engine(props, new InMemoryJournal());

    assertThat(engine.process(signal("M1", Side.YES, 0.55, 0.30, 0.12)).status())
        .isEqualTo(SignalOutcome.Status.OPENED);
    assertThat(engine.process(signal("M2", Side.YES, 0.55, 0.30, 0.12)).status())
        .isEqualTo(SignalOutcome.Status.OPENED);

    SignalOutcome third = engine.process(signal("M3", Side.YES, 0.55, 0.30, 0.12));
    assertThat(third.rejection()).isEqualTo(RejectionReason.MAX_OPEN_POSITIONS);
    assertThat(engine.activePositions()).hasSize(2);

    assertThat(engine.closePosition("M1", "make room")).isPresent();
    assertThat(engine.process(signal("M3", Side.YES, 0.55, 0.30, 0.12)).status())
        .isEqualTo(SignalOutcome.Status.OPENED);
    assertThat(engine.activePositions()).extracting(Position::marketId).containsExactlyInAnyOrder("M2", "M3");
  }

  @Test
  void openPositionCapHoldsWhenDifferentMarketsOpenConcurrently() throws Exception {
    PaperTradingProperties props = new PaperTradingProperties(
        new PaperTradingProperties.Capital(new BigDecimal("1000"), 1), null, null, null, null, null, null,
        null, new PaperTradingProperties.Engine(4, null, null), null);
    CyclicBarrier bothSizing = new CyclicBarrier(2);
    KellySizer rendezvous = new KellySizer() {
      @Override
      public SizingDecision size(Signal signal, BigDecimal availableCapital, PaperTradingProperties.Sizing sizing) {
        try {
          bothSizing.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException(e);
        } catch (BrokenBarrierException | TimeoutException e) {
          throw new IllegalStateException("second signal never reached sizing", e);
        }
        return super.size(signal, availableCapital, sizing);
      }
    };
    InMemoryJournal journal = new InMemoryJournal();
    PaperTradingEngine engine = engine(props, journal, rendezvous, new CapitalLedger(), null);

    CompletableFuture<SignalOutcome> first = engine.submit(signal("M1", Side.YES, 0.55, 0.30, 0.12));
    CompletableFuture<SignalOutcome> second = engine.submit(signal("M2", Side.YES, 0.55, 0.30, 0.12));
    CompletableFuture.allOf(first, second).get(30, TimeUnit.SECONDS);

    assertThat(List.of(first.join(), second.join()))
        .extracting(SignalOutcome::status, SignalOutcome::rejection)
        .containsExactlyInAnyOrder(
            tuple(SignalOutcome.Status.OPENED, null),
            tuple(SignalOutcome.Status.REJECTED, RejectionReason.MAX_OPEN_POSITIONS));
    assertThat(engine.activePositions()).hasSize(1);

    LedgerSnapshot capital = engine.status().capital();
    assertBalanced(capital);
    assertThat(capital.allocated()).isEqualByComparingTo(engine.activePositions().get(0).stake());
    assertSameCapital(new JournalReplayer().replay(journal.readAll()).ledger().snapshot(), capital);
  }

  @Test
  void malformedSignalsAreRejectedWithoutTouchingState() {
    InMemoryJournal journal = new InMemoryJournal();
    PaperTradingEngine engine = engine(PaperTradingProperties.defaults(), journal);
    LedgerSnapshot before = engine.status().capital();

    List<Signal> bad = List.of(
        signal("M1", Side.YES, 1.2, 0.30, 0.12),
        signal("M1", Side.YES, 0.55, 0.0, 0.12),
        signal("M1", Side.YES, 0.55, 1.0, 0.12),
        signal(" ", Side.YES, 0.55, 0.30, 0.12),
        signal("M1", null, 0.55, 0.30, 0.12)
    );
    for (Signal s : bad) {
      assertThat(engine.process(s).rejection()).isEqualTo(RejectionReason.INVALID_SIGNAL);
    }
    assertThat(engine.process(null).rejection()).isEqualTo(RejectionReason.INVALID_SIGNAL);

    assertThat(engine.status().capital()).isEqualTo(before);
    assertThat(engine.activePositions()).isEmpty();
    assertThat(journal.readAll()).hasSize(1);
  }

  @Test
  void noEdgeAndInsufficientCapitalAreLocalRejections() {
    PaperTradingEngine engine = engine(properties(0.25, 0.10, 0.05), new InMemoryJournal());

    assertThat(engine.process(signal("M1", Side.YES, 0.25, 0.30, 0.10)).rejection())
        .isEqualTo(RejectionReason.NO_EDGE);
    assertThat(engine.process(signal("M1", Side.YES, 0.55, 0.30, 0.02)).rejection())
        .isEqualTo(RejectionReason.NO_EDGE);
    assertThat(engine.process(signal("M2", Side.YES, 0.55, 0.30, 0.12)).status())
        .isEqualTo(SignalOutcome.Status.OPENED);
    assertThat(engine.fatalHalt()).isEmpty();
  }

  @Test
  void journalFailureCancelsReservationAndFreezesIntake() {
    when(failingJournal.readAll()).thenReturn(List.of());
    when(failingJournal.append(any()))
        .thenAnswer(invocation -> invocation.getArgument(0))
        .thenThrow(new JournalWriteException("disk full", null));
    PaperTradingEngine engine = engine(PaperTradingProperties.defaults(), failingJournal);

    SignalOutcome outcome = engine.process(signal("M1", Side.YES, 0.55, 0.30, 0.12));

    assertThat(outcome.rejection()).isEqualTo(RejectionReason.INTAKE_FROZEN);
    assertThat(engine.activePositions()).isEmpty();
    assertThat(engine.status().capital().available()).isEqualByComparingTo("1000");
    assertThat(engine.status().capital().allocated()).isEqualByComparingTo("0");
    assertThat(engine.fatalHalt()).map(FatalHalt::condition).contains(FatalCondition.JOURNAL_WRITE_FAILURE);

    assertThat(engine.process(signal("M2", Side.YES, 0.55, 0.30, 0.12)).rejection())
        .isEqualTo(RejectionReason.INTAKE_FROZEN);

    assertThat(engine.resumeIntake()).isPresent();
    assertThat(engine.status().intakeFrozen()).isFalse();
  }

  @Test
  void averagingDownAddsToTheSamePosition() {
    InMemoryJournal journal = new InMemoryJournal();
    PaperTradingEngine engine = engine(PaperTradingProperties.defaults(), journal);
    SignalOutcome opened = engine.process(signal("M1", Side.YES, 0.60, 0.40, 0.10, DEEP_BOOK));

    SignalOutcome added = engine.process(signal("M1", Side.YES, 0.50, 0.34, 0.16, DEEP_BOOK));

    assertThat(added.status()).isEqualTo(SignalOutcome.Status.AVERAGED_DOWN);
    Position position = added.position();
    assertThat(position.additions()).isEqualTo(1);
    assertThat(position.stake()).isEqualByComparingTo(opened.stake().add(added.stake()));
    assertThat(position.entryPrice()).isLessThan(opened.position().entryPrice());
    assertThat(position.stake()).isLessThanOrEqualTo(new BigDecimal("150"));
    assertThat(engine.status().capital().allocated()).isEqualByComparingTo(position.stake());
    assertThat(journal.entriesOf(JournalEntry.ReservationRecord.class))
        .extracting(JournalEntry.ReservationRecord::reason)
        .containsExactly(JournalEntry.ReservationReason.OPEN, JournalEntry.ReservationReason.AVERAGE_DOWN);

    SignalOutcome third = engine.process(signal("M1", Side.YES, 0.50, 0.25, 0.30, DEEP_BOOK));
    assertThat(third.rejection()).isEqualTo(RejectionReason.DUPLICATE_ACTIVE_POSITION);
  }

  @Test
  void expiredAndReversedPositionsAreClosedBySweep() {
    PaperTradingEngine engine = engine(PaperTradingProperties.defaults(), new InMemoryJournal());
    engine.process(signal("M1", Side.YES, 0.55, 0.30, 0.12));
    engine.process(signal("M2", Side.YES, 0.55, 0.30, 0.12));

    engine.process(signal("M2", Side.NO, 0.80, 0.70, 0.10));
    assertThat(engine.evaluateOpenPositions().closed()).isEmpty();
    assertThat(engine.evaluateOpenPositions().closed())
        .extracting(EvaluationSummary.ClosedPosition::marketId, EvaluationSummary.ClosedPosition::exitStatus)
        .containsExactly(tuple("M2", "CLOSING_MANUAL"));

    clock.advance(Duration.ofDays(8));
    assertThat(engine.evaluateOpenPositions().closed())
        .extracting(EvaluationSummary.ClosedPosition::exitStatus)
        .containsExactly("CLOSING_EXPIRED");
    assertThat(engine.closedPositions()).hasSize(2);
  }

  @Test
  void journalReplayReproducesLedgerAndPositions() {
    InMemoryJournal journal = new InMemoryJournal();
    PaperTradingEngine engine = engine(PaperTradingProperties.defaults(), journal);
    engine.process(signal("M1", Side.YES, 0.60, 0.40, 0.10, DEEP_BOOK));
    engine.process(signal("M1", Side.YES, 0.50, 0.34, 0.16, DEEP_BOOK));
    engine.process(signal("M2", Side.NO, 0.55, 0.30, 0.12));
    engine.process(signal("M3", Side.YES, 0.70, 0.50, 0.20));
    engine.onQuote(new MarketQuote("M2", new BigDecimal("0.50"), DEEP_BOOK, false, null, NOW));
    engine.evaluateOpenPositions();
    engine.closePosition("M3", "operator");
    engine.deposit(new BigDecimal("250"), "top up");

    JournalReplayer.ReplayResult replayed = new JournalReplayer().replay(journal.readAll());

    assertSameCapital(replayed.ledger().snapshot(), engine.status().capital());
    assertThat(sorted(replayed.store().activePositions())).usingRecursiveComparison()
        .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
        .isEqualTo(sorted(engine.activePositions()));
    assertThat(replayed.store().closedPositions()).usingRecursiveComparison()
        .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
        .isEqualTo(engine.closedPositions());
    assertThat(engine.closedPositions()).hasSize(2);
    assertThat(engine.reconcile().matches()).isTrue();
  }

  @Test
  void reconcileDivergenceFreezesIntake() {
    CapitalLedger ledger = new CapitalLedger();
    PaperTradingEngine engine = engine(PaperTradingProperties.defaults(), new InMemoryJournal(), ledger, null);

    ledger.deposit(new BigDecimal("5"));
    ReconcileResult result = engine.reconcile();

    assertThat(result.matches()).isFalse();
    assertThat(result.liveTotal()).isEqualByComparingTo("1005");
    assertThat(result.replayedTotal()).isEqualByComparingTo("1000");
    assertThat(engine.fatalHalt()).map(FatalHalt::condition).contains(FatalCondition.LEDGER_DIVERGENCE);
    assertThat(engine.process(signal("M1", Side.YES, 0.55, 0.30, 0.12)).rejection())
        .isEqualTo(RejectionReason.INTAKE_FROZEN);
  }

  @Test
  void restartRecoversFromJournalFile(@TempDir Path dir) throws Exception {
    Path journalPath = dir.resolve("journal.jsonl");
    CapitalSnapshotStore snapshots = new CapitalSnapshotStore(dir.resolve("capital.json"), JournalCodec.objectMapper());
    LedgerSnapshot before;
    List<Position> activeBefore;
    try (FileJournal journal = new FileJournal(journalPath, JournalCodec.objectMapper(), RetryPolicy.none())) {
      PaperTradingEngine first = engine(PaperTradingProperties.defaults(), journal, new CapitalLedger(), snapshots);
      first.process(signal("M1", Side.YES, 0.55, 0.30, 0.12));
      first.process(signal("M2", Side.NO, 0.65, 0.40, 0.25));
      first.closePosition("M2", "operator");
      before = first.status().capital();
      activeBefore = first.activePositions();
    }

    try (FileJournal journal = new FileJournal(journalPath, JournalCodec.objectMapper(), RetryPolicy.none())) {
      PaperTradingEngine second = engine(PaperTradingProperties.defaults(), journal, new CapitalLedger(), snapshots);

      assertSameCapital(second.status().capital(), before);
      assertThat(second.activePositions()).usingRecursiveComparison()
          .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
          .isEqualTo(activeBefore);
      assertThat(second.closedPositions()).hasSize(1);
      assertThat(snapshots.read()).hasValueSatisfying(s -> assertThat(s.matches(before)).isTrue());
      assertThat(second.process(signal("M1", Side.YES, 0.55, 0.30, 0.12)).rejection())
          .isEqualTo(RejectionReason.DUPLICATE_ACTIVE_POSITION);
    }
  }

  @Test
  void concurrentSignalsKeepLedgerAndMarketInvariants() throws Exception {
    PaperTradingProperties props = new PaperTradingProperties(
        new PaperTradingProperties.Capital(new BigDecimal("1000"), 100), null, null, null, null, null, null,
        null, new PaperTradingProperties.Engine(8, null, null), null);
    InMemoryJournal journal = new InMemoryJournal();
    PaperTradingEngine engine = engine(props, journal);

    List<CompletableFuture<SignalOutcome>> futures = new ArrayList<>();
    for (int round = 0; round < 4; round++) {
      for (int m = 0; m < 40; m++) {
        futures.add(engine.submit(signal("M" + m, Side.YES, 0.55 + round * 0.01, 0.30, 0.12)));
      }
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

    long opened = futures.stream().map(CompletableFuture::join)
        .filter(o -> o.status() == SignalOutcome.Status.OPENED).count();
    List<Position> active = engine.activePositions();
    assertThat(active).hasSize((int) opened);
    assertThat(active).extracting(Position::marketId).doesNotHaveDuplicates();

    LedgerSnapshot capital = engine.status().capital();
    assertBalanced(capital);
    BigDecimal staked = active.stream().map(Position::stake).reduce(BigDecimal.ZERO, BigDecimal::add);
    assertThat(capital.allocated()).isEqualByComparingTo(staked);
    assertSameCapital(new JournalReplayer().replay(journal.readAll()).ledger().snapshot(), capital);
  }

  // ========== helpers ==========

  private PaperTradingEngine engine(PaperTradingProperties props, Journal journal) {
    return engine(props, journal, new CapitalLedger(), null);
  }

  private PaperTradingEngine engine(PaperTradingProperties props, Journal journal, CapitalLedger ledger,
                                    CapitalSnapshotStore snapshots) {
    return engine(props, journal, new KellySizer(), ledger, snapshots);
  }

  private PaperTradingEngine engine(PaperTradingProperties props, Journal journal, KellySizer sizer,
                                    CapitalLedger ledger, CapitalSnapshotStore snapshots) {
    PaperTradingEngine engine = new PaperTradingEngine(
        ledger,
        new PositionStore(),
        sizer,
        new SlippageModel(),
        new RiskSupervisor(),
        journal,
        snapshots,
        RiskParameters.resolve(props, GovernanceBounds.unbounded(), null),
        clock,
        meterRegistry,
        props.engine().workerThreads()
    );
    engines.add(engine);
    engine.start(props.capital().initialUsd());
    return engine;
  }

  private static PaperTradingProperties properties(double kelly, double maxExposure, double minEdge) {
    return new PaperTradingProperties(null, new PaperTradingProperties.Sizing(kelly, maxExposure, minEdge, null),
        null, null, null, null, null, null, null, null);
  }

  private static PaperTradingProperties withExits(PaperTradingProperties p, double stopLoss, double takeProfit) {
    return new PaperTradingProperties(p.capital(), p.sizing(), p.slippage(),
        new PaperTradingProperties.Exits(stopLoss, takeProfit), p.drawdown(), p.edgeReversal(), p.averagingDown(),
        p.journal(), p.engine(), p.governance());
  }

  private static List<Position> sorted(Collection<Position> positions) {
    return positions.stream().sorted(Comparator.comparing(Position::marketId)).toList();
  }

  private static void assertSameCapital(LedgerSnapshot actual, LedgerSnapshot expected) {
    assertThat(actual.total()).isEqualByComparingTo(expected.total());
    assertThat(actual.available()).isEqualByComparingTo(expected.available());
    assertThat(actual.allocated()).isEqualByComparingTo(expected.allocated());
  }

  private static void assertBalanced(LedgerSnapshot snapshot) {
    assertThat(snapshot.available().add(snapshot.allocated())).isEqualByComparingTo(snapshot.total());
    assertThat(snapshot.available().signum()).isGreaterThanOrEqualTo(0);
    assertThat(snapshot.allocated().signum()).isGreaterThanOrEqualTo(0);
  }
}
