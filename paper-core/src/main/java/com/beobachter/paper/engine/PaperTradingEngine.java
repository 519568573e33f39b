package com.beobachter.paper.engine;

import com.beobachter.paper.domain.ConfidenceTier;
import com.beobachter.paper.domain.MarketQuote;
import com.beobachter.paper.domain.Position;
import com.beobachter.paper.domain.PositionStatus;
import com.beobachter.paper.domain.RejectionReason;
import com.beobachter.paper.domain.Signal;
import com.beobachter.paper.governance.RiskParameters;
import com.beobachter.paper.journal.CapitalSnapshot;
import com.beobachter.paper.journal.CapitalSnapshotStore;
import com.beobachter.paper.journal.Journal;
import com.beobachter.paper.journal.JournalEntry;
import com.beobachter.paper.journal.JournalEntry.ReservationReason;
import com.beobachter.paper.journal.JournalReplayer;
import com.beobachter.paper.journal.JournalWriteException;
import com.beobachter.paper.ledger.CapitalLedger;
import com.beobachter.paper.ledger.LedgerInvariantViolationException;
import com.beobachter.paper.ledger.LedgerSnapshot;
import com.beobachter.paper.ledger.Release;
import com.beobachter.paper.ledger.ReservationToken;
import com.beobachter.paper.position.PositionStore;
import com.beobachter.paper.risk.LifecycleCommand;
import com.beobachter.paper.risk.RiskSupervisor;
import com.beobachter.paper.sizing.KellySizer;
import com.beobachter.paper.sizing.SizingDecision;
import com.beobachter.paper.slippage.Fill;
import com.beobachter.paper.slippage.SlippageModel;
import com.beobachter.paper.slippage.TradeDirection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Paper trading pipeline: validate, dedup, size, reserve, open, evaluate, close, release.
 *
 * <p>Everything that touches one market runs under that market's lock, and every reserve,
 * increase or release is journaled before the lock is released. Signals for different markets
 * run in parallel on the worker pool. A fatal condition (ledger invariant violation, journal
 * write failure, reconciliation divergence) freezes new intake until {@link #resumeIntake()};
 * closes keep working while frozen.
 *
 * <p>Lock order: market lock, then commit lock (read side), then the ledger's own lock.
 * {@link #reconcile()} takes the commit lock's write side alone.
 */
@Slf4j
public class PaperTradingEngine {

  private final CapitalLedger ledger;
  private final PositionStore store;
  private final KellySizer sizer;
  private final SlippageModel slippage;
  private final RiskSupervisor supervisor;
  private final Journal journal;
  private final CapitalSnapshotStore snapshots;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final ExecutorService workers;

  private final MarketLocks marketLocks = new MarketLocks();
  private final ReentrantReadWriteLock commitLock = new ReentrantReadWriteLock();
  private final AtomicReference<RiskParameters> parameters;
  private final AtomicReference<FatalHalt> fatalHalt = new AtomicReference<>();
  private final Map<String, MarketQuote> quotes = new ConcurrentHashMap<>();
  private final Map<String, Double> latestEdges = new ConcurrentHashMap<>();
  private final Map<String, ConfidenceTier> latestConfidence = new ConcurrentHashMap<>();
  private final AtomicInteger haltedGauge = new AtomicInteger();

  private final Counter signalsReceived;
  private final Counter positionsOpened;
  private final Counter positionsAveraged;

  public PaperTradingEngine(
      CapitalLedger ledger,
      PositionStore store,
      KellySizer sizer,
      SlippageModel slippage,
      RiskSupervisor supervisor,
      Journal journal,
      CapitalSnapshotStore snapshots,
      RiskParameters initialParameters,
      Clock clock,
      MeterRegistry meterRegistry,
      int workerThreads
  ) {
    this.ledger = ledger;
    this.store = store;
    this.sizer = sizer;
    this.slippage = slippage;
    this.supervisor = supervisor;
    this.journal = journal;
    this.snapshots = snapshots;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.parameters = new AtomicReference<>(initialParameters);
    AtomicInteger threadIds = new AtomicInteger();
    this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), r -> {
      Thread t = new Thread(r, "paper-engine-" + threadIds.incrementAndGet());
      t.setDaemon(true);
      return t;
    });

    this.signalsReceived = Counter.builder("paper.signals.received")
        .description("Signals received by the engine")
        .register(meterRegistry);
    this.positionsOpened = Counter.builder("paper.positions.opened")
        .description("Positions opened")
        .register(meterRegistry);
    this.positionsAveraged = Counter.builder("paper.positions.averaged")
        .description("Averaging-down additions")
        .register(meterRegistry);

    Gauge.builder("paper.capital.total", ledger, l -> l.snapshot().total().doubleValue())
        .description("Total paper capital in USD")
        .register(meterRegistry);
    Gauge.builder("paper.capital.available", ledger, l -> l.snapshot().available().doubleValue())
        .description("Available paper capital in USD")
        .register(meterRegistry);
    Gauge.builder("paper.capital.allocated", ledger, l -> l.snapshot().allocated().doubleValue())
        .description("Allocated paper capital in USD")
        .register(meterRegistry);
    Gauge.builder("paper.positions.active", store, PositionStore::openCount)
        .description("Active positions")
        .register(meterRegistry);
    Gauge.builder("paper.trading.halted", haltedGauge, AtomicInteger::get)
        .description("1 while the drawdown breaker blocks new entries")
        .register(meterRegistry);
    Gauge.builder("paper.intake.frozen", fatalHalt, ref -> ref.get() == null ? 0 : 1)
        .description("1 while a fatal condition freezes intake")
        .register(meterRegistry);
  }

  // ========== Startup ==========

  /**
   * Rebuilds state from the journal, or journals {@code initialCapital} as the genesis deposit
   * when the journal is empty. Call once before accepting signals.
   */
  public void start(BigDecimal initialCapital) {
    List<JournalEntry> entries = journal.readAll();
    if (entries.isEmpty()) {
      if (initialCapital != null && initialCapital.signum() > 0) {
        deposit(initialCapital, "initial capital");
      }
    } else {
      JournalReplayer.ReplayResult result = new JournalReplayer().replayInto(ledger, store, entries);
      log.info("recovered from journal: entries={} lastSequence={} active={} closed={} reopened={}",
          result.applied(), result.lastSequence(), store.openCount(), store.closedPositions().size(),
          result.reopened());
      checkSnapshot(result.lastSequence());
    }
    LedgerSnapshot snapshot = ledger.snapshot();
    supervisor.getDrawdownProtector().reset(snapshot.total());
    writeSnapshot();
    log.info("paper engine started: total={} available={} allocated={}",
        snapshot.total(), snapshot.available(), snapshot.allocated());
  }

  // ========== Signal intake ==========

  public CompletableFuture<SignalOutcome> submit(Signal signal) {
    return CompletableFuture.supplyAsync(() -> process(signal), workers);
  }

  public SignalOutcome process(Signal signal) {
    signalsReceived.increment();
    if (signal == null) {
      return reject(null, RejectionReason.INVALID_SIGNAL, "signal is null");
    }
    Optional<String> problem = signal.validate();
    if (problem.isPresent()) {
      return reject(signal, RejectionReason.INVALID_SIGNAL, problem.get());
    }
    if (fatalHalt.get() != null) {
      return reject(signal, RejectionReason.INTAKE_FROZEN, fatalHalt.get().condition().name());
    }

    RiskParameters params = parameters.get();
    return marketLocks.withLock(signal.marketId(), () -> {
      try {
        Optional<Position> active = store.active(signal.marketId());
        if (active.isPresent()) {
          return onRepeatSignal(active.get(), signal, params);
        }
        return open(signal, params);
      } catch (JournalWriteException e) {
        freeze(FatalCondition.JOURNAL_WRITE_FAILURE, e.getMessage());
        return reject(signal, RejectionReason.INTAKE_FROZEN, e.getMessage());
      } catch (LedgerInvariantViolationException e) {
        freeze(FatalCondition.LEDGER_INVARIANT_VIOLATION, e.getMessage());
        return reject(signal, RejectionReason.INTAKE_FROZEN, e.getMessage());
      }
    });
  }

  private SignalOutcome open(Signal signal, RiskParameters params) {
    if (supervisor.entriesHalted()) {
      return reject(signal, RejectionReason.TRADING_HALTED, "drawdown breaker engaged");
    }
    if (store.openCount() >= params.maxOpenPositions()) {
      return reject(signal, RejectionReason.MAX_OPEN_POSITIONS, "open positions at " + params.maxOpenPositions());
    }

    SizingDecision sizing = sizer.size(signal, ledger.snapshot().available(), params.sizing());
    if (!sizing.accepted()) {
      return reject(signal, sizing.rejection(), sizing.detail());
    }
    BigDecimal stake = sizing.stake();

    Instant now = clock.instant();
    String positionId = UUID.randomUUID().toString();
    if (store.beginOpening(positionId, signal, now, params.maxOpenPositions()).isEmpty()) {
      if (store.isActive(signal.marketId())) {
        return reject(signal, RejectionReason.DUPLICATE_ACTIVE_POSITION, "market already active");
      }
      return reject(signal, RejectionReason.MAX_OPEN_POSITIONS, "open positions at " + params.maxOpenPositions());
    }

    commitLock.readLock().lock();
    try {
      Optional<ReservationToken> reserved = ledger.tryReserve(positionId, stake);
      if (reserved.isEmpty()) {
        store.abandonOpening(signal.marketId());
        return reject(signal, RejectionReason.INSUFFICIENT_CAPITAL,
            "stake " + stake + " exceeds available " + ledger.snapshot().available());
      }
      ReservationToken token = reserved.get();
      Fill fill = slippage.fill(TradeDirection.BUY, BigDecimal.valueOf(signal.marketPrice()), stake,
          signal.liquidityUsd(), params.slippage());

      try {
        journal.append(new JournalEntry.ReservationRecord(0, now, positionId, signal.marketId(),
            token.reservationId(), stake, ReservationReason.OPEN, signal.side(), fill.price(), signal.edge(),
            signal.expiresAt(), signal.signalId()));
      } catch (JournalWriteException e) {
        ledger.cancel(token);
        store.abandonOpening(signal.marketId());
        throw e;
      }

      Position position = store.completeOpening(signal.marketId(), token.reservationId(), stake, fill.price(), now);
      latestEdges.put(signal.marketId(), signal.edge());
      rememberConfidence(signal);
      positionsOpened.increment();
      log.info("OPENED {} {} stake={} fill={} (ref={} slip={}) edge={} kelly={}",
          signal.marketId(), signal.side(), stake, fill.price(), signal.marketPrice(),
          String.format("%.4f", fill.slippageRate()), signal.edge(), String.format("%.4f", sizing.fullKellyFraction()));
      writeSnapshot();
      return SignalOutcome.opened(signal, stake, position);
    } finally {
      commitLock.readLock().unlock();
    }
  }

  private void rememberConfidence(Signal signal) {
    if (signal.confidence() == null) {
      latestConfidence.remove(signal.marketId());
    } else {
      latestConfidence.put(signal.marketId(), signal.confidence());
    }
  }

  private SignalOutcome onRepeatSignal(Position position, Signal signal, RiskParameters params) {
    latestEdges.put(signal.marketId(), signal.edgeFor(position.side()));
    rememberConfidence(signal);
    if (!position.isOpen()) {
      return reject(signal, RejectionReason.DUPLICATE_ACTIVE_POSITION, "position is " + position.status());
    }

    BigDecimal total = ledger.snapshot().total();
    Optional<LifecycleCommand.TopUp> topUp = supervisor.reviewRepeatSignal(position, signal, total, params);
    if (topUp.isEmpty()) {
      return reject(signal, RejectionReason.DUPLICATE_ACTIVE_POSITION, "active position, averaging down declined");
    }
    if (supervisor.entriesHalted()) {
      return reject(signal, RejectionReason.TRADING_HALTED, "drawdown breaker engaged");
    }

    SizingDecision sizing = sizer.size(signal, ledger.snapshot().available(), params.sizing());
    if (!sizing.accepted()) {
      return reject(signal, sizing.rejection(), "averaging down: " + sizing.detail());
    }
    BigDecimal add = sizing.stake().min(topUp.get().maxAddStake()).setScale(2, RoundingMode.DOWN);
    if (add.signum() <= 0 || add.compareTo(params.sizing().minStakeUsd()) < 0) {
      return reject(signal, RejectionReason.NO_EDGE, "averaging down: addition " + add + " below minimum");
    }

    Instant now = clock.instant();
    ReservationToken token = new ReservationToken(position.reservationId(), position.positionId());
    commitLock.readLock().lock();
    try {
      if (!ledger.tryIncrease(token, add)) {
        return reject(signal, RejectionReason.INSUFFICIENT_CAPITAL, "averaging down: " + add + " not available");
      }
      Fill fill = slippage.fill(TradeDirection.BUY, BigDecimal.valueOf(signal.marketPrice()), add,
          signal.liquidityUsd(), params.slippage());
      try {
        journal.append(new JournalEntry.ReservationRecord(0, now, position.positionId(), position.marketId(),
            token.reservationId(), add, ReservationReason.AVERAGE_DOWN, position.side(), fill.price(),
            signal.edge(), position.expiresAt(), signal.signalId()));
      } catch (JournalWriteException e) {
        ledger.shrink(token, add);
        throw e;
      }
      Position updated = store.averageDown(position.marketId(), add, fill.price(), signal.edge());
      positionsAveraged.increment();
      log.info("AVERAGED DOWN {} add={} fill={} stake={} entry {} -> {} additions={}",
          position.marketId(), add, fill.price(), updated.stake(), position.entryPrice(), updated.entryPrice(),
          updated.additions());
      writeSnapshot();
      return SignalOutcome.averaged(signal, add, updated);
    } finally {
      commitLock.readLock().unlock();
    }
  }

  // ========== Quotes and evaluation ==========

  public void onQuote(MarketQuote quote) {
    if (quote == null || quote.marketId() == null || quote.marketId().isBlank()) {
      throw new IllegalArgumentException("quote requires a market id");
    }
    if (quote.yesPrice() == null
        || quote.yesPrice().signum() < 0
        || quote.yesPrice().compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException("yes price must be within [0,1]: " + quote.yesPrice());
    }
    quotes.put(quote.marketId(), quote);
  }

  /**
   * Periodic sweep over active positions. Each position is evaluated under its market lock.
   */
  public EvaluationSummary evaluateOpenPositions() {
    RiskParameters params = parameters.get();
    observeCapital(params);

    List<EvaluationSummary.ClosedPosition> closed = new ArrayList<>();
    int evaluated = 0;
    for (Position snapshot : store.activePositions()) {
      String marketId = snapshot.marketId();
      evaluated++;
      Optional<Position> result = marketLocks.withLock(marketId, () -> guarded(marketId, () -> {
        Optional<Position> current = store.active(marketId).filter(Position::isOpen);
        if (current.isEmpty()) {
          return Optional.<Position>empty();
        }
        Optional<LifecycleCommand.Close> command = supervisor.evaluate(current.get(), quotes.get(marketId),
            latestEdges.get(marketId), latestConfidence.get(marketId), params, clock.instant());
        if (command.isEmpty()) {
          return Optional.<Position>empty();
        }
        LifecycleCommand.Close close = command.get();
        return closeLocked(marketId, close.closingStatus(), close.markPrice(), close.reason(), params);
      }));
      result.ifPresent(p -> closed.add(new EvaluationSummary.ClosedPosition(marketId, p.exitStatus().name(),
          p.realizedPnl())));
    }
    if (!closed.isEmpty()) {
      log.info("evaluation sweep: evaluated={} closed={}", evaluated, closed.size());
    }
    return new EvaluationSummary(evaluated, closed, supervisor.entriesHalted());
  }

  /**
   * Operator close. Runs even while intake is frozen or the drawdown breaker is engaged.
   */
  public Optional<Position> closePosition(String marketId, String reason) {
    RiskParameters params = parameters.get();
    return marketLocks.withLock(marketId, () -> guarded(marketId, () -> {
      Optional<Position> current = store.active(marketId).filter(Position::isOpen);
      if (current.isEmpty()) {
        return Optional.<Position>empty();
      }
      MarketQuote quote = quotes.get(marketId);
      BigDecimal mark = quote != null && quote.yesPrice() != null ? quote.priceFor(current.get().side()) : null;
      return closeLocked(marketId, PositionStatus.CLOSING_MANUAL, mark,
          reason == null || reason.isBlank() ? "manual close" : reason, params);
    }));
  }

  private Optional<Position> closeLocked(String marketId, PositionStatus status, BigDecimal mark, String reason,
                                         RiskParameters params) {
    Optional<Position> closing = store.beginClosing(marketId, status);
    if (closing.isEmpty()) {
      return Optional.empty();
    }
    Position position = closing.get();
    Instant now = clock.instant();

    commitLock.readLock().lock();
    try {
      try {
        journal.append(new JournalEntry.TransitionRecord(0, now, position.positionId(), marketId,
            PositionStatus.OPEN, status, reason));
      } catch (JournalWriteException e) {
        store.revertClosing(marketId);
        throw e;
      }

      Fill exit = exitFill(position, status, mark, params);
      BigDecimal pnl = position.pnlAt(exit.price());
      ReservationToken token = new ReservationToken(position.reservationId(), position.positionId());
      BigDecimal reserved = ledger.reservedAmount(token);

      try {
        journal.append(new JournalEntry.ReleaseRecord(0, now, position.positionId(), marketId,
            token.reservationId(), reserved, pnl, status, exit.price()));
      } catch (JournalWriteException e) {
        // the transition is journaled; replay reopens the position
        store.revertClosing(marketId);
        throw e;
      }
      Release release = ledger.release(token, pnl);
      Position closed = store.completeClosing(marketId, exit.price(), pnl, now);
      supervisor.onClosed(closed);
      latestEdges.remove(marketId);
      latestConfidence.remove(marketId);

      Counter.builder("paper.positions.closed")
          .description("Positions closed by closing status")
          .tag("status", status.name())
          .register(meterRegistry)
          .increment();
      log.info("CLOSED {} {} via {} exit={} stake={} pnl={} returned={} ({})",
          marketId, position.side(), status, exit.price(), release.reserved(), pnl, release.returned(), reason);
      writeSnapshot();
      return Optional.of(closed);
    } finally {
      commitLock.readLock().unlock();
      observeCapital(params);
    }
  }

  private Fill exitFill(Position position, PositionStatus status, BigDecimal mark, RiskParameters params) {
    MarketQuote quote = quotes.get(position.marketId());
    if (status == PositionStatus.CLOSING_RESOLVED && quote != null && quote.resolvedOutcome() != null) {
      return slippage.settle(quote.resolvedOutcome(), position.side());
    }
    BigDecimal price = mark != null ? mark : position.entryPrice();
    BigDecimal notional = position.contracts().multiply(price);
    BigDecimal liquidity = quote != null ? quote.liquidityUsd() : null;
    return slippage.fill(TradeDirection.SELL, price, notional, liquidity, params.slippage());
  }

  private void observeCapital(RiskParameters params) {
    supervisor.observeCapital(ledger.snapshot().total(), clock.instant(), params)
        .ifPresent(halt -> log.warn("new entries halted: {}", halt.reason()));
    haltedGauge.set(supervisor.entriesHalted() ? 1 : 0);
  }

  // ========== Capital and operator commands ==========

  public void deposit(BigDecimal amount, String note) {
    if (amount == null || amount.signum() <= 0) {
      throw new IllegalArgumentException("deposit must be positive: " + amount);
    }
    commitLock.readLock().lock();
    try {
      journal.append(new JournalEntry.DepositRecord(0, clock.instant(), amount, note));
      ledger.deposit(amount);
    } catch (JournalWriteException e) {
      freeze(FatalCondition.JOURNAL_WRITE_FAILURE, e.getMessage());
      throw e;
    } finally {
      commitLock.readLock().unlock();
    }
    log.info("deposit {} ({}) total={}", amount, note, ledger.snapshot().total());
    writeSnapshot();
  }

  /**
   * Replays the journal into fresh state and compares total capital with the live ledger.
   * A mismatch freezes intake.
   */
  public ReconcileResult reconcile() {
    commitLock.writeLock().lock();
    try {
      JournalReplayer.ReplayResult replayed = new JournalReplayer().replay(journal.readAll());
      BigDecimal live = ledger.snapshot().total();
      BigDecimal fromJournal = replayed.ledger().snapshot().total();
      boolean matches = live.compareTo(fromJournal) == 0;
      if (!matches) {
        freeze(FatalCondition.LEDGER_DIVERGENCE, "live total " + live + " != journal total " + fromJournal);
      } else {
        log.debug("reconcile ok: total={} seq={}", live, replayed.lastSequence());
      }
      return new ReconcileResult(live, fromJournal, replayed.lastSequence(), matches);
    } catch (LedgerInvariantViolationException e) {
      freeze(FatalCondition.LEDGER_DIVERGENCE, "journal replay failed: " + e.getMessage());
      return new ReconcileResult(ledger.snapshot().total(), null, journal.lastSequence(), false);
    } finally {
      commitLock.writeLock().unlock();
    }
  }

  public Optional<FatalHalt> resumeIntake() {
    FatalHalt previous = fatalHalt.getAndSet(null);
    if (previous != null) {
      log.warn("intake resumed by operator after {} ({})", previous.condition(), previous.detail());
    }
    return Optional.ofNullable(previous);
  }

  public void updateParameters(RiskParameters next) {
    RiskParameters previous = parameters.getAndSet(next);
    log.info("risk parameters updated: sizing {} -> {}", previous.sizing(), next.sizing());
  }

  public RiskParameters parameters() {
    return parameters.get();
  }

  public EngineStatus status() {
    return new EngineStatus(ledger.snapshot(), store.openCount(), store.closedPositions().size(),
        supervisor.getDrawdownProtector().state(), fatalHalt.get(), journal.lastSequence());
  }

  public List<Position> activePositions() {
    return List.copyOf(store.activePositions());
  }

  public List<Position> closedPositions() {
    return store.closedPositions();
  }

  public Optional<FatalHalt> fatalHalt() {
    return Optional.ofNullable(fatalHalt.get());
  }

  public void shutdown() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  // ========== Internals ==========

  private <T> Optional<T> guarded(String marketId, Supplier<Optional<T>> action) {
    try {
      return action.get();
    } catch (JournalWriteException e) {
      freeze(FatalCondition.JOURNAL_WRITE_FAILURE, marketId + ": " + e.getMessage());
      return Optional.empty();
    } catch (LedgerInvariantViolationException e) {
      freeze(FatalCondition.LEDGER_INVARIANT_VIOLATION, marketId + ": " + e.getMessage());
      return Optional.empty();
    }
  }

  private void freeze(FatalCondition condition, String detail) {
    FatalHalt halt = new FatalHalt(condition, detail, clock.instant());
    if (fatalHalt.compareAndSet(null, halt)) {
      log.error("ALERT intake frozen: {} - {}", condition, detail);
      Counter.builder("paper.engine.fatal")
          .description("Fatal conditions that froze intake")
          .tag("condition", condition.name())
          .register(meterRegistry)
          .increment();
    } else {
      log.error("fatal condition while already frozen: {} - {}", condition, detail);
    }
  }

  private SignalOutcome reject(Signal signal, RejectionReason reason, String detail) {
    Counter.builder("paper.signals.rejected")
        .description("Signals rejected by reason")
        .tag("reason", reason.name())
        .register(meterRegistry)
        .increment();
    log.debug("rejected signal {} for {}: {} ({})",
        signal == null ? null : signal.signalId(), signal == null ? null : signal.marketId(), reason, detail);
    return SignalOutcome.rejected(signal, reason, detail);
  }

  private void writeSnapshot() {
    if (snapshots == null) {
      return;
    }
    try {
      snapshots.write(CapitalSnapshot.of(ledger.snapshot(), journal.lastSequence(), clock.instant()));
    } catch (UncheckedIOException e) {
      log.warn("capital snapshot write failed: {}", e.getMessage());
    }
  }

  private void checkSnapshot(long lastSequence) {
    if (snapshots == null) {
      return;
    }
    try {
      snapshots.read().ifPresent(snapshot -> {
        if (snapshot.lastSequence() == lastSequence && !snapshot.matches(ledger.snapshot())) {
          log.warn("capital snapshot at seq={} disagrees with journal replay: snapshot={} replay={}",
              lastSequence, snapshot, ledger.snapshot());
        }
      });
    } catch (UncheckedIOException e) {
      log.warn("capital snapshot unreadable, relying on journal: {}", e.getMessage());
    }
  }
}
