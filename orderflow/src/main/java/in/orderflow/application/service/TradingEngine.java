package in.orderflow.application.service;

import in.orderflow.config.TradingSettings;
import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.data.Tick;
import in.orderflow.domain.invalidation.InvalidationAction;
import in.orderflow.domain.invalidation.InvalidationEvent;
import in.orderflow.domain.monitoring.DailyPerformance;
import in.orderflow.domain.signal.Signal;
import in.orderflow.domain.trade.ClosedTrade;
import in.orderflow.domain.trade.ExitReason;
import in.orderflow.domain.trade.PendingTrade;
import in.orderflow.domain.trade.Position;
import in.orderflow.infrastructure.metrics.EngineMetrics;
import in.orderflow.infrastructure.metrics.NoOpEngineMetrics;
import in.orderflow.service.invalidation.EvaluationContext;
import in.orderflow.service.invalidation.EvaluationReason;
import in.orderflow.service.invalidation.InvalidationEvaluator;
import in.orderflow.service.performance.PerformanceAggregator;
import in.orderflow.service.risk.RiskGuardrailManager;
import in.orderflow.service.signal.SignalBarCache;
import in.orderflow.service.trade.PositionLedger;
import in.orderflow.util.TradingDayClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * TradingEngine - single entry point of the simulator core.
 *
 * FLOW PER INPUT:
 * <pre>
 *   signals/bars ──→ SignalBarCache ──→ auto-take ──→ PositionLedger (pending)
 *                                                          │
 *   tick ─────────────────────────────────────────────→ PositionLedger (fills, exits)
 *                                                          │
 *                                    InvalidationEvaluator ←┘ (every input with open positions)
 *                                                          │
 *   close hook ──→ evaluator cleanup ──→ RiskGuardrailManager ──→ daily performance
 * </pre>
 *
 * VERSIONING:
 * Every externally observable mutation bumps {@link #getVersion()} exactly once
 * per call; no-op calls leave it unchanged. Hosts key persistence and redraws
 * off the version.
 *
 * Single-threaded: calls must be serialized by the host and may not re-enter.
 * Given the same ordered inputs, settings and clock, the version progression
 * and closed-trade sequence are identical.
 */
public final class TradingEngine {
    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private final Clock clock;
    private final EngineMetrics metrics;

    private final SignalBarCache cache = new SignalBarCache();
    private final RiskGuardrailManager guardrails;
    private final PositionLedger ledger;
    private final InvalidationEvaluator evaluator;

    private TradingSettings settings;
    private MarketContext market;
    private long clockOffsetMs;
    private DailyPerformance performance;
    private long version;

    private TradingEngine(Builder builder) {
        this.clock = builder.clock;
        this.metrics = builder.metrics;
        this.settings = builder.settings;
        this.market = builder.market;
        this.clockOffsetMs = builder.clockOffsetMs;

        this.guardrails = new RiskGuardrailManager(settings.guardrails(), now());
        this.evaluator = new InvalidationEvaluator(cache);
        this.ledger = new PositionLedger(settings, market.priceStep(), guardrails, this::now, new LedgerHooks());
        ledger.restoreHistory(builder.history);

        refreshPerformance();
        log.info("✅ TradingEngine ready: priceStep={}, timeframeMs={}, autoTake={}, history={} trades",
            market.priceStep(), market.timeframeMs(), settings.autoTake(), builder.history.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ════════════════════════════════════════════════════════════════════════
    // MARKET INPUTS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Ingest a detector batch.
     *
     * Only signals not seen before are auto-taken and checked for bar-count
     * invalidation; known ids are ignored. Open positions are then re-scored,
     * against the new signals when there are any, otherwise against the bars.
     *
     * @param bars latest bar window, or null when the batch carries no bars
     * @return true if observable state changed
     */
    public boolean syncSignals(List<Signal> signals, List<FootprintBar> bars) {
        boolean changed = false;
        boolean barsUpdated = bars != null && cache.updateBars(bars);

        List<Signal> fresh = cache.addNew(signals == null ? List.of() : signals);
        for (Signal signal : fresh) {
            if (settings.invalidationBars() > 0) {
                changed |= ledger.closeOnOppositeSignal(signal, settings.invalidationBars());
            }
            if (settings.autoTake()) {
                changed |= handleEntry(ledger.createPending(signal, true), true);
            }
        }
        cache.evict(ledger::isReferenced);

        if (!fresh.isEmpty()) {
            long at = fresh.get(fresh.size() - 1).timestamp();
            changed |= evaluate(EvaluationReason.SIGNAL, at, fresh);
        } else if (barsUpdated) {
            long at = cache.latestBar().map(FootprintBar::endTime).orElse(now());
            changed |= evaluate(EvaluationReason.BARS, at, List.of());
        }

        return bumpIf(changed);
    }

    public boolean onBars(List<FootprintBar> bars) {
        return syncSignals(List.of(), bars);
    }

    /**
     * Apply one trade print: pending expiry and fills, exits, then re-scoring.
     */
    public boolean onTick(Tick tick) {
        boolean changed = ledger.onTick(tick);
        changed |= evaluate(EvaluationReason.TRADE, tick.timestamp(), List.of());
        return bumpIf(changed);
    }

    /**
     * Apply a batch of prints in exchange order (timestamp, then trade id).
     *
     * @return true if any print changed state
     */
    public boolean onTicks(List<Tick> ticks) {
        if (ticks == null || ticks.isEmpty()) {
            return false;
        }
        List<Tick> ordered = new ArrayList<>(ticks);
        ordered.sort(Tick.EXCHANGE_ORDER);
        boolean changed = false;
        for (Tick tick : ordered) {
            changed |= onTick(tick);
        }
        return changed;
    }

    // ════════════════════════════════════════════════════════════════════════
    // MANUAL ORDER MANAGEMENT
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Create a pending order for a cached signal.
     *
     * A guardrail denial returns empty but still bumps the version, since the
     * denial is recorded in the guardrail state.
     */
    public Optional<PendingTrade> takeSignal(String signalId) {
        Optional<Signal> signal = cache.signal(signalId);
        if (signal.isEmpty()) {
            log.debug("takeSignal: unknown signal {}", signalId);
            return Optional.empty();
        }
        PositionLedger.EntryAttempt attempt = ledger.createPending(signal.get(), false);
        bumpIf(handleEntry(attempt, false));
        return attempt.created();
    }

    public boolean cancelPending(String id) {
        return bumpIf(ledger.cancelPending(id));
    }

    public boolean flattenPosition(String id) {
        return flattenPosition(id, null, ExitReason.CANCELLED);
    }

    /**
     * Close a position's remainder.
     *
     * @param price  exit price, null for the last print
     * @param reason exit reason, null for {@code cancelled}
     */
    public boolean flattenPosition(String id, Double price, ExitReason reason) {
        return bumpIf(ledger.flatten(id, price, reason));
    }

    /**
     * Act on an invalidation event: close, reduce by half, tighten the stop, or hold.
     */
    public boolean applyInvalidationAction(String eventId, InvalidationAction action) {
        boolean applied = evaluator.applyAction(eventId, action, ledger);
        if (applied) {
            metrics.recordInvalidationAction(action);
        }
        return bumpIf(applied);
    }

    // ════════════════════════════════════════════════════════════════════════
    // SETTINGS AND CLOCK
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Replace the settings. Equal settings (field by field) are a no-op.
     */
    public boolean updateSettings(TradingSettings next) {
        if (next == null || next.equals(settings)) {
            return false;
        }
        this.settings = next;
        ledger.configure(next);
        guardrails.updateSettings(next.guardrails(), now());
        refreshPerformance();
        log.info("Settings updated: autoTake={}, risk={}%, objectiveInvalidation={}",
            next.autoTake(), next.riskPerTradePercent(), next.objectiveInvalidation().enabled());
        return bumpIf(true);
    }

    /**
     * Partial update, e.g. {@code engine.updateSettings(b -> b.autoTake(true))}.
     */
    public boolean updateSettings(UnaryOperator<TradingSettings.Builder> change) {
        return updateSettings(change.apply(settings.toBuilder()).build());
    }

    /**
     * Switch symbol or timeframe parameters. Does not bump the version: the
     * context only affects how future inputs are priced and scored.
     *
     * @return true if the context differed
     */
    public boolean updateMarketContext(MarketContext next) {
        if (next == null || next.equals(market)) {
            return false;
        }
        this.market = next;
        ledger.setPriceStep(next.priceStep());
        log.info("Market context: priceStep={}, timeframeMs={}", next.priceStep(), next.timeframeMs());
        return true;
    }

    /**
     * Server time minus local time. Shifts the day boundary used by the
     * guardrails and daily performance; recorded trades keep their times.
     */
    public boolean updateClockOffset(long offsetMs) {
        if (offsetMs == clockOffsetMs) {
            return false;
        }
        this.clockOffsetMs = offsetMs;
        guardrails.ensureDay(now());
        refreshPerformance();
        return bumpIf(true);
    }

    public void resetDay() {
        resetDay(TradingDayClock.dayKey(now()));
    }

    /**
     * Drop the day's trades from closed and history and reset the guardrails. Always bumps.
     */
    public void resetDay(String day) {
        boolean removed = ledger.removeDay(day);
        guardrails.reset(now());
        refreshPerformance();
        log.info("Day {} reset (trades removed={})", day, removed);
        bumpIf(true);
    }

    // ════════════════════════════════════════════════════════════════════════
    // OUTPUTS
    // ════════════════════════════════════════════════════════════════════════

    public String exportHistory(ExportFormat format) {
        return HistoryExporter.export(ledger.history(), format);
    }

    public TradingStateSnapshot getState() {
        return new TradingStateSnapshot(
            version,
            settings,
            market,
            clockOffsetMs,
            ledger.pending(),
            ledger.positions(),
            ledger.closed(),
            ledger.history(),
            performance,
            evaluator.events(),
            guardrails.getState(),
            evaluator.objectiveKpis()
        );
    }

    public TradingPersistenceSnapshot getPersistenceSnapshot() {
        return new TradingPersistenceSnapshot(settings, ledger.history());
    }

    public long getVersion() {
        return version;
    }

    public TradingSettings getSettings() {
        return settings;
    }

    /**
     * Engine time: host clock plus the server clock offset.
     */
    public long now() {
        return clock.millis() + clockOffsetMs;
    }

    // ════════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ════════════════════════════════════════════════════════════════════════

    private boolean handleEntry(PositionLedger.EntryAttempt attempt, boolean auto) {
        if (attempt.created().isPresent()) {
            metrics.recordPendingCreated(attempt.pending().side(), auto);
            return true;
        }
        if (attempt.denied()) {
            metrics.recordEntryBlocked(attempt.decision().block().source());
            return true;
        }
        return attempt.guardrailsChanged();
    }

    private boolean evaluate(EvaluationReason reason, long at, List<Signal> fresh) {
        if (ledger.positions().isEmpty()) {
            return false;
        }
        EvaluationContext context = new EvaluationContext(at, reason, fresh, cache.bars(), settings,
            market.priceStep(), market.timeframeMs());
        List<InvalidationEvent> emitted = evaluator.evaluate(context, ledger);
        for (InvalidationEvent event : emitted) {
            metrics.recordInvalidationEvent(event);
        }
        return !emitted.isEmpty();
    }

    private void refreshPerformance() {
        this.performance = PerformanceAggregator.daily(TradingDayClock.dayKey(now()), ledger.history(),
            settings.riskFraction());
        metrics.updateDailyNetR(performance.getTotals().netR());
    }

    private boolean bumpIf(boolean changed) {
        if (!changed) {
            return false;
        }
        version++;
        metrics.updateBook(ledger.pending().size(), ledger.positions().size(), version);
        metrics.updateGuardrailStatus(guardrails.getStatus());
        return true;
    }

    /**
     * Keeps evaluator, guardrails and performance in step with ledger transitions.
     */
    private final class LedgerHooks implements PositionLedger.Listener {
        @Override
        public Position onPositionOpened(Position position) {
            metrics.recordFill(position.side());
            return evaluator.onPositionOpened(position);
        }

        @Override
        public void onPositionClosed(Position position, ClosedTrade trade) {
            evaluator.onPositionClosed(position.id(), trade.exitReason());
            guardrails.recordClosedTrade(trade);
            refreshPerformance();
            metrics.recordTradeClosed(trade);
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // BUILDER
    // ════════════════════════════════════════════════════════════════════════

    public static final class Builder {
        private TradingSettings settings = TradingSettings.defaults();
        private MarketContext market = MarketContext.defaults();
        private List<ClosedTrade> history = List.of();
        private Clock clock = Clock.systemUTC();
        private long clockOffsetMs;
        private EngineMetrics metrics = NoOpEngineMetrics.INSTANCE;

        private Builder() {}

        public Builder settings(TradingSettings settings) {
            this.settings = settings != null ? settings : TradingSettings.defaults();
            return this;
        }

        public Builder priceStep(double priceStep) {
            this.market = new MarketContext(priceStep, market.timeframeMs());
            return this;
        }

        public Builder timeframeMs(long timeframeMs) {
            this.market = new MarketContext(market.priceStep(), timeframeMs);
            return this;
        }

        public Builder history(List<ClosedTrade> history) {
            this.history = history != null ? List.copyOf(history) : List.of();
            return this;
        }

        /**
         * Restore settings and history from a persisted snapshot.
         */
        public Builder restore(TradingPersistenceSnapshot snapshot) {
            return settings(snapshot.settings()).history(snapshot.history());
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder clockOffsetMs(long clockOffsetMs) {
            this.clockOffsetMs = clockOffsetMs;
            return this;
        }

        public Builder metrics(EngineMetrics metrics) {
            this.metrics = metrics != null ? metrics : NoOpEngineMetrics.INSTANCE;
            return this;
        }

        public TradingEngine build() {
            return new TradingEngine(this);
        }
    }
}
