package in.orderflow.service.trade;

import in.orderflow.config.TradingSettings;
import in.orderflow.domain.data.Tick;
import in.orderflow.domain.risk.EntryDecision;
import in.orderflow.domain.signal.Signal;
import in.orderflow.domain.trade.ClosedTrade;
import in.orderflow.domain.trade.ExitReason;
import in.orderflow.domain.trade.FirstHit;
import in.orderflow.domain.trade.PendingTrade;
import in.orderflow.domain.trade.Position;
import in.orderflow.domain.trade.TradeResult;
import in.orderflow.service.risk.RiskGuardrailManager;
import in.orderflow.util.BoundedRing;
import in.orderflow.util.TradingDayClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Position Ledger - owns pending orders, open positions and closed trades.
 *
 * LIFECYCLE:
 * <pre>
 *   signal ──create──→ PENDING ──touch──→ OPEN ──tp1──→ OPEN (partial, stop at BE)
 *                         │                 │
 *                      expiry/cancel     tp2 / stop / time-stop / flatten / invalidation
 *                         ↓                 ↓
 *                      (gone)            CLOSED (closed ring + history ring)
 * </pre>
 *
 * Positions are immutable records; every transition replaces the instance in
 * place. Per tick, exits are checked in a fixed priority: target1 partial,
 * target2, stop, time stop. Target2 is checked before the stop, so a tick that
 * satisfies both closes at target2.
 *
 * Not thread-safe: the host serializes calls.
 */
public final class PositionLedger {
    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    public static final int MAX_CLOSED = 120;
    public static final int MAX_HISTORY = 2000;

    private static final double MIN_REWARD_RISK = 2.0;
    private static final double TARGET2_R = 3.0;
    private static final double TIGHTEN_STOP_R = 0.5;

    /**
     * Hooks the engine uses to keep position-scoped state in step with the ledger.
     */
    public interface Listener {
        /**
         * Called once per fill, before the position is stored.
         *
         * @return the position to store (may carry an updated entry bar index)
         */
        Position onPositionOpened(Position position);

        /**
         * Called after the position left the ledger.
         */
        void onPositionClosed(Position position, ClosedTrade trade);
    }

    private final RiskGuardrailManager guardrails;
    private final LongSupplier clock;
    private final Listener listener;

    private TradingSettings settings;
    private double priceStep;

    private final List<PendingTrade> pending = new ArrayList<>();
    private final List<Position> positions = new ArrayList<>();
    private final BoundedRing<ClosedTrade> closed = new BoundedRing<>(MAX_CLOSED);
    private final BoundedRing<ClosedTrade> history = new BoundedRing<>(MAX_HISTORY);

    private Double lastPrice;
    private long lastTimestamp;

    public PositionLedger(
        TradingSettings settings,
        double priceStep,
        RiskGuardrailManager guardrails,
        LongSupplier clock,
        Listener listener
    ) {
        this.settings = settings;
        this.priceStep = priceStep;
        this.guardrails = guardrails;
        this.clock = clock;
        this.listener = listener;
    }

    public void configure(TradingSettings settings) {
        this.settings = settings;
    }

    public void setPriceStep(double priceStep) {
        this.priceStep = priceStep;
    }

    // ════════════════════════════════════════════════════════════════════════
    // ENTRY
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Create a touch-entry pending order for the signal.
     *
     * Skipped (no pending, no decision) when the signal is already pending or
     * open, has no risk, or offers less than 2R to its target1. Otherwise the
     * guardrails decide; a denial carries the blocking reason.
     */
    public EntryAttempt createPending(Signal signal, boolean auto) {
        if (isReferenced(signal.id())) {
            return EntryAttempt.SKIPPED;
        }

        double riskPerUnit = Math.abs(signal.entry() - signal.stop());
        if (riskPerUnit < TradeMath.PRICE_EPSILON) {
            log.debug("Signal {} skipped: zero risk (entry={}, stop={})", signal.id(), signal.entry(), signal.stop());
            return EntryAttempt.SKIPPED;
        }

        int direction = signal.side().direction();
        Double provided = signal.target1();
        double providedTarget1 = provided != null && Double.isFinite(provided)
            ? provided
            : signal.entry() + direction * riskPerUnit * MIN_REWARD_RISK;
        double rewardRisk = Math.abs(providedTarget1 - signal.entry()) / Math.max(riskPerUnit, TradeMath.PRICE_EPSILON);
        if (rewardRisk + TradeMath.PRICE_EPSILON < MIN_REWARD_RISK) {
            log.debug("Signal {} skipped: reward/risk {} below {}", signal.id(), rewardRisk, MIN_REWARD_RISK);
            return EntryAttempt.SKIPPED;
        }

        long decisionTime = Math.max(signal.timestamp(), lastTimestamp);
        EntryDecision decision = guardrails.evaluateEntry(decisionTime, signal, auto);
        if (!decision.allowed()) {
            return new EntryAttempt(null, decision);
        }

        long retestWindowMs = Math.round(Math.max(0, settings.retestWindowMinutes()) * TradingDayClock.MINUTE_MS);
        PendingTrade order = new PendingTrade(
            signal.id(),
            signal.id(),
            signal.side(),
            signal.strategy(),
            signal.session(),
            signal.entry(),
            signal.stop(),
            TradeMath.round6(signal.entry() + direction * riskPerUnit * MIN_REWARD_RISK),
            TradeMath.round6(signal.entry() + direction * riskPerUnit * TARGET2_R),
            signal.timestamp(),
            signal.timestamp() + retestWindowMs,
            PendingTrade.ENTRY_TYPE_TOUCH,
            auto,
            signal.barIndex()
        );
        pending.add(order);
        log.info("Pending {} {} @ {} (stop {}, t1 {}, t2 {}, auto={})",
            order.side().code(), order.id(), order.entry(), order.stop(), order.target1(), order.target2(), auto);
        return new EntryAttempt(order, decision);
    }

    public boolean cancelPending(String id) {
        boolean removed = pending.removeIf(order -> order.id().equals(id));
        if (removed) {
            log.info("Pending {} cancelled", id);
        }
        return removed;
    }

    // ════════════════════════════════════════════════════════════════════════
    // TICKS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Apply one print: expire or fill pending orders, then manage open positions.
     * Positions filled by this print are managed by the same print.
     *
     * @return true if pending orders or positions changed
     */
    public boolean onTick(Tick tick) {
        lastPrice = tick.price();
        lastTimestamp = tick.timestamp();

        boolean changed = false;
        for (int index = pending.size() - 1; index >= 0; index--) {
            PendingTrade order = pending.get(index);
            if (tick.timestamp() >= order.expiresAt()) {
                pending.remove(index);
                log.debug("Pending {} expired at {}", order.id(), tick.timestamp());
                changed = true;
                continue;
            }
            if (TradeMath.breached(order.side(), tick.price(), order.entry())) {
                pending.remove(index);
                changed = true;
                open(order, tick).ifPresent(positions::add);
            }
        }

        for (int index = positions.size() - 1; index >= 0; index--) {
            changed |= manage(index, tick);
        }
        return changed;
    }

    private Optional<Position> open(PendingTrade order, Tick tick) {
        double riskPerUnit = order.riskPerUnit();
        double riskFraction = settings.riskFraction();
        if (riskPerUnit < TradeMath.PRICE_EPSILON || riskFraction <= 0) {
            log.warn("Pending {} dropped at fill: riskPerUnit={}, riskFraction={}", order.id(), riskPerUnit, riskFraction);
            return Optional.empty();
        }

        double fillPrice = TradeMath.entryFill(order.side(), order.entry(), slippage());
        double size = riskFraction / riskPerUnit;
        double entryFee = TradeMath.fee(fillPrice, size, settings.feeRate());
        Double timeStopMinutes = settings.timeStopMinutes();
        Long timeStopAt = timeStopMinutes != null
            ? tick.timestamp() + Math.round(timeStopMinutes * TradingDayClock.MINUTE_MS)
            : null;

        Position position = Position.builder()
            .id(order.id())
            .signalId(order.signalId())
            .side(order.side())
            .strategy(order.strategy())
            .session(order.session())
            .entryPrice(order.entry())
            .entryFillPrice(fillPrice)
            .originalStop(order.stop())
            .stopPrice(order.stop())
            .target1(order.target1())
            .target2(order.target2())
            .entryTime(tick.timestamp())
            .entryBarIndex(order.barIndex())
            .size(size)
            .remainingSize(size)
            .partialSize(size * settings.partialTakePercent())
            .riskAmount(riskFraction)
            .riskPerUnit(riskPerUnit)
            .timeStopAt(timeStopAt)
            .realizedPnl(-entryFee)
            .realizedR(-entryFee / riskFraction)
            .feesPaid(entryFee)
            .lastPrice(tick.price())
            .build();

        log.info("✅ Filled {} {} @ {} (size {}, stop {})",
            position.side().code(), position.id(), fillPrice, size, position.stopPrice());
        return Optional.of(listener.onPositionOpened(position));
    }

    private boolean manage(int index, Tick tick) {
        Position position = positions.get(index);
        double price = tick.price();
        double rMove = position.rMultipleAt(price);

        position = position.toBuilder()
            .mfe(Math.max(position.mfe(), rMove))
            .mae(Math.max(position.mae(), Math.max(0, -rMove)))
            .lastPrice(price)
            .build();

        boolean changed = false;
        if (!position.target1Hit() && TradeMath.reached(position.side(), price, position.target1())) {
            if (consumesRemainder(position)) {
                Position hit = position.toBuilder()
                    .target1Hit(true)
                    .firstHit(position.firstHitOr(FirstHit.TP1))
                    .build();
                log.info("Target1 {} takes the whole remainder", position.id());
                close(index, hit, position.target1(), tick.timestamp(), ExitReason.TP1);
                return true;
            }
            position = applyTarget1(position);
            changed = true;
        }
        positions.set(index, position);

        if (TradeMath.reached(position.side(), price, position.target2())) {
            Position hit = position.toBuilder().firstHit(position.firstHitOr(FirstHit.TP2)).build();
            close(index, hit, position.target2(), tick.timestamp(), ExitReason.TP2);
            return true;
        }

        if (TradeMath.breached(position.side(), price, position.stopPrice())) {
            boolean afterTarget1 = position.target1Hit();
            Position hit = position.toBuilder()
                .firstHit(position.firstHitOr(afterTarget1 ? FirstHit.TP1 : FirstHit.STOP))
                .build();
            close(index, hit, position.stopPrice(), tick.timestamp(),
                afterTarget1 ? ExitReason.BREAKEVEN : ExitReason.STOP);
            return true;
        }

        if (position.timeStopAt() != null && tick.timestamp() >= position.timeStopAt()) {
            Position hit = position.toBuilder().firstHit(position.firstHitOr(FirstHit.TIME_STOP)).build();
            close(index, hit, price, tick.timestamp(), ExitReason.TIME_STOP);
            return true;
        }

        return changed;
    }

    private static double target1CloseSize(Position position) {
        return position.partialSize() > 0
            ? Math.min(position.partialSize(), position.remainingSize())
            : 0;
    }

    private static boolean consumesRemainder(Position position) {
        double closeSize = target1CloseSize(position);
        return closeSize > 0 && closeSize >= position.remainingSize();
    }

    /**
     * Target1: bank the partial at target1 and move the stop to breakeven.
     * With a zero partial only the flag and the stop move; the remainder rides
     * to target2 or breakeven. A partial covering the whole remainder never
     * reaches here: it is closed as a full TP1 exit.
     */
    private Position applyTarget1(Position position) {
        double breakeven = TradeMath.breakevenStop(position.side(), position.entryPrice(),
            settings.beOffsetTicks() * priceStep);
        double closeSize = target1CloseSize(position);

        Position.Builder next = position.toBuilder()
            .target1Hit(true)
            .firstHit(position.firstHitOr(FirstHit.TP1))
            .stopPrice(breakeven);

        if (closeSize <= 0) {
            log.info("Target1 {} flagged without partial, stop → {}", position.id(), breakeven);
            return next.build();
        }

        double exitFill = TradeMath.exitFill(position.side(), position.target1(), slippage());
        double fee = TradeMath.fee(exitFill, closeSize, settings.feeRate());
        double net = TradeMath.netExit(position.side(), position.entryFillPrice(), exitFill, closeSize,
            settings.feeRate());

        log.info("Target1 {} partial {} @ {} (net {}), stop → {}", position.id(), closeSize, exitFill, net, breakeven);
        return next
            .realizedPnl(position.realizedPnl() + net)
            .realizedR(position.realizedR() + net / position.riskAmount())
            .feesPaid(position.feesPaid() + fee)
            .remainingSize(position.remainingSize() - closeSize)
            .build();
    }

    // ════════════════════════════════════════════════════════════════════════
    // MANUAL AND INVALIDATION EXITS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Close the whole remainder.
     *
     * @param price exit price; null uses the last print, then the position's last price
     */
    public boolean flatten(String id, Double price, ExitReason reason) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        Position position = positions.get(index);
        double exitPrice = price != null ? price : lastPrice != null ? lastPrice : position.lastPrice();
        ExitReason exitReason = reason != null ? reason : ExitReason.CANCELLED;
        close(index, position, exitPrice, lastTimestampOrNow(), exitReason);
        return true;
    }

    /**
     * Close a fraction of the remainder at the current price.
     * A reduction that leaves nothing closes the position with reason invalidation.
     */
    public boolean reduce(String id, double fraction) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        double clamped = Math.min(Math.max(fraction, 0), 1);
        if (clamped <= 0) {
            return false;
        }
        Position position = positions.get(index);
        double closeSize = position.remainingSize() * clamped;
        if (closeSize <= TradeMath.PRICE_EPSILON) {
            return false;
        }

        double price = lastPrice != null ? lastPrice : position.lastPrice();
        double exitFill = TradeMath.exitFill(position.side(), price, slippage());
        double fee = TradeMath.fee(exitFill, closeSize, settings.feeRate());
        double net = TradeMath.netExit(position.side(), position.entryFillPrice(), exitFill, closeSize,
            settings.feeRate());
        double remaining = Math.max(0, position.remainingSize() - closeSize);

        Position reduced = position.toBuilder()
            .realizedPnl(position.realizedPnl() + net)
            .realizedR(position.realizedR() + net / position.riskAmount())
            .feesPaid(position.feesPaid() + fee)
            .remainingSize(remaining)
            .partialSize(Math.min(position.partialSize(), remaining))
            .lastPrice(price)
            .build();

        if (remaining <= TradeMath.PRICE_EPSILON) {
            close(index, reduced, price, lastTimestampOrNow(), ExitReason.INVALIDATION);
            return true;
        }
        positions.set(index, reduced);
        log.info("Reduced {} by {} @ {} (remaining {})", id, closeSize, exitFill, remaining);
        return true;
    }

    /**
     * Move the stop to -0.5R, only when that is strictly tighter than the current stop.
     */
    public boolean tightenStop(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return false;
        }
        Position position = positions.get(index);
        int direction = position.direction();
        double target = position.entryPrice() - direction * position.riskPerUnit() * TIGHTEN_STOP_R;
        boolean tighter = direction > 0
            ? target > position.stopPrice() + TradeMath.PRICE_EPSILON
            : target < position.stopPrice() - TradeMath.PRICE_EPSILON;
        if (!tighter) {
            return false;
        }
        positions.set(index, position.toBuilder().stopPrice(target).build());
        log.info("Stop {} tightened {} → {}", id, position.stopPrice(), target);
        return true;
    }

    /**
     * Bar-count invalidation: a new opposite-side signal of the same strategy
     * within {@code maxBars} bars of entry closes the position.
     */
    public boolean closeOnOppositeSignal(Signal signal, int maxBars) {
        if (maxBars <= 0) {
            return false;
        }
        boolean changed = false;
        for (int index = positions.size() - 1; index >= 0; index--) {
            Position position = positions.get(index);
            if (position.side() != signal.side().opposite() || position.strategy() != signal.strategy()) {
                continue;
            }
            int barsSinceEntry = signal.barIndex() - position.entryBarIndex();
            if (barsSinceEntry <= 0 || barsSinceEntry > maxBars) {
                continue;
            }
            Position hit = position.toBuilder().firstHit(position.firstHitOr(FirstHit.INVALIDATION)).build();
            double exitPrice = lastPrice != null ? lastPrice : signal.entry();
            log.info("Position {} invalidated by opposite signal {} after {} bars", position.id(), signal.id(),
                barsSinceEntry);
            close(index, hit, exitPrice, signal.timestamp(), ExitReason.INVALIDATION);
            changed = true;
        }
        return changed;
    }

    private ClosedTrade close(int index, Position position, double price, long timestamp, ExitReason reason) {
        double size = position.remainingSize();
        double exitFill = TradeMath.exitFill(position.side(), price, slippage());
        double fee = TradeMath.fee(exitFill, size, settings.feeRate());
        double net = TradeMath.netExit(position.side(), position.entryFillPrice(), exitFill, size,
            settings.feeRate());

        Position flat = position.toBuilder()
            .realizedPnl(position.realizedPnl() + net)
            .realizedR(position.realizedR() + net / position.riskAmount())
            .feesPaid(position.feesPaid() + fee)
            .remainingSize(0)
            .build();

        ClosedTrade trade = new ClosedTrade(
            flat.id(),
            flat.signalId(),
            flat.side(),
            flat.strategy(),
            flat.session(),
            flat.entryPrice(),
            flat.entryFillPrice(),
            exitFill,
            flat.entryTime(),
            timestamp,
            (timestamp - flat.entryTime()) / (double) TradingDayClock.MINUTE_MS,
            flat.firstHit(),
            reason,
            TradeResult.fromPnl(flat.realizedPnl()),
            flat.realizedPnl(),
            flat.realizedR(),
            flat.feesPaid(),
            flat.mfe(),
            flat.mae(),
            TradingDayClock.dayKey(timestamp)
        );

        positions.remove(index);
        closed.add(trade);
        history.add(trade);
        log.info("Closed {} {} @ {} reason={} result={} R={}", trade.side().code(), trade.id(), exitFill,
            reason.code(), trade.result().code(), String.format("%.4f", trade.realizedR()));
        listener.onPositionClosed(flat, trade);
        return trade;
    }

    // ════════════════════════════════════════════════════════════════════════
    // HISTORY
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Seed both rings from persisted history; the closed ring keeps only its newest entries.
     */
    public void restoreHistory(Collection<ClosedTrade> trades) {
        history.resetTo(trades);
        closed.resetTo(trades);
    }

    /**
     * Drop one day's trades from the closed and history rings.
     */
    public boolean removeDay(String day) {
        boolean fromHistory = history.removeIf(trade -> day.equals(trade.day()));
        boolean fromClosed = closed.removeIf(trade -> day.equals(trade.day()));
        return fromHistory || fromClosed;
    }

    // ════════════════════════════════════════════════════════════════════════
    // QUERIES
    // ════════════════════════════════════════════════════════════════════════

    /**
     * True when a pending order or an open position still refers to the signal.
     */
    public boolean isReferenced(String signalId) {
        return pending.stream().anyMatch(order -> order.signalId().equals(signalId))
            || positions.stream().anyMatch(position -> position.signalId().equals(signalId));
    }

    public Optional<Position> position(String id) {
        int index = indexOf(id);
        return index < 0 ? Optional.empty() : Optional.of(positions.get(index));
    }

    public boolean isOpen(String id) {
        return indexOf(id) >= 0;
    }

    /**
     * Replace an open position with an updated snapshot of itself.
     */
    public void update(Position position) {
        int index = indexOf(position.id());
        if (index >= 0) {
            positions.set(index, position);
        }
    }

    public List<PendingTrade> pending() {
        return List.copyOf(pending);
    }

    public List<Position> positions() {
        return List.copyOf(positions);
    }

    public List<ClosedTrade> closed() {
        return closed.toList();
    }

    public List<ClosedTrade> history() {
        return history.toList();
    }

    public Optional<Double> lastPrice() {
        return Optional.ofNullable(lastPrice);
    }

    public long lastTimestamp() {
        return lastTimestamp;
    }

    private long lastTimestampOrNow() {
        return lastTimestamp != 0 ? lastTimestamp : clock.getAsLong();
    }

    private double slippage() {
        return settings.slippageTicks() * priceStep;
    }

    private int indexOf(String id) {
        for (int index = 0; index < positions.size(); index++) {
            if (positions.get(index).id().equals(id)) {
                return index;
            }
        }
        return -1;
    }

    /**
     * Outcome of an entry request. {@code pending} is null when nothing was created;
     * {@code decision} is null when the request never reached the guardrails.
     */
    public record EntryAttempt(PendingTrade pending, EntryDecision decision) {
        public static final EntryAttempt SKIPPED = new EntryAttempt(null, null);

        public Optional<PendingTrade> created() {
            return Optional.ofNullable(pending);
        }

        public boolean denied() {
            return decision != null && !decision.allowed();
        }

        public boolean guardrailsChanged() {
            return decision != null && decision.changed();
        }
    }
}
