package in.orderflow.service.invalidation;

import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.invalidation.InvalidationAction;
import in.orderflow.domain.invalidation.InvalidationEvent;
import in.orderflow.domain.invalidation.InvalidationPolicyType;
import in.orderflow.domain.invalidation.ObjectiveKpis;
import in.orderflow.domain.signal.Signal;
import in.orderflow.domain.trade.ExitReason;
import in.orderflow.domain.trade.Position;
import in.orderflow.service.signal.SignalBarCache;
import in.orderflow.service.trade.PositionLedger;
import in.orderflow.util.BoundedLinkedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Invalidation Evaluator - re-scores every open position after each input.
 *
 * FLOW:
 * 1. Pick the policy for the pass (objective when enabled, else legacy)
 * 2. Capture entry references for positions seen for the first time
 * 3. Score each position in ledger order, keep emitted events (newest 240)
 * 4. Apply queued auto-closes after the pass, so the ledger is not mutated mid-iteration
 *
 * Manual actions on events go through {@link #applyAction}.
 */
public final class InvalidationEvaluator {
    private static final Logger log = LoggerFactory.getLogger(InvalidationEvaluator.class);

    public static final int MAX_EVENTS = 240;
    private static final double REDUCE_FRACTION = 0.5;

    private final SignalBarCache cache;
    private final LegacyInvalidationPolicy legacy = new LegacyInvalidationPolicy();
    private final ObjectiveInvalidationPolicy objective = new ObjectiveInvalidationPolicy();

    private final Map<String, PositionMeta> metas = new HashMap<>();
    private final BoundedLinkedMap<String, InvalidationEvent> events = new BoundedLinkedMap<>(MAX_EVENTS);
    private long sequence;

    public InvalidationEvaluator(SignalBarCache cache) {
        this.cache = cache;
    }

    /**
     * Capture entry references for a position that just filled.
     *
     * @return the position, with its entry bar index filled in when it had none
     */
    public Position onPositionOpened(Position position) {
        return initializeMeta(position, cache.bars());
    }

    /**
     * Drop the position's bookkeeping and settle its events.
     */
    public void onPositionClosed(String positionId, ExitReason reason) {
        metas.remove(positionId);
        boolean byInvalidation = reason == ExitReason.INVALIDATION;
        for (InvalidationEvent event : events.values()) {
            if (event.positionId().equals(positionId)) {
                events.put(event.id(), event.positionClosed(byInvalidation));
            }
        }
    }

    /**
     * Score every open position.
     *
     * @return events emitted by this pass, in emission order
     */
    public List<InvalidationEvent> evaluate(EvaluationContext context, PositionLedger ledger) {
        List<Position> positions = ledger.positions();
        if (positions.isEmpty()) {
            return List.of();
        }

        InvalidationPolicy policy = context.settings().objectiveInvalidation().enabled() ? objective : legacy;
        List<InvalidationEvent> emitted = new ArrayList<>();
        List<InvalidationEvent> autoCloseQueue = new ArrayList<>();

        for (Position original : positions) {
            Position position = initializeMeta(original, context.bars());
            if (position != original) {
                ledger.update(position);
            }
            PositionMeta meta = metas.get(position.id());

            String eventId = position.id() + "-" + context.now() + "-" + (++sequence);
            Optional<InvalidationEvent> event = policy.evaluate(position, meta, context, eventId);
            if (event.isEmpty()) {
                continue;
            }
            store(event.get());
            emitted.add(event.get());
            if (event.get().autoClosed()) {
                autoCloseQueue.add(event.get());
            }
        }

        for (InvalidationEvent event : autoCloseQueue) {
            ledger.flatten(event.positionId(), event.price(), ExitReason.INVALIDATION);
            events.get(event.id()).ifPresent(current -> events.put(current.id(), current.resolveAutoClosed()));
            if (event.policy() == InvalidationPolicyType.OBJECTIVE) {
                objective.recordAutoClose();
            }
            log.info("Auto-closed {} on invalidation {} (score {})", event.positionId(), event.id(), event.score());
        }
        return emitted;
    }

    /**
     * Act on an event.
     *
     * {@code hold} resolves an open event and is a no-op on a resolved one. The other actions resolve it only
     * when the ledger mutation succeeded (the position exists, the stop is
     * actually tighter, ...).
     *
     * @return false for an unknown event or a no-op action
     */
    public boolean applyAction(String eventId, InvalidationAction action, PositionLedger ledger) {
        Optional<InvalidationEvent> found = events.get(eventId);
        if (found.isEmpty() || action == null) {
            return false;
        }
        InvalidationEvent event = found.get();
        String positionId = event.positionId();

        boolean changed = switch (action) {
            case CLOSE -> ledger.flatten(positionId, null, ExitReason.INVALIDATION);
            case REDUCE -> ledger.reduce(positionId, REDUCE_FRACTION);
            case TIGHTEN_STOP -> ledger.tightenStop(positionId);
            case HOLD -> !event.resolved();
        };
        if (!changed) {
            log.debug("Action {} on {} changed nothing", action.code(), eventId);
            return false;
        }

        boolean stillOpen = ledger.isOpen(positionId);
        InvalidationAction taken = action == InvalidationAction.REDUCE && !stillOpen
            ? InvalidationAction.CLOSE
            : action;
        // re-read: a close may already have settled the event through the close hook
        InvalidationEvent current = events.get(eventId).orElse(event);
        events.put(eventId, current.resolve(taken, action != InvalidationAction.CLOSE && stillOpen));
        log.info("Invalidation {} resolved with {} (position open={})", eventId, taken.code(), stillOpen);
        return true;
    }

    public List<InvalidationEvent> events() {
        return events.values();
    }

    public Optional<InvalidationEvent> event(String id) {
        return events.get(id);
    }

    public ObjectiveKpis objectiveKpis() {
        return objective.kpis();
    }

    int trackedPositions() {
        return metas.size();
    }

    private void store(InvalidationEvent event) {
        events.put(event.id(), event);
        events.evictOverflow(id -> false);
    }

    /**
     * Entry references are set once, from the bar containing the fill time
     * (or the latest bar), and the signal's score.
     */
    private Position initializeMeta(Position position, List<FootprintBar> bars) {
        PositionMeta meta = metas.computeIfAbsent(position.id(), id -> new PositionMeta());
        SignalBarCache.BarLookup lookup = SignalBarCache.findBarForTime(bars, position.entryTime());

        if (lookup.found()) {
            FootprintBar bar = lookup.bar();
            if (meta.entryBarTime == null) {
                meta.entryBarTime = bar.startTime();
            }
            if (meta.entryCumDelta == null) {
                meta.entryCumDelta = bar.cumulativeDelta();
            }
            if (meta.entryPoc == null) {
                meta.entryPoc = bar.pocPrice();
            }
        }
        if (meta.entrySignalScore == null) {
            meta.entrySignalScore = cache.signal(position.signalId()).map(Signal::score).orElse(null);
        }

        if (lookup.found() && position.entryBarIndex() < 0) {
            return position.toBuilder().entryBarIndex(lookup.index()).build();
        }
        return position;
    }
}
