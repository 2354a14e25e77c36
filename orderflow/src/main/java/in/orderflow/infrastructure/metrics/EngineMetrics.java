package in.orderflow.infrastructure.metrics;

import in.orderflow.domain.invalidation.InvalidationAction;
import in.orderflow.domain.invalidation.InvalidationEvent;
import in.orderflow.domain.risk.GuardrailSource;
import in.orderflow.domain.risk.GuardrailStatus;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.trade.ClosedTrade;

/**
 * Engine metrics interface for monitoring replays and live simulation.
 *
 * Implementations can publish to Prometheus or anything else; the engine
 * only calls these hooks after a state change has been applied.
 *
 * Key metrics:
 * - Pending orders created, entries blocked by guardrails
 * - Fills and closed trades (by exit reason and result), realized R distribution
 * - Invalidation events (by policy and severity) and actions taken
 * - Book size, state version and guardrail status
 */
public interface EngineMetrics {

    /**
     * Record a pending order created from a signal.
     *
     * @param side Order side
     * @param auto Whether the engine took the signal on its own
     */
    void recordPendingCreated(TradeSide side, boolean auto);

    /**
     * Record an entry refused by the guardrails.
     *
     * @param source Block that denied the entry
     */
    void recordEntryBlocked(GuardrailSource source);

    void recordFill(TradeSide side);

    /**
     * Record a fully closed position.
     */
    void recordTradeClosed(ClosedTrade trade);

    void recordInvalidationEvent(InvalidationEvent event);

    void recordInvalidationAction(InvalidationAction action);

    /**
     * Update book gauges after a state change.
     *
     * @param pending Pending order count
     * @param open    Open position count
     * @param version Current state version
     */
    void updateBook(int pending, int open, long version);

    void updateGuardrailStatus(GuardrailStatus status);

    void updateDailyNetR(double netR);
}
