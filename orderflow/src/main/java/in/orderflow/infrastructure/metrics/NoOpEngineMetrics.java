package in.orderflow.infrastructure.metrics;

import in.orderflow.domain.invalidation.InvalidationAction;
import in.orderflow.domain.invalidation.InvalidationEvent;
import in.orderflow.domain.risk.GuardrailSource;
import in.orderflow.domain.risk.GuardrailStatus;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.trade.ClosedTrade;

/**
 * Metrics sink used when the host wires no registry.
 */
public final class NoOpEngineMetrics implements EngineMetrics {

    public static final NoOpEngineMetrics INSTANCE = new NoOpEngineMetrics();

    private NoOpEngineMetrics() {}

    @Override
    public void recordPendingCreated(TradeSide side, boolean auto) {}

    @Override
    public void recordEntryBlocked(GuardrailSource source) {}

    @Override
    public void recordFill(TradeSide side) {}

    @Override
    public void recordTradeClosed(ClosedTrade trade) {}

    @Override
    public void recordInvalidationEvent(InvalidationEvent event) {}

    @Override
    public void recordInvalidationAction(InvalidationAction action) {}

    @Override
    public void updateBook(int pending, int open, long version) {}

    @Override
    public void updateGuardrailStatus(GuardrailStatus status) {}

    @Override
    public void updateDailyNetR(double netR) {}
}
