package in.orderflow.infrastructure.metrics;

import in.orderflow.domain.invalidation.InvalidationAction;
import in.orderflow.domain.risk.GuardrailSource;
import in.orderflow.domain.risk.GuardrailStatus;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.signal.TradingSession;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static in.orderflow.Fixtures.BASE_TIMESTAMP;
import static in.orderflow.Fixtures.closedTrade;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PrometheusEngineMetrics.
 *
 * Tests:
 * - Counters carry their labels
 * - Gauges reflect the last update
 * - Text exposition contains every family
 */
class PrometheusEngineMetricsTest {

    private CollectorRegistry registry;
    private PrometheusEngineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusEngineMetrics(registry);
    }

    private Double sample(String name, String[] labelNames, String[] labelValues) {
        return registry.getSampleValue(name, labelNames, labelValues);
    }

    @Test
    void testCountersByLabel() {
        metrics.recordPendingCreated(TradeSide.LONG, true);
        metrics.recordPendingCreated(TradeSide.LONG, true);
        metrics.recordPendingCreated(TradeSide.SHORT, false);
        metrics.recordEntryBlocked(GuardrailSource.COOLDOWN);
        metrics.recordInvalidationAction(InvalidationAction.TIGHTEN_STOP);

        assertEquals(2.0, sample("orderflow_pending_created_total",
            new String[]{"side", "mode"}, new String[]{"long", "auto"}));
        assertEquals(1.0, sample("orderflow_pending_created_total",
            new String[]{"side", "mode"}, new String[]{"short", "manual"}));
        assertEquals(1.0, sample("orderflow_entries_blocked_total",
            new String[]{"source"}, new String[]{"cooldown"}));
        assertEquals(1.0, sample("orderflow_invalidation_actions_total",
            new String[]{"action"}, new String[]{InvalidationAction.TIGHTEN_STOP.code()}));
    }

    @Test
    void testClosedTradesAndRealizedR() {
        metrics.recordTradeClosed(closedTrade("t1", -1, BASE_TIMESTAMP, TradingSession.US));
        metrics.recordTradeClosed(closedTrade("t2", 2, BASE_TIMESTAMP, TradingSession.US));

        assertEquals(1.0, sample("orderflow_trades_closed_total",
            new String[]{"reason", "result"}, new String[]{"stop", "loss"}));
        assertEquals(1.0, sample("orderflow_trades_closed_total",
            new String[]{"reason", "result"}, new String[]{"tp2", "win"}));
        assertEquals(2.0, registry.getSampleValue("orderflow_trade_realized_r_count"));
        assertEquals(1.0, registry.getSampleValue("orderflow_trade_realized_r_sum"), 1e-12);
    }

    @Test
    void testGaugesKeepLastValue() {
        metrics.updateBook(3, 1, 7);
        metrics.updateBook(2, 2, 9);
        metrics.updateGuardrailStatus(GuardrailStatus.COOLDOWN);
        metrics.updateDailyNetR(-1.5);

        assertEquals(2.0, registry.getSampleValue("orderflow_pending_orders"));
        assertEquals(2.0, registry.getSampleValue("orderflow_open_positions"));
        assertEquals(9.0, registry.getSampleValue("orderflow_state_version"));
        assertEquals(2.0, registry.getSampleValue("orderflow_guardrail_status"));
        assertEquals(-1.5, registry.getSampleValue("orderflow_daily_net_r"));
    }

    @Test
    void testScrapeContainsFamilies() {
        metrics.recordFill(TradeSide.SHORT);

        String text = metrics.scrape();

        assertTrue(text.contains("orderflow_fills_total{side=\"short\",} 1.0"), text);
        assertTrue(text.contains("orderflow_guardrail_status"));
        assertTrue(text.contains("orderflow_trade_realized_r_bucket"));
        assertSame(registry, metrics.getRegistry());
    }
}
