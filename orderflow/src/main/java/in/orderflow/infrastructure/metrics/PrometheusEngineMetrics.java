package in.orderflow.infrastructure.metrics;

import in.orderflow.domain.invalidation.InvalidationAction;
import in.orderflow.domain.invalidation.InvalidationEvent;
import in.orderflow.domain.risk.GuardrailSource;
import in.orderflow.domain.risk.GuardrailStatus;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.trade.ClosedTrade;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - orderflow_pending_created_total{side, mode} - Pending orders by side and manual/auto
 * - orderflow_entries_blocked_total{source} - Guardrail denials
 * - orderflow_trades_closed_total{reason, result} - Closed trades
 * - orderflow_trade_realized_r - Realized R distribution
 * - orderflow_invalidation_events_total{policy, severity} - Invalidation events
 * - orderflow_guardrail_status - 0=ok, 1=limited, 2=cooldown, 3=locked
 *
 * Usage:
 * <pre>
 * PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(new CollectorRegistry());
 * TradingEngine engine = TradingEngine.builder().metrics(metrics).build();
 * String exposition = metrics.scrape();
 * </pre>
 */
public class PrometheusEngineMetrics implements EngineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEngineMetrics.class);

    private final CollectorRegistry registry;

    // Order flow
    private final Counter pendingCreated;
    private final Counter entriesBlocked;
    private final Counter fills;

    // Exits
    private final Counter tradesClosed;
    private final Histogram realizedR;

    // Invalidation
    private final Counter invalidationEvents;
    private final Counter invalidationActions;

    // State
    private final Gauge pendingOrders;
    private final Gauge openPositions;
    private final Gauge stateVersion;
    private final Gauge guardrailStatus;
    private final Gauge dailyNetR;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.pendingCreated = Counter.build()
            .name("orderflow_pending_created_total")
            .help("Total number of pending orders created from signals")
            .labelNames("side", "mode")
            .register(registry);

        this.entriesBlocked = Counter.build()
            .name("orderflow_entries_blocked_total")
            .help("Total number of entries denied by risk guardrails")
            .labelNames("source")
            .register(registry);

        this.fills = Counter.build()
            .name("orderflow_fills_total")
            .help("Total number of pending orders filled")
            .labelNames("side")
            .register(registry);

        this.tradesClosed = Counter.build()
            .name("orderflow_trades_closed_total")
            .help("Total number of closed positions")
            .labelNames("reason", "result")
            .register(registry);

        this.realizedR = Histogram.build()
            .name("orderflow_trade_realized_r")
            .help("Realized R multiple per closed trade")
            .buckets(-3, -2, -1, -0.5, 0, 0.5, 1, 2, 3)
            .register(registry);

        this.invalidationEvents = Counter.build()
            .name("orderflow_invalidation_events_total")
            .help("Total number of invalidation events emitted")
            .labelNames("policy", "severity")
            .register(registry);

        this.invalidationActions = Counter.build()
            .name("orderflow_invalidation_actions_total")
            .help("Total number of actions applied to invalidation events")
            .labelNames("action")
            .register(registry);

        this.pendingOrders = Gauge.build()
            .name("orderflow_pending_orders")
            .help("Current number of pending orders")
            .register(registry);

        this.openPositions = Gauge.build()
            .name("orderflow_open_positions")
            .help("Current number of open positions")
            .register(registry);

        this.stateVersion = Gauge.build()
            .name("orderflow_state_version")
            .help("Current engine state version")
            .register(registry);

        this.guardrailStatus = Gauge.build()
            .name("orderflow_guardrail_status")
            .help("Guardrail status (0=ok, 1=limited, 2=cooldown, 3=locked)")
            .register(registry);

        this.dailyNetR = Gauge.build()
            .name("orderflow_daily_net_r")
            .help("Net realized R for the current trading day")
            .register(registry);

        log.info("[PrometheusEngineMetrics] Initialized");
    }

    @Override
    public void recordPendingCreated(TradeSide side, boolean auto) {
        pendingCreated.labels(side.code(), auto ? "auto" : "manual").inc();
    }

    @Override
    public void recordEntryBlocked(GuardrailSource source) {
        entriesBlocked.labels(source.code()).inc();
    }

    @Override
    public void recordFill(TradeSide side) {
        fills.labels(side.code()).inc();
    }

    @Override
    public void recordTradeClosed(ClosedTrade trade) {
        tradesClosed.labels(trade.exitReason().code(), trade.result().code()).inc();
        realizedR.observe(trade.realizedR());
    }

    @Override
    public void recordInvalidationEvent(InvalidationEvent event) {
        invalidationEvents.labels(event.policy().code(), event.severity().code()).inc();
    }

    @Override
    public void recordInvalidationAction(InvalidationAction action) {
        invalidationActions.labels(action.code()).inc();
    }

    @Override
    public void updateBook(int pending, int open, long version) {
        pendingOrders.set(pending);
        openPositions.set(open);
        stateVersion.set(version);
    }

    @Override
    public void updateGuardrailStatus(GuardrailStatus status) {
        guardrailStatus.set(status.ordinal());
    }

    @Override
    public void updateDailyNetR(double netR) {
        dailyNetR.set(netR);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    /**
     * Current metrics in Prometheus text format (0.0.4).
     */
    public String scrape() {
        try {
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export metrics", e);
        }
    }
}
