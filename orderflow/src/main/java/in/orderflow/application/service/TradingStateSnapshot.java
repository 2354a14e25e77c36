package in.orderflow.application.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.config.TradingSettings;
import in.orderflow.domain.invalidation.InvalidationEvent;
import in.orderflow.domain.invalidation.ObjectiveKpis;
import in.orderflow.domain.monitoring.DailyPerformance;
import in.orderflow.domain.risk.RiskGuardrailState;
import in.orderflow.domain.trade.ClosedTrade;
import in.orderflow.domain.trade.PendingTrade;
import in.orderflow.domain.trade.Position;

import java.util.List;

/**
 * Immutable view of everything the host renders.
 *
 * Lists are copies taken at snapshot time, oldest first.
 */
public record TradingStateSnapshot(
    @JsonProperty("version") long version,
    @JsonProperty("settings") TradingSettings settings,
    @JsonProperty("market") MarketContext market,
    @JsonProperty("clockOffsetMs") long clockOffsetMs,
    @JsonProperty("pending") List<PendingTrade> pending,
    @JsonProperty("positions") List<Position> positions,
    @JsonProperty("closed") List<ClosedTrade> closed,
    @JsonProperty("history") List<ClosedTrade> history,
    @JsonProperty("performance") DailyPerformance performance,
    @JsonProperty("invalidations") List<InvalidationEvent> invalidations,
    @JsonProperty("guardrails") RiskGuardrailState guardrails,
    @JsonProperty("objectiveKpis") ObjectiveKpis objectiveKpis
) {
    public TradingStateSnapshot {
        pending = List.copyOf(pending);
        positions = List.copyOf(positions);
        closed = List.copyOf(closed);
        history = List.copyOf(history);
        invalidations = List.copyOf(invalidations);
    }
}
