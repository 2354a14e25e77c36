package in.orderflow.application.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.config.TradingSettings;
import in.orderflow.domain.trade.ClosedTrade;

import java.util.List;

/**
 * What the host stores durably: settings plus the full trade history.
 * Feeding it back through {@link TradingEngine.Builder} reconstructs the engine's history.
 */
public record TradingPersistenceSnapshot(
    @JsonProperty("settings") TradingSettings settings,
    @JsonProperty("history") List<ClosedTrade> history
) {
    public TradingPersistenceSnapshot {
        if (settings == null) {
            settings = TradingSettings.defaults();
        }
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static TradingPersistenceSnapshot empty() {
        return new TradingPersistenceSnapshot(TradingSettings.defaults(), List.of());
    }
}
