package in.orderflow.service.invalidation;

import in.orderflow.config.TradingSettings;
import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.signal.Signal;
import in.orderflow.service.signal.SignalBarCache;

import java.util.List;

/**
 * Inputs shared by every position in one evaluation pass.
 *
 * @param signals signals that are new in this pass (empty unless reason is SIGNAL)
 * @param bars    the cached bar window, oldest first
 */
public record EvaluationContext(
    long now,
    EvaluationReason reason,
    List<Signal> signals,
    List<FootprintBar> bars,
    TradingSettings settings,
    double priceStep,
    long timeframeMs
) {
    public EvaluationContext {
        signals = signals == null ? List.of() : List.copyOf(signals);
        bars = bars == null ? List.of() : List.copyOf(bars);
    }

    public SignalBarCache.BarLookup findBarForTime(long timestamp) {
        return SignalBarCache.findBarForTime(bars, timestamp);
    }

    public List<FootprintBar> lastBars(int count) {
        if (count <= 0 || bars.isEmpty()) {
            return List.of();
        }
        return bars.subList(Math.max(0, bars.size() - count), bars.size());
    }

    public FootprintBar latestBar() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }
}
