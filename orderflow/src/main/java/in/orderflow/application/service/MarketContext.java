package in.orderflow.application.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Instrument and chart parameters the engine prices against.
 *
 * @param priceStep   tick size; non-positive values fall back to {@link #DEFAULT_PRICE_STEP}
 * @param timeframeMs bar duration; non-positive values fall back to one minute
 */
public record MarketContext(
    @JsonProperty("priceStep") double priceStep,
    @JsonProperty("timeframeMs") long timeframeMs
) {
    public static final double DEFAULT_PRICE_STEP = 0.1;
    public static final long DEFAULT_TIMEFRAME_MS = 60_000L;

    public MarketContext {
        if (!(priceStep > 0) || !Double.isFinite(priceStep)) {
            priceStep = DEFAULT_PRICE_STEP;
        }
        if (timeframeMs <= 0) {
            timeframeMs = DEFAULT_TIMEFRAME_MS;
        }
    }

    public static MarketContext defaults() {
        return new MarketContext(DEFAULT_PRICE_STEP, DEFAULT_TIMEFRAME_MS);
    }
}
