package in.orderflow.domain.monitoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate over a set of closed trades.
 *
 * Rates are fractions (0-1). {@code avgLoss} is reported as a positive R magnitude.
 */
public record SummaryStats(
    @JsonProperty("trades") int trades,
    @JsonProperty("wins") int wins,
    @JsonProperty("losses") int losses,
    @JsonProperty("breakeven") int breakeven,
    @JsonProperty("netR") double netR,
    @JsonProperty("netPercent") double netPercent,
    @JsonProperty("avgR") double avgR,
    @JsonProperty("winRate") double winRate,
    @JsonProperty("lossRate") double lossRate,
    @JsonProperty("avgWin") double avgWin,
    @JsonProperty("avgLoss") double avgLoss,
    @JsonProperty("expectancy") double expectancy
) {
    public static final SummaryStats EMPTY = new SummaryStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
}
