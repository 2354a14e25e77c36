package in.orderflow.domain.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Time bar with volume broken down per price level.
 *
 * Bars are produced by the aggregator and are immutable once closed.
 * {@code pocPrice} is null for an empty bar; {@code depth} is null when no
 * order-book feed was available.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FootprintBar(
    @JsonProperty("startTime") long startTime,
    @JsonProperty("endTime") long endTime,
    @JsonProperty("levels") List<LevelBin> levels,
    @JsonProperty("pocPrice") Double pocPrice,
    @JsonProperty("pocVolume") double pocVolume,
    @JsonProperty("totalDelta") double totalDelta,
    @JsonProperty("cumulativeDelta") double cumulativeDelta,
    @JsonProperty("totalVolume") double totalVolume,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("open") double open,
    @JsonProperty("close") double close,
    @JsonProperty("l2") DepthBarMetrics depth
) {
    public FootprintBar {
        levels = levels == null ? List.of() : List.copyOf(levels);
    }

    public boolean contains(long timestamp) {
        return timestamp >= startTime && timestamp <= endTime;
    }

    public FootprintBar withDepth(DepthBarMetrics metrics) {
        return new FootprintBar(startTime, endTime, levels, pocPrice, pocVolume, totalDelta, cumulativeDelta,
            totalVolume, high, low, open, close, metrics);
    }
}
