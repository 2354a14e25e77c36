package in.orderflow.domain.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Order-book statistics aggregated over one bar by the depth analytics.
 *
 * OFI is order-flow imbalance: positive values mean bid-side pressure.
 * Replenishment values measure how fast the best level refilled after being hit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DepthBarMetrics(
    @JsonProperty("avgOfi") double avgOfi,
    @JsonProperty("netOfi") double netOfi,
    @JsonProperty("maxImbalance") double maxImbalance,
    @JsonProperty("minImbalance") double minImbalance,
    @JsonProperty("bestBid") Double bestBid,
    @JsonProperty("bestAsk") Double bestAsk,
    @JsonProperty("bestBidSize") double bestBidSize,
    @JsonProperty("bestAskSize") double bestAskSize,
    @JsonProperty("bidQueueDelta") double bidQueueDelta,
    @JsonProperty("askQueueDelta") double askQueueDelta,
    @JsonProperty("maxReplenishmentBid") double maxReplenishmentBid,
    @JsonProperty("maxReplenishmentAsk") double maxReplenishmentAsk,
    @JsonProperty("absorptions") List<AbsorptionEvent> absorptions,
    @JsonProperty("sweeps") List<SweepEvent> sweeps,
    @JsonProperty("spoofEvents") List<SpoofEvent> spoofEvents
) {
    public DepthBarMetrics {
        absorptions = absorptions == null ? List.of() : List.copyOf(absorptions);
        sweeps = sweeps == null ? List.of() : List.copyOf(sweeps);
        spoofEvents = spoofEvents == null ? List.of() : List.copyOf(spoofEvents);
    }

    /**
     * Flow-only metrics: OFI and best-level replenishment, no book snapshot or events.
     */
    public static DepthBarMetrics ofFlow(double netOfi, double maxReplenishmentBid, double maxReplenishmentAsk,
                                         List<SweepEvent> sweeps) {
        return new DepthBarMetrics(netOfi, netOfi, 0, 0, null, null, 0, 0, 0, 0,
            maxReplenishmentBid, maxReplenishmentAsk, List.of(), sweeps, List.of());
    }
}
