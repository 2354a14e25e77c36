package in.orderflow.domain.signal;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.domain.data.AbsorptionEvent;
import in.orderflow.domain.data.SpoofEvent;
import in.orderflow.domain.data.SweepEvent;

/**
 * Order-book (L2) confirmation attached to a signal by the depth analytics.
 */
public record DepthConfirmation(
    @JsonProperty("confirmed") boolean confirmed,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reason") String reason,
    @JsonProperty("absorption") AbsorptionEvent absorption,
    @JsonProperty("sweep") SweepEvent sweep,
    @JsonProperty("spoof") SpoofEvent spoof
) {}
