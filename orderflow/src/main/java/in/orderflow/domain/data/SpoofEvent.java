package in.orderflow.domain.data;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Large resting order pulled before it could trade.
 */
public record SpoofEvent(
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("side") String side,
    @JsonProperty("price") double price,
    @JsonProperty("size") double size
) {}
