package in.orderflow.domain.data;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Passive liquidity that kept refilling at one price while being hit.
 *
 * @param side "bid" or "ask", the resting side that absorbed
 */
public record AbsorptionEvent(
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("side") String side,
    @JsonProperty("price") double price,
    @JsonProperty("size") double size
) {}
