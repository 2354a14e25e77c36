package in.orderflow.domain.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Volume traded at one price inside a footprint bar.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LevelBin(
    @JsonProperty("price") double price,
    @JsonProperty("askVol") double askVol,
    @JsonProperty("bidVol") double bidVol,
    @JsonProperty("delta") double delta,
    @JsonProperty("totalVolume") double totalVolume
) {
    public static LevelBin of(double price, double askVol, double bidVol) {
        return new LevelBin(price, askVol, bidVol, askVol - bidVol, askVol + bidVol);
    }
}
