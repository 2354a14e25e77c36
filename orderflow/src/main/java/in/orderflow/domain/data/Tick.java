package in.orderflow.domain.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * Single execution print from the exchange trade stream.
 *
 * @param buyerMaker true when the buyer was the resting side (seller aggressed)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Tick(
    @JsonProperty("tradeId") long tradeId,
    @JsonProperty("price") double price,
    @JsonProperty("quantity") double quantity,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("isBuyerMaker") boolean buyerMaker
) {
    /**
     * Exchange order: timestamp, then trade id for prints sharing a timestamp.
     */
    public static final Comparator<Tick> EXCHANGE_ORDER =
        Comparator.comparingLong(Tick::timestamp).thenComparingLong(Tick::tradeId);

    public static Tick of(long tradeId, double price, long timestamp) {
        return new Tick(tradeId, price, 1.0, timestamp, false);
    }
}
