package in.orderflow.domain.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-session counters for the current day.
 */
public record SessionStats(
    @JsonProperty("trades") int trades,
    @JsonProperty("netR") double netR,
    @JsonProperty("losses") int losses
) {
    public static final SessionStats EMPTY = new SessionStats(0, 0, 0);

    public SessionStats record(double realizedR, boolean loss) {
        return new SessionStats(trades + 1, netR + realizedR, loss ? losses + 1 : losses);
    }
}
