package in.orderflow.domain.trade;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.signal.TradingSession;

/**
 * Limit order waiting for price to retest the signal entry.
 *
 * Keyed by signal id. Destroyed on fill, expiry or manual cancel.
 */
public record PendingTrade(
    @JsonProperty("id") String id,
    @JsonProperty("signalId") String signalId,
    @JsonProperty("side") TradeSide side,
    @JsonProperty("strategy") SignalStrategy strategy,
    @JsonProperty("session") TradingSession session,
    @JsonProperty("entry") double entry,
    @JsonProperty("stop") double stop,
    @JsonProperty("target1") double target1,
    @JsonProperty("target2") double target2,
    @JsonProperty("createdAt") long createdAt,
    @JsonProperty("expiresAt") long expiresAt,
    @JsonProperty("entryType") String entryType,
    @JsonProperty("auto") boolean auto,
    @JsonProperty("barIndex") int barIndex
) {
    public static final String ENTRY_TYPE_TOUCH = "touch";

    public double riskPerUnit() {
        return Math.abs(entry - stop);
    }
}
