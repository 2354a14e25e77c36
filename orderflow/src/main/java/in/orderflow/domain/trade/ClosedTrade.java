package in.orderflow.domain.trade;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.signal.TradingSession;

/**
 * Fully closed position. {@code exitPrice} is the exit fill (after slippage);
 * {@code day} is the UTC day of the exit (yyyy-MM-dd).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClosedTrade(
    @JsonProperty("id") String id,
    @JsonProperty("signalId") String signalId,
    @JsonProperty("side") TradeSide side,
    @JsonProperty("strategy") SignalStrategy strategy,
    @JsonProperty("session") TradingSession session,
    @JsonProperty("entryPrice") double entryPrice,
    @JsonProperty("entryFillPrice") double entryFillPrice,
    @JsonProperty("exitPrice") double exitPrice,
    @JsonProperty("entryTime") long entryTime,
    @JsonProperty("exitTime") long exitTime,
    @JsonProperty("holdMinutes") double holdMinutes,
    @JsonProperty("firstHit") FirstHit firstHit,
    @JsonProperty("exitReason") ExitReason exitReason,
    @JsonProperty("result") TradeResult result,
    @JsonProperty("realizedPnl") double realizedPnl,
    @JsonProperty("realizedR") double realizedR,
    @JsonProperty("feesPaid") double feesPaid,
    @JsonProperty("mfe") double mfe,
    @JsonProperty("mae") double mae,
    @JsonProperty("day") String day
) {}
