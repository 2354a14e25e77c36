package in.orderflow.domain.risk;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.domain.signal.TradingSession;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the guardrail state machine.
 *
 * @param lossUntil      loss-streak cooldown deadline, null when inactive
 * @param dailyStopUntil daily-stop cooldown deadline, null when inactive
 */
public record RiskGuardrailState(
    @JsonProperty("status") GuardrailStatus status,
    @JsonProperty("day") String day,
    @JsonProperty("resetAt") long resetAt,
    @JsonProperty("tradesToday") int tradesToday,
    @JsonProperty("netRToday") double netRToday,
    @JsonProperty("consecutiveLosses") int consecutiveLosses,
    @JsonProperty("sessionStats") Map<TradingSession, SessionStats> sessionStats,
    @JsonProperty("activeBlocks") List<GuardrailBlock> activeBlocks,
    @JsonProperty("lossUntil") Long lossUntil,
    @JsonProperty("dailyStopUntil") Long dailyStopUntil,
    @JsonProperty("lastBlock") LastBlock lastBlock,
    @JsonProperty("logs") List<GuardrailLogEntry> logs
) {}
