package in.orderflow.domain.risk;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.domain.signal.TradingSession;

/**
 * Active reason to refuse new entries. {@code session} is null for blocks that apply to every session.
 */
public record GuardrailBlock(
    @JsonProperty("source") GuardrailSource source,
    @JsonProperty("reason") String reason,
    @JsonProperty("until") Long until,
    @JsonProperty("session") TradingSession session
) {
    public boolean appliesTo(TradingSession signalSession) {
        return session == null || session == signalSession;
    }
}
