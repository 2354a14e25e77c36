package in.orderflow.domain.signal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Detected trade setup.
 *
 * Signals are owned by the detectors; the engine only caches and reads them.
 * {@code strategies} lists every setup that fired on the same bar (confluence),
 * {@code target1}/{@code target2} may be null when the detector offers none.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Signal(
    @JsonProperty("id") String id,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("barTime") long barTime,
    @JsonProperty("barIndex") int barIndex,
    @JsonProperty("price") double price,
    @JsonProperty("side") TradeSide side,
    @JsonProperty("strategy") SignalStrategy strategy,
    @JsonProperty("strategies") List<SignalStrategy> strategies,
    @JsonProperty("entry") double entry,
    @JsonProperty("stop") double stop,
    @JsonProperty("target1") Double target1,
    @JsonProperty("target2") Double target2,
    @JsonProperty("score") double score,
    @JsonProperty("session") TradingSession session,
    @JsonProperty("levelLabel") String levelLabel,
    @JsonProperty("evidence") List<String> evidence,
    @JsonProperty("l2") DepthConfirmation depthConfirmation
) {
    public Signal {
        strategies = strategies == null ? List.of(strategy) : List.copyOf(strategies);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        if (session == null) {
            session = TradingSession.OTHER;
        }
    }

    /**
     * True when more than one setup agreed on this signal.
     */
    public boolean hasConfluence() {
        return strategies.size() >= 2;
    }

    /**
     * Minimal signal for callers that have no detector metadata.
     */
    public static Signal of(String id, long timestamp, int barIndex, TradeSide side, SignalStrategy strategy,
                            double entry, double stop, Double target1, double score, TradingSession session) {
        return new Signal(id, timestamp, timestamp, barIndex, entry, side, strategy, List.of(strategy),
            entry, stop, target1, null, score, session, null, List.of(), null);
    }
}
