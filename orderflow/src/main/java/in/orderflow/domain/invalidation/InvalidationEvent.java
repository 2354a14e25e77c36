package in.orderflow.domain.invalidation;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.signal.TradingSession;

import java.util.List;

/**
 * Scored verdict that an open position's thesis is weakening.
 *
 * Events are immutable; resolution produces a copy. {@code price} is the
 * chart marker of the primary trigger. {@code printsScore}/{@code depthScore}
 * are only set by the objective policy.
 */
public record InvalidationEvent(
    @JsonProperty("id") String id,
    @JsonProperty("positionId") String positionId,
    @JsonProperty("positionSide") TradeSide positionSide,
    @JsonProperty("strategy") SignalStrategy strategy,
    @JsonProperty("policy") InvalidationPolicyType policy,
    @JsonProperty("triggerId") InvalidationTrigger trigger,
    @JsonProperty("triggerLabel") String triggerLabel,
    @JsonProperty("triggers") List<TriggerScore> triggers,
    @JsonProperty("score") int score,
    @JsonProperty("severity") InvalidationSeverity severity,
    @JsonProperty("evidence") List<EvidenceItem> evidence,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("recommendedAction") InvalidationAction recommendedAction,
    @JsonProperty("actions") List<InvalidationAction> actions,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("session") TradingSession session,
    @JsonProperty("price") double price,
    @JsonProperty("barTime") Long barTime,
    @JsonProperty("barIndex") Integer barIndex,
    @JsonProperty("autoClosed") boolean autoClosed,
    @JsonProperty("resolved") boolean resolved,
    @JsonProperty("actionTaken") InvalidationAction actionTaken,
    @JsonProperty("positionOpen") boolean positionOpen,
    @JsonProperty("winnerProtected") boolean winnerProtected,
    @JsonProperty("printsScore") Double printsScore,
    @JsonProperty("depthScore") Double depthScore
) {
    public InvalidationEvent {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * Mark resolved by an explicit action.
     */
    public InvalidationEvent resolve(InvalidationAction action, boolean stillOpen) {
        return new InvalidationEvent(id, positionId, positionSide, strategy, policy, trigger, triggerLabel,
            triggers, score, severity, evidence, recommendation, recommendedAction, actions, timestamp, session,
            price, barTime, barIndex, autoClosed, true, action, stillOpen, winnerProtected, printsScore,
            depthScore);
    }

    /**
     * Mark resolved by the engine's auto-close.
     */
    public InvalidationEvent resolveAutoClosed() {
        return new InvalidationEvent(id, positionId, positionSide, strategy, policy, trigger, triggerLabel,
            triggers, score, severity, evidence, recommendation, recommendedAction, actions, timestamp, session,
            price, barTime, barIndex, true, true, InvalidationAction.CLOSE, false, winnerProtected, printsScore,
            depthScore);
    }

    /**
     * The position went away for another reason. Unresolved events are settled
     * as {@code close} when the exit was an invalidation, otherwise {@code hold}.
     */
    public InvalidationEvent positionClosed(boolean closedByInvalidation) {
        InvalidationAction taken = actionTaken;
        if (!resolved && taken == null) {
            taken = closedByInvalidation ? InvalidationAction.CLOSE : InvalidationAction.HOLD;
        }
        return new InvalidationEvent(id, positionId, positionSide, strategy, policy, trigger, triggerLabel,
            triggers, score, severity, evidence, recommendation, recommendedAction, actions, timestamp, session,
            price, barTime, barIndex, autoClosed, true, taken, false, winnerProtected, printsScore,
            depthScore);
    }
}
