package in.orderflow.service.invalidation;

import in.orderflow.domain.invalidation.InvalidationEvent;
import in.orderflow.domain.invalidation.InvalidationPolicyType;
import in.orderflow.domain.trade.Position;

import java.util.Optional;

/**
 * Scoring strategy for open positions. Implementations may keep per-position
 * state in {@link PositionMeta} but never touch the ledger.
 */
interface InvalidationPolicy {

    InvalidationPolicyType type();

    /**
     * @param eventId id to give the event if one is emitted
     */
    Optional<InvalidationEvent> evaluate(Position position, PositionMeta meta, EvaluationContext context,
                                         String eventId);
}
