package in.orderflow.service.invalidation;

import in.orderflow.domain.invalidation.EvidenceItem;
import in.orderflow.domain.invalidation.InvalidationTrigger;

import java.util.List;

/**
 * One trigger that fired for a position, before weighting.
 *
 * @param markerPrice chart marker; null falls back to the position's last price
 */
public record TriggerResult(
    InvalidationTrigger trigger,
    double severity,
    List<EvidenceItem> evidence,
    Double markerPrice,
    Long barTime,
    Integer barIndex
) {
    public TriggerResult {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
