package in.orderflow.service.invalidation;

import in.orderflow.domain.invalidation.InvalidationSeverity;
import in.orderflow.domain.invalidation.InvalidationTrigger;

import java.util.List;

/**
 * Evaluator bookkeeping for one open position. Created at fill, discarded on close.
 *
 * Entry references are captured once from the bar that contained the fill and
 * never overwritten.
 */
final class PositionMeta {
    Long entryBarTime;
    Double entryCumDelta;
    Double entryPoc;
    Double entrySignalScore;

    long lastInvalidationAt;
    int lastScore;
    List<InvalidationTrigger> lastTriggers = List.of();

    // objective policy
    Long persistenceStart;
    int persistenceBars;
    long persistenceLastBarEnd;
    InvalidationSeverity activeTier;
    double lastPrintsScore;
    double lastDepthScore;

    void resetPersistence() {
        persistenceStart = null;
        persistenceBars = 0;
        persistenceLastBarEnd = 0;
    }
}
