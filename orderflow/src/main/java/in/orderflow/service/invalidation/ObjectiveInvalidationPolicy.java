package in.orderflow.service.invalidation;

import in.orderflow.config.ObjectiveInvalidationSettings;
import in.orderflow.domain.data.DepthBarMetrics;
import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.data.SweepEvent;
import in.orderflow.domain.invalidation.EvidenceItem;
import in.orderflow.domain.invalidation.InvalidationAction;
import in.orderflow.domain.invalidation.InvalidationEvent;
import in.orderflow.domain.invalidation.InvalidationPolicyType;
import in.orderflow.domain.invalidation.InvalidationSeverity;
import in.orderflow.domain.invalidation.InvalidationTrigger;
import in.orderflow.domain.invalidation.ObjectiveKpis;
import in.orderflow.domain.invalidation.TriggerScore;
import in.orderflow.domain.trade.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static in.orderflow.service.invalidation.LegacyInvalidationPolicy.clamp;
import static in.orderflow.service.invalidation.LegacyInvalidationPolicy.fixed;

/**
 * Two-factor scorer: executed prints and order-book behaviour must both turn
 * against the position before anything is emitted.
 *
 * PIPELINE (per position, per pass):
 * <pre>
 *   prints score ─┐
 *                 ├─ double confirmation ─ persistence timer ─ grace ─ tier escalation ─ event
 *   depth score ──┘
 * </pre>
 *
 * Tiers only escalate: an event fires when the actionable tier is above the
 * position's active tier. The active tier decays through a hysteresis band so
 * a score oscillating around a threshold does not re-fire.
 */
final class ObjectiveInvalidationPolicy implements InvalidationPolicy {
    private static final Logger log = LoggerFactory.getLogger(ObjectiveInvalidationPolicy.class);

    private static final double COMPONENT_POINTS = 25;
    private static final double OFI_POINTS = 40;
    private static final double REPLENISHMENT_POINTS = 30;
    private static final double SWEEP_POINTS = 30;
    private static final double EPSILON = 1e-8;
    private static final double VOLUME_FLOOR = 1e-6;

    private long evaluations;
    private long doubleConfirmations;
    private long eventsEmitted;
    private long graceSuppressed;
    private long persistenceSuppressed;
    private long severeSweepOverrides;
    private long winnerProtectedCount;
    private long hysteresisResets;
    private long autoClosed;

    @Override
    public InvalidationPolicyType type() {
        return InvalidationPolicyType.OBJECTIVE;
    }

    @Override
    public Optional<InvalidationEvent> evaluate(Position position, PositionMeta meta, EvaluationContext context,
                                                String eventId) {
        ObjectiveInvalidationSettings settings = context.settings().objectiveInvalidation();
        evaluations++;

        List<FootprintBar> window = context.lastBars(settings.lookbackBars());
        if (window.isEmpty()) {
            return Optional.empty();
        }
        FootprintBar latest = window.get(window.size() - 1);
        long now = context.now();

        double prints = printsScore(position, meta, window);
        DepthScore depth = depthScore(position, window, now, settings);
        double combined = prints * settings.normalizedPrintsWeight() + depth.score() * settings.normalizedDepthWeight();
        meta.lastPrintsScore = prints;
        meta.lastDepthScore = depth.score();

        applyHysteresis(position, meta, combined, settings);

        boolean confirmed = prints >= settings.printsThreshold() && depth.score() >= settings.depthThreshold();
        if (!confirmed) {
            meta.resetPersistence();
            return Optional.empty();
        }
        doubleConfirmations++;

        if (meta.persistenceStart == null) {
            meta.persistenceStart = now;
            meta.persistenceBars = 0;
            meta.persistenceLastBarEnd = latest.endTime();
        } else if (latest.endTime() > meta.persistenceLastBarEnd) {
            meta.persistenceBars++;
            meta.persistenceLastBarEnd = latest.endTime();
        }

        InvalidationSeverity tier = tierFor(combined, settings);
        if (tier == null || !tier.isAbove(meta.activeTier)) {
            return Optional.empty();
        }

        boolean inGrace = now - position.entryTime() < settings.gracePeriodSeconds() * 1000;
        if (inGrace) {
            if (!depth.severeSweep()) {
                graceSuppressed++;
                log.debug("Position {} {} tier suppressed by grace period", position.id(), tier.code());
                return Optional.empty();
            }
            severeSweepOverrides++;
        }

        long heldMs = now - meta.persistenceStart;
        boolean persistent = heldMs >= settings.persistenceSeconds() * 1000
            || meta.persistenceBars >= settings.persistenceBars();
        if (!persistent) {
            persistenceSuppressed++;
            log.debug("Position {} {} tier waiting for persistence ({}ms, {} bars)", position.id(), tier.code(),
                heldMs, meta.persistenceBars);
            return Optional.empty();
        }

        boolean winnerProtected = isWinnerProtected(position, depth.score(), settings);
        InvalidationAction recommended = winnerProtected ? InvalidationAction.TIGHTEN_STOP : actionFor(tier);
        boolean autoClose = settings.autoCloseSevere() && tier == InvalidationSeverity.SEVERE && !winnerProtected;
        if (winnerProtected) {
            winnerProtectedCount++;
        }

        meta.activeTier = tier;
        eventsEmitted++;

        int score = (int) Math.round(clamp(combined, 0, 100));
        List<TriggerScore> triggers = new ArrayList<>();
        triggers.add(new TriggerScore(InvalidationTrigger.PRINTS_PRESSURE, prints / 100));
        triggers.add(new TriggerScore(InvalidationTrigger.DEPTH_PRESSURE, depth.score() / 100));
        if (depth.severeSweep()) {
            triggers.add(new TriggerScore(InvalidationTrigger.SEVERE_SWEEP, 1.0));
        }
        InvalidationTrigger primary = depth.severeSweep()
            ? InvalidationTrigger.SEVERE_SWEEP
            : prints * settings.normalizedPrintsWeight() >= depth.score() * settings.normalizedDepthWeight()
                ? InvalidationTrigger.PRINTS_PRESSURE
                : InvalidationTrigger.DEPTH_PRESSURE;

        List<EvidenceItem> evidence = new ArrayList<>();
        evidence.add(new EvidenceItem("Prints", fixed(prints, 0)));
        evidence.add(new EvidenceItem("Depth", fixed(depth.score(), 0)));
        evidence.add(new EvidenceItem("Combined", fixed(combined, 1)));
        evidence.add(new EvidenceItem("Persistence", fixed(heldMs / 1000.0, 0) + "s / " + meta.persistenceBars + " bars"));
        if (depth.severeSweep()) {
            evidence.add(new EvidenceItem("Sweep", depth.sweepLevels() + " levels"));
        }
        evidence.add(new EvidenceItem("Score", String.valueOf(score)));

        String recommendation = winnerProtected
            ? "Trade is working: protect it with a tighter stop instead of exiting."
            : tier.recommendation();

        log.info("Objective invalidation {} on {}: tier={} prints={} depth={} protected={}{}", eventId,
            position.id(), tier.code(), fixed(prints, 1), fixed(depth.score(), 1), winnerProtected,
            autoClose ? " (auto-close)" : "");

        return Optional.of(new InvalidationEvent(
            eventId,
            position.id(),
            position.side(),
            position.strategy(),
            InvalidationPolicyType.OBJECTIVE,
            primary,
            primary.label(),
            triggers,
            score,
            tier,
            evidence,
            recommendation,
            recommended,
            tier.offeredActions(),
            now,
            position.session(),
            position.lastPrice(),
            latest.endTime(),
            context.bars().size() - 1,
            autoClose,
            false,
            null,
            true,
            winnerProtected,
            prints,
            depth.score()
        ));
    }

    // ════════════════════════════════════════════════════════════════════════
    // SCORES
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Four equal components: delta against, POC displacement, adverse close, cumulative delta break.
     */
    double printsScore(Position position, PositionMeta meta, List<FootprintBar> window) {
        int direction = position.direction();
        double risk = Math.max(position.riskPerUnit(), EPSILON);
        FootprintBar last = window.get(window.size() - 1);

        long against = window.stream().filter(bar -> direction * bar.totalDelta() < 0).count();
        double deltaComponent = (double) against / window.size();

        double entryPoc = meta.entryPoc != null ? meta.entryPoc : position.entryPrice();
        double lastPoc = last.pocPrice() != null ? last.pocPrice() : last.close();
        double pocComponent = clamp((entryPoc - lastPoc) * direction / risk, 0, 1);

        double closeComponent = clamp((position.entryPrice() - last.close()) * direction / risk, 0, 1);

        double cumComponent = 0;
        if (meta.entryCumDelta != null) {
            double minCum = window.stream().mapToDouble(FootprintBar::cumulativeDelta).min().orElse(0);
            double maxCum = window.stream().mapToDouble(FootprintBar::cumulativeDelta).max().orElse(0);
            double broken = direction > 0 ? meta.entryCumDelta - minCum : maxCum - meta.entryCumDelta;
            double avgAbsDelta = window.stream().mapToDouble(bar -> Math.abs(bar.totalDelta())).average().orElse(0);
            cumComponent = clamp(broken / Math.max(avgAbsDelta, VOLUME_FLOOR), 0, 1);
        }

        return COMPONENT_POINTS * (deltaComponent + pocComponent + closeComponent + cumComponent);
    }

    /**
     * OFI against (40), opposing replenishment dominance (30), recent severe sweep against (30).
     */
    DepthScore depthScore(Position position, List<FootprintBar> window, long now,
                          ObjectiveInvalidationSettings settings) {
        boolean isLong = position.direction() > 0;
        List<DepthBarMetrics> depthBars = window.stream()
            .map(FootprintBar::depth)
            .filter(metrics -> metrics != null)
            .toList();
        if (depthBars.isEmpty()) {
            return DepthScore.NONE;
        }

        long ofiAgainst = depthBars.stream().filter(m -> m.netOfi() * position.direction() < 0).count();
        double ofi = OFI_POINTS * ofiAgainst / depthBars.size();

        double dominance = 0;
        for (DepthBarMetrics metrics : depthBars) {
            double opposing = isLong ? metrics.maxReplenishmentAsk() : metrics.maxReplenishmentBid();
            double own = isLong ? metrics.maxReplenishmentBid() : metrics.maxReplenishmentAsk();
            if (opposing + own > 0) {
                dominance += clamp((opposing / (opposing + own) - 0.5) / 0.5, 0, 1);
            }
        }
        double replenishment = REPLENISHMENT_POINTS * dominance / depthBars.size();

        SweepEvent.Direction hurting = isLong ? SweepEvent.Direction.DOWN : SweepEvent.Direction.UP;
        double recencyMs = settings.severeSweepRecencySeconds() * 1000;
        int sweepLevels = 0;
        for (DepthBarMetrics metrics : depthBars) {
            for (SweepEvent sweep : metrics.sweeps()) {
                if (sweep.direction() == hurting
                    && sweep.levelsCleared() >= settings.severeSweepMinLevels()
                    && now - sweep.timestamp() <= recencyMs) {
                    sweepLevels = Math.max(sweepLevels, sweep.levelsCleared());
                }
            }
        }
        boolean severeSweep = sweepLevels > 0;

        return new DepthScore(ofi + replenishment + (severeSweep ? SWEEP_POINTS : 0), severeSweep, sweepLevels);
    }

    // ════════════════════════════════════════════════════════════════════════
    // TIERS
    // ════════════════════════════════════════════════════════════════════════

    private void applyHysteresis(Position position, PositionMeta meta, double combined,
                                 ObjectiveInvalidationSettings settings) {
        InvalidationSeverity active = meta.activeTier;
        if (active == null || combined >= threshold(active, settings) - settings.hysteresisPoints()) {
            return;
        }
        InvalidationSeverity dropped = null;
        for (InvalidationSeverity candidate : List.of(InvalidationSeverity.HIGH, InvalidationSeverity.MEDIUM)) {
            if (active.isAbove(candidate)
                && combined >= threshold(candidate, settings) - settings.hysteresisPoints()) {
                dropped = candidate;
                break;
            }
        }
        meta.activeTier = dropped;
        hysteresisResets++;
        log.debug("Position {} active tier {} → {} (combined {})", position.id(), active.code(),
            dropped != null ? dropped.code() : "none", fixed(combined, 1));
    }

    static InvalidationSeverity tierFor(double combined, ObjectiveInvalidationSettings settings) {
        if (combined >= settings.severeThreshold()) {
            return InvalidationSeverity.SEVERE;
        }
        if (combined >= settings.highThreshold()) {
            return InvalidationSeverity.HIGH;
        }
        if (combined >= settings.mediumThreshold()) {
            return InvalidationSeverity.MEDIUM;
        }
        return null;
    }

    private static double threshold(InvalidationSeverity tier, ObjectiveInvalidationSettings settings) {
        return switch (tier) {
            case SEVERE -> settings.severeThreshold();
            case HIGH -> settings.highThreshold();
            case MEDIUM, LOW -> settings.mediumThreshold();
        };
    }

    private static InvalidationAction actionFor(InvalidationSeverity tier) {
        return switch (tier) {
            case SEVERE -> InvalidationAction.CLOSE;
            case HIGH -> InvalidationAction.REDUCE;
            case MEDIUM, LOW -> InvalidationAction.TIGHTEN_STOP;
        };
    }

    private static boolean isWinnerProtected(Position position, double depth,
                                             ObjectiveInvalidationSettings settings) {
        if (!settings.winnerProtectionEnabled() || depth >= settings.winnerDepthOverride()) {
            return false;
        }
        double distance = Math.abs(position.target1() - position.entryPrice());
        double progress = (position.lastPrice() - position.entryPrice()) * position.direction()
            / Math.max(distance, EPSILON);
        return progress >= settings.winnerNearTargetFraction() || position.mfe() >= settings.winnerMinMfeR();
    }

    // ════════════════════════════════════════════════════════════════════════
    // KPIs
    // ════════════════════════════════════════════════════════════════════════

    void recordAutoClose() {
        autoClosed++;
    }

    ObjectiveKpis kpis() {
        return new ObjectiveKpis(evaluations, doubleConfirmations, eventsEmitted, graceSuppressed,
            persistenceSuppressed, severeSweepOverrides, winnerProtectedCount, hysteresisResets, autoClosed);
    }

    record DepthScore(double score, boolean severeSweep, int sweepLevels) {
        static final DepthScore NONE = new DepthScore(0, false, 0);
    }
}
