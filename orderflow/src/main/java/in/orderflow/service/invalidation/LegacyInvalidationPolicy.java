package in.orderflow.service.invalidation;

import in.orderflow.config.InvalidationSettings;
import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.data.LevelBin;
import in.orderflow.domain.invalidation.EvidenceItem;
import in.orderflow.domain.invalidation.InvalidationAction;
import in.orderflow.domain.invalidation.InvalidationEvent;
import in.orderflow.domain.invalidation.InvalidationPolicyType;
import in.orderflow.domain.invalidation.InvalidationSeverity;
import in.orderflow.domain.invalidation.InvalidationTrigger;
import in.orderflow.domain.invalidation.TriggerScore;
import in.orderflow.domain.signal.Signal;
import in.orderflow.domain.trade.Position;
import in.orderflow.service.signal.SignalBarCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Seven-trigger weighted scorer.
 *
 * SCORING:
 * - each trigger yields a severity (clamped to 1.5 after the aggressiveness multiplier)
 * - contribution = weight × min(severity, 1.2)
 * - score = min(100, round(Σ contributions)); below 40 nothing is emitted
 * - tiers: ≥85 high, ≥65 medium, else low
 *
 * A position gets at most one event per minute.
 */
final class LegacyInvalidationPolicy implements InvalidationPolicy {
    private static final Logger log = LoggerFactory.getLogger(LegacyInvalidationPolicy.class);

    static final long COOLDOWN_MS = 60_000L;
    static final int MIN_EVENT_SCORE = 40;
    static final int HIGH_SCORE = 85;
    static final int MEDIUM_SCORE = 65;

    private static final double MAX_SEVERITY = 1.5;
    private static final double MAX_CONTRIBUTING_SEVERITY = 1.2;
    private static final int MAX_EVIDENCE = 5;
    private static final int SWEEP_VOLUME_BARS = 40;
    private static final double EPSILON = 1e-8;
    private static final double VOLUME_FLOOR = 1e-6;

    private static final DateTimeFormatter BAR_TIME =
        DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    @Override
    public InvalidationPolicyType type() {
        return InvalidationPolicyType.LEGACY;
    }

    @Override
    public Optional<InvalidationEvent> evaluate(Position position, PositionMeta meta, EvaluationContext context,
                                                String eventId) {
        List<TriggerResult> triggers = computeTriggers(position, meta, context);
        if (triggers.isEmpty()) {
            return Optional.empty();
        }
        if (context.now() - meta.lastInvalidationAt < COOLDOWN_MS) {
            log.debug("Position {} in invalidation cooldown ({} triggers pending)", position.id(), triggers.size());
            return Optional.empty();
        }

        Optional<InvalidationEvent> event = buildEvent(position, triggers, context, eventId);
        event.ifPresent(e -> {
            meta.lastInvalidationAt = context.now();
            meta.lastScore = e.score();
            meta.lastTriggers = e.triggers().stream().map(TriggerScore::trigger).toList();
        });
        return event;
    }

    List<TriggerResult> computeTriggers(Position position, PositionMeta meta, EvaluationContext context) {
        InvalidationSettings settings = context.settings().invalidations();
        List<TriggerResult> results = new ArrayList<>();
        oppositeSignal(position, meta, context, settings).ifPresent(results::add);
        stackedImbalance(position, context, settings).ifPresent(results::add);
        deltaPocFlip(position, meta, context, settings).ifPresent(results::add);
        cumDeltaBreak(position, meta, context, settings).ifPresent(results::add);
        keyLevelRecapture(position, meta, context, settings).ifPresent(results::add);
        timeDecay(position, context.now(), settings).ifPresent(results::add);
        liquiditySweep(position, context, settings).ifPresent(results::add);
        return results;
    }

    // ════════════════════════════════════════════════════════════════════════
    // TRIGGERS
    // ════════════════════════════════════════════════════════════════════════

    Optional<TriggerResult> oppositeSignal(Position position, PositionMeta meta, EvaluationContext context,
                                           InvalidationSettings settings) {
        if (context.signals().isEmpty()) {
            return Optional.empty();
        }
        long entryBaseTime = meta.entryBarTime != null ? meta.entryBarTime : position.entryTime();
        TriggerResult best = null;

        for (Signal signal : context.signals()) {
            if (signal.side() != position.side().opposite() || signal.strategy() != position.strategy()) {
                continue;
            }
            long barsSinceEntry = Math.max(0,
                Math.round((signal.barTime() - entryBaseTime) / (double) Math.max(context.timeframeMs(), 1)));
            if (barsSinceEntry <= 0 || barsSinceEntry > settings.lookbackBars()) {
                continue;
            }
            boolean confluence = signal.hasConfluence();
            if (signal.score() < settings.minOppositeSignalScore() && !confluence) {
                continue;
            }

            double severity = clamp(Math.max(signal.score() / 100.0, confluence ? 0.9 : 0.6), 0, 1.2);
            if (best != null && severity <= best.severity()) {
                continue;
            }
            best = new TriggerResult(
                InvalidationTrigger.OPPOSITE_SIGNAL,
                severity,
                List.of(
                    new EvidenceItem("Score", fixed(signal.score(), 0)),
                    new EvidenceItem("Confluence", String.valueOf(signal.strategies().size())),
                    new EvidenceItem("Bars", String.valueOf(barsSinceEntry))
                ),
                signal.entry(),
                signal.barTime(),
                signal.barIndex()
            );
        }
        return Optional.ofNullable(best);
    }

    /**
     * Stacked aggression in the position's own direction near entry that
     * failed to move price: trapped traders on our side.
     */
    Optional<TriggerResult> stackedImbalance(Position position, EvaluationContext context,
                                             InvalidationSettings settings) {
        List<FootprintBar> bars = context.bars();
        if (bars.isEmpty() || position.mfe() >= settings.minProgressR()) {
            return Optional.empty();
        }

        double step = context.priceStep();
        double windowMs = settings.stackedImbalanceWindowSeconds() * 1000;
        long latestTime = bars.get(bars.size() - 1).endTime();
        double thresholdRatio = settings.stackedImbalanceRatio();
        int minLevels = settings.stackedImbalanceLevels();
        boolean isLong = position.direction() > 0;
        double limitDistance = step * Math.max(minLevels + 2, 6);

        TriggerResult best = null;
        for (int idx = bars.size() - 1; idx >= 0; idx--) {
            FootprintBar bar = bars.get(idx);
            if (latestTime - bar.endTime() > windowMs) {
                break;
            }

            List<LevelBin> levels = new ArrayList<>(bar.levels());
            levels.sort(Comparator.comparingDouble(LevelBin::price));

            int consecutive = 0;
            int bestConsecutive = 0;
            double accumulated = 0;
            double bestAverage = 0;
            Double previousPrice = null;
            Double bestPrice = null;

            for (LevelBin level : levels) {
                if (Math.abs(level.price() - position.entryPrice()) > limitDistance) {
                    continue;
                }
                double dominant = isLong ? level.askVol() : level.bidVol();
                double opposing = isLong ? level.bidVol() : level.askVol();
                double ratio = opposing <= EPSILON ? dominant : dominant / Math.max(opposing, EPSILON);

                if (ratio >= thresholdRatio) {
                    if (previousPrice != null && Math.abs(level.price() - previousPrice - step) < step * 0.25) {
                        consecutive++;
                        accumulated += ratio;
                    } else {
                        consecutive = 1;
                        accumulated = ratio;
                    }
                    previousPrice = level.price();

                    if (consecutive >= bestConsecutive) {
                        bestConsecutive = consecutive;
                        double average = accumulated / consecutive;
                        if (average > bestAverage) {
                            bestAverage = average;
                            bestPrice = level.price();
                        }
                    }
                } else {
                    consecutive = 0;
                    accumulated = 0;
                    previousPrice = null;
                }
            }

            if (bestConsecutive < minLevels || bestPrice == null) {
                continue;
            }
            double severity = clamp(
                0.5 * (bestAverage / thresholdRatio) + 0.5 * ((double) bestConsecutive / minLevels), 0, MAX_SEVERITY);
            if (best != null && severity <= best.severity()) {
                continue;
            }
            best = new TriggerResult(
                InvalidationTrigger.STACKED_IMBALANCE,
                severity,
                List.of(
                    new EvidenceItem("Levels", String.valueOf(bestConsecutive)),
                    new EvidenceItem("Ratio", fixed(bestAverage, 2)),
                    new EvidenceItem("Bar", BAR_TIME.format(Instant.ofEpochMilli(bar.endTime())))
                ),
                bestPrice,
                bar.endTime(),
                idx
            );
        }
        return Optional.ofNullable(best);
    }

    Optional<TriggerResult> deltaPocFlip(Position position, PositionMeta meta, EvaluationContext context,
                                         InvalidationSettings settings) {
        List<FootprintBar> bars = context.bars();
        if (bars.isEmpty()) {
            return Optional.empty();
        }

        int direction = position.direction();
        double step = context.priceStep();
        int window = Math.max(2, settings.deltaFlipWindow());
        SignalBarCache.BarLookup entry = context.findBarForTime(entryTime(position, meta));
        int entryIndex = entry.found() ? Math.max(entry.index(), 0) : Math.max(bars.size() - window, 0);
        List<FootprintBar> subset = bars.subList(entryIndex, bars.size());
        if (subset.size() < 2) {
            return Optional.empty();
        }
        List<FootprintBar> windowBars = subset.subList(Math.max(0, subset.size() - window), subset.size());
        if (windowBars.size() < 2) {
            return Optional.empty();
        }
        if (!windowBars.stream().allMatch(bar -> direction * bar.totalDelta() < 0)) {
            return Optional.empty();
        }

        double firstPoc = pocOrClose(windowBars.get(0));
        FootprintBar lastBar = windowBars.get(windowBars.size() - 1);
        double lastPoc = pocOrClose(lastBar);
        double pocShift = lastPoc - firstPoc;
        double entryPoc = meta.entryPoc != null
            ? meta.entryPoc
            : entry.found() ? pocOrClose(entry.bar()) : position.entryPrice();
        double lastClose = lastBar.close();

        boolean pocAgainst = direction > 0 ? lastPoc < entryPoc - step * 0.25 : lastPoc > entryPoc + step * 0.25;
        boolean crossEntry = direction > 0
            ? lastClose < position.entryPrice() - step * 0.25
            : lastClose > position.entryPrice() + step * 0.25;
        if (!pocAgainst || !crossEntry) {
            return Optional.empty();
        }

        double avgDelta = windowBars.stream().mapToDouble(bar -> Math.abs(bar.totalDelta())).average().orElse(0);
        double avgVolume = windowBars.stream()
            .mapToDouble(bar -> Math.max(bar.totalVolume(), VOLUME_FLOOR)).average().orElse(0);
        double severity = clamp(
            avgDelta / Math.max(avgVolume, VOLUME_FLOOR) + Math.min(Math.abs(pocShift) / (step * window), 1.2),
            0, MAX_SEVERITY);

        return Optional.of(new TriggerResult(
            InvalidationTrigger.DELTA_POC_FLIP,
            severity,
            List.of(
                new EvidenceItem("Avg Δ", fixed(avgDelta, 2)),
                new EvidenceItem("POC shift", fixed(pocShift, 2)),
                new EvidenceItem("Close", fixed(lastClose, 2))
            ),
            lastClose,
            lastBar.endTime(),
            bars.size() - 1
        ));
    }

    Optional<TriggerResult> cumDeltaBreak(Position position, PositionMeta meta, EvaluationContext context,
                                          InvalidationSettings settings) {
        List<FootprintBar> bars = context.bars();
        if (bars.isEmpty()) {
            return Optional.empty();
        }

        int lookback = Math.max(3, settings.cumDeltaLookback());
        Double entryCum = meta.entryCumDelta;
        if (entryCum == null) {
            SignalBarCache.BarLookup entry = context.findBarForTime(entryTime(position, meta));
            entryCum = entry.found() ? entry.bar().cumulativeDelta() : null;
        }
        if (entryCum == null) {
            return Optional.empty();
        }

        List<FootprintBar> windowBars = context.lastBars(lookback);
        double minCum = windowBars.stream().mapToDouble(FootprintBar::cumulativeDelta).min().orElse(0);
        double maxCum = windowBars.stream().mapToDouble(FootprintBar::cumulativeDelta).max().orElse(0);
        boolean isLong = position.direction() > 0;
        boolean brokeAgainst = isLong ? minCum < entryCum : maxCum > entryCum;
        if (!brokeAgainst) {
            return Optional.empty();
        }

        double drop = isLong ? entryCum - minCum : maxCum - entryCum;
        double avgIncremental = windowBars.stream()
            .mapToDouble(bar -> Math.abs(bar.totalDelta())).average().orElse(0);
        double severity = clamp(drop / Math.max(avgIncremental, VOLUME_FLOOR), 0, MAX_SEVERITY);
        FootprintBar lastBar = windowBars.get(windowBars.size() - 1);

        return Optional.of(new TriggerResult(
            InvalidationTrigger.CUMDELTA_BREAK,
            severity,
            List.of(
                new EvidenceItem("Entry cumΔ", fixed(entryCum, 2)),
                new EvidenceItem("Current cumΔ", fixed(isLong ? minCum : maxCum, 2)),
                new EvidenceItem("Net Δ", fixed(drop, 2))
            ),
            lastBar.close(),
            lastBar.endTime(),
            bars.size() - 1
        ));
    }

    Optional<TriggerResult> keyLevelRecapture(Position position, PositionMeta meta, EvaluationContext context,
                                              InvalidationSettings settings) {
        FootprintBar lastBar = context.latestBar();
        if (lastBar == null) {
            return Optional.empty();
        }

        int direction = position.direction();
        double step = context.priceStep();
        double close = lastBar.close();
        double poc = pocOrClose(lastBar);
        double entryPoc;
        if (meta.entryPoc != null) {
            entryPoc = meta.entryPoc;
        } else {
            SignalBarCache.BarLookup entry = context.findBarForTime(entryTime(position, meta));
            entryPoc = entry.found() ? pocOrClose(entry.bar()) : position.entryPrice();
        }

        double delta = lastBar.totalDelta();
        boolean deltaAgainst = direction > 0 ? delta < 0 : delta > 0;
        boolean pocAgainst = direction > 0 ? poc < entryPoc : poc > entryPoc;
        boolean cross = direction > 0 ? close < entryPoc - step * 0.25 : close > entryPoc + step * 0.25;
        if (!deltaAgainst || !pocAgainst || !cross) {
            return Optional.empty();
        }

        double strength = Math.abs(delta) / Math.max(lastBar.totalVolume(), VOLUME_FLOOR);
        if (strength < settings.keyLevelDeltaThreshold()) {
            return Optional.empty();
        }

        return Optional.of(new TriggerResult(
            InvalidationTrigger.KEY_LEVEL_RECAPTURE,
            clamp(strength, 0, MAX_SEVERITY),
            List.of(
                new EvidenceItem("Close", fixed(close, 2)),
                new EvidenceItem("Current POC", fixed(poc, 2)),
                new EvidenceItem("Δ ratio", fixed(strength, 2))
            ),
            close,
            lastBar.endTime(),
            context.bars().size() - 1
        ));
    }

    Optional<TriggerResult> timeDecay(Position position, long now, InvalidationSettings settings) {
        int decayMinutes = settings.timeDecayMinutes();
        double elapsedMinutes = (now - position.entryTime()) / 60_000.0;
        if (elapsedMinutes < decayMinutes || position.mfe() >= settings.minProgressR()) {
            return Optional.empty();
        }

        double severity = clamp((elapsedMinutes - decayMinutes) / Math.max(decayMinutes, 1), 0, MAX_SEVERITY);
        return Optional.of(new TriggerResult(
            InvalidationTrigger.TIME_DECAY,
            severity,
            List.of(
                new EvidenceItem("Hold", fixed(elapsedMinutes, 1) + "m"),
                new EvidenceItem("MFE", fixed(position.mfe(), 2) + "R")
            ),
            position.lastPrice(),
            null,
            null
        ));
    }

    Optional<TriggerResult> liquiditySweep(Position position, EvaluationContext context,
                                           InvalidationSettings settings) {
        List<FootprintBar> bars = context.bars();
        if (bars.isEmpty()) {
            return Optional.empty();
        }

        boolean isLong = position.direction() > 0;
        double step = context.priceStep();
        FootprintBar lastBar = bars.get(bars.size() - 1);
        FootprintBar prevBar = bars.size() >= 2 ? bars.get(bars.size() - 2) : null;
        double entryPrice = position.entryPrice();

        double wick = isLong ? entryPrice - lastBar.low() : lastBar.high() - entryPrice;
        if (wick <= step * 0.25) {
            return Optional.empty();
        }
        double retrace = isLong
            ? (lastBar.close() - lastBar.low()) / Math.max(wick, step)
            : (lastBar.high() - lastBar.close()) / Math.max(wick, step);
        if (retrace < settings.liquidityRetracePercent()) {
            return Optional.empty();
        }

        double[] volumes = context.lastBars(SWEEP_VOLUME_BARS).stream()
            .mapToDouble(FootprintBar::totalVolume).sorted().toArray();
        int percentileIndex = Math.max(0, (int) Math.floor((volumes.length - 1) * settings.liquiditySweepPercentile()));
        double percentileVolume = volumes.length > 0 ? volumes[percentileIndex] : 0;
        if (lastBar.totalVolume() < percentileVolume) {
            return Optional.empty();
        }

        boolean followThrough = prevBar != null && (isLong
            ? prevBar.close() < entryPrice - wick * 0.2
            : prevBar.close() > entryPrice + wick * 0.2);
        if (followThrough) {
            return Optional.empty();
        }

        double volumeBoost = percentileVolume > 0
            ? lastBar.totalVolume() / Math.max(percentileVolume, VOLUME_FLOOR) - 1
            : 0;
        double severity = clamp(wick / Math.max(position.riskPerUnit(), step) + volumeBoost, 0, MAX_SEVERITY);

        return Optional.of(new TriggerResult(
            InvalidationTrigger.LIQUIDITY_SWEEP,
            severity,
            List.of(
                new EvidenceItem("Sweep", fixed(wick, 2)),
                new EvidenceItem("Retrace", fixed(retrace * 100, 0) + "%"),
                new EvidenceItem("Volume", fixed(lastBar.totalVolume(), 0))
            ),
            isLong ? lastBar.low() : lastBar.high(),
            lastBar.endTime(),
            bars.size() - 1
        ));
    }

    // ════════════════════════════════════════════════════════════════════════
    // EVENT
    // ════════════════════════════════════════════════════════════════════════

    Optional<InvalidationEvent> buildEvent(Position position, List<TriggerResult> triggers,
                                           EvaluationContext context, String eventId) {
        InvalidationSettings settings = context.settings().invalidations();
        double multiplier = settings.aggressiveness().severityMultiplier();

        double total = 0;
        double highestContribution = Double.NEGATIVE_INFINITY;
        TriggerResult primary = triggers.get(0);
        List<TriggerScore> scores = new ArrayList<>();
        for (TriggerResult trigger : triggers) {
            double severity = clamp(trigger.severity() * multiplier, 0, MAX_SEVERITY);
            double contribution = trigger.trigger().weight() * Math.min(severity, MAX_CONTRIBUTING_SEVERITY);
            if (contribution > highestContribution) {
                highestContribution = contribution;
                primary = trigger;
            }
            total += contribution;
            scores.add(new TriggerScore(trigger.trigger(), Math.min(severity, MAX_CONTRIBUTING_SEVERITY)));
        }

        int score = (int) Math.min(100, Math.round(total));
        if (score < MIN_EVENT_SCORE) {
            log.debug("Position {} score {} below event floor ({} triggers)", position.id(), score, triggers.size());
            return Optional.empty();
        }

        InvalidationSeverity severity = score >= HIGH_SCORE
            ? InvalidationSeverity.HIGH
            : score >= MEDIUM_SCORE ? InvalidationSeverity.MEDIUM : InvalidationSeverity.LOW;
        InvalidationAction recommended = switch (severity) {
            case HIGH, SEVERE -> InvalidationAction.CLOSE;
            case MEDIUM -> InvalidationAction.REDUCE;
            case LOW -> InvalidationAction.TIGHTEN_STOP;
        };

        List<EvidenceItem> evidence = new ArrayList<>();
        appendEvidence(evidence, primary.evidence());
        for (TriggerResult trigger : triggers) {
            if (evidence.size() >= MAX_EVIDENCE) {
                break;
            }
            if (trigger != primary) {
                appendEvidence(evidence, trigger.evidence());
            }
        }
        evidence.add(new EvidenceItem("Score", String.valueOf(score)));

        boolean autoClose = settings.autoCloseHighSeverity() && score >= settings.autoCloseThreshold();
        double marker = primary.markerPrice() != null ? primary.markerPrice() : position.lastPrice();

        log.info("Invalidation {} on {}: score={} severity={} primary={}{}", eventId, position.id(), score,
            severity.code(), primary.trigger().code(), autoClose ? " (auto-close)" : "");

        return Optional.of(new InvalidationEvent(
            eventId,
            position.id(),
            position.side(),
            position.strategy(),
            InvalidationPolicyType.LEGACY,
            primary.trigger(),
            primary.trigger().label(),
            scores,
            score,
            severity,
            evidence,
            severity.recommendation(),
            recommended,
            severity.offeredActions(),
            context.now(),
            position.session(),
            marker,
            primary.barTime(),
            primary.barIndex(),
            autoClose,
            false,
            null,
            true,
            false,
            null,
            null
        ));
    }

    private static void appendEvidence(List<EvidenceItem> target, List<EvidenceItem> items) {
        for (EvidenceItem item : items) {
            if (target.size() >= MAX_EVIDENCE) {
                return;
            }
            if (!target.contains(item)) {
                target.add(item);
            }
        }
    }

    private static long entryTime(Position position, PositionMeta meta) {
        return meta.entryBarTime != null ? meta.entryBarTime : position.entryTime();
    }

    private static double pocOrClose(FootprintBar bar) {
        return bar.pocPrice() != null ? bar.pocPrice() : bar.close();
    }

    static double clamp(double value, double min, double max) {
        return Math.min(Math.max(value, min), max);
    }

    static String fixed(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
