package in.orderflow.bootstrap;

import in.orderflow.application.service.ExportFormat;
import in.orderflow.application.service.TradingEngine;
import in.orderflow.application.service.TradingPersistenceSnapshot;
import in.orderflow.application.service.TradingStateSnapshot;
import in.orderflow.config.SettingsLoader;
import in.orderflow.config.TradingSettings;
import in.orderflow.domain.monitoring.SummaryStats;
import in.orderflow.infrastructure.metrics.PrometheusEngineMetrics;
import in.orderflow.infrastructure.persistence.SnapshotCodec;
import in.orderflow.infrastructure.replay.ReplayClock;
import in.orderflow.infrastructure.replay.ReplayEvent;
import in.orderflow.infrastructure.replay.ReplayEventReader;
import in.orderflow.util.Env;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Replay entry point.
 *
 * Plays one recorded feed through one engine per settings preset, so presets
 * can be compared on identical input. Environment:
 * - ORDERFLOW_REPLAY_FILE   NDJSON feed (or first program argument)
 * - ORDERFLOW_SETTINGS      base settings JSON (optional)
 * - ORDERFLOW_PRESETS       comma-separated preset names (default: all)
 * - ORDERFLOW_REPLAY_SPEED  playback multiplier, 0 = as fast as possible
 * - ORDERFLOW_PRICE_STEP / ORDERFLOW_TIMEFRAME_MS
 * - ORDERFLOW_OUTPUT_DIR    where snapshots and CSV history are written (optional)
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== OrderFlow Replay Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        String feed = args.length > 0 ? args[0] : Env.get("ORDERFLOW_REPLAY_FILE", null);
        if (feed == null) {
            log.error("No feed given: pass a file argument or set ORDERFLOW_REPLAY_FILE");
            System.exit(2);
            return;
        }

        double speed = Env.getDouble("ORDERFLOW_REPLAY_SPEED", 0);
        double priceStep = Env.getDouble("ORDERFLOW_PRICE_STEP", 0.1);
        long timeframeMs = Env.getLong("ORDERFLOW_TIMEFRAME_MS", 60_000L);
        String outputDir = Env.get("ORDERFLOW_OUTPUT_DIR", null);

        // ═══════════════════════════════════════════════════════════════
        // Settings & presets
        // ═══════════════════════════════════════════════════════════════
        TradingSettings base = SettingsLoader.fromEnvironment();
        Map<String, TradingSettings> presets = selectPresets(presets(base), Env.get("ORDERFLOW_PRESETS", ""));
        log.info("✓ {} preset(s): {}", presets.size(), presets.keySet());

        // ═══════════════════════════════════════════════════════════════
        // Feed
        // ═══════════════════════════════════════════════════════════════
        List<ReplayEvent> events = ReplayEventReader.readAll(Paths.get(feed));
        long start = events.stream().mapToLong(ReplayEvent::timestamp).filter(ts -> ts > 0).min().orElse(0);

        // ═══════════════════════════════════════════════════════════════
        // Replay per preset
        // ═══════════════════════════════════════════════════════════════
        for (Map.Entry<String, TradingSettings> preset : presets.entrySet()) {
            PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(new CollectorRegistry());
            ReplayClock clock = new ReplayClock(start);
            TradingEngine engine = TradingEngine.builder()
                .settings(preset.getValue())
                .priceStep(priceStep)
                .timeframeMs(timeframeMs)
                .clock(clock)
                .metrics(metrics)
                .build();

            ReplaySession session = new ReplaySession(preset.getKey(), engine, clock, speed);
            TradingStateSnapshot state = session.run(events);
            logSummary(preset.getKey(), state);
            log.debug("[{}] metrics:\n{}", preset.getKey(), metrics.scrape());

            if (outputDir != null) {
                writeOutputs(Paths.get(outputDir), preset.getKey(), engine);
            }
        }

        log.info("✅ Replay complete");
    }

    /**
     * Built-in presets derived from the base settings.
     */
    static Map<String, TradingSettings> presets(TradingSettings base) {
        Map<String, TradingSettings> presets = new LinkedHashMap<>();
        presets.put("base", base);
        presets.put("auto-legacy", base.toBuilder()
            .autoTake(true)
            .objectiveInvalidation(base.objectiveInvalidation().toBuilder().enabled(false).build())
            .build());
        presets.put("auto-objective", base.toBuilder()
            .autoTake(true)
            .objectiveInvalidation(base.objectiveInvalidation().toBuilder().enabled(true).build())
            .build());
        return presets;
    }

    static Map<String, TradingSettings> selectPresets(Map<String, TradingSettings> available, String names) {
        if (names == null || names.isBlank()) {
            return available;
        }
        Map<String, TradingSettings> selected = new LinkedHashMap<>();
        List<String> unknown = new ArrayList<>();
        for (String name : names.split(",")) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            if (key.isEmpty()) {
                continue;
            }
            TradingSettings settings = available.get(key);
            if (settings == null) {
                unknown.add(key);
            } else {
                selected.put(key, settings);
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("Ignoring unknown presets {} (available: {})", unknown, available.keySet());
        }
        return selected.isEmpty() ? available : selected;
    }

    private static void logSummary(String preset, TradingStateSnapshot state) {
        SummaryStats totals = state.performance().getTotals();
        log.info("[{}] trades={} wins={} losses={} netR={} winRate={}% expectancy={} guardrails={}",
            preset,
            state.history().size(),
            totals.wins(),
            totals.losses(),
            String.format(Locale.ROOT, "%.2f", totals.netR()),
            String.format(Locale.ROOT, "%.1f", totals.winRate() * 100),
            String.format(Locale.ROOT, "%.3f", totals.expectancy()),
            state.guardrails().status().code());
    }

    private static void writeOutputs(Path dir, String preset, TradingEngine engine) {
        TradingPersistenceSnapshot snapshot = engine.getPersistenceSnapshot();
        SnapshotCodec.write(dir.resolve(preset + "-snapshot.json"), snapshot);
        try {
            Files.writeString(dir.resolve(preset + "-history.csv"), engine.exportHistory(ExportFormat.CSV));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write history for preset " + preset, e);
        }
        log.info("[{}] outputs written to {}", preset, dir);
    }
}
