package in.orderflow.service.risk;

import in.orderflow.config.NewsWindow;
import in.orderflow.config.RiskGuardrailSettings;
import in.orderflow.domain.risk.EntryDecision;
import in.orderflow.domain.risk.GuardrailBlock;
import in.orderflow.domain.risk.GuardrailLogEntry;
import in.orderflow.domain.risk.GuardrailSource;
import in.orderflow.domain.risk.GuardrailStatus;
import in.orderflow.domain.risk.LastBlock;
import in.orderflow.domain.risk.RiskGuardrailState;
import in.orderflow.domain.risk.SessionStats;
import in.orderflow.domain.signal.Signal;
import in.orderflow.domain.signal.TradingSession;
import in.orderflow.domain.trade.ClosedTrade;
import in.orderflow.util.BoundedRing;
import in.orderflow.util.TradingDayClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Risk Guardrail Manager - day-scoped gatekeeper for new exposure.
 *
 * STATE MACHINE (per UTC day):
 * <pre>
 *   OK ──cap/window hit──→ LIMITED
 *   OK ──loss streak / daily stop──→ COOLDOWN ──deadline──→ OK
 *   any ──daily loss / trades / consecutive-loss cap──→ LOCKED ──day roll──→ OK
 * </pre>
 * Status is derived from the active block list on every refresh, never set directly.
 *
 * Blocks are recomputed on every entry attempt and every closed trade.
 * A session-scoped block only denies signals of that session; all other
 * blocks deny everything. Denials are returned as values, never thrown.
 *
 * Time is always supplied by the caller, so replays are deterministic.
 */
public final class RiskGuardrailManager {
    private static final Logger log = LoggerFactory.getLogger(RiskGuardrailManager.class);

    public static final int MAX_LOG_ENTRIES = 60;
    private static final double EPSILON = 1e-8;
    private static final long COOLDOWN_EXPIRY_SLACK_MS = 500;

    private RiskGuardrailSettings settings;
    private List<ParsedNewsWindow> newsWindows;

    private String day;
    private long resetAt;
    private int tradesToday;
    private double netRToday;
    private int consecutiveLosses;
    private final Map<TradingSession, SessionStats> sessionStats = new EnumMap<>(TradingSession.class);
    private List<GuardrailBlock> activeBlocks = List.of();
    private GuardrailStatus status = GuardrailStatus.OK;
    private Long lossUntil;
    private Long dailyStopUntil;
    private LastBlock lastBlock;
    private final BoundedRing<GuardrailLogEntry> logs = new BoundedRing<>(MAX_LOG_ENTRIES);

    private int lastLossCooldownTrigger;
    private boolean dailyStopTriggered;

    public RiskGuardrailManager(RiskGuardrailSettings settings, long now) {
        this.settings = settings != null ? settings : RiskGuardrailSettings.defaults();
        this.newsWindows = parseNewsWindows(this.settings.newsWindows());
        this.day = TradingDayClock.dayKey(now);
        this.resetAt = TradingDayClock.nextDayStart(now);
        clearSessionStats();
    }

    public RiskGuardrailSettings getSettings() {
        return settings;
    }

    public GuardrailStatus getStatus() {
        return status;
    }

    public RiskGuardrailState getState() {
        return new RiskGuardrailState(
            status,
            day,
            resetAt,
            tradesToday,
            netRToday,
            consecutiveLosses,
            Map.copyOf(sessionStats),
            List.copyOf(activeBlocks),
            lossUntil,
            dailyStopUntil,
            lastBlock,
            logs.toList()
        );
    }

    /**
     * Replace the settings and refresh blocks.
     *
     * @return true if anything observable changed
     */
    public boolean updateSettings(RiskGuardrailSettings next, long now) {
        RiskGuardrailSettings candidate = next != null ? next : RiskGuardrailSettings.defaults();
        if (candidate.equals(settings)) {
            return false;
        }
        this.settings = candidate;
        this.newsWindows = parseNewsWindows(candidate.newsWindows());
        ensureDay(now);
        refreshBlocks(now);
        if (!candidate.enabled()) {
            lastBlock = null;
        }
        log.info("Guardrails updated: enabled={}, maxDailyLossR={}, maxTradesPerDay={}, maxConsecutiveLosses={}",
            candidate.enabled(), candidate.maxDailyLossR(), candidate.maxTradesPerDay(),
            candidate.maxConsecutiveLosses());
        return true;
    }

    /**
     * Roll to a new day if {@code now} falls on a different UTC day.
     *
     * @return true if a reset happened
     */
    public boolean ensureDay(long now) {
        if (TradingDayClock.dayKey(now).equals(day)) {
            return false;
        }
        applyReset(now, "Automatic daily reset", true);
        return true;
    }

    /**
     * Manual reset of all counters, cooldowns and blocks.
     */
    public void reset(long now) {
        applyReset(now, "Manual reset", false);
    }

    /**
     * Decide whether a new entry may be taken.
     *
     * @param signal the candidate signal, may be null for a session-agnostic check
     * @param auto   true when the engine takes the signal on its own
     */
    public EntryDecision evaluateEntry(long now, Signal signal, boolean auto) {
        boolean changed = ensureDay(now);
        changed |= refreshBlocks(now);

        if (!settings.enabled()) {
            return EntryDecision.allow(changed);
        }

        GuardrailBlock blocking = null;
        for (GuardrailBlock block : activeBlocks) {
            if (block.session() == null || (signal != null && block.appliesTo(signal.session()))) {
                blocking = block;
                break;
            }
        }

        if (blocking == null && signal != null && !settings.isSessionAllowed(signal.session())) {
            blocking = new GuardrailBlock(GuardrailSource.SESSION_WINDOW,
                "Session " + signal.session().code() + " not allowed", resetAt, signal.session());
        }

        if (blocking == null) {
            return EntryDecision.allow(changed);
        }

        String signalId = signal != null ? signal.id() : null;
        lastBlock = new LastBlock(blocking, now, signalId, auto);
        appendLog(new GuardrailLogEntry(now, blocking.source(), blocking.reason(), signalId, auto));
        log.info("Entry blocked for signal {} ({}): {}", signalId, blocking.source().code(), blocking.reason());
        return EntryDecision.deny(blocking);
    }

    /**
     * Book a closed trade into the day's counters and arm cooldowns when thresholds are crossed.
     *
     * @return true if guardrail state changed in a way the host can observe
     */
    public boolean recordClosedTrade(ClosedTrade trade) {
        long now = trade.exitTime();
        ensureDay(now);

        boolean loss = trade.realizedR() < -EPSILON;
        tradesToday++;
        netRToday += trade.realizedR();
        TradingSession session = trade.session();
        sessionStats.put(session, sessionStats.getOrDefault(session, SessionStats.EMPTY).record(trade.realizedR(), loss));

        if (loss) {
            consecutiveLosses++;
        } else {
            consecutiveLosses = 0;
            lastLossCooldownTrigger = 0;
        }

        if (settings.enabled()) {
            evaluateLossCooldown(now);
            evaluateDailyStop(now);
        }

        refreshBlocks(now);
        return true;
    }

    // ════════════════════════════════════════════════════════════════════════
    // BLOCKS
    // ════════════════════════════════════════════════════════════════════════

    private boolean refreshBlocks(long now) {
        if (!settings.enabled()) {
            if (!activeBlocks.isEmpty() || status != GuardrailStatus.OK) {
                activeBlocks = List.of();
                status = GuardrailStatus.OK;
                return true;
            }
            return false;
        }

        boolean cooldownExpired = false;
        if (lossUntil != null && now >= lossUntil - COOLDOWN_EXPIRY_SLACK_MS) {
            lossUntil = null;
            lastLossCooldownTrigger = consecutiveLosses;
            cooldownExpired = true;
        }
        if (dailyStopUntil != null && now >= dailyStopUntil - COOLDOWN_EXPIRY_SLACK_MS) {
            dailyStopUntil = null;
            cooldownExpired = true;
        }

        List<GuardrailBlock> blocks = computeBlocks(now);
        GuardrailStatus nextStatus = deriveStatus(blocks);
        boolean changed = !blocks.equals(activeBlocks) || nextStatus != status;
        if (changed) {
            if (nextStatus != status) {
                log.info("Guardrail status {} → {} ({} active blocks)", status.code(), nextStatus.code(), blocks.size());
            }
            activeBlocks = List.copyOf(blocks);
            status = nextStatus;
        }
        return changed || cooldownExpired;
    }

    private List<GuardrailBlock> computeBlocks(long now) {
        List<GuardrailBlock> blocks = new ArrayList<>();

        for (ParsedNewsWindow window : newsWindows) {
            if (now >= window.start() && now <= window.end()) {
                String reason = window.label().isEmpty()
                    ? "News window active"
                    : "News window: " + window.label();
                blocks.add(new GuardrailBlock(GuardrailSource.NEWS, reason, window.end(), null));
                break;
            }
        }

        if (lossUntil != null && now < lossUntil) {
            blocks.add(new GuardrailBlock(GuardrailSource.COOLDOWN,
                "Loss cooldown (" + formatRemaining(now, lossUntil) + " left)", lossUntil, null));
        }

        if (dailyStopUntil != null && now < dailyStopUntil) {
            blocks.add(new GuardrailBlock(GuardrailSource.COOLDOWN,
                "Daily stop cooldown until " + formatTime(dailyStopUntil) + " UTC", dailyStopUntil, null));
        }

        Double maxDailyLoss = settings.maxDailyLossR();
        if (maxDailyLoss != null && netRToday <= -maxDailyLoss) {
            // A served daily-stop cooldown lifts the lock until the next loss limit day.
            if (!dailyStopTriggered) {
                blocks.add(dailyLossBlock(resetAt));
            } else if (dailyStopUntil != null) {
                blocks.add(dailyLossBlock(dailyStopUntil));
            }
        }

        Integer maxTrades = settings.maxTradesPerDay();
        if (maxTrades != null && tradesToday >= maxTrades) {
            blocks.add(new GuardrailBlock(GuardrailSource.DAILY_TRADES,
                "Daily trade limit reached (" + tradesToday + ")", resetAt, null));
        }

        Integer maxConsecutive = settings.maxConsecutiveLosses();
        if (maxConsecutive != null && consecutiveLosses >= maxConsecutive) {
            blocks.add(new GuardrailBlock(GuardrailSource.MAX_CONSECUTIVE_LOSSES,
                "Max consecutive losses reached (" + consecutiveLosses + ")", resetAt, null));
        }

        for (TradingSession session : TradingSession.values()) {
            SessionStats stats = sessionStats.getOrDefault(session, SessionStats.EMPTY);
            Integer sessionMaxTrades = settings.maxTradesFor(session);
            if (sessionMaxTrades != null && stats.trades() >= sessionMaxTrades) {
                blocks.add(new GuardrailBlock(GuardrailSource.SESSION_TRADES,
                    "Session " + session.code() + " limited (" + stats.trades() + "/" + sessionMaxTrades + ")",
                    resetAt, session));
            }
            Double sessionMaxLoss = settings.maxLossRFor(session);
            if (sessionMaxLoss != null && stats.netR() <= -sessionMaxLoss) {
                blocks.add(new GuardrailBlock(GuardrailSource.SESSION_LOSS,
                    "Session " + session.code() + " loss limit reached (" + formatR(stats.netR()) + ")",
                    resetAt, session));
            }
        }

        for (TradingSession session : TradingSession.values()) {
            if (!settings.isSessionAllowed(session)) {
                blocks.add(new GuardrailBlock(GuardrailSource.SESSION_WINDOW,
                    "Session " + session.code() + " disabled", resetAt, session));
            }
        }

        return blocks;
    }

    private GuardrailBlock dailyLossBlock(long until) {
        return new GuardrailBlock(GuardrailSource.DAILY_LOSS,
            "Max daily loss reached (" + formatR(netRToday) + ")", until, null);
    }

    private static GuardrailStatus deriveStatus(List<GuardrailBlock> blocks) {
        if (blocks.stream().anyMatch(b -> b.source().isLocking())) {
            return GuardrailStatus.LOCKED;
        }
        if (blocks.stream().anyMatch(b -> b.source() == GuardrailSource.COOLDOWN)) {
            return GuardrailStatus.COOLDOWN;
        }
        return blocks.isEmpty() ? GuardrailStatus.OK : GuardrailStatus.LIMITED;
    }

    // ════════════════════════════════════════════════════════════════════════
    // COOLDOWNS
    // ════════════════════════════════════════════════════════════════════════

    private void evaluateLossCooldown(long now) {
        int trigger = settings.lossCooldownTrigger();
        if (trigger <= 0 || settings.lossCooldownMinutes() <= 0) {
            return;
        }
        if (consecutiveLosses < trigger || consecutiveLosses <= lastLossCooldownTrigger) {
            return;
        }
        int minutes = Math.max(1, settings.lossCooldownMinutes());
        long until = now + minutes * TradingDayClock.MINUTE_MS;
        lossUntil = Math.max(lossUntil != null ? lossUntil : 0L, until);
        lastLossCooldownTrigger = consecutiveLosses;
        appendLog(new GuardrailLogEntry(now, GuardrailSource.COOLDOWN,
            minutes + "m cooldown after " + consecutiveLosses + " consecutive losses", null, true));
        log.info("Loss cooldown armed: {} consecutive losses, blocked until {}", consecutiveLosses,
            Instant.ofEpochMilli(lossUntil));
    }

    private void evaluateDailyStop(long now) {
        Double maxDailyLoss = settings.maxDailyLossR();
        if (maxDailyLoss == null || netRToday > -maxDailyLoss || dailyStopTriggered) {
            return;
        }
        dailyStopTriggered = true;
        int minutes = settings.dailyStopCooldownMinutes();
        dailyStopUntil = minutes > 0
            ? Math.min(resetAt, now + minutes * TradingDayClock.MINUTE_MS)
            : resetAt;
        appendLog(new GuardrailLogEntry(now, GuardrailSource.DAILY_LOSS,
            "Daily stop triggered (" + formatR(netRToday) + ")", null, true));
        log.warn("Daily stop triggered at {}: entries blocked until {}", formatR(netRToday),
            Instant.ofEpochMilli(dailyStopUntil));
    }

    // ════════════════════════════════════════════════════════════════════════
    // HELPERS
    // ════════════════════════════════════════════════════════════════════════

    private void applyReset(long now, String reason, boolean auto) {
        day = TradingDayClock.dayKey(now);
        resetAt = TradingDayClock.nextDayStart(now);
        tradesToday = 0;
        netRToday = 0;
        consecutiveLosses = 0;
        clearSessionStats();
        activeBlocks = List.of();
        lossUntil = null;
        dailyStopUntil = null;
        status = GuardrailStatus.OK;
        lastBlock = null;
        lastLossCooldownTrigger = 0;
        dailyStopTriggered = false;
        appendLog(new GuardrailLogEntry(now, GuardrailSource.RESET, reason, null, auto));
        log.info("Guardrails reset for {}: {}", day, reason);
    }

    private void clearSessionStats() {
        sessionStats.clear();
        for (TradingSession session : TradingSession.values()) {
            sessionStats.put(session, SessionStats.EMPTY);
        }
    }

    private void appendLog(GuardrailLogEntry entry) {
        logs.add(entry);
    }

    private static List<ParsedNewsWindow> parseNewsWindows(List<NewsWindow> windows) {
        List<ParsedNewsWindow> parsed = new ArrayList<>();
        for (NewsWindow window : windows) {
            try {
                long start = Instant.parse(window.start()).toEpochMilli();
                long end = Instant.parse(window.end()).toEpochMilli();
                if (end <= start) {
                    log.warn("Ignoring news window {}: end {} is not after start {}",
                        window.id(), window.end(), window.start());
                    continue;
                }
                String id = window.id() != null && !window.id().isBlank() ? window.id() : start + "-" + end;
                String label = window.label() != null ? window.label().trim() : "";
                parsed.add(new ParsedNewsWindow(id, label, start, end));
            } catch (DateTimeParseException | NullPointerException e) {
                log.warn("Ignoring news window {} with unparseable bounds: {} / {}",
                    window.id(), window.start(), window.end());
            }
        }
        parsed.sort(Comparator.comparingLong(ParsedNewsWindow::start));
        return List.copyOf(parsed);
    }

    private static String formatR(double value) {
        return String.format(Locale.ROOT, "%.2fR", value);
    }

    private static String formatTime(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis).toString().substring(11, 16);
    }

    private static String formatRemaining(long now, long until) {
        long remainingMs = until - now;
        if (remainingMs <= 0) {
            return "0m";
        }
        long minutes = Math.round(remainingMs / (double) TradingDayClock.MINUTE_MS);
        if (minutes >= 90) {
            return String.format(Locale.ROOT, "%.1fh", minutes / 60.0);
        }
        return minutes + "m";
    }

    private record ParsedNewsWindow(String id, String label, long start, long end) {
        ParsedNewsWindow {
            Objects.requireNonNull(id);
        }
    }
}
