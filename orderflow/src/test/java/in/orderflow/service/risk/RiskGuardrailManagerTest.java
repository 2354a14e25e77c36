package in.orderflow.service.risk;

import in.orderflow.config.NewsWindow;
import in.orderflow.config.RiskGuardrailSettings;
import in.orderflow.domain.risk.EntryDecision;
import in.orderflow.domain.risk.GuardrailSource;
import in.orderflow.domain.risk.GuardrailStatus;
import in.orderflow.domain.risk.RiskGuardrailState;
import in.orderflow.domain.signal.Signal;
import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.signal.TradingSession;
import in.orderflow.util.TradingDayClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static in.orderflow.Fixtures.BASE_TIMESTAMP;
import static in.orderflow.Fixtures.MINUTE;
import static in.orderflow.Fixtures.SECOND;
import static in.orderflow.Fixtures.closedTrade;
import static in.orderflow.Fixtures.signal;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RiskGuardrailManager.
 *
 * Tests:
 * - Loss-streak cooldown arming and expiry
 * - Daily loss lock and daily-stop cooldown
 * - Session, news and per-session caps
 * - Day roll and manual reset
 */
class RiskGuardrailManagerTest {

    private static Signal usSignal(String id, long timestamp) {
        return signal(id, TradeSide.LONG, 100, 95, timestamp, 1);
    }

    private static RiskGuardrailSettings.Builder enabledAllSessions() {
        return RiskGuardrailSettings.builder().enabled(true).allowedSessions(List.of());
    }

    @Test
    void testDisabledAllowsEverything() {
        RiskGuardrailManager manager = new RiskGuardrailManager(RiskGuardrailSettings.defaults(), BASE_TIMESTAMP);
        manager.recordClosedTrade(closedTrade("t1", -1, BASE_TIMESTAMP, TradingSession.US));
        manager.recordClosedTrade(closedTrade("t2", -1, BASE_TIMESTAMP, TradingSession.US));

        EntryDecision decision = manager.evaluateEntry(BASE_TIMESTAMP, usSignal("s1", BASE_TIMESTAMP), false);

        assertTrue(decision.allowed(), "Disabled guardrails never block");
        assertEquals(GuardrailStatus.OK, manager.getStatus());
        assertEquals(2, manager.getState().consecutiveLosses(), "Counters are still kept while disabled");
    }

    @Test
    void testLossCooldownBlocksUntilExpiry() {
        RiskGuardrailManager manager = new RiskGuardrailManager(
            enabledAllSessions().lossCooldownTrigger(2).lossCooldownMinutes(15).build(), BASE_TIMESTAMP);
        long lastExit = BASE_TIMESTAMP + MINUTE;

        manager.recordClosedTrade(closedTrade("t1", -1, BASE_TIMESTAMP, TradingSession.US));
        manager.recordClosedTrade(closedTrade("t2", -1, lastExit, TradingSession.US));

        assertEquals(GuardrailStatus.COOLDOWN, manager.getStatus());
        EntryDecision blocked = manager.evaluateEntry(lastExit + MINUTE, usSignal("s1", lastExit + MINUTE), true);
        assertFalse(blocked.allowed(), "Cooldown should block entries");
        assertEquals(GuardrailSource.COOLDOWN, blocked.block().source());
        assertEquals(lastExit + 15 * MINUTE, blocked.block().until());

        EntryDecision later = manager.evaluateEntry(lastExit + 15 * MINUTE, usSignal("s2", lastExit + 15 * MINUTE), true);
        assertTrue(later.allowed(), "Cooldown expired");
        assertEquals(GuardrailStatus.OK, manager.getStatus());
    }

    @Test
    void testWinResetsConsecutiveLosses() {
        RiskGuardrailManager manager = new RiskGuardrailManager(enabledAllSessions().build(), BASE_TIMESTAMP);

        manager.recordClosedTrade(closedTrade("t1", -1, BASE_TIMESTAMP, TradingSession.US));
        manager.recordClosedTrade(closedTrade("t2", -1, BASE_TIMESTAMP, TradingSession.US));
        assertEquals(2, manager.getState().consecutiveLosses());

        manager.recordClosedTrade(closedTrade("t3", 2, BASE_TIMESTAMP, TradingSession.US));

        RiskGuardrailState state = manager.getState();
        assertEquals(0, state.consecutiveLosses(), "A win resets the streak");
        assertEquals(3, state.tradesToday());
        assertEquals(0.0, state.netRToday(), 1e-9);
        assertEquals(3, state.sessionStats().get(TradingSession.US).trades());
        assertEquals(2, state.sessionStats().get(TradingSession.US).losses());
    }

    @Test
    void testDailyLossLocksUntilNextDay() {
        RiskGuardrailManager manager = new RiskGuardrailManager(
            enabledAllSessions().maxDailyLossR(2.0).dailyStopCooldownMinutes(0).build(), BASE_TIMESTAMP);

        manager.recordClosedTrade(closedTrade("t1", -1, BASE_TIMESTAMP, TradingSession.US));
        manager.recordClosedTrade(closedTrade("t2", -1, BASE_TIMESTAMP + SECOND, TradingSession.US));

        assertEquals(GuardrailStatus.LOCKED, manager.getStatus());
        long later = BASE_TIMESTAMP + 30 * MINUTE;
        assertFalse(manager.evaluateEntry(later, usSignal("s1", later), false).allowed(),
            "Entries stay blocked for the rest of the day");

        long nextDay = TradingDayClock.nextDayStart(BASE_TIMESTAMP) + SECOND;
        EntryDecision decision = manager.evaluateEntry(nextDay, usSignal("s2", nextDay), false);
        assertTrue(decision.allowed(), "New day resets the lock");
        assertEquals(GuardrailStatus.OK, manager.getStatus());
        assertEquals(0, manager.getState().tradesToday());
        assertEquals("Automatic daily reset", manager.getState().logs().get(manager.getState().logs().size() - 1).message());
    }

    @Test
    void testDailyStopCooldownLiftsEarly() {
        RiskGuardrailManager manager = new RiskGuardrailManager(
            enabledAllSessions().maxDailyLossR(2.0).dailyStopCooldownMinutes(30).build(), BASE_TIMESTAMP);

        manager.recordClosedTrade(closedTrade("t1", -2.5, BASE_TIMESTAMP, TradingSession.US));

        long during = BASE_TIMESTAMP + 10 * MINUTE;
        assertFalse(manager.evaluateEntry(during, usSignal("s1", during), false).allowed());

        long after = BASE_TIMESTAMP + 30 * MINUTE;
        assertTrue(manager.evaluateEntry(after, usSignal("s2", after), false).allowed(),
            "Served daily-stop cooldown lifts the daily loss block");
    }

    @Test
    void testMaxConsecutiveLossesLocks() {
        RiskGuardrailManager manager = new RiskGuardrailManager(
            enabledAllSessions().maxConsecutiveLosses(2).build(), BASE_TIMESTAMP);

        manager.recordClosedTrade(closedTrade("t1", -1, BASE_TIMESTAMP, TradingSession.US));
        manager.recordClosedTrade(closedTrade("t2", -1, BASE_TIMESTAMP, TradingSession.US));

        EntryDecision decision = manager.evaluateEntry(BASE_TIMESTAMP, usSignal("s1", BASE_TIMESTAMP), false);
        assertFalse(decision.allowed());
        assertEquals(GuardrailSource.MAX_CONSECUTIVE_LOSSES, decision.block().source());
        assertEquals(GuardrailStatus.LOCKED, manager.getStatus());
    }

    @Test
    void testDisallowedSessionIsBlocked() {
        RiskGuardrailManager manager = new RiskGuardrailManager(
            RiskGuardrailSettings.builder().enabled(true).build(), BASE_TIMESTAMP);
        Signal asia = Signal.of("asia", BASE_TIMESTAMP, 1, TradeSide.LONG, SignalStrategy.POC_MIGRATION,
            100, 95, 110.0, 80, TradingSession.ASIA);

        EntryDecision denied = manager.evaluateEntry(BASE_TIMESTAMP, asia, true);
        EntryDecision allowed = manager.evaluateEntry(BASE_TIMESTAMP, usSignal("us", BASE_TIMESTAMP), true);

        assertFalse(denied.allowed(), "Asia is not in the default allowed sessions");
        assertEquals(GuardrailSource.SESSION_WINDOW, denied.block().source());
        assertTrue(allowed.allowed());
        assertEquals(GuardrailStatus.LIMITED, manager.getStatus(), "Session blocks only limit");
    }

    @Test
    void testSessionTradeCapOnlyAffectsThatSession() {
        RiskGuardrailManager manager = new RiskGuardrailManager(
            enabledAllSessions().sessionMaxTrades(TradingSession.US, 1).build(), BASE_TIMESTAMP);
        manager.recordClosedTrade(closedTrade("t1", 1, BASE_TIMESTAMP, TradingSession.US));

        Signal eu = Signal.of("eu", BASE_TIMESTAMP, 1, TradeSide.SHORT, SignalStrategy.POC_MIGRATION,
            100, 105, 90.0, 80, TradingSession.EU);

        EntryDecision usDecision = manager.evaluateEntry(BASE_TIMESTAMP, usSignal("us", BASE_TIMESTAMP), false);
        assertFalse(usDecision.allowed());
        assertEquals(GuardrailSource.SESSION_TRADES, usDecision.block().source());
        assertTrue(manager.evaluateEntry(BASE_TIMESTAMP, eu, false).allowed());
    }

    @Test
    void testSessionLossCapBlocksThatSession() {
        RiskGuardrailManager manager = new RiskGuardrailManager(
            enabledAllSessions().sessionMaxLossR(TradingSession.EU, 2.0).build(), BASE_TIMESTAMP);
        manager.recordClosedTrade(closedTrade("t1", -1, BASE_TIMESTAMP, TradingSession.EU));
        manager.recordClosedTrade(closedTrade("t2", -1, BASE_TIMESTAMP + MINUTE, TradingSession.EU));

        Signal eu = Signal.of("eu", BASE_TIMESTAMP + 2 * MINUTE, 1, TradeSide.SHORT, SignalStrategy.POC_MIGRATION,
            100, 105, 90.0, 80, TradingSession.EU);

        EntryDecision euDecision = manager.evaluateEntry(BASE_TIMESTAMP + 2 * MINUTE, eu, false);
        assertFalse(euDecision.allowed(), "EU is down 2R");
        assertEquals(GuardrailSource.SESSION_LOSS, euDecision.block().source());
        assertTrue(manager.evaluateEntry(BASE_TIMESTAMP + 2 * MINUTE,
            usSignal("us", BASE_TIMESTAMP + 2 * MINUTE), false).allowed());
    }

    @Test
    void testNewsWindowBlocksAndInvalidWindowsAreIgnored() {
        String start = Instant.ofEpochMilli(BASE_TIMESTAMP - MINUTE).toString();
        String end = Instant.ofEpochMilli(BASE_TIMESTAMP + MINUTE).toString();
        RiskGuardrailManager manager = new RiskGuardrailManager(enabledAllSessions()
            .addNewsWindow(new NewsWindow("cpi", "CPI", start, end))
            .build(), BASE_TIMESTAMP);

        EntryDecision inside = manager.evaluateEntry(BASE_TIMESTAMP, usSignal("s1", BASE_TIMESTAMP), false);
        assertFalse(inside.allowed());
        assertEquals(GuardrailSource.NEWS, inside.block().source());
        assertEquals("News window: CPI", inside.block().reason());

        RiskGuardrailManager ignoring = new RiskGuardrailManager(enabledAllSessions()
            .addNewsWindow(new NewsWindow("backwards", "Backwards", end, start))
            .addNewsWindow(new NewsWindow("garbage", "Garbage", "not-a-date", end))
            .build(), BASE_TIMESTAMP);
        assertTrue(ignoring.evaluateEntry(BASE_TIMESTAMP, usSignal("s2", BASE_TIMESTAMP), false).allowed());
    }

    @Test
    void testDenialRecordsLastBlock() {
        RiskGuardrailManager manager = new RiskGuardrailManager(
            enabledAllSessions().maxTradesPerDay(1).build(), BASE_TIMESTAMP);
        manager.recordClosedTrade(closedTrade("t1", 1, BASE_TIMESTAMP, TradingSession.US));

        manager.evaluateEntry(BASE_TIMESTAMP + SECOND, usSignal("s9", BASE_TIMESTAMP), true);

        RiskGuardrailState state = manager.getState();
        assertNotNull(state.lastBlock());
        assertEquals("s9", state.lastBlock().signalId());
        assertTrue(state.lastBlock().auto());
        assertEquals(GuardrailSource.DAILY_TRADES, state.lastBlock().block().source());
        assertEquals(GuardrailStatus.LOCKED, state.status());
    }

    @Test
    void testManualResetClearsState() {
        RiskGuardrailManager manager = new RiskGuardrailManager(
            enabledAllSessions().maxTradesPerDay(1).build(), BASE_TIMESTAMP);
        manager.recordClosedTrade(closedTrade("t1", -1, BASE_TIMESTAMP, TradingSession.US));

        manager.reset(BASE_TIMESTAMP + SECOND);

        RiskGuardrailState state = manager.getState();
        assertEquals(0, state.tradesToday());
        assertEquals(0, state.consecutiveLosses());
        assertTrue(state.activeBlocks().isEmpty());
        assertNull(state.lastBlock());
        assertTrue(manager.evaluateEntry(BASE_TIMESTAMP + SECOND, usSignal("s1", BASE_TIMESTAMP), false).allowed());
    }

    @Test
    void testSettingsUpdateIsNoOpWhenEqual() {
        RiskGuardrailSettings settings = enabledAllSessions().maxTradesPerDay(3).build();
        RiskGuardrailManager manager = new RiskGuardrailManager(settings, BASE_TIMESTAMP);

        assertFalse(manager.updateSettings(enabledAllSessions().maxTradesPerDay(3).build(), BASE_TIMESTAMP));
        assertTrue(manager.updateSettings(enabledAllSessions().maxTradesPerDay(4).build(), BASE_TIMESTAMP));
    }
}
