package in.orderflow.service.performance;

import in.orderflow.domain.monitoring.DailyPerformance;
import in.orderflow.domain.monitoring.SummaryStats;
import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradingSession;
import in.orderflow.domain.trade.ClosedTrade;
import in.orderflow.util.TradingDayClock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static in.orderflow.Fixtures.BASE_TIMESTAMP;
import static in.orderflow.Fixtures.MINUTE;
import static in.orderflow.Fixtures.closedTrade;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PerformanceAggregator.
 *
 * Tests:
 * - Totals, rates and expectancy for one day
 * - Session and strategy breakdowns
 * - Other days and empty input
 */
class PerformanceAggregatorTest {

    private static final double EPS = 1e-9;
    private static final String DAY = TradingDayClock.dayKey(BASE_TIMESTAMP);

    private static List<ClosedTrade> history() {
        long nextDay = TradingDayClock.nextDayStart(BASE_TIMESTAMP) + MINUTE;
        return List.of(
            closedTrade("a", 2, BASE_TIMESTAMP, TradingSession.US, SignalStrategy.ABSORPTION_FAILURE),
            closedTrade("b", -1, BASE_TIMESTAMP + MINUTE, TradingSession.US, SignalStrategy.POC_MIGRATION),
            closedTrade("c", 1, BASE_TIMESTAMP + 2 * MINUTE, TradingSession.EU, SignalStrategy.ABSORPTION_FAILURE),
            closedTrade("d", 0, BASE_TIMESTAMP + 3 * MINUTE, TradingSession.EU, SignalStrategy.DELTA_DIVERGENCE),
            closedTrade("e", -1, nextDay, TradingSession.ASIA, SignalStrategy.POC_MIGRATION));
    }

    @Test
    void testDailyTotals() {
        DailyPerformance performance = PerformanceAggregator.daily(DAY, history(), 0.01);
        SummaryStats totals = performance.getTotals();

        assertEquals(DAY, performance.getDay());
        assertEquals(4, totals.trades(), "Next-day trade excluded");
        assertEquals(2, totals.wins());
        assertEquals(1, totals.losses());
        assertEquals(1, totals.breakeven());
        assertEquals(2.0, totals.netR(), EPS);
        assertEquals(0.02, totals.netPercent(), EPS);
        assertEquals(0.5, totals.avgR(), EPS);
        assertEquals(0.5, totals.winRate(), EPS);
        assertEquals(0.25, totals.lossRate(), EPS);
        assertEquals(1.5, totals.avgWin(), EPS);
        assertEquals(1.0, totals.avgLoss(), EPS, "Average loss is a positive magnitude");
        assertEquals(0.5, totals.expectancy(), EPS, "0.5 x 1.5 - 0.25 x 1.0");
    }

    @Test
    void testSessionAndStrategyBreakdown() {
        DailyPerformance performance = PerformanceAggregator.daily(DAY, history(), 0.01);

        SummaryStats us = performance.forSession(TradingSession.US);
        assertEquals(2, us.trades());
        assertEquals(1.0, us.netR(), EPS);
        assertEquals(SummaryStats.EMPTY, performance.forSession(TradingSession.ASIA));

        SummaryStats absorption = performance.forStrategy(SignalStrategy.ABSORPTION_FAILURE);
        assertEquals(2, absorption.trades());
        assertEquals(1.0, absorption.winRate(), EPS);
        assertEquals(1, performance.forStrategy(SignalStrategy.POC_MIGRATION).losses());
        assertEquals(TradingSession.values().length, performance.getBySession().size());
        assertEquals(SignalStrategy.values().length, performance.getByStrategy().size());
    }

    @Test
    void testEmptyHistory() {
        DailyPerformance performance = PerformanceAggregator.daily(DAY, List.of(), 0.01);

        assertEquals(SummaryStats.EMPTY, performance.getTotals());
        assertEquals(0, performance.forStrategy(SignalStrategy.DELTA_DIVERGENCE).trades());
    }

    @Test
    void testSummarizeWithFilter() {
        SummaryStats losers = PerformanceAggregator.summarize(history(), t -> t.realizedR() < 0, 0.02);

        assertEquals(2, losers.trades());
        assertEquals(-2.0, losers.netR(), EPS);
        assertEquals(-0.04, losers.netPercent(), EPS);
        assertEquals(0.0, losers.winRate(), EPS);
        assertEquals(-1.0, losers.expectancy(), EPS);
    }
}
