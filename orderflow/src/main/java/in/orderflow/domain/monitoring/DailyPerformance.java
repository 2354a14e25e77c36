package in.orderflow.domain.monitoring;

import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradingSession;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Daily trading performance: totals plus breakdowns by session and strategy.
 */
public class DailyPerformance {
    private final String day;
    private final SummaryStats totals;
    private final Map<TradingSession, SummaryStats> bySession;
    private final Map<SignalStrategy, SummaryStats> byStrategy;

    public DailyPerformance(
            String day,
            SummaryStats totals,
            Map<TradingSession, SummaryStats> bySession,
            Map<SignalStrategy, SummaryStats> byStrategy) {
        this.day = day;
        this.totals = totals;
        Map<TradingSession, SummaryStats> sessions = new EnumMap<>(TradingSession.class);
        sessions.putAll(bySession);
        Map<SignalStrategy, SummaryStats> strategies = new EnumMap<>(SignalStrategy.class);
        strategies.putAll(byStrategy);
        this.bySession = Collections.unmodifiableMap(sessions);
        this.byStrategy = Collections.unmodifiableMap(strategies);
    }

    // Getters
    public String getDay() { return day; }
    public SummaryStats getTotals() { return totals; }
    public Map<TradingSession, SummaryStats> getBySession() { return bySession; }
    public Map<SignalStrategy, SummaryStats> getByStrategy() { return byStrategy; }

    public SummaryStats forSession(TradingSession session) {
        return bySession.getOrDefault(session, SummaryStats.EMPTY);
    }

    public SummaryStats forStrategy(SignalStrategy strategy) {
        return byStrategy.getOrDefault(strategy, SummaryStats.EMPTY);
    }
}
