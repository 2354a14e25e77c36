package in.orderflow.service.performance;

import in.orderflow.domain.monitoring.DailyPerformance;
import in.orderflow.domain.monitoring.SummaryStats;
import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradingSession;
import in.orderflow.domain.trade.ClosedTrade;
import in.orderflow.domain.trade.TradeResult;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Performance Aggregator - derives daily statistics from closed trades.
 *
 * Pure function of its inputs, recomputed whenever history or settings change.
 * Win/loss classification uses realized PnL (fees included) with a 1e-9 epsilon:
 * - winRate, lossRate = winners / trades, losers / trades
 * - avgWin = mean R of winners, avgLoss = |mean R of losers|
 * - expectancy = winRate × avgWin − lossRate × avgLoss
 * - netPercent = netR × account risk fraction
 */
public final class PerformanceAggregator {

    /**
     * Build the performance of one day.
     *
     * @param day          day key (yyyy-MM-dd)
     * @param history      closed trades, any day; only those of {@code day} are counted
     * @param riskFraction account risk per trade as a fraction (0.01 = 1%)
     */
    public static DailyPerformance daily(String day, List<ClosedTrade> history, double riskFraction) {
        List<ClosedTrade> trades = history.stream()
            .filter(trade -> day.equals(trade.day()))
            .toList();

        Map<TradingSession, SummaryStats> bySession = new EnumMap<>(TradingSession.class);
        for (TradingSession session : TradingSession.values()) {
            bySession.put(session, summarize(trades, t -> t.session() == session, riskFraction));
        }

        Map<SignalStrategy, SummaryStats> byStrategy = new EnumMap<>(SignalStrategy.class);
        for (SignalStrategy strategy : SignalStrategy.values()) {
            byStrategy.put(strategy, summarize(trades, t -> t.strategy() == strategy, riskFraction));
        }

        return new DailyPerformance(day, summarize(trades, t -> true, riskFraction), bySession, byStrategy);
    }

    /**
     * Summarize the trades matching a filter.
     */
    public static SummaryStats summarize(List<ClosedTrade> trades, Predicate<ClosedTrade> filter,
                                         double riskFraction) {
        int count = 0;
        int winners = 0;
        int losers = 0;
        int breakeven = 0;
        double netR = 0;
        double winR = 0;
        double lossR = 0;

        for (ClosedTrade trade : trades) {
            if (!filter.test(trade)) {
                continue;
            }
            count++;
            netR += trade.realizedR();
            TradeResult result = TradeResult.fromPnl(trade.realizedPnl());
            switch (result) {
                case WIN -> {
                    winners++;
                    winR += trade.realizedR();
                }
                case LOSS -> {
                    losers++;
                    lossR += trade.realizedR();
                }
                default -> breakeven++;
            }
        }

        if (count == 0) {
            return SummaryStats.EMPTY;
        }

        double avgR = netR / count;
        double winRate = (double) winners / count;
        double lossRate = (double) losers / count;
        double avgWin = winners > 0 ? winR / winners : 0;
        double avgLoss = losers > 0 ? Math.abs(lossR / losers) : 0;
        double expectancy = winRate * avgWin - lossRate * avgLoss;

        return new SummaryStats(count, winners, losers, breakeven, netR, netR * riskFraction, avgR,
            winRate, lossRate, avgWin, avgLoss, expectancy);
    }

    private PerformanceAggregator() {}
}
