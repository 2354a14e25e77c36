package in.orderflow;

import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.data.LevelBin;
import in.orderflow.domain.signal.Signal;
import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.signal.TradingSession;
import in.orderflow.domain.trade.ClosedTrade;
import in.orderflow.domain.trade.ExitReason;
import in.orderflow.domain.trade.FirstHit;
import in.orderflow.domain.trade.TradeResult;
import in.orderflow.util.TradingDayClock;

import java.util.List;

/**
 * Shared builders for engine tests.
 */
public final class Fixtures {

    /** 2023-11-14T22:13:20Z */
    public static final long BASE_TIMESTAMP = 1_700_000_000_000L;
    public static final long SECOND = 1_000L;
    public static final long MINUTE = 60_000L;

    /**
     * Signal with target1 exactly 2R away.
     */
    public static Signal signal(String id, TradeSide side, double entry, double stop, long timestamp, int barIndex) {
        return signal(id, side, SignalStrategy.ABSORPTION_FAILURE, entry, stop, timestamp, barIndex, 70);
    }

    public static Signal signal(String id, TradeSide side, SignalStrategy strategy, double entry, double stop,
                                long timestamp, int barIndex, double score) {
        double risk = Math.abs(entry - stop);
        double target1 = entry + side.direction() * 2 * risk;
        return Signal.of(id, timestamp, barIndex, side, strategy, entry, stop, target1, score, TradingSession.US);
    }

    /**
     * One-level bar without depth metrics.
     */
    public static FootprintBar bar(long start, double open, double high, double low, double close,
                                   double delta, double cumulativeDelta, double volume, double poc) {
        double ask = (volume + delta) / 2;
        double bid = (volume - delta) / 2;
        LevelBin level = new LevelBin(poc, ask, bid, delta, volume);
        return new FootprintBar(start, start + MINUTE - 1, List.of(level), poc, volume, delta, cumulativeDelta,
            volume, high, low, open, close, null);
    }

    /**
     * Closed long trade with the given R; PnL is R × 0.01 (1% risk).
     */
    public static ClosedTrade closedTrade(String id, double realizedR, long exitTime, TradingSession session) {
        return closedTrade(id, realizedR, exitTime, session, SignalStrategy.ABSORPTION_FAILURE);
    }

    public static ClosedTrade closedTrade(String id, double realizedR, long exitTime, TradingSession session,
                                          SignalStrategy strategy) {
        double pnl = realizedR * 0.01;
        ExitReason reason = realizedR < 0 ? ExitReason.STOP : ExitReason.TP2;
        FirstHit firstHit = realizedR < 0 ? FirstHit.STOP : FirstHit.TP1;
        return new ClosedTrade(id, id, TradeSide.LONG, strategy, session, 100, 100, 100 + realizedR,
            exitTime - MINUTE, exitTime, 1.0, firstHit, reason, TradeResult.fromPnl(pnl), pnl, realizedR, 0,
            Math.max(0, realizedR), Math.max(0, -realizedR), TradingDayClock.dayKey(exitTime));
    }

    private Fixtures() {}
}
