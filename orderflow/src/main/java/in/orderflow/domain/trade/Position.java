package in.orderflow.domain.trade;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.domain.signal.SignalStrategy;
import in.orderflow.domain.signal.TradeSide;
import in.orderflow.domain.signal.TradingSession;

/**
 * Open simulated exposure.
 *
 * Immutable snapshot: every state change produces a new instance via
 * {@link #toBuilder()}. {@code size} is fixed at fill time; only
 * {@code remainingSize} shrinks. A position whose remaining size reaches zero
 * must be closed in the same transition, it never sits in the ledger empty.
 *
 * {@code riskAmount} is the account-risk fraction at entry, so realized R is
 * realized PnL divided by it.
 */
public record Position(
    @JsonProperty("id") String id,
    @JsonProperty("signalId") String signalId,
    @JsonProperty("side") TradeSide side,
    @JsonProperty("strategy") SignalStrategy strategy,
    @JsonProperty("session") TradingSession session,
    @JsonProperty("entryPrice") double entryPrice,
    @JsonProperty("entryFillPrice") double entryFillPrice,
    @JsonProperty("originalStop") double originalStop,
    @JsonProperty("stopPrice") double stopPrice,
    @JsonProperty("target1") double target1,
    @JsonProperty("target2") double target2,
    @JsonProperty("entryTime") long entryTime,
    @JsonProperty("entryBarIndex") int entryBarIndex,
    @JsonProperty("size") double size,
    @JsonProperty("remainingSize") double remainingSize,
    @JsonProperty("partialSize") double partialSize,
    @JsonProperty("riskAmount") double riskAmount,
    @JsonProperty("riskPerUnit") double riskPerUnit,
    @JsonProperty("timeStopAt") Long timeStopAt,
    @JsonProperty("target1Hit") boolean target1Hit,
    @JsonProperty("firstHit") FirstHit firstHit,
    @JsonProperty("realizedPnl") double realizedPnl,
    @JsonProperty("realizedR") double realizedR,
    @JsonProperty("feesPaid") double feesPaid,
    @JsonProperty("mfe") double mfe,
    @JsonProperty("mae") double mae,
    @JsonProperty("lastPrice") double lastPrice
) {
    private static final double SIZE_TOLERANCE = 1e-12;

    public Position {
        if (remainingSize < -SIZE_TOLERANCE || remainingSize > size + SIZE_TOLERANCE) {
            throw new IllegalStateException(String.format(
                "Position %s remaining size %.10f outside [0, %.10f]", id, remainingSize, size));
        }
        if (firstHit == null) {
            firstHit = FirstHit.NONE;
        }
    }

    public int direction() {
        return side.direction();
    }

    /**
     * Signed progress of a price relative to the requested entry, in R.
     */
    public double rMultipleAt(double price) {
        return (price - entryPrice) * side.direction() / Math.max(riskPerUnit, 1e-8);
    }

    /**
     * Record first hit if none yet.
     */
    public FirstHit firstHitOr(FirstHit candidate) {
        return firstHit == FirstHit.NONE ? candidate : firstHit;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String signalId;
        private TradeSide side;
        private SignalStrategy strategy;
        private TradingSession session;
        private double entryPrice;
        private double entryFillPrice;
        private double originalStop;
        private double stopPrice;
        private double target1;
        private double target2;
        private long entryTime;
        private int entryBarIndex;
        private double size;
        private double remainingSize;
        private double partialSize;
        private double riskAmount;
        private double riskPerUnit;
        private Long timeStopAt;
        private boolean target1Hit;
        private FirstHit firstHit = FirstHit.NONE;
        private double realizedPnl;
        private double realizedR;
        private double feesPaid;
        private double mfe;
        private double mae;
        private double lastPrice;

        private Builder() {}

        private Builder(Position p) {
            this.id = p.id;
            this.signalId = p.signalId;
            this.side = p.side;
            this.strategy = p.strategy;
            this.session = p.session;
            this.entryPrice = p.entryPrice;
            this.entryFillPrice = p.entryFillPrice;
            this.originalStop = p.originalStop;
            this.stopPrice = p.stopPrice;
            this.target1 = p.target1;
            this.target2 = p.target2;
            this.entryTime = p.entryTime;
            this.entryBarIndex = p.entryBarIndex;
            this.size = p.size;
            this.remainingSize = p.remainingSize;
            this.partialSize = p.partialSize;
            this.riskAmount = p.riskAmount;
            this.riskPerUnit = p.riskPerUnit;
            this.timeStopAt = p.timeStopAt;
            this.target1Hit = p.target1Hit;
            this.firstHit = p.firstHit;
            this.realizedPnl = p.realizedPnl;
            this.realizedR = p.realizedR;
            this.feesPaid = p.feesPaid;
            this.mfe = p.mfe;
            this.mae = p.mae;
            this.lastPrice = p.lastPrice;
        }

        public Builder id(String v) { this.id = v; return this; }
        public Builder signalId(String v) { this.signalId = v; return this; }
        public Builder side(TradeSide v) { this.side = v; return this; }
        public Builder strategy(SignalStrategy v) { this.strategy = v; return this; }
        public Builder session(TradingSession v) { this.session = v; return this; }
        public Builder entryPrice(double v) { this.entryPrice = v; return this; }
        public Builder entryFillPrice(double v) { this.entryFillPrice = v; return this; }
        public Builder originalStop(double v) { this.originalStop = v; return this; }
        public Builder stopPrice(double v) { this.stopPrice = v; return this; }
        public Builder target1(double v) { this.target1 = v; return this; }
        public Builder target2(double v) { this.target2 = v; return this; }
        public Builder entryTime(long v) { this.entryTime = v; return this; }
        public Builder entryBarIndex(int v) { this.entryBarIndex = v; return this; }
        public Builder size(double v) { this.size = v; return this; }
        public Builder remainingSize(double v) { this.remainingSize = v; return this; }
        public Builder partialSize(double v) { this.partialSize = v; return this; }
        public Builder riskAmount(double v) { this.riskAmount = v; return this; }
        public Builder riskPerUnit(double v) { this.riskPerUnit = v; return this; }
        public Builder timeStopAt(Long v) { this.timeStopAt = v; return this; }
        public Builder target1Hit(boolean v) { this.target1Hit = v; return this; }
        public Builder firstHit(FirstHit v) { this.firstHit = v; return this; }
        public Builder realizedPnl(double v) { this.realizedPnl = v; return this; }
        public Builder realizedR(double v) { this.realizedR = v; return this; }
        public Builder feesPaid(double v) { this.feesPaid = v; return this; }
        public Builder mfe(double v) { this.mfe = v; return this; }
        public Builder mae(double v) { this.mae = v; return this; }
        public Builder lastPrice(double v) { this.lastPrice = v; return this; }

        public Position build() {
            return new Position(id, signalId, side, strategy, session, entryPrice, entryFillPrice, originalStop,
                stopPrice, target1, target2, entryTime, entryBarIndex, size, remainingSize, partialSize,
                riskAmount, riskPerUnit, timeStopAt, target1Hit, firstHit, realizedPnl, realizedR, feesPaid,
                mfe, mae, lastPrice);
        }
    }
}
