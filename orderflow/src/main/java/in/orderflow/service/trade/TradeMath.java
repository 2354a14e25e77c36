package in.orderflow.service.trade;

import in.orderflow.domain.signal.TradeSide;

/**
 * Fill and fee arithmetic shared by every ledger transition.
 *
 * Slippage always works against the trader: entries fill higher for longs,
 * exits fill lower.
 */
public final class TradeMath {

    public static final double PRICE_EPSILON = 1e-8;

    public static double entryFill(TradeSide side, double price, double slippage) {
        return price + side.direction() * slippage;
    }

    public static double exitFill(TradeSide side, double price, double slippage) {
        return price - side.direction() * slippage;
    }

    public static double fee(double fillPrice, double size, double feeRate) {
        return Math.abs(fillPrice * size) * feeRate;
    }

    /**
     * Net PnL of closing {@code size} units: gross move from the entry fill minus the exit fee.
     */
    public static double netExit(TradeSide side, double entryFill, double exitFill, double size, double feeRate) {
        double gross = (exitFill - entryFill) * size * side.direction();
        return gross - fee(exitFill, size, feeRate);
    }

    public static double breakevenStop(TradeSide side, double entryPrice, double offset) {
        return entryPrice + offset * side.direction();
    }

    public static double round6(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }

    public static boolean reached(TradeSide side, double price, double level) {
        return side == TradeSide.LONG ? price >= level - PRICE_EPSILON : price <= level + PRICE_EPSILON;
    }

    public static boolean breached(TradeSide side, double price, double level) {
        return side == TradeSide.LONG ? price <= level + PRICE_EPSILON : price >= level - PRICE_EPSILON;
    }

    private TradeMath() {}
}
