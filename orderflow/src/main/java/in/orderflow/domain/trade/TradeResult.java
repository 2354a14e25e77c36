package in.orderflow.domain.trade;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a closed trade by realized PnL (fees included).
 */
public enum TradeResult {
    WIN("win"),
    LOSS("loss"),
    BREAKEVEN("breakeven");

    public static final double PNL_EPSILON = 1e-9;

    private final String code;

    TradeResult(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static TradeResult fromPnl(double realizedPnl) {
        if (realizedPnl > PNL_EPSILON) return WIN;
        if (realizedPnl < -PNL_EPSILON) return LOSS;
        return BREAKEVEN;
    }

    @JsonCreator
    public static TradeResult fromCode(String code) {
        for (TradeResult result : values()) {
            if (result.code.equalsIgnoreCase(code) || result.name().equalsIgnoreCase(code)) {
                return result;
            }
        }
        throw new IllegalArgumentException("Unknown trade result: " + code);
    }
}
