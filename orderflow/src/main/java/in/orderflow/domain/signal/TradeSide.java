package in.orderflow.domain.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a signal, pending order or position.
 */
public enum TradeSide {
    LONG("long", 1),
    SHORT("short", -1);

    private final String code;
    private final int direction;

    TradeSide(String code, int direction) {
        this.code = code;
        this.direction = direction;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * +1 for LONG, -1 for SHORT. Multiplying a price move by this gives the move in the trade's favour.
     */
    public int direction() {
        return direction;
    }

    public TradeSide opposite() {
        return this == LONG ? SHORT : LONG;
    }

    @JsonCreator
    public static TradeSide fromCode(String code) {
        for (TradeSide side : values()) {
            if (side.code.equalsIgnoreCase(code) || side.name().equalsIgnoreCase(code)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Unknown trade side: " + code);
    }
}
