package in.orderflow.domain.trade;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * First exit level a position touched. Set once, never overwritten.
 */
public enum FirstHit {
    NONE("none"),
    TP1("tp1"),
    TP2("tp2"),
    STOP("stop"),
    TIME_STOP("time-stop"),
    INVALIDATION("invalidation");

    private final String code;

    FirstHit(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static FirstHit fromCode(String code) {
        for (FirstHit hit : values()) {
            if (hit.code.equalsIgnoreCase(code) || hit.name().equalsIgnoreCase(code)) {
                return hit;
            }
        }
        throw new IllegalArgumentException("Unknown first hit: " + code);
    }
}
