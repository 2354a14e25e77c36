package in.orderflow.domain.trade;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the remainder of a position was closed.
 */
public enum ExitReason {
    TP1("tp1"),                   // partial at target1 covered the whole remainder
    TP2("tp2"),                   // second target reached
    STOP("stop"),                 // original stop hit before target1
    BREAKEVEN("breakeven"),       // breakeven stop hit after target1
    TIME_STOP("time-stop"),       // max hold time exceeded
    INVALIDATION("invalidation"), // closed on invalidation evidence
    CANCELLED("cancelled");       // manual flatten

    private final String code;

    ExitReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ExitReason fromCode(String code) {
        for (ExitReason reason : values()) {
            if (reason.code.equalsIgnoreCase(code) || reason.name().equalsIgnoreCase(code)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown exit reason: " + code);
    }
}
