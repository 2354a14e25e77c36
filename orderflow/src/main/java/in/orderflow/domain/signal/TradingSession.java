package in.orderflow.domain.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Market session a signal was generated in.
 */
public enum TradingSession {
    ASIA("asia"),
    EU("eu"),
    US("us"),
    OTHER("other");

    private final String code;

    TradingSession(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static TradingSession fromCode(String code) {
        for (TradingSession session : values()) {
            if (session.code.equalsIgnoreCase(code) || session.name().equalsIgnoreCase(code)) {
                return session;
            }
        }
        throw new IllegalArgumentException("Unknown trading session: " + code);
    }
}
