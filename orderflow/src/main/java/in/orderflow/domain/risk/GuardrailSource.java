package in.orderflow.domain.risk;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a block or audit-log entry.
 */
public enum GuardrailSource {
    NEWS("news", false),
    COOLDOWN("cooldown", false),
    DAILY_LOSS("daily-loss", true),
    DAILY_TRADES("daily-trades", true),
    MAX_CONSECUTIVE_LOSSES("max-consecutive-losses", true),
    SESSION_TRADES("session-trades", false),
    SESSION_LOSS("session-loss", false),
    SESSION_WINDOW("session-window", false),
    RESET("reset", false);

    private final String code;
    private final boolean locking;

    GuardrailSource(String code, boolean locking) {
        this.code = code;
        this.locking = locking;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Hard daily limits that put the guardrails in LOCKED status.
     */
    public boolean isLocking() {
        return locking;
    }
}
