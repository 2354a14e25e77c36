package in.orderflow.domain.risk;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived guardrail status, most restrictive first: LOCKED > COOLDOWN > LIMITED > OK.
 */
public enum GuardrailStatus {
    OK("ok"),
    LIMITED("limited"),
    COOLDOWN("cooldown"),
    LOCKED("locked");

    private final String code;

    GuardrailStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
