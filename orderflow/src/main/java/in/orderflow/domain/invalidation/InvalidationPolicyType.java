package in.orderflow.domain.invalidation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scorer that produced an invalidation event.
 */
public enum InvalidationPolicyType {
    LEGACY("legacy"),
    OBJECTIVE("objective");

    private final String code;

    InvalidationPolicyType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
