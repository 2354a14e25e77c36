package in.orderflow.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How eagerly the legacy invalidation scorer reacts to trigger severities.
 */
public enum InvalidationAggressiveness {
    STRICT("strict", 1.1),
    MODERATE("moderate", 1.0),
    RELAXED("relaxed", 0.85);

    private final String code;
    private final double severityMultiplier;

    InvalidationAggressiveness(String code, double severityMultiplier) {
        this.code = code;
        this.severityMultiplier = severityMultiplier;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public double severityMultiplier() {
        return severityMultiplier;
    }

    @JsonCreator
    public static InvalidationAggressiveness fromCode(String code) {
        for (InvalidationAggressiveness value : values()) {
            if (value.code.equalsIgnoreCase(code) || value.name().equalsIgnoreCase(code)) {
                return value;
            }
        }
        return MODERATE;
    }
}
