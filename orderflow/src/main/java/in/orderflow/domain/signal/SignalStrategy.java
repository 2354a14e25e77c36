package in.orderflow.domain.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Order-flow setups produced by the signal detectors.
 */
public enum SignalStrategy {
    ABSORPTION_FAILURE("absorption-failure", "Absorption Failure"),
    POC_MIGRATION("poc-migration", "POC Migration"),
    DELTA_DIVERGENCE("delta-divergence", "Delta Divergence");

    private final String code;
    private final String label;

    SignalStrategy(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    @JsonCreator
    public static SignalStrategy fromCode(String code) {
        for (SignalStrategy strategy : values()) {
            if (strategy.code.equalsIgnoreCase(code) || strategy.name().equalsIgnoreCase(code)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown signal strategy: " + code);
    }
}
