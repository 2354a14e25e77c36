package in.orderflow.domain.invalidation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Evidence sources that can invalidate an open position.
 *
 * The first seven belong to the legacy weighted scorer; the weight is the
 * score contribution of a trigger at full severity. The objective policy
 * reports its sub-scores as the last three, which carry no weight.
 */
public enum InvalidationTrigger {
    OPPOSITE_SIGNAL("opposite-signal", "Opposite signal", 40),
    STACKED_IMBALANCE("stacked-imbalance", "Stacked imbalance", 18),
    DELTA_POC_FLIP("delta-poc-flip", "Delta + POC flip", 16),
    CUMDELTA_BREAK("cumdelta-break", "Cum-delta break", 15),
    KEY_LEVEL_RECAPTURE("key-level-recapture", "Key level recapture", 18),
    TIME_DECAY("time-decay", "Time decay", 12),
    LIQUIDITY_SWEEP("liquidity-sweep", "Liquidity sweep", 21),

    PRINTS_PRESSURE("prints-pressure", "Prints against position", 0),
    DEPTH_PRESSURE("depth-pressure", "Order book against position", 0),
    SEVERE_SWEEP("severe-sweep", "Severe sweep", 0);

    private final String code;
    private final String label;
    private final int weight;

    InvalidationTrigger(String code, String label, int weight) {
        this.code = code;
        this.label = label;
        this.weight = weight;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public int weight() {
        return weight;
    }

    @JsonCreator
    public static InvalidationTrigger fromCode(String code) {
        for (InvalidationTrigger trigger : values()) {
            if (trigger.code.equalsIgnoreCase(code) || trigger.name().equalsIgnoreCase(code)) {
                return trigger;
            }
        }
        throw new IllegalArgumentException("Unknown invalidation trigger: " + code);
    }
}
