package in.orderflow.domain.invalidation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Response to an invalidation event.
 */
public enum InvalidationAction {
    CLOSE("close", "Close now"),
    REDUCE("reduce", "Reduce 50%"),
    TIGHTEN_STOP("tighten-stop", "Move stop to -0.5R"),
    HOLD("hold", "Hold");

    private final String code;
    private final String label;

    InvalidationAction(String code, String label) {
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
    public static InvalidationAction fromCode(String code) {
        for (InvalidationAction action : values()) {
            if (action.code.equalsIgnoreCase(code) || action.name().equalsIgnoreCase(code)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown invalidation action: " + code);
    }
}
