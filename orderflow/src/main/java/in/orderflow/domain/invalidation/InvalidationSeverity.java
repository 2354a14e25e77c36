package in.orderflow.domain.invalidation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Event tier. Legacy events use LOW..HIGH, objective events MEDIUM..SEVERE.
 * Declaration order is escalation order.
 */
public enum InvalidationSeverity {
    LOW("low", "Keep the position with a tighter stop and watch closely."),
    MEDIUM("medium", "Consider reducing exposure or tightening the stop."),
    HIGH("high", "Closing the position now is recommended."),
    SEVERE("severe", "Thesis broken on prints and book: close the position.");

    private final String code;
    private final String recommendation;

    InvalidationSeverity(String code, String recommendation) {
        this.code = code;
        this.recommendation = recommendation;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String recommendation() {
        return recommendation;
    }

    public boolean isAbove(InvalidationSeverity other) {
        return other == null || ordinal() > other.ordinal();
    }

    /**
     * Actions offered to the trader, most decisive first.
     */
    public List<InvalidationAction> offeredActions() {
        return switch (this) {
            case SEVERE, HIGH -> List.of(InvalidationAction.CLOSE, InvalidationAction.REDUCE,
                InvalidationAction.TIGHTEN_STOP);
            case MEDIUM -> List.of(InvalidationAction.REDUCE, InvalidationAction.TIGHTEN_STOP,
                InvalidationAction.HOLD);
            case LOW -> List.of(InvalidationAction.TIGHTEN_STOP, InvalidationAction.HOLD,
                InvalidationAction.REDUCE);
        };
    }
}
