package in.orderflow.domain.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggressive order that cleared several book levels at once.
 */
public record SweepEvent(
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("levelsCleared") int levelsCleared,
    @JsonProperty("notional") double notional
) {

    /**
     * UP sweeps lift offers (buy pressure), DOWN sweeps hit bids (sell pressure).
     */
    public enum Direction {
        UP("up"),
        DOWN("down");

        private final String code;

        Direction(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }

        @JsonCreator
        public static Direction fromCode(String code) {
            return "up".equalsIgnoreCase(code) ? UP : DOWN;
        }
    }
}
