package in.orderflow.infrastructure.replay;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import in.orderflow.domain.data.FootprintBar;
import in.orderflow.domain.data.Tick;
import in.orderflow.domain.signal.Signal;

import java.util.List;

/**
 * One line of a recorded feed.
 *
 * <pre>
 * {"type":"signals","ts":1700000000000,"signals":[...],"bars":[...]}
 * {"type":"bars","ts":1700000000000,"bars":[...]}
 * {"type":"trades","ts":1700000000000,"trades":[...]}
 * {"type":"clock-offset","ts":1700000000000,"offsetMs":-250}
 * </pre>
 *
 * {@code ts} is the feed time the event was recorded at; for trade batches it
 * defaults to the latest print.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReplayEvent(
    @JsonProperty("type") Type type,
    @JsonProperty("ts") long timestamp,
    @JsonProperty("signals") List<Signal> signals,
    @JsonProperty("bars") List<FootprintBar> bars,
    @JsonProperty("trades") List<Tick> trades,
    @JsonProperty("offsetMs") Long offsetMs
) {
    public ReplayEvent {
        signals = signals == null ? List.of() : List.copyOf(signals);
        trades = trades == null ? List.of() : List.copyOf(trades);
        if (bars != null) {
            bars = List.copyOf(bars);
        }
        if (timestamp <= 0 && !trades.isEmpty()) {
            timestamp = trades.stream().mapToLong(Tick::timestamp).max().orElse(0);
        }
    }

    public enum Type {
        SIGNALS("signals"),
        BARS("bars"),
        TRADES("trades"),
        CLOCK_OFFSET("clock-offset");

        private final String code;

        Type(String code) {
            this.code = code;
        }

        @JsonValue
        public String code() {
            return code;
        }

        @JsonCreator
        public static Type fromCode(String code) {
            for (Type type : values()) {
                if (type.code.equalsIgnoreCase(code)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown replay event type: " + code);
        }
    }
}
