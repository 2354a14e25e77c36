package in.orderflow.domain.invalidation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters of the objective invalidation policy since engine start.
 */
public record ObjectiveKpis(
    @JsonProperty("evaluations") long evaluations,
    @JsonProperty("doubleConfirmations") long doubleConfirmations,
    @JsonProperty("eventsEmitted") long eventsEmitted,
    @JsonProperty("graceSuppressed") long graceSuppressed,
    @JsonProperty("persistenceSuppressed") long persistenceSuppressed,
    @JsonProperty("severeSweepOverrides") long severeSweepOverrides,
    @JsonProperty("winnerProtected") long winnerProtected,
    @JsonProperty("hysteresisResets") long hysteresisResets,
    @JsonProperty("autoClosed") long autoClosed
) {
    public static final ObjectiveKpis EMPTY = new ObjectiveKpis(0, 0, 0, 0, 0, 0, 0, 0, 0);
}
