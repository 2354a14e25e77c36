package in.orderflow.domain.invalidation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trigger that fired within an event, with its clamped severity.
 */
public record TriggerScore(
    @JsonProperty("id") InvalidationTrigger trigger,
    @JsonProperty("severity") double severity
) {}
