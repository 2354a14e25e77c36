package in.orderflow.domain.invalidation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Human-readable label/value pair backing an invalidation event.
 */
public record EvidenceItem(
    @JsonProperty("label") String label,
    @JsonProperty("value") String value
) {}
