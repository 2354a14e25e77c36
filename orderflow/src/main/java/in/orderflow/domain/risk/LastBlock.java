package in.orderflow.domain.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Most recent denied entry attempt.
 */
public record LastBlock(
    @JsonProperty("block") GuardrailBlock block,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("signalId") String signalId,
    @JsonProperty("auto") boolean auto
) {}
