package in.orderflow.domain.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Audit-log line. {@code auto} is true for engine-driven entries (auto-take, automatic resets).
 */
public record GuardrailLogEntry(
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("source") GuardrailSource source,
    @JsonProperty("message") String message,
    @JsonProperty("signalId") String signalId,
    @JsonProperty("auto") boolean auto
) {}
