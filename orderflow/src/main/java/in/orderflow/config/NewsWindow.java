package in.orderflow.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scheduled news blackout. {@code start}/{@code end} are ISO-8601 instants;
 * windows that fail to parse or end before they start are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NewsWindow(
    @JsonProperty("id") String id,
    @JsonProperty("label") String label,
    @JsonProperty("start") String start,
    @JsonProperty("end") String end
) {}
