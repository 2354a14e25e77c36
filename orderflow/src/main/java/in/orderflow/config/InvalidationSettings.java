package in.orderflow.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import static in.orderflow.config.SettingsMath.atLeast;
import static in.orderflow.config.SettingsMath.clamp;

/**
 * Thresholds of the seven-trigger legacy invalidation scorer.
 *
 * Values are clamped on construction, so every instance is valid.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvalidationSettings(
    @JsonProperty("aggressiveness")
    InvalidationAggressiveness aggressiveness,

    @JsonProperty("lookbackBars")
    int lookbackBars,                    // bars after entry an opposite signal still counts

    @JsonProperty("autoCloseHighSeverity")
    boolean autoCloseHighSeverity,

    @JsonProperty("autoCloseThreshold")
    double autoCloseThreshold,           // score 0-100

    @JsonProperty("minOppositeSignalScore")
    double minOppositeSignalScore,       // score 0-100

    @JsonProperty("stackedImbalanceLevels")
    int stackedImbalanceLevels,

    @JsonProperty("stackedImbalanceRatio")
    double stackedImbalanceRatio,

    @JsonProperty("stackedImbalanceWindowSeconds")
    double stackedImbalanceWindowSeconds,

    @JsonProperty("minProgressR")
    double minProgressR,                 // MFE in R that counts as "the trade worked"

    @JsonProperty("deltaFlipWindow")
    int deltaFlipWindow,

    @JsonProperty("cumDeltaLookback")
    int cumDeltaLookback,

    @JsonProperty("timeDecayMinutes")
    int timeDecayMinutes,

    @JsonProperty("liquiditySweepPercentile")
    double liquiditySweepPercentile,     // 0-1

    @JsonProperty("liquidityRetracePercent")
    double liquidityRetracePercent,      // 0-1

    @JsonProperty("keyLevelDeltaThreshold")
    double keyLevelDeltaThreshold        // |delta| / volume, 0-1
) {
    public InvalidationSettings {
        if (aggressiveness == null) {
            aggressiveness = InvalidationAggressiveness.MODERATE;
        }
        lookbackBars = atLeast(lookbackBars, 1);
        autoCloseThreshold = clamp(autoCloseThreshold, 0, 100);
        minOppositeSignalScore = clamp(minOppositeSignalScore, 0, 100);
        stackedImbalanceLevels = atLeast(stackedImbalanceLevels, 2);
        stackedImbalanceRatio = atLeast(stackedImbalanceRatio, 1);
        stackedImbalanceWindowSeconds = atLeast(stackedImbalanceWindowSeconds, 15);
        minProgressR = atLeast(minProgressR, 0);
        deltaFlipWindow = atLeast(deltaFlipWindow, 2);
        cumDeltaLookback = atLeast(cumDeltaLookback, 3);
        timeDecayMinutes = atLeast(timeDecayMinutes, 1);
        liquiditySweepPercentile = clamp(liquiditySweepPercentile, 0, 1);
        liquidityRetracePercent = clamp(liquidityRetracePercent, 0, 1);
        keyLevelDeltaThreshold = clamp(keyLevelDeltaThreshold, 0, 1);
    }

    public static InvalidationSettings defaults() {
        return new InvalidationSettings(
            InvalidationAggressiveness.MODERATE,
            6,      // lookback bars
            false,  // no auto close
            85,     // auto close threshold
            75,     // min opposite signal score
            4,      // stacked levels
            4,      // stacked ratio
            60,     // stacked window seconds
            0.5,    // min progress R
            2,      // delta flip window
            5,      // cum delta lookback
            9,      // time decay minutes
            0.85,   // sweep volume percentile
            0.8,    // sweep retrace
            0.65    // key level delta ratio
        );
    }

    public InvalidationSettings withAutoClose(boolean enabled, double threshold) {
        return new InvalidationSettings(aggressiveness, lookbackBars, enabled, threshold, minOppositeSignalScore,
            stackedImbalanceLevels, stackedImbalanceRatio, stackedImbalanceWindowSeconds, minProgressR,
            deltaFlipWindow, cumDeltaLookback, timeDecayMinutes, liquiditySweepPercentile,
            liquidityRetracePercent, keyLevelDeltaThreshold);
    }

    public InvalidationSettings withAggressiveness(InvalidationAggressiveness value) {
        return new InvalidationSettings(value, lookbackBars, autoCloseHighSeverity, autoCloseThreshold,
            minOppositeSignalScore, stackedImbalanceLevels, stackedImbalanceRatio, stackedImbalanceWindowSeconds,
            minProgressR, deltaFlipWindow, cumDeltaLookback, timeDecayMinutes, liquiditySweepPercentile,
            liquidityRetracePercent, keyLevelDeltaThreshold);
    }
}
