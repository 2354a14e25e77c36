package in.orderflow.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import static in.orderflow.config.SettingsMath.atLeast;
import static in.orderflow.config.SettingsMath.clamp;

/**
 * Two-factor (prints + order book) invalidation policy.
 *
 * When {@code enabled}, this policy replaces the legacy seven-trigger scorer.
 * Tier thresholds are kept ordered: severe >= high >= medium.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectiveInvalidationSettings(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("lookbackBars")
    int lookbackBars,

    @JsonProperty("printsThreshold")
    double printsThreshold,             // 0-100, prints sub-score needed for confirmation

    @JsonProperty("depthThreshold")
    double depthThreshold,              // 0-100, depth sub-score needed for confirmation

    @JsonProperty("printsWeight")
    double printsWeight,

    @JsonProperty("depthWeight")
    double depthWeight,

    @JsonProperty("persistenceSeconds")
    double persistenceSeconds,          // confirmation must hold this long...

    @JsonProperty("persistenceBars")
    int persistenceBars,                // ...or across this many closed bars

    @JsonProperty("gracePeriodSeconds")
    double gracePeriodSeconds,          // silence after entry unless a severe sweep hits

    @JsonProperty("mediumThreshold")
    double mediumThreshold,

    @JsonProperty("highThreshold")
    double highThreshold,

    @JsonProperty("severeThreshold")
    double severeThreshold,

    @JsonProperty("hysteresisPoints")
    double hysteresisPoints,

    @JsonProperty("severeSweepMinLevels")
    int severeSweepMinLevels,

    @JsonProperty("severeSweepRecencySeconds")
    double severeSweepRecencySeconds,

    @JsonProperty("winnerProtectionEnabled")
    boolean winnerProtectionEnabled,

    @JsonProperty("winnerNearTargetFraction")
    double winnerNearTargetFraction,    // 0-1 of the distance entry -> target1

    @JsonProperty("winnerMinMfeR")
    double winnerMinMfeR,

    @JsonProperty("winnerDepthOverride")
    double winnerDepthOverride,         // depth score that overrides protection

    @JsonProperty("autoCloseSevere")
    boolean autoCloseSevere
) {
    public ObjectiveInvalidationSettings {
        lookbackBars = atLeast(lookbackBars, 2);
        printsThreshold = clamp(printsThreshold, 0, 100);
        depthThreshold = clamp(depthThreshold, 0, 100);
        printsWeight = atLeast(printsWeight, 0);
        depthWeight = atLeast(depthWeight, 0);
        if (printsWeight + depthWeight <= 0) {
            printsWeight = 0.5;
            depthWeight = 0.5;
        }
        persistenceSeconds = atLeast(persistenceSeconds, 0);
        persistenceBars = atLeast(persistenceBars, 0);
        gracePeriodSeconds = atLeast(gracePeriodSeconds, 0);
        mediumThreshold = clamp(mediumThreshold, 0, 100);
        highThreshold = Math.max(mediumThreshold, clamp(highThreshold, 0, 100));
        severeThreshold = Math.max(highThreshold, clamp(severeThreshold, 0, 100));
        hysteresisPoints = clamp(hysteresisPoints, 0, 100);
        severeSweepMinLevels = atLeast(severeSweepMinLevels, 1);
        severeSweepRecencySeconds = atLeast(severeSweepRecencySeconds, 0);
        winnerNearTargetFraction = clamp(winnerNearTargetFraction, 0, 1);
        winnerMinMfeR = atLeast(winnerMinMfeR, 0);
        winnerDepthOverride = clamp(winnerDepthOverride, 0, 100);
    }

    public static ObjectiveInvalidationSettings defaults() {
        return new ObjectiveInvalidationSettings(
            false,  // legacy scorer unless enabled
            5,      // lookback bars
            60,     // prints threshold
            55,     // depth threshold
            0.55,   // prints weight
            0.45,   // depth weight
            20,     // persistence seconds
            2,      // persistence bars
            30,     // grace period seconds
            55,     // medium
            70,     // high
            85,     // severe
            8,      // hysteresis points
            3,      // severe sweep levels
            30,     // severe sweep recency seconds
            true,   // winner protection
            0.8,    // near target1
            1.0,    // banked MFE (R)
            75,     // depth override
            false   // auto close severe
        );
    }

    /**
     * Prints weight normalised so both weights sum to one.
     */
    @JsonIgnore
    public double normalizedPrintsWeight() {
        return printsWeight / (printsWeight + depthWeight);
    }

    @JsonIgnore
    public double normalizedDepthWeight() {
        return depthWeight / (printsWeight + depthWeight);
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private boolean enabled;
        private int lookbackBars;
        private double printsThreshold;
        private double depthThreshold;
        private double printsWeight;
        private double depthWeight;
        private double persistenceSeconds;
        private int persistenceBars;
        private double gracePeriodSeconds;
        private double mediumThreshold;
        private double highThreshold;
        private double severeThreshold;
        private double hysteresisPoints;
        private int severeSweepMinLevels;
        private double severeSweepRecencySeconds;
        private boolean winnerProtectionEnabled;
        private double winnerNearTargetFraction;
        private double winnerMinMfeR;
        private double winnerDepthOverride;
        private boolean autoCloseSevere;

        private Builder(ObjectiveInvalidationSettings source) {
            this.enabled = source.enabled;
            this.lookbackBars = source.lookbackBars;
            this.printsThreshold = source.printsThreshold;
            this.depthThreshold = source.depthThreshold;
            this.printsWeight = source.printsWeight;
            this.depthWeight = source.depthWeight;
            this.persistenceSeconds = source.persistenceSeconds;
            this.persistenceBars = source.persistenceBars;
            this.gracePeriodSeconds = source.gracePeriodSeconds;
            this.mediumThreshold = source.mediumThreshold;
            this.highThreshold = source.highThreshold;
            this.severeThreshold = source.severeThreshold;
            this.hysteresisPoints = source.hysteresisPoints;
            this.severeSweepMinLevels = source.severeSweepMinLevels;
            this.severeSweepRecencySeconds = source.severeSweepRecencySeconds;
            this.winnerProtectionEnabled = source.winnerProtectionEnabled;
            this.winnerNearTargetFraction = source.winnerNearTargetFraction;
            this.winnerMinMfeR = source.winnerMinMfeR;
            this.winnerDepthOverride = source.winnerDepthOverride;
            this.autoCloseSevere = source.autoCloseSevere;
        }

        public Builder enabled(boolean value) { this.enabled = value; return this; }
        public Builder lookbackBars(int value) { this.lookbackBars = value; return this; }
        public Builder printsThreshold(double value) { this.printsThreshold = value; return this; }
        public Builder depthThreshold(double value) { this.depthThreshold = value; return this; }
        public Builder printsWeight(double value) { this.printsWeight = value; return this; }
        public Builder depthWeight(double value) { this.depthWeight = value; return this; }
        public Builder persistenceSeconds(double value) { this.persistenceSeconds = value; return this; }
        public Builder persistenceBars(int value) { this.persistenceBars = value; return this; }
        public Builder gracePeriodSeconds(double value) { this.gracePeriodSeconds = value; return this; }
        public Builder mediumThreshold(double value) { this.mediumThreshold = value; return this; }
        public Builder highThreshold(double value) { this.highThreshold = value; return this; }
        public Builder severeThreshold(double value) { this.severeThreshold = value; return this; }
        public Builder hysteresisPoints(double value) { this.hysteresisPoints = value; return this; }
        public Builder severeSweepMinLevels(int value) { this.severeSweepMinLevels = value; return this; }
        public Builder severeSweepRecencySeconds(double value) { this.severeSweepRecencySeconds = value; return this; }
        public Builder winnerProtectionEnabled(boolean value) { this.winnerProtectionEnabled = value; return this; }
        public Builder winnerNearTargetFraction(double value) { this.winnerNearTargetFraction = value; return this; }
        public Builder winnerMinMfeR(double value) { this.winnerMinMfeR = value; return this; }
        public Builder winnerDepthOverride(double value) { this.winnerDepthOverride = value; return this; }
        public Builder autoCloseSevere(boolean value) { this.autoCloseSevere = value; return this; }

        public ObjectiveInvalidationSettings build() {
            return new ObjectiveInvalidationSettings(enabled, lookbackBars, printsThreshold, depthThreshold,
                printsWeight, depthWeight, persistenceSeconds, persistenceBars, gracePeriodSeconds,
                mediumThreshold, highThreshold, severeThreshold, hysteresisPoints, severeSweepMinLevels,
                severeSweepRecencySeconds, winnerProtectionEnabled, winnerNearTargetFraction, winnerMinMfeR,
                winnerDepthOverride, autoCloseSevere);
        }
    }
}
