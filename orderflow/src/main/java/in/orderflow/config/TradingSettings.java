package in.orderflow.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import static in.orderflow.config.SettingsMath.atLeast;
import static in.orderflow.config.SettingsMath.clamp;

/**
 * Simulator configuration.
 *
 * Clamp-on-write: the canonical constructor normalises every field, so an
 * out-of-range input is silently corrected instead of rejected. Two settings
 * are considered equal when every (clamped) field is equal.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradingSettings(
    @JsonProperty("autoTake")
    boolean autoTake,                   // create pending orders for every new signal

    @JsonProperty("riskPerTradePercent")
    double riskPerTradePercent,         // account % risked per trade (1.0 = 1%)

    @JsonProperty("feesPercent")
    double feesPercent,                 // per leg, in percent of notional (0.01 = 0.01%)

    @JsonProperty("slippageTicks")
    double slippageTicks,

    @JsonProperty("partialTakePercent")
    double partialTakePercent,          // fraction closed at target1, 0-1

    @JsonProperty("timeStopMinutes")
    Double timeStopMinutes,             // null = no time stop

    @JsonProperty("retestWindowMinutes")
    double retestWindowMinutes,

    @JsonProperty("beOffsetTicks")
    double beOffsetTicks,

    @JsonProperty("invalidationBars")
    int invalidationBars,               // 0 = legacy bar-count invalidation off

    @JsonProperty("invalidations")
    InvalidationSettings invalidations,

    @JsonProperty("objectiveInvalidation")
    ObjectiveInvalidationSettings objectiveInvalidation,

    @JsonProperty("guardrails")
    RiskGuardrailSettings guardrails
) {
    public TradingSettings {
        riskPerTradePercent = atLeast(riskPerTradePercent, 0);
        feesPercent = atLeast(feesPercent, 0);
        slippageTicks = atLeast(slippageTicks, 0);
        partialTakePercent = clamp(partialTakePercent, 0, 1);
        if (timeStopMinutes != null && !(timeStopMinutes > 0)) {
            timeStopMinutes = null;
        }
        retestWindowMinutes = atLeast(retestWindowMinutes, 0);
        beOffsetTicks = atLeast(beOffsetTicks, 0);
        invalidationBars = Math.max(0, invalidationBars);
        if (invalidations == null) {
            invalidations = InvalidationSettings.defaults();
        }
        if (objectiveInvalidation == null) {
            objectiveInvalidation = ObjectiveInvalidationSettings.defaults();
        }
        if (guardrails == null) {
            guardrails = RiskGuardrailSettings.defaults();
        }
    }

    public static TradingSettings defaults() {
        return new TradingSettings(
            false,  // manual take
            1.0,    // 1% risk
            0.01,   // 0.01% fee per leg
            0.5,    // half a tick slippage
            0.5,    // half off at target1
            15.0,   // time stop minutes
            5,      // retest window minutes
            0.5,    // breakeven offset ticks
            0,      // legacy bar invalidation off
            InvalidationSettings.defaults(),
            ObjectiveInvalidationSettings.defaults(),
            RiskGuardrailSettings.defaults()
        );
    }

    /**
     * Account risk per trade as a fraction (1% -> 0.01).
     */
    @JsonIgnore
    public double riskFraction() {
        return riskPerTradePercent / 100.0;
    }

    /**
     * Fee rate per leg as a fraction of notional.
     */
    @JsonIgnore
    public double feeRate() {
        return feesPercent / 100.0;
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private boolean autoTake;
        private double riskPerTradePercent;
        private double feesPercent;
        private double slippageTicks;
        private double partialTakePercent;
        private Double timeStopMinutes;
        private double retestWindowMinutes;
        private double beOffsetTicks;
        private int invalidationBars;
        private InvalidationSettings invalidations;
        private ObjectiveInvalidationSettings objectiveInvalidation;
        private RiskGuardrailSettings guardrails;

        private Builder(TradingSettings source) {
            this.autoTake = source.autoTake;
            this.riskPerTradePercent = source.riskPerTradePercent;
            this.feesPercent = source.feesPercent;
            this.slippageTicks = source.slippageTicks;
            this.partialTakePercent = source.partialTakePercent;
            this.timeStopMinutes = source.timeStopMinutes;
            this.retestWindowMinutes = source.retestWindowMinutes;
            this.beOffsetTicks = source.beOffsetTicks;
            this.invalidationBars = source.invalidationBars;
            this.invalidations = source.invalidations;
            this.objectiveInvalidation = source.objectiveInvalidation;
            this.guardrails = source.guardrails;
        }

        public Builder autoTake(boolean value) { this.autoTake = value; return this; }
        public Builder riskPerTradePercent(double value) { this.riskPerTradePercent = value; return this; }
        public Builder feesPercent(double value) { this.feesPercent = value; return this; }
        public Builder slippageTicks(double value) { this.slippageTicks = value; return this; }
        public Builder partialTakePercent(double value) { this.partialTakePercent = value; return this; }
        public Builder timeStopMinutes(Double value) { this.timeStopMinutes = value; return this; }
        public Builder retestWindowMinutes(double value) { this.retestWindowMinutes = value; return this; }
        public Builder beOffsetTicks(double value) { this.beOffsetTicks = value; return this; }
        public Builder invalidationBars(int value) { this.invalidationBars = value; return this; }
        public Builder invalidations(InvalidationSettings value) { this.invalidations = value; return this; }
        public Builder objectiveInvalidation(ObjectiveInvalidationSettings value) { this.objectiveInvalidation = value; return this; }
        public Builder guardrails(RiskGuardrailSettings value) { this.guardrails = value; return this; }

        public TradingSettings build() {
            return new TradingSettings(autoTake, riskPerTradePercent, feesPercent, slippageTicks,
                partialTakePercent, timeStopMinutes, retestWindowMinutes, beOffsetTicks, invalidationBars,
                invalidations, objectiveInvalidation, guardrails);
        }
    }
}
