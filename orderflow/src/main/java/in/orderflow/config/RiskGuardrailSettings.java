package in.orderflow.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.orderflow.domain.signal.TradingSession;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Account-level risk limits.
 *
 * Nullable caps are disabled when null. Per-session caps are keyed by session
 * code ("asia", "eu", "us", "other"). An empty {@code allowedSessions} list
 * allows every session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskGuardrailSettings(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("maxDailyLossR")
    Double maxDailyLossR,

    @JsonProperty("maxTradesPerDay")
    Integer maxTradesPerDay,

    @JsonProperty("maxConsecutiveLosses")
    Integer maxConsecutiveLosses,

    @JsonProperty("perSessionMaxTrades")
    Map<String, Integer> perSessionMaxTrades,

    @JsonProperty("perSessionMaxLossR")
    Map<String, Double> perSessionMaxLossR,

    @JsonProperty("lossCooldownTrigger")
    int lossCooldownTrigger,            // consecutive losses that arm the cooldown, 0 = off

    @JsonProperty("lossCooldownMinutes")
    int lossCooldownMinutes,

    @JsonProperty("dailyStopCooldownMinutes")
    int dailyStopCooldownMinutes,       // 0 = until the day resets

    @JsonProperty("allowedSessions")
    List<TradingSession> allowedSessions,

    @JsonProperty("newsWindows")
    List<NewsWindow> newsWindows
) {
    private static final double EPSILON = 1e-8;

    public RiskGuardrailSettings {
        if (maxDailyLossR != null && !(maxDailyLossR >= EPSILON)) {
            maxDailyLossR = null;
        }
        if (maxTradesPerDay != null && maxTradesPerDay < 1) {
            maxTradesPerDay = null;
        }
        if (maxConsecutiveLosses != null && maxConsecutiveLosses < 1) {
            maxConsecutiveLosses = null;
        }
        perSessionMaxTrades = sanitizeSessionMap(perSessionMaxTrades);
        perSessionMaxLossR = sanitizeSessionMap(perSessionMaxLossR);
        lossCooldownTrigger = Math.max(0, lossCooldownTrigger);
        lossCooldownMinutes = Math.max(0, lossCooldownMinutes);
        dailyStopCooldownMinutes = Math.max(0, dailyStopCooldownMinutes);
        allowedSessions = allowedSessions == null
            ? List.of()
            : List.copyOf(new LinkedHashSet<>(allowedSessions.stream().filter(s -> s != null).toList()));
        newsWindows = newsWindows == null
            ? List.of()
            : List.copyOf(newsWindows.stream().filter(w -> w != null).toList());
    }

    public static RiskGuardrailSettings defaults() {
        return new RiskGuardrailSettings(
            false,
            null,
            null,
            null,
            Map.of(),
            Map.of(),
            0,
            15,
            1440,
            List.of(TradingSession.EU, TradingSession.US),
            List.of()
        );
    }

    public Integer maxTradesFor(TradingSession session) {
        return perSessionMaxTrades.get(session.code());
    }

    public Double maxLossRFor(TradingSession session) {
        return perSessionMaxLossR.get(session.code());
    }

    public boolean isSessionAllowed(TradingSession session) {
        return allowedSessions.isEmpty() || allowedSessions.contains(session);
    }

    private static <N extends Number> Map<String, N> sanitizeSessionMap(Map<String, N> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        Map<String, N> result = new LinkedHashMap<>();
        for (TradingSession session : TradingSession.values()) {
            N value = input.get(session.code());
            if (value != null && Double.isFinite(value.doubleValue()) && value.doubleValue() >= 0) {
                result.put(session.code(), value);
            }
        }
        return Map.copyOf(result);
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private boolean enabled;
        private Double maxDailyLossR;
        private Integer maxTradesPerDay;
        private Integer maxConsecutiveLosses;
        private final Map<String, Integer> perSessionMaxTrades;
        private final Map<String, Double> perSessionMaxLossR;
        private int lossCooldownTrigger;
        private int lossCooldownMinutes;
        private int dailyStopCooldownMinutes;
        private List<TradingSession> allowedSessions;
        private final List<NewsWindow> newsWindows;

        private Builder(RiskGuardrailSettings source) {
            this.enabled = source.enabled;
            this.maxDailyLossR = source.maxDailyLossR;
            this.maxTradesPerDay = source.maxTradesPerDay;
            this.maxConsecutiveLosses = source.maxConsecutiveLosses;
            this.perSessionMaxTrades = new LinkedHashMap<>(source.perSessionMaxTrades);
            this.perSessionMaxLossR = new LinkedHashMap<>(source.perSessionMaxLossR);
            this.lossCooldownTrigger = source.lossCooldownTrigger;
            this.lossCooldownMinutes = source.lossCooldownMinutes;
            this.dailyStopCooldownMinutes = source.dailyStopCooldownMinutes;
            this.allowedSessions = new ArrayList<>(source.allowedSessions);
            this.newsWindows = new ArrayList<>(source.newsWindows);
        }

        public Builder enabled(boolean value) { this.enabled = value; return this; }
        public Builder maxDailyLossR(Double value) { this.maxDailyLossR = value; return this; }
        public Builder maxTradesPerDay(Integer value) { this.maxTradesPerDay = value; return this; }
        public Builder maxConsecutiveLosses(Integer value) { this.maxConsecutiveLosses = value; return this; }
        public Builder lossCooldownTrigger(int value) { this.lossCooldownTrigger = value; return this; }
        public Builder lossCooldownMinutes(int value) { this.lossCooldownMinutes = value; return this; }
        public Builder dailyStopCooldownMinutes(int value) { this.dailyStopCooldownMinutes = value; return this; }

        public Builder sessionMaxTrades(TradingSession session, Integer value) {
            if (value == null) {
                perSessionMaxTrades.remove(session.code());
            } else {
                perSessionMaxTrades.put(session.code(), value);
            }
            return this;
        }

        public Builder sessionMaxLossR(TradingSession session, Double value) {
            if (value == null) {
                perSessionMaxLossR.remove(session.code());
            } else {
                perSessionMaxLossR.put(session.code(), value);
            }
            return this;
        }

        public Builder allowedSessions(List<TradingSession> sessions) {
            this.allowedSessions = sessions == null ? new ArrayList<>() : new ArrayList<>(sessions);
            return this;
        }

        public Builder addNewsWindow(NewsWindow window) {
            this.newsWindows.add(window);
            return this;
        }

        public RiskGuardrailSettings build() {
            return new RiskGuardrailSettings(enabled, maxDailyLossR, maxTradesPerDay, maxConsecutiveLosses,
                perSessionMaxTrades, perSessionMaxLossR, lossCooldownTrigger, lossCooldownMinutes,
                dailyStopCooldownMinutes, allowedSessions, newsWindows);
        }
    }
}
