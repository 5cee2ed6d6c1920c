package in.fxsignal.config;

import in.fxsignal.domain.data.Granularity;
import in.fxsignal.service.breakout.BreakoutRule;
import in.fxsignal.service.signal.EntryTiming;
import in.fxsignal.service.strength.StrengthWeights;
import in.fxsignal.util.Env;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the signal pipeline.
 *
 * {@link #defaults()} gives the documented defaults; {@link #fromEnv()} overlays
 * environment variables / system properties on top of them.
 */
public final class SignalConfig {

    /**
     * Cooldown category used for trade signals.
     */
    public enum CooldownScope {
        /** One category ("strength_alert") for all sessions. */
        GLOBAL,
        /** Category is the current trading session name; pruned on session rollover. */
        SESSION
    }

    public static final List<String> DEFAULT_PAIRS = List.of(
        "EUR_USD", "GBP_USD", "USD_JPY", "USD_CHF", "AUD_USD", "NZD_USD", "USD_CAD",
        "EUR_GBP", "EUR_JPY", "GBP_JPY", "EUR_AUD", "EUR_CAD", "EUR_NZD",
        "GBP_AUD", "GBP_CAD", "GBP_NZD", "AUD_JPY", "NZD_JPY", "CAD_JPY", "CHF_JPY",
        "AUD_NZD", "AUD_CAD", "AUD_CHF", "NZD_CAD", "NZD_CHF", "CAD_CHF", "EUR_CHF", "GBP_CHF"
    );

    public static final String DEFAULT_NEWS_CALENDAR_URL = "https://nfs.faireconomy.media/ff_calendar_thisweek.json";

    private final List<String> pairs;
    private final Granularity strengthGranularity;
    private final int strengthCandleCount;
    private final StrengthWeights strengthWeights;
    private final String strengthPolicy;
    private final List<BreakoutRule> breakoutRules;
    private final double atrMultiplier;
    private final int rangeLookback;
    private final int priorDayScanBars;
    private final boolean trendFilterEnabled;
    private final int trendEmaPeriod;
    private final Granularity decisionGranularity;
    private final Granularity executionGranularity;
    private final int decisionCandleCount;
    private final int executionCandleCount;
    private final EntryTiming entryTiming;
    private final double pullbackArmLevel;
    private final boolean retestEnabled;
    private final int retestLookback;
    private final double retestAtrTolerance;
    private final double stopAtrMultiple;
    private final List<Double> targetAtrMultiples;
    private final double minRewardRisk;
    private final Duration signalCooldown;
    private final CooldownScope cooldownScope;
    private final Duration strengthAlertCooldown;
    private final int breakoutAlertMinPairs;
    private final Duration breakoutAlertCooldown;
    private final Duration heartbeatCooldown;
    private final int topCandidates;
    private final Duration loopInterval;
    private final int candleRetryAttempts;
    private final Duration candleRetryInitialDelay;
    private final String newsCalendarUrl;
    private final Duration newsCheckInterval;
    private final String cooldownStore;
    private final String stateDir;
    private final int port;
    private final boolean signalDebug;

    private SignalConfig(Builder b) {
        this.pairs = List.copyOf(b.pairs);
        this.strengthGranularity = b.strengthGranularity;
        this.strengthCandleCount = b.strengthCandleCount;
        this.strengthWeights = b.strengthWeights;
        this.strengthPolicy = b.strengthPolicy;
        this.breakoutRules = List.copyOf(b.breakoutRules);
        this.atrMultiplier = b.atrMultiplier;
        this.rangeLookback = b.rangeLookback;
        this.priorDayScanBars = b.priorDayScanBars;
        this.trendFilterEnabled = b.trendFilterEnabled;
        this.trendEmaPeriod = b.trendEmaPeriod;
        this.decisionGranularity = b.decisionGranularity;
        this.executionGranularity = b.executionGranularity;
        this.decisionCandleCount = b.decisionCandleCount;
        this.executionCandleCount = b.executionCandleCount;
        this.entryTiming = b.entryTiming;
        this.pullbackArmLevel = b.pullbackArmLevel;
        this.retestEnabled = b.retestEnabled;
        this.retestLookback = b.retestLookback;
        this.retestAtrTolerance = b.retestAtrTolerance;
        this.stopAtrMultiple = b.stopAtrMultiple;
        this.targetAtrMultiples = List.copyOf(b.targetAtrMultiples);
        this.minRewardRisk = b.minRewardRisk;
        this.signalCooldown = b.signalCooldown;
        this.cooldownScope = b.cooldownScope;
        this.strengthAlertCooldown = b.strengthAlertCooldown;
        this.breakoutAlertMinPairs = b.breakoutAlertMinPairs;
        this.breakoutAlertCooldown = b.breakoutAlertCooldown;
        this.heartbeatCooldown = b.heartbeatCooldown;
        this.topCandidates = b.topCandidates;
        this.loopInterval = b.loopInterval;
        this.candleRetryAttempts = b.candleRetryAttempts;
        this.candleRetryInitialDelay = b.candleRetryInitialDelay;
        this.newsCalendarUrl = b.newsCalendarUrl;
        this.newsCheckInterval = b.newsCheckInterval;
        this.cooldownStore = b.cooldownStore;
        this.stateDir = b.stateDir;
        this.port = b.port;
        this.signalDebug = b.signalDebug;
    }

    public static SignalConfig defaults() {
        return builder().build();
    }

    /**
     * Load from environment, falling back to defaults for unset keys.
     */
    public static SignalConfig fromEnv() {
        Builder d = builder();
        return builder()
            .pairs(Env.getList("PAIRS", d.pairs))
            .strengthGranularity(Granularity.parse(Env.get("STRENGTH_GRANULARITY", d.strengthGranularity.name())))
            .strengthCandleCount(Env.getInt("STRENGTH_CANDLE_COUNT", d.strengthCandleCount))
            .strengthWeights(StrengthWeights.parse(Env.getList("STRENGTH_WEIGHTS", List.of("0.4", "0.3", "0.2", "0.1"))))
            .strengthPolicy(Env.get("STRENGTH_POLICY", d.strengthPolicy))
            .breakoutRules(BreakoutRule.parseAll(Env.getList("BREAKOUT_RULES", List.of("SWING_ATR:H1", "PRIOR_DAY:H1"))))
            .atrMultiplier(Env.getDouble("ATR_MULTIPLIER", d.atrMultiplier))
            .rangeLookback(Env.getInt("RANGE_LOOKBACK", d.rangeLookback))
            .priorDayScanBars(Env.getInt("PRIOR_DAY_SCAN_BARS", d.priorDayScanBars))
            .trendFilterEnabled(Env.getBool("TREND_FILTER_ENABLED", d.trendFilterEnabled))
            .trendEmaPeriod(Env.getInt("TREND_EMA_PERIOD", d.trendEmaPeriod))
            .decisionGranularity(Granularity.parse(Env.get("DECISION_GRANULARITY", d.decisionGranularity.name())))
            .executionGranularity(Granularity.parse(Env.get("EXECUTION_GRANULARITY", d.executionGranularity.name())))
            .decisionCandleCount(Env.getInt("DECISION_CANDLE_COUNT", d.decisionCandleCount))
            .executionCandleCount(Env.getInt("EXECUTION_CANDLE_COUNT", d.executionCandleCount))
            .entryTiming(EntryTiming.valueOf(Env.get("ENTRY_TIMING", d.entryTiming.name()).trim().toUpperCase()))
            .pullbackArmLevel(Env.getDouble("PULLBACK_ARM_LEVEL", d.pullbackArmLevel))
            .retestEnabled(Env.getBool("RETEST_ENABLED", d.retestEnabled))
            .retestLookback(Env.getInt("RETEST_LOOKBACK", d.retestLookback))
            .retestAtrTolerance(Env.getDouble("RETEST_ATR_TOLERANCE", d.retestAtrTolerance))
            .stopAtrMultiple(Env.getDouble("STOP_ATR_MULTIPLE", d.stopAtrMultiple))
            .targetAtrMultiples(parseDoubles(Env.getList("TARGET_ATR_MULTIPLES", List.of("2", "4", "6"))))
            .minRewardRisk(Env.getDouble("MIN_REWARD_RISK", d.minRewardRisk))
            .signalCooldown(Duration.ofSeconds(Env.getLong("SIGNAL_COOLDOWN_SECONDS", d.signalCooldown.getSeconds())))
            .cooldownScope(CooldownScope.valueOf(Env.get("COOLDOWN_SCOPE", d.cooldownScope.name()).trim().toUpperCase()))
            .strengthAlertCooldown(Duration.ofSeconds(
                Env.getLong("STRENGTH_ALERT_COOLDOWN_SECONDS", d.strengthAlertCooldown.getSeconds())))
            .breakoutAlertMinPairs(Env.getInt("BREAKOUT_ALERT_MIN_PAIRS", d.breakoutAlertMinPairs))
            .breakoutAlertCooldown(Duration.ofSeconds(
                Env.getLong("BREAKOUT_ALERT_COOLDOWN_SECONDS", d.breakoutAlertCooldown.getSeconds())))
            .heartbeatCooldown(Duration.ofSeconds(Env.getLong("HEARTBEAT_COOLDOWN_SECONDS", d.heartbeatCooldown.getSeconds())))
            .topCandidates(Env.getInt("TOP_CANDIDATES", d.topCandidates))
            .loopInterval(Duration.ofSeconds(Env.getLong("LOOP_INTERVAL_SECONDS", d.loopInterval.getSeconds())))
            .candleRetryAttempts(Env.getInt("CANDLE_RETRY_ATTEMPTS", d.candleRetryAttempts))
            .candleRetryInitialDelay(Duration.ofMillis(
                Env.getLong("CANDLE_RETRY_INITIAL_MS", d.candleRetryInitialDelay.toMillis())))
            .newsCalendarUrl(Env.getBool("NEWS_ALERTS_ENABLED", true)
                ? Env.get("NEWS_CALENDAR_URL", d.newsCalendarUrl).trim()
                : "")
            .newsCheckInterval(Duration.ofSeconds(
                Env.getLong("NEWS_CHECK_INTERVAL_SECONDS", d.newsCheckInterval.getSeconds())))
            .cooldownStore(Env.get("COOLDOWN_STORE", d.cooldownStore).trim().toUpperCase())
            .stateDir(Env.get("STATE_DIR", d.stateDir))
            .port(Env.getInt("PORT", d.port))
            .signalDebug(Env.getBool("SIGNAL_DEBUG", d.signalDebug))
            .build();
    }

    private static List<Double> parseDoubles(List<String> values) {
        List<Double> result = new ArrayList<>();
        for (String v : values) {
            result.add(Double.parseDouble(v));
        }
        return result;
    }

    public List<String> pairs() { return pairs; }
    public Granularity strengthGranularity() { return strengthGranularity; }
    public int strengthCandleCount() { return strengthCandleCount; }
    public StrengthWeights strengthWeights() { return strengthWeights; }
    public String strengthPolicy() { return strengthPolicy; }
    public List<BreakoutRule> breakoutRules() { return breakoutRules; }
    public double atrMultiplier() { return atrMultiplier; }
    public int rangeLookback() { return rangeLookback; }
    public int priorDayScanBars() { return priorDayScanBars; }
    public boolean trendFilterEnabled() { return trendFilterEnabled; }
    public int trendEmaPeriod() { return trendEmaPeriod; }
    public Granularity decisionGranularity() { return decisionGranularity; }
    public Granularity executionGranularity() { return executionGranularity; }
    public int decisionCandleCount() { return decisionCandleCount; }
    public int executionCandleCount() { return executionCandleCount; }
    public EntryTiming entryTiming() { return entryTiming; }
    public double pullbackArmLevel() { return pullbackArmLevel; }
    public boolean retestEnabled() { return retestEnabled; }
    public int retestLookback() { return retestLookback; }
    public double retestAtrTolerance() { return retestAtrTolerance; }
    public double stopAtrMultiple() { return stopAtrMultiple; }
    public List<Double> targetAtrMultiples() { return targetAtrMultiples; }
    public double minRewardRisk() { return minRewardRisk; }
    public Duration signalCooldown() { return signalCooldown; }
    public CooldownScope cooldownScope() { return cooldownScope; }
    public Duration strengthAlertCooldown() { return strengthAlertCooldown; }
    public int breakoutAlertMinPairs() { return breakoutAlertMinPairs; }
    public Duration breakoutAlertCooldown() { return breakoutAlertCooldown; }
    public Duration heartbeatCooldown() { return heartbeatCooldown; }
    public int topCandidates() { return topCandidates; }
    public Duration loopInterval() { return loopInterval; }
    public int candleRetryAttempts() { return candleRetryAttempts; }
    public Duration candleRetryInitialDelay() { return candleRetryInitialDelay; }
    public String newsCalendarUrl() { return newsCalendarUrl; }
    public Duration newsCheckInterval() { return newsCheckInterval; }
    public String cooldownStore() { return cooldownStore; }
    public String stateDir() { return stateDir; }
    public int port() { return port; }
    public boolean signalDebug() { return signalDebug; }

    /**
     * News warnings are off when no calendar URL is configured.
     */
    public boolean newsAlertsEnabled() {
        return newsCalendarUrl != null && !newsCalendarUrl.isBlank();
    }

    /**
     * Longest of the configured cooldown windows. A key last fired before
     * {@code now - longestCooldown()} no longer suppresses anything.
     */
    public Duration longestCooldown() {
        Duration longest = signalCooldown;
        for (Duration d : List.of(strengthAlertCooldown, breakoutAlertCooldown, heartbeatCooldown)) {
            if (d.compareTo(longest) > 0) {
                longest = d;
            }
        }
        return longest;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy of this config as a builder, for overriding individual values.
     */
    public Builder toBuilder() {
        return builder()
            .pairs(pairs)
            .strengthGranularity(strengthGranularity)
            .strengthCandleCount(strengthCandleCount)
            .strengthWeights(strengthWeights)
            .strengthPolicy(strengthPolicy)
            .breakoutRules(breakoutRules)
            .atrMultiplier(atrMultiplier)
            .rangeLookback(rangeLookback)
            .priorDayScanBars(priorDayScanBars)
            .trendFilterEnabled(trendFilterEnabled)
            .trendEmaPeriod(trendEmaPeriod)
            .decisionGranularity(decisionGranularity)
            .executionGranularity(executionGranularity)
            .decisionCandleCount(decisionCandleCount)
            .executionCandleCount(executionCandleCount)
            .entryTiming(entryTiming)
            .pullbackArmLevel(pullbackArmLevel)
            .retestEnabled(retestEnabled)
            .retestLookback(retestLookback)
            .retestAtrTolerance(retestAtrTolerance)
            .stopAtrMultiple(stopAtrMultiple)
            .targetAtrMultiples(targetAtrMultiples)
            .minRewardRisk(minRewardRisk)
            .signalCooldown(signalCooldown)
            .cooldownScope(cooldownScope)
            .strengthAlertCooldown(strengthAlertCooldown)
            .breakoutAlertMinPairs(breakoutAlertMinPairs)
            .breakoutAlertCooldown(breakoutAlertCooldown)
            .heartbeatCooldown(heartbeatCooldown)
            .topCandidates(topCandidates)
            .loopInterval(loopInterval)
            .candleRetryAttempts(candleRetryAttempts)
            .candleRetryInitialDelay(candleRetryInitialDelay)
            .newsCalendarUrl(newsCalendarUrl)
            .newsCheckInterval(newsCheckInterval)
            .cooldownStore(cooldownStore)
            .stateDir(stateDir)
            .port(port)
            .signalDebug(signalDebug);
    }

    /**
     * Builder for SignalConfig. Starts from the documented defaults.
     */
    public static class Builder {
        private List<String> pairs = DEFAULT_PAIRS;
        private Granularity strengthGranularity = Granularity.H4;
        private int strengthCandleCount = 20;
        private StrengthWeights strengthWeights = StrengthWeights.defaults();
        private String strengthPolicy = "MIN_RANK:5";
        private List<BreakoutRule> breakoutRules = BreakoutRule.parseAll(List.of("SWING_ATR:H1", "PRIOR_DAY:H1"));
        private double atrMultiplier = 0.5;
        private int rangeLookback = 20;
        private int priorDayScanBars = 0;
        private boolean trendFilterEnabled = false;
        private int trendEmaPeriod = 200;
        private Granularity decisionGranularity = Granularity.H1;
        private Granularity executionGranularity = Granularity.M15;
        private int decisionCandleCount = 100;
        private int executionCandleCount = 50;
        private EntryTiming entryTiming = EntryTiming.MOMENTUM;
        private double pullbackArmLevel = 40.0;
        private boolean retestEnabled = false;
        private int retestLookback = 6;
        private double retestAtrTolerance = 0.25;
        private double stopAtrMultiple = 1.0;
        private List<Double> targetAtrMultiples = List.of(2.0, 4.0, 6.0);
        private double minRewardRisk = 2.0;
        private Duration signalCooldown = Duration.ofHours(1);
        private CooldownScope cooldownScope = CooldownScope.GLOBAL;
        private Duration strengthAlertCooldown = Duration.ofHours(4);
        private int breakoutAlertMinPairs = 4;
        private Duration breakoutAlertCooldown = Duration.ofHours(1);
        private Duration heartbeatCooldown = Duration.ofHours(24);
        private int topCandidates = 0;
        private Duration loopInterval = Duration.ofSeconds(60);
        private int candleRetryAttempts = 3;
        private Duration candleRetryInitialDelay = Duration.ofSeconds(1);
        private String newsCalendarUrl = DEFAULT_NEWS_CALENDAR_URL;
        private Duration newsCheckInterval = Duration.ofMinutes(5);
        private String cooldownStore = "FILE";
        private String stateDir = "./state";
        private int port = 9090;
        private boolean signalDebug = false;

        public Builder pairs(List<String> v) { this.pairs = v; return this; }
        public Builder strengthGranularity(Granularity v) { this.strengthGranularity = v; return this; }
        public Builder strengthCandleCount(int v) { this.strengthCandleCount = v; return this; }
        public Builder strengthWeights(StrengthWeights v) { this.strengthWeights = v; return this; }
        public Builder strengthPolicy(String v) { this.strengthPolicy = v; return this; }
        public Builder breakoutRules(List<BreakoutRule> v) { this.breakoutRules = v; return this; }
        public Builder atrMultiplier(double v) { this.atrMultiplier = v; return this; }
        public Builder rangeLookback(int v) { this.rangeLookback = v; return this; }
        public Builder priorDayScanBars(int v) { this.priorDayScanBars = v; return this; }
        public Builder trendFilterEnabled(boolean v) { this.trendFilterEnabled = v; return this; }
        public Builder trendEmaPeriod(int v) { this.trendEmaPeriod = v; return this; }
        public Builder decisionGranularity(Granularity v) { this.decisionGranularity = v; return this; }
        public Builder executionGranularity(Granularity v) { this.executionGranularity = v; return this; }
        public Builder decisionCandleCount(int v) { this.decisionCandleCount = v; return this; }
        public Builder executionCandleCount(int v) { this.executionCandleCount = v; return this; }
        public Builder entryTiming(EntryTiming v) { this.entryTiming = v; return this; }
        public Builder pullbackArmLevel(double v) { this.pullbackArmLevel = v; return this; }
        public Builder retestEnabled(boolean v) { this.retestEnabled = v; return this; }
        public Builder retestLookback(int v) { this.retestLookback = v; return this; }
        public Builder retestAtrTolerance(double v) { this.retestAtrTolerance = v; return this; }
        public Builder stopAtrMultiple(double v) { this.stopAtrMultiple = v; return this; }
        public Builder targetAtrMultiples(List<Double> v) { this.targetAtrMultiples = v; return this; }
        public Builder minRewardRisk(double v) { this.minRewardRisk = v; return this; }
        public Builder signalCooldown(Duration v) { this.signalCooldown = v; return this; }
        public Builder cooldownScope(CooldownScope v) { this.cooldownScope = v; return this; }
        public Builder strengthAlertCooldown(Duration v) { this.strengthAlertCooldown = v; return this; }
        public Builder breakoutAlertMinPairs(int v) { this.breakoutAlertMinPairs = v; return this; }
        public Builder breakoutAlertCooldown(Duration v) { this.breakoutAlertCooldown = v; return this; }
        public Builder heartbeatCooldown(Duration v) { this.heartbeatCooldown = v; return this; }
        public Builder topCandidates(int v) { this.topCandidates = v; return this; }
        public Builder loopInterval(Duration v) { this.loopInterval = v; return this; }
        public Builder candleRetryAttempts(int v) { this.candleRetryAttempts = v; return this; }
        public Builder candleRetryInitialDelay(Duration v) { this.candleRetryInitialDelay = v; return this; }
        public Builder newsCalendarUrl(String v) { this.newsCalendarUrl = v; return this; }
        public Builder newsCheckInterval(Duration v) { this.newsCheckInterval = v; return this; }
        public Builder cooldownStore(String v) { this.cooldownStore = v; return this; }
        public Builder stateDir(String v) { this.stateDir = v; return this; }
        public Builder port(int v) { this.port = v; return this; }
        public Builder signalDebug(boolean v) { this.signalDebug = v; return this; }

        public SignalConfig build() {
            return new SignalConfig(this);
        }
    }
}
