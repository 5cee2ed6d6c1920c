package in.fxsignal.bootstrap;

import in.fxsignal.config.PairUniverse;
import in.fxsignal.config.SignalConfig;
import in.fxsignal.service.strength.StrengthPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs from App.main() before any wiring. Throws IllegalStateException if the
 * configuration is invalid; the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    public static void validate(SignalConfig config, PairUniverse universe) {
        log.info("Running startup config validation...");

        if (universe.isEmpty()) {
            throw new IllegalStateException("INVALID CONFIG: no valid pairs in PAIRS " + config.pairs());
        }
        if (config.breakoutRules().isEmpty()) {
            throw new IllegalStateException("INVALID CONFIG: BREAKOUT_RULES is empty");
        }
        requirePositive("STRENGTH_CANDLE_COUNT", config.strengthCandleCount());
        requirePositive("DECISION_CANDLE_COUNT", config.decisionCandleCount());
        requirePositive("EXECUTION_CANDLE_COUNT", config.executionCandleCount());
        requirePositive("RANGE_LOOKBACK", config.rangeLookback());
        requirePositive("RETEST_LOOKBACK", config.retestLookback());
        requirePositive("CANDLE_RETRY_ATTEMPTS", config.candleRetryAttempts());
        requirePositive("CANDLE_RETRY_INITIAL_MS", config.candleRetryInitialDelay().toMillis());
        requirePositive("SIGNAL_COOLDOWN_SECONDS", config.signalCooldown().getSeconds());
        requirePositive("LOOP_INTERVAL_SECONDS", config.loopInterval().getSeconds());
        requirePositive("BREAKOUT_ALERT_MIN_PAIRS", config.breakoutAlertMinPairs());
        if (config.newsAlertsEnabled()) {
            requirePositive("NEWS_CHECK_INTERVAL_SECONDS", config.newsCheckInterval().getSeconds());
        }

        if (config.priorDayScanBars() < 0 || config.topCandidates() < 0) {
            throw new IllegalStateException("INVALID CONFIG: PRIOR_DAY_SCAN_BARS and TOP_CANDIDATES cannot be negative");
        }
        if (!(config.stopAtrMultiple() > 0)) {
            throw new IllegalStateException("INVALID CONFIG: STOP_ATR_MULTIPLE must be > 0, got "
                + config.stopAtrMultiple());
        }
        validateTargets(config.targetAtrMultiples());
        if (!config.strengthWeights().isValid()) {
            throw new IllegalStateException("INVALID CONFIG: STRENGTH_WEIGHTS must be non-negative with a positive sum");
        }
        if (config.pullbackArmLevel() <= 0 || config.pullbackArmLevel() >= 50) {
            throw new IllegalStateException("INVALID CONFIG: PULLBACK_ARM_LEVEL must be in (0, 50)");
        }
        if (!"FILE".equals(config.cooldownStore()) && !"POSTGRES".equals(config.cooldownStore())) {
            throw new IllegalStateException("INVALID CONFIG: COOLDOWN_STORE must be FILE or POSTGRES, got "
                + config.cooldownStore());
        }
        try {
            StrengthPolicy.parse(config.strengthPolicy());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("INVALID CONFIG: STRENGTH_POLICY " + e.getMessage(), e);
        }

        log.info("Startup config validation passed: {} pairs, rules={}, policy={}",
            universe.size(), config.breakoutRules(), config.strengthPolicy());
    }

    private static void validateTargets(List<Double> targets) {
        if (targets.isEmpty()) {
            throw new IllegalStateException("INVALID CONFIG: TARGET_ATR_MULTIPLES is empty");
        }
        double prev = 0.0;
        for (double t : targets) {
            if (t <= prev) {
                throw new IllegalStateException(
                    "INVALID CONFIG: TARGET_ATR_MULTIPLES must be positive and strictly ascending, got " + targets);
            }
            prev = t;
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalStateException("INVALID CONFIG: " + key + " must be positive, got " + value);
        }
    }

    private StartupConfigValidator() {}
}
