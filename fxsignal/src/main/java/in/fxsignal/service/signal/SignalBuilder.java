package in.fxsignal.service.signal;

import in.fxsignal.application.port.output.CandleSource;
import in.fxsignal.application.port.output.NotificationSink;
import in.fxsignal.config.SignalConfig;
import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.Direction;
import in.fxsignal.domain.model.RankMap;
import in.fxsignal.domain.model.TradeSignal;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import in.fxsignal.service.breakout.BreakoutDetector;
import in.fxsignal.service.candle.SessionClock;
import in.fxsignal.service.cooldown.CooldownStore;
import in.fxsignal.service.indicator.IndicatorLibrary;
import in.fxsignal.service.strength.StrengthPolicy;
import in.fxsignal.service.trade.ActiveTrades;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Signal Builder - sequential gate pipeline for one pair.
 *
 * Gates (any failure short-circuits to no signal):
 * 1. Cooldown: (pair, category) must be out of its window
 * 2. Breakout: first configured rule that confirms
 * 3. Direction and strength: side with the higher rank, agreeing with the
 *    breakout, accepted by the strength policy
 * 4. Momentum: decision RSI on the right side of 50, then entry timing on
 *    the execution timeframe
 * 5. Retest (optional)
 * 6. Risk: entry = latest execution close, ATR stop and targets, minimum reward:risk
 * 7. Emit: acquire the cooldown, add to ActiveTrades, notify
 *
 * Under PULLBACK_CROSS timing the execution RSI is fed to the
 * {@link PullbackTracker} on every evaluation of a ranked pair, before the
 * breakout gate; the entry-timing gate then reads the result of that update.
 * Candle counts follow the frame's role: breakout and decision frames use the
 * decision count, the execution frame uses the execution count.
 *
 * The cooldown is recorded whether or not delivery succeeded.
 */
public final class SignalBuilder {
    private static final Logger log = LoggerFactory.getLogger(SignalBuilder.class);

    public static final String GLOBAL_CATEGORY = "strength_alert";

    static final double EXECUTION_BUY_RSI = 45.0;
    static final double EXECUTION_SELL_RSI = 55.0;

    private final SignalConfig config;
    private final CandleSource candleSource;
    private final BreakoutDetector breakoutDetector;
    private final StrengthPolicy strengthPolicy;
    private final CooldownStore cooldownStore;
    private final ActiveTrades activeTrades;
    private final NotificationSink sink;
    private final PullbackTracker pullbackTracker;
    private final RetestConfirmation retestConfirmation;
    private final RiskCalculator riskCalculator;
    private final SignalMetrics metrics;
    private final Clock clock;

    public SignalBuilder(SignalConfig config,
                         CandleSource candleSource,
                         BreakoutDetector breakoutDetector,
                         StrengthPolicy strengthPolicy,
                         CooldownStore cooldownStore,
                         ActiveTrades activeTrades,
                         NotificationSink sink,
                         PullbackTracker pullbackTracker,
                         SignalMetrics metrics,
                         Clock clock) {
        this.config = config;
        this.candleSource = candleSource;
        this.breakoutDetector = breakoutDetector;
        this.strengthPolicy = strengthPolicy;
        this.cooldownStore = cooldownStore;
        this.activeTrades = activeTrades;
        this.sink = sink;
        this.pullbackTracker = pullbackTracker;
        this.retestConfirmation = new RetestConfirmation(config.retestLookback(), config.retestAtrTolerance());
        this.riskCalculator = new RiskCalculator(config.stopAtrMultiple(), config.targetAtrMultiples());
        this.metrics = metrics;
        this.clock = clock;
    }

    public Optional<TradeSignal> build(CurrencyPair pair, RankMap ranks) {
        Instant now = clock.instant();
        String category = categoryAt(now);
        CooldownKey key = CooldownKey.of(pair, category);

        // 1. Cooldown
        if (!cooldownStore.isAllowed(key, now, config.signalCooldown())) {
            return reject(SignalGate.COOLDOWN, pair, "fired within "
                + config.signalCooldown().toMinutes() + " min (" + category + ")");
        }

        if (!ranks.isRanked(pair)) {
            return reject(SignalGate.DATA, pair, "currencies not ranked");
        }

        Map<Frame, List<Candle>> cache = new HashMap<>();
        List<Candle> decisionCandles = decisionCandles(pair, config.decisionGranularity(), cache);
        List<BigDecimal> decisionCloses = IndicatorLibrary.closes(decisionCandles);
        OptionalDouble decisionRsi = IndicatorLibrary.latestRsi(decisionCloses, IndicatorLibrary.DEFAULT_RSI_PERIOD);
        if (decisionRsi.isEmpty()) {
            return reject(SignalGate.DATA, pair, decisionCandles.size() + " "
                + config.decisionGranularity() + " candles, RSI unavailable");
        }

        int baseRank = ranks.rankOf(pair.base()).orElseThrow();
        int quoteRank = ranks.rankOf(pair.quote()).orElseThrow();

        // Pullback state follows the execution frame on every evaluation
        boolean crossedBack = false;
        if (config.entryTiming() == EntryTiming.PULLBACK_CROSS && baseRank != quoteRank) {
            List<Candle> tracked = executionCandles(pair, cache);
            OptionalDouble trackedRsi = rsiOf(tracked);
            if (trackedRsi.isEmpty()) {
                return reject(SignalGate.DATA, pair, tracked.size() + " "
                    + config.executionGranularity() + " candles, RSI unavailable");
            }
            Direction wanted = baseRank > quoteRank ? Direction.BUY : Direction.SELL;
            crossedBack = pullbackTracker.update(pair, wanted, trackedRsi.getAsDouble());
        }

        // 2. Breakout
        Optional<BreakoutEvent> breakout = breakoutDetector.firstMatch(
            pair, config.breakoutRules(), g -> decisionCandles(pair, g, cache));
        if (breakout.isEmpty()) {
            return reject(SignalGate.BREAKOUT, pair, "no rule confirmed " + config.breakoutRules());
        }

        // 3. Direction & strength
        if (baseRank == quoteRank) {
            return reject(SignalGate.DIRECTION, pair, "equal ranks " + baseRank);
        }
        Direction direction = baseRank > quoteRank ? Direction.BUY : Direction.SELL;
        if (breakout.get().direction() != direction) {
            return reject(SignalGate.DIRECTION, pair, breakout.get().tag() + " "
                + breakout.get().direction() + " against strength " + direction);
        }
        int strong = direction == Direction.BUY ? baseRank : quoteRank;
        int weak = direction == Direction.BUY ? quoteRank : baseRank;
        if (!strengthPolicy.accepts(strong, weak)) {
            return reject(SignalGate.STRENGTH, pair, String.format("%+d/%+d rejected by %s",
                strong, weak, strengthPolicy.describe()));
        }

        // 4. Momentum
        double hRsi = decisionRsi.getAsDouble();
        if (direction == Direction.BUY ? hRsi < IndicatorLibrary.RSI_NEUTRAL : hRsi > IndicatorLibrary.RSI_NEUTRAL) {
            return reject(SignalGate.MOMENTUM, pair, String.format("%s decision RSI %.1f", direction, hRsi));
        }

        List<Candle> executionCandles = executionCandles(pair, cache);
        OptionalDouble executionRsi = rsiOf(executionCandles);
        if (executionCandles.isEmpty() || executionRsi.isEmpty()) {
            return reject(SignalGate.DATA, pair, executionCandles.size() + " "
                + config.executionGranularity() + " candles, RSI unavailable");
        }
        double eRsi = executionRsi.getAsDouble();
        if (!entryTimingOk(direction, eRsi, crossedBack)) {
            return reject(SignalGate.ENTRY_TIMING, pair, String.format("%s %s entry RSI %.1f",
                config.entryTiming(), direction, eRsi));
        }

        BigDecimal atr = IndicatorLibrary.atr(decisionCandles, IndicatorLibrary.DEFAULT_ATR_PERIOD);
        if (atr.signum() <= 0) {
            return reject(SignalGate.RISK, pair, "ATR unavailable");
        }

        // 5. Retest
        if (config.retestEnabled() && !retestConfirmation.confirms(breakout.get(), executionCandles, atr)) {
            return reject(SignalGate.RETEST, pair, "no retest of " + breakout.get().level());
        }

        // 6. Risk
        BigDecimal entry = executionCandles.get(executionCandles.size() - 1).close();
        RiskCalculator.RiskLevels levels = riskCalculator.compute(direction, entry, atr);
        if (!levels.meets(config.minRewardRisk())) {
            return reject(SignalGate.RISK, pair, "reward:risk " + levels.rewardToRisk()
                + " below " + config.minRewardRisk());
        }

        // 7. Emit
        if (!cooldownStore.tryAcquire(key, now, config.signalCooldown())) {
            return reject(SignalGate.COOLDOWN, pair, "acquired by a concurrent evaluation");
        }

        TradeSignal signal = new TradeSignal(
            UUID.randomUUID().toString(),
            pair,
            direction,
            entry,
            levels.stopLoss(),
            levels.takeProfits(),
            baseRank,
            quoteRank,
            baseRank - quoteRank,
            atr,
            hRsi,
            eRsi,
            breakout.get().tag(),
            category,
            now
        );

        activeTrades.add(signal);
        pullbackTracker.reset(pair);
        metrics.recordSignal(signal);
        metrics.setActiveTrades(activeTrades.size());

        boolean delivered = sink.send(SignalMessageFormatter.format(signal, config.minRewardRisk()));
        metrics.recordNotification(delivered);
        if (!delivered) {
            log.warn("[SIGNAL] Notification failed for {} {}, cooldown kept", direction, pair);
        }

        log.info("[SIGNAL] Trade triggered: {} {} | {} | ranks {}/{} | RSI {}/{} | entry={} sl={} tp={}",
            direction, pair, signal.breakoutTag(), baseRank, quoteRank,
            String.format("%.1f", hRsi), String.format("%.1f", eRsi),
            entry, levels.stopLoss(), levels.takeProfits());
        return Optional.of(signal);
    }

    /**
     * Cooldown category for trade signals at {@code now}.
     */
    public String categoryAt(Instant now) {
        return config.cooldownScope() == SignalConfig.CooldownScope.SESSION
            ? SessionClock.sessionAt(now).label()
            : GLOBAL_CATEGORY;
    }

    private boolean entryTimingOk(Direction direction, double rsi, boolean crossedBack) {
        return switch (config.entryTiming()) {
            case NONE -> true;
            case MOMENTUM -> direction == Direction.BUY ? rsi > EXECUTION_BUY_RSI : rsi < EXECUTION_SELL_RSI;
            case PULLBACK_CROSS -> crossedBack;
        };
    }

    private List<Candle> decisionCandles(CurrencyPair pair, Granularity granularity, Map<Frame, List<Candle>> cache) {
        return candles(pair, new Frame(granularity, config.decisionCandleCount()), cache);
    }

    private List<Candle> executionCandles(CurrencyPair pair, Map<Frame, List<Candle>> cache) {
        return candles(pair, new Frame(config.executionGranularity(), config.executionCandleCount()), cache);
    }

    private List<Candle> candles(CurrencyPair pair, Frame frame, Map<Frame, List<Candle>> cache) {
        return cache.computeIfAbsent(frame, f -> {
            List<Candle> fetched = candleSource.get(pair, f.granularity(), f.count());
            return fetched == null ? List.of() : fetched;
        });
    }

    private static OptionalDouble rsiOf(List<Candle> candles) {
        return IndicatorLibrary.latestRsi(IndicatorLibrary.closes(candles), IndicatorLibrary.DEFAULT_RSI_PERIOD);
    }

    private Optional<TradeSignal> reject(SignalGate gate, CurrencyPair pair, String reason) {
        metrics.recordGateRejection(gate.label());
        if (config.signalDebug()) {
            log.info("[SIGNAL] {} rejected at {}: {}", pair, gate, reason);
        } else {
            log.debug("[SIGNAL] {} rejected at {}: {}", pair, gate, reason);
        }
        return Optional.empty();
    }

    /** Candle request for one evaluation; the count depends on the role the frame plays. */
    private record Frame(Granularity granularity, int count) {}
}
