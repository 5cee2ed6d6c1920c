package in.fxsignal.service.breakout;

import in.fxsignal.config.SignalConfig;
import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.BreakoutStrategyType;
import in.fxsignal.domain.model.CurrencyPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Registry of named breakout strategies.
 */
public final class BreakoutDetector {
    private static final Logger log = LoggerFactory.getLogger(BreakoutDetector.class);

    private final Map<BreakoutStrategyType, BreakoutStrategy> strategies = new EnumMap<>(BreakoutStrategyType.class);

    public BreakoutDetector(List<BreakoutStrategy> strategies) {
        for (BreakoutStrategy s : strategies) {
            this.strategies.put(s.type(), s);
        }
    }

    /**
     * All five strategies configured from {@code config}.
     */
    public static BreakoutDetector standard(SignalConfig config, TrendFilter trendFilter) {
        return new BreakoutDetector(List.of(
            new CurrentBarBreakout(),
            new PriorBarBreakout(),
            new PriorDayBreakout(config.priorDayScanBars()),
            new RangeBreakout(config.rangeLookback(), config.trendFilterEnabled() ? trendFilter : TrendFilter.NONE),
            new SwingAtrBreakout(config.atrMultiplier())
        ));
    }

    /**
     * Run one named strategy.
     */
    public Optional<BreakoutEvent> detect(BreakoutStrategyType type, CurrencyPair pair,
                                          List<Candle> candles, Granularity timeframe) {
        BreakoutStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("Breakout strategy not registered: " + type);
        }
        return strategy.detect(pair, candles, timeframe);
    }

    /**
     * Evaluate rules in order; the first confirming rule wins.
     *
     * @param candlesFor candles per timeframe, fetched at most once per timeframe by the caller
     */
    public Optional<BreakoutEvent> firstMatch(CurrencyPair pair, List<BreakoutRule> rules,
                                              Function<Granularity, List<Candle>> candlesFor) {
        for (BreakoutRule rule : rules) {
            List<Candle> candles = candlesFor.apply(rule.timeframe());
            Optional<BreakoutEvent> event = detect(rule.strategy(), pair, candles, rule.timeframe());
            if (event.isPresent()) {
                log.debug("[BREAKOUT] {} {} {} level={}", pair, event.get().tag(),
                    event.get().direction(), event.get().level());
                return event;
            }
        }
        return Optional.empty();
    }
}
