package in.fxsignal.service.breakout;

import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.BreakoutStrategyType;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.Direction;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Latest close beyond the highest high / lowest low of the preceding
 * {@code lookback} bars, optionally gated by a trend filter.
 */
public final class RangeBreakout implements BreakoutStrategy {

    private final int lookback;
    private final TrendFilter trendFilter;

    public RangeBreakout(int lookback, TrendFilter trendFilter) {
        if (lookback < 1) {
            throw new IllegalArgumentException("Range lookback must be positive: " + lookback);
        }
        this.lookback = lookback;
        this.trendFilter = trendFilter == null ? TrendFilter.NONE : trendFilter;
    }

    @Override
    public BreakoutStrategyType type() {
        return BreakoutStrategyType.RANGE;
    }

    @Override
    public Optional<BreakoutEvent> detect(CurrencyPair pair, List<Candle> candles, Granularity timeframe) {
        if (candles == null || candles.size() < lookback + 1) {
            return Optional.empty();
        }

        int lastIdx = candles.size() - 1;
        BigDecimal rangeHigh = null;
        BigDecimal rangeLow = null;
        for (int i = lastIdx - lookback; i < lastIdx; i++) {
            Candle c = candles.get(i);
            rangeHigh = rangeHigh == null ? c.high() : rangeHigh.max(c.high());
            rangeLow = rangeLow == null ? c.low() : rangeLow.min(c.low());
        }

        BigDecimal close = candles.get(lastIdx).close();
        BreakoutEvent event = null;
        if (close.compareTo(rangeHigh) > 0) {
            event = new BreakoutEvent(pair, rangeHigh, Direction.BUY, timeframe, type());
        } else if (close.compareTo(rangeLow) < 0) {
            event = new BreakoutEvent(pair, rangeLow, Direction.SELL, timeframe, type());
        }

        if (event == null || !trendFilter.allows(pair, event.direction())) {
            return Optional.empty();
        }
        return Optional.of(event);
    }
}
