package in.fxsignal.service.breakout;

import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.BreakoutStrategyType;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.Direction;

import java.util.List;
import java.util.Optional;

/**
 * Latest close outside the latest bar's own high/low.
 *
 * With consistent OHLC data the close always lies inside its own range, so
 * this only fires on malformed or still-forming bars where the feed's
 * high/low lag the close.
 */
public final class CurrentBarBreakout implements BreakoutStrategy {

    @Override
    public BreakoutStrategyType type() {
        return BreakoutStrategyType.CURRENT_BAR;
    }

    @Override
    public Optional<BreakoutEvent> detect(CurrencyPair pair, List<Candle> candles, Granularity timeframe) {
        if (candles == null || candles.isEmpty()) {
            return Optional.empty();
        }
        Candle last = candles.get(candles.size() - 1);
        if (last.close().compareTo(last.high()) > 0) {
            return Optional.of(new BreakoutEvent(pair, last.high(), Direction.BUY, timeframe, type()));
        }
        if (last.close().compareTo(last.low()) < 0) {
            return Optional.of(new BreakoutEvent(pair, last.low(), Direction.SELL, timeframe, type()));
        }
        return Optional.empty();
    }
}
