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
 * Latest close above the preceding bar's high (BUY) or below its low (SELL).
 */
public final class PriorBarBreakout implements BreakoutStrategy {

    @Override
    public BreakoutStrategyType type() {
        return BreakoutStrategyType.PRIOR_BAR;
    }

    @Override
    public Optional<BreakoutEvent> detect(CurrencyPair pair, List<Candle> candles, Granularity timeframe) {
        if (candles == null || candles.size() < 2) {
            return Optional.empty();
        }
        Candle last = candles.get(candles.size() - 1);
        Candle prev = candles.get(candles.size() - 2);
        if (last.close().compareTo(prev.high()) > 0) {
            return Optional.of(new BreakoutEvent(pair, prev.high(), Direction.BUY, timeframe, type()));
        }
        if (last.close().compareTo(prev.low()) < 0) {
            return Optional.of(new BreakoutEvent(pair, prev.low(), Direction.SELL, timeframe, type()));
        }
        return Optional.empty();
    }
}
