package in.fxsignal.service.breakout;

import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.BreakoutStrategyType;
import in.fxsignal.domain.model.CurrencyPair;

import java.util.List;
import java.util.Optional;

/**
 * One named breakout definition.
 *
 * Implementations are pure over the given candles (oldest first) apart from
 * an optional trend filter. Missing or short history returns empty, never throws.
 */
public interface BreakoutStrategy {

    BreakoutStrategyType type();

    Optional<BreakoutEvent> detect(CurrencyPair pair, List<Candle> candles, Granularity timeframe);
}
