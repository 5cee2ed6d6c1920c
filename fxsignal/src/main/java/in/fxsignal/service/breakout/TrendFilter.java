package in.fxsignal.service.breakout;

import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.Direction;

/**
 * Longer-timeframe trend alignment check for a breakout direction.
 */
@FunctionalInterface
public interface TrendFilter {

    TrendFilter NONE = (pair, direction) -> true;

    boolean allows(CurrencyPair pair, Direction direction);
}
