package in.fxsignal.domain.model;

import in.fxsignal.domain.data.Granularity;

import java.math.BigDecimal;

/**
 * A broken structural level. Produced fresh on each evaluation, never persisted.
 */
public record BreakoutEvent(
    CurrencyPair pair,
    BigDecimal level,
    Direction direction,
    Granularity timeframe,
    BreakoutStrategyType strategy
) {
    /**
     * Short scenario label, e.g. "PRIOR_DAY@H1".
     */
    public String tag() {
        return strategy.name() + "@" + timeframe.name();
    }
}
