package in.fxsignal.domain.model;

/**
 * Named breakout definitions. Each is an independent strategy; the breakout
 * gate evaluates the configured ones in order.
 */
public enum BreakoutStrategyType {
    /** Latest close outside the same bar's high/low. Degenerate whipsaw detector. */
    CURRENT_BAR,
    /** Latest close beyond the preceding bar's high/low. */
    PRIOR_BAR,
    /** Intraday close beyond the previous trading day's high/low. */
    PRIOR_DAY,
    /** Latest close beyond the highest high / lowest low of the last N bars. */
    RANGE,
    /** Close beyond the extreme swing point, confirmed by EMA-50, RSI and an ATR-sized move. */
    SWING_ATR
}
