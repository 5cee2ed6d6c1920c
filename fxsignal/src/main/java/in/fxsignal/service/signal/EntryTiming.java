package in.fxsignal.service.signal;

/**
 * Execution-timeframe RSI condition applied after the decision-timeframe check.
 */
public enum EntryTiming {
    /** No execution-timeframe check. */
    NONE,
    /** Execution RSI above 45 for buys, below 55 for sells. */
    MOMENTUM,
    /** RSI must have pulled back past the arm level, then crossed back over 50. */
    PULLBACK_CROSS
}
