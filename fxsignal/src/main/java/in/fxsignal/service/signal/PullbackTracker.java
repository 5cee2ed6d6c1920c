package in.fxsignal.service.signal;

import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.Direction;
import in.fxsignal.service.indicator.IndicatorLibrary;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-pair "pullback then cross back" entry timing state.
 *
 * For a BUY the tracker arms once RSI dips to {@code armLevel} or below, and
 * fires when RSI then crosses from below 50 to 50 or above. SELL mirrors this
 * with {@code 100 - armLevel}. State is kept between evaluations and cleared
 * after a signal or when the wanted direction changes.
 */
public final class PullbackTracker {

    private final double armLevel;
    private final Map<CurrencyPair, State> states = new ConcurrentHashMap<>();

    public PullbackTracker(double armLevel) {
        if (armLevel <= 0 || armLevel >= IndicatorLibrary.RSI_NEUTRAL) {
            throw new IllegalArgumentException("Arm level must be in (0, 50): " + armLevel);
        }
        this.armLevel = armLevel;
    }

    /**
     * Feed the latest execution-timeframe RSI.
     *
     * @return true if the cross-back happened on this update
     */
    public boolean update(CurrencyPair pair, Direction direction, double rsi) {
        State prev = states.get(pair);
        if (prev != null && prev.direction() != direction) {
            prev = null;
        }

        boolean armed = prev != null && prev.armed();
        if (direction == Direction.BUY ? rsi <= armLevel : rsi >= 100.0 - armLevel) {
            armed = true;
        }

        boolean crossed = false;
        if (armed && prev != null) {
            double mid = IndicatorLibrary.RSI_NEUTRAL;
            crossed = direction == Direction.BUY
                ? prev.previousRsi() < mid && rsi >= mid
                : prev.previousRsi() > mid && rsi <= mid;
        }

        states.put(pair, new State(direction, armed, rsi));
        return crossed;
    }

    public boolean isArmed(CurrencyPair pair) {
        State s = states.get(pair);
        return s != null && s.armed();
    }

    public void reset(CurrencyPair pair) {
        states.remove(pair);
    }

    private record State(Direction direction, boolean armed, double previousRsi) {}
}
