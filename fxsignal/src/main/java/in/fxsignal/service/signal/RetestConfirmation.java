package in.fxsignal.service.signal;

import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.Direction;

import java.math.BigDecimal;
import java.util.List;

/**
 * Retest of a broken level on the execution timeframe.
 *
 * BUY: within the last {@code lookback} bars some bar's low came within
 * {@code tolerance × ATR} of the level and that bar closed above it, and the
 * latest close is still above the level. SELL mirrors with highs.
 */
public final class RetestConfirmation {

    private final int lookback;
    private final BigDecimal atrTolerance;

    public RetestConfirmation(int lookback, double atrTolerance) {
        if (lookback < 1) {
            throw new IllegalArgumentException("Retest lookback must be positive: " + lookback);
        }
        this.lookback = lookback;
        this.atrTolerance = BigDecimal.valueOf(atrTolerance);
    }

    public boolean confirms(BreakoutEvent breakout, List<Candle> candles, BigDecimal atr) {
        if (candles == null || candles.isEmpty() || atr == null || atr.signum() <= 0) {
            return false;
        }

        BigDecimal level = breakout.level();
        BigDecimal tolerance = atr.multiply(atrTolerance);
        boolean buy = breakout.direction() == Direction.BUY;

        BigDecimal lastClose = candles.get(candles.size() - 1).close();
        if (buy ? lastClose.compareTo(level) <= 0 : lastClose.compareTo(level) >= 0) {
            return false;
        }

        int from = Math.max(0, candles.size() - lookback);
        for (int i = from; i < candles.size(); i++) {
            Candle c = candles.get(i);
            BigDecimal extreme = buy ? c.low() : c.high();
            boolean touched = extreme.subtract(level).abs().compareTo(tolerance) <= 0;
            boolean rejected = buy ? c.close().compareTo(level) > 0 : c.close().compareTo(level) < 0;
            if (touched && rejected) {
                return true;
            }
        }
        return false;
    }
}
