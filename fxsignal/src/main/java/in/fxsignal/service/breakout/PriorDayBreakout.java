package in.fxsignal.service.breakout;

import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.BreakoutStrategyType;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.Direction;
import in.fxsignal.service.candle.SessionClock;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Intraday close beyond the previous trading day's high/low.
 *
 * Intraday bars are grouped into trading days with {@link SessionClock#tradingDate}.
 * With {@code scanBars = 0} only the latest bar is checked; otherwise the last
 * {@code scanBars} bars of the current trading day are scanned and the most
 * recent breaking bar wins ("broke out sometime today").
 */
public final class PriorDayBreakout implements BreakoutStrategy {

    private final int scanBars;

    public PriorDayBreakout(int scanBars) {
        if (scanBars < 0) {
            throw new IllegalArgumentException("Scan bars cannot be negative: " + scanBars);
        }
        this.scanBars = scanBars;
    }

    @Override
    public BreakoutStrategyType type() {
        return BreakoutStrategyType.PRIOR_DAY;
    }

    @Override
    public Optional<BreakoutEvent> detect(CurrencyPair pair, List<Candle> candles, Granularity timeframe) {
        if (candles == null || candles.size() < 2) {
            return Optional.empty();
        }
        if (timeframe == Granularity.D1) {
            Candle prev = candles.get(candles.size() - 2);
            return check(pair, candles.get(candles.size() - 1), prev.high(), prev.low(), timeframe);
        }

        int lastIdx = candles.size() - 1;
        LocalDate today = SessionClock.tradingDate(candles.get(lastIdx).timestamp());

        // first bar of today
        int todayStart = lastIdx;
        while (todayStart > 0 && SessionClock.tradingDate(candles.get(todayStart - 1).timestamp()).equals(today)) {
            todayStart--;
        }
        if (todayStart == 0) {
            return Optional.empty();
        }

        LocalDate priorDay = SessionClock.tradingDate(candles.get(todayStart - 1).timestamp());
        BigDecimal priorHigh = null;
        BigDecimal priorLow = null;
        for (int i = todayStart - 1; i >= 0; i--) {
            Candle c = candles.get(i);
            if (!SessionClock.tradingDate(c.timestamp()).equals(priorDay)) {
                break;
            }
            priorHigh = priorHigh == null ? c.high() : priorHigh.max(c.high());
            priorLow = priorLow == null ? c.low() : priorLow.min(c.low());
        }

        int firstScanned = scanBars == 0 ? lastIdx : Math.max(todayStart, lastIdx - scanBars + 1);
        for (int i = lastIdx; i >= firstScanned; i--) {
            Optional<BreakoutEvent> hit = check(pair, candles.get(i), priorHigh, priorLow, timeframe);
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    private Optional<BreakoutEvent> check(CurrencyPair pair, Candle bar, BigDecimal high, BigDecimal low,
                                          Granularity timeframe) {
        if (bar.close().compareTo(high) > 0) {
            return Optional.of(new BreakoutEvent(pair, high, Direction.BUY, timeframe, type()));
        }
        if (bar.close().compareTo(low) < 0) {
            return Optional.of(new BreakoutEvent(pair, low, Direction.SELL, timeframe, type()));
        }
        return Optional.empty();
    }
}
