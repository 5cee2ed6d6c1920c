package in.fxsignal.service.breakout;

import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.BreakoutStrategyType;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.Direction;
import in.fxsignal.service.indicator.IndicatorLibrary;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Swing breakout confirmed by trend, momentum and bar size.
 *
 * BUY when all hold (SELL mirrored):
 * - last close above the highest swing high
 * - last close above EMA-50 of closes
 * - RSI-14 above 55
 * - last close - previous close >= atrMultiplier × ATR-14
 */
public final class SwingAtrBreakout implements BreakoutStrategy {

    static final int MIN_CANDLES = 20;
    static final int EMA_PERIOD = 50;
    static final double RSI_BUY_LEVEL = 55.0;
    static final double RSI_SELL_LEVEL = 45.0;

    private final BigDecimal atrMultiplier;

    public SwingAtrBreakout(double atrMultiplier) {
        this.atrMultiplier = BigDecimal.valueOf(atrMultiplier);
    }

    @Override
    public BreakoutStrategyType type() {
        return BreakoutStrategyType.SWING_ATR;
    }

    @Override
    public Optional<BreakoutEvent> detect(CurrencyPair pair, List<Candle> candles, Granularity timeframe) {
        if (candles == null || candles.size() < MIN_CANDLES) {
            return Optional.empty();
        }

        List<BigDecimal> closes = IndicatorLibrary.closes(candles);
        BigDecimal ema = IndicatorLibrary.latestEma(closes, EMA_PERIOD);
        OptionalDouble rsi = IndicatorLibrary.latestRsi(closes, IndicatorLibrary.DEFAULT_RSI_PERIOD);
        if (ema == null || rsi.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal atr = IndicatorLibrary.atr(candles, IndicatorLibrary.DEFAULT_ATR_PERIOD);
        BigDecimal minMove = atrMultiplier.multiply(atr);
        BigDecimal lastClose = closes.get(closes.size() - 1);
        BigDecimal prevClose = closes.get(closes.size() - 2);
        BigDecimal move = lastClose.subtract(prevClose);

        IndicatorLibrary.SwingPoints swings = IndicatorLibrary.findSwingPoints(candles);
        BigDecimal swingHigh = swings.highestHigh();
        BigDecimal swingLow = swings.lowestLow();

        if (swingHigh != null
            && lastClose.compareTo(swingHigh) > 0
            && lastClose.compareTo(ema) > 0
            && rsi.getAsDouble() > RSI_BUY_LEVEL
            && move.compareTo(minMove) >= 0) {
            return Optional.of(new BreakoutEvent(pair, swingHigh, Direction.BUY, timeframe, type()));
        }

        if (swingLow != null
            && lastClose.compareTo(swingLow) < 0
            && lastClose.compareTo(ema) < 0
            && rsi.getAsDouble() < RSI_SELL_LEVEL
            && move.negate().compareTo(minMove) >= 0) {
            return Optional.of(new BreakoutEvent(pair, swingLow, Direction.SELL, timeframe, type()));
        }

        return Optional.empty();
    }
}
