package in.fxsignal.service.indicator;

import in.fxsignal.domain.data.Candle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Indicator Library - pure indicator functions over ordered candle / close series.
 *
 * All inputs are chronological (oldest first). Insufficient data never throws:
 * ATR and EMA slope return zero, RSI and EMA return an empty list. Callers treat
 * those as "no confirmation".
 *
 * Calculation Methods:
 * - True Range: TR = max(H-L, |H-PC|, |L-PC|)
 * - ATR: simple mean of the trailing {@code period} true ranges
 * - RSI: Wilder's smoothing, avg_t = (avg_{t-1} × (n-1) + x_t) / n
 * - EMA: seeded with the SMA of the first {@code period} values, k = 2 / (n + 1)
 */
public final class IndicatorLibrary {

    public static final int DEFAULT_ATR_PERIOD = 14;
    public static final int DEFAULT_RSI_PERIOD = 14;
    public static final int DEFAULT_SLOPE_PERIOD = 10;

    /** RSI midpoint; above favours buyers, below favours sellers. */
    public static final double RSI_NEUTRAL = 50.0;

    private static final int SCALE = 8;

    /**
     * Average True Range over the trailing {@code period} bars.
     *
     * @param candles candles in chronological order
     * @param period  ATR period (typically 14)
     * @return ATR, or {@link BigDecimal#ZERO} if fewer than {@code period + 1} candles
     */
    public static BigDecimal atr(List<Candle> candles, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("ATR period must be positive: " + period);
        }
        if (candles == null || candles.size() < period + 1) {
            return BigDecimal.ZERO;
        }

        BigDecimal sumTR = BigDecimal.ZERO;
        for (int i = candles.size() - period; i < candles.size(); i++) {
            sumTR = sumTR.add(trueRange(candles.get(i), candles.get(i - 1)));
        }
        return sumTR.divide(new BigDecimal(period), SCALE, RoundingMode.HALF_UP);
    }

    /**
     * True Range for a candle given the previous candle's close.
     */
    public static BigDecimal trueRange(Candle current, Candle previous) {
        if (current == null || previous == null) {
            throw new IllegalArgumentException("Candles cannot be null");
        }
        BigDecimal prevClose = previous.close();
        BigDecimal highLow = current.high().subtract(current.low());
        BigDecimal highPrevClose = current.high().subtract(prevClose).abs();
        BigDecimal lowPrevClose = current.low().subtract(prevClose).abs();
        return highLow.max(highPrevClose).max(lowPrevClose);
    }

    /**
     * Wilder-smoothed RSI. Produces one value per bar from index {@code period}
     * onward, so {@code closes.size() - period} values in total.
     *
     * @return RSI series in [0, 100], or an empty list if fewer than {@code period + 1} closes
     */
    public static List<Double> rsi(List<BigDecimal> closes, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("RSI period must be positive: " + period);
        }
        if (closes == null || closes.size() < period + 1) {
            return Collections.emptyList();
        }

        int deltas = closes.size() - 1;
        double[] gains = new double[deltas];
        double[] losses = new double[deltas];
        for (int i = 0; i < deltas; i++) {
            double delta = closes.get(i + 1).subtract(closes.get(i)).doubleValue();
            gains[i] = Math.max(delta, 0.0);
            losses[i] = Math.max(-delta, 0.0);
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 0; i < period; i++) {
            avgGain += gains[i];
            avgLoss += losses[i];
        }
        avgGain /= period;
        avgLoss /= period;

        List<Double> result = new ArrayList<>(deltas - period + 1);
        result.add(rsiValue(avgGain, avgLoss));

        for (int i = period; i < deltas; i++) {
            avgGain = (avgGain * (period - 1) + gains[i]) / period;
            avgLoss = (avgLoss * (period - 1) + losses[i]) / period;
            result.add(rsiValue(avgGain, avgLoss));
        }
        return result;
    }

    /**
     * Most recent RSI value, empty if insufficient data.
     */
    public static OptionalDouble latestRsi(List<BigDecimal> closes, int period) {
        List<Double> series = rsi(closes, period);
        return series.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(series.get(series.size() - 1));
    }

    private static double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    /**
     * SMA-seeded exponential moving average.
     *
     * @return one value per input from index {@code period - 1}, or empty if fewer than {@code period} values
     */
    public static List<BigDecimal> ema(List<BigDecimal> values, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("EMA period must be positive: " + period);
        }
        if (values == null || values.size() < period) {
            return Collections.emptyList();
        }

        BigDecimal k = BigDecimal.valueOf(2.0 / (period + 1));
        BigDecimal oneMinusK = BigDecimal.ONE.subtract(k);

        BigDecimal sum = BigDecimal.ZERO;
        for (int i = 0; i < period; i++) {
            sum = sum.add(values.get(i));
        }

        List<BigDecimal> result = new ArrayList<>(values.size() - period + 1);
        BigDecimal current = sum.divide(new BigDecimal(period), SCALE, RoundingMode.HALF_UP);
        result.add(current);
        for (int i = period; i < values.size(); i++) {
            current = values.get(i).multiply(k).add(current.multiply(oneMinusK))
                .setScale(SCALE, RoundingMode.HALF_UP);
            result.add(current);
        }
        return result;
    }

    /**
     * Latest EMA value, or null if insufficient data.
     */
    public static BigDecimal latestEma(List<BigDecimal> values, int period) {
        List<BigDecimal> series = ema(values, period);
        return series.isEmpty() ? null : series.get(series.size() - 1);
    }

    /**
     * Difference between the last two EMA points.
     *
     * @return slope, or {@link BigDecimal#ZERO} if fewer than {@code period + 1} values
     */
    public static BigDecimal emaSlope(List<BigDecimal> values, int period) {
        List<BigDecimal> series = ema(values, period);
        if (series.size() < 2) {
            return BigDecimal.ZERO;
        }
        return series.get(series.size() - 1).subtract(series.get(series.size() - 2));
    }

    /**
     * Local extremes using a 3-bar window: a high strictly greater than both
     * neighbours, a low strictly less than both neighbours. First and last bars
     * are never swing points.
     */
    public static SwingPoints findSwingPoints(List<Candle> candles) {
        if (candles == null || candles.size() < 3) {
            return new SwingPoints(List.of(), List.of());
        }

        List<BigDecimal> highs = new ArrayList<>();
        List<BigDecimal> lows = new ArrayList<>();
        for (int i = 1; i < candles.size() - 1; i++) {
            Candle prev = candles.get(i - 1);
            Candle cur = candles.get(i);
            Candle next = candles.get(i + 1);
            if (cur.high().compareTo(prev.high()) > 0 && cur.high().compareTo(next.high()) > 0) {
                highs.add(cur.high());
            }
            if (cur.low().compareTo(prev.low()) < 0 && cur.low().compareTo(next.low()) < 0) {
                lows.add(cur.low());
            }
        }
        return new SwingPoints(List.copyOf(highs), List.copyOf(lows));
    }

    /**
     * Close prices of the given candles.
     */
    public static List<BigDecimal> closes(List<Candle> candles) {
        if (candles == null) {
            return List.of();
        }
        return candles.stream().map(Candle::close).toList();
    }

    /**
     * Swing highs and lows in chronological order.
     */
    public record SwingPoints(List<BigDecimal> highs, List<BigDecimal> lows) {

        public BigDecimal highestHigh() {
            return highs.stream().max(BigDecimal::compareTo).orElse(null);
        }

        public BigDecimal lowestLow() {
            return lows.stream().min(BigDecimal::compareTo).orElse(null);
        }
    }

    private IndicatorLibrary() {}
}
