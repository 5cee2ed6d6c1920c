package in.fxsignal.service.indicator;

import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.CandleFixtures;
import in.fxsignal.domain.data.Granularity;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IndicatorLibrary.
 *
 * Tests:
 * - True range and ATR over known bars
 * - RSI bounds, saturation and insufficient data
 * - EMA seeding and slope sign
 * - Swing point detection
 */
class IndicatorLibraryTest {

    private static final Instant T0 = Instant.parse("2024-03-05T12:00:00Z");

    @Test
    void testTrueRangeUsesPreviousClose() {
        Candle prev = CandleFixtures.bar(T0, 1.0, 1.1, 0.9, 1.0);
        Candle gapUp = CandleFixtures.bar(T0.plusSeconds(3600), 1.3, 1.4, 1.25, 1.35);

        assertEquals(0, new BigDecimal("0.4").compareTo(IndicatorLibrary.trueRange(gapUp, prev)),
            "Gap up TR should be high - previous close");
    }

    @Test
    void testAtrIsMeanOfTrailingTrueRanges() {
        List<Candle> candles = CandleFixtures.flat(T0, Granularity.H1, 20, 1.1, 0.001);

        BigDecimal atr = IndicatorLibrary.atr(candles, 14);

        assertEquals(0, new BigDecimal("0.002").compareTo(atr), "Flat bars of range 0.002 give ATR 0.002");
    }

    @Test
    void testAtrInsufficientDataIsZero() {
        List<Candle> candles = CandleFixtures.flat(T0, Granularity.H1, 14, 1.1, 0.001);

        assertEquals(BigDecimal.ZERO, IndicatorLibrary.atr(candles, 14), "14 candles cannot produce ATR(14)");
        assertEquals(BigDecimal.ZERO, IndicatorLibrary.atr(null, 14));
        assertThrows(IllegalArgumentException.class, () -> IndicatorLibrary.atr(candles, 0));
    }

    @Test
    void testRsiOfRisingSeriesIsHundred() {
        List<BigDecimal> closes = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            closes.add(BigDecimal.valueOf(1.0 + i * 0.01));
        }

        List<Double> rsi = IndicatorLibrary.rsi(closes, 14);

        assertEquals(6, rsi.size(), "One value per bar from index 14");
        assertEquals(100.0, rsi.get(rsi.size() - 1), 1e-9, "No losses means RSI 100");
    }

    @Test
    void testRsiOfFallingSeriesIsZero() {
        List<BigDecimal> closes = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            closes.add(BigDecimal.valueOf(2.0 - i * 0.01));
        }

        OptionalDouble rsi = IndicatorLibrary.latestRsi(closes, 14);

        assertTrue(rsi.isPresent());
        assertEquals(0.0, rsi.getAsDouble(), 1e-9);
    }

    @Test
    void testRsiStaysWithinBounds() {
        List<BigDecimal> closes = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            closes.add(BigDecimal.valueOf(1.0 + Math.sin(i / 3.0) * 0.02));
        }

        for (double v : IndicatorLibrary.rsi(closes, 14)) {
            assertTrue(v >= 0.0 && v <= 100.0, "RSI out of range: " + v);
        }
    }

    @Test
    void testRsiInsufficientData() {
        List<BigDecimal> closes = List.of(BigDecimal.ONE, BigDecimal.TEN);

        assertTrue(IndicatorLibrary.rsi(closes, 14).isEmpty());
        assertFalse(IndicatorLibrary.latestRsi(closes, 14).isPresent());
    }

    @Test
    void testEmaSeededWithSma() {
        List<BigDecimal> values = List.of(
            BigDecimal.valueOf(1), BigDecimal.valueOf(2), BigDecimal.valueOf(3), BigDecimal.valueOf(4));

        List<BigDecimal> ema = IndicatorLibrary.ema(values, 3);

        assertEquals(2, ema.size());
        assertEquals(0, BigDecimal.valueOf(2).compareTo(ema.get(0)), "Seed is SMA of first 3 values");
        assertEquals(0, BigDecimal.valueOf(3).compareTo(ema.get(1)), "k=0.5: 4*0.5 + 2*0.5 = 3");
        assertNull(IndicatorLibrary.latestEma(values.subList(0, 2), 3));
    }

    @Test
    void testEmaSlopeSign() {
        List<Candle> rising = CandleFixtures.trending(T0, Granularity.H4, 20, 1.0, 0.01, 0.002);
        List<Candle> falling = CandleFixtures.trending(T0, Granularity.H4, 20, 1.2, -0.01, 0.002);

        assertTrue(IndicatorLibrary.emaSlope(IndicatorLibrary.closes(rising), 10).signum() > 0);
        assertTrue(IndicatorLibrary.emaSlope(IndicatorLibrary.closes(falling), 10).signum() < 0);
        assertEquals(BigDecimal.ZERO, IndicatorLibrary.emaSlope(IndicatorLibrary.closes(rising.subList(0, 10)), 10),
            "A single EMA point has no slope");
    }

    @Test
    void testFindSwingPoints() {
        List<Candle> candles = List.of(
            CandleFixtures.bar(T0, 1.00, 1.01, 0.99, 1.00),
            CandleFixtures.bar(T0.plusSeconds(3600), 1.00, 1.05, 0.98, 1.02),
            CandleFixtures.bar(T0.plusSeconds(7200), 1.02, 1.03, 0.95, 0.97),
            CandleFixtures.bar(T0.plusSeconds(10800), 0.97, 1.04, 0.96, 1.03),
            CandleFixtures.bar(T0.plusSeconds(14400), 1.03, 1.035, 0.97, 1.00)
        );

        IndicatorLibrary.SwingPoints swings = IndicatorLibrary.findSwingPoints(candles);

        assertEquals(List.of(BigDecimal.valueOf(1.05), BigDecimal.valueOf(1.04)), swings.highs());
        assertEquals(List.of(BigDecimal.valueOf(0.95)), swings.lows());
        assertEquals(BigDecimal.valueOf(1.05), swings.highestHigh());
        assertEquals(BigDecimal.valueOf(0.95), swings.lowestLow());
    }

    @Test
    void testFindSwingPointsTooFewBars() {
        IndicatorLibrary.SwingPoints swings = IndicatorLibrary.findSwingPoints(List.of());

        assertTrue(swings.highs().isEmpty());
        assertNull(swings.highestHigh());
        assertNull(swings.lowestLow());
    }
}
