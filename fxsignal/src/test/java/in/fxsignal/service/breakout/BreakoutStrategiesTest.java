package in.fxsignal.service.breakout;

import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.CandleFixtures;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.BreakoutStrategyType;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.Direction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the breakout strategies.
 *
 * Tests:
 * - CURRENT_BAR and PRIOR_BAR levels
 * - PRIOR_DAY grouping by trading date and scan window
 * - RANGE lookback and trend filter
 * - SWING_ATR confirmation conditions
 */
class BreakoutStrategiesTest {

    private static final CurrencyPair EUR_USD = CurrencyPair.parse("EUR_USD");
    private static final Instant T0 = Instant.parse("2024-03-05T12:00:00Z");

    // ═══════════════════════════════════════════════════════════════
    // CURRENT_BAR / PRIOR_BAR
    // ═══════════════════════════════════════════════════════════════

    @Test
    void testCurrentBarOnlyFiresOnInconsistentBar() {
        CurrentBarBreakout strategy = new CurrentBarBreakout();

        assertTrue(strategy.detect(EUR_USD, List.of(CandleFixtures.bar(T0, 1.10, 1.11, 1.09, 1.105)),
            Granularity.H1).isEmpty(), "Close inside its own range");

        Optional<BreakoutEvent> event = strategy.detect(EUR_USD,
            List.of(CandleFixtures.bar(T0, 1.10, 1.11, 1.09, 1.112)), Granularity.H1);
        assertTrue(event.isPresent());
        assertEquals(Direction.BUY, event.get().direction());
        assertEquals(BreakoutStrategyType.CURRENT_BAR, event.get().strategy());
        assertTrue(strategy.detect(EUR_USD, List.of(), Granularity.H1).isEmpty());
    }

    @Test
    void testPriorBar() {
        PriorBarBreakout strategy = new PriorBarBreakout();
        Candle prev = CandleFixtures.bar(T0, 1.10, 1.11, 1.09, 1.10);

        Optional<BreakoutEvent> buy = strategy.detect(EUR_USD,
            List.of(prev, CandleFixtures.bar(T0.plusSeconds(3600), 1.10, 1.12, 1.10, 1.115)), Granularity.H1);
        Optional<BreakoutEvent> sell = strategy.detect(EUR_USD,
            List.of(prev, CandleFixtures.bar(T0.plusSeconds(3600), 1.10, 1.10, 1.08, 1.085)), Granularity.H1);
        Optional<BreakoutEvent> inside = strategy.detect(EUR_USD,
            List.of(prev, CandleFixtures.bar(T0.plusSeconds(3600), 1.10, 1.105, 1.095, 1.10)), Granularity.H1);

        assertEquals(Direction.BUY, buy.orElseThrow().direction());
        assertEquals(0, prev.high().compareTo(buy.get().level()), "Level is the prior bar's high");
        assertEquals(Direction.SELL, sell.orElseThrow().direction());
        assertEquals(0, prev.low().compareTo(sell.get().level()));
        assertTrue(inside.isEmpty());
        assertTrue(strategy.detect(EUR_USD, List.of(prev), Granularity.H1).isEmpty(), "Needs two bars");
    }

    // ═══════════════════════════════════════════════════════════════
    // PRIOR_DAY
    // ═══════════════════════════════════════════════════════════════

    /**
     * Trading date 2024-03-05 bars (high 1.1000, low 1.0900), then today's bars
     * from 2024-03-05T22:00Z (17:00 New York) with the given closes.
     */
    private static List<Candle> priorDaySeries(double... todayCloses) {
        List<Candle> candles = new ArrayList<>();
        Instant t = Instant.parse("2024-03-05T10:00:00Z");
        for (int i = 0; i < 11; i++) {
            candles.add(CandleFixtures.bar(t, 1.095, 1.100, 1.090, 1.095));
            t = t.plus(Duration.ofHours(1));
        }
        t = Instant.parse("2024-03-05T22:00:00Z");
        for (double close : todayCloses) {
            candles.add(CandleFixtures.bar(t, 1.095, Math.max(close, 1.095) + 0.0005,
                Math.min(close, 1.095) - 0.0005, close));
            t = t.plus(Duration.ofHours(1));
        }
        return candles;
    }

    @Test
    void testPriorDayBuyOnLatestBar() {
        Optional<BreakoutEvent> event = new PriorDayBreakout(0)
            .detect(EUR_USD, priorDaySeries(1.095, 1.096, 1.1050), Granularity.H1);

        assertTrue(event.isPresent());
        assertEquals(Direction.BUY, event.get().direction());
        assertEquals(0, new BigDecimal("1.1").compareTo(event.get().level()), "Level is the prior day high");
        assertEquals("PRIOR_DAY@H1", event.get().tag());
    }

    @Test
    void testPriorDaySell() {
        Optional<BreakoutEvent> event = new PriorDayBreakout(0)
            .detect(EUR_USD, priorDaySeries(1.095, 1.0850), Granularity.H1);

        assertEquals(Direction.SELL, event.orElseThrow().direction());
        assertEquals(0, new BigDecimal("1.09").compareTo(event.get().level()));
    }

    @Test
    void testPriorDayScanWindow() {
        List<Candle> candles = priorDaySeries(1.095, 1.1050, 1.0990);

        assertTrue(new PriorDayBreakout(0).detect(EUR_USD, candles, Granularity.H1).isEmpty(),
            "Latest bar back inside the prior day range");
        assertEquals(Direction.BUY, new PriorDayBreakout(2).detect(EUR_USD, candles, Granularity.H1)
            .orElseThrow().direction(), "Scanning today's bars finds the earlier break");
    }

    @Test
    void testPriorDayNeedsPreviousDay() {
        List<Candle> todayOnly = priorDaySeries(1.095, 1.1050).subList(11, 13);

        assertTrue(new PriorDayBreakout(0).detect(EUR_USD, todayOnly, Granularity.H1).isEmpty());
    }

    @Test
    void testPriorDayOnDailyBarsUsesPreviousBar() {
        List<Candle> daily = List.of(
            CandleFixtures.bar(Instant.parse("2024-03-04T22:00:00Z"), 1.09, 1.10, 1.08, 1.095),
            CandleFixtures.bar(Instant.parse("2024-03-05T22:00:00Z"), 1.095, 1.11, 1.09, 1.105));

        BreakoutEvent event = new PriorDayBreakout(0).detect(EUR_USD, daily, Granularity.D1).orElseThrow();

        assertEquals(0, new BigDecimal("1.1").compareTo(event.level()));
        assertThrows(IllegalArgumentException.class, () -> new PriorDayBreakout(-1));
    }

    // ═══════════════════════════════════════════════════════════════
    // RANGE
    // ═══════════════════════════════════════════════════════════════

    private static List<Candle> rangeSeries(double lastClose) {
        List<Candle> candles = new ArrayList<>(CandleFixtures.flat(T0, Granularity.H1, 5, 1.10, 0.001));
        candles.add(CandleFixtures.bar(T0.plusSeconds(3600), 1.10, Math.max(lastClose, 1.10) + 0.0005,
            Math.min(lastClose, 1.10) - 0.0005, lastClose));
        return candles;
    }

    @Test
    void testRangeBreakout() {
        RangeBreakout strategy = new RangeBreakout(5, TrendFilter.NONE);

        BreakoutEvent buy = strategy.detect(EUR_USD, rangeSeries(1.103), Granularity.H1).orElseThrow();
        BreakoutEvent sell = strategy.detect(EUR_USD, rangeSeries(1.097), Granularity.H1).orElseThrow();

        assertEquals(Direction.BUY, buy.direction());
        assertEquals(0, new BigDecimal("1.101").compareTo(buy.level()));
        assertEquals(Direction.SELL, sell.direction());
        assertEquals(0, new BigDecimal("1.099").compareTo(sell.level()));
        assertTrue(strategy.detect(EUR_USD, rangeSeries(1.1005), Granularity.H1).isEmpty());
        assertTrue(new RangeBreakout(10, TrendFilter.NONE).detect(EUR_USD, rangeSeries(1.103), Granularity.H1)
            .isEmpty(), "Needs lookback + 1 bars");
    }

    @Test
    void testRangeBreakoutTrendFilterVeto() {
        RangeBreakout strategy = new RangeBreakout(5, (pair, direction) -> direction == Direction.SELL);

        assertTrue(strategy.detect(EUR_USD, rangeSeries(1.103), Granularity.H1).isEmpty(), "BUY vetoed");
        assertTrue(strategy.detect(EUR_USD, rangeSeries(1.097), Granularity.H1).isPresent());
    }

    // ═══════════════════════════════════════════════════════════════
    // SWING_ATR
    // ═══════════════════════════════════════════════════════════════

    /**
     * Steady trend with a spike every fifth bar (the swing extremes), then a
     * final bar that jumps {@code lastJump} in the trend direction.
     */
    static List<Candle> swingSeries(int count, double sign, double lastJump) {
        List<Candle> candles = new ArrayList<>();
        double base = sign > 0 ? 1.0 : 2.0;
        double close = base;
        Instant t = T0.minus(Duration.ofHours(count));
        for (int i = 0; i < count; i++) {
            double prev = close;
            close = i == count - 1 ? close + sign * lastJump : base + sign * 0.0005 * i;
            double spike = i % 5 == 0 && i > 0 ? 0.004 : 0.0005;
            double high = sign > 0 ? close + spike : close + 0.0005;
            double low = sign > 0 ? close - 0.0005 : close - spike;
            candles.add(CandleFixtures.bar(t, prev, high, low, close));
            t = t.plus(Duration.ofHours(1));
        }
        return candles;
    }

    @Test
    void testSwingAtrBuy() {
        List<Candle> candles = swingSeries(60, 1.0, 0.01);

        BreakoutEvent event = new SwingAtrBreakout(0.5).detect(EUR_USD, candles, Granularity.H1).orElseThrow();

        assertEquals(Direction.BUY, event.direction());
        assertEquals(candles.get(55).high(), event.level(), "Level is the highest swing high");
        assertEquals(BreakoutStrategyType.SWING_ATR, event.strategy());
    }

    @Test
    void testSwingAtrSell() {
        List<Candle> candles = swingSeries(60, -1.0, 0.01);

        BreakoutEvent event = new SwingAtrBreakout(0.5).detect(EUR_USD, candles, Granularity.H1).orElseThrow();

        assertEquals(Direction.SELL, event.direction());
        assertEquals(candles.get(55).low(), event.level());
    }

    @Test
    void testSwingAtrRejectsSmallMove() {
        List<Candle> candles = swingSeries(60, 1.0, 0.01);

        assertTrue(new SwingAtrBreakout(10.0).detect(EUR_USD, candles, Granularity.H1).isEmpty(),
            "Move below 10 x ATR");
    }

    @Test
    void testSwingAtrNeedsEnoughHistory() {
        assertTrue(new SwingAtrBreakout(0.5).detect(EUR_USD, swingSeries(19, 1.0, 0.01), Granularity.H1).isEmpty());
        assertTrue(new SwingAtrBreakout(0.5).detect(EUR_USD, swingSeries(40, 1.0, 0.01), Granularity.H1).isEmpty(),
            "EMA-50 unavailable");
    }
}
