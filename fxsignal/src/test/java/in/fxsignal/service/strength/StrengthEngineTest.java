package in.fxsignal.service.strength;

import in.fxsignal.application.port.output.CandleSource;
import in.fxsignal.domain.data.CandleFixtures;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.Currency;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.RankMap;
import in.fxsignal.domain.model.StrengthScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit tests for StrengthEngine.
 *
 * Tests:
 * - Rank mapping of known scores onto [-7, +7]
 * - Monotonicity and zero avoidance
 * - Base/quote attribution of pair scores
 * - Missing candle data
 */
@ExtendWith(MockitoExtension.class)
class StrengthEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-05T12:00:00Z");
    private static final CurrencyPair EUR_USD = CurrencyPair.parse("EUR_USD");
    private static final CurrencyPair GBP_USD = CurrencyPair.parse("GBP_USD");
    private static final CurrencyPair USD_JPY = CurrencyPair.parse("USD_JPY");

    @Mock
    private CandleSource candleSource;

    private StrengthEngine engine;

    @BeforeEach
    void setUp() {
        engine = new StrengthEngine(candleSource, Granularity.H4, 20, StrengthWeights.defaults());
    }

    @Test
    void testRankOfFourScores() {
        List<StrengthScore> scores = List.of(
            new StrengthScore(Currency.CHF, -5.0, 1),
            new StrengthScore(Currency.EUR, 10.0, 1),
            new StrengthScore(Currency.JPY, -10.0, 1),
            new StrengthScore(Currency.GBP, 5.0, 1)
        );

        RankMap ranks = StrengthEngine.rank(scores);

        assertEquals(Map.of(Currency.EUR, 7, Currency.GBP, 2, Currency.CHF, -2, Currency.JPY, -7), ranks.asMap());
    }

    @Test
    void testRankOfEightScoresIsMonotoneAndNeverZero() {
        List<StrengthScore> scores = new ArrayList<>();
        Currency[] currencies = Currency.values();
        for (int i = 0; i < currencies.length; i++) {
            scores.add(new StrengthScore(currencies[i], 8.0 - i, 3));
        }

        RankMap ranks = StrengthEngine.rank(scores);

        assertEquals(8, ranks.size());
        assertEquals(7, ranks.rankOf(currencies[0]).orElseThrow(), "Strongest gets +7");
        assertEquals(-7, ranks.rankOf(currencies[7]).orElseThrow(), "Weakest gets -7");
        int previous = Integer.MAX_VALUE;
        for (Currency c : currencies) {
            int rank = ranks.rankOf(c).orElseThrow();
            assertNotEquals(0, rank, "Zero is never a rank");
            assertTrue(rank <= previous, "Ranks must not increase as scores fall");
            previous = rank;
        }
    }

    @Test
    void testRankOddCountMidpointNudged() {
        List<StrengthScore> scores = List.of(
            new StrengthScore(Currency.EUR, 3.0, 1),
            new StrengthScore(Currency.USD, 0.0, 1),
            new StrengthScore(Currency.JPY, -3.0, 1)
        );

        RankMap ranks = StrengthEngine.rank(scores);

        assertEquals(7, ranks.rankOf(Currency.EUR).orElseThrow());
        assertEquals(1, ranks.rankOf(Currency.USD).orElseThrow(), "Midpoint falls in the upper half");
        assertEquals(-7, ranks.rankOf(Currency.JPY).orElseThrow());
    }

    @Test
    void testRankFewerThanTwoScoresIsEmpty() {
        assertTrue(StrengthEngine.rank(List.of()).isEmpty());
        assertTrue(StrengthEngine.rank(List.of(new StrengthScore(Currency.EUR, 1.0, 1))).isEmpty());
    }

    @Test
    void testNoCandlesGivesEmptyRanks() {
        when(candleSource.get(any(), any(), anyInt())).thenReturn(List.of());

        RankMap ranks = engine.computeRanks(List.of(EUR_USD, GBP_USD, USD_JPY));

        assertTrue(ranks.isEmpty(), "No data, no ranking");
    }

    @Test
    void testRisingPairStrengthensBaseAndWeakensQuote() {
        when(candleSource.get(eq(EUR_USD), eq(Granularity.H4), eq(20)))
            .thenReturn(CandleFixtures.trending(NOW, Granularity.H4, 20, 1.08, 0.002, 0.0005));
        when(candleSource.get(eq(USD_JPY), eq(Granularity.H4), eq(20)))
            .thenReturn(List.of());

        List<StrengthScore> scores = engine.computeScores(List.of(EUR_USD, USD_JPY));

        assertEquals(2, scores.size(), "USD_JPY had no candles and contributes nothing");
        assertEquals(Currency.EUR, scores.get(0).currency());
        assertTrue(scores.get(0).score() > 0);
        assertEquals(Currency.USD, scores.get(1).currency());
        assertEquals(-scores.get(0).score(), scores.get(1).score(), 1e-12, "Quote receives the negated score");
    }

    @Test
    void testScoresAreAveragedPerCurrency() {
        when(candleSource.get(eq(EUR_USD), any(), anyInt()))
            .thenReturn(CandleFixtures.trending(NOW, Granularity.H4, 20, 1.08, 0.002, 0.0005));
        when(candleSource.get(eq(GBP_USD), any(), anyInt()))
            .thenReturn(CandleFixtures.trending(NOW, Granularity.H4, 20, 1.26, 0.002, 0.0005));

        List<StrengthScore> scores = engine.computeScores(List.of(EUR_USD, GBP_USD));

        StrengthScore usd = scores.stream().filter(s -> s.currency() == Currency.USD).findFirst().orElseThrow();
        assertEquals(2, usd.contributions(), "USD appears in both pairs");
        assertEquals(Currency.USD, scores.get(scores.size() - 1).currency(), "USD is weakest against both");
    }

    @Test
    void testCompositeScoreSignFollowsTrend() {
        double up = StrengthEngine.compositeScore(
            CandleFixtures.trending(NOW, Granularity.H4, 20, 1.0, 0.01, 0.001), StrengthWeights.defaults());
        double down = StrengthEngine.compositeScore(
            CandleFixtures.trending(NOW, Granularity.H4, 20, 1.3, -0.01, 0.001), StrengthWeights.defaults());

        assertTrue(up > down, "Rising series must outscore falling series");
        assertTrue(up > 0);
    }
}
