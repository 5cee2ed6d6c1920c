package in.fxsignal.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RankMapTest {

    @Test
    void testDifferentialAndRankedCheck() {
        RankMap ranks = RankMap.of(Map.of(Currency.EUR, 7, Currency.USD, -7, Currency.JPY, 1));
        CurrencyPair eurUsd = CurrencyPair.parse("EUR_USD");

        assertTrue(ranks.isRanked(eurUsd));
        assertEquals(14, ranks.differential(eurUsd));
        assertEquals(-14, ranks.differential(eurUsd.inverse()));
        assertFalse(ranks.isRanked(CurrencyPair.parse("GBP_USD")), "GBP has no rank");
    }

    @Test
    void testRejectsZeroAndOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> RankMap.of(Map.of(Currency.EUR, 0)));
        assertThrows(IllegalArgumentException.class, () -> RankMap.of(Map.of(Currency.EUR, 8)));
        assertThrows(IllegalArgumentException.class, () -> RankMap.of(Map.of(Currency.EUR, -8)));
    }

    @Test
    void testSortedDescendingAndEmpty() {
        RankMap ranks = RankMap.of(Map.of(Currency.EUR, -1, Currency.USD, 3, Currency.JPY, 1));

        List<Currency> order = ranks.sortedDescending().stream().map(Map.Entry::getKey).toList();

        assertEquals(List.of(Currency.USD, Currency.JPY, Currency.EUR), order);
        assertSame(RankMap.empty(), RankMap.of(Map.of()));
        assertTrue(RankMap.empty().isEmpty());
    }
}
