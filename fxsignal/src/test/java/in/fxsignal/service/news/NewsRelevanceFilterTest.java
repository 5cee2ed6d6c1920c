package in.fxsignal.service.news;

import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.EconomicEvent;
import in.fxsignal.domain.model.ImpactLevel;
import in.fxsignal.domain.model.TradeSignalFixtures;
import in.fxsignal.service.trade.ActiveTrades;
import in.fxsignal.service.trade.InMemoryActiveTradeRepository;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for news relevance.
 *
 * Tests:
 * - Impact, currency and one-hour horizon filtering
 * - Grouping by active pair
 * - Warning text
 */
class NewsRelevanceFilterTest {

    private static final Instant NOW = Instant.parse("2024-03-05T13:00:00Z");

    private static EconomicEvent event(long minutesAhead, String currency, ImpactLevel impact, String title) {
        return new EconomicEvent(NOW.plusSeconds(minutesAhead * 60), currency, impact, title, null);
    }

    @Test
    void testRelevantFiltering() {
        EconomicEvent cpi = event(30, "USD", ImpactLevel.HIGH, "CPI");
        EconomicEvent atHorizon = event(60, "eur ", ImpactLevel.MEDIUM, "ECB Speech");
        List<EconomicEvent> events = List.of(
            cpi,
            atHorizon,
            event(61, "USD", ImpactLevel.HIGH, "Too late"),
            event(-1, "USD", ImpactLevel.HIGH, "Already out"),
            event(10, "USD", ImpactLevel.LOW, "Low impact"),
            event(10, "JPY", ImpactLevel.HIGH, "Other currency"),
            event(10, null, ImpactLevel.HIGH, "No currency"));

        assertEquals(List.of(cpi, atHorizon), NewsRelevanceFilter.relevant(Set.of("EUR", "USD"), events, NOW));
    }

    @Test
    void testForActiveTradesGroupsByPair() {
        ActiveTrades trades = new ActiveTrades(new InMemoryActiveTradeRepository());
        trades.add(TradeSignalFixtures.buyEurUsd("a", NOW.minusSeconds(600)));
        trades.add(TradeSignalFixtures.sellUsdJpy("b", NOW.minusSeconds(300)));
        EconomicEvent nfp = event(15, "USD", ImpactLevel.HIGH, "Non-Farm Payrolls");
        EconomicEvent boj = event(20, "JPY", ImpactLevel.MEDIUM, "BoJ Minutes");

        Map<CurrencyPair, List<EconomicEvent>> grouped =
            new NewsRelevanceFilter(trades).forActiveTrades(List.of(nfp, boj), NOW);

        assertEquals(List.of(CurrencyPair.parse("EUR_USD"), CurrencyPair.parse("USD_JPY")), List.copyOf(grouped.keySet()));
        assertEquals(List.of(nfp), grouped.get(CurrencyPair.parse("EUR_USD")));
        assertEquals(List.of(nfp, boj), grouped.get(CurrencyPair.parse("USD_JPY")));
    }

    @Test
    void testWarningText() {
        String warning = NewsRelevanceFilter.format(CurrencyPair.parse("EUR_USD"),
            event(15, "USD", ImpactLevel.HIGH, "CPI"));

        assertEquals("News Alert for EUR_USD trade!\nUSD - CPI (HIGH)\nTime: 2024-03-05 13:15 UTC", warning);
    }

    @Test
    void testImpactParsing() {
        assertEquals(ImpactLevel.HIGH, ImpactLevel.parse(" High "));
        assertEquals(ImpactLevel.LOW, ImpactLevel.parse("Non-Economic"));
        assertEquals(ImpactLevel.LOW, ImpactLevel.parse(null));
    }
}
