package in.fxsignal.domain.model;

import in.fxsignal.exceptions.InvalidPairException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CurrencyPairTest {

    @Test
    void testParseAcceptedForms() {
        CurrencyPair expected = new CurrencyPair(Currency.EUR, Currency.USD);

        assertEquals(expected, CurrencyPair.parse("EUR_USD"));
        assertEquals(expected, CurrencyPair.parse("eur/usd"));
        assertEquals(expected, CurrencyPair.parse(" EURUSD "));
        assertEquals("EUR_USD", expected.symbol());
    }

    @Test
    void testParseRejectsUntrackedAndMalformed() {
        InvalidPairException untracked = assertThrows(InvalidPairException.class, () -> CurrencyPair.parse("EUR_SEK"));
        assertEquals("EUR_SEK", untracked.getIdentifier());
        assertThrows(InvalidPairException.class, () -> CurrencyPair.parse("EUR-USD-X"));
        assertThrows(InvalidPairException.class, () -> CurrencyPair.parse(""));
        assertThrows(InvalidPairException.class, () -> CurrencyPair.parse("USD_USD"));
    }

    @Test
    void testInverseAndContains() {
        CurrencyPair pair = CurrencyPair.parse("GBP_JPY");

        assertEquals(CurrencyPair.parse("JPY_GBP"), pair.inverse());
        assertTrue(pair.contains(Currency.JPY));
        assertFalse(pair.contains(Currency.USD));
    }
}
