package in.fxsignal.domain.model;

import in.fxsignal.exceptions.InvalidPairException;

/**
 * Ordered (base, quote) currency pair, identified as "BASE_QUOTE".
 */
public record CurrencyPair(Currency base, Currency quote) {

    public CurrencyPair {
        if (base == null || quote == null) {
            throw new IllegalArgumentException("Pair currencies cannot be null");
        }
        if (base == quote) {
            throw new InvalidPairException(base + "_" + quote, "base and quote are the same currency");
        }
    }

    /**
     * Parse an identifier such as "EUR_USD" (also accepts "EUR/USD" and "EURUSD").
     *
     * @throws InvalidPairException if malformed or either side is untracked
     */
    public static CurrencyPair parse(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new InvalidPairException(String.valueOf(identifier), "blank identifier");
        }
        String normalized = identifier.trim().toUpperCase().replace('/', '_');
        String baseSymbol;
        String quoteSymbol;
        if (normalized.length() == 7 && normalized.charAt(3) == '_') {
            baseSymbol = normalized.substring(0, 3);
            quoteSymbol = normalized.substring(4);
        } else if (normalized.length() == 6 && normalized.chars().allMatch(Character::isLetter)) {
            baseSymbol = normalized.substring(0, 3);
            quoteSymbol = normalized.substring(3);
        } else {
            throw new InvalidPairException(identifier, "expected BASE_QUOTE");
        }

        Currency base = Currency.fromSymbol(baseSymbol)
            .orElseThrow(() -> new InvalidPairException(identifier, "untracked currency " + baseSymbol));
        Currency quote = Currency.fromSymbol(quoteSymbol)
            .orElseThrow(() -> new InvalidPairException(identifier, "untracked currency " + quoteSymbol));
        return new CurrencyPair(base, quote);
    }

    public CurrencyPair inverse() {
        return new CurrencyPair(quote, base);
    }

    public boolean contains(Currency currency) {
        return base == currency || quote == currency;
    }

    /**
     * Identifier used by the candle API and as cooldown subject.
     */
    public String symbol() {
        return base.name() + "_" + quote.name();
    }

    @Override
    public String toString() {
        return symbol();
    }
}
