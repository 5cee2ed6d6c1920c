package in.fxsignal.domain.model;

import java.util.Optional;

/**
 * The closed set of tracked currencies.
 */
public enum Currency {
    EUR,
    GBP,
    USD,
    JPY,
    CHF,
    AUD,
    NZD,
    CAD;

    /**
     * Look up a tracked currency by symbol. Empty for anything outside the set.
     */
    public static Optional<Currency> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String normalized = symbol.trim().toUpperCase();
        for (Currency c : values()) {
            if (c.name().equals(normalized)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
