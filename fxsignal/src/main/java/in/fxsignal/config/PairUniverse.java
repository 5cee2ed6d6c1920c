package in.fxsignal.config;

import in.fxsignal.domain.model.Currency;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.exceptions.InvalidPairException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Allow-listed pairs to evaluate, in configured order.
 *
 * Malformed identifiers and untracked currencies are skipped with a warning.
 * A pair whose inverse is already listed is dropped (first occurrence wins),
 * so "EUR_USD" and "USD_EUR" never produce independent signals.
 */
public final class PairUniverse {
    private static final Logger log = LoggerFactory.getLogger(PairUniverse.class);

    private final List<CurrencyPair> pairs;

    private PairUniverse(List<CurrencyPair> pairs) {
        this.pairs = List.copyOf(pairs);
    }

    public static PairUniverse of(List<String> identifiers) {
        Set<CurrencyPair> accepted = new LinkedHashSet<>();
        for (String id : identifiers) {
            CurrencyPair pair;
            try {
                pair = CurrencyPair.parse(id);
            } catch (InvalidPairException e) {
                log.warn("[CONFIG] Skipping pair: {}", e.getMessage());
                continue;
            }
            if (accepted.contains(pair)) {
                log.warn("[CONFIG] Duplicate pair {} ignored", pair);
                continue;
            }
            if (accepted.contains(pair.inverse())) {
                log.warn("[CONFIG] Pair {} ignored, inverse {} already listed", pair, pair.inverse());
                continue;
            }
            accepted.add(pair);
        }
        return new PairUniverse(new ArrayList<>(accepted));
    }

    public List<CurrencyPair> pairs() {
        return pairs;
    }

    /**
     * Tracked currencies that appear in at least one pair.
     */
    public Set<Currency> currencies() {
        Set<Currency> result = EnumSet.noneOf(Currency.class);
        for (CurrencyPair p : pairs) {
            result.add(p.base());
            result.add(p.quote());
        }
        return result;
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    public int size() {
        return pairs.size();
    }
}
