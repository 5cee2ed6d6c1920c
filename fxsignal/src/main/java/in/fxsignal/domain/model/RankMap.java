package in.fxsignal.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Currency to rank in [-7, +7] (0 excluded). Immutable.
 *
 * An empty map means "no opinion" for this tick.
 */
public final class RankMap {

    public static final int MAX_RANK = 7;
    public static final int MIN_RANK = -7;

    private static final RankMap EMPTY = new RankMap(Map.of());

    private final Map<Currency, Integer> ranks;

    private RankMap(Map<Currency, Integer> ranks) {
        this.ranks = ranks;
    }

    public static RankMap empty() {
        return EMPTY;
    }

    public static RankMap of(Map<Currency, Integer> ranks) {
        if (ranks == null || ranks.isEmpty()) {
            return EMPTY;
        }
        EnumMap<Currency, Integer> copy = new EnumMap<>(Currency.class);
        for (Map.Entry<Currency, Integer> e : ranks.entrySet()) {
            int rank = e.getValue();
            if (rank < MIN_RANK || rank > MAX_RANK || rank == 0) {
                throw new IllegalArgumentException("Rank out of range for " + e.getKey() + ": " + rank);
            }
            copy.put(e.getKey(), rank);
        }
        return new RankMap(Collections.unmodifiableMap(copy));
    }

    public Optional<Integer> rankOf(Currency currency) {
        return Optional.ofNullable(ranks.get(currency));
    }

    public boolean isRanked(CurrencyPair pair) {
        return ranks.containsKey(pair.base()) && ranks.containsKey(pair.quote());
    }

    /**
     * base rank - quote rank. Caller must check {@link #isRanked} first.
     */
    public int differential(CurrencyPair pair) {
        return ranks.get(pair.base()) - ranks.get(pair.quote());
    }

    public boolean isEmpty() {
        return ranks.isEmpty();
    }

    public int size() {
        return ranks.size();
    }

    public Map<Currency, Integer> asMap() {
        return ranks;
    }

    /**
     * Entries sorted strongest first.
     */
    public List<Map.Entry<Currency, Integer>> sortedDescending() {
        List<Map.Entry<Currency, Integer>> entries = new ArrayList<>(ranks.entrySet());
        entries.sort(Map.Entry.<Currency, Integer>comparingByValue(Comparator.reverseOrder()));
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return ranks.equals(((RankMap) o).ranks);
    }

    @Override
    public int hashCode() {
        return ranks.hashCode();
    }

    @Override
    public String toString() {
        return "RankMap" + ranks;
    }
}
