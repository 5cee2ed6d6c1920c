package in.fxsignal.service.strength;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Only exact (strong, weak) rank combinations, e.g. 7/-7 and 7/-5.
 */
public final class PairedExtremesPolicy implements StrengthPolicy {

    private final List<RankPair> pairs;

    public PairedExtremesPolicy(List<RankPair> pairs) {
        if (pairs == null || pairs.isEmpty()) {
            throw new IllegalArgumentException("Paired ranks cannot be empty");
        }
        this.pairs = List.copyOf(pairs);
    }

    @Override
    public boolean accepts(int strongRank, int weakRank) {
        return pairs.contains(new RankPair(strongRank, weakRank));
    }

    @Override
    public String describe() {
        return "PAIRED:" + pairs.stream()
            .map(p -> p.strong() + "/" + p.weak())
            .collect(Collectors.joining(","));
    }

    public record RankPair(int strong, int weak) {}
}
