package in.fxsignal.service.strength;

import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Strong rank minus weak rank must be one of an explicit set (e.g. 10, 12, 14).
 */
public final class AcceptedDifferentialPolicy implements StrengthPolicy {

    private final Set<Integer> accepted;

    public AcceptedDifferentialPolicy(Set<Integer> accepted) {
        if (accepted == null || accepted.isEmpty()) {
            throw new IllegalArgumentException("Accepted differentials cannot be empty");
        }
        this.accepted = Set.copyOf(accepted);
    }

    @Override
    public boolean accepts(int strongRank, int weakRank) {
        return accepted.contains(strongRank - weakRank);
    }

    @Override
    public String describe() {
        return "ACCEPTED_DIFFS:" + new TreeSet<>(accepted).stream()
            .map(String::valueOf)
            .collect(Collectors.joining(","));
    }
}
