package in.fxsignal.service.strength;

/**
 * Strong side at least +n and weak side at most -n.
 */
public final class MinimumRankPolicy implements StrengthPolicy {

    private final int minRank;

    public MinimumRankPolicy(int minRank) {
        if (minRank < 1 || minRank > 7) {
            throw new IllegalArgumentException("Minimum rank must be in 1..7: " + minRank);
        }
        this.minRank = minRank;
    }

    @Override
    public boolean accepts(int strongRank, int weakRank) {
        return strongRank >= minRank && weakRank <= -minRank;
    }

    @Override
    public String describe() {
        return "MIN_RANK:" + minRank;
    }
}
