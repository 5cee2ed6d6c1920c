package in.fxsignal.service.strength;

/**
 * Strong rank minus weak rank at least n.
 */
public final class MinimumDifferentialPolicy implements StrengthPolicy {

    private final int minDifferential;

    public MinimumDifferentialPolicy(int minDifferential) {
        if (minDifferential < 1 || minDifferential > 14) {
            throw new IllegalArgumentException("Minimum differential must be in 1..14: " + minDifferential);
        }
        this.minDifferential = minDifferential;
    }

    @Override
    public boolean accepts(int strongRank, int weakRank) {
        return strongRank - weakRank >= minDifferential;
    }

    @Override
    public String describe() {
        return "MIN_DIFF:" + minDifferential;
    }
}
