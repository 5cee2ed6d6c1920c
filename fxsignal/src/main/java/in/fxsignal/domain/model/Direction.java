package in.fxsignal.domain.model;

/**
 * Trade direction relative to the pair's base currency.
 */
public enum Direction {
    BUY,
    SELL;

    /**
     * +1 for BUY, -1 for SELL. Used to orient price offsets.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    public Direction opposite() {
        return this == BUY ? SELL : BUY;
    }
}
