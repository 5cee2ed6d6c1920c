package in.fxsignal.domain.model;

/**
 * FX trading sessions by New York local hour.
 */
public enum TradingSession {
    ASIAN("Asian", 0, 8),
    LONDON("London", 8, 16),
    NEW_YORK("NewYork", 16, 24);

    private final String label;
    private final int startHour;
    private final int endHour;

    TradingSession(String label, int startHour, int endHour) {
        this.label = label;
        this.startHour = startHour;
        this.endHour = endHour;
    }

    /**
     * Name used as cooldown category when cooldowns are session scoped.
     */
    public String label() {
        return label;
    }

    public static TradingSession forHour(int newYorkHour) {
        if (newYorkHour < 0 || newYorkHour > 23) {
            throw new IllegalArgumentException("Hour out of range: " + newYorkHour);
        }
        for (TradingSession s : values()) {
            if (newYorkHour >= s.startHour && newYorkHour < s.endHour) {
                return s;
            }
        }
        return NEW_YORK;
    }
}
