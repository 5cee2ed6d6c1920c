package in.fxsignal.domain.model;

/**
 * Economic calendar impact classification.
 */
public enum ImpactLevel {
    HIGH,
    MEDIUM,
    LOW,
    HOLIDAY;

    public boolean isMarketMoving() {
        return this == HIGH || this == MEDIUM;
    }

    /**
     * Lenient parse of calendar feed values ("High", "Medium", ...). Unknown maps to LOW.
     */
    public static ImpactLevel parse(String value) {
        if (value == null) {
            return LOW;
        }
        return switch (value.trim().toUpperCase()) {
            case "HIGH" -> HIGH;
            case "MEDIUM" -> MEDIUM;
            case "HOLIDAY" -> HOLIDAY;
            default -> LOW;
        };
    }
}
