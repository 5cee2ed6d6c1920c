package in.fxsignal.domain.data;

import java.time.Duration;

/**
 * Candle granularities requested from the candle source.
 */
public enum Granularity {
    M5(5, "M5"),
    M15(15, "M15"),
    M30(30, "M30"),
    H1(60, "H1"),
    H4(240, "H4"),
    /**
     * Daily candle. Aligned to the FX trading day (17:00 New York).
     */
    D1(1440, "D");

    private final int minutes;
    private final String apiCode;

    Granularity(int minutes, String apiCode) {
        this.minutes = minutes;
        this.apiCode = apiCode;
    }

    public int getMinutes() {
        return minutes;
    }

    /**
     * Code used by the OANDA v20 candles endpoint.
     */
    public String getApiCode() {
        return apiCode;
    }

    public Duration toDuration() {
        return Duration.ofMinutes(minutes);
    }

    /**
     * Parse either the enum name or the API code ("D" for daily).
     */
    public static Granularity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Granularity is blank");
        }
        String normalized = value.trim().toUpperCase();
        for (Granularity g : values()) {
            if (g.name().equals(normalized) || g.apiCode.equals(normalized)) {
                return g;
            }
        }
        throw new IllegalArgumentException("Unknown granularity: " + value);
    }
}
