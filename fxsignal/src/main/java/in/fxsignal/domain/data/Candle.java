package in.fxsignal.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * OHLC candle for one period of one pair at one granularity (mid prices).
 */
public record Candle(
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close
) {
    public Candle {
        if (timestamp == null || open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("Candle fields cannot be null");
        }
    }

    /**
     * Create candle from raw values.
     */
    public static Candle of(Instant ts, double o, double h, double l, double c) {
        return new Candle(
            ts,
            BigDecimal.valueOf(o),
            BigDecimal.valueOf(h),
            BigDecimal.valueOf(l),
            BigDecimal.valueOf(c)
        );
    }
}
