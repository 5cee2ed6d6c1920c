package in.fxsignal.service.strength;

import java.util.List;

/**
 * Weights of the composite strength score components.
 */
public record StrengthWeights(double priceChange, double rsi, double emaSlope, double atr) {

    public static StrengthWeights defaults() {
        return new StrengthWeights(0.4, 0.3, 0.2, 0.1);
    }

    /**
     * Parse "price,rsi,ema,atr", e.g. "0.4,0.3,0.2,0.1".
     */
    public static StrengthWeights parse(List<String> parts) {
        if (parts == null || parts.size() != 4) {
            throw new IllegalArgumentException("STRENGTH_WEIGHTS needs 4 values, got " + parts);
        }
        try {
            return new StrengthWeights(
                Double.parseDouble(parts.get(0)),
                Double.parseDouble(parts.get(1)),
                Double.parseDouble(parts.get(2)),
                Double.parseDouble(parts.get(3))
            );
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("STRENGTH_WEIGHTS must be numeric: " + parts, e);
        }
    }

    public double sum() {
        return priceChange + rsi + emaSlope + atr;
    }

    public boolean isValid() {
        return priceChange >= 0 && rsi >= 0 && emaSlope >= 0 && atr >= 0 && sum() > 0;
    }
}
