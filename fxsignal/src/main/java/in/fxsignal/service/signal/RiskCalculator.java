package in.fxsignal.service.signal;

import in.fxsignal.domain.model.Direction;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * ATR-based stop and targets.
 *
 * stop = entry ∓ stopMultiple × ATR, target_i = entry ± targetMultiple_i × ATR
 * (upper sign for BUY).
 */
public final class RiskCalculator {

    private final BigDecimal stopMultiple;
    private final List<BigDecimal> targetMultiples;

    public RiskCalculator(double stopMultiple, List<Double> targetMultiples) {
        if (stopMultiple <= 0) {
            throw new IllegalArgumentException("Stop multiple must be positive: " + stopMultiple);
        }
        if (targetMultiples == null || targetMultiples.isEmpty()) {
            throw new IllegalArgumentException("At least one target multiple is required");
        }
        this.stopMultiple = BigDecimal.valueOf(stopMultiple);
        this.targetMultiples = targetMultiples.stream().map(BigDecimal::valueOf).toList();
    }

    public RiskLevels compute(Direction direction, BigDecimal entry, BigDecimal atr) {
        BigDecimal sign = BigDecimal.valueOf(direction.sign());
        BigDecimal stop = entry.subtract(sign.multiply(stopMultiple).multiply(atr));

        List<BigDecimal> targets = new ArrayList<>(targetMultiples.size());
        for (BigDecimal m : targetMultiples) {
            targets.add(entry.add(sign.multiply(m).multiply(atr)));
        }
        return new RiskLevels(entry, stop, List.copyOf(targets));
    }

    /**
     * Entry, stop and ordered targets (nearest first).
     */
    public record RiskLevels(BigDecimal entry, BigDecimal stopLoss, List<BigDecimal> takeProfits) {

        /**
         * Reward:risk on the first target; zero when there is no risk distance.
         */
        public BigDecimal rewardToRisk() {
            BigDecimal risk = entry.subtract(stopLoss).abs();
            if (risk.signum() == 0) {
                return BigDecimal.ZERO;
            }
            return takeProfits.get(0).subtract(entry).abs().divide(risk, MathContext.DECIMAL64);
        }

        public boolean meets(double minRewardRisk) {
            return rewardToRisk().compareTo(BigDecimal.valueOf(minRewardRisk)) >= 0;
        }
    }
}
