package in.fxsignal.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Fully specified directional trade notification. Immutable.
 */
public record TradeSignal(
    String id,
    CurrencyPair pair,
    Direction direction,
    BigDecimal entry,
    BigDecimal stopLoss,
    List<BigDecimal> takeProfits,
    int baseRank,
    int quoteRank,
    int strengthDifferential,
    BigDecimal atr,
    double decisionRsi,
    double entryRsi,
    String breakoutTag,
    String category,
    Instant createdAt
) {
    public TradeSignal {
        if (takeProfits == null || takeProfits.isEmpty()) {
            throw new IllegalArgumentException("At least one take-profit level is required");
        }
        takeProfits = List.copyOf(takeProfits);
    }
}
