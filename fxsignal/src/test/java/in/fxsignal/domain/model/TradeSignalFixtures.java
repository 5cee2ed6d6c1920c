package in.fxsignal.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Ready-made trade signals for tests.
 */
public final class TradeSignalFixtures {

    public static TradeSignal buyEurUsd(String id, Instant createdAt) {
        return new TradeSignal(id, CurrencyPair.parse("EUR_USD"), Direction.BUY,
            new BigDecimal("1.10000"), new BigDecimal("1.09800"),
            List.of(new BigDecimal("1.10400"), new BigDecimal("1.10800"), new BigDecimal("1.11200")),
            7, -7, 14, new BigDecimal("0.00200"), 62.5, 55.25,
            "PRIOR_DAY@H1", "strength_alert", createdAt);
    }

    public static TradeSignal sellUsdJpy(String id, Instant createdAt) {
        return new TradeSignal(id, CurrencyPair.parse("USD_JPY"), Direction.SELL,
            new BigDecimal("150.000"), new BigDecimal("150.300"),
            List.of(new BigDecimal("149.400")),
            -5, 6, -11, new BigDecimal("0.300"), 40.0, 44.0,
            "SWING_ATR@H1", "London", createdAt);
    }

    private TradeSignalFixtures() {}
}
