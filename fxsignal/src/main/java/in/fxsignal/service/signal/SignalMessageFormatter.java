package in.fxsignal.service.signal;

import in.fxsignal.domain.model.Currency;
import in.fxsignal.domain.model.Direction;
import in.fxsignal.domain.model.TradeSignal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Plain-text trade notification.
 */
public final class SignalMessageFormatter {

    public static String format(TradeSignal signal, double minRewardRisk) {
        int digits = signal.pair().quote() == Currency.JPY ? 3 : 5;
        boolean buy = signal.direction() == Direction.BUY;
        int strong = buy ? signal.baseRank() : signal.quoteRank();
        int weak = buy ? signal.quoteRank() : signal.baseRank();

        StringBuilder sb = new StringBuilder();
        sb.append(signal.direction()).append(' ').append(signal.pair())
            .append(" [").append(signal.category()).append("]\n");
        sb.append("Strength Diff: ").append(Math.abs(signal.strengthDifferential())).append('\n');
        sb.append(String.format(Locale.ROOT, "Strengths: %+d, %+d\n", strong, weak));
        sb.append(String.format(Locale.ROOT, "Decision RSI: %.1f | Entry RSI: %.1f\n",
            signal.decisionRsi(), signal.entryRsi()));
        sb.append("Entry: ").append(price(signal.entry(), digits))
            .append(" | SL: ").append(price(signal.stopLoss(), digits))
            .append(" | ATR: ").append(price(signal.atr(), digits)).append('\n');
        sb.append("TPs: ");
        for (int i = 0; i < signal.takeProfits().size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append("TP").append(i + 1).append(':').append(price(signal.takeProfits().get(i), digits));
        }
        sb.append(String.format(Locale.ROOT, " | Min RRR:1:%.1f\n", minRewardRisk));
        sb.append("Breakout: ").append(signal.breakoutTag());
        return sb.toString();
    }

    private static String price(BigDecimal value, int digits) {
        return value.setScale(digits, RoundingMode.HALF_UP).toPlainString();
    }

    private SignalMessageFormatter() {}
}
