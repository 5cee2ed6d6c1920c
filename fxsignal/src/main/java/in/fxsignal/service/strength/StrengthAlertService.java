package in.fxsignal.service.strength;

import in.fxsignal.application.port.output.NotificationSink;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.domain.model.Currency;
import in.fxsignal.domain.model.RankMap;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import in.fxsignal.service.cooldown.CooldownStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Periodic currency strength report.
 *
 * The ranking is sent at most once per cooldown window (key
 * currency_strength|strength_report); the window starts when the report is
 * attempted, whether or not delivery succeeded.
 */
public final class StrengthAlertService {
    private static final Logger log = LoggerFactory.getLogger(StrengthAlertService.class);

    public static final CooldownKey REPORT_KEY = new CooldownKey("currency_strength", "strength_report");
    public static final int EXTREME_RANK = 5;

    private final NotificationSink sink;
    private final CooldownStore cooldownStore;
    private final Duration cooldown;
    private final SignalMetrics metrics;

    public StrengthAlertService(NotificationSink sink, CooldownStore cooldownStore, Duration cooldown,
                                SignalMetrics metrics) {
        this.sink = sink;
        this.cooldownStore = cooldownStore;
        this.cooldown = cooldown;
        this.metrics = metrics;
    }

    /**
     * Send the ranking if the report is out of cooldown.
     *
     * @return currencies at the extremes (|rank| >= 5), empty for an empty map
     */
    public Map<Currency, Integer> publish(RankMap ranks, Instant now) {
        if (ranks.isEmpty()) {
            return Map.of();
        }

        if (cooldownStore.tryAcquire(REPORT_KEY, now, cooldown)) {
            boolean delivered = sink.send(format(ranks));
            metrics.recordNotification(delivered);
            if (delivered) {
                log.info("[STRENGTH] Sent currency strength report");
            } else {
                log.warn("[STRENGTH] Currency strength report delivery failed");
            }
        } else {
            log.debug("[STRENGTH] Report in cooldown, {} min remaining",
                cooldownStore.remaining(REPORT_KEY, now, cooldown).toMinutes());
        }

        return extremes(ranks);
    }

    public static Map<Currency, Integer> extremes(RankMap ranks) {
        Map<Currency, Integer> result = new EnumMap<>(Currency.class);
        ranks.asMap().forEach((c, r) -> {
            if (Math.abs(r) >= EXTREME_RANK) {
                result.put(c, r);
            }
        });
        return result;
    }

    public static String format(RankMap ranks) {
        StringBuilder sb = new StringBuilder();
        sb.append("Currency Strength Alert\n");
        sb.append("Currency Strength Rankings (+7 strongest -> -7 weakest):\n");
        for (Map.Entry<Currency, Integer> e : ranks.sortedDescending()) {
            int rank = e.getValue();
            sb.append(e.getKey()).append(": ").append(rank > 0 ? "+" : "").append(rank).append('\n');
        }
        return sb.toString();
    }
}
