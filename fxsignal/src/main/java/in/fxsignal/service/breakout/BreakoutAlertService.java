package in.fxsignal.service.breakout;

import in.fxsignal.application.port.output.CandleSource;
import in.fxsignal.application.port.output.NotificationSink;
import in.fxsignal.domain.model.BreakoutEvent;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import in.fxsignal.service.cooldown.CooldownStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Group breakout alert: one message when enough pairs break out together.
 *
 * Per-pair keys (pair|breakout) suppress pairs already alerted; the group key
 * (breakout_group|breakout) limits how often a group message goes out. Keys
 * are recorded only when delivery succeeded.
 */
public final class BreakoutAlertService {
    private static final Logger log = LoggerFactory.getLogger(BreakoutAlertService.class);

    public static final String CATEGORY = "breakout";
    public static final CooldownKey GROUP_KEY = new CooldownKey("breakout_group", CATEGORY);

    private static final DateTimeFormatter UTC_MINUTE =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final CandleSource candleSource;
    private final BreakoutDetector detector;
    private final BreakoutRule rule;
    private final int candleCount;
    private final NotificationSink sink;
    private final CooldownStore cooldownStore;
    private final int minPairs;
    private final Duration pairCooldown;
    private final Duration groupCooldown;
    private final SignalMetrics metrics;

    public BreakoutAlertService(CandleSource candleSource, BreakoutDetector detector, BreakoutRule rule,
                                int candleCount, NotificationSink sink, CooldownStore cooldownStore,
                                int minPairs, Duration pairCooldown, Duration groupCooldown,
                                SignalMetrics metrics) {
        this.candleSource = candleSource;
        this.detector = detector;
        this.rule = rule;
        this.candleCount = candleCount;
        this.sink = sink;
        this.cooldownStore = cooldownStore;
        this.minPairs = minPairs;
        this.pairCooldown = pairCooldown;
        this.groupCooldown = groupCooldown;
        this.metrics = metrics;
    }

    /**
     * Scan all pairs and send a group alert if enough fresh breakouts exist.
     *
     * @return pairs included in a delivered alert, empty otherwise
     */
    public List<CurrencyPair> run(List<CurrencyPair> pairs, Instant now) {
        if (!cooldownStore.isAllowed(GROUP_KEY, now, groupCooldown)) {
            log.debug("[BREAKOUT] Group alert in cooldown");
            return List.of();
        }

        List<CurrencyPair> fresh = new ArrayList<>();
        for (CurrencyPair pair : pairs) {
            try {
                Optional<BreakoutEvent> event = detector.detect(rule.strategy(), pair,
                    candleSource.get(pair, rule.timeframe(), candleCount), rule.timeframe());
                if (event.isEmpty()) {
                    continue;
                }
                CooldownKey key = CooldownKey.of(pair, CATEGORY);
                if (cooldownStore.isAllowed(key, now, pairCooldown)) {
                    fresh.add(pair);
                    log.info("[BREAKOUT] {} {} (will alert)", pair, event.get().tag());
                } else {
                    log.info("[BREAKOUT] {} broke out but cooldown active ({}s left)",
                        pair, cooldownStore.remaining(key, now, pairCooldown).getSeconds());
                }
            } catch (RuntimeException e) {
                log.error("[BREAKOUT] Error checking {}: {}", pair, e.getMessage(), e);
            }
        }

        if (fresh.size() < minPairs) {
            log.info("[BREAKOUT] {} fresh breakouts, need {} for a group alert", fresh.size(), minPairs);
            return List.of();
        }

        fresh.sort(Comparator.comparing(CurrencyPair::symbol));
        boolean delivered = sink.send(format(fresh, now));
        metrics.recordNotification(delivered);
        if (!delivered) {
            log.warn("[BREAKOUT] Failed to send group breakout alert");
            return List.of();
        }

        for (CurrencyPair pair : fresh) {
            cooldownStore.record(CooldownKey.of(pair, CATEGORY), now);
        }
        cooldownStore.record(GROUP_KEY, now);
        log.info("[BREAKOUT] Sent group alert for {} pairs", fresh.size());
        return List.copyOf(fresh);
    }

    static String format(List<CurrencyPair> pairs, Instant now) {
        StringBuilder sb = new StringBuilder();
        sb.append("Breakout Alert! (").append(pairs.size()).append(" pairs) - ")
            .append(UTC_MINUTE.format(now)).append("\n\n");
        for (int i = 0; i < pairs.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(pairs.get(i).symbol());
        }
        return sb.toString();
    }
}
