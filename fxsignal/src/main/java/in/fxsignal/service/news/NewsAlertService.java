package in.fxsignal.service.news;

import in.fxsignal.application.port.output.EconomicCalendarSource;
import in.fxsignal.application.port.output.NotificationSink;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.EconomicEvent;
import in.fxsignal.exceptions.CalendarFetchException;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import in.fxsignal.service.cooldown.CooldownStore;
import in.fxsignal.service.trade.ActiveTrades;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * News Alert Service - warns about upcoming High/Medium impact events for
 * currencies of open trades.
 *
 * FLOW (one run):
 * 1. Skip when there are no active trades (no calendar request)
 * 2. Fetch the calendar week
 * 3. For each (active pair, relevant event) not yet warned about: send the warning
 * 4. Record the (pair, event) cooldown key once delivered
 *
 * A failed delivery is retried on the next run while the event is still ahead.
 */
public final class NewsAlertService {
    private static final Logger log = LoggerFactory.getLogger(NewsAlertService.class);

    /**
     * Keeps a warned (pair, event) key past the event time.
     */
    public static final Duration ALERT_WINDOW = NewsRelevanceFilter.HORIZON.multipliedBy(2);

    static final String CATEGORY_PREFIX = "news:";

    private final EconomicCalendarSource calendar;
    private final ActiveTrades activeTrades;
    private final NewsRelevanceFilter filter;
    private final NotificationSink sink;
    private final CooldownStore cooldownStore;
    private final SignalMetrics metrics;

    public NewsAlertService(EconomicCalendarSource calendar, ActiveTrades activeTrades, NotificationSink sink,
                            CooldownStore cooldownStore, SignalMetrics metrics) {
        this.calendar = calendar;
        this.activeTrades = activeTrades;
        this.filter = new NewsRelevanceFilter(activeTrades);
        this.sink = sink;
        this.cooldownStore = cooldownStore;
        this.metrics = metrics;
    }

    /**
     * @return number of warnings delivered on this run
     */
    public int run(Instant now) {
        if (activeTrades.size() == 0) {
            return 0;
        }

        List<EconomicEvent> events;
        try {
            events = calendar.events();
        } catch (CalendarFetchException e) {
            log.warn("[NEWS] Calendar unavailable, skipping run: {}", e.getMessage());
            return 0;
        }

        int sent = 0;
        for (Map.Entry<CurrencyPair, List<EconomicEvent>> entry : filter.forActiveTrades(events, now).entrySet()) {
            CurrencyPair pair = entry.getKey();
            for (EconomicEvent ev : entry.getValue()) {
                CooldownKey key = keyFor(pair, ev);
                if (!cooldownStore.isAllowed(key, now, ALERT_WINDOW)) {
                    continue;
                }
                boolean delivered = sink.send(NewsRelevanceFilter.format(pair, ev));
                metrics.recordNotification(delivered);
                if (delivered) {
                    cooldownStore.record(key, now);
                    sent++;
                    log.info("[NEWS] Alert sent for {}: {} - {}", pair, ev.currency(), ev.title());
                } else {
                    log.warn("[NEWS] Alert delivery failed for {}: {} - {}", pair, ev.currency(), ev.title());
                }
            }
        }
        return sent;
    }

    /**
     * One key per (pair, event): event time, currency and title identify the event.
     */
    static CooldownKey keyFor(CurrencyPair pair, EconomicEvent ev) {
        String category = CATEGORY_PREFIX + ev.time().getEpochSecond() + ":"
            + ev.currency().trim().toUpperCase() + ":" + ev.title().replace('|', '/');
        return CooldownKey.of(pair, category);
    }
}
