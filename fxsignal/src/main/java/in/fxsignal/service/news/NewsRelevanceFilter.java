package in.fxsignal.service.news;

import in.fxsignal.domain.model.Currency;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.EconomicEvent;
import in.fxsignal.domain.model.TradeSignal;
import in.fxsignal.service.trade.ActiveTrades;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Upcoming market-moving news for currencies in active trades.
 *
 * An event is relevant when its impact is High or Medium, its currency is
 * involved, and it occurs within the next hour (0 <= t - now <= 1h).
 */
public final class NewsRelevanceFilter {

    static final Duration HORIZON = Duration.ofHours(1);

    private static final DateTimeFormatter UTC_MINUTE =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final ActiveTrades activeTrades;

    public NewsRelevanceFilter(ActiveTrades activeTrades) {
        this.activeTrades = activeTrades;
    }

    /**
     * Relevant events among {@code events} for the given currency symbols.
     */
    public static List<EconomicEvent> relevant(Collection<String> currencies, List<EconomicEvent> events,
                                               Instant now) {
        List<EconomicEvent> result = new ArrayList<>();
        for (EconomicEvent ev : events) {
            if (ev.currency() == null || !currencies.contains(ev.currency().trim().toUpperCase())) {
                continue;
            }
            if (ev.impact() == null || !ev.impact().isMarketMoving()) {
                continue;
            }
            long secondsUntil = Duration.between(now, ev.time()).getSeconds();
            if (secondsUntil >= 0 && secondsUntil <= HORIZON.getSeconds()) {
                result.add(ev);
            }
        }
        return result;
    }

    /**
     * Relevant events per active pair, pairs in signal order. Pairs with no events are omitted.
     */
    public Map<CurrencyPair, List<EconomicEvent>> forActiveTrades(List<EconomicEvent> events, Instant now) {
        Map<CurrencyPair, List<EconomicEvent>> result = new LinkedHashMap<>();
        for (TradeSignal trade : activeTrades.snapshot()) {
            CurrencyPair pair = trade.pair();
            if (result.containsKey(pair)) {
                continue;
            }
            List<EconomicEvent> hits = relevant(symbols(Set.of(pair.base(), pair.quote())), events, now);
            if (!hits.isEmpty()) {
                result.put(pair, hits);
            }
        }
        return result;
    }

    /**
     * Warning text for one (pair, event).
     */
    public static String format(CurrencyPair pair, EconomicEvent ev) {
        return "News Alert for " + pair + " trade!\n"
            + ev.currency() + " - " + ev.title() + " (" + ev.impact() + ")\n"
            + "Time: " + UTC_MINUTE.format(ev.time());
    }

    private static Set<String> symbols(Set<Currency> currencies) {
        return currencies.stream().map(Currency::name).collect(Collectors.toSet());
    }
}
