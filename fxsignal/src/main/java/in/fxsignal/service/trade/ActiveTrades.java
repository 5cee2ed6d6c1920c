package in.fxsignal.service.trade;

import in.fxsignal.application.port.output.ActiveTradeRepository;
import in.fxsignal.domain.model.Currency;
import in.fxsignal.domain.model.TradeSignal;
import in.fxsignal.exceptions.ActiveTradePersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ActiveTrades - open trade signals visible to other collaborators.
 *
 * STRUCTURE:
 * - Map<signalId, TradeSignal> of open signals
 * - Map<currency, Set<signalId>> index for currency-keyed lookups (news relevance)
 *
 * LIFECYCLE:
 * 1. Restored from the repository on startup
 * 2. Added when the signal pipeline emits
 * 3. Removed only by trade-lifecycle management through {@link #remove}
 */
public final class ActiveTrades {
    private static final Logger log = LoggerFactory.getLogger(ActiveTrades.class);

    private final Map<String, TradeSignal> byId = new ConcurrentHashMap<>();
    private final Map<Currency, Set<String>> byCurrency = new ConcurrentHashMap<>();
    private final ActiveTradeRepository repository;

    public ActiveTrades(ActiveTradeRepository repository) {
        this.repository = repository;
    }

    /**
     * Restore from the repository (called on startup).
     */
    public void load() {
        try {
            List<TradeSignal> stored = repository.loadAll();
            byId.clear();
            byCurrency.clear();
            stored.forEach(this::index);
            log.info("[TRADES] Restored {} active trades", byId.size());
        } catch (ActiveTradePersistenceException e) {
            log.warn("[TRADES] Could not restore active trades, starting empty: {}", e.getMessage());
        }
    }

    public void add(TradeSignal signal) {
        index(signal);
        log.debug("[TRADES] Added {} {} {}", signal.id(), signal.direction(), signal.pair());
    }

    /**
     * Remove a signal (trade closed or cancelled).
     *
     * @return true if it was present
     */
    public boolean remove(String signalId) {
        TradeSignal removed = byId.remove(signalId);
        if (removed == null) {
            return false;
        }
        unindex(removed.pair().base(), signalId);
        unindex(removed.pair().quote(), signalId);
        return true;
    }

    /**
     * Open signals, oldest first. Snapshot, safe to iterate.
     */
    public List<TradeSignal> snapshot() {
        return byId.values().stream()
            .sorted(Comparator.comparing(TradeSignal::createdAt))
            .toList();
    }

    /**
     * Open signals whose pair contains the currency.
     */
    public List<TradeSignal> forCurrency(Currency currency) {
        Set<String> ids = byCurrency.get(currency);
        if (ids == null) {
            return Collections.emptyList();
        }
        return ids.stream()
            .map(byId::get)
            .filter(s -> s != null)
            .sorted(Comparator.comparing(TradeSignal::createdAt))
            .toList();
    }

    /**
     * Currencies involved in at least one open signal.
     */
    public Set<Currency> currencies() {
        Set<Currency> result = EnumSet.noneOf(Currency.class);
        byCurrency.forEach((c, ids) -> {
            if (!ids.isEmpty()) {
                result.add(c);
            }
        });
        return result;
    }

    public int size() {
        return byId.size();
    }

    /**
     * Persist the current snapshot.
     *
     * @return true if written
     */
    public boolean flush() {
        try {
            repository.saveAll(snapshot());
            return true;
        } catch (ActiveTradePersistenceException e) {
            log.warn("[TRADES] Failed to persist active trades: {}", e.getMessage());
            return false;
        }
    }

    private void index(TradeSignal signal) {
        byId.put(signal.id(), signal);
        byCurrency.computeIfAbsent(signal.pair().base(), k -> ConcurrentHashMap.newKeySet()).add(signal.id());
        byCurrency.computeIfAbsent(signal.pair().quote(), k -> ConcurrentHashMap.newKeySet()).add(signal.id());
    }

    private void unindex(Currency currency, String signalId) {
        Set<String> ids = byCurrency.get(currency);
        if (ids != null) {
            ids.remove(signalId);
            if (ids.isEmpty()) {
                byCurrency.remove(currency);
            }
        }
    }
}
