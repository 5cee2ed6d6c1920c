package in.fxsignal.service.cooldown;

import in.fxsignal.application.port.output.CooldownRepository;
import in.fxsignal.domain.model.CooldownKey;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Map-backed repository for service tests.
 */
public class InMemoryCooldownRepository implements CooldownRepository {

    private final Map<CooldownKey, Instant> rows = new HashMap<>();

    @Override
    public synchronized Map<CooldownKey, Instant> loadAll() {
        return new HashMap<>(rows);
    }

    @Override
    public synchronized void upsert(CooldownKey key, Instant firedAt) {
        rows.put(key, firedAt);
    }

    @Override
    public synchronized void deleteCategory(String category) {
        rows.keySet().removeIf(k -> k.category().equals(category));
    }

    @Override
    public synchronized void deleteOlderThan(Instant cutoff) {
        rows.values().removeIf(t -> t.isBefore(cutoff));
    }

    @Override
    public synchronized void saveAll(Map<CooldownKey, Instant> snapshot) {
        rows.clear();
        rows.putAll(snapshot);
    }

    public synchronized Map<CooldownKey, Instant> rows() {
        return new HashMap<>(rows);
    }
}
