package in.fxsignal.application.port.output;

import in.fxsignal.domain.model.CooldownKey;

import java.time.Instant;
import java.util.Map;

/**
 * Durable cooldown key to last-fired timestamp mapping.
 *
 * All methods throw {@link in.fxsignal.exceptions.CooldownPersistenceException}
 * when the backing store is unreadable or unwritable.
 */
public interface CooldownRepository {

    Map<CooldownKey, Instant> loadAll();

    void upsert(CooldownKey key, Instant firedAt);

    void deleteCategory(String category);

    void deleteOlderThan(Instant cutoff);

    /**
     * Replace the stored mapping with the given snapshot.
     */
    void saveAll(Map<CooldownKey, Instant> snapshot);
}
