package in.fxsignal.service.cooldown;

import in.fxsignal.application.port.output.CooldownRepository;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.exceptions.CooldownPersistenceException;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CooldownStore - last-fired timestamp per (subject, category) key.
 *
 * STRUCTURE:
 * - In-memory ConcurrentHashMap is authoritative for decisions
 * - Every change is written through to the CooldownRepository
 * - {@link #tryAcquire} does check-then-record atomically per key
 *
 * PERSISTENCE FAILURES:
 * A failed write is logged, counted and marks the store dirty. Decisions keep
 * using in-memory state; the next {@link #flush()} rewrites the full snapshot.
 */
public final class CooldownStore {
    private static final Logger log = LoggerFactory.getLogger(CooldownStore.class);

    private final Map<CooldownKey, Instant> lastFired = new ConcurrentHashMap<>();
    private final CooldownRepository repository;
    private final SignalMetrics metrics;
    private final AtomicBoolean dirty = new AtomicBoolean(false);

    public CooldownStore(CooldownRepository repository, SignalMetrics metrics) {
        this.repository = repository;
        this.metrics = metrics;
    }

    /**
     * Load persisted state (called on startup). Starts empty if the store is unreadable.
     */
    public void load() {
        try {
            Map<CooldownKey, Instant> stored = repository.loadAll();
            lastFired.clear();
            lastFired.putAll(stored);
            log.info("[COOLDOWN] Loaded {} cooldown keys", stored.size());
        } catch (CooldownPersistenceException e) {
            log.warn("[COOLDOWN] Could not load cooldown state, starting empty: {}", e.getMessage());
            metrics.recordCooldownPersistFailure();
        }
    }

    /**
     * True if the key never fired or last fired at least {@code window} before {@code now}.
     */
    public boolean isAllowed(CooldownKey key, Instant now, Duration window) {
        Instant last = lastFired.get(key);
        return isElapsed(last, now, window);
    }

    /**
     * Record a fire at {@code now}, replacing any earlier timestamp.
     */
    public void record(CooldownKey key, Instant now) {
        lastFired.put(key, now);
        persist(key, now);
    }

    /**
     * Atomically check the window and record {@code now} if allowed.
     *
     * @return true if this caller acquired the key
     */
    public boolean tryAcquire(CooldownKey key, Instant now, Duration window) {
        boolean[] acquired = {false};
        lastFired.compute(key, (k, last) -> {
            if (isElapsed(last, now, window)) {
                acquired[0] = true;
                return now;
            }
            return last;
        });
        if (acquired[0]) {
            persist(key, now);
        }
        return acquired[0];
    }

    public Optional<Instant> lastFired(CooldownKey key) {
        return Optional.ofNullable(lastFired.get(key));
    }

    /**
     * Time left before the key may fire again; zero if allowed now.
     */
    public Duration remaining(CooldownKey key, Instant now, Duration window) {
        Instant last = lastFired.get(key);
        if (last == null) {
            return Duration.ZERO;
        }
        Duration left = window.minus(Duration.between(last, now));
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Remove every key of a category (e.g. a trading session that ended).
     *
     * @return number of keys removed
     */
    public int pruneCategory(String category) {
        int before = lastFired.size();
        lastFired.keySet().removeIf(k -> k.category().equals(category));
        int removed = before - lastFired.size();
        try {
            repository.deleteCategory(category);
        } catch (CooldownPersistenceException e) {
            markDirty(e);
        }
        if (removed > 0) {
            log.info("[COOLDOWN] Pruned {} keys of category {}", removed, category);
        }
        return removed;
    }

    /**
     * Remove keys last fired before {@code cutoff}.
     */
    public int pruneOlderThan(Instant cutoff) {
        int before = lastFired.size();
        lastFired.values().removeIf(t -> t.isBefore(cutoff));
        int removed = before - lastFired.size();
        try {
            repository.deleteOlderThan(cutoff);
        } catch (CooldownPersistenceException e) {
            markDirty(e);
        }
        if (removed > 0) {
            log.info("[COOLDOWN] Pruned {} keys last fired before {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * Write the full snapshot to durable storage.
     *
     * @return true if the snapshot was written
     */
    public boolean flush() {
        try {
            repository.saveAll(snapshot());
            dirty.set(false);
            return true;
        } catch (CooldownPersistenceException e) {
            log.warn("[COOLDOWN] Flush failed, keeping in-memory state: {}", e.getMessage());
            metrics.recordCooldownPersistFailure();
            dirty.set(true);
            return false;
        }
    }

    /**
     * Flush only if an earlier write failed.
     */
    public void flushIfDirty() {
        if (dirty.get()) {
            log.info("[COOLDOWN] Retrying flush of dirty cooldown state");
            flush();
        }
    }

    public boolean isDirty() {
        return dirty.get();
    }

    /**
     * Sorted copy of the current state.
     */
    public Map<CooldownKey, Instant> snapshot() {
        Map<CooldownKey, Instant> copy = new TreeMap<>(
            (a, b) -> a.asString().compareTo(b.asString()));
        copy.putAll(lastFired);
        return copy;
    }

    public int size() {
        return lastFired.size();
    }

    private void persist(CooldownKey key, Instant firedAt) {
        try {
            repository.upsert(key, firedAt);
        } catch (CooldownPersistenceException e) {
            markDirty(e);
        }
    }

    private void markDirty(CooldownPersistenceException e) {
        log.warn("[COOLDOWN] Persist failed, continuing with in-memory state: {}", e.getMessage());
        metrics.recordCooldownPersistFailure();
        dirty.set(true);
    }

    private static boolean isElapsed(Instant last, Instant now, Duration window) {
        return last == null || Duration.between(last, now).compareTo(window) >= 0;
    }
}
