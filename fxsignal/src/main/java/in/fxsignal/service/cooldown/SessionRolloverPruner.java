package in.fxsignal.service.cooldown;

import in.fxsignal.domain.model.TradingSession;
import in.fxsignal.service.candle.SessionClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Prunes the cooldown category of a trading session once the next session starts.
 *
 * The first tick after startup has no previous session to compare with, so it
 * prunes the categories of every session other than the current one. Keys left
 * over from a session that ended while the process was down go with them.
 */
public final class SessionRolloverPruner {
    private static final Logger log = LoggerFactory.getLogger(SessionRolloverPruner.class);

    private final CooldownStore cooldownStore;
    private final AtomicReference<TradingSession> current = new AtomicReference<>();

    public SessionRolloverPruner(CooldownStore cooldownStore) {
        this.cooldownStore = cooldownStore;
    }

    /**
     * Check for a session change at {@code now}.
     *
     * @return the session that ended, or null if none ended
     */
    public TradingSession onTick(Instant now) {
        TradingSession session = SessionClock.sessionAt(now);
        TradingSession previous = current.getAndSet(session);
        if (previous == null) {
            pruneStale(session);
            return null;
        }
        if (previous == session) {
            return null;
        }
        int removed = cooldownStore.pruneCategory(previous.label());
        log.info("[COOLDOWN] Session rollover {} -> {}, pruned {} keys",
            previous.label(), session.label(), removed);
        return previous;
    }

    private void pruneStale(TradingSession session) {
        int removed = 0;
        for (TradingSession other : TradingSession.values()) {
            if (other != session) {
                removed += cooldownStore.pruneCategory(other.label());
            }
        }
        if (removed > 0) {
            log.info("[COOLDOWN] Startup in {} session, pruned {} stale session keys", session.label(), removed);
        }
    }
}
