package in.fxsignal.service;

import in.fxsignal.application.port.output.NotificationSink;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import in.fxsignal.service.cooldown.CooldownStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Liveness message to the notification channel, once per cooldown window.
 */
public final class HeartbeatService {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatService.class);

    public static final CooldownKey HEARTBEAT_KEY = new CooldownKey("bot", "heartbeat");
    static final String MESSAGE = "Bot Heartbeat: FX signal service is running";

    private final NotificationSink sink;
    private final CooldownStore cooldownStore;
    private final Duration cooldown;
    private final SignalMetrics metrics;

    public HeartbeatService(NotificationSink sink, CooldownStore cooldownStore, Duration cooldown,
                            SignalMetrics metrics) {
        this.sink = sink;
        this.cooldownStore = cooldownStore;
        this.cooldown = cooldown;
        this.metrics = metrics;
    }

    /**
     * Startup heartbeat, sent regardless of the last one.
     */
    public boolean sendInitial(Instant now) {
        return send(now, "initial");
    }

    /**
     * Send if the last delivered heartbeat is older than the cooldown.
     *
     * @return true if a heartbeat was delivered
     */
    public boolean beat(Instant now) {
        if (!cooldownStore.isAllowed(HEARTBEAT_KEY, now, cooldown)) {
            return false;
        }
        return send(now, "daily");
    }

    private boolean send(Instant now, String kind) {
        boolean delivered = sink.send(MESSAGE);
        metrics.recordNotification(delivered);
        if (delivered) {
            cooldownStore.record(HEARTBEAT_KEY, now);
            log.info("[HEARTBEAT] Sent {} heartbeat", kind);
        } else {
            log.warn("[HEARTBEAT] {} heartbeat delivery failed", kind);
        }
        return delivered;
    }
}
