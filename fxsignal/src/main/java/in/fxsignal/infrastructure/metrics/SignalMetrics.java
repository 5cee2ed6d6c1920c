package in.fxsignal.infrastructure.metrics;

import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.TradeSignal;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus metrics for the signal pipeline.
 *
 * Key Metrics:
 * - fx_signals_emitted_total{pair, direction} - Trade signals emitted
 * - fx_gate_rejections_total{gate} - Pairs rejected per pipeline gate
 * - fx_candle_fetch_failures_total{granularity} - Fetches that exhausted retries
 * - fx_cooldown_persist_failures_total - Cooldown writes that failed
 * - fx_notifications_total{status} - Notification deliveries (sent/failed)
 * - fx_evaluation_duration_seconds - Full pass duration
 * - fx_active_trades - Open trade signals
 */
public class SignalMetrics {

    private final CollectorRegistry registry;

    private final Counter signalsEmitted;
    private final Counter gateRejections;
    private final Counter candleFetchFailures;
    private final Counter cooldownPersistFailures;
    private final Counter notifications;
    private final Histogram evaluationDuration;
    private final Gauge activeTrades;

    public SignalMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public SignalMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.signalsEmitted = Counter.build()
            .name("fx_signals_emitted_total")
            .help("Total number of trade signals emitted")
            .labelNames("pair", "direction")
            .register(registry);

        this.gateRejections = Counter.build()
            .name("fx_gate_rejections_total")
            .help("Total number of pair evaluations rejected by a pipeline gate")
            .labelNames("gate")
            .register(registry);

        this.candleFetchFailures = Counter.build()
            .name("fx_candle_fetch_failures_total")
            .help("Candle fetches that failed after all retries")
            .labelNames("granularity")
            .register(registry);

        this.cooldownPersistFailures = Counter.build()
            .name("fx_cooldown_persist_failures_total")
            .help("Cooldown state writes that failed")
            .register(registry);

        this.notifications = Counter.build()
            .name("fx_notifications_total")
            .help("Notification delivery attempts")
            .labelNames("status")
            .register(registry);

        this.evaluationDuration = Histogram.build()
            .name("fx_evaluation_duration_seconds")
            .help("Duration of one evaluation pass in seconds")
            .buckets(0.5, 1.0, 2.5, 5.0, 10.0, 30.0, 60.0, 120.0)
            .register(registry);

        this.activeTrades = Gauge.build()
            .name("fx_active_trades")
            .help("Number of open trade signals")
            .register(registry);
    }

    public void recordSignal(TradeSignal signal) {
        signalsEmitted.labels(signal.pair().symbol(), signal.direction().name()).inc();
    }

    public void recordGateRejection(String gate) {
        gateRejections.labels(gate).inc();
    }

    public void recordCandleFetchFailure(Granularity granularity) {
        candleFetchFailures.labels(granularity.name()).inc();
    }

    public void recordCooldownPersistFailure() {
        cooldownPersistFailures.inc();
    }

    public void recordNotification(boolean delivered) {
        notifications.labels(delivered ? "sent" : "failed").inc();
    }

    public void recordEvaluation(Duration elapsed) {
        evaluationDuration.observe(elapsed.toMillis() / 1000.0);
    }

    public void setActiveTrades(int count) {
        activeTrades.set(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
