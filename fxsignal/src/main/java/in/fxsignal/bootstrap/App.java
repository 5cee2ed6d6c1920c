package in.fxsignal.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.fxsignal.application.port.output.CandleSource;
import in.fxsignal.application.port.output.CooldownRepository;
import in.fxsignal.application.port.output.NotificationSink;
import in.fxsignal.config.PairUniverse;
import in.fxsignal.config.SignalConfig;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.infrastructure.calendar.ForexFactoryCalendarSource;
import in.fxsignal.infrastructure.metrics.PrometheusMetricsHandler;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import in.fxsignal.infrastructure.notification.LoggingNotificationSink;
import in.fxsignal.infrastructure.oanda.OandaCandleSource;
import in.fxsignal.infrastructure.persistence.JsonFileActiveTradeRepository;
import in.fxsignal.infrastructure.persistence.JsonFileCooldownRepository;
import in.fxsignal.infrastructure.persistence.PostgresCooldownRepository;
import in.fxsignal.migration.CooldownTableMigration;
import in.fxsignal.service.HeartbeatService;
import in.fxsignal.service.breakout.BreakoutAlertService;
import in.fxsignal.service.breakout.BreakoutDetector;
import in.fxsignal.service.breakout.EmaTrendFilter;
import in.fxsignal.service.candle.RetryPolicy;
import in.fxsignal.service.candle.RetryingCandleSource;
import in.fxsignal.service.candle.SessionClock;
import in.fxsignal.service.cooldown.CooldownStore;
import in.fxsignal.service.cooldown.SessionRolloverPruner;
import in.fxsignal.service.news.NewsAlertService;
import in.fxsignal.service.signal.PullbackTracker;
import in.fxsignal.service.signal.SignalBuilder;
import in.fxsignal.service.signal.SignalEvaluator;
import in.fxsignal.service.strength.StrengthAlertService;
import in.fxsignal.service.strength.StrengthEngine;
import in.fxsignal.service.strength.StrengthPolicy;
import in.fxsignal.service.trade.ActiveTrades;
import in.fxsignal.transport.http.ApiHandlers;
import in.fxsignal.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the strength/breakout pipeline:
 * - OANDA candle adapter behind a retrying decorator
 * - durable cooldown store (JSON file or PostgreSQL)
 * - active trade index persisted to the state directory
 * - scheduled evaluation, group breakout alert, news warnings and heartbeat
 * - read-only HTTP API and Prometheus /metrics
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== FX Signal Service Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        SignalConfig config = SignalConfig.fromEnv();
        PairUniverse universe = PairUniverse.of(config.pairs());
        StartupConfigValidator.validate(config, universe);

        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        SignalMetrics metrics = new SignalMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Candle source
        // ═══════════════════════════════════════════════════════════════
        String apiBase = Env.get("OANDA_API", OandaCandleSource.DEFAULT_API);
        String token = Env.get("OANDA_TOKEN", "");
        if (token.isBlank()) {
            log.warn("[CONFIG] OANDA_TOKEN is not set; candle requests will be rejected upstream");
        }
        RetryPolicy retryPolicy = RetryPolicy.forCandleSource(
            config.candleRetryAttempts(), config.candleRetryInitialDelay());
        CandleSource candleSource = new RetryingCandleSource(
            new OandaCandleSource(apiBase, token, mapper), retryPolicy, metrics);
        log.info("✓ Candle source: {} ({})", apiBase, retryPolicy);

        // ═══════════════════════════════════════════════════════════════
        // State: cooldowns + active trades
        // ═══════════════════════════════════════════════════════════════
        Path stateDir = Path.of(config.stateDir());
        CooldownRepository cooldownRepository = createCooldownRepository(config, stateDir, mapper);
        CooldownStore cooldownStore = new CooldownStore(cooldownRepository, metrics);
        cooldownStore.load();

        ActiveTrades activeTrades = new ActiveTrades(
            new JsonFileActiveTradeRepository(stateDir.resolve("active_trades.json"), mapper));
        activeTrades.load();
        metrics.setActiveTrades(activeTrades.size());
        log.info("✓ State loaded: {} cooldown keys, {} active trades", cooldownStore.size(), activeTrades.size());

        // ═══════════════════════════════════════════════════════════════
        // Pipeline
        // ═══════════════════════════════════════════════════════════════
        NotificationSink sink = new LoggingNotificationSink();
        StrengthEngine strengthEngine = new StrengthEngine(candleSource, config.strengthGranularity(),
            config.strengthCandleCount(), config.strengthWeights());
        BreakoutDetector breakoutDetector = BreakoutDetector.standard(config,
            new EmaTrendFilter(candleSource, Granularity.D1, config.trendEmaPeriod()));
        StrengthPolicy strengthPolicy = StrengthPolicy.parse(config.strengthPolicy());

        SignalBuilder signalBuilder = new SignalBuilder(config, candleSource, breakoutDetector, strengthPolicy,
            cooldownStore, activeTrades, sink, new PullbackTracker(config.pullbackArmLevel()), metrics, clock);
        StrengthAlertService strengthAlerts = new StrengthAlertService(sink, cooldownStore,
            config.strengthAlertCooldown(), metrics);
        SignalEvaluator evaluator = new SignalEvaluator(universe, strengthEngine, strengthAlerts, signalBuilder,
            cooldownStore, new SessionRolloverPruner(cooldownStore), activeTrades, metrics,
            config.topCandidates(), clock);

        BreakoutAlertService breakoutAlerts = new BreakoutAlertService(candleSource, breakoutDetector,
            config.breakoutRules().get(0), config.decisionCandleCount(), sink, cooldownStore,
            config.breakoutAlertMinPairs(), config.signalCooldown(), config.breakoutAlertCooldown(), metrics);
        HeartbeatService heartbeat = new HeartbeatService(sink, cooldownStore, config.heartbeatCooldown(), metrics);
        log.info("✓ Pipeline wired: policy={}, rules={}, entry={}",
            strengthPolicy.describe(), config.breakoutRules(), config.entryTiming());

        NewsAlertService newsAlerts = null;
        if (config.newsAlertsEnabled()) {
            newsAlerts = new NewsAlertService(new ForexFactoryCalendarSource(config.newsCalendarUrl(), mapper),
                activeTrades, sink, cooldownStore, metrics);
            log.info("✓ News alerts: {} (every {}s)", config.newsCalendarUrl(), config.newsCheckInterval().getSeconds());
        } else {
            log.info("News alerts disabled");
        }

        heartbeat.sendInitial(clock.instant());

        // ═══════════════════════════════════════════════════════════════
        // Schedulers
        // ═══════════════════════════════════════════════════════════════
        startEvaluationScheduler(evaluator, config.loopInterval(), clock);
        startBreakoutAlertScheduler(breakoutAlerts, universe, clock);
        startHeartbeatScheduler(heartbeat, clock);
        if (newsAlerts != null) {
            startNewsAlertScheduler(newsAlerts, config.newsCheckInterval(), clock);
        }
        startFlushScheduler(cooldownStore, activeTrades,
            maxOf(config.longestCooldown(), NewsAlertService.ALERT_WINDOW), clock);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[SHUTDOWN] Flushing state...");
            cooldownStore.flush();
            activeTrades.flush();
            log.info("[SHUTDOWN] ✓ State flushed");
        }, "state-flush-hook"));

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        int port = config.port();
        ApiHandlers api = new ApiHandlers(activeTrades, cooldownStore, evaluator::latestRanks, clock);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/active-trades", api::activeTrades)
            .get("/api/strength", api::strength)
            .get("/api/cooldowns", api::cooldowns)
            .setFallbackHandler(exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "FX Signal Service\n\n" +
                    "API:     GET /api/health, /api/active-trades, /api/strength, /api/cooldowns\n" +
                    "Metrics: GET /metrics\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP API server started on http://localhost:{}/", port);
    }

    private static CooldownRepository createCooldownRepository(SignalConfig config, Path stateDir,
                                                               ObjectMapper mapper) {
        if ("POSTGRES".equals(config.cooldownStore())) {
            DataSource dataSource = createDataSource();
            new CooldownTableMigration(dataSource).migrate();
            log.info("✓ Cooldown store: PostgreSQL");
            return new PostgresCooldownRepository(dataSource);
        }
        Path file = stateDir.resolve("cooldowns.json");
        log.info("✓ Cooldown store: {}", file);
        return new JsonFileCooldownRepository(file, mapper);
    }

    private static DataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/fxsignal");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 4);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("fxsignal-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    /**
     * Strength/signal pass every loop interval while the FX market is open.
     */
    private static void startEvaluationScheduler(SignalEvaluator evaluator, Duration interval, Clock clock) {
        log.info("[SCHEDULER] Starting signal evaluation (every {}s)", interval.getSeconds());

        ScheduledExecutorService scheduler = daemonScheduler("signal-evaluator");
        scheduler.scheduleAtFixedRate(() -> {
            try {
                Instant now = clock.instant();
                if (!SessionClock.isMarketOpen(now)) {
                    log.debug("[SCHEDULER] Market closed at {}, skipping pass", SessionClock.formatNewYork(now));
                    return;
                }
                evaluator.runPass();
            } catch (Exception e) {
                log.error("[SCHEDULER] Error in signal evaluation: {}", e.getMessage(), e);
            }
        }, 0, interval.getSeconds(), TimeUnit.SECONDS);

        log.info("[SCHEDULER] ✓ Signal evaluation scheduler started");
    }

    private static void startBreakoutAlertScheduler(BreakoutAlertService breakoutAlerts, PairUniverse universe,
                                                    Clock clock) {
        log.info("[SCHEDULER] Starting group breakout alert (every 1 minute)");

        ScheduledExecutorService scheduler = daemonScheduler("breakout-alert");
        scheduler.scheduleAtFixedRate(() -> {
            try {
                Instant now = clock.instant();
                if (SessionClock.isMarketOpen(now)) {
                    breakoutAlerts.run(universe.pairs(), now);
                }
            } catch (Exception e) {
                log.error("[SCHEDULER] Error in group breakout alert: {}", e.getMessage(), e);
            }
        }, 1, 1, TimeUnit.MINUTES);

        log.info("[SCHEDULER] ✓ Group breakout alert scheduler started");
    }

    private static void startHeartbeatScheduler(HeartbeatService heartbeat, Clock clock) {
        ScheduledExecutorService scheduler = daemonScheduler("heartbeat");
        scheduler.scheduleAtFixedRate(() -> {
            try {
                heartbeat.beat(clock.instant());
            } catch (Exception e) {
                log.error("[SCHEDULER] Error in heartbeat: {}", e.getMessage(), e);
            }
        }, 1, 1, TimeUnit.MINUTES);

        log.info("[SCHEDULER] ✓ Heartbeat scheduler started");
    }

    /**
     * Warnings for upcoming news on currencies of open trades.
     */
    private static void startNewsAlertScheduler(NewsAlertService newsAlerts, Duration interval, Clock clock) {
        ScheduledExecutorService scheduler = daemonScheduler("news-alert");
        scheduler.scheduleAtFixedRate(() -> {
            try {
                newsAlerts.run(clock.instant());
            } catch (Exception e) {
                log.error("[SCHEDULER] Error in news alert: {}", e.getMessage(), e);
            }
        }, interval.getSeconds(), interval.getSeconds(), TimeUnit.SECONDS);

        log.info("[SCHEDULER] ✓ News alert scheduler started");
    }

    /**
     * Periodic flush so that an abnormal exit loses at most one interval of state.
     * Keys older than every cooldown window are dropped first.
     */
    private static void startFlushScheduler(CooldownStore cooldownStore, ActiveTrades activeTrades,
                                            Duration retention, Clock clock) {
        ScheduledExecutorService scheduler = daemonScheduler("state-flush");
        scheduler.scheduleAtFixedRate(() -> {
            try {
                cooldownStore.pruneOlderThan(clock.instant().minus(retention));
                cooldownStore.flushIfDirty();
                activeTrades.flush();
            } catch (Exception e) {
                log.error("[SCHEDULER] Error flushing state: {}", e.getMessage(), e);
            }
        }, 5, 5, TimeUnit.MINUTES);

        log.info("[SCHEDULER] ✓ State flush scheduler started");
    }

    private static Duration maxOf(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static ScheduledExecutorService daemonScheduler(String name) {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    private App() {}
}
