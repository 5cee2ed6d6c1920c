package in.fxsignal.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.domain.model.Currency;
import in.fxsignal.domain.model.RankMap;
import in.fxsignal.domain.model.TradeSignalFixtures;
import in.fxsignal.infrastructure.metrics.PrometheusMetricsHandler;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import in.fxsignal.service.cooldown.CooldownStore;
import in.fxsignal.service.cooldown.InMemoryCooldownRepository;
import in.fxsignal.service.trade.ActiveTrades;
import in.fxsignal.service.trade.InMemoryActiveTradeRepository;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the JSON API and /metrics endpoint.
 *
 * Tests:
 * - Health counters
 * - Active trades listing
 * - Strength ranks before and after a pass
 * - Cooldown listing
 * - Prometheus text format with signal metrics
 */
public class ApiEndpointTest {

    private static final int TEST_PORT = 19181;
    private static final Instant NOW = Instant.parse("2024-03-05T14:05:00Z");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Undertow server;
    private HttpClient httpClient;
    private SignalMetrics metrics;
    private ActiveTrades activeTrades;
    private CooldownStore cooldownStore;
    private final AtomicReference<RankMap> ranks = new AtomicReference<>(RankMap.empty());

    @BeforeEach
    public void setUp() {
        metrics = new SignalMetrics(new CollectorRegistry());
        activeTrades = new ActiveTrades(new InMemoryActiveTradeRepository());
        cooldownStore = new CooldownStore(new InMemoryCooldownRepository(), metrics);
        ApiHandlers api = new ApiHandlers(activeTrades, cooldownStore, ranks::get, Clock.fixed(NOW, ZoneOffset.UTC));

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
                .get("/api/health", api::health)
                .get("/api/active-trades", api::activeTrades)
                .get("/api/strength", api::strength)
                .get("/api/cooldowns", api::cooldowns))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testHealth() throws Exception {
        activeTrades.add(TradeSignalFixtures.buyEurUsd("sig-1", NOW));
        cooldownStore.record(new CooldownKey("EUR_USD", "strength_alert"), NOW);

        HttpResponse<String> response = get("/api/health");
        JsonNode body = MAPPER.readTree(response.body());

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        assertEquals("ok", body.get("status").asText());
        assertEquals("2024-03-05T14:05:00Z", body.get("ts").asText());
        assertEquals(1, body.get("activeTrades").asInt());
        assertEquals(1, body.get("cooldownKeys").asInt());
        assertFalse(body.get("cooldownDirty").asBoolean(), "Write-through succeeded");
        assertEquals(0, body.get("rankedCurrencies").asInt());
    }

    @Test
    public void testActiveTrades() throws Exception {
        activeTrades.add(TradeSignalFixtures.buyEurUsd("sig-1", NOW));

        JsonNode body = MAPPER.readTree(get("/api/active-trades").body());

        assertEquals(1, body.size());
        JsonNode trade = body.get(0);
        assertEquals("sig-1", trade.get("id").asText());
        assertEquals("EUR_USD", trade.get("pair").asText());
        assertEquals("BUY", trade.get("direction").asText());
        assertEquals(3, trade.get("takeProfits").size());
        assertEquals(14, trade.get("strengthDifferential").asInt());
        assertEquals("PRIOR_DAY@H1", trade.get("breakout").asText());
    }

    @Test
    public void testStrengthReflectsLatestPass() throws Exception {
        JsonNode before = MAPPER.readTree(get("/api/strength").body());
        assertTrue(before.get("empty").asBoolean(), "No pass yet");

        ranks.set(RankMap.of(Map.of(Currency.USD, 7, Currency.JPY, -7)));
        JsonNode after = MAPPER.readTree(get("/api/strength").body());

        assertFalse(after.get("empty").asBoolean());
        assertEquals("USD", after.get("ranks").get(0).get("currency").asText(), "Strongest first");
        assertEquals(-7, after.get("ranks").get(1).get("rank").asInt());
    }

    @Test
    public void testCooldowns() throws Exception {
        cooldownStore.record(new CooldownKey("GBP_JPY", "London"), NOW);

        JsonNode body = MAPPER.readTree(get("/api/cooldowns").body());

        assertEquals(1, body.size());
        assertEquals("GBP_JPY", body.get(0).get("subject").asText());
        assertEquals("London", body.get(0).get("category").asText());
        assertEquals("2024-03-05T14:05:00Z", body.get(0).get("lastFired").asText());
    }

    @Test
    public void testMetricsExport() throws Exception {
        metrics.recordSignal(TradeSignalFixtures.sellUsdJpy("sig-2", NOW));
        metrics.recordGateRejection("RETEST");
        metrics.recordNotification(false);

        HttpResponse<String> response = get("/metrics");
        String body = response.body();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"),
            "Content-Type should be text/plain for Prometheus format");
        assertTrue(body.contains("fx_signals_emitted_total{pair=\"USD_JPY\",direction=\"SELL\",} 1.0"),
            "Should show the emitted signal");
        assertTrue(body.contains("fx_gate_rejections_total{gate=\"RETEST\",} 1.0"),
            "Should show the gate rejection");
        assertTrue(body.contains("fx_notifications_total{status=\"failed\",} 1.0"),
            "Should show the failed delivery");
        assertTrue(body.contains("# TYPE fx_evaluation_duration_seconds histogram"));
    }
}
