package in.fxsignal.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.domain.model.Currency;
import in.fxsignal.domain.model.RankMap;
import in.fxsignal.domain.model.TradeSignal;
import in.fxsignal.service.cooldown.CooldownStore;
import in.fxsignal.service.trade.ActiveTrades;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Read-only JSON API over the pipeline state.
 *
 * GET /api/health         - status and counters
 * GET /api/active-trades  - open trade signals
 * GET /api/strength       - rank map of the latest pass
 * GET /api/cooldowns      - cooldown keys with last-fired time
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String JSON = "application/json; charset=utf-8";

    private final ActiveTrades activeTrades;
    private final CooldownStore cooldownStore;
    private final Supplier<RankMap> latestRanks;
    private final Clock clock;

    public ApiHandlers(ActiveTrades activeTrades, CooldownStore cooldownStore,
                       Supplier<RankMap> latestRanks, Clock clock) {
        this.activeTrades = activeTrades;
        this.cooldownStore = cooldownStore;
        this.latestRanks = latestRanks;
        this.clock = clock;
    }

    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", clock.instant().toString());
        health.put("activeTrades", activeTrades.size());
        health.put("cooldownKeys", cooldownStore.size());
        health.put("cooldownDirty", cooldownStore.isDirty());
        health.put("rankedCurrencies", latestRanks.get().size());
        send(exchange, 200, health);
    }

    public void activeTrades(HttpServerExchange exchange) {
        ArrayNode trades = MAPPER.createArrayNode();
        for (TradeSignal s : activeTrades.snapshot()) {
            ObjectNode n = trades.addObject();
            n.put("id", s.id());
            n.put("pair", s.pair().symbol());
            n.put("direction", s.direction().name());
            n.put("entry", s.entry());
            n.put("stopLoss", s.stopLoss());
            ArrayNode tps = n.putArray("takeProfits");
            for (BigDecimal tp : s.takeProfits()) {
                tps.add(tp);
            }
            n.put("baseRank", s.baseRank());
            n.put("quoteRank", s.quoteRank());
            n.put("strengthDifferential", s.strengthDifferential());
            n.put("breakout", s.breakoutTag());
            n.put("category", s.category());
            n.put("createdAt", s.createdAt().toString());
        }
        send(exchange, 200, trades);
    }

    public void strength(HttpServerExchange exchange) {
        RankMap ranks = latestRanks.get();
        ObjectNode body = MAPPER.createObjectNode();
        ArrayNode list = body.putArray("ranks");
        for (Map.Entry<Currency, Integer> e : ranks.sortedDescending()) {
            ObjectNode n = list.addObject();
            n.put("currency", e.getKey().name());
            n.put("rank", e.getValue());
        }
        body.put("empty", ranks.isEmpty());
        send(exchange, 200, body);
    }

    public void cooldowns(HttpServerExchange exchange) {
        ArrayNode list = MAPPER.createArrayNode();
        for (Map.Entry<CooldownKey, Instant> e : cooldownStore.snapshot().entrySet()) {
            ObjectNode n = list.addObject();
            n.put("subject", e.getKey().subject());
            n.put("category", e.getKey().category());
            n.put("lastFired", e.getValue().toString());
        }
        send(exchange, 200, list);
    }

    private void send(HttpServerExchange exchange, int status, Object body) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
        try {
            exchange.setStatusCode(status);
            exchange.getResponseSender().send(MAPPER.writeValueAsString(body));
        } catch (Exception e) {
            log.error("[HTTP] Failed to write response: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("{\"error\":\"internal error\"}");
        }
    }
}
