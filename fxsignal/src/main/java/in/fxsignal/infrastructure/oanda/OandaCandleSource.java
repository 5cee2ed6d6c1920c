package in.fxsignal.infrastructure.oanda;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxsignal.application.port.output.CandleSource;
import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.exceptions.CandleFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * OANDA v20 REST candle adapter (mid prices).
 *
 * GET {api}/instruments/{pair}/candles?granularity=H1&count=100&price=M
 * Authorization: Bearer {token}
 *
 * Throws {@link CandleFetchException} on I/O errors, non-200 responses and
 * unparseable bodies; wrap in a RetryingCandleSource for the pipeline.
 */
public final class OandaCandleSource implements CandleSource {
    private static final Logger log = LoggerFactory.getLogger(OandaCandleSource.class);

    public static final String DEFAULT_API = "https://api-fxtrade.oanda.com/v3";

    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final String apiBase;
    private final String token;
    private final ObjectMapper objectMapper;

    public OandaCandleSource(String apiBase, String token, ObjectMapper objectMapper) {
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.token = token;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Candle> get(CurrencyPair pair, Granularity granularity, int count) {
        String url = apiBase + "/instruments/" + pair.symbol() + "/candles"
            + "?granularity=" + granularity.getApiCode()
            + "&count=" + count
            + "&price=M";

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Authorization", "Bearer " + token)
            .header("Accept", "application/json")
            .timeout(Duration.ofSeconds(15))
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CandleFetchException(pair.symbol(), granularity, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CandleFetchException(pair.symbol(), granularity, "interrupted", e);
        }

        if (response.statusCode() != 200) {
            log.error("[CANDLES] OANDA {} {} HTTP {}: {}", pair, granularity, response.statusCode(), response.body());
            throw new CandleFetchException(pair.symbol(), granularity, "HTTP " + response.statusCode());
        }

        List<Candle> candles = parseCandles(response.body(), pair, granularity);
        log.debug("[CANDLES] {} {} fetched {}/{}", pair, granularity, candles.size(), count);
        return candles;
    }

    /**
     * Parse a candles response body. Entries without mid prices are skipped.
     */
    List<Candle> parseCandles(String body, CurrencyPair pair, Granularity granularity) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new CandleFetchException(pair.symbol(), granularity, "unparseable body", e);
        }

        List<Candle> result = new ArrayList<>();
        JsonNode candles = root.path("candles");
        for (JsonNode node : candles) {
            JsonNode mid = node.path("mid");
            if (mid.isMissingNode() || !node.hasNonNull("time")) {
                continue;
            }
            try {
                result.add(new Candle(
                    Instant.parse(node.get("time").asText()),
                    new BigDecimal(mid.path("o").asText()),
                    new BigDecimal(mid.path("h").asText()),
                    new BigDecimal(mid.path("l").asText()),
                    new BigDecimal(mid.path("c").asText())
                ));
            } catch (RuntimeException e) {
                log.warn("[CANDLES] Skipping malformed {} {} candle {}: {}", pair, granularity, node, e.getMessage());
            }
        }
        return result;
    }
}
