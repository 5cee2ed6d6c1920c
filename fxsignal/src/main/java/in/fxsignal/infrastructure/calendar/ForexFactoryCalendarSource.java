package in.fxsignal.infrastructure.calendar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxsignal.application.port.output.EconomicCalendarSource;
import in.fxsignal.domain.model.EconomicEvent;
import in.fxsignal.domain.model.ImpactLevel;
import in.fxsignal.exceptions.CalendarFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Forex Factory weekly calendar export (JSON).
 *
 * GET {url} returns an array of
 * {"title":"CPI m/m","country":"USD","date":"2024-03-05T08:30:00-05:00","impact":"High",...}.
 * "country" carries the currency code. Entries without a parseable date are skipped.
 */
public final class ForexFactoryCalendarSource implements EconomicCalendarSource {
    private static final Logger log = LoggerFactory.getLogger(ForexFactoryCalendarSource.class);

    private final HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final String url;
    private final ObjectMapper objectMapper;

    public ForexFactoryCalendarSource(String url, ObjectMapper objectMapper) {
        this.url = url;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<EconomicEvent> events() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept", "application/json")
            .timeout(Duration.ofSeconds(15))
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CalendarFetchException("Calendar fetch failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalendarFetchException("Calendar fetch interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new CalendarFetchException("Calendar fetch failed: HTTP " + response.statusCode());
        }

        List<EconomicEvent> events = parseEvents(response.body());
        log.debug("[NEWS] Calendar fetched, {} events", events.size());
        return events;
    }

    List<EconomicEvent> parseEvents(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new CalendarFetchException("Unparseable calendar body", e);
        }
        if (!root.isArray()) {
            throw new CalendarFetchException("Calendar body is not an array");
        }

        List<EconomicEvent> result = new ArrayList<>();
        for (JsonNode node : root) {
            try {
                result.add(new EconomicEvent(
                    OffsetDateTime.parse(node.path("date").asText()).toInstant(),
                    node.path("country").asText(null),
                    ImpactLevel.parse(node.path("impact").asText(null)),
                    node.path("title").asText(""),
                    node.hasNonNull("actual") ? node.get("actual").asText() : null
                ));
            } catch (RuntimeException e) {
                log.warn("[NEWS] Skipping malformed calendar entry {}: {}", node, e.getMessage());
            }
        }
        return result;
    }
}
