package in.fxsignal.domain.model;

import java.time.Instant;

/**
 * One economic calendar entry. The currency is kept as the raw feed symbol
 * because calendars also list untracked currencies.
 */
public record EconomicEvent(
    Instant time,
    String currency,
    ImpactLevel impact,
    String title,
    String actual
) {
}
