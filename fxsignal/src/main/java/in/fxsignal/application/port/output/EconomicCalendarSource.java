package in.fxsignal.application.port.output;

import in.fxsignal.domain.model.EconomicEvent;

import java.util.List;

/**
 * Economic calendar feed.
 */
public interface EconomicCalendarSource {

    /**
     * Events of the current calendar week, in feed order.
     *
     * @throws in.fxsignal.exceptions.CalendarFetchException when the feed cannot be read
     */
    List<EconomicEvent> events();
}
