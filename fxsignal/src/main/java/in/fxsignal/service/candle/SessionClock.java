package in.fxsignal.service.candle;

import in.fxsignal.domain.model.TradingSession;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Session Clock - FX session and trading-day boundaries.
 *
 * All boundaries are in New York local time:
 * - Sessions: Asian 00:00-08:00, London 08:00-16:00, NewYork 16:00-24:00
 * - Trading day rolls at 17:00; a bar at 17:00 Monday belongs to Tuesday's trading date
 * - Weekly close Friday 17:00, reopen Sunday 17:00
 */
public final class SessionClock {
    public static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private static final LocalTime DAY_ROLL = LocalTime.of(17, 0);
    private static final Duration ROLL_OFFSET = Duration.ofHours(24 - DAY_ROLL.getHour());

    /**
     * Trading session for an instant.
     */
    public static TradingSession sessionAt(Instant instant) {
        return TradingSession.forHour(instant.atZone(NEW_YORK).getHour());
    }

    /**
     * FX trading date of an instant.
     */
    public static LocalDate tradingDate(Instant instant) {
        return instant.atZone(NEW_YORK).plus(ROLL_OFFSET).toLocalDate();
    }

    /**
     * Start of the given trading date (17:00 New York on the previous calendar day).
     */
    public static Instant tradingDayStart(LocalDate tradingDate) {
        return ZonedDateTime.of(tradingDate.minusDays(1), DAY_ROLL, NEW_YORK).toInstant();
    }

    /**
     * False between Friday 17:00 and Sunday 17:00 New York.
     */
    public static boolean isMarketOpen(Instant instant) {
        ZonedDateTime ny = instant.atZone(NEW_YORK);
        DayOfWeek day = ny.getDayOfWeek();
        LocalTime time = ny.toLocalTime();
        return switch (day) {
            case SATURDAY -> false;
            case FRIDAY -> time.isBefore(DAY_ROLL);
            case SUNDAY -> !time.isBefore(DAY_ROLL);
            default -> true;
        };
    }

    /**
     * Format timestamp as New York time string for logging and messages.
     */
    public static String formatNewYork(Instant timestamp) {
        return timestamp.atZone(NEW_YORK).toLocalDateTime().withNano(0).toString() + " NY";
    }

    private SessionClock() {}
}
