package in.fxsignal.exceptions;

/**
 * The economic calendar feed could not be fetched or parsed.
 */
public class CalendarFetchException extends RuntimeException {

    public CalendarFetchException(String message) {
        super(message);
    }

    public CalendarFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
