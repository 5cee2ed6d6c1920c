package in.fxsignal.exceptions;

/**
 * The active trade snapshot could not be read or written.
 */
public class ActiveTradePersistenceException extends RuntimeException {

    public ActiveTradePersistenceException(String message) {
        super(message);
    }

    public ActiveTradePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
