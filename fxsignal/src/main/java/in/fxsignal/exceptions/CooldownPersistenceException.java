package in.fxsignal.exceptions;

/**
 * Durable cooldown state could not be read or written.
 */
public class CooldownPersistenceException extends RuntimeException {

    public CooldownPersistenceException(String message) {
        super(message);
    }

    public CooldownPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
