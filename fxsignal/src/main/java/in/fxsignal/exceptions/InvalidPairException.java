package in.fxsignal.exceptions;

/**
 * Pair identifier that is malformed or references an untracked currency.
 */
public class InvalidPairException extends IllegalArgumentException {

    private final String identifier;

    public InvalidPairException(String identifier, String reason) {
        super("Invalid pair '" + identifier + "': " + reason);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
