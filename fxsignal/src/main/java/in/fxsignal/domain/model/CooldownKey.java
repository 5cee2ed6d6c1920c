package in.fxsignal.domain.model;

/**
 * Dedup identity: subject (usually a pair symbol) plus a signal category.
 */
public record CooldownKey(String subject, String category) {

    private static final char SEPARATOR = '|';

    public CooldownKey {
        if (subject == null || subject.isBlank() || category == null || category.isBlank()) {
            throw new IllegalArgumentException("Cooldown subject and category are required");
        }
        if (subject.indexOf(SEPARATOR) >= 0 || category.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Cooldown key parts cannot contain '" + SEPARATOR + "'");
        }
    }

    public static CooldownKey of(CurrencyPair pair, String category) {
        return new CooldownKey(pair.symbol(), category);
    }

    /**
     * Storage form, "subject|category".
     */
    public String asString() {
        return subject + SEPARATOR + category;
    }

    public static CooldownKey parse(String value) {
        int idx = value == null ? -1 : value.indexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("Malformed cooldown key: " + value);
        }
        return new CooldownKey(value.substring(0, idx), value.substring(idx + 1));
    }
}
