package in.fxsignal.service.strength;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Acceptance rule of the direction and strength gate.
 *
 * Ranks are oriented to the signal direction before the check: for a BUY the
 * strong side is the base, for a SELL it is the quote.
 */
public interface StrengthPolicy {

    /**
     * @param strongRank rank of the currency being bought
     * @param weakRank   rank of the currency being sold
     */
    boolean accepts(int strongRank, int weakRank);

    String describe();

    /**
     * Parse a policy expression:
     * <ul>
     *   <li>{@code MIN_RANK:5} both ranks at least 5 in magnitude, opposite signs</li>
     *   <li>{@code MIN_DIFF:10} strong - weak at least 10</li>
     *   <li>{@code ACCEPTED_DIFFS:10,12,14} strong - weak in the set</li>
     *   <li>{@code PAIRED:7/-7,7/-5} exact (strong, weak) combinations</li>
     * </ul>
     */
    static StrengthPolicy parse(String expression) {
        if (expression == null || !expression.contains(":")) {
            throw new IllegalArgumentException("Strength policy must be NAME:ARGS, got " + expression);
        }
        int idx = expression.indexOf(':');
        String name = expression.substring(0, idx).trim().toUpperCase();
        String args = expression.substring(idx + 1).trim();
        try {
            return switch (name) {
                case "MIN_RANK" -> new MinimumRankPolicy(Integer.parseInt(args));
                case "MIN_DIFF" -> new MinimumDifferentialPolicy(Integer.parseInt(args));
                case "ACCEPTED_DIFFS" -> new AcceptedDifferentialPolicy(parseInts(args));
                case "PAIRED" -> new PairedExtremesPolicy(parsePairs(args));
                default -> throw new IllegalArgumentException("Unknown strength policy: " + name);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed strength policy arguments: " + expression, e);
        }
    }

    private static Set<Integer> parseInts(String args) {
        Set<Integer> values = new LinkedHashSet<>();
        for (String part : args.split(",")) {
            if (!part.isBlank()) {
                values.add(Integer.parseInt(part.trim()));
            }
        }
        return values;
    }

    private static List<PairedExtremesPolicy.RankPair> parsePairs(String args) {
        List<PairedExtremesPolicy.RankPair> pairs = new ArrayList<>();
        for (String part : args.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            String[] sides = part.trim().split("/");
            if (sides.length != 2) {
                throw new IllegalArgumentException("Paired rank must be STRONG/WEAK, got " + part);
            }
            pairs.add(new PairedExtremesPolicy.RankPair(
                Integer.parseInt(sides[0].trim()), Integer.parseInt(sides[1].trim())));
        }
        return pairs;
    }
}
