package in.fxsignal.service.breakout;

import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.BreakoutStrategyType;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the breakout gate: a strategy applied on a timeframe.
 */
public record BreakoutRule(BreakoutStrategyType strategy, Granularity timeframe) {

    /**
     * Parse "STRATEGY:TIMEFRAME", e.g. "PRIOR_DAY:H1".
     */
    public static BreakoutRule parse(String value) {
        String[] parts = value.trim().split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Breakout rule must be STRATEGY:TIMEFRAME, got " + value);
        }
        return new BreakoutRule(
            BreakoutStrategyType.valueOf(parts[0].trim().toUpperCase()),
            Granularity.parse(parts[1])
        );
    }

    public static List<BreakoutRule> parseAll(List<String> values) {
        List<BreakoutRule> rules = new ArrayList<>();
        for (String v : values) {
            rules.add(parse(v));
        }
        return List.copyOf(rules);
    }

    @Override
    public String toString() {
        return strategy + ":" + timeframe;
    }
}
