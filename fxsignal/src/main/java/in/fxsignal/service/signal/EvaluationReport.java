package in.fxsignal.service.signal;

import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.RankMap;
import in.fxsignal.domain.model.TradeSignal;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one evaluation pass.
 *
 * @param ranks      rank map computed for the pass (empty = no opinion)
 * @param candidates pairs evaluated, in evaluation order
 * @param signals    signals emitted
 * @param failures   pairs whose evaluation threw
 * @param elapsed    wall time of the pass
 */
public record EvaluationReport(
    RankMap ranks,
    List<CurrencyPair> candidates,
    List<TradeSignal> signals,
    int failures,
    Duration elapsed
) {
    public EvaluationReport {
        candidates = List.copyOf(candidates);
        signals = List.copyOf(signals);
    }
}
