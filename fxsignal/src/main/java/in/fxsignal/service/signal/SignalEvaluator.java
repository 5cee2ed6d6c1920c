package in.fxsignal.service.signal;

import in.fxsignal.config.PairUniverse;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.RankMap;
import in.fxsignal.domain.model.TradeSignal;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import in.fxsignal.service.cooldown.CooldownStore;
import in.fxsignal.service.cooldown.SessionRolloverPruner;
import in.fxsignal.service.strength.StrengthAlertService;
import in.fxsignal.service.strength.StrengthEngine;
import in.fxsignal.service.trade.ActiveTrades;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One scheduling tick of the pipeline.
 *
 * Ranks all currencies, publishes the strength report, then runs the
 * SignalBuilder over candidate pairs ordered by |base rank - quote rank|
 * descending. A failure on one pair is logged and the pass continues.
 */
public final class SignalEvaluator {
    private static final Logger log = LoggerFactory.getLogger(SignalEvaluator.class);

    private final PairUniverse universe;
    private final StrengthEngine strengthEngine;
    private final StrengthAlertService strengthAlerts;
    private final SignalBuilder signalBuilder;
    private final CooldownStore cooldownStore;
    private final SessionRolloverPruner sessionPruner;
    private final ActiveTrades activeTrades;
    private final SignalMetrics metrics;
    private final int topCandidates;
    private final Clock clock;

    private final AtomicReference<RankMap> latestRanks = new AtomicReference<>(RankMap.empty());

    public SignalEvaluator(PairUniverse universe,
                           StrengthEngine strengthEngine,
                           StrengthAlertService strengthAlerts,
                           SignalBuilder signalBuilder,
                           CooldownStore cooldownStore,
                           SessionRolloverPruner sessionPruner,
                           ActiveTrades activeTrades,
                           SignalMetrics metrics,
                           int topCandidates,
                           Clock clock) {
        this.universe = universe;
        this.strengthEngine = strengthEngine;
        this.strengthAlerts = strengthAlerts;
        this.signalBuilder = signalBuilder;
        this.cooldownStore = cooldownStore;
        this.sessionPruner = sessionPruner;
        this.activeTrades = activeTrades;
        this.metrics = metrics;
        this.topCandidates = topCandidates;
        this.clock = clock;
    }

    public EvaluationReport runPass() {
        Instant started = clock.instant();
        sessionPruner.onTick(started);

        RankMap ranks = strengthEngine.computeRanks(universe.pairs());
        latestRanks.set(ranks);

        List<CurrencyPair> candidates = List.of();
        List<TradeSignal> signals = new ArrayList<>();
        int failures = 0;

        if (!ranks.isEmpty()) {
            strengthAlerts.publish(ranks, started);

            candidates = candidates(ranks);
            for (CurrencyPair pair : candidates) {
                try {
                    Optional<TradeSignal> signal = signalBuilder.build(pair, ranks);
                    signal.ifPresent(signals::add);
                } catch (RuntimeException e) {
                    failures++;
                    log.error("[SIGNAL] Evaluation failed for {}: {}", pair, e.getMessage(), e);
                }
            }
        }

        if (!signals.isEmpty()) {
            activeTrades.flush();
        }
        cooldownStore.flushIfDirty();

        Duration elapsed = Duration.between(started, clock.instant());
        metrics.recordEvaluation(elapsed);
        metrics.setActiveTrades(activeTrades.size());
        log.info("[SIGNAL] Pass done: {} candidates, {} signals, {} failures in {}ms",
            candidates.size(), signals.size(), failures, elapsed.toMillis());
        return new EvaluationReport(ranks, candidates, signals, failures, elapsed);
    }

    /**
     * Ranked pairs by |differential| descending; ties keep configured order.
     */
    List<CurrencyPair> candidates(RankMap ranks) {
        List<CurrencyPair> ranked = new ArrayList<>();
        for (CurrencyPair pair : universe.pairs()) {
            if (ranks.isRanked(pair)) {
                ranked.add(pair);
            }
        }
        ranked.sort(Comparator.comparingInt((CurrencyPair p) -> Math.abs(ranks.differential(p))).reversed());
        if (topCandidates > 0 && ranked.size() > topCandidates) {
            return List.copyOf(ranked.subList(0, topCandidates));
        }
        return ranked;
    }

    /**
     * Rank map of the most recent pass.
     */
    public RankMap latestRanks() {
        return latestRanks.get();
    }
}
