package in.fxsignal.service.strength;

import in.fxsignal.application.port.output.CandleSource;
import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.Currency;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.RankMap;
import in.fxsignal.domain.model.StrengthScore;
import in.fxsignal.service.indicator.IndicatorLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Strength Engine - per-currency relative strength rank in [-7, +7].
 *
 * Algorithm:
 * 1. For each pair, fetch a fixed window of candles (default 20 × H4)
 * 2. Composite score = w_price × %change(last bar)
 *                    + w_rsi   × ((RSI14 - 50) / 50) × 100
 *                    + w_ema   × EMA10 slope × 100
 *                    + w_atr   × ATR14
 * 3. +score to the base currency, -score to the quote currency
 * 4. Average contributions per currency, sort descending
 * 5. rank = round(7 - idx × 14 / (n - 1)); a computed 0 becomes +1 in the
 *    upper half of the ranking and -1 in the lower half
 *
 * Pairs with no candles are skipped for this tick. Fewer than 2 scored
 * currencies gives an empty RankMap.
 */
public final class StrengthEngine {
    private static final Logger log = LoggerFactory.getLogger(StrengthEngine.class);

    private final CandleSource candleSource;
    private final Granularity granularity;
    private final int candleCount;
    private final StrengthWeights weights;

    public StrengthEngine(CandleSource candleSource, Granularity granularity, int candleCount, StrengthWeights weights) {
        this.candleSource = candleSource;
        this.granularity = granularity;
        this.candleCount = candleCount;
        this.weights = weights;
    }

    public RankMap computeRanks(List<CurrencyPair> pairs) {
        List<StrengthScore> scores = computeScores(pairs);
        RankMap ranks = rank(scores);
        if (ranks.isEmpty()) {
            log.warn("[STRENGTH] Only {} currencies scored, no ranking this tick", scores.size());
        } else {
            log.info("[STRENGTH] Ranks: {}", ranks.sortedDescending());
        }
        return ranks;
    }

    /**
     * Averaged composite scores, strongest first.
     */
    public List<StrengthScore> computeScores(List<CurrencyPair> pairs) {
        Map<Currency, List<Double>> contributions = new EnumMap<>(Currency.class);

        for (CurrencyPair pair : pairs) {
            List<Candle> candles = candleSource.get(pair, granularity, candleCount);
            if (candles == null || candles.isEmpty()) {
                log.warn("[STRENGTH] No candles returned for {}", pair);
                continue;
            }

            double score = compositeScore(candles, weights);
            contributions.computeIfAbsent(pair.base(), c -> new ArrayList<>()).add(score);
            contributions.computeIfAbsent(pair.quote(), c -> new ArrayList<>()).add(-score);
        }

        List<StrengthScore> scores = new ArrayList<>();
        contributions.forEach((currency, values) -> {
            double avg = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            scores.add(new StrengthScore(currency, avg, values.size()));
        });
        scores.sort(Comparator.comparingDouble(StrengthScore::score).reversed()
            .thenComparing(StrengthScore::currency));
        return scores;
    }

    /**
     * Weighted composite score of one pair's candle window.
     */
    static double compositeScore(List<Candle> candles, StrengthWeights weights) {
        List<BigDecimal> closes = IndicatorLibrary.closes(candles);

        double priceChange = 0.0;
        if (closes.size() >= 2) {
            double last = closes.get(closes.size() - 1).doubleValue();
            double prev = closes.get(closes.size() - 2).doubleValue();
            if (prev != 0.0) {
                priceChange = (last - prev) / prev * 100.0;
            }
        }

        double rsi = IndicatorLibrary.latestRsi(closes, IndicatorLibrary.DEFAULT_RSI_PERIOD)
            .orElse(IndicatorLibrary.RSI_NEUTRAL);
        double normRsi = (rsi - IndicatorLibrary.RSI_NEUTRAL) / IndicatorLibrary.RSI_NEUTRAL;
        double emaSlope = IndicatorLibrary.emaSlope(closes, IndicatorLibrary.DEFAULT_SLOPE_PERIOD).doubleValue();
        double atr = IndicatorLibrary.atr(candles, IndicatorLibrary.DEFAULT_ATR_PERIOD).doubleValue();

        return weights.priceChange() * priceChange
            + weights.rsi() * normRsi * 100.0
            + weights.emaSlope() * emaSlope * 100.0
            + weights.atr() * atr;
    }

    /**
     * Map scores (any order) onto [-7, +7] by descending position.
     */
    public static RankMap rank(List<StrengthScore> scores) {
        if (scores == null || scores.size() < 2) {
            return RankMap.empty();
        }

        List<StrengthScore> sorted = new ArrayList<>(scores);
        sorted.sort(Comparator.comparingDouble(StrengthScore::score).reversed()
            .thenComparing(StrengthScore::currency));

        int n = sorted.size();
        double span = RankMap.MAX_RANK - RankMap.MIN_RANK;
        Map<Currency, Integer> ranks = new EnumMap<>(Currency.class);
        for (int idx = 0; idx < n; idx++) {
            int rank = (int) Math.rint(RankMap.MAX_RANK - idx * span / (n - 1));
            if (rank == 0) {
                // midpoint is not a rank: push to the side of the ranking it fell in
                rank = idx < n / 2.0 ? 1 : -1;
            }
            ranks.put(sorted.get(idx).currency(), rank);
        }
        return RankMap.of(ranks);
    }
}
