package in.fxsignal.service.candle;

import in.fxsignal.application.port.output.CandleSource;
import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.exceptions.CandleFetchException;
import in.fxsignal.infrastructure.metrics.SignalMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * CandleSource decorator that retries transient failures with bounded backoff.
 *
 * Never throws: once the policy is exhausted the fetch degrades to an empty
 * list, which the pipeline treats as "no data for this pair this tick".
 */
public final class RetryingCandleSource implements CandleSource {
    private static final Logger log = LoggerFactory.getLogger(RetryingCandleSource.class);

    private final CandleSource delegate;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final SignalMetrics metrics;

    public RetryingCandleSource(CandleSource delegate, RetryPolicy policy, SignalMetrics metrics) {
        this(delegate, policy, metrics, d -> Thread.sleep(d.toMillis()));
    }

    public RetryingCandleSource(CandleSource delegate, RetryPolicy policy, SignalMetrics metrics, Sleeper sleeper) {
        this.delegate = delegate;
        this.policy = policy;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    @Override
    public List<Candle> get(CurrencyPair pair, Granularity granularity, int count) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                List<Candle> candles = delegate.get(pair, granularity, count);
                return candles == null ? List.of() : candles;
            } catch (CandleFetchException e) {
                if (!policy.shouldRetry(attempt)) {
                    log.warn("[CANDLES] {} {} failed after {} attempts: {}",
                        pair, granularity, attempt, e.getMessage());
                    metrics.recordCandleFetchFailure(granularity);
                    return List.of();
                }
                Duration delay = policy.delayAfter(attempt);
                log.debug("[CANDLES] {} {} attempt {} failed, retrying in {}ms: {}",
                    pair, granularity, attempt, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[CANDLES] {} {} retry interrupted", pair, granularity);
                    metrics.recordCandleFetchFailure(granularity);
                    return List.of();
                }
            }
        }
    }

    /**
     * Backoff wait. Replaced in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
