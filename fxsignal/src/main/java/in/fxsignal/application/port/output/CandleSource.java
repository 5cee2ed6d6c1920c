package in.fxsignal.application.port.output;

import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.CurrencyPair;

import java.util.List;

/**
 * Market data source for OHLC candles.
 *
 * Returned candles are ordered oldest to newest. Implementations may return
 * fewer candles than requested, or none when the market is closed.
 */
public interface CandleSource {

    /**
     * Fetch up to {@code count} most recent candles.
     *
     * @throws in.fxsignal.exceptions.CandleFetchException on transient I/O failure
     *         (adapters only; the retrying decorator never throws)
     */
    List<Candle> get(CurrencyPair pair, Granularity granularity, int count);
}
