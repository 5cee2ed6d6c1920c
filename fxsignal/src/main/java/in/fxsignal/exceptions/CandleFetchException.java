package in.fxsignal.exceptions;

import in.fxsignal.domain.data.Granularity;

/**
 * Transient failure while fetching candles from a market-data source
 * (network error, non-200 response, unparseable body).
 */
public class CandleFetchException extends RuntimeException {

    private final String pair;
    private final Granularity granularity;

    public CandleFetchException(String pair, Granularity granularity, String message) {
        super("Candle fetch failed for " + pair + " " + granularity + ": " + message);
        this.pair = pair;
        this.granularity = granularity;
    }

    public CandleFetchException(String pair, Granularity granularity, String message, Throwable cause) {
        super("Candle fetch failed for " + pair + " " + granularity + ": " + message, cause);
        this.pair = pair;
        this.granularity = granularity;
    }

    public String getPair() {
        return pair;
    }

    public Granularity getGranularity() {
        return granularity;
    }
}
