package in.fxsignal.service.breakout;

import in.fxsignal.application.port.output.CandleSource;
import in.fxsignal.domain.data.Candle;
import in.fxsignal.domain.data.Granularity;
import in.fxsignal.domain.model.CurrencyPair;
import in.fxsignal.domain.model.Direction;
import in.fxsignal.service.indicator.IndicatorLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;

/**
 * Daily EMA trend filter: BUY only above the EMA, SELL only below it.
 * Insufficient daily history rejects the breakout.
 */
public final class EmaTrendFilter implements TrendFilter {
    private static final Logger log = LoggerFactory.getLogger(EmaTrendFilter.class);

    private final CandleSource candleSource;
    private final Granularity granularity;
    private final int period;

    public EmaTrendFilter(CandleSource candleSource, Granularity granularity, int period) {
        this.candleSource = candleSource;
        this.granularity = granularity;
        this.period = period;
    }

    @Override
    public boolean allows(CurrencyPair pair, Direction direction) {
        List<Candle> candles = candleSource.get(pair, granularity, period + 1);
        List<BigDecimal> closes = IndicatorLibrary.closes(candles);
        BigDecimal ema = IndicatorLibrary.latestEma(closes, period);
        if (ema == null) {
            log.debug("[BREAKOUT] {} trend filter: {} {} candles, need {}", pair, closes.size(), granularity, period);
            return false;
        }
        BigDecimal lastClose = closes.get(closes.size() - 1);
        int cmp = lastClose.compareTo(ema);
        return direction == Direction.BUY ? cmp > 0 : cmp < 0;
    }
}
