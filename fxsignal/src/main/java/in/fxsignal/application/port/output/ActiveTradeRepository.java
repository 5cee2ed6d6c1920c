package in.fxsignal.application.port.output;

import in.fxsignal.domain.model.TradeSignal;

import java.util.List;

/**
 * Durable snapshot of open trade signals.
 *
 * Both methods throw {@link in.fxsignal.exceptions.ActiveTradePersistenceException}
 * when the store cannot be read or written.
 */
public interface ActiveTradeRepository {

    List<TradeSignal> loadAll();

    void saveAll(List<TradeSignal> trades);
}
