package in.fxsignal.service.trade;

import in.fxsignal.application.port.output.ActiveTradeRepository;
import in.fxsignal.domain.model.TradeSignal;

import java.util.ArrayList;
import java.util.List;

/**
 * List-backed repository for service tests.
 */
public class InMemoryActiveTradeRepository implements ActiveTradeRepository {

    private final List<TradeSignal> stored = new ArrayList<>();

    @Override
    public synchronized List<TradeSignal> loadAll() {
        return new ArrayList<>(stored);
    }

    @Override
    public synchronized void saveAll(List<TradeSignal> trades) {
        stored.clear();
        stored.addAll(trades);
    }

    public synchronized List<TradeSignal> stored() {
        return new ArrayList<>(stored);
    }
}
