package in.fxsignal.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fxsignal.application.port.output.ActiveTradeRepository;
import in.fxsignal.domain.model.TradeSignal;
import in.fxsignal.exceptions.ActiveTradePersistenceException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Active trade snapshot as a JSON array of TradeSignal.
 */
public final class JsonFileActiveTradeRepository implements ActiveTradeRepository {

    private static final TypeReference<List<TradeSignal>> LIST_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileActiveTradeRepository(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized List<TradeSignal> loadAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return mapper.readValue(file.toFile(), LIST_TYPE);
        } catch (IOException e) {
            throw new ActiveTradePersistenceException("Failed to read active trades " + file, e);
        }
    }

    @Override
    public synchronized void saveAll(List<TradeSignal> trades) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), trades);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ActiveTradePersistenceException("Failed to write active trades " + file, e);
        }
    }
}
