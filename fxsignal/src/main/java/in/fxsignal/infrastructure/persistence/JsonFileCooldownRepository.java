package in.fxsignal.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.fxsignal.application.port.output.CooldownRepository;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.exceptions.CooldownPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Cooldown state in a JSON file.
 *
 * Format:
 * <pre>
 * {"cooldowns": {"EUR_USD|strength_alert": 1718000000, ...}}
 * </pre>
 * Values are epoch seconds. Writes go to a temp file that is atomically moved
 * over the target, so a crash mid-write leaves the previous state intact.
 */
public final class JsonFileCooldownRepository implements CooldownRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileCooldownRepository.class);

    private static final String ROOT_FIELD = "cooldowns";

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileCooldownRepository(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized Map<CooldownKey, Instant> loadAll() {
        return read();
    }

    @Override
    public synchronized void upsert(CooldownKey key, Instant firedAt) {
        Map<CooldownKey, Instant> state = read();
        state.put(key, firedAt);
        write(state);
    }

    @Override
    public synchronized void deleteCategory(String category) {
        Map<CooldownKey, Instant> state = read();
        if (state.keySet().removeIf(k -> k.category().equals(category))) {
            write(state);
        }
    }

    @Override
    public synchronized void deleteOlderThan(Instant cutoff) {
        Map<CooldownKey, Instant> state = read();
        if (state.values().removeIf(t -> t.isBefore(cutoff))) {
            write(state);
        }
    }

    @Override
    public synchronized void saveAll(Map<CooldownKey, Instant> snapshot) {
        write(new HashMap<>(snapshot));
    }

    private Map<CooldownKey, Instant> read() {
        Map<CooldownKey, Instant> state = new HashMap<>();
        if (!Files.exists(file)) {
            return state;
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            JsonNode entries = root == null ? null : root.get(ROOT_FIELD);
            if (entries == null || !entries.isObject()) {
                return state;
            }
            Iterator<Map.Entry<String, JsonNode>> it = entries.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                try {
                    state.put(CooldownKey.parse(e.getKey()), Instant.ofEpochSecond(e.getValue().asLong()));
                } catch (IllegalArgumentException bad) {
                    log.warn("[COOLDOWN] Ignoring malformed key '{}' in {}", e.getKey(), file);
                }
            }
            return state;
        } catch (IOException e) {
            throw new CooldownPersistenceException("Failed to read cooldown file " + file, e);
        }
    }

    private void write(Map<CooldownKey, Instant> state) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode entries = root.putObject(ROOT_FIELD);
        state.entrySet().stream()
            .sorted(Map.Entry.comparingByKey((a, b) -> a.asString().compareTo(b.asString())))
            .forEach(e -> entries.put(e.getKey().asString(), e.getValue().getEpochSecond()));

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new CooldownPersistenceException("Failed to write cooldown file " + file, e);
        }
    }
}
