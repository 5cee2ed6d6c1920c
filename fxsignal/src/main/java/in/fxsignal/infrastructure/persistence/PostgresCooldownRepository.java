package in.fxsignal.infrastructure.persistence;

import in.fxsignal.application.port.output.CooldownRepository;
import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.exceptions.CooldownPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * PostgreSQL implementation of CooldownRepository (table signal_cooldowns).
 */
public final class PostgresCooldownRepository implements CooldownRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresCooldownRepository.class);

    private static final String UPSERT_SQL = """
        INSERT INTO signal_cooldowns (subject, category, fired_at)
        VALUES (?, ?, ?)
        ON CONFLICT (subject, category)
        DO UPDATE SET fired_at = EXCLUDED.fired_at
        """;

    private final DataSource dataSource;

    public PostgresCooldownRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Map<CooldownKey, Instant> loadAll() {
        String sql = """
            SELECT subject, category, fired_at
            FROM signal_cooldowns
            """;

        Map<CooldownKey, Instant> result = new HashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                CooldownKey key = new CooldownKey(rs.getString("subject"), rs.getString("category"));
                result.put(key, rs.getTimestamp("fired_at").toInstant());
            }

        } catch (SQLException e) {
            log.error("Failed to load cooldowns: {}", e.getMessage());
            throw new CooldownPersistenceException("Failed to load cooldowns", e);
        }
        return result;
    }

    @Override
    public void upsert(CooldownKey key, Instant firedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {

            ps.setString(1, key.subject());
            ps.setString(2, key.category());
            ps.setTimestamp(3, Timestamp.from(firedAt));
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to upsert cooldown {}: {}", key.asString(), e.getMessage());
            throw new CooldownPersistenceException("Failed to upsert cooldown " + key.asString(), e);
        }
    }

    @Override
    public void deleteCategory(String category) {
        String sql = "DELETE FROM signal_cooldowns WHERE category = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, category);
            int deleted = ps.executeUpdate();
            log.debug("Deleted {} cooldowns of category {}", deleted, category);

        } catch (SQLException e) {
            log.error("Failed to delete cooldown category {}: {}", category, e.getMessage());
            throw new CooldownPersistenceException("Failed to delete cooldown category " + category, e);
        }
    }

    @Override
    public void deleteOlderThan(Instant cutoff) {
        String sql = "DELETE FROM signal_cooldowns WHERE fired_at < ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to delete old cooldowns: {}", e.getMessage());
            throw new CooldownPersistenceException("Failed to delete old cooldowns", e);
        }
    }

    @Override
    public void saveAll(Map<CooldownKey, Instant> snapshot) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (Statement clear = conn.createStatement();
                 PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {

                clear.executeUpdate("DELETE FROM signal_cooldowns");
                for (Map.Entry<CooldownKey, Instant> e : snapshot.entrySet()) {
                    ps.setString(1, e.getKey().subject());
                    ps.setString(2, e.getKey().category());
                    ps.setTimestamp(3, Timestamp.from(e.getValue()));
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
                log.debug("Saved {} cooldowns", snapshot.size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to save cooldown snapshot: {}", e.getMessage());
            throw new CooldownPersistenceException("Failed to save cooldown snapshot", e);
        }
    }
}
