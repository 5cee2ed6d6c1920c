package in.fxsignal.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the signal_cooldowns table on startup when the Postgres cooldown store is selected.
 */
public final class CooldownTableMigration {
    private static final Logger log = LoggerFactory.getLogger(CooldownTableMigration.class);

    static final String TABLE = "signal_cooldowns";

    private final DataSource dataSource;

    public CooldownTableMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Create the table and its category index if missing.
     */
    public void migrate() {
        log.info("[COOLDOWN MIGRATION] Starting");

        try (Connection conn = dataSource.getConnection()) {
            if (tableExists(conn, TABLE)) {
                log.info("[COOLDOWN MIGRATION] {} table already exists", TABLE);
                return;
            }

            log.info("[COOLDOWN MIGRATION] Creating {} table...", TABLE);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("""
                    CREATE TABLE signal_cooldowns (
                        subject   VARCHAR(64)  NOT NULL,
                        category  VARCHAR(64)  NOT NULL,
                        fired_at  TIMESTAMPTZ  NOT NULL,
                        PRIMARY KEY (subject, category)
                    )
                    """);
                stmt.execute("CREATE INDEX idx_signal_cooldowns_category ON signal_cooldowns (category)");
            }
            log.info("[COOLDOWN MIGRATION] {} table created", TABLE);

        } catch (SQLException e) {
            log.error("[COOLDOWN MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Cooldown table migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
