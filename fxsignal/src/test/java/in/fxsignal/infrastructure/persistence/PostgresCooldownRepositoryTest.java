package in.fxsignal.infrastructure.persistence;

import in.fxsignal.domain.model.CooldownKey;
import in.fxsignal.exceptions.CooldownPersistenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PostgresCooldownRepository against mocked JDBC.
 *
 * Tests:
 * - Row mapping on load
 * - Upsert parameter binding
 * - SQLException translated to CooldownPersistenceException
 * - Snapshot save rolls back on failure
 */
@ExtendWith(MockitoExtension.class)
class PostgresCooldownRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-05T10:00:00Z");

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet resultSet;

    private PostgresCooldownRepository repository;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        repository = new PostgresCooldownRepository(dataSource);
    }

    @Test
    void testLoadAllMapsRows() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString("subject")).thenReturn("EUR_USD");
        when(resultSet.getString("category")).thenReturn("London");
        when(resultSet.getTimestamp("fired_at")).thenReturn(Timestamp.from(T0));

        Map<CooldownKey, Instant> loaded = repository.loadAll();

        assertEquals(Map.of(new CooldownKey("EUR_USD", "London"), T0), loaded);
        verify(connection).close();
    }

    @Test
    void testUpsertBindsParameters() throws SQLException {
        when(connection.prepareStatement(anyString())).thenReturn(statement);

        repository.upsert(new CooldownKey("GBP_JPY", "strength_alert"), T0);

        verify(statement).setString(1, "GBP_JPY");
        verify(statement).setString(2, "strength_alert");
        verify(statement).setTimestamp(3, Timestamp.from(T0));
        verify(statement).executeUpdate();
    }

    @Test
    void testSqlFailureTranslated() throws SQLException {
        when(connection.prepareStatement(anyString())).thenThrow(new SQLException("connection reset"));

        CooldownPersistenceException e = assertThrows(CooldownPersistenceException.class,
            () -> repository.deleteCategory("London"));
        assertTrue(e.getCause() instanceof SQLException);
    }

    @Test
    void testSaveAllRollsBackOnFailure() throws SQLException {
        Statement clear = mock(Statement.class);
        when(connection.createStatement()).thenReturn(clear);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeBatch()).thenThrow(new SQLException("constraint"));

        assertThrows(CooldownPersistenceException.class,
            () -> repository.saveAll(Map.of(new CooldownKey("EUR_USD", "London"), T0)));

        verify(clear).executeUpdate("DELETE FROM signal_cooldowns");
        verify(connection).rollback();
        verify(connection, never()).commit();
    }
}
