package jp.tradelog.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Trade Log Migration Tests")
class TradeLogMigrationTest {

    @Mock
    private DataSource dataSource;
    @Mock
    private Connection connection;
    @Mock
    private DatabaseMetaData metaData;
    @Mock
    private ResultSet executionsLookup;
    @Mock
    private ResultSet tradesLookup;
    @Mock
    private Statement statement;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getTables(isNull(), isNull(), eq("executions"), any())).thenReturn(executionsLookup);
        lenient().when(metaData.getTables(isNull(), isNull(), eq("round_trip_trades"), any())).thenReturn(tradesLookup);
    }

    @Test
    @DisplayName("Missing tables are created with their indexes")
    void migrate_createsMissingTables() throws SQLException {
        when(executionsLookup.next()).thenReturn(false);
        when(tradesLookup.next()).thenReturn(false);
        when(connection.createStatement()).thenReturn(statement);

        new TradeLogMigration(dataSource).migrate();

        verify(statement).execute(startsWith("CREATE TABLE executions"));
        verify(statement).execute(startsWith("CREATE TABLE round_trip_trades"));
        verify(statement, times(6)).execute(anyString());
    }

    @Test
    @DisplayName("Existing tables are left alone")
    void migrate_skipsExistingTables() throws SQLException {
        when(executionsLookup.next()).thenReturn(true);
        when(tradesLookup.next()).thenReturn(true);

        new TradeLogMigration(dataSource).migrate();

        verify(connection, never()).createStatement();
    }

    @Test
    @DisplayName("SQL failure aborts startup")
    void migrate_failureThrows() throws SQLException {
        when(executionsLookup.next()).thenReturn(false);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute(anyString())).thenThrow(new SQLException("permission denied"));

        RuntimeException e = assertThrows(RuntimeException.class, () -> new TradeLogMigration(dataSource).migrate());
        assertInstanceOf(SQLException.class, e.getCause());
    }
}
