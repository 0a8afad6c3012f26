package jp.tradelog.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Trade log migration - creates the execution and round-trip tables on startup.
 *
 * Creates two tables:
 * - executions: raw fills, imported or entered by hand
 * - round_trip_trades: derived trades, rebuilt in full after every execution change
 */
public final class TradeLogMigration {
    private static final Logger log = LoggerFactory.getLogger(TradeLogMigration.class);

    private final DataSource dataSource;

    public TradeLogMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates tables and indexes if they don't exist.
     */
    public void migrate() {
        log.info("[MIGRATION] Starting trade log schema migration");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "executions")) {
                log.info("[MIGRATION] Creating executions table...");
                createExecutionsTable(conn);
                log.info("[MIGRATION] ✓ executions table created");
            } else {
                log.info("[MIGRATION] executions table already exists");
            }

            if (!tableExists(conn, "round_trip_trades")) {
                log.info("[MIGRATION] Creating round_trip_trades table...");
                createRoundTripTradesTable(conn);
                log.info("[MIGRATION] ✓ round_trip_trades table created");
            } else {
                log.info("[MIGRATION] round_trip_trades table already exists");
            }

            log.info("[MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Trade log migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createExecutionsTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE executions (
                id BIGSERIAL PRIMARY KEY,
                symbol VARCHAR(32) NOT NULL,
                name VARCHAR(256) NOT NULL,
                country VARCHAR(4) NOT NULL,
                trade_date DATE NOT NULL,
                side VARCHAR(4) NOT NULL,
                price NUMERIC(20,6) NOT NULL CHECK (price > 0),
                quantity NUMERIC(20,6) NOT NULL CHECK (quantity > 0),
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_executions_instrument ON executions (symbol, country)");
            stmt.execute("CREATE INDEX idx_executions_trade_date ON executions (trade_date)");
        }
    }

    private void createRoundTripTradesTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE round_trip_trades (
                id BIGSERIAL PRIMARY KEY,
                symbol VARCHAR(32) NOT NULL,
                name VARCHAR(256) NOT NULL,
                country VARCHAR(4) NOT NULL,

                -- Entry
                entry_date DATE NOT NULL,
                avg_entry_price NUMERIC(30,12) NOT NULL,
                total_quantity NUMERIC(20,6) NOT NULL,
                total_entry_cost NUMERIC(30,12) NOT NULL,

                -- Exit
                exit_date DATE NOT NULL,
                avg_exit_price NUMERIC(20,6) NOT NULL,
                total_exit_revenue NUMERIC(30,12) NOT NULL,

                -- Result
                profit_loss NUMERIC(30,12) NOT NULL,
                profit_loss_percent NUMERIC(30,12) NOT NULL,
                holding_days INT NOT NULL,

                entry_execution_ids TEXT NOT NULL DEFAULT '',
                exit_execution_ids TEXT NOT NULL DEFAULT '',
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_round_trip_trades_exit_date ON round_trip_trades (exit_date)");
            stmt.execute("CREATE INDEX idx_round_trip_trades_instrument ON round_trip_trades (symbol, country)");
        }
    }
}
