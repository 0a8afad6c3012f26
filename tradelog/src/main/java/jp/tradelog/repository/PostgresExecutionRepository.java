package jp.tradelog.repository;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.trade.ExecutionRecord;
import jp.tradelog.domain.trade.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of ExecutionRepository.
 */
public final class PostgresExecutionRepository implements ExecutionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresExecutionRepository.class);

    private static final String COLUMNS =
        "id, symbol, name, country, trade_date, side, price, quantity, created_at";

    private final DataSource dataSource;

    public PostgresExecutionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public ExecutionRecord insert(ExecutionRecord record) {
        String sql = """
            INSERT INTO executions (symbol, name, country, trade_date, side, price, quantity)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            RETURNING id, symbol, name, country, trade_date, side, price, quantity, created_at
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            bind(ps, record);

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Insert returned no row");
                }
                return mapRow(rs);
            }

        } catch (SQLException e) {
            log.error("Failed to insert execution: {}", e.getMessage());
            throw new RuntimeException("Failed to insert execution", e);
        }
    }

    @Override
    public int insertBatch(List<ExecutionRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        String sql = """
            INSERT INTO executions (symbol, name, country, trade_date, side, price, quantity)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (ExecutionRecord record : records) {
                    bind(ps, record);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

            log.debug("Inserted {} executions", records.size());
            return records.size();

        } catch (SQLException e) {
            log.error("Failed to insert execution batch: {}", e.getMessage());
            throw new RuntimeException("Failed to insert execution batch", e);
        }
    }

    @Override
    public Optional<ExecutionRecord> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM executions WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find execution {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to find execution", e);
        }

        return Optional.empty();
    }

    @Override
    public List<ExecutionRecord> findAllOrderByDate() {
        String sql = "SELECT " + COLUMNS + " FROM executions ORDER BY trade_date ASC, id ASC";

        List<ExecutionRecord> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                result.add(mapRow(rs));
            }

        } catch (SQLException e) {
            log.error("Failed to find executions: {}", e.getMessage());
            throw new RuntimeException("Failed to find executions", e);
        }

        return result;
    }

    @Override
    public boolean deleteById(long id) {
        String sql = "DELETE FROM executions WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, id);
            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("Failed to delete execution {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to delete execution", e);
        }
    }

    @Override
    public int deleteAll() {
        String sql = "DELETE FROM executions";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int deleted = ps.executeUpdate();
            log.info("Deleted all {} executions", deleted);
            return deleted;

        } catch (SQLException e) {
            log.error("Failed to delete executions: {}", e.getMessage());
            throw new RuntimeException("Failed to delete executions", e);
        }
    }

    private void bind(PreparedStatement ps, ExecutionRecord record) throws SQLException {
        ps.setString(1, record.symbol());
        ps.setString(2, record.name());
        ps.setString(3, record.country().name());
        ps.setDate(4, Date.valueOf(record.date()));
        ps.setString(5, record.side().name());
        ps.setBigDecimal(6, record.price());
        ps.setBigDecimal(7, record.quantity());
    }

    private ExecutionRecord mapRow(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        return new ExecutionRecord(
            rs.getLong("id"),
            rs.getString("symbol"),
            rs.getString("name"),
            Country.valueOf(rs.getString("country")),
            rs.getDate("trade_date").toLocalDate(),
            Side.valueOf(rs.getString("side")),
            rs.getBigDecimal("price"),
            rs.getBigDecimal("quantity"),
            createdAt != null ? createdAt.toInstant() : null
        );
    }
}
