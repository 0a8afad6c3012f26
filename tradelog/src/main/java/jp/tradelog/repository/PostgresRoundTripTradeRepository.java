package jp.tradelog.repository;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.trade.RoundTripTrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * PostgreSQL implementation of RoundTripTradeRepository.
 *
 * Contributing execution ids are stored as comma-separated text; they are
 * back-references only and never joined on.
 */
public final class PostgresRoundTripTradeRepository implements RoundTripTradeRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresRoundTripTradeRepository.class);

    private static final String SELECT = """
        SELECT id, symbol, name, country, entry_date, avg_entry_price, total_quantity, total_entry_cost,
               exit_date, avg_exit_price, total_exit_revenue, profit_loss, profit_loss_percent,
               holding_days, entry_execution_ids, exit_execution_ids
        FROM round_trip_trades
        """;

    private final DataSource dataSource;

    public PostgresRoundTripTradeRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void replaceAll(List<RoundTripTrade> trades) {
        String insertSql = """
            INSERT INTO round_trip_trades (symbol, name, country, entry_date, avg_entry_price, total_quantity,
                total_entry_cost, exit_date, avg_exit_price, total_exit_revenue, profit_loss,
                profit_loss_percent, holding_days, entry_execution_ids, exit_execution_ids)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);

            try (Statement clear = conn.createStatement();
                 PreparedStatement ps = conn.prepareStatement(insertSql)) {

                clear.executeUpdate("DELETE FROM round_trip_trades");

                for (RoundTripTrade trade : trades) {
                    ps.setString(1, trade.symbol());
                    ps.setString(2, trade.name());
                    ps.setString(3, trade.country().name());
                    ps.setDate(4, Date.valueOf(trade.entryDate()));
                    ps.setBigDecimal(5, trade.avgEntryPrice());
                    ps.setBigDecimal(6, trade.totalQuantity());
                    ps.setBigDecimal(7, trade.totalEntryCost());
                    ps.setDate(8, Date.valueOf(trade.exitDate()));
                    ps.setBigDecimal(9, trade.avgExitPrice());
                    ps.setBigDecimal(10, trade.totalExitRevenue());
                    ps.setBigDecimal(11, trade.profitLoss());
                    ps.setBigDecimal(12, trade.profitLossPercent());
                    ps.setLong(13, trade.holdingDays());
                    ps.setString(14, joinIds(trade.entryExecutionIds()));
                    ps.setString(15, joinIds(trade.exitExecutionIds()));
                    ps.addBatch();
                }

                if (!trades.isEmpty()) {
                    ps.executeBatch();
                }
                conn.commit();

            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

            log.debug("Replaced round-trip trades: {}", trades.size());

        } catch (SQLException e) {
            log.error("Failed to replace round-trip trades: {}", e.getMessage());
            throw new RuntimeException("Failed to replace round-trip trades", e);
        }
    }

    @Override
    public List<RoundTripTrade> findAll() {
        return findByExitDateBetween(null, null);
    }

    @Override
    public List<RoundTripTrade> findByExitDateBetween(LocalDate from, LocalDate to) {
        StringBuilder sql = new StringBuilder(SELECT);
        List<LocalDate> params = new ArrayList<>();
        if (from != null) {
            sql.append(params.isEmpty() ? " WHERE" : " AND").append(" exit_date >= ?");
            params.add(from);
        }
        if (to != null) {
            sql.append(params.isEmpty() ? " WHERE" : " AND").append(" exit_date <= ?");
            params.add(to);
        }
        sql.append(" ORDER BY exit_date ASC, id ASC");

        List<RoundTripTrade> result = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                ps.setDate(i + 1, Date.valueOf(params.get(i)));
            }

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to find round-trip trades: {}", e.getMessage());
            throw new RuntimeException("Failed to find round-trip trades", e);
        }

        return result;
    }

    static String joinIds(List<Long> ids) {
        return ids.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    static List<Long> splitIds(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(Long::valueOf)
            .toList();
    }

    private RoundTripTrade mapRow(ResultSet rs) throws SQLException {
        return new RoundTripTrade(
            rs.getLong("id"),
            rs.getString("symbol"),
            rs.getString("name"),
            Country.valueOf(rs.getString("country")),
            rs.getDate("entry_date").toLocalDate(),
            rs.getBigDecimal("avg_entry_price"),
            rs.getBigDecimal("total_quantity"),
            rs.getBigDecimal("total_entry_cost"),
            rs.getDate("exit_date").toLocalDate(),
            rs.getBigDecimal("avg_exit_price"),
            rs.getBigDecimal("total_exit_revenue"),
            rs.getBigDecimal("profit_loss"),
            rs.getBigDecimal("profit_loss_percent"),
            rs.getLong("holding_days"),
            splitIds(rs.getString("entry_execution_ids")),
            splitIds(rs.getString("exit_execution_ids"))
        );
    }
}
