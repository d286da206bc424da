package com.vexen.database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin JDBC helper used by the subsystem repositories.
 * <p>
 * Parameters are bound positionally with {@link PreparedStatement#setObject(int, Object)};
 * {@link Instant} values are bound as {@link Timestamp}. Every {@link SQLException} surfaces as a
 * {@link DataAccessException}. When echo is enabled each statement is logged at INFO on the
 * {@value #SQL_LOGGER} logger (parameter values are never logged).
 */
public final class JdbcSupport {

    /** Logger name used for SQL echo. */
    public static final String SQL_LOGGER = "vexen.sql";

    private static final Logger sqlLog = LoggerFactory.getLogger(SQL_LOGGER);

    /** Maps the current row of a result set. */
    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private final DataSource dataSource;
    private final Connection boundConnection;
    private final boolean echo;

    public JdbcSupport(DataSource dataSource, boolean echo) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        this.dataSource = dataSource;
        this.boundConnection = null;
        this.echo = echo;
    }

    private JdbcSupport(Connection connection, boolean echo) {
        this.dataSource = null;
        this.boundConnection = connection;
        this.echo = echo;
    }

    /**
     * Executes an INSERT, UPDATE or DELETE.
     *
     * @return number of affected rows
     */
    public int update(String sql, Object... params) {
        return execute(sql, connection -> {
            try (PreparedStatement ps = prepare(connection, sql, params)) {
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Runs a query and maps every row.
     */
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
        return execute(sql, connection -> {
            try (PreparedStatement ps = prepare(connection, sql, params);
                 ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        });
    }

    /**
     * Runs a query expected to return at most one row.
     *
     * @throws DataAccessException if more than one row is returned
     */
    public <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
        List<T> rows = query(sql, mapper, params);
        if (rows.size() > 1) {
            throw new DataAccessException("Expected at most one row but got " + rows.size() + ": " + sql, null);
        }
        return rows.stream().findFirst();
    }

    /**
     * Runs {@code work} on a single connection inside a transaction. The transaction commits when
     * {@code work} returns and rolls back when it throws. Nested calls join the outer transaction.
     */
    public <T> T inTransaction(Function<JdbcSupport, T> work) {
        if (boundConnection != null) {
            return work.apply(this);
        }
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                T result = work.apply(new JdbcSupport(connection, echo));
                connection.commit();
                return result;
            } catch (RuntimeException e) {
                rollback(connection, e);
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new DataAccessException("Transaction failed", e);
        }
    }

    /** Reads a nullable timestamp column as an {@link Instant}. */
    public static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    }

    @FunctionalInterface
    private interface ConnectionWork<T> {
        T run(Connection connection) throws SQLException;
    }

    private <T> T execute(String sql, ConnectionWork<T> work) {
        if (echo) {
            sqlLog.info(sql);
        }
        try {
            if (boundConnection != null) {
                return work.run(boundConnection);
            }
            try (Connection connection = dataSource.getConnection()) {
                return work.run(connection);
            }
        } catch (SQLException e) {
            throw new DataAccessException("SQL failed: " + sql, e);
        }
    }

    private static PreparedStatement prepare(Connection connection, String sql, Object... params) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(sql);
        try {
            for (int i = 0; i < params.length; i++) {
                Object param = params[i];
                if (param instanceof Instant instant) {
                    ps.setTimestamp(i + 1, Timestamp.from(instant));
                } else {
                    ps.setObject(i + 1, param);
                }
            }
            return ps;
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }

    private static void rollback(Connection connection, RuntimeException cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
