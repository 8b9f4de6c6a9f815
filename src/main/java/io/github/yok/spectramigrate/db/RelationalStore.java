package io.github.yok.spectramigrate.db;

import com.google.common.base.Preconditions;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * One exclusively owned JDBC connection together with the dialect used to talk to it.
 *
 * <p>
 * Offers the few primitives the copier needs (counting, statement preparation and explicit
 * transaction control) and closes the connection on {@link #close()}.
 * </p>
 */
@Slf4j
public class RelationalStore implements AutoCloseable {

    // Role of the store in log messages ("source" / "target")
    @Getter
    private final String name;

    @Getter
    private final Connection connection;

    @Getter
    private final StoreDialect dialect;

    /**
     * Wraps an open connection.
     *
     * @param name role of the store in log messages
     * @param connection open JDBC connection (ownership is transferred)
     * @param dialect dialect of the connected engine
     */
    public RelationalStore(String name, Connection connection, StoreDialect dialect) {
        this.name = Preconditions.checkNotNull(name, "name must not be null");
        this.connection = Preconditions.checkNotNull(connection, "connection must not be null");
        this.dialect = Preconditions.checkNotNull(dialect, "dialect must not be null");
    }

    /**
     * Counts the rows of a table matching a simple predicate.
     *
     * @param table table name
     * @param predicate SQL predicate without {@code WHERE}; blank counts all rows
     * @return number of matching rows
     * @throws SQLException if the query fails
     */
    public long count(String table, String predicate) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + table;
        if (StringUtils.isNotBlank(predicate)) {
            sql += " WHERE " + predicate;
        }
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            long count = rs.next() ? rs.getLong(1) : 0L;
            log.debug("[{}] {} → {}", name, sql, count);
            return count;
        }
    }

    /**
     * Prepares a statement on this store's connection.
     *
     * @param sql SQL text
     * @return prepared statement (caller closes it)
     * @throws SQLException if preparation fails
     */
    public PreparedStatement prepare(String sql) throws SQLException {
        return connection.prepareStatement(sql);
    }

    /**
     * Starts an explicit transaction.
     *
     * @throws SQLException if auto-commit cannot be switched off
     */
    public void begin() throws SQLException {
        connection.setAutoCommit(false);
    }

    /**
     * Commits the current transaction.
     *
     * @throws SQLException if the commit fails
     */
    public void commit() throws SQLException {
        connection.commit();
    }

    /**
     * Rolls back the current transaction after {@code cause} aborted it and returns to auto-commit
     * mode. A failing rollback is attached to {@code cause} as a suppressed exception.
     *
     * @param cause failure that aborted the transaction
     */
    public void rollback(Exception cause) {
        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
                log.warn("[{}] Transaction rolled back", name);
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Returns to auto-commit mode.
     *
     * @throws SQLException if auto-commit cannot be restored
     */
    public void end() throws SQLException {
        connection.setAutoCommit(true);
    }

    /**
     * Closes the connection. A failing close is logged; it never masks the run's own outcome.
     */
    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[{}] Failed to close connection: {}", name, e.getMessage(), e);
        }
    }
}
