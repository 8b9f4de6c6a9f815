package io.github.yok.spectramigrate.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Properties;
import org.sqlite.SQLiteConfig;

/**
 * SQLite implementation of {@link StoreDialect}.
 *
 * <p>
 * SQLite has no boolean, timestamp or array types: booleans are stored as {@code 0/1}, timestamps
 * as epoch seconds and numeric arrays as JSON text. Parameters need no casts because SQLite types
 * values, not columns.
 * </p>
 */
public class SqliteDialect extends AbstractStoreDialect {

    // SQLITE_MAX_VARIABLE_NUMBER of SQLite 3.32 and later
    private static final int MAX_BIND_PARAMETERS = 32_766;

    private final ObjectMapper objectMapper;

    /**
     * Creates the dialect with a default {@link ObjectMapper}.
     */
    public SqliteDialect() {
        this(new ObjectMapper());
    }

    /**
     * Creates the dialect.
     *
     * @param objectMapper mapper used to write numeric arrays as JSON text
     */
    public SqliteDialect(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "SQLite";
    }

    @Override
    public Properties connectionProperties(String user, String password, boolean readOnly) {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(readOnly);
        return config.toProperties();
    }

    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        connection.setAutoCommit(true);
    }

    @Override
    public boolean supportsSequences() {
        return false;
    }

    @Override
    public long resetSequence(Connection connection, String table, String keyColumn) {
        // INTEGER PRIMARY KEY follows MAX(rowid) on its own
        return -1L;
    }

    @Override
    public String getBooleanTrueLiteral() {
        return "1";
    }

    @Override
    public String getBooleanFalseLiteral() {
        return "0";
    }

    @Override
    public String parameterExpression(SqlType type) {
        return "?";
    }

    @Override
    public int getMaxBindParameters() {
        return MAX_BIND_PARAMETERS;
    }

    @Override
    protected void bindBoolean(PreparedStatement statement, int index, boolean value)
            throws SQLException {
        statement.setInt(index, value ? 1 : 0);
    }

    @Override
    protected void bindTimestamp(PreparedStatement statement, int index, Instant value)
            throws SQLException {
        statement.setLong(index, value.getEpochSecond());
    }

    @Override
    protected void bindDoubleArray(PreparedStatement statement, int index, Double[] values)
            throws SQLException {
        try {
            statement.setString(index, objectMapper.writeValueAsString(values));
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to serialize numeric array as JSON", e);
        }
    }
}
