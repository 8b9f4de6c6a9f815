package io.github.yok.spectramigrate.db;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * PostgreSQL implementation of {@link StoreDialect}.
 *
 * <p>
 * Parameters are wrapped in {@code CAST(? AS ...)} so that rows inside a {@code VALUES} list are
 * typed even when a value is {@code NULL}. Numeric arrays are bound as native {@code float8[]}
 * and timestamps as {@link OffsetDateTime} in UTC.
 * </p>
 */
@Slf4j
public class PostgresqlDialect extends AbstractStoreDialect {

    // Half of the protocol limit (65535) keeps statements well below it
    private static final int MAX_BIND_PARAMETERS = 32_767;

    @Override
    public String getName() {
        return "PostgreSQL";
    }

    @Override
    public Properties connectionProperties(String user, String password, boolean readOnly) {
        Properties props = new Properties();
        if (user != null) {
            props.setProperty("user", user);
        }
        if (password != null) {
            props.setProperty("password", password);
        }
        props.setProperty("ApplicationName", "spectramigrate");
        if (readOnly) {
            props.setProperty("readOnly", "true");
        }
        return props;
    }

    @Override
    public void prepareConnection(Connection connection) throws SQLException {
        connection.setAutoCommit(true);
        try (Statement st = connection.createStatement()) {
            st.execute("SET TIME ZONE 'UTC'");
        }
    }

    @Override
    public boolean supportsSequences() {
        return true;
    }

    @Override
    public long resetSequence(Connection connection, String table, String keyColumn)
            throws SQLException {
        String sql = "SELECT setval(pg_get_serial_sequence(?, ?), (SELECT COALESCE(MAX("
                + keyColumn + "), 1) FROM " + table + "))";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, table);
            ps.setString(2, keyColumn);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long value = rs.getLong(1);
                    if (!rs.wasNull()) {
                        return value;
                    }
                }
            }
        }
        log.debug("No serial sequence behind {}.{}", table, keyColumn);
        return -1L;
    }

    @Override
    public String getBooleanTrueLiteral() {
        return "TRUE";
    }

    @Override
    public String getBooleanFalseLiteral() {
        return "FALSE";
    }

    @Override
    public String parameterExpression(SqlType type) {
        switch (type) {
            case BIGINT:
                return "CAST(? AS BIGINT)";
            case INTEGER:
                return "CAST(? AS INTEGER)";
            case DOUBLE:
                return "CAST(? AS DOUBLE PRECISION)";
            case BOOLEAN:
                return "CAST(? AS BOOLEAN)";
            case TEXT:
                return "CAST(? AS TEXT)";
            case BINARY:
                return "CAST(? AS BYTEA)";
            case TIMESTAMP:
                return "CAST(? AS TIMESTAMPTZ)";
            case DOUBLE_ARRAY:
                return "CAST(? AS DOUBLE PRECISION[])";
            default:
                throw new IllegalArgumentException("Unsupported column type: " + type);
        }
    }

    @Override
    public int getMaxBindParameters() {
        return MAX_BIND_PARAMETERS;
    }

    @Override
    protected void bindBoolean(PreparedStatement statement, int index, boolean value)
            throws SQLException {
        statement.setBoolean(index, value);
    }

    @Override
    protected void bindTimestamp(PreparedStatement statement, int index, Instant value)
            throws SQLException {
        statement.setObject(index, OffsetDateTime.ofInstant(value, ZoneOffset.UTC));
    }

    @Override
    protected void bindDoubleArray(PreparedStatement statement, int index, Double[] values)
            throws SQLException {
        Array array = statement.getConnection().createArrayOf("float8", values);
        statement.setArray(index, array);
    }
}
