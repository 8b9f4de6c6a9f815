package io.github.yok.spectramigrate.db;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Locale;

/**
 * Base class for store dialects.
 *
 * <p>
 * Implements the type coercions both engines share (numbers stored as text, booleans stored as
 * integers, text stored as BLOB) and leaves the engine-specific representation of booleans,
 * timestamps and arrays to subclasses.
 * </p>
 */
public abstract class AbstractStoreDialect implements StoreDialect {

    @Override
    public String applyLimit(String baseSql, int limit) {
        return baseSql + " LIMIT " + limit;
    }

    @Override
    public void bindValue(PreparedStatement statement, int index, Object value, SqlType type)
            throws SQLException {
        if (value == null) {
            bindNull(statement, index, type);
            return;
        }
        switch (type) {
            case BIGINT:
                statement.setLong(index, toLong(value));
                break;
            case INTEGER:
                statement.setInt(index, toInt(value));
                break;
            case DOUBLE:
                statement.setDouble(index, toDouble(value));
                break;
            case BOOLEAN:
                bindBoolean(statement, index, toBoolean(value));
                break;
            case TEXT:
                statement.setString(index, toText(value));
                break;
            case BINARY:
                statement.setBytes(index, toBytes(value));
                break;
            case TIMESTAMP:
                bindTimestamp(statement, index, toInstant(value));
                break;
            case DOUBLE_ARRAY:
                bindDoubleArray(statement, index, toDoubleArray(value));
                break;
            default:
                throw new SQLException("Unsupported column type: " + type);
        }
    }

    /**
     * Binds SQL NULL for the given type.
     *
     * @param statement prepared statement
     * @param index parameter index
     * @param type logical column type
     * @throws SQLException if binding fails
     */
    protected void bindNull(PreparedStatement statement, int index, SqlType type)
            throws SQLException {
        statement.setNull(index, type.getJdbcType());
    }

    /**
     * Binds a boolean in the engine's representation.
     *
     * @param statement prepared statement
     * @param index parameter index
     * @param value value
     * @throws SQLException if binding fails
     */
    protected abstract void bindBoolean(PreparedStatement statement, int index, boolean value)
            throws SQLException;

    /**
     * Binds an instant in the engine's timestamp representation.
     *
     * @param statement prepared statement
     * @param index parameter index
     * @param value instant (UTC)
     * @throws SQLException if binding fails
     */
    protected abstract void bindTimestamp(PreparedStatement statement, int index, Instant value)
            throws SQLException;

    /**
     * Binds a numeric array in the engine's array representation.
     *
     * @param statement prepared statement
     * @param index parameter index
     * @param values array elements
     * @throws SQLException if binding fails
     */
    protected abstract void bindDoubleArray(PreparedStatement statement, int index,
            Double[] values) throws SQLException;

    static int toInt(Object value) throws SQLException {
        long number = toLong(value);
        if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            throw new SQLException("Integer value out of range: " + number);
        }
        return (int) number;
    }

    static long toLong(Object value) throws SQLException {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1L : 0L;
        }
        if (value instanceof String) {
            try {
                return new BigDecimal(((String) value).trim()).longValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new SQLException("Not an integer value: '" + value + "'", e);
            }
        }
        throw new SQLException("Cannot convert " + value.getClass().getName() + " to integer");
    }

    static double toDouble(Object value) throws SQLException {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new SQLException("Not a numeric value: '" + value + "'", e);
            }
        }
        throw new SQLException("Cannot convert " + value.getClass().getName() + " to double");
    }

    static boolean toBoolean(Object value) throws SQLException {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0d;
        }
        if (value instanceof String) {
            String text = ((String) value).trim().toLowerCase(Locale.ROOT);
            switch (text) {
                case "1":
                case "t":
                case "true":
                    return true;
                case "0":
                case "f":
                case "false":
                    return false;
                default:
                    throw new SQLException("Not a boolean value: '" + value + "'");
            }
        }
        throw new SQLException("Cannot convert " + value.getClass().getName() + " to boolean");
    }

    static String toText(Object value) {
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return value.toString();
    }

    static byte[] toBytes(Object value) throws SQLException {
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        if (value instanceof String) {
            return ((String) value).getBytes(StandardCharsets.UTF_8);
        }
        if (value instanceof Blob) {
            Blob blob = (Blob) value;
            long length = blob.length();
            if (length > Integer.MAX_VALUE) {
                throw new SQLException("BLOB too large to bind: " + length + " bytes");
            }
            return blob.getBytes(1, (int) length);
        }
        throw new SQLException("Cannot convert " + value.getClass().getName() + " to bytes");
    }

    static Instant toInstant(Object value) throws SQLException {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant();
        }
        throw new SQLException("Cannot convert " + value.getClass().getName() + " to timestamp");
    }

    static Double[] toDoubleArray(Object value) throws SQLException {
        if (value instanceof Double[]) {
            return (Double[]) value;
        }
        if (value instanceof double[]) {
            double[] primitive = (double[]) value;
            Double[] boxed = new Double[primitive.length];
            for (int i = 0; i < primitive.length; i++) {
                boxed[i] = primitive[i];
            }
            return boxed;
        }
        if (value instanceof Collection) {
            Collection<?> collection = (Collection<?>) value;
            Double[] boxed = new Double[collection.size()];
            int i = 0;
            for (Object element : collection) {
                boxed[i++] = element == null ? null : toDouble(element);
            }
            return boxed;
        }
        throw new SQLException(
                "Cannot convert " + value.getClass().getName() + " to a numeric array");
    }
}
