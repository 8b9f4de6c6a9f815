package io.github.yok.spectramigrate.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Value binding operations for each store dialect.
 */
public interface StoreValueOperations {

    /**
     * Binds a (transformed) column value to a statement parameter.
     *
     * @param statement prepared statement
     * @param index 1-based parameter index
     * @param value value, may be {@code null}
     * @param type logical column type
     * @throws SQLException if binding fails or the value does not fit the type
     */
    void bindValue(PreparedStatement statement, int index, Object value, SqlType type)
            throws SQLException;
}
