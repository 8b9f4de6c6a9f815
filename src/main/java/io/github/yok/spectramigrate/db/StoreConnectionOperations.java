package io.github.yok.spectramigrate.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Connection and session operations for each store dialect.
 */
public interface StoreConnectionOperations {

    /**
     * Builds the driver properties used to open a connection.
     *
     * @param user user name, may be {@code null}
     * @param password password, may be {@code null}
     * @param readOnly whether the connection must not write
     * @return driver properties
     */
    Properties connectionProperties(String user, String password, boolean readOnly);

    /**
     * Initializes a freshly opened connection (session settings, auto-commit).
     *
     * @param connection JDBC connection
     * @throws SQLException if initialization fails
     */
    void prepareConnection(Connection connection) throws SQLException;

    /**
     * Returns whether the store keeps id sequences that must follow explicit-id inserts.
     *
     * @return true when supported
     */
    boolean supportsSequences();

    /**
     * Moves the id sequence of the table to the current maximum key.
     *
     * @param connection JDBC connection
     * @param table table name
     * @param keyColumn key column backed by the sequence
     * @return new sequence value, or {@code -1} when the table has no sequence
     * @throws SQLException if the statement fails
     */
    long resetSequence(Connection connection, String table, String keyColumn)
            throws SQLException;
}
