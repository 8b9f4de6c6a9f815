package io.github.yok.spectramigrate.db;

import io.github.yok.spectramigrate.config.SourceConfig;
import io.github.yok.spectramigrate.config.TargetConfig;
import io.github.yok.spectramigrate.core.MigrationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Opens the source and target stores.
 *
 * <p>
 * Failures are reported as {@link MigrationException} with the kind the entry point needs to end
 * the run before any data is read:
 * </p>
 * <ul>
 * <li>{@link MigrationException.Kind#SOURCE_NOT_FOUND}: the SQLite file does not exist (checked
 * before any connection attempt)</li>
 * <li>{@link MigrationException.Kind#SOURCE_CONNECTION}: the file exists but cannot be opened</li>
 * <li>{@link MigrationException.Kind#TARGET_CONNECTION}: PostgreSQL is unreachable or rejects the
 * credentials</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreConnector {

    private final StoreDialectFactory dialectFactory;

    /**
     * Checks that the SQLite file exists and opens it read-only.
     *
     * @param config source settings
     * @return source store
     * @throws MigrationException if the file is missing or cannot be opened
     */
    public RelationalStore openSource(SourceConfig config) {
        Path path = Paths.get(config.getSqlitePath());
        if (!Files.isRegularFile(path)) {
            throw new MigrationException(MigrationException.Kind.SOURCE_NOT_FOUND,
                    "SQLite database not found: " + path.toAbsolutePath());
        }
        log.info("Connecting to SQLite: {}", path.toAbsolutePath());
        try {
            return open("source", config.getDriverClass(), config.getJdbcUrl(), null, null, true);
        } catch (ClassNotFoundException | SQLException e) {
            throw new MigrationException(MigrationException.Kind.SOURCE_CONNECTION,
                    "Cannot open SQLite database: " + path.toAbsolutePath(), e);
        }
    }

    /**
     * Opens the PostgreSQL target for writing.
     *
     * @param config target settings
     * @param password password to use (the configured one or the prompted one)
     * @return target store
     * @throws MigrationException if the connection fails
     */
    public RelationalStore openTarget(TargetConfig config, String password) {
        log.info("Connecting to PostgreSQL: {}:{}/{} as {}", config.getHost(), config.getPort(),
                config.getDatabase(), config.getUser());
        try {
            RelationalStore store = open("target", config.getDriverClass(), config.getJdbcUrl(),
                    config.getUser(), password, false);
            log.info("PostgreSQL connection successful");
            return store;
        } catch (ClassNotFoundException | SQLException e) {
            throw new MigrationException(MigrationException.Kind.TARGET_CONNECTION,
                    "Cannot connect to PostgreSQL at " + config.getHost() + ":" + config.getPort()
                            + "/" + config.getDatabase(),
                    e);
        }
    }

    private RelationalStore open(String name, String driverClass, String url, String user,
            String password, boolean readOnly) throws ClassNotFoundException, SQLException {
        // Blank driver class means JDBC 4 auto-loading
        if (StringUtils.isNotBlank(driverClass)) {
            Class.forName(driverClass);
        }
        StoreDialect dialect = dialectFactory.forUrl(url);
        Connection connection = DriverManager.getConnection(url,
                dialect.connectionProperties(user, password, readOnly));
        try {
            dialect.prepareConnection(connection);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return new RelationalStore(name, connection, dialect);
    }
}
