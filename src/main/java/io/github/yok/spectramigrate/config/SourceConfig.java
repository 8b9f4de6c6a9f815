package io.github.yok.spectramigrate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code source} section in {@code application.yml}.
 *
 * <pre>
 * source:
 *   sqlite-path: ${SQLITE_DB:database-8765.sqlite}
 *   driver-class: org.sqlite.JDBC
 * </pre>
 *
 * <p>
 * The source store is a SQLite file that is opened read-only.
 * </p>
 */
@ConfigurationProperties(prefix = "source")
@Data
public class SourceConfig {

    /**
     * Path of the SQLite database file (environment variable {@code SQLITE_DB}).
     */
    private String sqlitePath = "database-8765.sqlite";

    /**
     * Fully qualified JDBC driver class name. Blank means JDBC 4 auto-loading.
     */
    private String driverClass = "org.sqlite.JDBC";

    /**
     * Returns the JDBC URL of the source file.
     *
     * @return {@code jdbc:sqlite:<path>}
     */
    public String getJdbcUrl() {
        return "jdbc:sqlite:" + sqlitePath;
    }
}
